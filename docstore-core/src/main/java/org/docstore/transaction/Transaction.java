/*
 * Transaction.java
 *
 * This source file is part of the Docstore open source project
 *
 * Copyright 2024-2026 the Docstore project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.docstore.transaction;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.FieldTransform;
import org.docstore.model.Precondition;
import org.docstore.model.Write;
import org.docstore.query.StructuredQuery;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Handle passed to a transaction's update function. Reads go to the backend immediately and
 * see the transaction's snapshot; writes are buffered and sent with the commit. All reads must
 * come before the first write.
 */
public class Transaction {
    @Nonnull
    private final TransactionBackend backend;
    @Nonnull
    private final ByteString token;
    @Nonnull
    private final List<Write> writes = new ArrayList<>();

    Transaction(@Nonnull TransactionBackend backend, @Nonnull ByteString token) {
        this.backend = backend;
        this.token = token;
    }

    @Nonnull
    public ByteString getToken() {
        return token;
    }

    @Nullable
    public Document get(@Nonnull String name) {
        checkNoWrites();
        return backend.getDocument(name, token);
    }

    @Nonnull
    public List<Document> get(@Nonnull String... names) {
        checkNoWrites();
        List<Document> documents = new ArrayList<>(names.length);
        for (String name : names) {
            documents.add(backend.getDocument(name, token));
        }
        return documents;
    }

    @Nonnull
    public List<Document> query(@Nonnull String parent, @Nonnull StructuredQuery query) {
        checkNoWrites();
        return backend.runQuery(parent, query, token);
    }

    /**
     * Create a document, failing the commit if it already exists.
     *
     * @param document the new document
     * @return this transaction
     */
    @Nonnull
    public Transaction create(@Nonnull Document document) {
        return write(Write.update(document).withPrecondition(Precondition.exists(false)));
    }

    @Nonnull
    public Transaction set(@Nonnull Document document) {
        return write(Write.update(document));
    }

    @Nonnull
    public Transaction set(@Nonnull Document document, @Nonnull DocumentMask mergeFields) {
        return write(Write.update(document, mergeFields));
    }

    /**
     * Update the masked fields of an existing document, failing the commit if it does not exist.
     *
     * @param document the new field values
     * @param updateMask the fields to change
     * @param transforms transforms to apply after the update
     * @return this transaction
     */
    @Nonnull
    public Transaction update(@Nonnull Document document, @Nonnull DocumentMask updateMask,
                              @Nonnull FieldTransform... transforms) {
        return write(Write.update(document, updateMask)
                .withUpdateTransforms(transforms)
                .withPrecondition(Precondition.exists(true)));
    }

    @Nonnull
    public Transaction delete(@Nonnull String name) {
        return write(Write.delete(name));
    }

    @Nonnull
    public Transaction delete(@Nonnull String name, @Nonnull Precondition precondition) {
        return write(Write.delete(name).withPrecondition(precondition));
    }

    @Nonnull
    public Transaction write(@Nonnull Write write) {
        writes.add(write);
        return this;
    }

    @Nonnull
    public List<Write> getWrites() {
        return ImmutableList.copyOf(writes);
    }

    private void checkNoWrites() {
        if (!writes.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException(
                    "transactions require all reads to be executed before all writes",
                    LogMessageKeys.TRANSACTION_ID, TransactionRecord.tokenString(token),
                    LogMessageKeys.WRITE_COUNT, writes.size());
        }
    }
}
