/*
 * TransactionBackend.java
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

import com.google.protobuf.ByteString;
import org.docstore.model.Document;
import org.docstore.model.Write;
import org.docstore.query.StructuredQuery;
import org.docstore.write.CommitResponse;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * The calls a {@link Transaction} makes. Implemented by the document service.
 */
public interface TransactionBackend {

    @Nonnull
    ByteString beginTransaction(@Nonnull TransactionOptions options);

    /**
     * Read one document inside a transaction.
     *
     * @param name full document name
     * @param transaction the transaction token
     * @return the document, or {@code null} if it does not exist
     */
    @Nullable
    Document getDocument(@Nonnull String name, @Nonnull ByteString transaction);

    @Nonnull
    List<Document> runQuery(@Nonnull String parent, @Nonnull StructuredQuery query, @Nonnull ByteString transaction);

    @Nonnull
    CommitResponse commit(@Nonnull ByteString transaction, @Nonnull List<Write> writes);

    void rollback(@Nonnull ByteString transaction);
}
