/*
 * BatchGetDocumentsResponse.java
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

package org.docstore.service;

import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One result of {@link DocumentService#batchGetDocuments}: either a found document or the name of
 * a missing one. The first response also carries the transaction the request began, if any.
 */
public final class BatchGetDocumentsResponse {
    @Nullable
    private final Document found;
    @Nullable
    private final String missing;
    @Nullable
    private final ByteString transaction;
    @Nonnull
    private final Timestamp readTime;

    private BatchGetDocumentsResponse(@Nullable Document found, @Nullable String missing,
                                      @Nullable ByteString transaction, @Nonnull Timestamp readTime) {
        this.found = found;
        this.missing = missing;
        this.transaction = transaction;
        this.readTime = readTime;
    }

    @Nonnull
    static BatchGetDocumentsResponse found(@Nonnull Document document, @Nullable ByteString transaction,
                                           @Nonnull Timestamp readTime) {
        return new BatchGetDocumentsResponse(document, null, transaction, readTime);
    }

    @Nonnull
    static BatchGetDocumentsResponse missing(@Nonnull String name, @Nullable ByteString transaction,
                                             @Nonnull Timestamp readTime) {
        return new BatchGetDocumentsResponse(null, name, transaction, readTime);
    }

    public boolean isFound() {
        return found != null;
    }

    @Nullable
    public Document getFound() {
        return found;
    }

    @Nullable
    public String getMissing() {
        return missing;
    }

    @Nullable
    public ByteString getTransaction() {
        return transaction;
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    @Override
    public String toString() {
        return "BatchGetDocumentsResponse{" + (found != null ? "found=" + found.getName() : "missing=" + missing)
               + ", readTime=" + Timestamps.toString(readTime) + "}";
    }
}
