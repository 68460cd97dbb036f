/*
 * RunQueryResponse.java
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

package org.docstore.query;

import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One message of a query's response stream. It carries either a document or only progress
 * information (the read time and how many documents were skipped since the previous message).
 * The first message also carries the token of a transaction begun by the query.
 */
public final class RunQueryResponse {
    @Nullable
    private final ByteString transaction;
    @Nullable
    private final Document document;
    @Nonnull
    private final Timestamp readTime;
    private final int skippedResults;

    public RunQueryResponse(@Nullable ByteString transaction, @Nullable Document document,
                            @Nonnull Timestamp readTime, int skippedResults) {
        this.transaction = transaction;
        this.document = document;
        this.readTime = readTime;
        this.skippedResults = skippedResults;
    }

    @Nullable
    public ByteString getTransaction() {
        return transaction;
    }

    @Nullable
    public Document getDocument() {
        return document;
    }

    public boolean hasDocument() {
        return document != null;
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    public int getSkippedResults() {
        return skippedResults;
    }

    @Override
    public String toString() {
        return "RunQueryResponse{"
                + (document == null ? "progress" : document.getName())
                + ", readTime=" + Timestamps.toString(readTime)
                + (skippedResults == 0 ? "" : ", skipped=" + skippedResults)
                + (transaction == null ? "" : ", transaction")
                + "}";
    }
}
