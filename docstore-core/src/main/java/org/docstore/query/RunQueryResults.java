/*
 * RunQueryResults.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A query's response stream folded into one result: the documents in order, the total number
 * of skipped documents, the latest read time and the transaction token, if one was begun.
 */
public final class RunQueryResults {
    @Nonnull
    private final ImmutableList<Document> documents;
    private final int skippedResults;
    @Nullable
    private final Timestamp readTime;
    @Nullable
    private final ByteString transaction;

    private RunQueryResults(@Nonnull ImmutableList<Document> documents, int skippedResults,
                            @Nullable Timestamp readTime, @Nullable ByteString transaction) {
        this.documents = documents;
        this.skippedResults = skippedResults;
        this.readTime = readTime;
        this.transaction = transaction;
    }

    /**
     * Merge interleaved document and progress messages.
     *
     * @param responses the stream, in order
     * @return the combined result
     */
    @Nonnull
    public static RunQueryResults merge(@Nonnull List<RunQueryResponse> responses) {
        ImmutableList.Builder<Document> documents = ImmutableList.builder();
        int skipped = 0;
        Timestamp readTime = null;
        ByteString transaction = null;
        for (RunQueryResponse response : responses) {
            if (response.getDocument() != null) {
                documents.add(response.getDocument());
            }
            skipped += response.getSkippedResults();
            if (readTime == null || Timestamps.compare(response.getReadTime(), readTime) > 0) {
                readTime = response.getReadTime();
            }
            if (transaction == null && response.getTransaction() != null) {
                transaction = response.getTransaction();
            }
        }
        return new RunQueryResults(documents.build(), skipped, readTime, transaction);
    }

    @Nonnull
    public List<Document> getDocuments() {
        return documents;
    }

    public int getSkippedResults() {
        return skippedResults;
    }

    @Nullable
    public Timestamp getReadTime() {
        return readTime;
    }

    @Nullable
    public ByteString getTransaction() {
        return transaction;
    }
}
