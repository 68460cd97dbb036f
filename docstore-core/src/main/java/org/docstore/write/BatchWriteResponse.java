/*
 * BatchWriteResponse.java
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

package org.docstore.write;

import com.google.common.collect.ImmutableList;
import io.grpc.Status;
import org.docstore.model.WriteResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Outcome of a non-atomic batch: for each write, its status and, if it succeeded, its result.
 */
public final class BatchWriteResponse {
    @Nonnull
    private final ImmutableList<WriteResult> writeResults;
    @Nonnull
    private final ImmutableList<Status> statuses;

    public BatchWriteResponse(@Nonnull List<WriteResult> writeResults, @Nonnull List<Status> statuses) {
        if (writeResults.size() != statuses.size()) {
            throw new IllegalArgumentException("one result and one status per write");
        }
        this.writeResults = ImmutableList.copyOf(writeResults);
        this.statuses = ImmutableList.copyOf(statuses);
    }

    /**
     * Results by write index; a failed write has an empty result.
     *
     * @return the write results
     */
    @Nonnull
    public List<WriteResult> getWriteResults() {
        return writeResults;
    }

    @Nonnull
    public List<Status> getStatuses() {
        return statuses;
    }

    @Nullable
    public WriteResult getWriteResult(int index) {
        return statuses.get(index).isOk() ? writeResults.get(index) : null;
    }

    @Nonnull
    public Status getStatus(int index) {
        return statuses.get(index);
    }

    @Override
    public String toString() {
        return "BatchWriteResponse{statuses=" + statuses + "}";
    }
}
