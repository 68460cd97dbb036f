/*
 * CommitResponse.java
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
import com.google.protobuf.Timestamp;
import org.docstore.model.WriteResult;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Result of a successful commit: its time and one result per write, in order.
 */
public final class CommitResponse {
    @Nonnull
    private final Timestamp commitTime;
    @Nonnull
    private final ImmutableList<WriteResult> writeResults;

    public CommitResponse(@Nonnull Timestamp commitTime, @Nonnull List<WriteResult> writeResults) {
        this.commitTime = commitTime;
        this.writeResults = ImmutableList.copyOf(writeResults);
    }

    @Nonnull
    public Timestamp getCommitTime() {
        return commitTime;
    }

    @Nonnull
    public List<WriteResult> getWriteResults() {
        return writeResults;
    }

    @Override
    public String toString() {
        return "CommitResponse{commitTime=" + commitTime.getSeconds() + "." + commitTime.getNanos()
                + ", writeResults=" + writeResults.size() + "}";
    }
}
