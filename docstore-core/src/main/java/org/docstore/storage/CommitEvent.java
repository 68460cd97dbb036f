/*
 * CommitEvent.java
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

package org.docstore.storage;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Notification of one published commit, delivered to every {@link CommitListener} in commit order.
 */
public final class CommitEvent {
    @Nonnull
    private final Timestamp commitTime;
    @Nonnull
    private final ImmutableList<DocumentMutation> mutations;

    public CommitEvent(@Nonnull Timestamp commitTime, @Nonnull List<DocumentMutation> mutations) {
        this.commitTime = commitTime;
        this.mutations = ImmutableList.copyOf(mutations);
    }

    @Nonnull
    public Timestamp getCommitTime() {
        return commitTime;
    }

    @Nonnull
    public List<DocumentMutation> getMutations() {
        return mutations;
    }

    @Override
    public String toString() {
        return "CommitEvent{" + Timestamps.toString(commitTime) + ", " + mutations + "}";
    }
}
