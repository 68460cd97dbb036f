/*
 * TargetChange.java
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

package org.docstore.listen;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.grpc.Status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A change in the state of one or more targets. Empty target ids mean every target on the stream.
 */
public final class TargetChange {

    /**
     * Kind of target change.
     */
    public enum Type {
        /** Nothing changed; carries a new read time and resume token. */
        NO_CHANGE,
        ADD,
        /** The target is gone; a cause is present when the server dropped it. */
        REMOVE,
        /** Every change up to the read time of this or a later message has been sent. */
        CURRENT,
        /** The client must discard what it has for the targets. */
        RESET
    }

    @Nonnull
    private final Type type;
    @Nonnull
    private final ImmutableList<Integer> targetIds;
    @Nullable
    private final Status cause;
    @Nonnull
    private final ByteString resumeToken;
    @Nullable
    private final Timestamp readTime;

    public TargetChange(@Nonnull Type type, @Nonnull List<Integer> targetIds, @Nullable Status cause,
                        @Nonnull ByteString resumeToken, @Nullable Timestamp readTime) {
        if (cause != null && type != Type.REMOVE) {
            throw new IllegalArgumentException("only REMOVE carries a cause");
        }
        this.type = type;
        this.targetIds = ImmutableList.copyOf(targetIds);
        this.cause = cause;
        this.resumeToken = resumeToken;
        this.readTime = readTime;
    }

    @Nonnull
    public static TargetChange of(@Nonnull Type type, int... targetIds) {
        ImmutableList.Builder<Integer> ids = ImmutableList.builder();
        for (int targetId : targetIds) {
            ids.add(targetId);
        }
        return new TargetChange(type, ids.build(), null, ByteString.EMPTY, null);
    }

    @Nonnull
    public static TargetChange removed(int targetId, @Nonnull Status cause) {
        return new TargetChange(Type.REMOVE, ImmutableList.of(targetId), cause, ByteString.EMPTY, null);
    }

    @Nonnull
    public static TargetChange noChange(@Nonnull ByteString resumeToken, @Nonnull Timestamp readTime) {
        return new TargetChange(Type.NO_CHANGE, ImmutableList.of(), null, resumeToken, readTime);
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    @Nonnull
    public List<Integer> getTargetIds() {
        return targetIds;
    }

    @Nullable
    public Status getCause() {
        return cause;
    }

    /**
     * Resume token for the targets, empty if none.
     *
     * @return the resume token
     */
    @Nonnull
    public ByteString getResumeToken() {
        return resumeToken;
    }

    @Nullable
    public Timestamp getReadTime() {
        return readTime;
    }

    @Override
    public String toString() {
        return "TargetChange{" + type + ", " + targetIds
                + (cause == null ? "" : ", cause=" + cause.getCode())
                + (readTime == null ? "" : ", readTime=" + readTime.getSeconds() + "." + readTime.getNanos()) + "}";
    }
}
