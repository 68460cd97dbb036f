/*
 * WriteStreamState.java
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
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.WriteResult;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Server-side state of one write stream, kept across reconnects: the responses issued and not
 * yet acknowledged, in order.
 */
final class WriteStreamState {
    @Nonnull
    private final String streamId;
    private long lastIssued;
    private long lastAcknowledged;
    @Nonnull
    private final Deque<WriteResponse> unacknowledged = new ArrayDeque<>();
    private volatile long lastActiveMillis;
    private volatile boolean attached;

    WriteStreamState(@Nonnull String streamId) {
        this.streamId = streamId;
    }

    @Nonnull
    String getStreamId() {
        return streamId;
    }

    void touch(long nowMillis, boolean connected) {
        lastActiveMillis = nowMillis;
        attached = connected;
    }

    boolean isIdleSince(long cutoffMillis) {
        return !attached && lastActiveMillis < cutoffMillis;
    }

    /**
     * The handshake reply; it carries the newest position issued on this stream.
     */
    @Nonnull
    synchronized WriteResponse handshake() {
        return new WriteResponse(streamId, StreamTokens.encode(lastIssued), ImmutableList.of(), null);
    }

    @Nonnull
    synchronized WriteResponse issue(@Nonnull List<WriteResult> writeResults, @Nonnull Timestamp commitTime) {
        lastIssued++;
        WriteResponse response = new WriteResponse(streamId, StreamTokens.encode(lastIssued), writeResults, commitTime);
        unacknowledged.addLast(response);
        return response;
    }

    /**
     * Acknowledge every response up to and including {@code position}.
     *
     * @param position position of the newest response the client has seen
     * @throws DocumentStoreExceptions.InvalidArgumentException if the position was never issued or
     * is older than what was already acknowledged
     */
    synchronized void acknowledge(long position) {
        if (position > lastIssued || position < lastAcknowledged) {
            throw new DocumentStoreExceptions.InvalidArgumentException("stream token out of range",
                    LogMessageKeys.STREAM_ID, streamId,
                    LogMessageKeys.STREAM_TOKEN, position,
                    LogMessageKeys.EXPECTED, lastAcknowledged + ".." + lastIssued);
        }
        while (!unacknowledged.isEmpty() && unacknowledged.peekFirst().getPosition() <= position) {
            unacknowledged.removeFirst();
        }
        lastAcknowledged = position;
    }

    @Nonnull
    synchronized List<WriteResponse> getUnacknowledged() {
        return ImmutableList.copyOf(unacknowledged);
    }

    synchronized int getUnacknowledgedCount() {
        return unacknowledged.size();
    }
}
