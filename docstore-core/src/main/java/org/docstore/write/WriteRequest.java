/*
 * WriteRequest.java
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
import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import org.docstore.model.Write;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * One message from the client on a write stream.
 *
 * <p>
 * The first message of a stream is a handshake without writes; it names a {@code streamId}
 * and {@code streamToken} only when resuming an earlier stream. Every later message carries
 * the token of the newest response the client has received, acknowledging it and all earlier
 * ones, and an ordered batch of writes to commit atomically. A later message without writes is
 * a pure acknowledgement.
 * </p>
 */
public final class WriteRequest {
    @Nullable
    private final String streamId;
    @Nullable
    private final ByteString streamToken;
    @Nonnull
    private final ImmutableList<Write> writes;

    private WriteRequest(@Nullable String streamId, @Nullable ByteString streamToken, @Nonnull List<Write> writes) {
        this.streamId = streamId;
        this.streamToken = streamToken;
        this.writes = ImmutableList.copyOf(writes);
    }

    @Nonnull
    public static WriteRequest handshake() {
        return new WriteRequest(null, null, ImmutableList.of());
    }

    @Nonnull
    public static WriteRequest resume(@Nonnull String streamId, @Nonnull ByteString streamToken) {
        return new WriteRequest(streamId, streamToken, ImmutableList.of());
    }

    @Nonnull
    public static WriteRequest writes(@Nonnull ByteString streamToken, @Nonnull List<Write> writes) {
        return new WriteRequest(null, streamToken, writes);
    }

    @Nonnull
    public static WriteRequest acknowledge(@Nonnull ByteString streamToken) {
        return new WriteRequest(null, streamToken, ImmutableList.of());
    }

    /**
     * A request with every field given explicitly, including ones the protocol rejects.
     *
     * @param streamId stream to address, if any
     * @param streamToken token being acknowledged, if any
     * @param writes writes to commit
     * @return the request
     */
    @Nonnull
    public static WriteRequest of(@Nullable String streamId, @Nullable ByteString streamToken,
                                  @Nonnull List<Write> writes) {
        return new WriteRequest(streamId, streamToken, writes);
    }

    @Nullable
    public String getStreamId() {
        return streamId;
    }

    @Nullable
    public ByteString getStreamToken() {
        return streamToken;
    }

    @Nonnull
    public List<Write> getWrites() {
        return writes;
    }

    @Override
    public String toString() {
        return "WriteRequest{streamId=" + streamId
                + ", token=" + (streamToken == null ? null : BaseEncoding.base16().encode(streamToken.toByteArray()))
                + ", writes=" + writes.size() + "}";
    }
}
