/*
 * WriteResponse.java
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
import com.google.protobuf.Timestamp;
import org.docstore.model.WriteResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * One message from the server on a write stream: the handshake reply, or the outcome of one
 * committed write request.
 */
public final class WriteResponse {
    @Nonnull
    private final String streamId;
    @Nonnull
    private final ByteString streamToken;
    @Nonnull
    private final ImmutableList<WriteResult> writeResults;
    @Nullable
    private final Timestamp commitTime;

    public WriteResponse(@Nonnull String streamId, @Nonnull ByteString streamToken,
                         @Nonnull List<WriteResult> writeResults, @Nullable Timestamp commitTime) {
        this.streamId = streamId;
        this.streamToken = streamToken;
        this.writeResults = ImmutableList.copyOf(writeResults);
        this.commitTime = commitTime;
    }

    @Nonnull
    public String getStreamId() {
        return streamId;
    }

    @Nonnull
    public ByteString getStreamToken() {
        return streamToken;
    }

    long getPosition() {
        return StreamTokens.decode(streamToken);
    }

    @Nonnull
    public List<WriteResult> getWriteResults() {
        return writeResults;
    }

    /**
     * Commit time of the writes this response answers.
     *
     * @return the commit time, or {@code null} for a handshake reply
     */
    @Nullable
    public Timestamp getCommitTime() {
        return commitTime;
    }

    @Override
    public String toString() {
        return "WriteResponse{streamId=" + streamId + ", token=" + BaseEncoding.base16().encode(streamToken.toByteArray())
                + ", writeResults=" + writeResults.size() + "}";
    }
}
