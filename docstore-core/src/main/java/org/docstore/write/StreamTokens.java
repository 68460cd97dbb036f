/*
 * StreamTokens.java
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

import com.google.common.primitives.Longs;
import com.google.protobuf.ByteString;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Write stream tokens: the position of a response within its stream, as an 8-byte big-endian counter.
 * The handshake response carries position 0.
 */
final class StreamTokens {
    private StreamTokens() {
    }

    @Nonnull
    static ByteString encode(long position) {
        return ByteString.copyFrom(Longs.toByteArray(position));
    }

    /**
     * Decode a token.
     *
     * @param token the token
     * @return its position
     * @throws DocumentStoreExceptions.InvalidArgumentException if the token is malformed
     */
    static long decode(@Nonnull ByteString token) {
        if (token.size() != Long.BYTES) {
            throw new DocumentStoreExceptions.InvalidArgumentException("malformed stream token",
                    LogMessageKeys.STREAM_TOKEN, token.size());
        }
        long position = Longs.fromByteArray(token.toByteArray());
        if (position < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("malformed stream token",
                    LogMessageKeys.STREAM_TOKEN, position);
        }
        return position;
    }
}
