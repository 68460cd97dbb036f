/*
 * ResumeTokens.java
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

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Listen resume tokens. A token is the serialized read time it was issued at; clients must treat
 * it as opaque.
 */
public final class ResumeTokens {
    private ResumeTokens() {
    }

    @Nonnull
    public static ByteString fromReadTime(@Nonnull Timestamp readTime) {
        return readTime.toByteString();
    }

    /**
     * Read time a token was issued at.
     *
     * @param resumeToken the token
     * @return its read time
     * @throws DocumentStoreExceptions.InvalidArgumentException if the token was not issued by a listen stream
     */
    @Nonnull
    public static Timestamp toReadTime(@Nonnull ByteString resumeToken) {
        try {
            Timestamp readTime = Timestamp.parseFrom(resumeToken);
            if (resumeToken.isEmpty() || !Timestamps.isValid(readTime)) {
                throw new DocumentStoreExceptions.InvalidArgumentException("invalid resume token",
                        LogMessageKeys.RESUME_TOKEN, resumeToken.size());
            }
            return readTime;
        } catch (InvalidProtocolBufferException e) {
            DocumentStoreExceptions.InvalidArgumentException invalid =
                    new DocumentStoreExceptions.InvalidArgumentException("invalid resume token", e);
            invalid.addLogInfo(LogMessageKeys.RESUME_TOKEN.toString(), resumeToken.size());
            throw invalid;
        }
    }
}
