/*
 * WriteStreamRegistry.java
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

import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import org.docstore.logging.KeyValueLogMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Write streams that can still be resumed, by stream id. A stream stays registered after its
 * connection breaks, until the client resumes and completes it or it has been detached for longer
 * than the idle limit passed to {@link #expireIdle(Duration)}.
 */
public class WriteStreamRegistry {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(WriteStreamRegistry.class);

    @Nonnull
    private final Map<String, WriteStreamState> streams = new ConcurrentHashMap<>();
    @Nonnull
    private final Clock clock;

    public WriteStreamRegistry(@Nonnull Clock clock) {
        this.clock = clock;
    }

    public WriteStreamRegistry() {
        this(Clock.systemUTC());
    }

    @Nonnull
    WriteStreamState create() {
        WriteStreamState state = new WriteStreamState(UUID.randomUUID().toString());
        state.touch(clock.millis(), true);
        streams.put(state.getStreamId(), state);
        return state;
    }

    void attach(@Nonnull WriteStreamState state) {
        state.touch(clock.millis(), true);
    }

    void detach(@Nonnull WriteStreamState state) {
        state.touch(clock.millis(), false);
    }

    /**
     * Forget streams whose connection has been gone for longer than {@code idle}.
     *
     * @param idle how long a detached stream stays resumable
     * @return the number of streams forgotten
     */
    public int expireIdle(@Nonnull Duration idle) {
        long cutoff = clock.millis() - idle.toMillis();
        int expired = 0;
        for (Iterator<WriteStreamState> iter = streams.values().iterator(); iter.hasNext(); ) {
            WriteStreamState state = iter.next();
            if (state.isIdleSince(cutoff)) {
                iter.remove();
                expired++;
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("expired idle write stream",
                            LogMessageKeys.STREAM_ID, state.getStreamId()));
                }
            }
        }
        return expired;
    }

    @Nonnull
    WriteStreamState get(@Nonnull String streamId) {
        WriteStreamState state = streams.get(streamId);
        if (state == null) {
            throw new DocumentStoreExceptions.NotFoundException("unknown write stream",
                    LogMessageKeys.STREAM_ID, streamId);
        }
        return state;
    }

    void remove(@Nonnull String streamId) {
        streams.remove(streamId);
    }

    public boolean contains(@Nonnull String streamId) {
        return streams.containsKey(streamId);
    }

    public int size() {
        return streams.size();
    }
}
