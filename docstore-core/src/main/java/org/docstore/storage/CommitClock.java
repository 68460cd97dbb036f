/*
 * CommitClock.java
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

import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Instant;

/**
 * Hands out read and commit times with microsecond precision. Every commit time is strictly
 * greater than every time handed out before it, so a snapshot read at a returned read time can
 * never be changed by a later commit. Read times never go backwards.
 */
class CommitClock {
    @Nonnull
    private final Clock clock;
    private long lastCommitMicros;
    private long lastReadMicros;

    CommitClock(@Nonnull Clock clock) {
        this.clock = clock;
    }

    @Nonnull
    synchronized Timestamp readTime() {
        long micros = Math.max(nowMicros(), Math.max(lastCommitMicros, lastReadMicros));
        lastReadMicros = micros;
        return Timestamps.fromMicros(micros);
    }

    @Nonnull
    synchronized Timestamp nextCommitTime() {
        long micros = Math.max(nowMicros(), Math.max(lastCommitMicros, lastReadMicros) + 1);
        lastCommitMicros = micros;
        return Timestamps.fromMicros(micros);
    }

    @Nonnull
    synchronized Timestamp lastCommitTime() {
        return Timestamps.fromMicros(lastCommitMicros);
    }

    long nowMicros() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
    }
}
