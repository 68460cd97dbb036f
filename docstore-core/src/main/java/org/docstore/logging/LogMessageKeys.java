/*
 * LogMessageKeys.java
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

package org.docstore.logging;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by docstore.
 * All keys are kept here so that collisions and spelling drift are easy to spot.
 */
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    CODE,
    DESCRIPTION,
    CURR_ATTEMPT,
    MAX_ATTEMPTS,
    DELAY,
    COUNT,
    EXPECTED,
    ACTUAL,
    // documents and queries
    DATABASE,
    DOCUMENT,
    PARENT,
    COLLECTION_ID,
    FIELD_PATH,
    OPERATOR,
    READ_TIME,
    SKIPPED,
    PAGE_SIZE,
    PAGE_TOKEN,
    // transactions and writes
    TRANSACTION_ID,
    RETRY_TRANSACTION_ID,
    TRANSACTION_STATE,
    READ_ONLY,
    COMMIT_TIME,
    WRITE_COUNT,
    WRITE_INDEX,
    PRECONDITION,
    AGE_MILLIS,
    // streams
    STREAM_ID,
    STREAM_TOKEN,
    UNACKNOWLEDGED,
    EXPIRED_STREAMS,
    TARGET_ID,
    TARGET_STATE("state"),
    OLD_STATE("old"),
    NEW_STATE("new"),
    RESUME_TOKEN,
    CHANGE_TYPE,
    POLICY,
    // storage
    HORIZON,
    PRUNED_VERSIONS;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
