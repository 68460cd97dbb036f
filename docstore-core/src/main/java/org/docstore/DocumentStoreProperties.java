/*
 * DocumentStoreProperties.java
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

package org.docstore;

import org.docstore.watch.ExistenceFilterPolicy;

/**
 * Property keys understood by {@link DocumentStoreConfig#fromProperties(java.util.Properties)}.
 */
public final class DocumentStoreProperties {
    /**
     * How far in the past a read time may lie. Older read times are rejected.
     */
    public static final PropertyKey<Long> MAX_READ_STALENESS_MILLIS = PropertyKey.longPropertyKey(
            "docstore.read.max_staleness_millis", 60_000L);

    /**
     * Lifetime of a transaction token. A token used after this long is expired.
     */
    public static final PropertyKey<Long> TRANSACTION_TIMEOUT_MILLIS = PropertyKey.longPropertyKey(
            "docstore.transaction.timeout_millis", 270_000L);

    /**
     * How long superseded document versions are kept for snapshot reads and listen resumption.
     */
    public static final PropertyKey<Long> VERSION_RETENTION_MILLIS = PropertyKey.longPropertyKey(
            "docstore.storage.version_retention_millis", 60_000L);

    /**
     * Number of skipped documents after which a query emits a progress response.
     */
    public static final PropertyKey<Integer> QUERY_PROGRESS_INTERVAL = PropertyKey.integerPropertyKey(
            "docstore.query.progress_interval", 1000);

    /**
     * Number of write stream responses a client may leave unacknowledged.
     */
    public static final PropertyKey<Integer> MAX_UNACKNOWLEDGED_WRITES = PropertyKey.integerPropertyKey(
            "docstore.write.max_unacknowledged", 10);

    public static final PropertyKey<Integer> TRANSACTION_MAX_ATTEMPTS = PropertyKey.integerPropertyKey(
            "docstore.transaction.max_attempts", 5);

    public static final PropertyKey<Long> INITIAL_RETRY_DELAY_MILLIS = PropertyKey.longPropertyKey(
            "docstore.retry.initial_delay_millis", 1000L);

    public static final PropertyKey<Long> MAX_RETRY_DELAY_MILLIS = PropertyKey.longPropertyKey(
            "docstore.retry.max_delay_millis", 60_000L);

    public static final PropertyKey<Double> RETRY_BACKOFF_FACTOR = PropertyKey.doublePropertyKey(
            "docstore.retry.backoff_factor", 1.5);

    public static final PropertyKey<Integer> WATCH_MAX_RECONNECT_ATTEMPTS = PropertyKey.integerPropertyKey(
            "docstore.watch.max_reconnect_attempts", 10);

    public static final PropertyKey<ExistenceFilterPolicy> EXISTENCE_FILTER_POLICY = PropertyKey.enumPropertyKey(
            "docstore.watch.existence_filter_policy", ExistenceFilterPolicy.class, ExistenceFilterPolicy.RESET_STREAM);

    private DocumentStoreProperties() {
        throw new IllegalStateException("should not instantiate class of static properties");
    }
}
