/*
 * DocumentStoreConfig.java
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

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;

/**
 * Immutable settings shared by the document service, its transaction coordinator and
 * its stream handlers. Use {@link #newBuilder()} to create one, or {@link #fromProperties(Properties)}
 * to read the keys in {@link DocumentStoreProperties}.
 */
public final class DocumentStoreConfig {
    /**
     * Name of the optional classpath resource read by {@link #load()}.
     */
    public static final String PROPERTIES_RESOURCE = "docstore.properties";

    @Nonnull
    private final Clock clock;
    @Nonnull
    private final Duration maxReadStaleness;
    @Nonnull
    private final Duration transactionTimeout;
    @Nonnull
    private final Duration versionRetention;
    private final int queryProgressInterval;
    private final int maxUnacknowledgedWrites;
    private final int transactionMaxAttempts;
    private final long initialRetryDelayMillis;
    private final long maxRetryDelayMillis;
    private final double retryBackoffFactor;
    private final int watchMaxReconnectAttempts;
    @Nonnull
    private final ExistenceFilterPolicy existenceFilterPolicy;

    private DocumentStoreConfig(@Nonnull Builder builder) {
        this.clock = builder.clock;
        this.maxReadStaleness = builder.maxReadStaleness;
        this.transactionTimeout = builder.transactionTimeout;
        this.versionRetention = builder.versionRetention;
        this.queryProgressInterval = builder.queryProgressInterval;
        this.maxUnacknowledgedWrites = builder.maxUnacknowledgedWrites;
        this.transactionMaxAttempts = builder.transactionMaxAttempts;
        this.initialRetryDelayMillis = builder.initialRetryDelayMillis;
        this.maxRetryDelayMillis = builder.maxRetryDelayMillis;
        this.retryBackoffFactor = builder.retryBackoffFactor;
        this.watchMaxReconnectAttempts = builder.watchMaxReconnectAttempts;
        this.existenceFilterPolicy = builder.existenceFilterPolicy;
    }

    /**
     * Source of wall-clock time for commit timestamps, staleness checks and transaction expiry.
     *
     * @return the clock
     */
    @Nonnull
    public Clock getClock() {
        return clock;
    }

    @Nonnull
    public Duration getMaxReadStaleness() {
        return maxReadStaleness;
    }

    @Nonnull
    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    /**
     * How long superseded versions stay readable. Listen streams resuming from an older point
     * receive a reset instead of a difference.
     *
     * @return the retention window
     */
    @Nonnull
    public Duration getVersionRetention() {
        return versionRetention;
    }

    public int getQueryProgressInterval() {
        return queryProgressInterval;
    }

    public int getMaxUnacknowledgedWrites() {
        return maxUnacknowledgedWrites;
    }

    public int getTransactionMaxAttempts() {
        return transactionMaxAttempts;
    }

    public long getInitialRetryDelayMillis() {
        return initialRetryDelayMillis;
    }

    public long getMaxRetryDelayMillis() {
        return maxRetryDelayMillis;
    }

    public double getRetryBackoffFactor() {
        return retryBackoffFactor;
    }

    public int getWatchMaxReconnectAttempts() {
        return watchMaxReconnectAttempts;
    }

    @Nonnull
    public ExistenceFilterPolicy getExistenceFilterPolicy() {
        return existenceFilterPolicy;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public static DocumentStoreConfig defaults() {
        return newBuilder().build();
    }

    /**
     * Build a configuration from property values, using defaults for missing keys.
     *
     * @param properties configuration values keyed by the names in {@link DocumentStoreProperties}
     * @return a builder primed with those values
     */
    @Nonnull
    public static Builder fromProperties(@Nonnull Properties properties) {
        return newBuilder()
                .setMaxReadStaleness(Duration.ofMillis(DocumentStoreProperties.MAX_READ_STALENESS_MILLIS.get(properties)))
                .setTransactionTimeout(Duration.ofMillis(DocumentStoreProperties.TRANSACTION_TIMEOUT_MILLIS.get(properties)))
                .setVersionRetention(Duration.ofMillis(DocumentStoreProperties.VERSION_RETENTION_MILLIS.get(properties)))
                .setQueryProgressInterval(DocumentStoreProperties.QUERY_PROGRESS_INTERVAL.get(properties))
                .setMaxUnacknowledgedWrites(DocumentStoreProperties.MAX_UNACKNOWLEDGED_WRITES.get(properties))
                .setTransactionMaxAttempts(DocumentStoreProperties.TRANSACTION_MAX_ATTEMPTS.get(properties))
                .setInitialRetryDelayMillis(DocumentStoreProperties.INITIAL_RETRY_DELAY_MILLIS.get(properties))
                .setMaxRetryDelayMillis(DocumentStoreProperties.MAX_RETRY_DELAY_MILLIS.get(properties))
                .setRetryBackoffFactor(DocumentStoreProperties.RETRY_BACKOFF_FACTOR.get(properties))
                .setWatchMaxReconnectAttempts(DocumentStoreProperties.WATCH_MAX_RECONNECT_ATTEMPTS.get(properties))
                .setExistenceFilterPolicy(DocumentStoreProperties.EXISTENCE_FILTER_POLICY.get(properties));
    }

    /**
     * Load configuration from the {@value #PROPERTIES_RESOURCE} classpath resource, if present,
     * overridden by system properties.
     *
     * @return the loaded configuration
     */
    @Nonnull
    public static DocumentStoreConfig load() {
        Properties properties = new Properties();
        try (InputStream in = DocumentStoreConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read " + PROPERTIES_RESOURCE, e);
        }
        properties.putAll(System.getProperties());
        return fromProperties(properties).build();
    }

    /**
     * Builder for {@link DocumentStoreConfig}.
     */
    public static class Builder {
        @Nonnull
        private Clock clock = Clock.systemUTC();
        @Nonnull
        private Duration maxReadStaleness = Duration.ofMillis(DocumentStoreProperties.MAX_READ_STALENESS_MILLIS.getDefaultValue());
        @Nonnull
        private Duration transactionTimeout = Duration.ofMillis(DocumentStoreProperties.TRANSACTION_TIMEOUT_MILLIS.getDefaultValue());
        @Nonnull
        private Duration versionRetention = Duration.ofMillis(DocumentStoreProperties.VERSION_RETENTION_MILLIS.getDefaultValue());
        private int queryProgressInterval = DocumentStoreProperties.QUERY_PROGRESS_INTERVAL.getDefaultValue();
        private int maxUnacknowledgedWrites = DocumentStoreProperties.MAX_UNACKNOWLEDGED_WRITES.getDefaultValue();
        private int transactionMaxAttempts = DocumentStoreProperties.TRANSACTION_MAX_ATTEMPTS.getDefaultValue();
        private long initialRetryDelayMillis = DocumentStoreProperties.INITIAL_RETRY_DELAY_MILLIS.getDefaultValue();
        private long maxRetryDelayMillis = DocumentStoreProperties.MAX_RETRY_DELAY_MILLIS.getDefaultValue();
        private double retryBackoffFactor = DocumentStoreProperties.RETRY_BACKOFF_FACTOR.getDefaultValue();
        private int watchMaxReconnectAttempts = DocumentStoreProperties.WATCH_MAX_RECONNECT_ATTEMPTS.getDefaultValue();
        @Nonnull
        private ExistenceFilterPolicy existenceFilterPolicy = DocumentStoreProperties.EXISTENCE_FILTER_POLICY.getDefaultValue();

        private Builder() {
        }

        private Builder(@Nonnull DocumentStoreConfig config) {
            this.clock = config.clock;
            this.maxReadStaleness = config.maxReadStaleness;
            this.transactionTimeout = config.transactionTimeout;
            this.versionRetention = config.versionRetention;
            this.queryProgressInterval = config.queryProgressInterval;
            this.maxUnacknowledgedWrites = config.maxUnacknowledgedWrites;
            this.transactionMaxAttempts = config.transactionMaxAttempts;
            this.initialRetryDelayMillis = config.initialRetryDelayMillis;
            this.maxRetryDelayMillis = config.maxRetryDelayMillis;
            this.retryBackoffFactor = config.retryBackoffFactor;
            this.watchMaxReconnectAttempts = config.watchMaxReconnectAttempts;
            this.existenceFilterPolicy = config.existenceFilterPolicy;
        }

        @Nonnull
        public Builder setClock(@Nonnull Clock clock) {
            this.clock = clock;
            return this;
        }

        @Nonnull
        public Builder setMaxReadStaleness(@Nonnull Duration maxReadStaleness) {
            this.maxReadStaleness = maxReadStaleness;
            return this;
        }

        @Nonnull
        public Builder setTransactionTimeout(@Nonnull Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
            return this;
        }

        @Nonnull
        public Builder setVersionRetention(@Nonnull Duration versionRetention) {
            this.versionRetention = versionRetention;
            return this;
        }

        @Nonnull
        public Builder setQueryProgressInterval(int queryProgressInterval) {
            this.queryProgressInterval = queryProgressInterval;
            return this;
        }

        @Nonnull
        public Builder setMaxUnacknowledgedWrites(int maxUnacknowledgedWrites) {
            this.maxUnacknowledgedWrites = maxUnacknowledgedWrites;
            return this;
        }

        @Nonnull
        public Builder setTransactionMaxAttempts(int transactionMaxAttempts) {
            this.transactionMaxAttempts = transactionMaxAttempts;
            return this;
        }

        @Nonnull
        public Builder setInitialRetryDelayMillis(long initialRetryDelayMillis) {
            this.initialRetryDelayMillis = initialRetryDelayMillis;
            return this;
        }

        @Nonnull
        public Builder setMaxRetryDelayMillis(long maxRetryDelayMillis) {
            this.maxRetryDelayMillis = maxRetryDelayMillis;
            return this;
        }

        @Nonnull
        public Builder setRetryBackoffFactor(double retryBackoffFactor) {
            this.retryBackoffFactor = retryBackoffFactor;
            return this;
        }

        @Nonnull
        public Builder setWatchMaxReconnectAttempts(int watchMaxReconnectAttempts) {
            this.watchMaxReconnectAttempts = watchMaxReconnectAttempts;
            return this;
        }

        @Nonnull
        public Builder setExistenceFilterPolicy(@Nonnull ExistenceFilterPolicy existenceFilterPolicy) {
            this.existenceFilterPolicy = existenceFilterPolicy;
            return this;
        }

        @Nonnull
        public DocumentStoreConfig build() {
            if (queryProgressInterval <= 0 || maxUnacknowledgedWrites <= 0 || transactionMaxAttempts <= 0) {
                throw new DocumentStoreExceptions.InvalidArgumentException("counts in the configuration must be positive",
                        "query_progress_interval", queryProgressInterval,
                        "max_unacknowledged_writes", maxUnacknowledgedWrites,
                        "transaction_max_attempts", transactionMaxAttempts);
            }
            if (maxReadStaleness.isNegative() || versionRetention.isNegative() || transactionTimeout.isNegative()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("durations in the configuration must not be negative");
            }
            return new DocumentStoreConfig(this);
        }
    }
}
