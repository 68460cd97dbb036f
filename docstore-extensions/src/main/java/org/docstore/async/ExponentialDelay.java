/*
 * ExponentialDelay.java
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

package org.docstore.async;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Exponential backoff with jitter. Each call to {@link #delay()} waits for the current
 * delay and then grows it by the backoff factor, capped at the maximum.
 */
public class ExponentialDelay {
    public static final double DEFAULT_BACKOFF_FACTOR = 1.5;
    public static final double DEFAULT_JITTER_FACTOR = 1.0;

    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final double backoffFactor;
    private final double jitterFactor;

    private long currentDelayMillis;
    private long nextDelayMillis;

    public ExponentialDelay(long initialDelayMillis, long maxDelayMillis) {
        this(initialDelayMillis, maxDelayMillis, DEFAULT_BACKOFF_FACTOR, DEFAULT_JITTER_FACTOR);
    }

    public ExponentialDelay(long initialDelayMillis, long maxDelayMillis, double backoffFactor, double jitterFactor) {
        if (initialDelayMillis < 0 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("delay bounds must satisfy 0 <= initial <= max");
        }
        if (backoffFactor < 1.0 || jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("backoff factor must be >= 1 and jitter must be within [0, 1]");
        }
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.backoffFactor = backoffFactor;
        this.jitterFactor = jitterFactor;
        reset();
    }

    @Nonnull
    public CompletableFuture<Void> delay() {
        return MoreAsyncUtil.delayedFuture(nextDelayMillis, TimeUnit.MILLISECONDS)
                .thenApply(vignore -> {
                    calculateNextDelay();
                    return vignore;
                });
    }

    /**
     * Return to the initial delay, typically after a successful attempt. The first delay
     * after a reset is zero so that the first retry happens immediately.
     */
    public final void reset() {
        currentDelayMillis = initialDelayMillis;
        nextDelayMillis = 0L;
    }

    /**
     * Jump straight to the maximum delay. Used when the server reports that it is overloaded.
     */
    public void resetToMax() {
        currentDelayMillis = maxDelayMillis;
        nextDelayMillis = jittered(maxDelayMillis);
    }

    protected void calculateNextDelay() {
        nextDelayMillis = jittered(currentDelayMillis);
        currentDelayMillis = Math.min((long)(currentDelayMillis * backoffFactor), maxDelayMillis);
    }

    private long jittered(long base) {
        double jitter = (ThreadLocalRandom.current().nextDouble() - 0.5) * jitterFactor * base;
        return Math.max(0L, Math.min(maxDelayMillis, (long)(base + jitter)));
    }

    public long getNextDelayMillis() {
        return nextDelayMillis;
    }

    public long getCurrentDelayMillis() {
        return currentDelayMillis;
    }
}
