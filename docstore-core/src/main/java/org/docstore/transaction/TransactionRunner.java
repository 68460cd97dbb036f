/*
 * TransactionRunner.java
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

package org.docstore.transaction;

import com.google.protobuf.ByteString;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.async.ExponentialDelay;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * Runs an update function in a read-write transaction, retrying the whole attempt when the
 * commit fails with a retriable error.
 *
 * <p>
 * Each attempt begins a transaction, hands a {@link Transaction} to the function and commits
 * the writes it buffered. Attempts after the first are chained to their predecessor through
 * {@link TransactionOptions#readWrite(ByteString)} and wait an exponentially growing, jittered
 * delay first. An exception thrown by the function itself rolls the transaction back and is
 * rethrown without retrying.
 * </p>
 */
public class TransactionRunner {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionRunner.class);

    @Nonnull
    private final TransactionBackend backend;
    private final int maxAttempts;
    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final double backoffFactor;

    public TransactionRunner(@Nonnull TransactionBackend backend, @Nonnull DocumentStoreConfig config) {
        this(backend, config.getTransactionMaxAttempts(), config.getInitialRetryDelayMillis(),
                config.getMaxRetryDelayMillis(), config.getRetryBackoffFactor());
    }

    public TransactionRunner(@Nonnull TransactionBackend backend, int maxAttempts, long initialDelayMillis,
                             long maxDelayMillis, double backoffFactor) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("max attempts must be positive");
        }
        this.backend = backend;
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.backoffFactor = backoffFactor;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Nonnull
    protected ExponentialDelay createExponentialDelay() {
        return new ExponentialDelay(initialDelayMillis, maxDelayMillis, backoffFactor,
                ExponentialDelay.DEFAULT_JITTER_FACTOR);
    }

    /**
     * Run {@code updateFunction} transactionally.
     *
     * @param updateFunction reads through the transaction and buffers writes on it
     * @param <T> result type
     * @return the function's result from the attempt that committed
     * @throws DocumentStoreException if the commit fails permanently or attempts run out
     */
    public <T> T run(@Nonnull Function<? super Transaction, ? extends T> updateFunction) {
        ExponentialDelay delay = createExponentialDelay();
        ByteString previous = null;
        int attempt = 0;
        while (true) {
            attempt++;
            ByteString token = backend.beginTransaction(previous == null
                                                        ? TransactionOptions.readWrite()
                                                        : TransactionOptions.readWrite(previous));
            Transaction transaction = new Transaction(backend, token);
            T result = applyOrRollBack(updateFunction, transaction);
            try {
                backend.commit(token, transaction.getWrites());
                return result;
            } catch (RuntimeException e) {
                DocumentStoreException mapped = DocumentStoreExceptions.wrap(e);
                if (!mapped.isRetriable() || attempt >= maxAttempts) {
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug(KeyValueLogMessage.of("giving up on transaction",
                                LogMessageKeys.TRANSACTION_ID, TransactionRecord.tokenString(token),
                                LogMessageKeys.CODE, mapped.getCode(),
                                LogMessageKeys.CURR_ATTEMPT, attempt,
                                LogMessageKeys.MAX_ATTEMPTS, maxAttempts));
                    }
                    throw mapped;
                }
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn(KeyValueLogMessage.build("retrying transaction",
                            LogMessageKeys.MESSAGE, mapped.getMessage(),
                            LogMessageKeys.CODE, mapped.getCode(),
                            LogMessageKeys.CURR_ATTEMPT, attempt,
                            LogMessageKeys.MAX_ATTEMPTS, maxAttempts,
                            LogMessageKeys.DELAY, delay.getNextDelayMillis()).toString());
                }
                delay.delay().join();
                previous = token;
            }
        }
    }

    @Nullable
    private <T> T applyOrRollBack(@Nonnull Function<? super Transaction, ? extends T> updateFunction,
                                  @Nonnull Transaction transaction) {
        try {
            return updateFunction.apply(transaction);
        } catch (RuntimeException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("rolling back transaction after update function failed",
                        LogMessageKeys.TRANSACTION_ID, TransactionRecord.tokenString(transaction.getToken())), e);
            }
            try {
                backend.rollback(transaction.getToken());
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }
    }
}
