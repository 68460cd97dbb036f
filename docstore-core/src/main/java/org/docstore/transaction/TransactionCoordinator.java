/*
 * TransactionCoordinator.java
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
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Durations;
import com.google.protobuf.util.Timestamps;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.docstore.model.Write;
import org.docstore.query.QueryEvaluator;
import org.docstore.query.StructuredQuery;
import org.docstore.storage.CommitEvent;
import org.docstore.storage.DocumentSource;
import org.docstore.storage.DocumentStore;
import org.docstore.write.CommitResponse;
import org.docstore.write.WritePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns transaction tokens and drives them through their states.
 *
 * <p>
 * Transactions are optimistic. Reads run against the snapshot at the transaction's read time
 * and read-write transactions remember what they saw. At commit, inside the store's commit
 * lock, the writes are applied (preconditions first) and the transaction is validated: if any
 * document it read or wrote has changed after its read time, or any query it ran would now
 * return different versions, the commit fails with {@code ABORTED} and nothing is published.
 * </p>
 *
 * <p>
 * Tokens are single-use for terminal operations. Once committed, rolled back, failed or
 * expired, any further use is rejected; records are forgotten after twice the transaction
 * timeout, after which the token is reported as unknown.
 * </p>
 */
public class TransactionCoordinator {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionCoordinator.class);
    private static final int TOKEN_BYTES = 16;

    @Nonnull
    private final DocumentStore store;
    @Nonnull
    private final WritePipeline pipeline;
    @Nonnull
    private final QueryEvaluator evaluator;
    @Nonnull
    private final DocumentStoreConfig config;
    @Nonnull
    private final Map<ByteString, TransactionRecord> records = new ConcurrentHashMap<>();
    @Nonnull
    private final SecureRandom random = new SecureRandom();

    public TransactionCoordinator(@Nonnull DocumentStore store, @Nonnull WritePipeline pipeline,
                                  @Nonnull QueryEvaluator evaluator, @Nonnull DocumentStoreConfig config) {
        this.store = store;
        this.pipeline = pipeline;
        this.evaluator = evaluator;
        this.config = config;
    }

    /**
     * Begin a transaction.
     *
     * @param options the transaction mode
     * @return the new, active transaction
     * @throws DocumentStoreExceptions.InvalidArgumentException if the read time or retry token is invalid
     */
    @Nonnull
    public TransactionRecord begin(@Nonnull TransactionOptions options) {
        int attempt = 1;
        ByteString retry = options.getRetryTransaction();
        if (retry != null) {
            TransactionRecord previous = records.get(retry);
            if (previous == null || previous.isReadOnly()) {
                throw new DocumentStoreExceptions.InvalidArgumentException(
                        "retry transaction does not name an earlier read-write transaction",
                        LogMessageKeys.RETRY_TRANSACTION_ID, TransactionRecord.tokenString(retry));
            }
            if (previous.transition(TransactionState.ROLLED_BACK) == TransactionState.ACTIVE && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("rolled back transaction replaced by retry",
                        LogMessageKeys.TRANSACTION_ID, previous.getId()));
            }
            attempt = previous.getAttempt() + 1;
        }
        Timestamp readTime = options.getReadTime();
        if (readTime != null) {
            validateReadTime(readTime);
        } else {
            readTime = store.currentReadTime();
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        TransactionRecord record = new TransactionRecord(ByteString.copyFrom(bytes), options, readTime,
                config.getClock().millis(), attempt);
        records.put(record.getToken(), record);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("began transaction",
                    LogMessageKeys.TRANSACTION_ID, record.getId(),
                    LogMessageKeys.READ_ONLY, options.isReadOnly(),
                    LogMessageKeys.READ_TIME, Timestamps.toString(readTime),
                    LogMessageKeys.CURR_ATTEMPT, attempt));
        }
        return record;
    }

    /**
     * Check that a caller-supplied read time lies inside the readable window: not in the future and
     * not older than the maximum staleness or the retained versions.
     *
     * @param readTime the requested read time
     * @throws DocumentStoreExceptions.InvalidArgumentException if it does not
     */
    public void validateReadTime(@Nonnull Timestamp readTime) {
        try {
            Timestamps.checkValid(readTime);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreExceptions.InvalidArgumentException("read time is not a valid timestamp",
                    LogMessageKeys.READ_TIME, readTime);
        }
        Timestamp now = store.currentReadTime();
        Timestamp oldest = Timestamps.subtract(now, Durations.fromMillis(
                config.getMaxReadStaleness().toMillis()));
        if (Timestamps.compare(readTime, now) > 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("read time is in the future",
                    LogMessageKeys.READ_TIME, Timestamps.toString(readTime));
        }
        if (Timestamps.compare(readTime, oldest) < 0 || Timestamps.compare(readTime, store.getEarliestReadTime()) < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("read time is too old",
                    LogMessageKeys.READ_TIME, Timestamps.toString(readTime),
                    LogMessageKeys.EXPECTED, Timestamps.toString(oldest));
        }
    }

    /**
     * Find an active transaction for a read.
     *
     * @param token the transaction token
     * @return its record
     * @throws DocumentStoreExceptions.NotFoundException if the token is unknown
     * @throws DocumentStoreExceptions.InvalidArgumentException if the transaction already ended
     * @throws DocumentStoreExceptions.AbortedException if the transaction expired
     */
    @Nonnull
    public TransactionRecord lookupActive(@Nonnull ByteString token) {
        TransactionRecord record = records.get(token);
        if (record == null) {
            throw new DocumentStoreExceptions.NotFoundException("transaction not found",
                    LogMessageKeys.TRANSACTION_ID, TransactionRecord.tokenString(token));
        }
        if (isExpired(record)) {
            expire(record);
        }
        TransactionState state = record.getState();
        if (state == TransactionState.EXPIRED) {
            throw new DocumentStoreExceptions.AbortedException("transaction expired",
                    LogMessageKeys.TRANSACTION_ID, record.getId());
        }
        if (state.isTerminal()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("transaction is no longer active",
                    LogMessageKeys.TRANSACTION_ID, record.getId(),
                    LogMessageKeys.TRANSACTION_STATE, state);
        }
        return record;
    }

    /**
     * The snapshot a transaction reads from.
     *
     * @param record an active transaction
     * @return the snapshot at its read time
     */
    @Nonnull
    public DocumentSource snapshot(@Nonnull TransactionRecord record) {
        return store.snapshot(record.getReadTime());
    }

    /**
     * Remember that a read-write transaction read a document, whether or not it existed.
     *
     * @param record the transaction
     * @param path the document read
     */
    public void recordRead(@Nonnull TransactionRecord record, @Nonnull ResourcePath path) {
        if (!record.isReadOnly()) {
            record.recordRead(path);
        }
    }

    /**
     * Remember the versions a read-write transaction's query returned.
     *
     * @param record the transaction
     * @param parent parent path of the query
     * @param query the query
     * @param results the documents it returned
     */
    public void recordQuery(@Nonnull TransactionRecord record, @Nonnull ResourcePath parent,
                            @Nonnull StructuredQuery query, @Nonnull List<Document> results) {
        if (!record.isReadOnly()) {
            record.recordQuery(parent, query, results);
        }
    }

    /**
     * Commit a batch of writes, inside a transaction or on its own.
     *
     * @param token the transaction, or {@code null} for a standalone atomic batch
     * @param writes the writes, in order
     * @return the commit time and per-write results
     * @throws DocumentStoreExceptions.FailedPreconditionException if a write's precondition fails
     * @throws DocumentStoreExceptions.AbortedException if the transaction conflicts or has expired
     * @throws DocumentStoreExceptions.InvalidArgumentException if the writes are malformed, the
     * transaction is read-only and writes were given, or the token was already used
     */
    @Nonnull
    public CommitResponse commit(@Nullable ByteString token, @Nonnull List<Write> writes) {
        TransactionRecord record = null;
        if (token != null) {
            record = lookupActive(token);
            TransactionState previous = record.transition(TransactionState.FAILED);
            if (previous != TransactionState.ACTIVE) {
                throw new DocumentStoreExceptions.InvalidArgumentException("transaction is no longer active",
                        LogMessageKeys.TRANSACTION_ID, record.getId(),
                        LogMessageKeys.TRANSACTION_STATE, previous);
            }
            if (record.isReadOnly() && !writes.isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("cannot write in a read-only transaction",
                        LogMessageKeys.TRANSACTION_ID, record.getId(),
                        LogMessageKeys.WRITE_COUNT, writes.size());
            }
        }
        final TransactionRecord transaction = record;
        try {
            pipeline.validate(writes);
            AtomicReference<WritePipeline.AppliedBatch> applied = new AtomicReference<>();
            CommitEvent event = store.commit((latest, commitTime) -> {
                WritePipeline.AppliedBatch batch = pipeline.apply(writes, latest, commitTime);
                if (transaction != null && !transaction.isReadOnly()) {
                    checkConflicts(transaction, writes, latest);
                }
                applied.set(batch);
                return batch.getMutations();
            });
            if (transaction != null) {
                transaction.setState(TransactionState.COMMITTED);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("committed writes",
                        LogMessageKeys.TRANSACTION_ID, transaction == null ? null : transaction.getId(),
                        LogMessageKeys.COMMIT_TIME, Timestamps.toString(event.getCommitTime()),
                        LogMessageKeys.WRITE_COUNT, writes.size()));
            }
            return new CommitResponse(event.getCommitTime(), applied.get().getWriteResults());
        } catch (DocumentStoreException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("commit rejected",
                        LogMessageKeys.TRANSACTION_ID, transaction == null ? null : transaction.getId(),
                        LogMessageKeys.CODE, e.getCode()), e);
            }
            throw e;
        }
    }

    private void checkConflicts(@Nonnull TransactionRecord record, @Nonnull List<Write> writes,
                          @Nonnull DocumentSource latest) {
        Set<ResourcePath> touched = new LinkedHashSet<>(record.getReadPaths());
        for (Write write : writes) {
            touched.add(pipeline.getDatabaseId().parseDocumentName(write.getName()));
        }
        Timestamp readTime = record.getReadTime();
        for (ResourcePath path : touched) {
            Timestamp changed = store.lastChangeTime(path);
            if (changed != null && Timestamps.compare(changed, readTime) > 0) {
                throw new DocumentStoreExceptions.AbortedException("document changed since the transaction read it",
                        LogMessageKeys.TRANSACTION_ID, record.getId(),
                        LogMessageKeys.DOCUMENT, path,
                        LogMessageKeys.READ_TIME, Timestamps.toString(readTime),
                        LogMessageKeys.ACTUAL, Timestamps.toString(changed));
            }
        }
        for (TransactionRecord.QueryRead read : record.getQueryReads()) {
            List<Document> now = evaluator.evaluate(read.parent, read.query, latest);
            if (!TransactionRecord.QueryRead.versions(now).equals(read.results)) {
                throw new DocumentStoreExceptions.AbortedException("query result changed since the transaction ran it",
                        LogMessageKeys.TRANSACTION_ID, record.getId(),
                        LogMessageKeys.PARENT, read.parent,
                        LogMessageKeys.EXPECTED, read.results.size(),
                        LogMessageKeys.ACTUAL, now.size());
            }
        }
    }

    /**
     * Roll back an active transaction.
     *
     * @param token the transaction token
     */
    public void rollback(@Nonnull ByteString token) {
        TransactionRecord record = lookupActive(token);
        TransactionState previous = record.transition(TransactionState.ROLLED_BACK);
        if (previous != TransactionState.ACTIVE) {
            throw new DocumentStoreExceptions.InvalidArgumentException("transaction is no longer active",
                    LogMessageKeys.TRANSACTION_ID, record.getId(),
                    LogMessageKeys.TRANSACTION_STATE, previous);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("rolled back transaction",
                    LogMessageKeys.TRANSACTION_ID, record.getId()));
        }
    }

    /**
     * Read time of the oldest transaction that can still read; versions it can see must be kept.
     *
     * @return the oldest active read time, or {@code null} if no transaction is active
     */
    @Nullable
    public Timestamp oldestActiveReadTime() {
        Timestamp oldest = null;
        for (TransactionRecord record : records.values()) {
            if (record.getState() == TransactionState.ACTIVE && !isExpired(record)
                    && (oldest == null || Timestamps.compare(record.getReadTime(), oldest) < 0)) {
                oldest = record.getReadTime();
            }
        }
        return oldest;
    }

    /**
     * Expire transactions that outlived the timeout and forget long-finished ones.
     *
     * @return the number of transactions expired by this call
     */
    public int expireStale() {
        int expired = 0;
        long now = config.getClock().millis();
        long timeout = config.getTransactionTimeout().toMillis();
        Iterator<TransactionRecord> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            TransactionRecord record = iterator.next();
            long age = now - record.getStartMillis();
            if (age > timeout && expire(record)) {
                expired++;
            }
            if (age > 2 * timeout && record.getState().isTerminal()) {
                iterator.remove();
            }
        }
        return expired;
    }

    /**
     * Number of transactions currently tracked, active or finished.
     *
     * @return the record count
     */
    public int size() {
        return records.size();
    }

    private boolean isExpired(@Nonnull TransactionRecord record) {
        return config.getClock().millis() - record.getStartMillis() > config.getTransactionTimeout().toMillis();
    }

    private boolean expire(@Nonnull TransactionRecord record) {
        if (record.transition(TransactionState.EXPIRED) != TransactionState.ACTIVE) {
            return false;
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("transaction expired",
                    LogMessageKeys.TRANSACTION_ID, record.getId(),
                    LogMessageKeys.AGE_MILLIS, config.getClock().millis() - record.getStartMillis()));
        }
        return true;
    }
}
