/*
 * TransactionCoordinatorTest.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Durations;
import com.google.protobuf.util.Timestamps;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;
import org.docstore.model.Precondition;
import org.docstore.model.ResourcePath;
import org.docstore.model.Write;
import org.docstore.query.FieldFilter;
import org.docstore.query.Filter;
import org.docstore.query.QueryEvaluator;
import org.docstore.query.StructuredQuery;
import org.docstore.storage.DocumentStore;
import org.docstore.test.ManualClock;
import org.docstore.write.CommitResponse;
import org.docstore.write.WritePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.docstore.test.TestDocuments.DATABASE;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.name;
import static org.docstore.test.TestDocuments.put;
import static org.docstore.test.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TransactionCoordinator}.
 */
class TransactionCoordinatorTest {
    private static final ResourcePath ROOT = DATABASE.getDocumentsRoot();

    private ManualClock clock;
    private DocumentStore store;
    private QueryEvaluator evaluator;
    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        DocumentStoreConfig config = DocumentStoreConfig.newBuilder()
                .setClock(clock)
                .setMaxReadStaleness(Duration.ofSeconds(60))
                .setTransactionTimeout(Duration.ofSeconds(270))
                .build();
        store = new DocumentStore(clock);
        evaluator = new QueryEvaluator(config.getQueryProgressInterval());
        coordinator = new TransactionCoordinator(store, new WritePipeline(DATABASE), evaluator, config);
        put(store, doc("accounts/alice", "balance", 100), doc("accounts/bob", "balance", 50));
    }

    private static ResourcePath path(String relative) {
        return DATABASE.parseDocumentName(name(relative));
    }

    private Document read(TransactionRecord record, String relative) {
        coordinator.recordRead(record, path(relative));
        return coordinator.snapshot(record).get(path(relative));
    }

    @Test
    void readsSeeTheSnapshotAtTheReadTime() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        put(store, doc("accounts/alice", "balance", 0));
        assertEquals(value(100), read(record, "accounts/alice").getFields().get("balance"));
        assertEquals(value(0), store.snapshot(store.currentReadTime()).get(path("accounts/alice")).getFields().get("balance"));
    }

    @Test
    void commitAppliesWritesAtomically() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        read(record, "accounts/alice");
        read(record, "accounts/bob");
        CommitResponse response = coordinator.commit(record.getToken(), ImmutableList.of(
                Write.update(doc("accounts/alice", "balance", 70)),
                Write.update(doc("accounts/bob", "balance", 80))));
        assertEquals(TransactionState.COMMITTED, record.getState());
        assertThat(Timestamps.compare(response.getCommitTime(), record.getReadTime()), greaterThan(0));
        assertEquals(response.getCommitTime(), store.lastChangeTime(path("accounts/alice")));
        assertEquals(response.getCommitTime(), store.lastChangeTime(path("accounts/bob")));
    }

    @Test
    void stalePreconditionFailsBeforeTheConflictCheck() {
        Timestamp original = store.lastChangeTime(path("accounts/alice"));
        TransactionRecord first = coordinator.begin(TransactionOptions.readWrite());
        TransactionRecord second = coordinator.begin(TransactionOptions.readWrite());
        assertEquals(original, read(first, "accounts/alice").getUpdateTime());
        assertEquals(original, read(second, "accounts/alice").getUpdateTime());

        CommitResponse committed = coordinator.commit(first.getToken(), ImmutableList.of(
                Write.update(doc("accounts/alice", "balance", 120)).withPrecondition(Precondition.updateTime(original))));
        Timestamp updated = committed.getWriteResults().get(0).getUpdateTime();
        assertThat(Timestamps.compare(updated, original), greaterThan(0));

        // the second transaction also conflicts, but the failed precondition is what it reports
        DocumentStoreExceptions.FailedPreconditionException e = assertThrows(
                DocumentStoreExceptions.FailedPreconditionException.class,
                () -> coordinator.commit(second.getToken(), ImmutableList.of(
                        Write.update(doc("accounts/alice", "balance", 130)).withPrecondition(Precondition.updateTime(original)))));
        assertEquals(0, e.getWriteIndex());
        assertEquals(TransactionState.FAILED, second.getState());
        assertEquals(value(120), store.snapshot(store.currentReadTime()).get(path("accounts/alice")).getFields().get("balance"));
    }

    @Test
    void concurrentChangeToReadDocumentAborts() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        read(record, "accounts/alice");
        put(store, doc("accounts/alice", "balance", 1));
        assertThrows(DocumentStoreExceptions.AbortedException.class, () -> coordinator.commit(record.getToken(),
                ImmutableList.of(Write.update(doc("accounts/bob", "balance", 0)))));
        assertEquals(TransactionState.FAILED, record.getState());
        assertEquals(value(50), store.snapshot(store.currentReadTime()).get(path("accounts/bob")).getFields().get("balance"));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.commit(record.getToken(), ImmutableList.of()));
    }

    @Test
    void concurrentChangeToWrittenDocumentAborts() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        put(store, doc("accounts/bob", "balance", 1));
        assertThrows(DocumentStoreExceptions.AbortedException.class, () -> coordinator.commit(record.getToken(),
                ImmutableList.of(Write.delete(name("accounts/bob")))));
    }

    @Test
    void unrelatedChangeDoesNotAbort() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        read(record, "accounts/alice");
        put(store, doc("accounts/carol", "balance", 5));
        coordinator.commit(record.getToken(), ImmutableList.of(Write.update(doc("accounts/alice", "balance", 99))));
        assertEquals(TransactionState.COMMITTED, record.getState());
    }

    @Test
    void phantomInQueryResultAborts() {
        StructuredQuery rich = StructuredQuery.newBuilder()
                .from("accounts")
                .where(Filter.field("balance", FieldFilter.Operator.GREATER_THAN_OR_EQUAL, value(100)))
                .build();
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        List<Document> results = evaluator.evaluate(ROOT, rich, coordinator.snapshot(record));
        coordinator.recordQuery(record, ROOT, rich, results);
        put(store, doc("accounts/dave", "balance", 500));
        assertThrows(DocumentStoreExceptions.AbortedException.class, () -> coordinator.commit(record.getToken(),
                ImmutableList.of(Write.update(doc("reports/rich", "count", results.size())))));
    }

    @Test
    void readOnlyTransactions() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readOnly());
        put(store, doc("accounts/alice", "balance", 1));
        // read-only transactions never conflict
        read(record, "accounts/alice");
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class, () -> coordinator.commit(record.getToken(),
                ImmutableList.of(Write.delete(name("accounts/alice")))));

        TransactionRecord other = coordinator.begin(TransactionOptions.readOnly());
        coordinator.commit(other.getToken(), ImmutableList.of());
        assertEquals(TransactionState.COMMITTED, other.getState());
    }

    @Test
    void readOnlyAtPastReadTime() {
        Timestamp before = store.currentReadTime();
        clock.advance(Duration.ofSeconds(1));
        put(store, doc("accounts/alice", "balance", 1));
        TransactionRecord record = coordinator.begin(TransactionOptions.readOnly(before));
        assertEquals(before, record.getReadTime());
        assertEquals(value(100), read(record, "accounts/alice").getFields().get("balance"));
    }

    @Test
    void invalidReadTimes() {
        Timestamp future = Timestamps.add(store.currentReadTime(), Durations.fromSeconds(10));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.begin(TransactionOptions.readOnly(future)));
        Timestamp old = store.currentReadTime();
        clock.advance(Duration.ofMinutes(2));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.begin(TransactionOptions.readOnly(old)));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.validateReadTime(Timestamp.newBuilder().setSeconds(1).setNanos(-1).build()));
    }

    @Test
    void unknownAndFinishedTokens() {
        assertThrows(DocumentStoreExceptions.NotFoundException.class,
                () -> coordinator.lookupActive(ByteString.copyFromUtf8("nope")));
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        coordinator.rollback(record.getToken());
        assertEquals(TransactionState.ROLLED_BACK, record.getState());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.commit(record.getToken(), ImmutableList.of()));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.rollback(record.getToken()));
    }

    @Test
    void expiredTransactionsAbort() {
        TransactionRecord record = coordinator.begin(TransactionOptions.readWrite());
        clock.advance(Duration.ofSeconds(271));
        assertThrows(DocumentStoreExceptions.AbortedException.class,
                () -> coordinator.commit(record.getToken(), ImmutableList.of()));
        assertEquals(TransactionState.EXPIRED, record.getState());
    }

    @Test
    void expireStaleForgetsOldRecords() {
        coordinator.begin(TransactionOptions.readWrite());
        TransactionRecord finished = coordinator.begin(TransactionOptions.readWrite());
        coordinator.rollback(finished.getToken());
        assertEquals(2, coordinator.size());
        clock.advance(Duration.ofSeconds(300));
        assertEquals(1, coordinator.expireStale());
        assertNull(coordinator.oldestActiveReadTime());
        clock.advance(Duration.ofSeconds(300));
        assertEquals(0, coordinator.expireStale());
        assertEquals(0, coordinator.size());
    }

    @Test
    void oldestActiveReadTime() {
        TransactionRecord first = coordinator.begin(TransactionOptions.readWrite());
        coordinator.begin(TransactionOptions.readOnly());
        assertEquals(first.getReadTime(), coordinator.oldestActiveReadTime());
        coordinator.rollback(first.getToken());
        assertNotNull(coordinator.oldestActiveReadTime());
    }

    @Test
    void retriesChainToTheirPredecessor() {
        TransactionRecord first = coordinator.begin(TransactionOptions.readWrite());
        TransactionRecord second = coordinator.begin(TransactionOptions.readWrite(first.getToken()));
        assertEquals(1, first.getAttempt());
        assertEquals(2, second.getAttempt());
        assertEquals(TransactionState.ROLLED_BACK, first.getState());

        TransactionRecord readOnly = coordinator.begin(TransactionOptions.readOnly());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.begin(TransactionOptions.readWrite(readOnly.getToken())));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> coordinator.begin(TransactionOptions.readWrite(ByteString.copyFromUtf8("unknown"))));
    }

    @Test
    void standaloneCommitChecksPreconditions() {
        assertThrows(DocumentStoreExceptions.FailedPreconditionException.class, () -> coordinator.commit(null,
                ImmutableList.of(Write.update(doc("accounts/alice", "balance", 1))
                        .withPrecondition(Precondition.exists(false)))));
        CommitResponse response = coordinator.commit(null, ImmutableList.of(Write.delete(name("accounts/bob"))));
        assertNull(store.snapshot(response.getCommitTime()).get(path("accounts/bob")));
    }
}
