/*
 * DocumentServiceTest.java
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


package org.docstore.service;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.Precondition;
import org.docstore.model.Value;
import org.docstore.model.Write;
import org.docstore.query.AggregateField;
import org.docstore.query.AggregationQuery;
import org.docstore.query.FieldFilter;
import org.docstore.query.Filter;
import org.docstore.query.Order;
import org.docstore.query.RunAggregationQueryResponse;
import org.docstore.query.RunQueryResponse;
import org.docstore.query.StructuredQuery;
import org.docstore.test.ManualClock;
import org.docstore.test.RecordingObserver;
import org.docstore.transaction.ReadOptions;
import org.docstore.transaction.TransactionOptions;
import org.docstore.write.BatchWriteResponse;
import org.docstore.write.CommitResponse;
import org.docstore.write.WriteRequest;
import org.docstore.write.WriteResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.docstore.test.TestDocuments.DATABASE;
import static org.docstore.test.TestDocuments.ROOT;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.fields;
import static org.docstore.test.TestDocuments.name;
import static org.docstore.test.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentService}.
 */
class DocumentServiceTest {
    private ManualClock clock;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        DocumentStoreConfig config = DocumentStoreConfig.newBuilder()
                .setClock(clock)
                .setMaxReadStaleness(Duration.ofSeconds(60))
                .setTransactionTimeout(Duration.ofSeconds(270))
                .setVersionRetention(Duration.ofSeconds(60))
                .build();
        service = new DocumentService(DATABASE, config, MoreExecutors.directExecutor());
    }

    private CommitResponse set(Document... documents) {
        List<Write> writes = new ArrayList<>();
        for (Document document : documents) {
            writes.add(Write.update(document));
        }
        return service.commit(null, writes);
    }

    private static List<String> ids(List<Document> documents) {
        List<String> ids = new ArrayList<>();
        for (Document document : documents) {
            ids.add(document.getId());
        }
        return ids;
    }

    @Test
    void getDocument() {
        set(doc("rooms/a", "size", 3, "color", "red"));
        Document document = service.getDocument(name("rooms/a"), null, ReadOptions.latest());
        assertEquals(value(3), document.getFields().get("size"));
        assertNotNull(document.getCreateTime());

        Document projected = service.getDocument(name("rooms/a"), DocumentMask.parse("color"), ReadOptions.latest());
        assertThat(projected.getFields().keySet(), contains("color"));

        DocumentStoreExceptions.NotFoundException e = assertThrows(DocumentStoreExceptions.NotFoundException.class,
                () -> service.getDocument(name("rooms/b"), null, ReadOptions.latest()));
        assertEquals(Status.Code.NOT_FOUND, e.getCode());
    }

    @Test
    void getDocumentAtReadTime() {
        Timestamp first = set(doc("rooms/a", "size", 1)).getCommitTime();
        set(doc("rooms/a", "size", 2));
        assertEquals(value(1), service.getDocument(name("rooms/a"), null, ReadOptions.readTime(first))
                .getFields().get("size"));
        assertEquals(value(2), service.getDocument(name("rooms/a"), null, ReadOptions.latest())
                .getFields().get("size"));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.getDocument(name("rooms/a"), null, ReadOptions.newTransaction(TransactionOptions.readWrite())));
    }

    @Test
    void createDocument() {
        Document created = service.createDocument(ROOT, "rooms", "a", fields("size", 3), null);
        assertEquals(name("rooms/a"), created.getName());
        assertEquals(created.getCreateTime(), created.getUpdateTime());

        DocumentStoreExceptions.AlreadyExistsException e = assertThrows(DocumentStoreExceptions.AlreadyExistsException.class,
                () -> service.createDocument(ROOT, "rooms", "a", fields("size", 4), null));
        assertEquals(Status.Code.ALREADY_EXISTS, e.getCode());
        assertEquals(value(3), service.getDocument(name("rooms/a"), null, ReadOptions.latest()).getFields().get("size"));

        Document generated = service.createDocument(name("rooms/a"), "walls", null, fields("n", 1), DocumentMask.parse("n"));
        assertEquals(20, generated.getId().length());
        assertEquals("walls", generated.getCollectionId());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.createDocument(ROOT, "rooms/x", "b", fields(), null));
    }

    @Test
    void updateDocument() {
        set(doc("rooms/a", "size", 3, "color", "red"));
        Document updated = service.updateDocument(doc("rooms/a", "color", "blue", "ignored", true),
                DocumentMask.parse("color", "gone"), null, Precondition.exists(true));
        assertEquals(fields("size", 3, "color", "blue"), updated.getFields());

        Document replaced = service.updateDocument(doc("rooms/a", "only", 1), null, null, Precondition.NONE);
        assertEquals(fields("only", 1), replaced.getFields());

        DocumentStoreExceptions.FailedPreconditionException e = assertThrows(
                DocumentStoreExceptions.FailedPreconditionException.class,
                () -> service.updateDocument(doc("rooms/b", "x", 1), null, null, Precondition.exists(true)));
        assertEquals(0, e.getWriteIndex());
    }

    @Test
    void deleteDocument() {
        Timestamp written = set(doc("rooms/a", "size", 3)).getCommitTime();
        set(doc("rooms/b", "size", 4));
        Timestamp bWritten = service.getDocument(name("rooms/b"), null, ReadOptions.latest()).getUpdateTime();

        assertThrows(DocumentStoreExceptions.FailedPreconditionException.class,
                () -> service.deleteDocument(name("rooms/b"), Precondition.updateTime(written)));
        service.deleteDocument(name("rooms/b"), Precondition.updateTime(bWritten));
        service.deleteDocument(name("rooms/missing"), Precondition.NONE);
        assertThrows(DocumentStoreExceptions.NotFoundException.class,
                () -> service.getDocument(name("rooms/b"), null, ReadOptions.latest()));
    }

    @Test
    void listDocumentsPagesAtOneReadTime() {
        set(doc("rooms/a", "n", 1), doc("rooms/b", "n", 2), doc("rooms/c", "n", 3), doc("halls/x", "n", 4));

        ListDocumentsResponse first = service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                .setPageSize(2)
                .build());
        assertThat(ids(first.getDocuments()), contains("a", "b"));
        assertFalse(first.getNextPageToken().isEmpty());

        set(doc("rooms/aa", "n", 5));
        ListDocumentsResponse second = service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                .setPageSize(2)
                .setPageToken(first.getNextPageToken())
                .build());
        assertThat(ids(second.getDocuments()), contains("c"));
        assertEquals("", second.getNextPageToken());

        ListDocumentsResponse all = service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                .setOrderBy(Order.descending("n"))
                .setMask(DocumentMask.parse("n"))
                .build());
        assertThat(ids(all.getDocuments()), contains("aa", "c", "b", "a"));
    }

    @Test
    void listDocumentsShowsMissing() {
        set(doc("rooms/a", "n", 1), doc("rooms/ghost/walls/w", "n", 2));
        ListDocumentsResponse response = service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                .setShowMissing(true)
                .build());
        assertThat(ids(response.getDocuments()), contains("a", "ghost"));
        assertTrue(response.getDocuments().get(1).isMissing());

        assertThat(ids(service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms").build()).getDocuments()),
                contains("a"));
    }

    @Test
    void invalidListDocuments() {
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms").setPageSize(-1).build()));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                        .setShowMissing(true)
                        .setOrderBy(Order.ascending("n"))
                        .build()));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.listDocuments(ListDocumentsRequest.newBuilder(ROOT, "rooms")
                        .setPageToken("not a token!")
                        .build()));
    }

    @Test
    void batchGetDocumentsBeginsTransaction() {
        set(doc("rooms/a", "n", 1));
        List<BatchGetDocumentsResponse> responses = service.batchGetDocuments(
                ImmutableList.of(name("rooms/a"), name("rooms/b")), null,
                ReadOptions.newTransaction(TransactionOptions.readWrite())).asList();
        assertThat(responses, hasSize(2));
        assertTrue(responses.get(0).isFound());
        assertEquals(name("rooms/a"), responses.get(0).getFound().getName());
        assertFalse(responses.get(1).isFound());
        assertEquals(name("rooms/b"), responses.get(1).getMissing());
        assertEquals(responses.get(0).getReadTime(), responses.get(1).getReadTime());

        ByteString transaction = responses.get(0).getTransaction();
        assertNotNull(transaction);
        assertNull(responses.get(1).getTransaction());

        // the transaction read both documents, so a concurrent write to one of them aborts it
        set(doc("rooms/b", "n", 2));
        assertThrows(DocumentStoreExceptions.AbortedException.class,
                () -> service.commit(transaction, ImmutableList.of(Write.update(doc("rooms/a", "n", 3)))));
    }

    @Test
    void batchGetDocumentsNeedsADocumentToBeginTransaction() {
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.batchGetDocuments(ImmutableList.of(), null,
                        ReadOptions.newTransaction(TransactionOptions.readOnly())));
        assertThat(service.batchGetDocuments(ImmutableList.of(), null, ReadOptions.latest()).asList(), empty());
    }

    @Test
    void transactionLifecycle() {
        set(doc("rooms/a", "n", 1));
        ByteString transaction = service.beginTransaction(TransactionOptions.readWrite());
        Document read = service.getDocument(name("rooms/a"), null, ReadOptions.transaction(transaction));
        assertEquals(value(1), read.getFields().get("n"));

        CommitResponse response = service.commit(transaction,
                ImmutableList.of(Write.update(doc("rooms/a", "n", 2))));
        assertThat(response.getWriteResults(), hasSize(1));
        assertEquals(response.getCommitTime(), response.getWriteResults().get(0).getUpdateTime());

        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.commit(transaction, ImmutableList.of()));

        ByteString rolledBack = service.beginTransaction(TransactionOptions.readWrite());
        service.rollback(rolledBack);
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.getDocument(name("rooms/a"), null, ReadOptions.transaction(rolledBack)));
    }

    @Test
    void runQuery() {
        Timestamp first = set(doc("rooms/a", "n", 1), doc("rooms/b", "n", 2)).getCommitTime();
        set(doc("rooms/c", "n", 3));
        StructuredQuery query = StructuredQuery.newBuilder()
                .from("rooms")
                .where(Filter.field("n", FieldFilter.Operator.GREATER_THAN_OR_EQUAL, value(2)))
                .build();

        List<String> latest = new ArrayList<>();
        for (RunQueryResponse response : service.runQuery(ROOT, query, ReadOptions.latest()).asList()) {
            if (response.getDocument() != null) {
                latest.add(response.getDocument().getId());
            }
        }
        assertThat(latest, contains("b", "c"));

        List<RunQueryResponse> past = service.runQuery(ROOT, query, ReadOptions.readTime(first)).asList();
        assertThat(past, hasSize(1));
        assertEquals("b", past.get(0).getDocument().getId());
        assertEquals(first, past.get(0).getReadTime());

        List<RunQueryResponse> transactional = service.runQuery(ROOT, query,
                ReadOptions.newTransaction(TransactionOptions.readOnly())).asList();
        assertNotNull(transactional.get(0).getTransaction());

        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.runQuery(ROOT, StructuredQuery.newBuilder().build(), ReadOptions.latest()));
    }

    @Test
    void runAggregationQuery() {
        Timestamp first = set(doc("rooms/a", "n", 1), doc("rooms/b", "n", 2)).getCommitTime();
        set(doc("rooms/c", "n", 3.5));
        AggregationQuery aggregation = AggregationQuery.of(StructuredQuery.newBuilder().from("rooms").build(),
                AggregateField.count(), AggregateField.sum("n"));

        RunAggregationQueryResponse latest = service.runAggregationQuery(ROOT, aggregation, ReadOptions.latest());
        assertEquals(Value.integerValue(3), latest.get("aggregate_0"));
        assertEquals(Value.doubleValue(6.5), latest.get("aggregate_1"));
        assertNull(latest.getTransaction());

        RunAggregationQueryResponse past = service.runAggregationQuery(ROOT, aggregation, ReadOptions.readTime(first));
        assertEquals(Value.integerValue(2), past.get("aggregate_0"));
        assertEquals(Value.integerValue(3), past.get("aggregate_1"));
        assertEquals(first, past.getReadTime());

        // a new document in the aggregated collection changes the count, so the transaction aborts
        ByteString transaction = service.runAggregationQuery(ROOT, aggregation,
                ReadOptions.newTransaction(TransactionOptions.readWrite())).getTransaction();
        assertNotNull(transaction);
        set(doc("rooms/d", "n", 4));
        assertThrows(DocumentStoreExceptions.AbortedException.class,
                () -> service.commit(transaction, ImmutableList.of(Write.update(doc("halls/x", "n", 1)))));
    }

    @Test
    void listCollectionIds() {
        set(doc("rooms/a", "n", 1), doc("halls/x", "n", 2), doc("attics/y", "n", 3),
                doc("rooms/a/walls/w", "n", 4), doc("rooms/a/doors/d", "n", 5));

        ListCollectionIdsResponse first = service.listCollectionIds(ROOT, 2, "", ReadOptions.latest());
        assertThat(first.getCollectionIds(), contains("attics", "halls"));
        ListCollectionIdsResponse second = service.listCollectionIds(ROOT, 2, first.getNextPageToken(),
                ReadOptions.latest());
        assertThat(second.getCollectionIds(), contains("rooms"));
        assertEquals("", second.getNextPageToken());

        assertThat(service.listCollectionIds(name("rooms/a"), 0, "", ReadOptions.latest()).getCollectionIds(),
                contains("doors", "walls"));

        ByteString transaction = service.beginTransaction(TransactionOptions.readOnly());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.listCollectionIds(ROOT, 0, "", ReadOptions.transaction(transaction)));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.listCollectionIds(ROOT, -1, "", ReadOptions.latest()));
    }

    @Test
    void batchWriteAppliesWritesIndependently() {
        set(doc("rooms/a", "n", 1));
        BatchWriteResponse response = service.batchWrite(ImmutableList.of(
                Write.update(doc("rooms/b", "n", 2)),
                Write.update(doc("rooms/a", "n", 3)).withPrecondition(Precondition.exists(false)),
                Write.delete(name("rooms/c"))));

        assertEquals(Status.Code.OK, response.getStatus(0).getCode());
        assertNotNull(response.getWriteResult(0).getUpdateTime());
        assertEquals(Status.Code.FAILED_PRECONDITION, response.getStatus(1).getCode());
        assertNull(response.getWriteResult(1).getUpdateTime());
        assertEquals(Status.Code.OK, response.getStatus(2).getCode());

        assertEquals(value(2), service.getDocument(name("rooms/b"), null, ReadOptions.latest()).getFields().get("n"));
        assertEquals(value(1), service.getDocument(name("rooms/a"), null, ReadOptions.latest()).getFields().get("n"));

        DocumentStoreExceptions.InvalidArgumentException e = assertThrows(
                DocumentStoreExceptions.InvalidArgumentException.class,
                () -> service.batchWrite(ImmutableList.of(Write.delete(name("rooms/a")), Write.delete(name("rooms/a")))));
        assertThat(e.getMessage(), startsWith("a batch write may not write a document twice"));
    }

    @Test
    void maintainPrunesUnreadableVersions() {
        set(doc("rooms/a", "n", 1));
        set(doc("rooms/a", "n", 2));
        clock.advance(Duration.ofSeconds(120));
        assertEquals(1, service.maintain());
        assertEquals(0, service.maintain());
        assertEquals(value(2), service.getDocument(name("rooms/a"), null, ReadOptions.latest()).getFields().get("n"));
    }

    @Test
    void maintainKeepsVersionsActiveTransactionsRead() {
        set(doc("rooms/a", "n", 1));
        ByteString transaction = service.beginTransaction(TransactionOptions.readOnly());
        set(doc("rooms/a", "n", 2));
        clock.advance(Duration.ofSeconds(120));
        assertEquals(0, service.maintain());
        assertEquals(value(1), service.getDocument(name("rooms/a"), null, ReadOptions.transaction(transaction))
                .getFields().get("n"));

        service.rollback(transaction);
        assertEquals(1, service.maintain());
    }

    @Test
    void maintainForgetsAbandonedWriteStreams() {
        RecordingObserver<WriteResponse> abandonedResponses = new RecordingObserver<>();
        StreamObserver<WriteRequest> abandoned = service.write(abandonedResponses);
        abandoned.onNext(WriteRequest.handshake());
        abandoned.onError(new IllegalStateException("connection reset"));

        RecordingObserver<WriteResponse> openResponses = new RecordingObserver<>();
        service.write(openResponses).onNext(WriteRequest.handshake());
        assertEquals(2, service.getWriteStreams().size());

        clock.advance(Duration.ofSeconds(271));
        service.maintain();
        assertEquals(1, service.getWriteStreams().size());
        assertTrue(service.getWriteStreams().contains(openResponses.last().getStreamId()));
    }
}
