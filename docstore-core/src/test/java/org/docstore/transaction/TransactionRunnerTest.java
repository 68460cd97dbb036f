/*
 * TransactionRunnerTest.java
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
import com.google.common.util.concurrent.MoreExecutors;
import org.apache.logging.log4j.Level;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;
import org.docstore.model.Value;
import org.docstore.model.Write;
import org.docstore.query.StructuredQuery;
import org.docstore.service.DocumentService;
import org.docstore.test.LogAppenderExtension;
import org.docstore.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.docstore.test.TestDocuments.DATABASE;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.name;
import static org.docstore.test.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TransactionRunner}.
 */
class TransactionRunnerTest {
    @RegisterExtension
    final LogAppenderExtension logs = new LogAppenderExtension(TransactionRunner.class, Level.WARN);

    private DocumentService service;
    private TransactionRunner runner;

    @BeforeEach
    void setUp() {
        DocumentStoreConfig config = DocumentStoreConfig.newBuilder().setClock(new ManualClock()).build();
        service = new DocumentService(DATABASE, config, MoreExecutors.directExecutor());
        service.commit(null, ImmutableList.of(Write.update(doc("counters/c", "n", 1))));
        runner = new TransactionRunner(service, 3, 1, 5, 2.0);
    }

    private Value current() {
        return service.getDocument(name("counters/c"), null, ReadOptions.latest()).getFields().get("n");
    }

    private static long increment(Transaction transaction) {
        Document counter = transaction.get(name("counters/c"));
        long next = counter.getFields().get("n").getIntegerValue() + 1;
        transaction.set(doc("counters/c", "n", next));
        return next;
    }

    @Test
    void commitsTheBufferedWrites() {
        long result = runner.run(TransactionRunnerTest::increment);
        assertEquals(2L, result);
        assertEquals(value(2), current());
        assertThat(logs.getMessages(), empty());
    }

    @Test
    void retriesAfterConflict() {
        AtomicInteger attempts = new AtomicInteger();
        long result = runner.run(transaction -> {
            long next = increment(transaction);
            if (attempts.incrementAndGet() == 1) {
                service.commit(null, ImmutableList.of(Write.update(doc("counters/c", "n", 10))));
            }
            return next;
        });
        assertEquals(2, attempts.get());
        assertEquals(11L, result);
        assertEquals(value(11), current());
        assertThat(logs.getMessages(), hasSize(1));
        assertThat(logs.getMessages().get(0), startsWith("retrying transaction"));
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(DocumentStoreExceptions.AbortedException.class, () -> runner.run(transaction -> {
            long next = increment(transaction);
            service.commit(null, ImmutableList.of(Write.update(doc("counters/c", "n", 100 + attempts.incrementAndGet()))));
            return next;
        }));
        assertEquals(3, attempts.get());
        assertEquals(value(103), current());
        assertThat(logs.getMessages(), hasSize(2));
    }

    @Test
    void functionFailureRollsBackWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner.run(transaction -> {
            attempts.incrementAndGet();
            increment(transaction);
            throw new IllegalStateException("boom");
        }));
        assertEquals("boom", e.getMessage());
        assertEquals(1, attempts.get());
        assertEquals(value(1), current());
        assertNull(service.getCoordinator().oldestActiveReadTime());
    }

    @Test
    void permanentErrorsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(DocumentStoreExceptions.FailedPreconditionException.class, () -> runner.run(transaction -> {
            attempts.incrementAndGet();
            return transaction.create(doc("counters/c", "n", 0));
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void readsMustPrecedeWrites() {
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class, () -> runner.run(transaction -> {
            transaction.set(doc("counters/d", "n", 0));
            return transaction.get(name("counters/c"));
        }));
    }

    @Test
    void queriesInsideTransactions() {
        Document[] seen = runner.run(transaction -> transaction.query(DATABASE.getDocumentsRoot().canonicalString(),
                StructuredQuery.newBuilder().from("counters").build()).toArray(new Document[0]));
        assertThat(ImmutableList.copyOf(seen).stream().map(Document::getId).collect(Collectors.toList()),
                contains("c"));
    }
}
