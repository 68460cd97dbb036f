/*
 * DocumentStoreTest.java
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
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.docstore.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.docstore.test.TestDocuments.DATABASE;
import static org.docstore.test.TestDocuments.delete;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.name;
import static org.docstore.test.TestDocuments.put;
import static org.docstore.test.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentStore}.
 */
class DocumentStoreTest {
    private ManualClock clock;
    private DocumentStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new DocumentStore(clock);
    }

    @Test
    void snapshotsAreStable() {
        put(store, doc("c/a", "v", 1));
        Timestamp before = store.currentReadTime();
        put(store, doc("c/a", "v", 2));
        delete(store, "c/a");

        DocumentSource old = store.snapshot(before);
        Document a = old.get(path("c/a"));
        assertNotNull(a);
        assertEquals(value(1), a.getFields().get("v"));
        assertNull(store.snapshot(store.currentReadTime()).get(path("c/a")));
    }

    @Test
    void commitTimesIncreaseWithAFrozenClock() {
        Timestamp first = put(store, doc("c/a"));
        Timestamp read = store.currentReadTime();
        Timestamp second = put(store, doc("c/b"));
        assertThat(Timestamps.compare(read, first), greaterThanOrEqualTo(0));
        assertThat(Timestamps.compare(second, read), greaterThan(0));
        assertThat(Timestamps.compare(store.currentReadTime(), second), greaterThanOrEqualTo(0));
    }

    @Test
    void scanReturnsDescendantsInPathOrder() {
        put(store, doc("c/b"), doc("c/a/sub/x"), doc("c/a"), doc("d/z"));
        List<String> names = store.snapshot(store.currentReadTime()).scan(DATABASE.collectionPath("c")).stream()
                .map(Document::getName)
                .collect(Collectors.toList());
        assertThat(names, contains(name("c/a"), name("c/a/sub/x"), name("c/b")));
    }

    @Test
    void createTimeIsKept() {
        Timestamp created = put(store, doc("c/a", "v", 1));
        clock.advance(Duration.ofSeconds(1));
        Timestamp updated = put(store, doc("c/a", "v", 2));
        Document a = store.snapshot(store.currentReadTime()).get(path("c/a"));
        assertNotNull(a);
        assertEquals(created, a.getCreateTime());
        assertEquals(updated, a.getUpdateTime());
        assertEquals(updated, store.lastChangeTime(path("c/a")));
    }

    @Test
    void listenersSeeBeforeAndAfter() {
        List<CommitEvent> events = new ArrayList<>();
        CommitListener listener = events::add;
        store.addListener(listener);
        put(store, doc("c/a", "v", 1));
        put(store, doc("c/a", "v", 2));
        store.removeListener(listener);
        put(store, doc("c/a", "v", 3));

        assertThat(events, hasSize(2));
        DocumentMutation mutation = events.get(1).getMutations().get(0);
        assertEquals(value(1), mutation.getBefore().getFields().get("v"));
        assertEquals(value(2), mutation.getAfter().getFields().get("v"));
    }

    @Test
    void pruneDiscardsUnreachableVersions() {
        put(store, doc("c/a", "v", 1));
        Timestamp old = store.currentReadTime();
        clock.advance(Duration.ofSeconds(1));
        put(store, doc("c/a", "v", 2));
        Timestamp horizon = store.currentReadTime();
        put(store, doc("c/a", "v", 3));
        delete(store, "c/b");

        assertEquals(1, store.prune(horizon));
        assertEquals(horizon, store.getEarliestReadTime());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class, () -> store.snapshot(old));
        Document atHorizon = store.snapshot(horizon).get(path("c/a"));
        assertNotNull(atHorizon);
        assertEquals(value(2), atHorizon.getFields().get("v"));
        assertEquals(0, store.prune(old));
    }

    @Test
    void prunedDeletionsDisappear() {
        put(store, doc("c/a"));
        delete(store, "c/a");
        store.prune(store.currentReadTime());
        assertNull(store.lastChangeTime(path("c/a")));
        assertTrue(store.snapshot(store.currentReadTime()).scan(DATABASE.collectionPath("c")).isEmpty());
    }

    private static ResourcePath path(String relativePath) {
        return DATABASE.parseDocumentName(name(relativePath));
    }
}
