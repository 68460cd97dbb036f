/*
 * WritePipelineTest.java
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

package org.docstore.write;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Durations;
import com.google.protobuf.util.Timestamps;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.FieldPath;
import org.docstore.model.FieldTransform;
import org.docstore.model.Precondition;
import org.docstore.model.Value;
import org.docstore.model.Write;
import org.docstore.model.WriteResult;
import org.docstore.storage.DocumentSource;
import org.docstore.storage.DocumentStore;
import org.docstore.test.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.docstore.test.TestDocuments.DATABASE;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.fields;
import static org.docstore.test.TestDocuments.name;
import static org.docstore.test.TestDocuments.put;
import static org.docstore.test.TestDocuments.value;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WritePipeline}.
 */
class WritePipelineTest {
    private WritePipeline pipeline;
    private DocumentStore store;
    private Timestamp seeded;
    private Timestamp commitTime;

    @BeforeEach
    void setUp() {
        pipeline = new WritePipeline(DATABASE);
        store = new DocumentStore(new ManualClock());
        seeded = put(store, doc("rooms/a", "count", 1, "nested", ImmutableMap.of("x", 1, "y", 2), "title", "old"));
        commitTime = Timestamps.add(seeded, Durations.fromSeconds(5));
    }

    private DocumentSource latest() {
        return store.snapshot(store.currentReadTime());
    }

    private WritePipeline.AppliedBatch apply(Write... writes) {
        List<Write> batch = ImmutableList.copyOf(writes);
        pipeline.validate(batch);
        return pipeline.apply(batch, latest(), commitTime);
    }

    private static Value field(Document document, String path) {
        return document.getValue(FieldPath.parse(path)).orElse(null);
    }

    @Test
    void preconditionsAreCheckedInOrder() {
        WritePipeline.AppliedBatch created = apply(
                Write.update(doc("rooms/b", "v", 1)).withPrecondition(Precondition.exists(false)),
                Write.update(doc("rooms/b", "v", 2)).withPrecondition(Precondition.exists(true)));
        Document b = created.getMutations().get(DATABASE.parseDocumentName(name("rooms/b")));
        assertEquals(value(2), field(b, "v"));
        assertEquals(commitTime, b.getCreateTime());

        DocumentStoreExceptions.FailedPreconditionException e = assertThrows(
                DocumentStoreExceptions.FailedPreconditionException.class,
                () -> apply(Write.delete(name("rooms/a")),
                        Write.update(doc("rooms/a", "v", 1)).withPrecondition(Precondition.exists(true))));
        assertEquals(1, e.getWriteIndex());

        assertThrows(DocumentStoreExceptions.FailedPreconditionException.class,
                () -> apply(Write.delete(name("rooms/a")).withPrecondition(Precondition.updateTime(commitTime))));
        WritePipeline.AppliedBatch deleted = apply(
                Write.delete(name("rooms/a")).withPrecondition(Precondition.updateTime(seeded)));
        assertTrue(deleted.getMutations().contains(DATABASE.parseDocumentName(name("rooms/a"))));
        assertNull(deleted.getWriteResults().get(0).getUpdateTime());
    }

    @Test
    void deletingMissingDocumentChangesNothing() {
        WritePipeline.AppliedBatch batch = apply(Write.delete(name("rooms/nope")));
        assertTrue(batch.getMutations().isEmpty());
        assertThat(batch.getWriteResults(), hasSize(1));
    }

    @Test
    void maskedUpdateMergesFields() {
        Document update = doc("rooms/a", "nested", ImmutableMap.of("x", 10), "title", "ignored", "extra", true);
        WritePipeline.AppliedBatch batch = apply(Write.update(update, DocumentMask.parse("nested.x", "count", "extra")));
        Document a = batch.getMutations().get(DATABASE.parseDocumentName(name("rooms/a")));
        assertEquals(value(10), field(a, "nested.x"));
        assertEquals(value(2), field(a, "nested.y"));
        assertEquals(value("old"), field(a, "title"));
        assertEquals(value(true), field(a, "extra"));
        // masked but absent from the document means delete
        assertNull(field(a, "count"));
        assertEquals(seeded, a.getCreateTime());
        assertEquals(commitTime, a.getUpdateTime());
    }

    @Test
    void unchangedDocumentKeepsUpdateTime() {
        WritePipeline.AppliedBatch batch = apply(Write.update(
                doc("rooms/a", "count", 1, "nested", ImmutableMap.of("x", 1, "y", 2), "title", "old")));
        assertTrue(batch.getMutations().isEmpty());
        assertEquals(seeded, batch.getWriteResults().get(0).getUpdateTime());
    }

    @Test
    void transformsReportResults() {
        WritePipeline.AppliedBatch batch = apply(Write.transform(name("rooms/a"),
                FieldTransform.increment(FieldPath.of("count"), value(2.5)),
                FieldTransform.serverTimestamp(FieldPath.of("touched")),
                FieldTransform.appendMissingElements(FieldPath.of("tags"), ImmutableList.of(value("a"), value("a"))),
                FieldTransform.maximum(FieldPath.parse("nested.x"), value(0))));
        WriteResult result = batch.getWriteResults().get(0);
        assertThat(result.getTransformResults(), contains(
                value(3.5), Value.timestampValue(commitTime), Value.nullValue(), value(1)));
        Document a = batch.getMutations().get(DATABASE.parseDocumentName(name("rooms/a")));
        assertEquals(value(ImmutableList.of("a")), field(a, "tags"));
        assertEquals(value("old"), field(a, "title"));
    }

    @Test
    void numericTransformEdgeCases() {
        put(store, doc("rooms/n", "big", Long.MAX_VALUE, "text", "abc", "nan", Double.NaN, "list", ImmutableList.of(1, 2, 1)));
        WritePipeline.AppliedBatch batch = apply(Write.transform(name("rooms/n"),
                FieldTransform.increment(FieldPath.of("big"), value(1)),
                FieldTransform.increment(FieldPath.of("text"), value(7)),
                FieldTransform.minimum(FieldPath.of("nan"), value(3)),
                FieldTransform.removeAllFromArray(FieldPath.of("list"), ImmutableList.of(value(1.0)))));
        Document n = batch.getMutations().get(DATABASE.parseDocumentName(name("rooms/n")));
        assertEquals(value(Long.MAX_VALUE), field(n, "big"));
        assertEquals(value(7), field(n, "text"));
        assertTrue(field(n, "nan").isNaN());
        assertEquals(value(ImmutableList.of(2)), field(n, "list"));
    }

    @Test
    void transformOnMissingDocumentCreatesIt() {
        WritePipeline.AppliedBatch batch = apply(Write.transform(name("rooms/new"),
                FieldTransform.increment(FieldPath.of("n"), value(4))));
        Document created = batch.getMutations().get(DATABASE.parseDocumentName(name("rooms/new")));
        assertEquals(fields("n", 4), created.getFields());
    }

    @Test
    void laterWritesSeeEarlierOnes() {
        WritePipeline.AppliedBatch batch = apply(
                Write.update(doc("rooms/c", "n", 1)),
                Write.transform(name("rooms/c"), FieldTransform.increment(FieldPath.of("n"), value(1))));
        Document c = batch.getMutations().get(DATABASE.parseDocumentName(name("rooms/c")));
        assertEquals(value(2), field(c, "n"));
    }

    @Test
    void updateTransformsApplyAfterTheUpdate() {
        Write write = Write.update(doc("rooms/a", "count", 5), DocumentMask.parse("count"))
                .withUpdateTransforms(FieldTransform.serverTimestamp(FieldPath.of("at")));
        Document a = apply(write).getMutations().get(DATABASE.parseDocumentName(name("rooms/a")));
        assertEquals(value(5), field(a, "count"));
        assertEquals(Value.timestampValue(commitTime), field(a, "at"));
    }

    @Test
    void invalidWrites() {
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.delete("projects/other/databases/(default)/documents/a/b"))));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.delete(name("rooms")))));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.transform(name("rooms/a"),
                        FieldTransform.increment(FieldPath.of("n"), value(1)),
                        FieldTransform.serverTimestamp(FieldPath.of("n"))))));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.update(doc("rooms/a", "n", 1), DocumentMask.parse("n"))
                        .withUpdateTransforms(FieldTransform.serverTimestamp(FieldPath.of("n"))))));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.update(doc("rooms/a", "__name__", "x")))));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> FieldTransform.increment(FieldPath.of("n"), value("one")));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> pipeline.validate(ImmutableList.of(Write.update(doc("rooms/a", "n", 1), DocumentMask.parse("n", "n.m")))));
    }

    @Test
    void appliedDocumentsAreReusedWhenUnchanged() {
        Document current = latest().get(DATABASE.parseDocumentName(name("rooms/a")));
        WritePipeline.AppliedBatch batch = apply(Write.transform(name("rooms/a"),
                FieldTransform.maximum(FieldPath.of("count"), value(0))));
        assertTrue(batch.getMutations().isEmpty());
        assertEquals(current.getUpdateTime(), batch.getWriteResults().get(0).getUpdateTime());
    }

    @Test
    void appendingPresentElementsIsIdempotent() {
        Timestamp tagged = put(store, doc("rooms/t", "tags", ImmutableList.of("a", "b")));
        Document before = latest().get(DATABASE.parseDocumentName(name("rooms/t")));
        WritePipeline.AppliedBatch batch = apply(Write.transform(name("rooms/t"),
                FieldTransform.appendMissingElements(FieldPath.of("tags"), ImmutableList.of(value("b"), value("a")))));
        assertTrue(batch.getMutations().isEmpty());
        assertEquals(tagged, batch.getWriteResults().get(0).getUpdateTime());
        assertEquals(before, latest().get(DATABASE.parseDocumentName(name("rooms/t"))));
    }
}
