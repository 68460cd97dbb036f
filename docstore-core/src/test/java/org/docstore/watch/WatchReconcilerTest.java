/*
 * WatchReconcilerTest.java
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

package org.docstore.watch;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.grpc.Status;
import org.docstore.listen.DocumentChange;
import org.docstore.listen.DocumentDelete;
import org.docstore.listen.ExistenceFilter;
import org.docstore.listen.ListenRequest;
import org.docstore.listen.ListenResponse;
import org.docstore.listen.ResumeTokens;
import org.docstore.listen.Target;
import org.docstore.listen.TargetChange;
import org.docstore.model.Document;
import org.docstore.query.QueryComparator;
import org.docstore.query.StructuredQuery;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.docstore.test.TestDocuments.ROOT;
import static org.docstore.test.TestDocuments.doc;
import static org.docstore.test.TestDocuments.name;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WatchReconciler}.
 */
class WatchReconcilerTest {
    private static final Target ROOMS = Target.query(1, ROOT, StructuredQuery.newBuilder().from("rooms").build());
    private static final Document A = doc("rooms/a", "v", 1);
    private static final Document B = doc("rooms/b", "v", 1);
    private static final Document C = doc("rooms/c", "v", 1);

    private static Timestamp time(long seconds) {
        return Timestamp.newBuilder().setSeconds(seconds).build();
    }

    private static ByteString token(long seconds) {
        return ResumeTokens.fromReadTime(time(seconds));
    }

    private static ListenResponse change(TargetChange.Type type, int... targetIds) {
        return ListenResponse.of(TargetChange.of(type, targetIds));
    }

    private static ListenResponse current(long seconds, int... targetIds) {
        return ListenResponse.of(new TargetChange(TargetChange.Type.CURRENT,
                Ints.asList(targetIds),
                null, token(seconds), time(seconds)));
    }

    private static ListenResponse noChange(long seconds) {
        return ListenResponse.of(TargetChange.noChange(token(seconds), time(seconds)));
    }

    private static ListenResponse document(Document document, int... targetIds) {
        return ListenResponse.of(new DocumentChange(document,
                Ints.asList(targetIds), ImmutableList.of()));
    }

    private static List<String> ids(QuerySnapshot snapshot) {
        return snapshot.getDocuments().stream().map(Document::getId).collect(Collectors.toList());
    }

    private static List<String> changes(QuerySnapshot snapshot) {
        return snapshot.getChanges().stream()
                .map(change -> change.getType() + " " + change.getDocument().getId() + " "
                               + change.getOldIndex() + "->" + change.getNewIndex())
                .collect(Collectors.toList());
    }

    private static List<String> requests(WatchReconciler.Effects effects) {
        return effects.getRequests().stream()
                .map(request -> request.getKind() == ListenRequest.Kind.ADD_TARGET
                                ? "add " + request.getAddTarget().getTargetId()
                                  + (request.getAddTarget().getResumeToken() == null ? ""
                                     : " from " + ResumeTokens.toReadTime(request.getAddTarget().getResumeToken()).getSeconds())
                                : "remove " + request.getRemoveTarget())
                .collect(Collectors.toList());
    }

    /**
     * Add the rooms target and bring it to a published snapshot of {@code A} and {@code B} at time 10.
     */
    private static WatchReconciler active(ExistenceFilterPolicy policy) {
        WatchReconciler reconciler = new WatchReconciler(policy);
        reconciler.addTarget(ROOMS);
        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        reconciler.onResponse(document(A, 1));
        reconciler.onResponse(document(B, 1));
        assertThat(reconciler.onResponse(current(10, 1)).getSnapshots(), hasSize(1));
        return reconciler;
    }

    @Test
    void initialSnapshotAtCurrent() {
        WatchReconciler reconciler = new WatchReconciler(ExistenceFilterPolicy.RESET_STREAM);
        WatchReconciler.Effects added = reconciler.addTarget(ROOMS);
        assertThat(requests(added), contains("add 1"));
        assertEquals(WatchTargetState.PENDING, reconciler.getState(1));

        // nothing is accepted before the server acknowledges the target
        assertTrue(reconciler.onResponse(document(C, 1)).isEmpty());
        assertEquals(0, reconciler.getDocumentCount(1));

        assertTrue(reconciler.onResponse(change(TargetChange.Type.ADD, 1)).isEmpty());
        assertEquals(WatchTargetState.SYNCING, reconciler.getState(1));
        assertTrue(reconciler.onResponse(document(A, 1)).isEmpty());
        assertTrue(reconciler.onResponse(document(B, 1)).isEmpty());

        WatchReconciler.Effects effects = reconciler.onResponse(current(10, 1));
        assertThat(effects.getSnapshots(), hasSize(1));
        QuerySnapshot snapshot = effects.getSnapshots().get(0);
        assertThat(ids(snapshot), contains("a", "b"));
        assertThat(changes(snapshot), contains("ADDED a -1->0", "ADDED b -1->1"));
        assertEquals(time(10), snapshot.getReadTime());
        assertEquals(WatchTargetState.ACTIVE, reconciler.getState(1));
        assertEquals(token(10), reconciler.getResumeToken(1));
    }

    @Test
    void currentWithoutReadTimeWaitsForNoChange() {
        WatchReconciler reconciler = new WatchReconciler(ExistenceFilterPolicy.RESET_STREAM);
        reconciler.addTarget(ROOMS);
        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        reconciler.onResponse(document(A, 1));
        assertTrue(reconciler.onResponse(ListenResponse.of(new TargetChange(TargetChange.Type.CURRENT,
                ImmutableList.of(1), null, token(5), null))).getSnapshots().isEmpty());
        assertEquals(WatchTargetState.CURRENT, reconciler.getState(1));

        QuerySnapshot snapshot = reconciler.onResponse(noChange(5)).getSnapshots().get(0);
        assertThat(ids(snapshot), contains("a"));
    }

    @Test
    void emptyResultIsStillPublished() {
        WatchReconciler reconciler = new WatchReconciler(ExistenceFilterPolicy.RESET_STREAM);
        reconciler.addTarget(ROOMS);
        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        List<QuerySnapshot> snapshots = reconciler.onResponse(current(3, 1)).getSnapshots();
        assertThat(snapshots, hasSize(1));
        assertTrue(snapshots.get(0).isEmpty());
    }

    @Test
    void incrementalChanges() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        Document modified = doc("rooms/a", "v", 2);
        reconciler.onResponse(document(modified, 1));
        reconciler.onResponse(document(C, 1));
        reconciler.onResponse(ListenResponse.of(new DocumentDelete(name("rooms/b"), ImmutableList.of(1), time(11))));
        assertTrue(reconciler.onResponse(document(C, 1)).getSnapshots().isEmpty());

        QuerySnapshot snapshot = reconciler.onResponse(noChange(12)).getSnapshots().get(0);
        assertThat(ids(snapshot), contains("a", "c"));
        assertThat(changes(snapshot), contains("REMOVED b 1->-1", "MODIFIED a 0->0", "ADDED c -1->1"));
        assertEquals(modified, snapshot.getDocument(name("rooms/a")));

        // nothing changed since, so there is nothing to publish
        assertTrue(reconciler.onResponse(noChange(13)).getSnapshots().isEmpty());
        assertEquals(token(13), reconciler.getResumeToken(1));
    }

    @Test
    void readTimeMayNotGoBackwards() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        Status fatal = reconciler.onResponse(noChange(9)).getFatal();
        assertNotNull(fatal);
        assertEquals(Status.Code.INTERNAL, fatal.getCode());
    }

    @Test
    void duplicateAddIsAProtocolError() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        assertNotNull(reconciler.onResponse(change(TargetChange.Type.ADD, 1)).getFatal());
    }

    @Test
    void resetRebuildsTheTarget() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        reconciler.onResponse(change(TargetChange.Type.RESET, 1));
        assertEquals(WatchTargetState.RESET, reconciler.getState(1));
        assertNull(reconciler.getResumeToken(1));
        reconciler.onResponse(document(C, 1));
        QuerySnapshot snapshot = reconciler.onResponse(current(20, 1)).getSnapshots().get(0);
        assertThat(ids(snapshot), contains("c"));
        assertThat(changes(snapshot), contains("REMOVED a 0->-1", "REMOVED b 0->-1", "ADDED c -1->0"));
    }

    @Test
    void existenceFilterMismatchResetsTheStream() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        assertTrue(reconciler.onResponse(ListenResponse.of(new ExistenceFilter(1, 2))).isEmpty());

        WatchReconciler.Effects effects = reconciler.onResponse(ListenResponse.of(new ExistenceFilter(1, 3)));
        assertTrue(effects.isReopenStream());
        assertNull(reconciler.getResumeToken(1));

        WatchReconciler.Effects reset = reconciler.onStreamReset();
        assertThat(requests(reset), contains("add 1"));
        assertEquals(WatchTargetState.PENDING, reconciler.getState(1));
        assertEquals(0, reconciler.getDocumentCount(1));
    }

    @Test
    void existenceFilterMismatchRelistensTheTarget() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RELISTEN_TARGET);
        WatchReconciler.Effects effects = reconciler.onResponse(ListenResponse.of(new ExistenceFilter(1, 3)));
        assertFalse(effects.isReopenStream());
        assertThat(requests(effects), contains("remove 1", "add 1"));

        // the acknowledgement of our own removal does not end the target
        assertTrue(reconciler.onResponse(change(TargetChange.Type.REMOVE, 1)).getTargetErrors().isEmpty());
        assertEquals(WatchTargetState.PENDING, reconciler.getState(1));
        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        reconciler.onResponse(document(A, 1));
        reconciler.onResponse(document(B, 1));
        reconciler.onResponse(document(C, 1));
        QuerySnapshot snapshot = reconciler.onResponse(current(15, 1)).getSnapshots().get(0);
        assertThat(ids(snapshot), contains("a", "b", "c"));
        assertThat(changes(snapshot), contains("ADDED c -1->2"));
    }

    @Test
    void streamResetResumesFromToken() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        reconciler.onResponse(document(C, 1));
        WatchReconciler.Effects reset = reconciler.onStreamReset();
        assertThat(requests(reset), contains("add 1 from 10"));
        // documents received after the resume point are dropped
        assertEquals(2, reconciler.getDocumentCount(1));

        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        reconciler.onResponse(document(C, 1));
        assertTrue(reconciler.onResponse(ListenResponse.of(new ExistenceFilter(1, 3))).isEmpty());
        QuerySnapshot snapshot = reconciler.onResponse(current(11, 1)).getSnapshots().get(0);
        assertThat(changes(snapshot), contains("ADDED c -1->2"));
    }

    @Test
    void serverRemovalWithCause() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        WatchReconciler.Effects effects = reconciler.onResponse(ListenResponse.of(
                TargetChange.removed(1, Status.PERMISSION_DENIED.withDescription("no"))));
        assertEquals(Status.Code.PERMISSION_DENIED, effects.getTargetErrors().get(1).getCode());
        assertNull(reconciler.getState(1));
    }

    @Test
    void serverRemovalWithoutCauseIsAnInternalError() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        WatchReconciler.Effects effects = reconciler.onResponse(change(TargetChange.Type.REMOVE, 1));
        assertEquals(Status.Code.INTERNAL, effects.getTargetErrors().get(1).getCode());
        assertNull(reconciler.getState(1));
        assertTrue(reconciler.onResponse(document(C, 1)).isEmpty());
    }

    @Test
    void onceTargetCompletesAfterItsFinalSnapshot() {
        WatchReconciler reconciler = new WatchReconciler(ExistenceFilterPolicy.RESET_STREAM);
        reconciler.addTarget(ROOMS.withOnce(true));
        reconciler.onResponse(change(TargetChange.Type.ADD, 1));
        reconciler.onResponse(document(A, 1));
        reconciler.onResponse(ListenResponse.of(new TargetChange(TargetChange.Type.CURRENT,
                ImmutableList.of(1), null, token(10), null)));
        assertTrue(reconciler.onResponse(change(TargetChange.Type.REMOVE, 1)).isEmpty());
        assertEquals(WatchTargetState.CURRENT, reconciler.getState(1));

        WatchReconciler.Effects effects = reconciler.onResponse(noChange(10));
        assertThat(ids(effects.getSnapshots().get(0)), contains("a"));
        assertThat(effects.getCompletedTargets(), contains(1));
        assertThat(effects.getTargetErrors().keySet(), empty());
        assertNull(reconciler.getState(1));

        WatchReconciler published = new WatchReconciler(ExistenceFilterPolicy.RESET_STREAM);
        published.addTarget(ROOMS.withOnce(true));
        published.onResponse(change(TargetChange.Type.ADD, 1));
        published.onResponse(current(10, 1));
        assertThat(published.onResponse(change(TargetChange.Type.REMOVE, 1)).getCompletedTargets(), contains(1));
    }

    @Test
    void removedTargetsIgnoreEvents() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        assertThat(requests(reconciler.removeTarget(1)), contains("remove 1"));
        assertTrue(reconciler.onResponse(document(C, 1)).isEmpty());
        assertThat(reconciler.onResponse(noChange(11)).getSnapshots(), empty());
        assertTrue(reconciler.removeTarget(1).isEmpty());
    }

    @Test
    void targetIdsMustBeAssigned() {
        WatchReconciler reconciler = active(ExistenceFilterPolicy.RESET_STREAM);
        assertThrows(IllegalArgumentException.class, () -> reconciler.addTarget(ROOMS));
        assertThrows(IllegalArgumentException.class, () -> reconciler.addTarget(ROOMS.withTargetId(Target.SERVER_ASSIGNED)));
    }

    @Test
    void diffIndexesApplyInOrder() {
        Document modified = doc("rooms/b", "v", 2);
        Document d = doc("rooms/d", "v", 1);
        List<DocumentViewChange> changes = WatchReconciler.diff(
                ImmutableList.of(A, B, C), ImmutableList.of(modified, C, d), QueryComparator.byName());
        assertThat(changes.stream().map(change -> change.getType() + " " + change.getDocument().getId() + " "
                                                  + change.getOldIndex() + "->" + change.getNewIndex())
                        .collect(Collectors.toList()),
                contains("REMOVED a 0->-1", "MODIFIED b 0->0", "ADDED d -1->2"));
    }
}
