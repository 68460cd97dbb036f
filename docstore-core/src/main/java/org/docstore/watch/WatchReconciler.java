/*
 * WatchReconciler.java
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
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import io.grpc.Status;
import org.docstore.listen.DocumentChange;
import org.docstore.listen.DocumentDelete;
import org.docstore.listen.DocumentRemove;
import org.docstore.listen.ExistenceFilter;
import org.docstore.listen.ListenRequest;
import org.docstore.listen.ListenResponse;
import org.docstore.listen.Target;
import org.docstore.listen.TargetChange;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.query.QueryComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds the responses of one listen stream into per-target snapshots.
 *
 * <p>
 * This is the transport-free core of a watch: every input (a local add or remove, a server
 * response, a stream restart) is applied to the per-target state machine and answered with the
 * {@link Effects} the caller must carry out, such as requests to send, snapshots to deliver,
 * targets that failed, or a fatal protocol error. Each target moves
 * {@code PENDING -> SYNCING -> CURRENT -> ACTIVE}; {@code RESET} rebuilds it from scratch and
 * {@code REMOVED} ends it.
 * </p>
 *
 * <p>
 * Document events accumulate per target and become visible only at a consistent point: a
 * {@code CURRENT} that carries a read time, or a later {@code NO_CHANGE} with a read time. Read
 * times must never go backwards within one stream.
 * </p>
 *
 * <p>
 * Not thread-safe; a watch drives it from one sequential executor.
 * </p>
 */
public class WatchReconciler {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(WatchReconciler.class);

    @Nonnull
    private final ExistenceFilterPolicy policy;
    @Nonnull
    private final Map<Integer, TargetView> targets = new TreeMap<>();
    @Nonnull
    private Timestamp lastReadTime = Timestamps.EPOCH;

    public WatchReconciler(@Nonnull ExistenceFilterPolicy policy) {
        this.policy = policy;
    }

    /**
     * What the caller must do after an input.
     */
    public static final class Effects {
        @Nonnull
        private final List<ListenRequest> requests = new ArrayList<>();
        @Nonnull
        private final List<QuerySnapshot> snapshots = new ArrayList<>();
        @Nonnull
        private final Map<Integer, Status> targetErrors = new LinkedHashMap<>();
        @Nonnull
        private final List<Integer> completedTargets = new ArrayList<>();
        @Nullable
        private Status fatal;
        private boolean reopenStream;

        /** Requests to send on the current stream, in order. */
        @Nonnull
        public List<ListenRequest> getRequests() {
            return requests;
        }

        @Nonnull
        public List<QuerySnapshot> getSnapshots() {
            return snapshots;
        }

        /**
         * Targets the server removed without being asked, with the reason. A removal that names no
         * cause is reported as {@code INTERNAL}. These targets have been dropped.
         *
         * @return the removed targets and why they ended
         */
        @Nonnull
        public Map<Integer, Status> getTargetErrors() {
            return targetErrors;
        }

        /**
         * Once targets the server finished after their final snapshot. They have been dropped.
         *
         * @return the finished target ids
         */
        @Nonnull
        public List<Integer> getCompletedTargets() {
            return completedTargets;
        }

        /**
         * A protocol violation; the whole watch must fail.
         *
         * @return the failure, or {@code null} if none occurred
         */
        @Nullable
        public Status getFatal() {
            return fatal;
        }

        /** The stream must be closed and reopened; {@link #onStreamReset()} supplies the new requests. */
        public boolean isReopenStream() {
            return reopenStream;
        }

        public boolean isEmpty() {
            return requests.isEmpty() && snapshots.isEmpty() && targetErrors.isEmpty() && completedTargets.isEmpty()
                    && fatal == null && !reopenStream;
        }
    }

    /**
     * Start watching a target. The target's id must be set and unused.
     *
     * @param target the target
     * @return the request to send
     */
    @Nonnull
    public Effects addTarget(@Nonnull Target target) {
        int targetId = target.getTargetId();
        TargetView existing = targets.get(targetId);
        if (targetId == Target.SERVER_ASSIGNED || (existing != null && existing.state != WatchTargetState.REMOVED)) {
            throw new IllegalArgumentException("target id must be set and unused: " + targetId);
        }
        TargetView view = new TargetView(target);
        targets.put(targetId, view);
        Effects effects = new Effects();
        effects.requests.add(ListenRequest.addTarget(target));
        return effects;
    }

    /**
     * Stop watching a target. Later events for it are ignored.
     *
     * @param targetId the target
     * @return the request to send
     */
    @Nonnull
    public Effects removeTarget(int targetId) {
        Effects effects = new Effects();
        TargetView view = targets.remove(targetId);
        if (view != null) {
            view.state = WatchTargetState.REMOVED;
            effects.requests.add(ListenRequest.removeTarget(targetId));
        }
        return effects;
    }

    /**
     * The stream was reopened. Accumulated events are dropped and every target is requested again,
     * from its resume token if it has one.
     *
     * @return the requests to send on the new stream
     */
    @Nonnull
    public Effects onStreamReset() {
        Effects effects = new Effects();
        lastReadTime = Timestamps.EPOCH;
        for (TargetView view : targets.values()) {
            view.restart(false);
            effects.requests.add(ListenRequest.addTarget(view.resumeTarget()));
        }
        return effects;
    }

    /**
     * Apply one response from the server.
     *
     * @param response the response
     * @return what to do next
     */
    @Nonnull
    public Effects onResponse(@Nonnull ListenResponse response) {
        Effects effects = new Effects();
        switch (response.getKind()) {
            case TARGET_CHANGE:
                onTargetChange(response.getTargetChange(), effects);
                break;
            case DOCUMENT_CHANGE:
                onDocumentChange(response.getDocumentChange());
                break;
            case DOCUMENT_DELETE:
                DocumentDelete delete = response.getDocumentDelete();
                if (advanceReadTime(delete.getReadTime(), effects)) {
                    removeDocument(delete.getDocumentName(), delete.getRemovedTargetIds());
                }
                break;
            case DOCUMENT_REMOVE:
                DocumentRemove remove = response.getDocumentRemove();
                if (advanceReadTime(remove.getReadTime(), effects)) {
                    removeDocument(remove.getDocumentName(), remove.getRemovedTargetIds());
                }
                break;
            case FILTER:
                onExistenceFilter(response.getFilter(), effects);
                break;
            default:
                throw new IllegalStateException("unknown listen response " + response.getKind());
        }
        return effects;
    }

    @Nullable
    public WatchTargetState getState(int targetId) {
        TargetView view = targets.get(targetId);
        return view == null ? null : view.state;
    }

    @Nullable
    public ByteString getResumeToken(int targetId) {
        TargetView view = targets.get(targetId);
        return view == null ? null : view.resumeToken;
    }

    /**
     * Number of documents accumulated for a target, published or not.
     *
     * @param targetId the target
     * @return the document count
     */
    public int getDocumentCount(int targetId) {
        TargetView view = targets.get(targetId);
        return view == null ? 0 : view.documents.size();
    }

    private void onTargetChange(@Nonnull TargetChange change, @Nonnull Effects effects) {
        Timestamp readTime = change.getReadTime();
        if (readTime != null && !advanceReadTime(readTime, effects)) {
            return;
        }
        switch (change.getType()) {
            case ADD:
                for (int targetId : change.getTargetIds()) {
                    TargetView view = targets.get(targetId);
                    if (view == null) {
                        continue;
                    }
                    if (view.state == WatchTargetState.PENDING) {
                        transition(view, WatchTargetState.SYNCING);
                    } else {
                        protocolError(effects, "unexpected ADD for target " + targetId + " in state " + view.state);
                        return;
                    }
                }
                break;
            case REMOVE:
                for (int targetId : change.getTargetIds()) {
                    TargetView view = targets.get(targetId);
                    if (view == null) {
                        continue;
                    }
                    if (change.getCause() == null && view.awaitingRemove) {
                        view.awaitingRemove = false;
                        continue;
                    }
                    if (change.getCause() == null && view.target.isOnce()
                            && (view.state == WatchTargetState.CURRENT || view.state == WatchTargetState.ACTIVE)) {
                        // the final snapshot is published at the next consistent point
                        view.completing = true;
                        if (view.state == WatchTargetState.ACTIVE && !view.dirty) {
                            complete(view, effects);
                        }
                        continue;
                    }
                    targets.remove(targetId);
                    view.state = WatchTargetState.REMOVED;
                    // a removal we did not ask for ends the target even when the server names no cause
                    Status cause = change.getCause();
                    if (cause == null) {
                        cause = Status.INTERNAL.withDescription("target removed by the server without a cause");
                    }
                    effects.targetErrors.put(targetId, cause);
                    if (LOGGER.isInfoEnabled()) {
                        LOGGER.info(KeyValueLogMessage.of("server removed target",
                                LogMessageKeys.TARGET_ID, targetId,
                                LogMessageKeys.CODE, cause.getCode()));
                    }
                }
                break;
            case CURRENT:
                for (TargetView view : selected(change.getTargetIds())) {
                    if (view.state == WatchTargetState.SYNCING || view.state == WatchTargetState.RESET
                            || view.state == WatchTargetState.ACTIVE) {
                        transition(view, WatchTargetState.CURRENT);
                    }
                    updateResumeToken(view, change.getResumeToken());
                    if (readTime != null) {
                        publish(view, readTime, effects);
                    }
                }
                break;
            case RESET:
                for (TargetView view : selected(change.getTargetIds())) {
                    view.documents.clear();
                    view.resumeToken = null;
                    view.dirty = true;
                    transition(view, WatchTargetState.RESET);
                }
                break;
            case NO_CHANGE:
                for (TargetView view : selected(change.getTargetIds())) {
                    updateResumeToken(view, change.getResumeToken());
                    if (readTime != null) {
                        publish(view, readTime, effects);
                    }
                }
                break;
            default:
                throw new IllegalStateException("unknown target change " + change.getType());
        }
    }

    private void onDocumentChange(@Nonnull DocumentChange change) {
        Document document = change.getDocument();
        for (int targetId : change.getTargetIds()) {
            TargetView view = receiving(targetId);
            if (view != null) {
                view.documents.put(document.getName(), document);
                view.dirty = true;
            }
        }
        removeDocument(document.getName(), change.getRemovedTargetIds());
    }

    private void removeDocument(@Nonnull String name, @Nonnull List<Integer> targetIds) {
        for (int targetId : targetIds) {
            TargetView view = receiving(targetId);
            if (view != null && view.documents.remove(name) != null) {
                view.dirty = true;
            }
        }
    }

    private void onExistenceFilter(@Nonnull ExistenceFilter filter, @Nonnull Effects effects) {
        TargetView view = receiving(filter.getTargetId());
        if (view == null || view.documents.size() == filter.getCount()) {
            return;
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("existence filter mismatch",
                    LogMessageKeys.TARGET_ID, filter.getTargetId(),
                    LogMessageKeys.EXPECTED, filter.getCount(),
                    LogMessageKeys.ACTUAL, view.documents.size(),
                    LogMessageKeys.POLICY, policy));
        }
        if (policy == ExistenceFilterPolicy.RESET_STREAM) {
            view.resumeToken = null;
            effects.reopenStream = true;
        } else {
            view.restart(true);
            effects.requests.add(ListenRequest.removeTarget(filter.getTargetId()));
            effects.requests.add(ListenRequest.addTarget(view.resumeTarget()));
        }
    }

    private void publish(@Nonnull TargetView view, @Nonnull Timestamp readTime, @Nonnull Effects effects) {
        publishSnapshot(view, readTime, effects);
        if (view.completing && view.state == WatchTargetState.ACTIVE) {
            complete(view, effects);
        }
    }

    private void complete(@Nonnull TargetView view, @Nonnull Effects effects) {
        int targetId = view.target.getTargetId();
        targets.remove(targetId);
        view.state = WatchTargetState.REMOVED;
        effects.completedTargets.add(targetId);
    }

    private void publishSnapshot(@Nonnull TargetView view, @Nonnull Timestamp readTime, @Nonnull Effects effects) {
        boolean first = view.state == WatchTargetState.CURRENT;
        if (view.state != WatchTargetState.CURRENT && view.state != WatchTargetState.ACTIVE) {
            return;
        }
        if (first) {
            transition(view, WatchTargetState.ACTIVE);
        }
        if (!first && !view.dirty) {
            return;
        }
        List<Document> next = new ArrayList<>(view.documents.values());
        next.sort(view.comparator);
        List<DocumentViewChange> changes = diff(view.published, next, view.comparator);
        if (changes.isEmpty() && view.hasPublished) {
            view.dirty = false;
            return;
        }
        view.published = ImmutableList.copyOf(next);
        view.hasPublished = true;
        view.dirty = false;
        effects.snapshots.add(new QuerySnapshot(view.target.getTargetId(), next, changes, readTime));
    }

    /**
     * Changes that turn {@code previous} into {@code next}: removals in old order, then additions and
     * modifications in new order, each index taken against the list as already changed.
     */
    @Nonnull
    static List<DocumentViewChange> diff(@Nonnull List<Document> previous, @Nonnull List<Document> next,
                                         @Nonnull Comparator<Document> comparator) {
        Map<String, Document> nextByName = new HashMap<>();
        for (Document document : next) {
            nextByName.put(document.getName(), document);
        }
        Map<String, Document> previousByName = new HashMap<>();
        for (Document document : previous) {
            previousByName.put(document.getName(), document);
        }
        List<Document> working = new ArrayList<>(previous);
        List<DocumentViewChange> changes = new ArrayList<>();
        for (Document document : previous) {
            if (!nextByName.containsKey(document.getName())) {
                int index = working.indexOf(document);
                working.remove(index);
                changes.add(new DocumentViewChange(DocumentViewChange.Type.REMOVED, document, index, -1));
            }
        }
        for (Document document : next) {
            Document old = previousByName.get(document.getName());
            if (old == null) {
                int index = insert(working, document, comparator);
                changes.add(new DocumentViewChange(DocumentViewChange.Type.ADDED, document, -1, index));
            } else if (!old.equals(document)) {
                int oldIndex = working.indexOf(old);
                working.remove(oldIndex);
                int newIndex = insert(working, document, comparator);
                changes.add(new DocumentViewChange(DocumentViewChange.Type.MODIFIED, document, oldIndex, newIndex));
            }
        }
        return changes;
    }

    private static int insert(@Nonnull List<Document> list, @Nonnull Document document,
                              @Nonnull Comparator<Document> comparator) {
        int index = Collections.binarySearch(list, document, comparator);
        int position = index >= 0 ? index : -index - 1;
        list.add(position, document);
        return position;
    }

    private boolean advanceReadTime(@Nonnull Timestamp readTime, @Nonnull Effects effects) {
        if (Timestamps.compare(readTime, lastReadTime) < 0) {
            protocolError(effects, "read time went backwards from " + Timestamps.toString(lastReadTime)
                    + " to " + Timestamps.toString(readTime));
            return false;
        }
        lastReadTime = readTime;
        return true;
    }

    private void protocolError(@Nonnull Effects effects, @Nonnull String description) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("listen protocol violation",
                    LogMessageKeys.DESCRIPTION, description));
        }
        effects.fatal = Status.INTERNAL.withDescription(description);
    }

    @Nonnull
    private List<TargetView> selected(@Nonnull List<Integer> targetIds) {
        List<TargetView> views = new ArrayList<>();
        if (targetIds.isEmpty()) {
            for (TargetView view : targets.values()) {
                if (view.state != WatchTargetState.REMOVED) {
                    views.add(view);
                }
            }
        } else {
            for (int targetId : targetIds) {
                TargetView view = targets.get(targetId);
                if (view != null && view.state != WatchTargetState.REMOVED) {
                    views.add(view);
                }
            }
        }
        return views;
    }

    /**
     * A target that accepts document events: acknowledged by the server and not removed.
     */
    @Nullable
    private TargetView receiving(int targetId) {
        TargetView view = targets.get(targetId);
        if (view == null || view.state == WatchTargetState.PENDING || view.state == WatchTargetState.REMOVED) {
            return null;
        }
        return view;
    }

    private static void updateResumeToken(@Nonnull TargetView view, @Nonnull ByteString resumeToken) {
        if (!resumeToken.isEmpty()
                && (view.state == WatchTargetState.CURRENT || view.state == WatchTargetState.ACTIVE)) {
            view.resumeToken = resumeToken;
            view.documentsAtResumeToken = new HashMap<>(view.documents);
        }
    }

    private static void transition(@Nonnull TargetView view, @Nonnull WatchTargetState next) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("watch target state change",
                    LogMessageKeys.TARGET_ID, view.target.getTargetId(),
                    LogMessageKeys.OLD_STATE, view.state,
                    LogMessageKeys.NEW_STATE, next));
        }
        view.state = next;
    }

    private static final class TargetView {
        @Nonnull
        private final Target target;
        @Nonnull
        private final Comparator<Document> comparator;
        @Nonnull
        private WatchTargetState state = WatchTargetState.PENDING;
        @Nonnull
        private final Map<String, Document> documents = new HashMap<>();
        @Nonnull
        private List<Document> published = ImmutableList.of();
        private boolean hasPublished;
        private boolean dirty;
        @Nullable
        private ByteString resumeToken;
        @Nonnull
        private Map<String, Document> documentsAtResumeToken = new HashMap<>();
        private boolean awaitingRemove;
        private boolean completing;

        TargetView(@Nonnull Target target) {
            this.target = target;
            this.resumeToken = target.getResumeToken();
            Target.Selector selector = target.getSelector();
            this.comparator = selector instanceof Target.QuerySelector
                              ? new QueryComparator(((Target.QuerySelector)selector).getQuery())
                              : QueryComparator.byName();
        }

        /**
         * Go back to {@code PENDING}. A target that keeps its resume token starts again from the
         * documents it had at that token, because the server only sends what changed since then.
         * Published documents stay as the base for the next snapshot's changes.
         */
        void restart(boolean discardState) {
            state = WatchTargetState.PENDING;
            awaitingRemove = discardState;
            completing = false;
            if (discardState) {
                resumeToken = null;
            }
            documents.clear();
            if (resumeToken != null) {
                documents.putAll(documentsAtResumeToken);
            } else {
                documentsAtResumeToken = new HashMap<>();
            }
            dirty = true;
        }

        @Nonnull
        Target resumeTarget() {
            return target.withResumeToken(resumeToken);
        }
    }
}
