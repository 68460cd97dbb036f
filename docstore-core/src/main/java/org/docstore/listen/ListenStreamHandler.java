/*
 * ListenStreamHandler.java
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

package org.docstore.listen;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.DatabaseId;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.docstore.query.QueryEvaluator;
import org.docstore.query.StructuredQuery;
import org.docstore.storage.CommitEvent;
import org.docstore.storage.CommitListener;
import org.docstore.storage.DocumentMutation;
import org.docstore.storage.DocumentSource;
import org.docstore.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;

/**
 * Server side of one listen stream.
 *
 * <p>
 * Requests from the client and commits from the store are both funnelled through one sequential
 * executor, so the stream sees them in a single order and its target state needs no locking.
 * Each target remembers the documents it last reported and the read time they are current at;
 * after a commit every affected target is evaluated again at the commit time and only the
 * differences are sent, followed by a global {@code NO_CHANGE} at the commit time.
 * </p>
 *
 * <p>
 * Problems with a single target remove that target with a cause. Protocol violations, namely a
 * duplicate target id or the removal of an unknown one, end the stream.
 * </p>
 */
public class ListenStreamHandler implements StreamObserver<ListenRequest>, CommitListener {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ListenStreamHandler.class);

    @Nonnull
    private final DatabaseId databaseId;
    @Nonnull
    private final DocumentStore store;
    @Nonnull
    private final QueryEvaluator evaluator;
    @Nonnull
    private final StreamObserver<ListenResponse> responseObserver;
    @Nonnull
    private final Executor executor;
    @Nonnull
    private final Map<Integer, ServerTarget> targets = new TreeMap<>();
    @Nonnull
    private Timestamp lastReadTime = Timestamps.EPOCH;
    // newest commit this stream has handled; new targets are read here and not at the store's latest
    @Nonnull
    private Timestamp processedTime = Timestamps.EPOCH;
    private int nextAssignedId = 1;
    private volatile boolean closed;

    public ListenStreamHandler(@Nonnull DatabaseId databaseId, @Nonnull DocumentStore store,
                               @Nonnull QueryEvaluator evaluator, @Nonnull Executor executor,
                               @Nonnull StreamObserver<ListenResponse> responseObserver) {
        this.databaseId = databaseId;
        this.store = store;
        this.evaluator = evaluator;
        this.executor = MoreExecutors.newSequentialExecutor(executor);
        this.responseObserver = responseObserver;
    }

    /**
     * Start receiving commits. Call once, before the first request.
     */
    public void start() {
        store.addListener(this);
        Timestamp startTime = store.currentReadTime();
        executor.execute(() -> processedTime = max(processedTime, startTime));
    }

    @Override
    public void onNext(@Nonnull ListenRequest request) {
        executor.execute(() -> {
            if (!closed) {
                handle(request);
            }
        });
    }

    @Override
    public void onCommit(@Nonnull CommitEvent event) {
        executor.execute(() -> {
            if (!closed) {
                handle(event);
            }
        });
    }

    @Override
    public void onError(@Nonnull Throwable t) {
        executor.execute(() -> {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("listen stream cancelled by client",
                        LogMessageKeys.MESSAGE, t.getMessage()));
            }
            close();
        });
    }

    @Override
    public void onCompleted() {
        executor.execute(() -> {
            if (!closed) {
                close();
                responseObserver.onCompleted();
            }
        });
    }

    public boolean isClosed() {
        return closed;
    }

    private void close() {
        closed = true;
        store.removeListener(this);
        targets.clear();
    }

    private void fail(@Nonnull DocumentStoreException e) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("closing listen stream",
                    LogMessageKeys.CODE, e.getCode(),
                    LogMessageKeys.MESSAGE, e.getMessage()));
        }
        close();
        responseObserver.onError(e.toStatusException());
    }

    private void handle(@Nonnull ListenRequest request) {
        try {
            if (request.getKind() == ListenRequest.Kind.ADD_TARGET) {
                addTarget(request.getAddTarget());
            } else {
                removeTarget(request.getRemoveTarget());
            }
        } catch (RuntimeException e) {
            fail(DocumentStoreExceptions.wrap(e));
        }
    }

    private void addTarget(@Nonnull Target target) {
        int targetId = target.getTargetId();
        if (targetId == Target.SERVER_ASSIGNED) {
            while (targets.containsKey(nextAssignedId)) {
                nextAssignedId++;
            }
            targetId = nextAssignedId++;
        } else if (targets.containsKey(targetId)) {
            throw new DocumentStoreExceptions.InvalidArgumentException("duplicate target id",
                    LogMessageKeys.TARGET_ID, targetId);
        }
        ServerTarget serverTarget;
        Timestamp resumeFrom;
        try {
            serverTarget = resolve(targetId, target);
            resumeFrom = target.getResumeToken() != null ? ResumeTokens.toReadTime(target.getResumeToken())
                                                         : target.getReadTime();
        } catch (DocumentStoreException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("rejected listen target",
                        LogMessageKeys.TARGET_ID, targetId,
                        LogMessageKeys.CODE, e.getCode(),
                        LogMessageKeys.MESSAGE, e.getMessage()));
            }
            send(TargetChange.removed(targetId, e.toStatus()));
            return;
        }
        // commits already queued behind this request must still reach the other targets in order
        Timestamp readTime = max(processedTime, store.getEarliestReadTime());
        DocumentSource latest = store.snapshot(readTime);
        Map<ResourcePath, Document> current = serverTarget.evaluate(latest);
        targets.put(targetId, serverTarget);
        send(TargetChange.of(TargetChange.Type.ADD, targetId));
        if (resumeFrom != null && Timestamps.compare(resumeFrom, store.getEarliestReadTime()) >= 0
                && Timestamps.compare(resumeFrom, readTime) <= 0) {
            serverTarget.sent = serverTarget.evaluate(store.snapshot(resumeFrom));
            sendDifferences(ImmutableList.of(serverTarget), ImmutableList.of(current), latest);
            send(new ExistenceFilter(targetId, current.size()));
        } else {
            if (resumeFrom != null) {
                send(TargetChange.of(TargetChange.Type.RESET, targetId));
            }
            for (Document document : current.values()) {
                send(new DocumentChange(document, ImmutableList.of(targetId), ImmutableList.of()));
            }
        }
        serverTarget.sent = current;
        serverTarget.syncedTime = readTime;
        send(new TargetChange(TargetChange.Type.CURRENT, ImmutableList.of(targetId), null,
                ResumeTokens.fromReadTime(readTime), null));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("added listen target",
                    LogMessageKeys.TARGET_ID, targetId,
                    LogMessageKeys.COUNT, current.size(),
                    LogMessageKeys.READ_TIME, Timestamps.toString(readTime)));
        }
        if (target.isOnce()) {
            targets.remove(targetId);
            send(TargetChange.of(TargetChange.Type.REMOVE, targetId));
        }
        sendNoChange(readTime, true);
    }

    private void removeTarget(int targetId) {
        if (targets.remove(targetId) == null) {
            throw new DocumentStoreExceptions.InvalidArgumentException("unknown target id",
                    LogMessageKeys.TARGET_ID, targetId);
        }
        send(TargetChange.of(TargetChange.Type.REMOVE, targetId));
    }

    @Nonnull
    private ServerTarget resolve(int targetId, @Nonnull Target target) {
        Target.Selector selector = target.getSelector();
        if (selector instanceof Target.QuerySelector) {
            Target.QuerySelector query = (Target.QuerySelector)selector;
            ResourcePath parent = databaseId.parseParent(query.getParent());
            query.getQuery().validate();
            return new ServerTarget(targetId, parent, query.getQuery(), ImmutableList.of());
        }
        List<ResourcePath> documents = new ArrayList<>();
        for (String name : ((Target.DocumentsSelector)selector).getDocuments()) {
            documents.add(databaseId.parseDocumentName(name));
        }
        return new ServerTarget(targetId, null, null, documents);
    }

    private void handle(@Nonnull CommitEvent event) {
        Timestamp commitTime = event.getCommitTime();
        processedTime = max(processedTime, commitTime);
        if (targets.isEmpty()) {
            return;
        }
        List<ServerTarget> affected = new ArrayList<>();
        for (ServerTarget target : targets.values()) {
            if (Timestamps.compare(target.syncedTime, commitTime) < 0 && target.isAffectedBy(event)) {
                affected.add(target);
            }
        }
        try {
            if (!affected.isEmpty()) {
                DocumentSource source = store.snapshot(commitTime);
                List<Map<ResourcePath, Document>> results = new ArrayList<>(affected.size());
                for (ServerTarget target : affected) {
                    results.add(target.evaluate(source));
                }
                sendDifferences(affected, results, source);
                for (int i = 0; i < affected.size(); i++) {
                    affected.get(i).sent = results.get(i);
                }
            }
            for (ServerTarget target : targets.values()) {
                target.syncedTime = max(target.syncedTime, commitTime);
            }
            sendNoChange(commitTime, false);
        } catch (DocumentStoreExceptions.InvalidArgumentException e) {
            fail(new DocumentStoreExceptions.UnavailableException("listen stream fell behind the retained versions",
                    LogMessageKeys.COMMIT_TIME, Timestamps.toString(commitTime)));
        }
    }

    /**
     * Send what changed between each target's reported documents and its new result, one message
     * per document and content.
     */
    private void sendDifferences(@Nonnull List<ServerTarget> changed, @Nonnull List<Map<ResourcePath, Document>> results,
                                 @Nonnull DocumentSource source) {
        Map<ResourcePath, Map<Document, List<Integer>>> updates = new TreeMap<>();
        Map<ResourcePath, List<Integer>> removals = new TreeMap<>();
        for (int i = 0; i < changed.size(); i++) {
            ServerTarget target = changed.get(i);
            Map<ResourcePath, Document> result = results.get(i);
            for (Map.Entry<ResourcePath, Document> entry : result.entrySet()) {
                if (!entry.getValue().equals(target.sent.get(entry.getKey()))) {
                    updates.computeIfAbsent(entry.getKey(), ignore -> new LinkedHashMap<>())
                            .computeIfAbsent(entry.getValue(), ignore -> new ArrayList<>())
                            .add(target.targetId);
                }
            }
            for (ResourcePath path : target.sent.keySet()) {
                if (!result.containsKey(path)) {
                    removals.computeIfAbsent(path, ignore -> new ArrayList<>()).add(target.targetId);
                }
            }
        }
        Timestamp readTime = source.getReadTime();
        for (Map.Entry<ResourcePath, Map<Document, List<Integer>>> entry : updates.entrySet()) {
            List<Integer> removed = removals.remove(entry.getKey());
            boolean first = true;
            for (Map.Entry<Document, List<Integer>> version : entry.getValue().entrySet()) {
                send(new DocumentChange(version.getKey(), version.getValue(),
                        first && removed != null ? removed : ImmutableList.of()));
                first = false;
            }
        }
        for (Map.Entry<ResourcePath, List<Integer>> entry : removals.entrySet()) {
            String name = entry.getKey().canonicalString();
            if (source.get(entry.getKey()) == null) {
                send(new DocumentDelete(name, entry.getValue(), readTime));
            } else {
                send(new DocumentRemove(name, entry.getValue(), readTime));
            }
        }
    }

    // a new target needs a consistent point even when no commit happened since the last one
    private void sendNoChange(@Nonnull Timestamp readTime, boolean allowRepeat) {
        int cmp = Timestamps.compare(readTime, lastReadTime);
        if (cmp < 0 || (cmp == 0 && !allowRepeat)) {
            return;
        }
        lastReadTime = readTime;
        send(TargetChange.noChange(ResumeTokens.fromReadTime(readTime), readTime));
    }

    private void send(@Nonnull TargetChange change) {
        send(ListenResponse.of(change));
    }

    private void send(@Nonnull DocumentChange change) {
        send(ListenResponse.of(change));
    }

    private void send(@Nonnull DocumentDelete delete) {
        send(ListenResponse.of(delete));
    }

    private void send(@Nonnull DocumentRemove remove) {
        send(ListenResponse.of(remove));
    }

    private void send(@Nonnull ExistenceFilter filter) {
        send(ListenResponse.of(filter));
    }

    private void send(@Nonnull ListenResponse response) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("sending listen response",
                    LogMessageKeys.MESSAGE, response));
        }
        responseObserver.onNext(response);
    }

    @Nonnull
    private static Timestamp max(@Nonnull Timestamp a, @Nonnull Timestamp b) {
        return Timestamps.compare(a, b) >= 0 ? a : b;
    }

    /**
     * A target as the stream tracks it.
     */
    private final class ServerTarget {
        private final int targetId;
        @Nullable
        private final ResourcePath parent;
        @Nullable
        private final StructuredQuery query;
        @Nonnull
        private final List<ResourcePath> documents;
        @Nonnull
        private Map<ResourcePath, Document> sent = new HashMap<>();
        @Nonnull
        private Timestamp syncedTime = Timestamps.EPOCH;

        ServerTarget(int targetId, @Nullable ResourcePath parent, @Nullable StructuredQuery query,
                     @Nonnull List<ResourcePath> documents) {
            this.targetId = targetId;
            this.parent = parent;
            this.query = query;
            this.documents = documents;
        }

        @Nonnull
        Map<ResourcePath, Document> evaluate(@Nonnull DocumentSource source) {
            Map<ResourcePath, Document> result = new LinkedHashMap<>();
            if (parent != null && query != null) {
                for (Document document : evaluator.evaluate(parent, query, source)) {
                    result.put(document.getPath(), document);
                }
            } else {
                for (ResourcePath path : documents) {
                    Document document = source.get(path);
                    if (document != null) {
                        result.put(path, document);
                    }
                }
            }
            return result;
        }

        boolean isAffectedBy(@Nonnull CommitEvent event) {
            for (DocumentMutation mutation : event.getMutations()) {
                if (parent != null ? parent.isPrefixOf(mutation.getPath()) : documents.contains(mutation.getPath())) {
                    return true;
                }
            }
            return false;
        }
    }
}
