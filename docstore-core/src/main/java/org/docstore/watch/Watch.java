/*
 * Watch.java
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

import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.async.ExponentialDelay;
import org.docstore.listen.ListenRequest;
import org.docstore.listen.ListenResponse;
import org.docstore.listen.Target;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Client side of a listen stream: multiplexes any number of watched targets over one stream and
 * keeps it alive.
 *
 * <p>
 * All work happens on one sequential executor, which owns the {@link WatchReconciler} and the
 * listeners. When the stream fails with a transient status it is reopened after an exponential,
 * jittered delay and every target resumes from its last resume token; {@code RESOURCE_EXHAUSTED}
 * waits the maximum delay. Any other status, too many consecutive failures, or a protocol
 * violation fails every listener and ends the watch.
 * </p>
 */
public class Watch implements AutoCloseable {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(Watch.class);

    @Nonnull
    private static final Set<Status.Code> TRANSIENT_CODES = EnumSet.of(
            Status.Code.CANCELLED,
            Status.Code.UNKNOWN,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.RESOURCE_EXHAUSTED,
            Status.Code.INTERNAL,
            Status.Code.UNAVAILABLE,
            Status.Code.UNAUTHENTICATED);

    @Nonnull
    private final Function<StreamObserver<ListenResponse>, StreamObserver<ListenRequest>> connectionFactory;
    @Nonnull
    private final Executor executor;
    @Nonnull
    private final WatchReconciler reconciler;
    @Nonnull
    private final ExponentialDelay backoff;
    private final int maxReconnectAttempts;
    @Nonnull
    private final Map<Integer, SnapshotListener> listeners = new HashMap<>();
    @Nonnull
    private final AtomicInteger nextTargetId = new AtomicInteger(1);
    @Nullable
    private StreamObserver<ListenRequest> requestSender;
    private int generation;
    private int reconnectAttempts;
    private boolean closed;

    public Watch(@Nonnull Function<StreamObserver<ListenResponse>, StreamObserver<ListenRequest>> connectionFactory,
                 @Nonnull Executor executor, @Nonnull DocumentStoreConfig config) {
        this(connectionFactory, executor, config.getExistenceFilterPolicy(),
                new ExponentialDelay(config.getInitialRetryDelayMillis(), config.getMaxRetryDelayMillis(),
                        config.getRetryBackoffFactor(), ExponentialDelay.DEFAULT_JITTER_FACTOR),
                config.getWatchMaxReconnectAttempts());
    }

    public Watch(@Nonnull Function<StreamObserver<ListenResponse>, StreamObserver<ListenRequest>> connectionFactory,
                 @Nonnull Executor executor, @Nonnull ExistenceFilterPolicy policy, @Nonnull ExponentialDelay backoff,
                 int maxReconnectAttempts) {
        this.connectionFactory = connectionFactory;
        this.executor = MoreExecutors.newSequentialExecutor(executor);
        this.reconciler = new WatchReconciler(policy);
        this.backoff = backoff;
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    /**
     * Start watching a target. The watch chooses the target id and ignores the one on {@code target}.
     *
     * @param target what to watch
     * @param listener receives the target's snapshots
     * @return the target id, for {@link #unlisten(int)}
     */
    public int listen(@Nonnull Target target, @Nonnull SnapshotListener listener) {
        int targetId = nextTargetId.getAndIncrement();
        executor.execute(() -> {
            if (closed) {
                listener.onError(new DocumentStoreException(Status.Code.CANCELLED, "watch is closed"));
                return;
            }
            listeners.put(targetId, listener);
            WatchReconciler.Effects effects = reconciler.addTarget(target.withTargetId(targetId));
            if (requestSender == null) {
                openStream();
            } else {
                apply(effects);
            }
        });
        return targetId;
    }

    public void unlisten(int targetId) {
        executor.execute(() -> {
            if (listeners.remove(targetId) != null) {
                apply(reconciler.removeTarget(targetId));
            }
        });
    }

    @Override
    public void close() {
        executor.execute(() -> {
            closed = true;
            closeStream();
            listeners.clear();
        });
    }

    private void openStream() {
        generation++;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("opening listen stream",
                    LogMessageKeys.CURR_ATTEMPT, reconnectAttempts,
                    LogMessageKeys.COUNT, listeners.size()));
        }
        requestSender = connectionFactory.apply(new ResponseObserver(generation));
        apply(reconciler.onStreamReset());
    }

    private void closeStream() {
        StreamObserver<ListenRequest> sender = requestSender;
        requestSender = null;
        generation++;
        if (sender != null) {
            sender.onCompleted();
        }
    }

    private void apply(@Nonnull WatchReconciler.Effects effects) {
        Status fatal = effects.getFatal();
        if (fatal != null) {
            failAll(fatal);
            return;
        }
        StreamObserver<ListenRequest> sender = requestSender;
        if (sender != null) {
            for (ListenRequest request : effects.getRequests()) {
                sender.onNext(request);
            }
        }
        for (QuerySnapshot snapshot : effects.getSnapshots()) {
            SnapshotListener listener = listeners.get(snapshot.getTargetId());
            if (listener != null) {
                listener.onSnapshot(snapshot);
            }
        }
        for (int targetId : effects.getCompletedTargets()) {
            SnapshotListener listener = listeners.remove(targetId);
            if (listener != null) {
                listener.onCompleted();
            }
        }
        for (Map.Entry<Integer, Status> error : effects.getTargetErrors().entrySet()) {
            SnapshotListener listener = listeners.remove(error.getKey());
            if (listener != null) {
                listener.onError(DocumentStoreExceptions.fromStatus(error.getValue()));
            }
        }
        if (effects.isReopenStream()) {
            closeStream();
            openStream();
        }
    }

    private void onStreamFailure(@Nonnull Status status) {
        requestSender = null;
        generation++;
        if (closed) {
            return;
        }
        if (!TRANSIENT_CODES.contains(status.getCode()) || reconnectAttempts >= maxReconnectAttempts) {
            failAll(status);
            return;
        }
        if (status.getCode() == Status.Code.RESOURCE_EXHAUSTED) {
            backoff.resetToMax();
        }
        reconnectAttempts++;
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.build("reopening listen stream",
                    LogMessageKeys.CODE, status.getCode(),
                    LogMessageKeys.DESCRIPTION, status.getDescription(),
                    LogMessageKeys.CURR_ATTEMPT, reconnectAttempts,
                    LogMessageKeys.MAX_ATTEMPTS, maxReconnectAttempts,
                    LogMessageKeys.DELAY, backoff.getNextDelayMillis()).toString());
        }
        backoff.delay().thenRun(() -> executor.execute(() -> {
            if (!closed && requestSender == null) {
                openStream();
            }
        }));
    }

    private void failAll(@Nonnull Status status) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("listen stream failed permanently",
                    LogMessageKeys.CODE, status.getCode(),
                    LogMessageKeys.DESCRIPTION, status.getDescription()));
        }
        closed = true;
        closeStream();
        DocumentStoreException error = DocumentStoreExceptions.fromStatus(status);
        List<SnapshotListener> failed = new ArrayList<>(listeners.values());
        listeners.clear();
        for (SnapshotListener listener : failed) {
            listener.onError(error);
        }
    }

    private final class ResponseObserver implements StreamObserver<ListenResponse> {
        private final int streamGeneration;

        ResponseObserver(int streamGeneration) {
            this.streamGeneration = streamGeneration;
        }

        private boolean isCurrent() {
            return streamGeneration == generation && !closed;
        }

        @Override
        public void onNext(@Nonnull ListenResponse response) {
            executor.execute(() -> {
                if (isCurrent()) {
                    reconnectAttempts = 0;
                    backoff.reset();
                    apply(reconciler.onResponse(response));
                }
            });
        }

        @Override
        public void onError(@Nonnull Throwable t) {
            executor.execute(() -> {
                if (isCurrent()) {
                    onStreamFailure(Status.fromThrowable(t));
                }
            });
        }

        @Override
        public void onCompleted() {
            executor.execute(() -> {
                if (isCurrent()) {
                    onStreamFailure(Status.UNAVAILABLE.withDescription("listen stream closed by the server"));
                }
            });
        }
    }
}
