/*
 * WriteStreamHandler.java
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

import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Write;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Function;

/**
 * Server side of one write stream connection.
 *
 * <p>
 * The first request is the handshake. It either opens a new stream or resumes a registered one
 * from the token it names, in which case every response after that token is sent again. Each
 * later request acknowledges responses up to its token and, if it carries writes, commits them
 * as one atomic batch and answers with the next token. A request that would leave more than
 * {@code maxUnacknowledged} responses unacknowledged closes the stream with
 * {@code RESOURCE_EXHAUSTED}; so does any other error, with its own status. After a retriable
 * error or a broken connection the stream stays registered for resumption; after any other error
 * it is dropped.
 * </p>
 */
public class WriteStreamHandler implements StreamObserver<WriteRequest> {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(WriteStreamHandler.class);

    @Nonnull
    private final Function<List<Write>, CommitResponse> committer;
    @Nonnull
    private final WriteStreamRegistry registry;
    private final int maxUnacknowledged;
    @Nonnull
    private final StreamObserver<WriteResponse> responseObserver;
    @Nullable
    private WriteStreamState stream;
    private boolean closed;

    public WriteStreamHandler(@Nonnull Function<List<Write>, CommitResponse> committer,
                              @Nonnull WriteStreamRegistry registry, int maxUnacknowledged,
                              @Nonnull StreamObserver<WriteResponse> responseObserver) {
        this.committer = committer;
        this.registry = registry;
        this.maxUnacknowledged = maxUnacknowledged;
        this.responseObserver = responseObserver;
    }

    @Override
    public synchronized void onNext(@Nonnull WriteRequest request) {
        if (closed) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("ignoring request on closed write stream",
                        LogMessageKeys.STREAM_ID, stream == null ? null : stream.getStreamId()));
            }
            return;
        }
        try {
            if (stream == null) {
                handshake(request);
            } else {
                write(stream, request);
            }
        } catch (RuntimeException e) {
            fail(DocumentStoreExceptions.wrap(e));
        }
    }

    private void handshake(@Nonnull WriteRequest request) {
        if (!request.getWrites().isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("first write stream request must be a handshake",
                    LogMessageKeys.WRITE_COUNT, request.getWrites().size());
        }
        String streamId = request.getStreamId();
        if (streamId == null) {
            if (request.getStreamToken() != null) {
                throw new DocumentStoreExceptions.InvalidArgumentException("stream token given without a stream id");
            }
            stream = registry.create();
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("opened write stream",
                        LogMessageKeys.STREAM_ID, stream.getStreamId()));
            }
            responseObserver.onNext(stream.handshake());
            return;
        }
        if (request.getStreamToken() == null) {
            throw new DocumentStoreExceptions.InvalidArgumentException("resuming a write stream requires a stream token",
                    LogMessageKeys.STREAM_ID, streamId);
        }
        WriteStreamState resumed = registry.get(streamId);
        resumed.acknowledge(StreamTokens.decode(request.getStreamToken()));
        registry.attach(resumed);
        stream = resumed;
        List<WriteResponse> replay = resumed.getUnacknowledged();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("resumed write stream",
                    LogMessageKeys.STREAM_ID, streamId,
                    LogMessageKeys.UNACKNOWLEDGED, replay.size()));
        }
        responseObserver.onNext(resumed.handshake());
        for (WriteResponse response : replay) {
            responseObserver.onNext(response);
        }
    }

    private void write(@Nonnull WriteStreamState current, @Nonnull WriteRequest request) {
        if (request.getStreamId() != null && !request.getStreamId().equals(current.getStreamId())) {
            throw new DocumentStoreExceptions.InvalidArgumentException("request names a different write stream",
                    LogMessageKeys.STREAM_ID, request.getStreamId(),
                    LogMessageKeys.EXPECTED, current.getStreamId());
        }
        if (request.getStreamToken() == null) {
            throw new DocumentStoreExceptions.InvalidArgumentException("write request requires a stream token",
                    LogMessageKeys.STREAM_ID, current.getStreamId());
        }
        current.acknowledge(StreamTokens.decode(request.getStreamToken()));
        registry.attach(current);
        if (request.getWrites().isEmpty()) {
            return;
        }
        int pending = current.getUnacknowledgedCount();
        if (pending >= maxUnacknowledged) {
            throw new DocumentStoreExceptions.ResourceExhaustedException("too many unacknowledged write responses",
                    LogMessageKeys.STREAM_ID, current.getStreamId(),
                    LogMessageKeys.UNACKNOWLEDGED, pending,
                    LogMessageKeys.EXPECTED, maxUnacknowledged);
        }
        CommitResponse committed = committer.apply(request.getWrites());
        WriteResponse response = current.issue(committed.getWriteResults(), committed.getCommitTime());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("committed write stream request",
                    LogMessageKeys.STREAM_ID, current.getStreamId(),
                    LogMessageKeys.STREAM_TOKEN, response.getPosition(),
                    LogMessageKeys.WRITE_COUNT, request.getWrites().size()));
        }
        responseObserver.onNext(response);
    }

    private void fail(@Nonnull DocumentStoreException e) {
        closed = true;
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("closing write stream",
                    LogMessageKeys.STREAM_ID, stream == null ? null : stream.getStreamId(),
                    LogMessageKeys.CODE, e.getCode(),
                    LogMessageKeys.MESSAGE, e.getMessage()));
        }
        if (stream != null) {
            // only a retriable failure leaves something worth resuming
            if (e.isRetriable()) {
                registry.detach(stream);
            } else {
                registry.remove(stream.getStreamId());
            }
        }
        responseObserver.onError(e.toStatusException());
    }

    @Override
    public synchronized void onError(@Nonnull Throwable t) {
        closed = true;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("write stream broken by client",
                    LogMessageKeys.STREAM_ID, stream == null ? null : stream.getStreamId(),
                    LogMessageKeys.MESSAGE, t.getMessage()));
        }
        if (stream != null) {
            registry.detach(stream);
        }
    }

    @Override
    public synchronized void onCompleted() {
        if (closed) {
            return;
        }
        closed = true;
        if (stream != null) {
            registry.remove(stream.getStreamId());
        }
        responseObserver.onCompleted();
    }

    @Nullable
    public synchronized String getStreamId() {
        return stream == null ? null : stream.getStreamId();
    }
}
