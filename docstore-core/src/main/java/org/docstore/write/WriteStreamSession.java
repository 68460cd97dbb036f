/*
 * WriteStreamSession.java
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

import com.google.protobuf.ByteString;
import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Write;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Client side of a write stream. Requests are sent one at a time and each call waits for the
 * response it expects, which hides the asynchronous stream behind blocking calls.
 *
 * <p>
 * A session remembers its stream id and the newest token it received. Every request carries that
 * token, so each write acknowledges the responses before it. After the connection breaks,
 * {@link #resume()} opens a new connection for the same stream and collects the responses the
 * server replays, up to the newest token named in its handshake reply. Tokens are only compared,
 * never interpreted.
 * </p>
 */
public final class WriteStreamSession implements StreamObserver<WriteResponse>, AutoCloseable {
    public static final long TIMEOUT_IN_SECONDS = 30;

    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(WriteStreamSession.class);

    @Nonnull
    private final Function<StreamObserver<WriteResponse>, StreamObserver<WriteRequest>> connectionFactory;
    @Nonnull
    private final BlockingQueue<CompletableFuture<WriteResponse>> responseQueue = new LinkedBlockingQueue<>();
    @Nullable
    private StreamObserver<WriteRequest> requestSender;
    private volatile boolean connected;
    private boolean closed;
    @Nullable
    private String streamId;
    @Nullable
    private ByteString lastToken;

    public WriteStreamSession(@Nonnull Function<StreamObserver<WriteResponse>, StreamObserver<WriteRequest>> connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * Open the stream with a handshake.
     *
     * @return the handshake reply
     */
    @Nonnull
    public synchronized WriteResponse open() {
        checkClosed();
        if (streamId != null) {
            throw new IllegalStateException("write stream already opened");
        }
        connect();
        WriteResponse handshake = sendAndReceive(WriteRequest.handshake());
        streamId = handshake.getStreamId();
        lastToken = handshake.getStreamToken();
        return handshake;
    }

    /**
     * Commit a batch of writes on the stream, acknowledging every earlier response.
     *
     * @param writes the writes, committed atomically
     * @return the response for this batch
     */
    @Nonnull
    public synchronized WriteResponse write(@Nonnull List<Write> writes) {
        if (writes.isEmpty()) {
            throw new IllegalArgumentException("use acknowledge() to send no writes");
        }
        WriteResponse response = sendAndReceive(WriteRequest.writes(checkOpen(), writes));
        lastToken = response.getStreamToken();
        return response;
    }

    /**
     * Acknowledge every response received so far without sending writes.
     */
    public synchronized void acknowledge() {
        send(WriteRequest.acknowledge(checkOpen()));
    }

    /**
     * Reconnect to the same stream after the connection broke.
     *
     * @return responses to requests whose answers had not arrived, in order
     */
    @Nonnull
    public synchronized List<WriteResponse> resume() {
        checkClosed();
        ByteString token = checkStarted();
        String id = streamId;
        if (id == null) {
            throw new IllegalStateException("write stream not opened");
        }
        disconnect();
        responseQueue.clear();
        connect();
        WriteResponse handshake = sendAndReceive(WriteRequest.resume(id, token));
        List<WriteResponse> replayed = new ArrayList<>();
        ByteString newest = token;
        while (!newest.equals(handshake.getStreamToken())) {
            WriteResponse response = receive();
            replayed.add(response);
            newest = response.getStreamToken();
        }
        lastToken = newest;
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("resumed write stream",
                    LogMessageKeys.STREAM_ID, id,
                    LogMessageKeys.UNACKNOWLEDGED, replayed.size()));
        }
        return replayed;
    }

    @Nullable
    public synchronized String getStreamId() {
        return streamId;
    }

    @Nullable
    public synchronized ByteString getLastToken() {
        return lastToken;
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    public void onNext(@Nonnull WriteResponse response) {
        if (!responseQueue.offer(CompletableFuture.completedFuture(response))) {
            throw new IllegalStateException("response queue rejected a response");
        }
    }

    @Override
    public void onError(@Nonnull Throwable t) {
        connected = false;
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("write stream failed",
                    LogMessageKeys.STREAM_ID, streamId,
                    LogMessageKeys.MESSAGE, t.getMessage()));
        }
        responseQueue.add(CompletableFuture.failedFuture(t));
    }

    @Override
    public void onCompleted() {
        connected = false;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        StreamObserver<WriteRequest> sender = requestSender;
        requestSender = null;
        if (sender != null && connected) {
            connected = false;
            sender.onCompleted();
        }
    }

    private void connect() {
        connected = true;
        requestSender = connectionFactory.apply(this);
    }

    private void disconnect() {
        StreamObserver<WriteRequest> sender = requestSender;
        requestSender = null;
        if (sender != null && connected) {
            connected = false;
            sender.onError(new IllegalStateException("write stream abandoned for resume"));
        }
    }

    @Nonnull
    private WriteResponse sendAndReceive(@Nonnull WriteRequest request) {
        send(request);
        return receive();
    }

    private void send(@Nonnull WriteRequest request) {
        StreamObserver<WriteRequest> sender = requestSender;
        if (sender == null || !connected) {
            throw new IllegalStateException("write stream is not connected");
        }
        sender.onNext(request);
    }

    @Nonnull
    private WriteResponse receive() {
        try {
            CompletableFuture<WriteResponse> response = responseQueue.poll(TIMEOUT_IN_SECONDS, TimeUnit.SECONDS);
            if (response == null) {
                throw new DocumentStoreExceptions.UnavailableException("timed out waiting for write response",
                        LogMessageKeys.STREAM_ID, streamId);
            }
            return response.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DocumentStoreExceptions.wrap(e);
        } catch (CompletionException e) {
            throw DocumentStoreExceptions.wrap(e);
        }
    }

    @Nonnull
    private ByteString checkOpen() {
        checkClosed();
        return checkStarted();
    }

    @Nonnull
    private ByteString checkStarted() {
        ByteString token = lastToken;
        if (token == null) {
            throw new IllegalStateException("write stream not opened");
        }
        return token;
    }

    private void checkClosed() {
        if (closed) {
            throw new IllegalStateException("write stream session is closed");
        }
    }
}
