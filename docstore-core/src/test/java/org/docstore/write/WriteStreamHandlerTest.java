/*
 * WriteStreamHandlerTest.java
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
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.grpc.Status;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Write;
import org.docstore.test.ManualClock;
import org.docstore.test.RecordingObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.docstore.test.TestDocuments.name;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WriteStreamHandler}.
 */
class WriteStreamHandlerTest {
    private static final int MAX_UNACKNOWLEDGED = 2;

    private final List<List<Write>> committed = new ArrayList<>();
    private ManualClock clock;
    private WriteStreamRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        registry = new WriteStreamRegistry(clock);
    }

    private CommitResponse commit(List<Write> writes) {
        committed.add(writes);
        return new CommitResponse(Timestamp.newBuilder().setSeconds(committed.size()).build(), ImmutableList.of());
    }

    private WriteStreamHandler connect(RecordingObserver<WriteResponse> observer) {
        return new WriteStreamHandler(this::commit, registry, MAX_UNACKNOWLEDGED, observer);
    }

    private static List<Write> batch(String id) {
        return ImmutableList.of(Write.delete(name("docs/" + id)));
    }

    @Test
    void handshakeOpensStream() {
        RecordingObserver<WriteResponse> observer = new RecordingObserver<>();
        WriteStreamHandler handler = connect(observer);
        handler.onNext(WriteRequest.handshake());
        WriteResponse handshake = observer.last();
        assertNotNull(handler.getStreamId());
        assertEquals(handler.getStreamId(), handshake.getStreamId());
        assertEquals(StreamTokens.encode(0), handshake.getStreamToken());
        assertNull(handshake.getCommitTime());
        assertTrue(registry.contains(handshake.getStreamId()));

        handler.onNext(WriteRequest.writes(handshake.getStreamToken(), batch("a")));
        WriteResponse first = observer.last();
        assertEquals(Timestamp.newBuilder().setSeconds(1).build(), first.getCommitTime());
        assertThat(committed, contains(batch("a")));

        handler.onCompleted();
        assertTrue(observer.isCompleted());
        assertFalse(registry.contains(handshake.getStreamId()));
    }

    @Test
    void unacknowledgedWindowIsBounded() {
        RecordingObserver<WriteResponse> observer = new RecordingObserver<>();
        WriteStreamHandler handler = connect(observer);
        handler.onNext(WriteRequest.handshake());
        ByteString start = observer.last().getStreamToken();
        handler.onNext(WriteRequest.writes(start, batch("a")));
        handler.onNext(WriteRequest.writes(start, batch("b")));
        handler.onNext(WriteRequest.writes(start, batch("c")));
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, observer.getErrorCode());
        assertThat(committed, hasSize(2));

        // the stream is closed; nothing more is committed
        handler.onNext(WriteRequest.writes(start, batch("d")));
        assertThat(committed, hasSize(2));
    }

    @Test
    void acknowledgingReopensTheWindow() {
        RecordingObserver<WriteResponse> observer = new RecordingObserver<>();
        WriteStreamHandler handler = connect(observer);
        handler.onNext(WriteRequest.handshake());
        ByteString start = observer.last().getStreamToken();
        handler.onNext(WriteRequest.writes(start, batch("a")));
        handler.onNext(WriteRequest.writes(start, batch("b")));
        handler.onNext(WriteRequest.acknowledge(observer.last().getStreamToken()));
        handler.onNext(WriteRequest.writes(observer.last().getStreamToken(), batch("c")));
        handler.onNext(WriteRequest.writes(observer.last().getStreamToken(), batch("d")));
        assertNull(observer.getError());
        assertThat(committed, hasSize(4));
    }

    @Test
    void resumeReplaysUnacknowledgedResponses() {
        RecordingObserver<WriteResponse> first = new RecordingObserver<>();
        WriteStreamHandler handler = connect(first);
        handler.onNext(WriteRequest.handshake());
        String streamId = handler.getStreamId();
        handler.onNext(WriteRequest.writes(first.last().getStreamToken(), batch("a")));
        ByteString seen = first.last().getStreamToken();
        handler.onNext(WriteRequest.writes(seen, batch("b")));
        WriteResponse lost = first.last();
        handler.onError(new IllegalStateException("connection reset"));
        assertTrue(registry.contains(streamId));

        RecordingObserver<WriteResponse> second = new RecordingObserver<>();
        WriteStreamHandler resumed = connect(second);
        resumed.onNext(WriteRequest.resume(streamId, seen));
        List<WriteResponse> responses = second.drain();
        assertThat(responses, hasSize(2));
        assertEquals(lost.getStreamToken(), responses.get(0).getStreamToken());
        assertEquals(lost.getStreamToken(), responses.get(1).getStreamToken());
        assertEquals(lost.getCommitTime(), responses.get(1).getCommitTime());
        assertThat(committed, hasSize(2));

        resumed.onNext(WriteRequest.writes(lost.getStreamToken(), batch("c")));
        assertThat(second.drain(), hasSize(1));
        assertThat(committed, hasSize(3));
    }

    @Test
    void resumeWithNothingMissing() {
        RecordingObserver<WriteResponse> first = new RecordingObserver<>();
        WriteStreamHandler handler = connect(first);
        handler.onNext(WriteRequest.handshake());
        handler.onNext(WriteRequest.writes(first.last().getStreamToken(), batch("a")));
        handler.onError(new IllegalStateException("gone"));

        RecordingObserver<WriteResponse> second = new RecordingObserver<>();
        connect(second).onNext(WriteRequest.resume(handler.getStreamId(), first.last().getStreamToken()));
        assertThat(second.getValues(), hasSize(1));
    }

    @Test
    void malformedRequestsCloseTheStream() {
        RecordingObserver<WriteResponse> writesFirst = new RecordingObserver<>();
        connect(writesFirst).onNext(WriteRequest.writes(StreamTokens.encode(0), batch("a")));
        assertEquals(Status.Code.INVALID_ARGUMENT, writesFirst.getErrorCode());

        RecordingObserver<WriteResponse> unknown = new RecordingObserver<>();
        connect(unknown).onNext(WriteRequest.resume("no-such-stream", StreamTokens.encode(0)));
        assertEquals(Status.Code.NOT_FOUND, unknown.getErrorCode());

        RecordingObserver<WriteResponse> future = new RecordingObserver<>();
        WriteStreamHandler handler = connect(future);
        handler.onNext(WriteRequest.handshake());
        handler.onNext(WriteRequest.writes(StreamTokens.encode(5), batch("a")));
        assertEquals(Status.Code.INVALID_ARGUMENT, future.getErrorCode());

        RecordingObserver<WriteResponse> garbage = new RecordingObserver<>();
        WriteStreamHandler other = connect(garbage);
        other.onNext(WriteRequest.handshake());
        other.onNext(WriteRequest.writes(ByteString.copyFromUtf8("x"), batch("a")));
        assertEquals(Status.Code.INVALID_ARGUMENT, garbage.getErrorCode());
        assertThat(committed, empty());
    }

    @Test
    void commitFailureClosesWithItsStatus() {
        RecordingObserver<WriteResponse> observer = new RecordingObserver<>();
        WriteStreamHandler handler = new WriteStreamHandler(writes -> {
            throw new DocumentStoreExceptions.FailedPreconditionException("precondition failed", 0);
        }, registry, MAX_UNACKNOWLEDGED, observer);
        handler.onNext(WriteRequest.handshake());
        handler.onNext(WriteRequest.writes(observer.last().getStreamToken(), batch("a")));
        assertEquals(Status.Code.FAILED_PRECONDITION, observer.getErrorCode());
        assertFalse(observer.isCompleted());
    }

    @Test
    void detachedStreamsExpireWhenIdle() {
        RecordingObserver<WriteResponse> brokenObserver = new RecordingObserver<>();
        WriteStreamHandler broken = connect(brokenObserver);
        broken.onNext(WriteRequest.handshake());
        broken.onNext(WriteRequest.writes(brokenObserver.last().getStreamToken(), batch("a")));
        broken.onError(new IllegalStateException("connection reset"));

        RecordingObserver<WriteResponse> liveObserver = new RecordingObserver<>();
        WriteStreamHandler live = connect(liveObserver);
        live.onNext(WriteRequest.handshake());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(0, registry.expireIdle(Duration.ofSeconds(60)));
        assertTrue(registry.contains(broken.getStreamId()));

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, registry.expireIdle(Duration.ofSeconds(60)));
        assertFalse(registry.contains(broken.getStreamId()));
        assertTrue(registry.contains(live.getStreamId()));

        RecordingObserver<WriteResponse> late = new RecordingObserver<>();
        connect(late).onNext(WriteRequest.resume(broken.getStreamId(), brokenObserver.last().getStreamToken()));
        assertEquals(Status.Code.NOT_FOUND, late.getErrorCode());
    }

    @Test
    void failedStreamsLeaveTheRegistryUnlessResumable() {
        RecordingObserver<WriteResponse> exhausted = new RecordingObserver<>();
        WriteStreamHandler full = connect(exhausted);
        full.onNext(WriteRequest.handshake());
        ByteString start = exhausted.last().getStreamToken();
        for (String id : ImmutableList.of("a", "b", "c")) {
            full.onNext(WriteRequest.writes(start, batch(id)));
        }
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, exhausted.getErrorCode());
        assertTrue(registry.contains(full.getStreamId()));
        clock.advance(Duration.ofSeconds(61));
        assertEquals(1, registry.expireIdle(Duration.ofSeconds(60)));

        RecordingObserver<WriteResponse> rejected = new RecordingObserver<>();
        WriteStreamHandler failing = new WriteStreamHandler(writes -> {
            throw new DocumentStoreExceptions.FailedPreconditionException("precondition failed", 0);
        }, registry, MAX_UNACKNOWLEDGED, rejected);
        failing.onNext(WriteRequest.handshake());
        failing.onNext(WriteRequest.writes(rejected.last().getStreamToken(), batch("a")));
        assertEquals(Status.Code.FAILED_PRECONDITION, rejected.getErrorCode());
        assertFalse(registry.contains(failing.getStreamId()));
        assertEquals(0, registry.size());
    }
}
