/*
 * RecordingObserver.java
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

package org.docstore.test;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A stream observer that keeps everything it is told.
 *
 * @param <T> message type
 */
public class RecordingObserver<T> implements StreamObserver<T> {
    @Nonnull
    private final List<T> values = new ArrayList<>();
    @Nullable
    private Throwable error;
    private boolean completed;

    @Override
    public synchronized void onNext(T value) {
        values.add(value);
    }

    @Override
    public synchronized void onError(Throwable t) {
        error = t;
    }

    @Override
    public synchronized void onCompleted() {
        completed = true;
    }

    @Nonnull
    public synchronized List<T> getValues() {
        return new ArrayList<>(values);
    }

    @Nonnull
    public synchronized T last() {
        return values.get(values.size() - 1);
    }

    /**
     * Values received since the last call.
     *
     * @return the new values
     */
    @Nonnull
    public synchronized List<T> drain() {
        List<T> drained = new ArrayList<>(values);
        values.clear();
        return drained;
    }

    @Nullable
    public synchronized Throwable getError() {
        return error;
    }

    @Nullable
    public synchronized Status.Code getErrorCode() {
        return error == null ? null : Status.fromThrowable(error).getCode();
    }

    public synchronized boolean isCompleted() {
        return completed;
    }
}
