/*
 * ResultCursor.java
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

package org.docstore.cursors;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * An ordered, finite sequence of results produced one at a time, such as the responses of a
 * query or of a batch get. A cursor is single-use and should be closed once the caller is
 * done with it, even if it was not read to the end.
 *
 * @param <T> type of the results
 */
public interface ResultCursor<T> extends AutoCloseable {

    /**
     * Produce the next result synchronously.
     *
     * @return the next result, or an exhausted result when the cursor is done
     */
    @Nonnull
    CursorResult<T> getNext();

    /**
     * Asynchronous form of {@link #getNext()}.
     *
     * @return a future of the next result
     */
    @Nonnull
    default CompletableFuture<CursorResult<T>> onNext() {
        return CompletableFuture.completedFuture(getNext());
    }

    @Override
    void close();

    boolean isClosed();

    /**
     * Drain the cursor into a list and close it.
     *
     * @return every remaining result
     */
    @Nonnull
    default List<T> asList() {
        List<T> results = new ArrayList<>();
        forEach(results::add);
        return results;
    }

    /**
     * Apply {@code consumer} to every remaining result and close the cursor.
     *
     * @param consumer operation to apply
     */
    default void forEach(@Nonnull Consumer<? super T> consumer) {
        try {
            CursorResult<T> result = getNext();
            while (result.hasNext()) {
                consumer.accept(result.get());
                result = getNext();
            }
        } finally {
            close();
        }
    }

    @Nonnull
    default <V> ResultCursor<V> map(@Nonnull Function<? super T, ? extends V> func) {
        return new MapCursor<>(this, func);
    }
}
