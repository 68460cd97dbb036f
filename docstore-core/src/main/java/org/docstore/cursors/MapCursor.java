/*
 * MapCursor.java
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
import java.util.function.Function;

/**
 * A cursor that applies a function to each result of another cursor.
 *
 * @param <T> type of the inner results
 * @param <V> type of the mapped results
 */
public class MapCursor<T, V> implements ResultCursor<V> {
    @Nonnull
    private final ResultCursor<T> inner;
    @Nonnull
    private final Function<? super T, ? extends V> func;

    public MapCursor(@Nonnull ResultCursor<T> inner, @Nonnull Function<? super T, ? extends V> func) {
        this.inner = inner;
        this.func = func;
    }

    @Nonnull
    @Override
    public CursorResult<V> getNext() {
        return inner.getNext().map(func);
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public boolean isClosed() {
        return inner.isClosed();
    }
}
