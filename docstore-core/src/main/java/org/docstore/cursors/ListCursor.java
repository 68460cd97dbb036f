/*
 * ListCursor.java
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
import java.util.List;

/**
 * A cursor over the elements of a list that has already been computed.
 *
 * @param <T> type of the elements
 */
public class ListCursor<T> implements ResultCursor<T> {
    @Nonnull
    private final List<T> list;
    private int nextPosition; // position of the next value to return
    private boolean closed = false;

    public ListCursor(@Nonnull List<T> list) {
        this(list, 0);
    }

    public ListCursor(@Nonnull List<T> list, int nextPosition) {
        this.list = list;
        this.nextPosition = nextPosition;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        if (closed || nextPosition >= list.size()) {
            return CursorResult.exhausted();
        }
        return CursorResult.withNextValue(list.get(nextPosition++));
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
