/*
 * CursorResult.java
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
import javax.annotation.Nullable;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * One step of a {@link ResultCursor}: either a value or the end of the sequence.
 *
 * @param <T> type of the value
 */
public final class CursorResult<T> {
    @SuppressWarnings("rawtypes")
    private static final CursorResult EXHAUSTED = new CursorResult<>(false, null);

    private final boolean hasNext;
    @Nullable
    private final T nextValue;

    private CursorResult(boolean hasNext, @Nullable T nextValue) {
        this.hasNext = hasNext;
        this.nextValue = nextValue;
    }

    @Nonnull
    public static <T> CursorResult<T> withNextValue(@Nonnull T nextValue) {
        return new CursorResult<>(true, nextValue);
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> CursorResult<T> exhausted() {
        return (CursorResult<T>)EXHAUSTED;
    }

    public boolean hasNext() {
        return hasNext;
    }

    /**
     * The value of this step.
     *
     * @return the value
     * @throws NoSuchElementException if the cursor was exhausted
     */
    @Nonnull
    public T get() {
        if (!hasNext || nextValue == null) {
            throw new NoSuchElementException("cursor is exhausted");
        }
        return nextValue;
    }

    @Nonnull
    public <V> CursorResult<V> map(@Nonnull Function<? super T, ? extends V> func) {
        return hasNext ? withNextValue(func.apply(get())) : exhausted();
    }

    @Override
    public String toString() {
        return hasNext ? "CursorResult{" + nextValue + "}" : "CursorResult{exhausted}";
    }
}
