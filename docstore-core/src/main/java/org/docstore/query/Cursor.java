/*
 * Cursor.java
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

package org.docstore.query;

import com.google.common.collect.ImmutableList;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A position in the ordered result of a query, given as values for the query's sort keys.
 * {@code before} says whether the position lies just before a document with those values
 * or just after it: a start cursor with {@code before} set includes that document, an end
 * cursor with {@code before} set excludes it.
 */
public final class Cursor {
    @Nonnull
    private final ImmutableList<Value> values;
    private final boolean before;

    public Cursor(@Nonnull List<Value> values, boolean before) {
        this.values = ImmutableList.copyOf(values);
        this.before = before;
    }

    /**
     * Start cursor that includes documents equal to {@code values}.
     *
     * @param values sort key values
     * @return the cursor
     */
    @Nonnull
    public static Cursor startAt(@Nonnull Value... values) {
        return new Cursor(Arrays.asList(values), true);
    }

    @Nonnull
    public static Cursor startAfter(@Nonnull Value... values) {
        return new Cursor(Arrays.asList(values), false);
    }

    @Nonnull
    public static Cursor endBefore(@Nonnull Value... values) {
        return new Cursor(Arrays.asList(values), true);
    }

    /**
     * End cursor that includes documents equal to {@code values}.
     *
     * @param values sort key values
     * @return the cursor
     */
    @Nonnull
    public static Cursor endAt(@Nonnull Value... values) {
        return new Cursor(Arrays.asList(values), false);
    }

    @Nonnull
    public List<Value> getValues() {
        return values;
    }

    public boolean isBefore() {
        return before;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cursor)) {
            return false;
        }
        Cursor that = (Cursor)o;
        return before == that.before && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, before);
    }

    @Override
    public String toString() {
        return (before ? "before" : "after") + values;
    }
}
