/*
 * AggregateField.java
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

import org.docstore.model.FieldPath;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One aggregate computed over the results of a query.
 */
public final class AggregateField {

    /**
     * The supported aggregate functions.
     */
    public enum Kind {
        COUNT,
        SUM,
        AVG
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final FieldPath field;

    private AggregateField(@Nonnull Kind kind, @Nullable FieldPath field) {
        this.kind = kind;
        this.field = field;
    }

    @Nonnull
    public static AggregateField count() {
        return new AggregateField(Kind.COUNT, null);
    }

    /**
     * Sum of the numeric values of a field. Documents where the field is missing or not a number
     * are ignored. The sum stays an integer while every summed value is an integer and it does not
     * overflow.
     *
     * @param fieldPath dotted path of the field to sum
     * @return the aggregate
     */
    @Nonnull
    public static AggregateField sum(@Nonnull String fieldPath) {
        return new AggregateField(Kind.SUM, FieldPath.parse(fieldPath));
    }

    /**
     * Average of the numeric values of a field, as a double, or null when there are none.
     *
     * @param fieldPath dotted path of the field to average
     * @return the aggregate
     */
    @Nonnull
    public static AggregateField average(@Nonnull String fieldPath) {
        return new AggregateField(Kind.AVG, FieldPath.parse(fieldPath));
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nullable
    public FieldPath getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateField)) {
            return false;
        }
        AggregateField that = (AggregateField)o;
        return kind == that.kind && Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, field);
    }

    @Override
    public String toString() {
        return field == null ? kind.name().toLowerCase() : kind.name().toLowerCase() + "(" + field.canonicalString() + ")";
    }
}
