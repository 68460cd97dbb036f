/*
 * Order.java
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
import java.util.Objects;

/**
 * One sort key of a query.
 */
public final class Order {

    /**
     * Sort direction.
     */
    public enum Direction {
        ASCENDING,
        DESCENDING;

        int apply(int comparison) {
            return this == ASCENDING ? comparison : -comparison;
        }
    }

    public static final Order BY_NAME = new Order(FieldPath.DOCUMENT_NAME, Direction.ASCENDING);

    @Nonnull
    private final FieldPath field;
    @Nonnull
    private final Direction direction;

    public Order(@Nonnull FieldPath field, @Nonnull Direction direction) {
        this.field = field;
        this.direction = direction;
    }

    @Nonnull
    public static Order ascending(@Nonnull String fieldPath) {
        return new Order(FieldPath.parse(fieldPath), Direction.ASCENDING);
    }

    @Nonnull
    public static Order descending(@Nonnull String fieldPath) {
        return new Order(FieldPath.parse(fieldPath), Direction.DESCENDING);
    }

    @Nonnull
    public FieldPath getField() {
        return field;
    }

    @Nonnull
    public Direction getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Order)) {
            return false;
        }
        Order that = (Order)o;
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + (direction == Direction.ASCENDING ? "asc" : "desc");
    }
}
