/*
 * UnaryFilter.java
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

import org.docstore.model.Document;
import org.docstore.model.FieldPath;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Optional;

/**
 * Tests one field for null or NaN.
 */
public class UnaryFilter extends Filter {

    /**
     * The test to perform. The negated forms still require the field to exist.
     */
    public enum Operator {
        IS_NAN,
        IS_NULL,
        IS_NOT_NAN,
        IS_NOT_NULL
    }

    @Nonnull
    private final FieldPath field;
    @Nonnull
    private final Operator operator;

    public UnaryFilter(@Nonnull FieldPath field, @Nonnull Operator operator) {
        this.field = field;
        this.operator = operator;
    }

    @Nonnull
    public FieldPath getField() {
        return field;
    }

    @Nonnull
    public Operator getOperator() {
        return operator;
    }

    @Override
    public boolean matches(@Nonnull Document document) {
        Optional<Value> value = document.getValue(field);
        if (value.isEmpty()) {
            return false;
        }
        switch (operator) {
            case IS_NAN:
                return value.get().isNaN();
            case IS_NULL:
                return value.get().isNull();
            case IS_NOT_NAN:
                return !value.get().isNaN();
            case IS_NOT_NULL:
                return !value.get().isNull();
            default:
                throw new IllegalStateException("unsupported operator " + operator);
        }
    }

    @Override
    public void validate() {
        // every field path and operator combination is valid
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryFilter that = (UnaryFilter)o;
        return field.equals(that.field) && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator);
    }

    @Override
    public String toString() {
        return field + " " + operator;
    }
}
