/*
 * FieldFilter.java
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

import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.FieldPath;
import org.docstore.model.Value;
import org.docstore.model.Values;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares one field of a document with a constant.
 */
public class FieldFilter extends Filter {

    /**
     * The comparison to perform.
     */
    public enum Operator {
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        ARRAY_CONTAINS("array-contains"),
        IN("in"),
        ARRAY_CONTAINS_ANY("array-contains-any"),
        NOT_IN("not-in");

        @Nonnull
        private final String symbol;

        Operator(@Nonnull String symbol) {
            this.symbol = symbol;
        }

        /**
         * Whether the operand is a list of candidates rather than a single value.
         *
         * @return {@code true} for the list operators
         */
        public boolean takesList() {
            return this == IN || this == NOT_IN || this == ARRAY_CONTAINS_ANY;
        }

        public boolean isInequality() {
            return this == LESS_THAN || this == LESS_THAN_OR_EQUAL || this == GREATER_THAN
                    || this == GREATER_THAN_OR_EQUAL || this == NOT_EQUAL || this == NOT_IN;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    @Nonnull
    private final FieldPath field;
    @Nonnull
    private final Operator operator;
    @Nonnull
    private final Value value;

    public FieldFilter(@Nonnull FieldPath field, @Nonnull Operator operator, @Nonnull Value value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    @Nonnull
    public FieldPath getField() {
        return field;
    }

    @Nonnull
    public Operator getOperator() {
        return operator;
    }

    @Nonnull
    public Value getValue() {
        return value;
    }

    @Override
    public boolean matches(@Nonnull Document document) {
        Optional<Value> fieldValue = document.getValue(field);
        return fieldValue.isPresent() && evalComparison(operator, fieldValue.get(), value);
    }

    /**
     * Apply {@code operator} to a document value and the filter's operand.
     *
     * @param operator the comparison
     * @param value value taken from the document
     * @param comparand the filter's operand
     * @return whether the comparison holds
     */
    static boolean evalComparison(@Nonnull Operator operator, @Nonnull Value value, @Nonnull Value comparand) {
        switch (operator) {
            case EQUAL:
                return Values.equivalent(value, comparand);
            case NOT_EQUAL:
                return !value.isNull() && !Values.equivalent(value, comparand);
            case LESS_THAN:
                return Values.comparable(value, comparand) && Values.compare(value, comparand) < 0;
            case LESS_THAN_OR_EQUAL:
                return Values.comparable(value, comparand) && Values.compare(value, comparand) <= 0;
            case GREATER_THAN:
                return Values.comparable(value, comparand) && Values.compare(value, comparand) > 0;
            case GREATER_THAN_OR_EQUAL:
                return Values.comparable(value, comparand) && Values.compare(value, comparand) >= 0;
            case ARRAY_CONTAINS:
                return Values.arrayContains(value, comparand);
            case IN:
                return Values.arrayContains(comparand, value);
            case NOT_IN:
                return !value.isNull() && !Values.arrayContains(comparand, value);
            case ARRAY_CONTAINS_ANY:
                if (!value.isArray()) {
                    return false;
                }
                for (Value candidate : comparand.getArrayValue()) {
                    if (Values.arrayContains(value, candidate)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("unsupported operator " + operator);
        }
    }

    @Override
    public void validate() {
        if (operator.takesList()) {
            if (!value.isArray() || value.getArrayValue().isEmpty()) {
                throw invalid("operator needs a non-empty array operand");
            }
            for (Value element : value.getArrayValue()) {
                checkOperand(element);
            }
        } else {
            checkOperand(value);
        }
    }

    private void checkOperand(@Nonnull Value operand) {
        if (operand.isNull() || operand.isNaN()) {
            throw invalid("null and NaN can only be tested with unary filters");
        }
        if (field.isDocumentName() && operand.getKind() != Value.Kind.REFERENCE) {
            throw invalid("document name filters need reference operands");
        }
    }

    @Nonnull
    private DocumentStoreExceptions.InvalidArgumentException invalid(@Nonnull String message) {
        return new DocumentStoreExceptions.InvalidArgumentException(message,
                LogMessageKeys.FIELD_PATH, field, LogMessageKeys.OPERATOR, operator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldFilter that = (FieldFilter)o;
        return field.equals(that.field) && operator == that.operator && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + value;
    }
}
