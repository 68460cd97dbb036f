/*
 * FieldTransforms.java
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

package org.docstore.write;

import com.google.protobuf.Timestamp;
import org.docstore.model.FieldTransform;
import org.docstore.model.Value;
import org.docstore.model.Values;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the new value of a field under a {@link FieldTransform}.
 */
final class FieldTransforms {

    private FieldTransforms() {
    }

    /**
     * Apply a transform.
     *
     * @param transform the transform
     * @param previous current value of the field, {@code null} if absent
     * @param commitTime time of the commit the transform is part of
     * @return the field's new value
     */
    @Nonnull
    static Value apply(@Nonnull FieldTransform transform, @Nullable Value previous, @Nonnull Timestamp commitTime) {
        switch (transform.getKind()) {
            case SET_TO_SERVER_TIMESTAMP:
                return Value.timestampValue(commitTime);
            case INCREMENT:
                return increment(previous, operand(transform));
            case MAXIMUM:
                return extreme(previous, operand(transform), true);
            case MINIMUM:
                return extreme(previous, operand(transform), false);
            case APPEND_MISSING_ELEMENTS: {
                List<Value> result = new ArrayList<>(elementsOf(previous));
                for (Value element : transform.getElements()) {
                    if (!contains(result, element)) {
                        result.add(element);
                    }
                }
                return Value.arrayValue(result);
            }
            case REMOVE_ALL_FROM_ARRAY: {
                List<Value> result = new ArrayList<>();
                for (Value existing : elementsOf(previous)) {
                    if (!contains(transform.getElements(), existing)) {
                        result.add(existing);
                    }
                }
                return Value.arrayValue(result);
            }
            default:
                throw new IllegalStateException("unsupported transform " + transform.getKind());
        }
    }

    /**
     * The value reported back to the client for a transform.
     *
     * @param transform the transform
     * @param newValue the field's value after the transform
     * @return the commit time or number written, or null for array transforms
     */
    @Nonnull
    static Value result(@Nonnull FieldTransform transform, @Nonnull Value newValue) {
        switch (transform.getKind()) {
            case APPEND_MISSING_ELEMENTS:
            case REMOVE_ALL_FROM_ARRAY:
                return Value.nullValue();
            default:
                return newValue;
        }
    }

    @Nonnull
    private static Value operand(@Nonnull FieldTransform transform) {
        Value operand = transform.getOperand();
        if (operand == null) {
            throw new IllegalStateException("numeric transform without operand");
        }
        return operand;
    }

    @Nonnull
    private static Value increment(@Nullable Value previous, @Nonnull Value operand) {
        if (previous == null || !previous.isNumber()) {
            return operand;
        }
        if (previous.getKind() == Value.Kind.INTEGER && operand.getKind() == Value.Kind.INTEGER) {
            long left = previous.getIntegerValue();
            long right = operand.getIntegerValue();
            long sum = left + right;
            // overflow iff both operands have the sign opposite to the result
            if (((left ^ sum) & (right ^ sum)) < 0) {
                return Value.integerValue(left < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
            }
            return Value.integerValue(sum);
        }
        return Value.doubleValue(previous.asDouble() + operand.asDouble());
    }

    @Nonnull
    private static Value extreme(@Nullable Value previous, @Nonnull Value operand, boolean maximum) {
        if (previous == null || !previous.isNumber()) {
            return operand;
        }
        if (previous.isNaN() || operand.isNaN()) {
            return Value.doubleValue(Double.NaN);
        }
        int cmp = Values.compare(operand, previous);
        return (maximum ? cmp > 0 : cmp < 0) ? operand : previous;
    }

    @Nonnull
    private static List<Value> elementsOf(@Nullable Value previous) {
        return previous != null && previous.isArray() ? previous.getArrayValue() : List.of();
    }

    private static boolean contains(@Nonnull List<Value> values, @Nonnull Value element) {
        for (Value value : values) {
            if (Values.equivalent(value, element)) {
                return true;
            }
        }
        return false;
    }
}
