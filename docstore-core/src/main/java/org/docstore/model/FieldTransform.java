/*
 * FieldTransform.java
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

package org.docstore.model;

import com.google.common.collect.ImmutableList;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A server-side change to one field, applied after the rest of a write.
 */
public final class FieldTransform {

    /**
     * The supported transformations.
     */
    public enum Kind {
        /** Set the field to the commit time. */
        SET_TO_SERVER_TIMESTAMP,
        INCREMENT,
        MAXIMUM,
        MINIMUM,
        /** Append the given elements that are not already present. */
        APPEND_MISSING_ELEMENTS,
        /** Remove every occurrence of the given elements. */
        REMOVE_ALL_FROM_ARRAY
    }

    @Nonnull
    private final FieldPath fieldPath;
    @Nonnull
    private final Kind kind;
    @Nullable
    private final Value operand;

    private FieldTransform(@Nonnull FieldPath fieldPath, @Nonnull Kind kind, @Nullable Value operand) {
        this.fieldPath = fieldPath;
        this.kind = kind;
        this.operand = operand;
    }

    @Nonnull
    public static FieldTransform serverTimestamp(@Nonnull FieldPath fieldPath) {
        return new FieldTransform(fieldPath, Kind.SET_TO_SERVER_TIMESTAMP, null);
    }

    @Nonnull
    public static FieldTransform increment(@Nonnull FieldPath fieldPath, @Nonnull Value operand) {
        return new FieldTransform(fieldPath, Kind.INCREMENT, requireNumber(fieldPath, operand));
    }

    @Nonnull
    public static FieldTransform maximum(@Nonnull FieldPath fieldPath, @Nonnull Value operand) {
        return new FieldTransform(fieldPath, Kind.MAXIMUM, requireNumber(fieldPath, operand));
    }

    @Nonnull
    public static FieldTransform minimum(@Nonnull FieldPath fieldPath, @Nonnull Value operand) {
        return new FieldTransform(fieldPath, Kind.MINIMUM, requireNumber(fieldPath, operand));
    }

    @Nonnull
    public static FieldTransform appendMissingElements(@Nonnull FieldPath fieldPath, @Nonnull List<Value> elements) {
        return new FieldTransform(fieldPath, Kind.APPEND_MISSING_ELEMENTS, Value.arrayValue(elements));
    }

    @Nonnull
    public static FieldTransform removeAllFromArray(@Nonnull FieldPath fieldPath, @Nonnull List<Value> elements) {
        return new FieldTransform(fieldPath, Kind.REMOVE_ALL_FROM_ARRAY, Value.arrayValue(elements));
    }

    @Nonnull
    private static Value requireNumber(@Nonnull FieldPath fieldPath, @Nonnull Value operand) {
        if (!operand.isNumber()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("numeric transform needs a number operand",
                    LogMessageKeys.FIELD_PATH, fieldPath, "operand", operand);
        }
        return operand;
    }

    @Nonnull
    public FieldPath getFieldPath() {
        return fieldPath;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * The number for numeric transforms, or an array value holding the elements of an array transform.
     *
     * @return the operand, {@code null} for server timestamps
     */
    @Nullable
    public Value getOperand() {
        return operand;
    }

    @Nonnull
    public List<Value> getElements() {
        return operand != null && operand.isArray() ? operand.getArrayValue() : ImmutableList.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldTransform)) {
            return false;
        }
        FieldTransform that = (FieldTransform)o;
        return fieldPath.equals(that.fieldPath) && kind == that.kind && Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldPath, kind, operand);
    }

    @Override
    public String toString() {
        return kind + "(" + fieldPath + (operand == null ? "" : ", " + operand) + ")";
    }
}
