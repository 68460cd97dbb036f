/*
 * Value.java
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
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A field value. Exactly one kind of payload is present, chosen by the static factory used to
 * create the value. Structural equality ({@link #equals(Object)}) distinguishes integers from
 * doubles; query semantics, which compare numbers by value, live in {@link Values}.
 */
public abstract class Value {

    /**
     * The kinds of value, in the order used when values of different kinds are sorted.
     * Integers and doubles share a position and sort together as numbers.
     */
    public enum Kind {
        NULL(0),
        BOOLEAN(1),
        INTEGER(2),
        DOUBLE(2),
        TIMESTAMP(3),
        STRING(4),
        BYTES(5),
        REFERENCE(6),
        GEO_POINT(7),
        ARRAY(8),
        MAP(9);

        private final int typeOrder;

        Kind(int typeOrder) {
            this.typeOrder = typeOrder;
        }

        public int getTypeOrder() {
            return typeOrder;
        }
    }

    private static final Value NULL_VALUE = new NullValue();
    private static final Value TRUE_VALUE = new BooleanValue(true);
    private static final Value FALSE_VALUE = new BooleanValue(false);

    Value() {
    }

    @Nonnull
    public abstract Kind getKind();

    public boolean isNull() {
        return getKind() == Kind.NULL;
    }

    public boolean isNumber() {
        return getKind() == Kind.INTEGER || getKind() == Kind.DOUBLE;
    }

    public boolean isNaN() {
        return getKind() == Kind.DOUBLE && Double.isNaN(getDoubleValue());
    }

    public boolean isArray() {
        return getKind() == Kind.ARRAY;
    }

    public boolean isMap() {
        return getKind() == Kind.MAP;
    }

    public boolean getBooleanValue() {
        throw wrongKind(Kind.BOOLEAN);
    }

    public long getIntegerValue() {
        throw wrongKind(Kind.INTEGER);
    }

    public double getDoubleValue() {
        throw wrongKind(Kind.DOUBLE);
    }

    /**
     * Numeric payload of an integer or double value as a {@code double}.
     *
     * @return the number
     */
    public double asDouble() {
        if (getKind() == Kind.INTEGER) {
            return getIntegerValue();
        }
        return getDoubleValue();
    }

    @Nonnull
    public Timestamp getTimestampValue() {
        throw wrongKind(Kind.TIMESTAMP);
    }

    @Nonnull
    public String getStringValue() {
        throw wrongKind(Kind.STRING);
    }

    @Nonnull
    public ByteString getBytesValue() {
        throw wrongKind(Kind.BYTES);
    }

    @Nonnull
    public String getReferenceValue() {
        throw wrongKind(Kind.REFERENCE);
    }

    @Nonnull
    public GeoPoint getGeoPointValue() {
        throw wrongKind(Kind.GEO_POINT);
    }

    @Nonnull
    public List<Value> getArrayValue() {
        throw wrongKind(Kind.ARRAY);
    }

    @Nonnull
    public Map<String, Value> getMapValue() {
        throw wrongKind(Kind.MAP);
    }

    private IllegalStateException wrongKind(@Nonnull Kind expected) {
        return new IllegalStateException("value of kind " + getKind() + " is not " + expected);
    }

    @Nonnull
    public static Value nullValue() {
        return NULL_VALUE;
    }

    @Nonnull
    public static Value booleanValue(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    @Nonnull
    public static Value integerValue(long value) {
        return new IntegerValue(value);
    }

    @Nonnull
    public static Value doubleValue(double value) {
        return new DoubleValue(value);
    }

    @Nonnull
    public static Value timestampValue(@Nonnull Timestamp value) {
        return new TimestampValue(Timestamps.checkValid(value));
    }

    @Nonnull
    public static Value stringValue(@Nonnull String value) {
        return new StringValue(value);
    }

    @Nonnull
    public static Value bytesValue(@Nonnull ByteString value) {
        return new BytesValue(value);
    }

    @Nonnull
    public static Value bytesValue(@Nonnull byte[] value) {
        return new BytesValue(ByteString.copyFrom(value));
    }

    /**
     * A reference to another document, by its full name.
     *
     * @param documentName full document name
     * @return the reference value
     */
    @Nonnull
    public static Value referenceValue(@Nonnull String documentName) {
        return new ReferenceValue(documentName);
    }

    @Nonnull
    public static Value geoPointValue(@Nonnull GeoPoint value) {
        return new GeoPointValue(value);
    }

    @Nonnull
    public static Value arrayValue(@Nonnull List<Value> values) {
        return new ArrayValue(ImmutableList.copyOf(values));
    }

    @Nonnull
    public static Value arrayValue(@Nonnull Value... values) {
        return new ArrayValue(ImmutableList.copyOf(values));
    }

    @Nonnull
    public static Value mapValue(@Nonnull Map<String, Value> values) {
        return new MapValue(ImmutableMap.copyOf(values));
    }

    private static final class NullValue extends Value {
        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.NULL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NullValue;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    private static final class BooleanValue extends Value {
        private final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.BOOLEAN;
        }

        @Override
        public boolean getBooleanValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanValue && ((BooleanValue)o).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    private static final class IntegerValue extends Value {
        private final long value;

        IntegerValue(long value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.INTEGER;
        }

        @Override
        public long getIntegerValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerValue && ((IntegerValue)o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    private static final class DoubleValue extends Value {
        private final double value;

        DoubleValue(double value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.DOUBLE;
        }

        @Override
        public double getDoubleValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DoubleValue && Double.compare(((DoubleValue)o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    private static final class TimestampValue extends Value {
        @Nonnull
        private final Timestamp value;

        TimestampValue(@Nonnull Timestamp value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.TIMESTAMP;
        }

        @Nonnull
        @Override
        public Timestamp getTimestampValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TimestampValue && ((TimestampValue)o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return Timestamps.toString(value);
        }
    }

    private static final class StringValue extends Value {
        @Nonnull
        private final String value;

        StringValue(@Nonnull String value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.STRING;
        }

        @Nonnull
        @Override
        public String getStringValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StringValue && ((StringValue)o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    private static final class BytesValue extends Value {
        @Nonnull
        private final ByteString value;

        BytesValue(@Nonnull ByteString value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.BYTES;
        }

        @Nonnull
        @Override
        public ByteString getBytesValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue && ((BytesValue)o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "bytes" + Arrays.toString(value.toByteArray());
        }
    }

    private static final class ReferenceValue extends Value {
        @Nonnull
        private final String value;

        ReferenceValue(@Nonnull String value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.REFERENCE;
        }

        @Nonnull
        @Override
        public String getReferenceValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ReferenceValue && ((ReferenceValue)o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.REFERENCE, value);
        }

        @Override
        public String toString() {
            return "ref(" + value + ")";
        }
    }

    private static final class GeoPointValue extends Value {
        @Nonnull
        private final GeoPoint value;

        GeoPointValue(@Nonnull GeoPoint value) {
            this.value = value;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.GEO_POINT;
        }

        @Nonnull
        @Override
        public GeoPoint getGeoPointValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof GeoPointValue && ((GeoPointValue)o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    private static final class ArrayValue extends Value {
        @Nonnull
        private final ImmutableList<Value> values;

        ArrayValue(@Nonnull ImmutableList<Value> values) {
            this.values = values;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.ARRAY;
        }

        @Nonnull
        @Override
        public List<Value> getArrayValue() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ArrayValue && ((ArrayValue)o).values.equals(values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    private static final class MapValue extends Value {
        @Nonnull
        private final ImmutableMap<String, Value> values;

        MapValue(@Nonnull ImmutableMap<String, Value> values) {
            this.values = values;
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.MAP;
        }

        @Nonnull
        @Override
        public Map<String, Value> getMapValue() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MapValue && ((MapValue)o).values.equals(values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
