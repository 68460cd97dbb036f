/*
 * Values.java
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

import com.google.common.primitives.UnsignedBytes;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordering, equivalence and field access for {@link Value}s.
 *
 * <p>
 * Values of different kinds order by {@link Value.Kind#getTypeOrder()}. Within a kind:
 * numbers compare by numeric value with NaN below every other number, strings compare in
 * UTF-8 byte order, bytes compare unsigned and lexicographically, references compare segment
 * by segment, geo points by latitude then longitude, arrays element by element and then by
 * length, and maps by their entries in key order and then by size.
 * </p>
 */
public final class Values {
    public static final Comparator<Value> COMPARATOR = Values::compare;

    private static final double TWO_TO_63 = 9.223372036854775808E18;

    private Values() {
    }

    public static int compare(@Nonnull Value left, @Nonnull Value right) {
        int typeCmp = Integer.compare(left.getKind().getTypeOrder(), right.getKind().getTypeOrder());
        if (typeCmp != 0) {
            return typeCmp;
        }
        switch (left.getKind()) {
            case NULL:
                return 0;
            case BOOLEAN:
                return Boolean.compare(left.getBooleanValue(), right.getBooleanValue());
            case INTEGER:
            case DOUBLE:
                return compareNumbers(left, right);
            case TIMESTAMP:
                return Timestamps.compare(left.getTimestampValue(), right.getTimestampValue());
            case STRING:
                return compareUtf8(left.getStringValue(), right.getStringValue());
            case BYTES:
                return UnsignedBytes.lexicographicalComparator()
                        .compare(left.getBytesValue().toByteArray(), right.getBytesValue().toByteArray());
            case REFERENCE:
                return ResourcePath.parse(left.getReferenceValue()).compareTo(ResourcePath.parse(right.getReferenceValue()));
            case GEO_POINT:
                return left.getGeoPointValue().compareTo(right.getGeoPointValue());
            case ARRAY:
                return compareArrays(left.getArrayValue(), right.getArrayValue());
            case MAP:
                return compareMaps(left.getMapValue(), right.getMapValue());
            default:
                throw new IllegalStateException("unknown value kind " + left.getKind());
        }
    }

    /**
     * Query equality: numbers compare by value across integers and doubles, and NaN equals NaN.
     * Everything else compares structurally.
     *
     * @param left one value
     * @param right another value
     * @return whether the two are the same for filtering and array membership
     */
    public static boolean equivalent(@Nonnull Value left, @Nonnull Value right) {
        if (left.isNumber() && right.isNumber()) {
            if (left.isNaN() || right.isNaN()) {
                return left.isNaN() && right.isNaN();
            }
            return compareNumbers(left, right) == 0;
        }
        if (left.getKind() != right.getKind()) {
            return false;
        }
        switch (left.getKind()) {
            case ARRAY: {
                List<Value> l = left.getArrayValue();
                List<Value> r = right.getArrayValue();
                if (l.size() != r.size()) {
                    return false;
                }
                for (int i = 0; i < l.size(); i++) {
                    if (!equivalent(l.get(i), r.get(i))) {
                        return false;
                    }
                }
                return true;
            }
            case MAP: {
                Map<String, Value> l = left.getMapValue();
                Map<String, Value> r = right.getMapValue();
                if (l.size() != r.size()) {
                    return false;
                }
                for (Map.Entry<String, Value> entry : l.entrySet()) {
                    Value other = r.get(entry.getKey());
                    if (other == null || !equivalent(entry.getValue(), other)) {
                        return false;
                    }
                }
                return true;
            }
            default:
                return left.equals(right);
        }
    }

    /**
     * Whether two values may be compared by the range operators. Numbers are comparable with
     * each other; all other values only with their own kind.
     *
     * @param left one value
     * @param right another value
     * @return {@code true} if a range comparison is meaningful
     */
    public static boolean comparable(@Nonnull Value left, @Nonnull Value right) {
        return left.getKind().getTypeOrder() == right.getKind().getTypeOrder();
    }

    public static boolean arrayContains(@Nonnull Value array, @Nonnull Value element) {
        if (!array.isArray()) {
            return false;
        }
        for (Value candidate : array.getArrayValue()) {
            if (equivalent(candidate, element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compare strings by their UTF-8 encoding, which matches code point order rather than the
     * UTF-16 order used by {@link String#compareTo(String)}.
     *
     * @param left one string
     * @param right another string
     * @return negative, zero or positive
     */
    public static int compareUtf8(@Nonnull String left, @Nonnull String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int l = left.codePointAt(i);
            int r = right.codePointAt(j);
            if (l != r) {
                return Integer.compare(l, r);
            }
            i += Character.charCount(l);
            j += Character.charCount(r);
        }
        return Boolean.compare(i < left.length(), j < right.length());
    }

    private static int compareNumbers(@Nonnull Value left, @Nonnull Value right) {
        if (left.getKind() == Value.Kind.INTEGER && right.getKind() == Value.Kind.INTEGER) {
            return Long.compare(left.getIntegerValue(), right.getIntegerValue());
        }
        if (left.getKind() == Value.Kind.DOUBLE && right.getKind() == Value.Kind.DOUBLE) {
            return compareDoubles(left.getDoubleValue(), right.getDoubleValue());
        }
        if (left.getKind() == Value.Kind.INTEGER) {
            return -compareDoubleToLong(right.getDoubleValue(), left.getIntegerValue());
        }
        return compareDoubleToLong(left.getDoubleValue(), right.getIntegerValue());
    }

    private static int compareDoubles(double left, double right) {
        if (Double.isNaN(left)) {
            return Double.isNaN(right) ? 0 : -1;
        }
        if (Double.isNaN(right)) {
            return 1;
        }
        // -0.0 and 0.0 are the same number here
        return left < right ? -1 : (left > right ? 1 : 0);
    }

    private static int compareDoubleToLong(double d, long l) {
        if (Double.isNaN(d) || d < -TWO_TO_63) {
            return -1;
        }
        if (d >= TWO_TO_63) {
            return 1;
        }
        long truncated = (long)d;
        int cmp = Long.compare(truncated, l);
        if (cmp != 0) {
            return cmp;
        }
        double fraction = d - truncated;
        return fraction > 0 ? 1 : (fraction < 0 ? -1 : 0);
    }

    private static int compareArrays(@Nonnull List<Value> left, @Nonnull List<Value> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int cmp = compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareMaps(@Nonnull Map<String, Value> left, @Nonnull Map<String, Value> right) {
        List<String> leftKeys = sortedKeys(left);
        List<String> rightKeys = sortedKeys(right);
        int common = Math.min(leftKeys.size(), rightKeys.size());
        for (int i = 0; i < common; i++) {
            int cmp = compareUtf8(leftKeys.get(i), rightKeys.get(i));
            if (cmp != 0) {
                return cmp;
            }
            cmp = compare(left.get(leftKeys.get(i)), right.get(rightKeys.get(i)));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(leftKeys.size(), rightKeys.size());
    }

    @Nonnull
    private static List<String> sortedKeys(@Nonnull Map<String, Value> map) {
        List<String> keys = new ArrayList<>(map.keySet());
        keys.sort(Values::compareUtf8);
        return keys;
    }

    /**
     * Look up a possibly nested field.
     *
     * @param fields top-level fields of a document
     * @param path field to find
     * @return the value, or empty if any segment is missing or not a map
     */
    @Nonnull
    public static Optional<Value> getField(@Nonnull Map<String, Value> fields, @Nonnull FieldPath path) {
        Map<String, Value> current = fields;
        for (int i = 0; i < path.size() - 1; i++) {
            Value next = current.get(path.get(i));
            if (next == null || !next.isMap()) {
                return Optional.empty();
            }
            current = next.getMapValue();
        }
        return Optional.ofNullable(current.get(path.getLastSegment()));
    }

    /**
     * Return a copy of {@code fields} with {@code path} set to {@code value}, creating intermediate
     * maps and replacing non-map intermediates.
     *
     * @param fields original fields
     * @param path field to set
     * @param value new value
     * @return the updated copy
     */
    @Nonnull
    public static Map<String, Value> setField(@Nonnull Map<String, Value> fields, @Nonnull FieldPath path, @Nonnull Value value) {
        Map<String, Value> copy = new LinkedHashMap<>(fields);
        String head = path.getFirstSegment();
        if (path.size() == 1) {
            copy.put(head, value);
        } else {
            Value existing = fields.get(head);
            Map<String, Value> child = existing != null && existing.isMap() ? existing.getMapValue() : Map.of();
            copy.put(head, Value.mapValue(setField(child, path.popFirst(), value)));
        }
        return copy;
    }

    /**
     * Return a copy of {@code fields} without {@code path}. Missing paths are ignored.
     *
     * @param fields original fields
     * @param path field to remove
     * @return the updated copy
     */
    @Nonnull
    public static Map<String, Value> deleteField(@Nonnull Map<String, Value> fields, @Nonnull FieldPath path) {
        String head = path.getFirstSegment();
        Value existing = fields.get(head);
        if (existing == null) {
            return fields;
        }
        Map<String, Value> copy = new LinkedHashMap<>(fields);
        if (path.size() == 1) {
            copy.remove(head);
        } else if (existing.isMap()) {
            copy.put(head, Value.mapValue(deleteField(existing.getMapValue(), path.popFirst())));
        }
        return copy;
    }
}
