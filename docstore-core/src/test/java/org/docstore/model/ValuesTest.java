/*
 * ValuesTest.java
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

import com.google.common.collect.ImmutableMap;
import com.google.protobuf.util.Timestamps;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Values}.
 */
class ValuesTest {

    @Test
    void crossTypeOrder() {
        List<Value> values = new ArrayList<>(Arrays.asList(
                Value.mapValue(ImmutableMap.of()),
                Value.arrayValue(),
                Value.geoPointValue(new GeoPoint(0, 0)),
                Value.referenceValue("projects/p/databases/d/documents/c/a"),
                Value.bytesValue(new byte[] {1}),
                Value.stringValue("a"),
                Value.timestampValue(Timestamps.fromSeconds(1)),
                Value.integerValue(1),
                Value.booleanValue(false),
                Value.nullValue()));
        Collections.shuffle(values);
        values.sort(Values.COMPARATOR);
        assertThat(values, contains(
                Value.nullValue(),
                Value.booleanValue(false),
                Value.integerValue(1),
                Value.timestampValue(Timestamps.fromSeconds(1)),
                Value.stringValue("a"),
                Value.bytesValue(new byte[] {1}),
                Value.referenceValue("projects/p/databases/d/documents/c/a"),
                Value.geoPointValue(new GeoPoint(0, 0)),
                Value.arrayValue(),
                Value.mapValue(ImmutableMap.of())));
    }

    @Test
    void numbersCompareByValue() {
        assertEquals(0, Values.compare(Value.integerValue(1), Value.doubleValue(1.0)));
        assertThat(Values.compare(Value.integerValue(1), Value.doubleValue(1.5)), lessThan(0));
        assertThat(Values.compare(Value.doubleValue(-0.5), Value.integerValue(-1)), greaterThan(0));
        assertEquals(0, Values.compare(Value.doubleValue(-0.0), Value.doubleValue(0.0)));
        assertThat(Values.compare(Value.integerValue(Long.MAX_VALUE), Value.doubleValue(9.3e18)), lessThan(0));
    }

    @Test
    void nanSortsBeforeAllNumbers() {
        assertThat(Values.compare(Value.doubleValue(Double.NaN), Value.doubleValue(Double.NEGATIVE_INFINITY)), lessThan(0));
        assertThat(Values.compare(Value.doubleValue(Double.NaN), Value.integerValue(Long.MIN_VALUE)), lessThan(0));
        assertEquals(0, Values.compare(Value.doubleValue(Double.NaN), Value.doubleValue(Double.NaN)));
    }

    @Test
    void equivalence() {
        assertTrue(Values.equivalent(Value.integerValue(2), Value.doubleValue(2.0)));
        assertNotEquals(Value.integerValue(2), Value.doubleValue(2.0));
        assertTrue(Values.equivalent(Value.doubleValue(Double.NaN), Value.doubleValue(Double.NaN)));
        assertFalse(Values.equivalent(Value.doubleValue(Double.NaN), Value.integerValue(0)));
        assertTrue(Values.equivalent(
                Value.arrayValue(Value.integerValue(1), Value.mapValue(ImmutableMap.of("a", Value.doubleValue(1.0)))),
                Value.arrayValue(Value.doubleValue(1.0), Value.mapValue(ImmutableMap.of("a", Value.integerValue(1))))));
        assertFalse(Values.equivalent(Value.stringValue("1"), Value.integerValue(1)));
    }

    @Test
    void stringsCompareByCodePoint() {
        // U+FFFD sorts before U+1F600 by code point, but after it in UTF-16 order
        String replacement = "\uFFFD";
        String emoji = new String(Character.toChars(0x1F600));
        assertThat(replacement.compareTo(emoji), greaterThan(0));
        assertThat(Values.compareUtf8(replacement, emoji), lessThan(0));
        assertThat(Values.compareUtf8("ab", "abc"), lessThan(0));
    }

    @Test
    void bytesCompareUnsigned() {
        assertThat(Values.compare(Value.bytesValue(new byte[] {(byte)0x01}), Value.bytesValue(new byte[] {(byte)0xff})),
                lessThan(0));
    }

    @Test
    void containersCompareElementwise() {
        assertThat(Values.compare(Value.arrayValue(Value.integerValue(1)),
                Value.arrayValue(Value.integerValue(1), Value.integerValue(0))), lessThan(0));
        assertThat(Values.compare(Value.arrayValue(Value.integerValue(2)),
                Value.arrayValue(Value.integerValue(1), Value.integerValue(5))), greaterThan(0));
        assertThat(Values.compare(Value.mapValue(ImmutableMap.of("a", Value.integerValue(9))),
                Value.mapValue(ImmutableMap.of("b", Value.integerValue(0)))), lessThan(0));
    }

    @Test
    void referencesCompareBySegment() {
        assertThat(Values.compare(Value.referenceValue("projects/p/databases/d/documents/c/a"),
                Value.referenceValue("projects/p/databases/d/documents/c/a/sub/x")), lessThan(0));
        assertThat(Values.compare(Value.referenceValue("projects/p/databases/d/documents/c/a/sub/x"),
                Value.referenceValue("projects/p/databases/d/documents/c/b")), lessThan(0));
    }

    @Test
    void nestedFields() {
        Map<String, Value> fields = ImmutableMap.of("a", Value.mapValue(ImmutableMap.of("b", Value.integerValue(1))),
                "s", Value.stringValue("x"));
        assertEquals(Value.integerValue(1), Values.getField(fields, FieldPath.of("a", "b")).orElseThrow());
        assertTrue(Values.getField(fields, FieldPath.of("s", "b")).isEmpty());

        Map<String, Value> updated = Values.setField(fields, FieldPath.of("s", "t"), Value.booleanValue(true));
        assertEquals(Value.booleanValue(true), Values.getField(updated, FieldPath.of("s", "t")).orElseThrow());
        assertEquals(Value.stringValue("x"), fields.get("s"));

        Map<String, Value> deleted = Values.deleteField(fields, FieldPath.of("a", "b"));
        assertEquals(Value.mapValue(ImmutableMap.of()), deleted.get("a"));
        assertEquals(fields, Values.deleteField(fields, FieldPath.of("missing")));
    }

    @Test
    void arrayMembership() {
        Value array = Value.arrayValue(Value.integerValue(1), Value.stringValue("a"));
        assertTrue(Values.arrayContains(array, Value.doubleValue(1.0)));
        assertFalse(Values.arrayContains(array, Value.stringValue("b")));
        assertFalse(Values.arrayContains(Value.stringValue("a"), Value.stringValue("a")));
    }
}
