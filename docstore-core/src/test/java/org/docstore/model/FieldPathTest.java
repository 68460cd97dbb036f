/*
 * FieldPathTest.java
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

import org.docstore.DocumentStoreExceptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FieldPath}.
 */
class FieldPathTest {

    @Test
    void parseDotted() {
        assertThat(FieldPath.parse("a.b_1.c").getSegments(), contains("a", "b_1", "c"));
    }

    @Test
    void parseQuoted() {
        FieldPath path = FieldPath.parse("`a.b`.`c\\`d`.e");
        assertThat(path.getSegments(), contains("a.b", "c`d", "e"));
        assertEquals("`a.b`.`c\\`d`.e", path.canonicalString());
    }

    @Test
    void canonicalQuotesWhereNeeded() {
        assertEquals("a.`1x`.`with space`", FieldPath.of("a", "1x", "with space").canonicalString());
        assertEquals(FieldPath.of("a", "1x"), FieldPath.parse(FieldPath.of("a", "1x").canonicalString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ".a", "a.", "a..b", "`a", "`a`b", "a`b`"})
    void invalid(String path) {
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class, () -> FieldPath.parse(path));
    }

    @Test
    void documentName() {
        assertTrue(FieldPath.parse("__name__").isDocumentName());
        assertFalse(FieldPath.of("a", "__name__").isDocumentName());
    }

    @Test
    void prefixAndOrder() {
        assertTrue(FieldPath.parse("a").isPrefixOf(FieldPath.parse("a.b")));
        assertTrue(FieldPath.parse("a.b").isPrefixOf(FieldPath.parse("a.b")));
        assertFalse(FieldPath.parse("a.b").isPrefixOf(FieldPath.parse("a")));
        assertThat(FieldPath.parse("a").compareTo(FieldPath.parse("a.b")), lessThan(0));
        assertThat(FieldPath.parse("a.z").compareTo(FieldPath.parse("b")), lessThan(0));
    }
}
