/*
 * DatabaseIdTest.java
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DatabaseId} and {@link ResourcePath}.
 */
class DatabaseIdTest {
    private static final DatabaseId DATABASE = DatabaseId.of("p");

    @Test
    void names() {
        assertEquals("projects/p/databases/(default)/documents/users/alice", DATABASE.documentName("users/alice"));
        assertEquals("projects/p/databases/(default)/documents", DATABASE.getDocumentsRoot().canonicalString());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class, () -> DATABASE.documentName("users"));
    }

    @Test
    void parseDocumentName() {
        ResourcePath path = DATABASE.parseDocumentName("projects/p/databases/(default)/documents/a/b/c/d");
        assertEquals("d", path.getLastSegment());
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> DATABASE.parseDocumentName("projects/p/databases/(default)/documents/a"));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> DATABASE.parseDocumentName("projects/q/databases/(default)/documents/a/b"));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> DATABASE.parseDocumentName("projects/p/databases/(default)/documents/a//b"));
    }

    @Test
    void parents() {
        assertTrue(DATABASE.isParentPath(DATABASE.getDocumentsRoot()));
        assertTrue(DATABASE.isParentPath(DATABASE.parseDocumentName(DATABASE.documentName("a/b"))));
        assertFalse(DATABASE.isParentPath(DATABASE.collectionPath("a")));
        assertThrows(DocumentStoreExceptions.InvalidArgumentException.class,
                () -> DATABASE.parseParent("projects/p/databases/(default)/documents/a"));
    }

    @Test
    void pathOrderPutsDescendantsAfterParent() {
        ResourcePath parent = ResourcePath.parse("c/a");
        ResourcePath child = ResourcePath.parse("c/a/sub/x");
        ResourcePath sibling = ResourcePath.parse("c/b");
        assertTrue(parent.compareTo(child) < 0);
        assertTrue(child.compareTo(sibling) < 0);
        assertTrue(parent.isPrefixOf(child));
        assertFalse(parent.isImmediateParentOf(child));
        assertTrue(ResourcePath.parse("c").isImmediateParentOf(parent));
    }
}
