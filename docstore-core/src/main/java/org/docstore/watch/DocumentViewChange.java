/*
 * DocumentViewChange.java
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

package org.docstore.watch;

import org.docstore.model.Document;

import javax.annotation.Nonnull;

/**
 * How one document moved between two consecutive snapshots of a target. Indexes refer to the
 * view as it is after the changes listed before this one, so applying the changes in order turns
 * the old document list into the new one.
 */
public final class DocumentViewChange {

    /**
     * Kind of change.
     */
    public enum Type {
        ADDED,
        MODIFIED,
        REMOVED
    }

    @Nonnull
    private final Type type;
    @Nonnull
    private final Document document;
    private final int oldIndex;
    private final int newIndex;

    DocumentViewChange(@Nonnull Type type, @Nonnull Document document, int oldIndex, int newIndex) {
        this.type = type;
        this.document = document;
        this.oldIndex = oldIndex;
        this.newIndex = newIndex;
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    @Nonnull
    public Document getDocument() {
        return document;
    }

    /**
     * Position the document was removed from.
     *
     * @return the old index, or -1 for an added document
     */
    public int getOldIndex() {
        return oldIndex;
    }

    /**
     * Position the document was inserted at.
     *
     * @return the new index, or -1 for a removed document
     */
    public int getNewIndex() {
        return newIndex;
    }

    @Override
    public String toString() {
        return type + "(" + document.getName() + ", " + oldIndex + " -> " + newIndex + ")";
    }
}
