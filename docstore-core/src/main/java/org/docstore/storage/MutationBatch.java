/*
 * MutationBatch.java
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

package org.docstore.storage;

import org.docstore.model.Document;
import org.docstore.model.ResourcePath;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The final state of every document touched by a commit: a new version or a deletion.
 * Later entries for the same path replace earlier ones.
 */
public final class MutationBatch {
    private final Map<ResourcePath, Document> changes = new LinkedHashMap<>();

    public void put(@Nonnull Document document) {
        changes.put(document.getPath(), document);
    }

    public void delete(@Nonnull ResourcePath path) {
        changes.put(path, null);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Changes in the order they were first recorded; a {@code null} value marks a deletion.
     *
     * @return the staged changes
     */
    @Nonnull
    public Map<ResourcePath, Document> getChanges() {
        return Collections.unmodifiableMap(changes);
    }

    @Nullable
    public Document get(@Nonnull ResourcePath path) {
        return changes.get(path);
    }

    public boolean contains(@Nonnull ResourcePath path) {
        return changes.containsKey(path);
    }
}
