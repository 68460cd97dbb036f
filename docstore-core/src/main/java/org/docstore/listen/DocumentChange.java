/*
 * DocumentChange.java
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

package org.docstore.listen;

import com.google.common.collect.ImmutableList;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A document that now matches {@code targetIds}, possibly changed, and no longer matches
 * {@code removedTargetIds}.
 */
public final class DocumentChange {
    @Nonnull
    private final Document document;
    @Nonnull
    private final ImmutableList<Integer> targetIds;
    @Nonnull
    private final ImmutableList<Integer> removedTargetIds;

    public DocumentChange(@Nonnull Document document, @Nonnull List<Integer> targetIds,
                          @Nonnull List<Integer> removedTargetIds) {
        this.document = document;
        this.targetIds = ImmutableList.copyOf(targetIds);
        this.removedTargetIds = ImmutableList.copyOf(removedTargetIds);
    }

    @Nonnull
    public Document getDocument() {
        return document;
    }

    @Nonnull
    public List<Integer> getTargetIds() {
        return targetIds;
    }

    @Nonnull
    public List<Integer> getRemovedTargetIds() {
        return removedTargetIds;
    }

    @Override
    public String toString() {
        return "DocumentChange{" + document.getName() + ", targets=" + targetIds + ", removed=" + removedTargetIds + "}";
    }
}
