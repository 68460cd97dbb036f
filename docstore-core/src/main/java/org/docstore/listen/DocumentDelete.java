/*
 * DocumentDelete.java
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
import com.google.protobuf.Timestamp;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A document that was deleted; it leaves every target in {@code removedTargetIds}.
 */
public final class DocumentDelete {
    @Nonnull
    private final String documentName;
    @Nonnull
    private final ImmutableList<Integer> removedTargetIds;
    @Nonnull
    private final Timestamp readTime;

    public DocumentDelete(@Nonnull String documentName, @Nonnull List<Integer> removedTargetIds,
                          @Nonnull Timestamp readTime) {
        this.documentName = documentName;
        this.removedTargetIds = ImmutableList.copyOf(removedTargetIds);
        this.readTime = readTime;
    }

    @Nonnull
    public String getDocumentName() {
        return documentName;
    }

    @Nonnull
    public List<Integer> getRemovedTargetIds() {
        return removedTargetIds;
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    @Override
    public String toString() {
        return "DocumentDelete{" + documentName + ", removed=" + removedTargetIds + "}";
    }
}
