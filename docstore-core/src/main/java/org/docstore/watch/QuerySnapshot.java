/*
 * QuerySnapshot.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * The documents matching a target at one consistent read time, in the target's order, and how
 * they differ from the previous snapshot delivered to the same listener.
 */
public final class QuerySnapshot {
    private final int targetId;
    @Nonnull
    private final ImmutableList<Document> documents;
    @Nonnull
    private final ImmutableList<DocumentViewChange> changes;
    @Nonnull
    private final Timestamp readTime;

    QuerySnapshot(int targetId, @Nonnull List<Document> documents, @Nonnull List<DocumentViewChange> changes,
                  @Nonnull Timestamp readTime) {
        this.targetId = targetId;
        this.documents = ImmutableList.copyOf(documents);
        this.changes = ImmutableList.copyOf(changes);
        this.readTime = readTime;
    }

    public int getTargetId() {
        return targetId;
    }

    @Nonnull
    public List<Document> getDocuments() {
        return documents;
    }

    @Nonnull
    public List<DocumentViewChange> getChanges() {
        return changes;
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    @Nullable
    public Document getDocument(@Nonnull String name) {
        for (Document document : documents) {
            if (document.getName().equals(name)) {
                return document;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "QuerySnapshot{target=" + targetId + ", size=" + documents.size() + ", changes=" + changes
                + ", readTime=" + readTime.getSeconds() + "." + readTime.getNanos() + "}";
    }
}
