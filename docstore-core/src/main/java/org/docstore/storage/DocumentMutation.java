/*
 * DocumentMutation.java
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

/**
 * The before and after state of one document changed by a commit.
 */
public final class DocumentMutation {
    @Nonnull
    private final ResourcePath path;
    @Nullable
    private final Document before;
    @Nullable
    private final Document after;

    public DocumentMutation(@Nonnull ResourcePath path, @Nullable Document before, @Nullable Document after) {
        this.path = path;
        this.before = before;
        this.after = after;
    }

    @Nonnull
    public ResourcePath getPath() {
        return path;
    }

    @Nullable
    public Document getBefore() {
        return before;
    }

    /**
     * State after the commit.
     *
     * @return the new document, or {@code null} if the commit deleted it
     */
    @Nullable
    public Document getAfter() {
        return after;
    }

    @Override
    public String toString() {
        return "DocumentMutation{" + path + ", " + (before == null ? "absent" : "present")
                + " -> " + (after == null ? "absent" : "present") + "}";
    }
}
