/*
 * ExistenceFilter.java
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

import javax.annotation.Nonnull;

/**
 * The number of documents matching a target. A client whose own count differs has missed changes.
 */
public final class ExistenceFilter {
    private final int targetId;
    private final int count;

    public ExistenceFilter(int targetId, int count) {
        this.targetId = targetId;
        this.count = count;
    }

    public int getTargetId() {
        return targetId;
    }

    public int getCount() {
        return count;
    }

    @Nonnull
    @Override
    public String toString() {
        return "ExistenceFilter{" + targetId + ", count=" + count + "}";
    }
}
