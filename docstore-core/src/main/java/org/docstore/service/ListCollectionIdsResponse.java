/*
 * ListCollectionIdsResponse.java
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

package org.docstore.service;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

public final class ListCollectionIdsResponse {
    @Nonnull
    private final List<String> collectionIds;
    @Nonnull
    private final String nextPageToken;

    public ListCollectionIdsResponse(@Nonnull List<String> collectionIds, @Nonnull String nextPageToken) {
        this.collectionIds = ImmutableList.copyOf(collectionIds);
        this.nextPageToken = nextPageToken;
    }

    @Nonnull
    public List<String> getCollectionIds() {
        return collectionIds;
    }

    @Nonnull
    public String getNextPageToken() {
        return nextPageToken;
    }

    @Override
    public String toString() {
        return "ListCollectionIdsResponse{" + collectionIds + ", nextPageToken='" + nextPageToken + "'}";
    }
}
