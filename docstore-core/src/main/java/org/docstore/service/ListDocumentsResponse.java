/*
 * ListDocumentsResponse.java
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
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * One page of {@link DocumentService#listDocuments(ListDocumentsRequest)}.
 */
public final class ListDocumentsResponse {
    @Nonnull
    private final List<Document> documents;
    @Nonnull
    private final String nextPageToken;

    public ListDocumentsResponse(@Nonnull List<Document> documents, @Nonnull String nextPageToken) {
        this.documents = ImmutableList.copyOf(documents);
        this.nextPageToken = nextPageToken;
    }

    @Nonnull
    public List<Document> getDocuments() {
        return documents;
    }

    /**
     * Token for the following page; empty when this is the last page.
     *
     * @return the next page token
     */
    @Nonnull
    public String getNextPageToken() {
        return nextPageToken;
    }

    @Override
    public String toString() {
        return "ListDocumentsResponse{documents=" + documents.size() + ", nextPageToken='" + nextPageToken + "'}";
    }
}
