/*
 * ListDocumentsRequest.java
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
import org.docstore.model.DocumentMask;
import org.docstore.query.Order;
import org.docstore.transaction.ReadOptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * Parameters of {@link DocumentService#listDocuments(ListDocumentsRequest)}.
 */
public final class ListDocumentsRequest {
    @Nonnull
    private final String parent;
    @Nonnull
    private final String collectionId;
    private final int pageSize;
    @Nonnull
    private final String pageToken;
    @Nonnull
    private final List<Order> orderBy;
    @Nullable
    private final DocumentMask mask;
    private final boolean showMissing;
    @Nonnull
    private final ReadOptions consistency;

    private ListDocumentsRequest(@Nonnull Builder builder) {
        this.parent = builder.parent;
        this.collectionId = builder.collectionId;
        this.pageSize = builder.pageSize;
        this.pageToken = builder.pageToken;
        this.orderBy = ImmutableList.copyOf(builder.orderBy);
        this.mask = builder.mask;
        this.showMissing = builder.showMissing;
        this.consistency = builder.consistency;
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull String parent, @Nonnull String collectionId) {
        return new Builder(parent, collectionId);
    }

    @Nonnull
    public String getParent() {
        return parent;
    }

    @Nonnull
    public String getCollectionId() {
        return collectionId;
    }

    /**
     * Maximum documents per page; {@code 0} means no limit.
     *
     * @return the page size
     */
    public int getPageSize() {
        return pageSize;
    }

    @Nonnull
    public String getPageToken() {
        return pageToken;
    }

    @Nonnull
    public List<Order> getOrderBy() {
        return orderBy;
    }

    @Nullable
    public DocumentMask getMask() {
        return mask;
    }

    public boolean isShowMissing() {
        return showMissing;
    }

    @Nonnull
    public ReadOptions getConsistency() {
        return consistency;
    }

    /**
     * Builder for {@link ListDocumentsRequest}.
     */
    public static class Builder {
        @Nonnull
        private final String parent;
        @Nonnull
        private final String collectionId;
        private int pageSize;
        @Nonnull
        private String pageToken = "";
        @Nonnull
        private List<Order> orderBy = ImmutableList.of();
        @Nullable
        private DocumentMask mask;
        private boolean showMissing;
        @Nonnull
        private ReadOptions consistency = ReadOptions.latest();

        private Builder(@Nonnull String parent, @Nonnull String collectionId) {
            this.parent = parent;
            this.collectionId = collectionId;
        }

        @Nonnull
        public Builder setPageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        @Nonnull
        public Builder setPageToken(@Nonnull String pageToken) {
            this.pageToken = pageToken;
            return this;
        }

        @Nonnull
        public Builder setOrderBy(@Nonnull Order... orderBy) {
            this.orderBy = Arrays.asList(orderBy);
            return this;
        }

        @Nonnull
        public Builder setMask(@Nullable DocumentMask mask) {
            this.mask = mask;
            return this;
        }

        @Nonnull
        public Builder setShowMissing(boolean showMissing) {
            this.showMissing = showMissing;
            return this;
        }

        @Nonnull
        public Builder setConsistency(@Nonnull ReadOptions consistency) {
            this.consistency = consistency;
            return this;
        }

        @Nonnull
        public ListDocumentsRequest build() {
            return new ListDocumentsRequest(this);
        }
    }
}
