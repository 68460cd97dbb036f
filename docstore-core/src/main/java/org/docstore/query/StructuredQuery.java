/*
 * StructuredQuery.java
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

package org.docstore.query;

import com.google.common.collect.ImmutableList;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.ResourcePath;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A query over the collections below a parent: which collections, which documents, in what
 * order, from where to where, how many, and which fields.
 */
public final class StructuredQuery {

    /**
     * Which end of the ordered results a limit keeps.
     */
    public enum LimitType {
        FIRST,
        LAST
    }

    /**
     * Selects the collections a query reads.
     */
    public static final class CollectionSelector {
        @Nonnull
        private final String collectionId;
        private final boolean allDescendants;

        public CollectionSelector(@Nonnull String collectionId, boolean allDescendants) {
            this.collectionId = collectionId;
            this.allDescendants = allDescendants;
        }

        @Nonnull
        public String getCollectionId() {
            return collectionId;
        }

        /**
         * Whether collections with this id at any depth below the parent are included, rather
         * than only the one directly under it.
         *
         * @return {@code true} for a collection group query
         */
        public boolean isAllDescendants() {
            return allDescendants;
        }

        boolean selects(@Nonnull ResourcePath parent, @Nonnull ResourcePath documentPath) {
            if (!collectionId.equals(documentPath.get(documentPath.size() - 2))) {
                return false;
            }
            if (allDescendants) {
                return documentPath.size() > parent.size() && parent.isPrefixOf(documentPath);
            }
            return documentPath.size() == parent.size() + 2 && parent.isPrefixOf(documentPath);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CollectionSelector)) {
                return false;
            }
            CollectionSelector that = (CollectionSelector)o;
            return allDescendants == that.allDescendants && collectionId.equals(that.collectionId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(collectionId, allDescendants);
        }

        @Override
        public String toString() {
            return collectionId + (allDescendants ? "/**" : "");
        }
    }

    @Nonnull
    private final ImmutableList<CollectionSelector> from;
    @Nullable
    private final Filter where;
    @Nonnull
    private final ImmutableList<Order> orderBy;
    @Nullable
    private final DocumentMask select;
    @Nullable
    private final Cursor startAt;
    @Nullable
    private final Cursor endAt;
    private final int offset;
    @Nullable
    private final Integer limit;
    @Nonnull
    private final LimitType limitType;

    private StructuredQuery(@Nonnull Builder builder) {
        this.from = ImmutableList.copyOf(builder.from);
        this.where = builder.where;
        this.orderBy = ImmutableList.copyOf(builder.orderBy);
        this.select = builder.select;
        this.startAt = builder.startAt;
        this.endAt = builder.endAt;
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.limitType = builder.limitType;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public List<CollectionSelector> getFrom() {
        return from;
    }

    @Nullable
    public Filter getWhere() {
        return where;
    }

    /**
     * The sort keys as given, without the implicit document name key.
     *
     * @return explicit sort keys
     */
    @Nonnull
    public List<Order> getOrderBy() {
        return orderBy;
    }

    /**
     * The sort keys actually applied: the explicit ones followed by the document name in
     * ascending order, unless the name is already one of the explicit keys.
     *
     * @return the full sort order
     */
    @Nonnull
    public List<Order> getNormalizedOrderBy() {
        for (Order order : orderBy) {
            if (order.getField().isDocumentName()) {
                return orderBy;
            }
        }
        return ImmutableList.<Order>builder().addAll(orderBy).add(Order.BY_NAME).build();
    }

    @Nullable
    public DocumentMask getSelect() {
        return select;
    }

    @Nullable
    public Cursor getStartAt() {
        return startAt;
    }

    @Nullable
    public Cursor getEndAt() {
        return endAt;
    }

    public int getOffset() {
        return offset;
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    /**
     * Whether the limit keeps the first or the last results in order. With {@link LimitType#LAST}
     * the offset also counts from the end, and the kept results are still returned in query order.
     *
     * @return the limit type
     */
    @Nonnull
    public LimitType getLimitType() {
        return limitType;
    }

    /**
     * Whether a document lies in one of the selected collections below {@code parent}.
     *
     * @param parent the query's parent path
     * @param document candidate document
     * @return {@code true} if the query reads the document's collection
     */
    public boolean selects(@Nonnull ResourcePath parent, @Nonnull Document document) {
        for (CollectionSelector selector : from) {
            if (selector.selects(parent, document.getPath())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a document satisfies the filter and has every explicitly ordered field. This
     * ignores collection selection, cursors, offset and limit.
     *
     * @param document candidate document
     * @return {@code true} if the document can appear in the result
     */
    public boolean matches(@Nonnull Document document) {
        if (where != null && !where.matches(document)) {
            return false;
        }
        for (Order order : orderBy) {
            if (document.getValue(order.getField()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reject malformed queries.
     *
     * @throws DocumentStoreExceptions.InvalidArgumentException if the query is malformed
     */
    public void validate() {
        if (from.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("query must select a collection");
        }
        if (where != null) {
            where.validate();
        }
        if (select != null) {
            select.validate();
        }
        if (offset < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("offset must not be negative", "offset", offset);
        }
        if (limit != null && limit < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("limit must not be negative", "limit", limit);
        }
        if (limitType == LimitType.LAST) {
            if (limit == null) {
                throw new DocumentStoreExceptions.InvalidArgumentException("limit to last requires a limit");
            }
            if (orderBy.isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("limit to last requires an explicit order by");
            }
        }
        validateCursor(startAt, "startAt");
        validateCursor(endAt, "endAt");
    }

    private void validateCursor(@Nullable Cursor cursor, @Nonnull String position) {
        if (cursor == null) {
            return;
        }
        List<Order> normalized = getNormalizedOrderBy();
        int size = cursor.getValues().size();
        if (size != orderBy.size() && size != normalized.size()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("cursor values do not match the order by clause",
                    "position", position,
                    LogMessageKeys.EXPECTED, orderBy.size(),
                    LogMessageKeys.ACTUAL, size);
        }
        for (int i = 0; i < size; i++) {
            if (normalized.get(i).getField().isDocumentName()
                    && cursor.getValues().get(i).getKind() != Value.Kind.REFERENCE) {
                throw new DocumentStoreExceptions.InvalidArgumentException("document name cursor values must be references",
                        "position", position);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructuredQuery)) {
            return false;
        }
        StructuredQuery that = (StructuredQuery)o;
        return offset == that.offset
                && from.equals(that.from)
                && Objects.equals(where, that.where)
                && orderBy.equals(that.orderBy)
                && Objects.equals(select, that.select)
                && Objects.equals(startAt, that.startAt)
                && Objects.equals(endAt, that.endAt)
                && Objects.equals(limit, that.limit)
                && limitType == that.limitType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, where, orderBy, select, startAt, endAt, offset, limit, limitType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Query{from=").append(from);
        if (where != null) {
            sb.append(", where=").append(where);
        }
        if (!orderBy.isEmpty()) {
            sb.append(", orderBy=").append(orderBy);
        }
        if (startAt != null) {
            sb.append(", startAt=").append(startAt);
        }
        if (endAt != null) {
            sb.append(", endAt=").append(endAt);
        }
        if (offset != 0) {
            sb.append(", offset=").append(offset);
        }
        if (limit != null) {
            sb.append(limitType == LimitType.LAST ? ", limitToLast=" : ", limit=").append(limit);
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link StructuredQuery}.
     */
    public static final class Builder {
        @Nonnull
        private final List<CollectionSelector> from = new ArrayList<>();
        @Nullable
        private Filter where;
        @Nonnull
        private final List<Order> orderBy = new ArrayList<>();
        @Nullable
        private DocumentMask select;
        @Nullable
        private Cursor startAt;
        @Nullable
        private Cursor endAt;
        private int offset;
        @Nullable
        private Integer limit;
        @Nonnull
        private LimitType limitType = LimitType.FIRST;

        private Builder() {
        }

        private Builder(@Nonnull StructuredQuery query) {
            this.from.addAll(query.from);
            this.where = query.where;
            this.orderBy.addAll(query.orderBy);
            this.select = query.select;
            this.startAt = query.startAt;
            this.endAt = query.endAt;
            this.offset = query.offset;
            this.limit = query.limit;
            this.limitType = query.limitType;
        }

        @Nonnull
        public Builder from(@Nonnull String collectionId) {
            from.add(new CollectionSelector(collectionId, false));
            return this;
        }

        @Nonnull
        public Builder fromAllDescendants(@Nonnull String collectionId) {
            from.add(new CollectionSelector(collectionId, true));
            return this;
        }

        @Nonnull
        public Builder where(@Nullable Filter filter) {
            this.where = filter;
            return this;
        }

        @Nonnull
        public Builder orderBy(@Nonnull Order... orders) {
            orderBy.addAll(Arrays.asList(orders));
            return this;
        }

        @Nonnull
        public Builder clearOrderBy() {
            orderBy.clear();
            return this;
        }

        @Nonnull
        public Builder select(@Nonnull String... fieldPaths) {
            this.select = DocumentMask.parse(fieldPaths);
            return this;
        }

        @Nonnull
        public Builder select(@Nullable DocumentMask mask) {
            this.select = mask;
            return this;
        }

        @Nonnull
        public Builder startAt(@Nullable Cursor cursor) {
            this.startAt = cursor;
            return this;
        }

        @Nonnull
        public Builder endAt(@Nullable Cursor cursor) {
            this.endAt = cursor;
            return this;
        }

        @Nonnull
        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        @Nonnull
        public Builder limit(@Nullable Integer limit) {
            this.limit = limit;
            this.limitType = LimitType.FIRST;
            return this;
        }

        /**
         * Keep the last {@code limit} results of the ordered query. Needs at least one explicit order.
         *
         * @param limit how many results to keep
         * @return this builder
         */
        @Nonnull
        public Builder limitToLast(int limit) {
            this.limit = limit;
            this.limitType = LimitType.LAST;
            return this;
        }

        @Nonnull
        public StructuredQuery build() {
            return new StructuredQuery(this);
        }
    }
}
