/*
 * AggregationQuery.java
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

import com.google.common.collect.ImmutableMap;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query whose result is a set of named aggregates over the documents a {@link StructuredQuery}
 * returns, after its offset and limit.
 */
public final class AggregationQuery {
    public static final int MAX_AGGREGATIONS = 5;
    private static final String DEFAULT_ALIAS_PREFIX = "aggregate_";

    @Nonnull
    private final StructuredQuery query;
    @Nonnull
    private final ImmutableMap<String, AggregateField> aggregations;

    public AggregationQuery(@Nonnull StructuredQuery query, @Nonnull Map<String, AggregateField> aggregations) {
        this.query = query;
        this.aggregations = ImmutableMap.copyOf(aggregations);
    }

    /**
     * Aggregate under generated aliases {@code aggregate_0}, {@code aggregate_1} and so on.
     *
     * @param query the query whose results are aggregated
     * @param fields the aggregates, in alias order
     * @return the aggregation query
     */
    @Nonnull
    public static AggregationQuery of(@Nonnull StructuredQuery query, @Nonnull AggregateField... fields) {
        Map<String, AggregateField> aggregations = new LinkedHashMap<>();
        for (int i = 0; i < fields.length; i++) {
            aggregations.put(DEFAULT_ALIAS_PREFIX + i, fields[i]);
        }
        return new AggregationQuery(query, aggregations);
    }

    @Nonnull
    public StructuredQuery getQuery() {
        return query;
    }

    @Nonnull
    public Map<String, AggregateField> getAggregations() {
        return aggregations;
    }

    /**
     * Reject malformed aggregation queries, including a malformed inner query.
     *
     * @throws DocumentStoreExceptions.InvalidArgumentException if the query is malformed
     */
    public void validate() {
        query.validate();
        if (aggregations.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("aggregation query needs an aggregate");
        }
        if (aggregations.size() > MAX_AGGREGATIONS) {
            throw new DocumentStoreExceptions.InvalidArgumentException("too many aggregates",
                    LogMessageKeys.EXPECTED, MAX_AGGREGATIONS,
                    LogMessageKeys.ACTUAL, aggregations.size());
        }
        for (Map.Entry<String, AggregateField> entry : aggregations.entrySet()) {
            if (entry.getKey().isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("aggregate alias must not be empty");
            }
            if (entry.getValue().getField() != null && entry.getValue().getField().isDocumentName()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("cannot aggregate the document name",
                        "alias", entry.getKey());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregationQuery)) {
            return false;
        }
        AggregationQuery that = (AggregationQuery)o;
        return query.equals(that.query) && aggregations.equals(that.aggregations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, aggregations);
    }

    @Override
    public String toString() {
        return "Aggregation{" + aggregations + " over " + query + "}";
    }
}
