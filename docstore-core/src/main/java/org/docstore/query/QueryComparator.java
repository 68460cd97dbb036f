/*
 * QueryComparator.java
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

import org.docstore.model.Document;
import org.docstore.model.Value;
import org.docstore.model.Values;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Orders documents by a query's sort keys, ending with the document name so that the order is
 * total. A document lacking a sort field sorts before documents that have it.
 */
public class QueryComparator implements Comparator<Document> {
    @Nonnull
    private final List<Order> orders;

    public QueryComparator(@Nonnull StructuredQuery query) {
        this.orders = query.getNormalizedOrderBy();
    }

    /**
     * Comparator for listening to documents by name only.
     *
     * @return a comparator by ascending document name
     */
    @Nonnull
    public static Comparator<Document> byName() {
        return (left, right) -> left.getPath().compareTo(right.getPath());
    }

    @Override
    public int compare(@Nonnull Document left, @Nonnull Document right) {
        for (Order order : orders) {
            int cmp = compareField(order, left, right);
            if (cmp != 0) {
                return cmp;
            }
        }
        return left.getPath().compareTo(right.getPath());
    }

    private static int compareField(@Nonnull Order order, @Nonnull Document left, @Nonnull Document right) {
        Optional<Value> l = left.getValue(order.getField());
        Optional<Value> r = right.getValue(order.getField());
        int cmp;
        if (l.isPresent() && r.isPresent()) {
            cmp = Values.compare(l.get(), r.get());
        } else {
            cmp = Boolean.compare(l.isPresent(), r.isPresent());
        }
        return order.getDirection().apply(cmp);
    }

    /**
     * Position of a document relative to a cursor: negative if it sorts before the cursor's
     * values, zero if its leading sort values equal them, positive if after.
     *
     * @param document the document
     * @param cursor the cursor
     * @return the comparison
     */
    public int compareToCursor(@Nonnull Document document, @Nonnull Cursor cursor) {
        List<Value> values = cursor.getValues();
        for (int i = 0; i < values.size() && i < orders.size(); i++) {
            Order order = orders.get(i);
            Optional<Value> value = document.getValue(order.getField());
            int cmp = value.isPresent() ? Values.compare(value.get(), values.get(i)) : -1;
            if (cmp != 0) {
                return order.getDirection().apply(cmp);
            }
        }
        return 0;
    }
}
