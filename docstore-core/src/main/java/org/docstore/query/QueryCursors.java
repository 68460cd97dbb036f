/*
 * QueryCursors.java
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

import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for paging through query results with cursors.
 */
public final class QueryCursors {

    private QueryCursors() {
    }

    /**
     * The values of every sort key of {@code query}, including the trailing document name,
     * read from {@code document}.
     *
     * @param query the query
     * @param document a document from its result
     * @return the sort values
     */
    @Nonnull
    public static List<Value> sortValues(@Nonnull StructuredQuery query, @Nonnull Document document) {
        List<Order> orders = query.getNormalizedOrderBy();
        List<Value> values = new ArrayList<>(orders.size());
        for (Order order : orders) {
            Optional<Value> value = document.getValue(order.getField());
            if (value.isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("document lacks an ordered field",
                        LogMessageKeys.DOCUMENT, document.getName(),
                        LogMessageKeys.FIELD_PATH, order.getField());
            }
            values.add(value.get());
        }
        return values;
    }

    /**
     * The query continued strictly after {@code lastDocument}. Because the cursor includes the
     * document name, resuming neither repeats nor skips documents that sort equal on the other
     * keys. The offset is cleared since it was consumed by the earlier page.
     *
     * @param query the original query
     * @param lastDocument the last document received
     * @return the query for the next page
     */
    @Nonnull
    public static StructuredQuery startAfter(@Nonnull StructuredQuery query, @Nonnull Document lastDocument) {
        return query.toBuilder()
                .startAt(new Cursor(sortValues(query, lastDocument), false))
                .offset(0)
                .build();
    }
}
