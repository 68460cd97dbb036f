/*
 * QueryEvaluator.java
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
import com.google.common.math.LongMath;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.cursors.CursorResult;
import org.docstore.cursors.ResultCursor;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.docstore.model.Value;
import org.docstore.storage.DocumentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a {@link StructuredQuery} against a consistent {@link DocumentSource}.
 *
 * <p>
 * Evaluation selects the documents of the chosen collections, keeps those that match the
 * filter and have every ordered field, sorts them by the query's order with the document name
 * as the final key, trims them to the start and end cursors, and then applies offset, limit
 * and projection. Skipping for the offset is reported through the responses'
 * {@code skippedResults}; long skips produce progress-only responses every
 * {@code progressInterval} documents.
 * </p>
 *
 * <p>
 * A limit to last keeps the final results in query order: the offset is counted back from the
 * last candidate and the limit is taken before it. Aggregations run over the same result set.
 * </p>
 */
public class QueryEvaluator {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEvaluator.class);

    private final int progressInterval;

    public QueryEvaluator(int progressInterval) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progress interval must be positive");
        }
        this.progressInterval = progressInterval;
    }

    /**
     * The ordered documents between the cursors, before offset and limit.
     *
     * @param parent parent path of the selected collections
     * @param query the query, already validated
     * @param source the snapshot to read
     * @return the bounded, sorted candidates
     */
    @Nonnull
    public List<Document> candidates(@Nonnull ResourcePath parent, @Nonnull StructuredQuery query,
                                     @Nonnull DocumentSource source) {
        List<Document> matching = new ArrayList<>();
        for (Document document : source.scan(parent)) {
            if (query.selects(parent, document) && query.matches(document)) {
                matching.add(document);
            }
        }
        QueryComparator comparator = new QueryComparator(query);
        matching.sort(comparator);
        List<Document> bounded = new ArrayList<>(matching.size());
        for (Document document : matching) {
            if (withinCursors(comparator, query, document)) {
                bounded.add(document);
            }
        }
        return bounded;
    }

    private static boolean withinCursors(@Nonnull QueryComparator comparator, @Nonnull StructuredQuery query,
                                         @Nonnull Document document) {
        Cursor startAt = query.getStartAt();
        if (startAt != null) {
            int cmp = comparator.compareToCursor(document, startAt);
            if (startAt.isBefore() ? cmp < 0 : cmp <= 0) {
                return false;
            }
        }
        Cursor endAt = query.getEndAt();
        if (endAt != null) {
            int cmp = comparator.compareToCursor(document, endAt);
            if (endAt.isBefore() ? cmp >= 0 : cmp > 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluate the query fully: candidates with offset, limit and projection applied.
     *
     * @param parent parent path of the selected collections
     * @param query the query
     * @param source the snapshot to read
     * @return the result documents in order
     */
    @Nonnull
    public List<Document> evaluate(@Nonnull ResourcePath parent, @Nonnull StructuredQuery query,
                                   @Nonnull DocumentSource source) {
        query.validate();
        List<Document> result = new ArrayList<>();
        for (Document document : window(query, candidates(parent, query, source))) {
            result.add(document.project(query.getSelect()));
        }
        return result;
    }

    @Nonnull
    private static List<Document> window(@Nonnull StructuredQuery query, @Nonnull List<Document> candidates) {
        Integer limit = query.getLimit();
        if (query.getLimitType() == StructuredQuery.LimitType.LAST && limit != null) {
            int to = candidates.size() - Math.min(query.getOffset(), candidates.size());
            return candidates.subList(Math.max(0, to - limit), to);
        }
        int from = Math.min(query.getOffset(), candidates.size());
        int to = limit == null ? candidates.size() : Math.min(candidates.size(), from + limit);
        return candidates.subList(from, to);
    }

    /**
     * Compute the aggregates of an aggregation query over the unprojected results of its query.
     *
     * @param parent parent path of the selected collections
     * @param aggregation the aggregation query
     * @param source the snapshot to read
     * @return the aggregate values by alias, in the query's alias order
     */
    @Nonnull
    public Map<String, Value> aggregate(@Nonnull ResourcePath parent, @Nonnull AggregationQuery aggregation,
                                        @Nonnull DocumentSource source) {
        aggregation.validate();
        List<Document> documents = window(aggregation.getQuery(), candidates(parent, aggregation.getQuery(), source));
        ImmutableMap.Builder<String, Value> result = ImmutableMap.builder();
        for (Map.Entry<String, AggregateField> entry : aggregation.getAggregations().entrySet()) {
            result.put(entry.getKey(), aggregate(entry.getValue(), documents));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("ran aggregation",
                    LogMessageKeys.PARENT, parent,
                    LogMessageKeys.READ_TIME, Timestamps.toString(source.getReadTime()),
                    LogMessageKeys.COUNT, documents.size(),
                    "query", aggregation));
        }
        return result.build();
    }

    @Nonnull
    private static Value aggregate(@Nonnull AggregateField field, @Nonnull List<Document> documents) {
        if (field.getKind() == AggregateField.Kind.COUNT) {
            return Value.integerValue(documents.size());
        }
        long integerSum = 0;
        double doubleSum = 0;
        boolean integral = true;
        int numbers = 0;
        for (Document document : documents) {
            Optional<Value> value = document.getValue(field.getField());
            if (value.isEmpty()) {
                continue;
            }
            Value number = value.get();
            if (number.getKind() == Value.Kind.INTEGER) {
                if (integral) {
                    try {
                        integerSum = LongMath.checkedAdd(integerSum, number.getIntegerValue());
                    } catch (ArithmeticException overflow) {
                        integral = false;
                        doubleSum = (double)integerSum + number.getIntegerValue();
                    }
                } else {
                    doubleSum += number.getIntegerValue();
                }
            } else if (number.getKind() == Value.Kind.DOUBLE) {
                if (integral) {
                    integral = false;
                    doubleSum = integerSum;
                }
                doubleSum += number.getDoubleValue();
            } else {
                continue;
            }
            numbers++;
        }
        if (field.getKind() == AggregateField.Kind.AVG) {
            if (numbers == 0) {
                return Value.nullValue();
            }
            return Value.doubleValue((integral ? (double)integerSum : doubleSum) / numbers);
        }
        return integral ? Value.integerValue(integerSum) : Value.doubleValue(doubleSum);
    }

    /**
     * Evaluate the query as a stream of responses.
     *
     * @param parent parent path of the selected collections
     * @param query the query
     * @param source the snapshot to read
     * @param transaction token to report in the first response, if the query began a transaction
     * @return a cursor of responses; it always yields at least one response
     */
    @Nonnull
    public ResultCursor<RunQueryResponse> execute(@Nonnull ResourcePath parent, @Nonnull StructuredQuery query,
                                                  @Nonnull DocumentSource source, @Nullable ByteString transaction) {
        query.validate();
        List<Document> candidates = candidates(parent, query, source);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("running query",
                    LogMessageKeys.PARENT, parent,
                    LogMessageKeys.READ_TIME, Timestamps.toString(source.getReadTime()),
                    LogMessageKeys.COUNT, candidates.size(),
                    "query", query));
        }
        if (query.getLimitType() == StructuredQuery.LimitType.LAST) {
            int skipped = Math.min(query.getOffset(), candidates.size());
            return new ResponseCursor(query, window(query, candidates), source.getReadTime(), transaction, 0, skipped);
        }
        return new ResponseCursor(query, candidates, source.getReadTime(), transaction, query.getOffset(), 0);
    }

    private final class ResponseCursor implements ResultCursor<RunQueryResponse> {
        @Nonnull
        private final StructuredQuery query;
        @Nonnull
        private final List<Document> candidates;
        @Nonnull
        private final Timestamp readTime;
        @Nullable
        private ByteString transaction;
        private int position;
        private int toSkip;
        private int pendingSkipped;
        private int remaining;
        private boolean sentAny;
        private boolean done;
        private boolean closed;

        ResponseCursor(@Nonnull StructuredQuery query, @Nonnull List<Document> candidates,
                       @Nonnull Timestamp readTime, @Nullable ByteString transaction, int toSkip, int skipped) {
            this.query = query;
            this.candidates = candidates;
            this.readTime = readTime;
            this.transaction = transaction;
            this.toSkip = toSkip;
            this.pendingSkipped = skipped;
            this.remaining = query.getLimit() == null ? Integer.MAX_VALUE : query.getLimit();
        }

        @Nonnull
        @Override
        public CursorResult<RunQueryResponse> getNext() {
            if (closed || done) {
                return CursorResult.exhausted();
            }
            while (toSkip > 0 && position < candidates.size()) {
                position++;
                toSkip--;
                pendingSkipped++;
                if (pendingSkipped == progressInterval) {
                    return emit(null);
                }
            }
            if (remaining > 0 && position < candidates.size()) {
                remaining--;
                return emit(candidates.get(position++).project(query.getSelect()));
            }
            done = true;
            if (pendingSkipped > 0 || !sentAny) {
                return emit(null);
            }
            return CursorResult.exhausted();
        }

        @Nonnull
        private CursorResult<RunQueryResponse> emit(@Nullable Document document) {
            RunQueryResponse response = new RunQueryResponse(transaction, document, readTime, pendingSkipped);
            transaction = null;
            pendingSkipped = 0;
            sentAny = true;
            return CursorResult.withNextValue(response);
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }
    }
}
