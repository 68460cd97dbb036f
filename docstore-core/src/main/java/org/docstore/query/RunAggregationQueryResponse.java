/*
 * RunAggregationQueryResponse.java
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
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * The result of an {@link AggregationQuery}: one value per alias, all read at the same time.
 */
public final class RunAggregationQueryResponse {
    @Nullable
    private final ByteString transaction;
    @Nonnull
    private final ImmutableMap<String, Value> result;
    @Nonnull
    private final Timestamp readTime;

    public RunAggregationQueryResponse(@Nullable ByteString transaction, @Nonnull Map<String, Value> result,
                                       @Nonnull Timestamp readTime) {
        this.transaction = transaction;
        this.result = ImmutableMap.copyOf(result);
        this.readTime = readTime;
    }

    /**
     * The token of a transaction begun by the query, if it began one.
     *
     * @return the transaction token or {@code null}
     */
    @Nullable
    public ByteString getTransaction() {
        return transaction;
    }

    @Nonnull
    public Map<String, Value> getResult() {
        return result;
    }

    @Nonnull
    public Value get(@Nonnull String alias) {
        Value value = result.get(alias);
        if (value == null) {
            throw new IllegalArgumentException("no aggregate with alias " + alias);
        }
        return value;
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    @Override
    public String toString() {
        return "RunAggregationQueryResponse{" + result
                + ", readTime=" + Timestamps.toString(readTime)
                + (transaction == null ? "" : ", transaction")
                + "}";
    }
}
