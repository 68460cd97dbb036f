/*
 * TransactionRecord.java
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

package org.docstore.transaction;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.docstore.query.StructuredQuery;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Server-side state of one transaction token. Guarded by its own monitor; the coordinator
 * drives state changes.
 */
public final class TransactionRecord {
    @Nonnull
    private final ByteString token;
    @Nonnull
    private final TransactionOptions options;
    @Nonnull
    private final Timestamp readTime;
    private final long startMillis;
    private final int attempt;
    @Nonnull
    private TransactionState state = TransactionState.ACTIVE;
    @Nonnull
    private final Set<ResourcePath> readPaths = new HashSet<>();
    @Nonnull
    private final List<QueryRead> queryReads = new ArrayList<>();

    TransactionRecord(@Nonnull ByteString token, @Nonnull TransactionOptions options, @Nonnull Timestamp readTime,
                      long startMillis, int attempt) {
        this.token = token;
        this.options = options;
        this.readTime = readTime;
        this.startMillis = startMillis;
        this.attempt = attempt;
    }

    /**
     * A query run inside the transaction, with the versions it returned.
     */
    static final class QueryRead {
        @Nonnull
        final ResourcePath parent;
        @Nonnull
        final StructuredQuery query;
        @Nonnull
        final ImmutableList<VersionKey> results;

        QueryRead(@Nonnull ResourcePath parent, @Nonnull StructuredQuery query, @Nonnull List<Document> documents) {
            this.parent = parent;
            this.query = query;
            this.results = versions(documents);
        }

        static ImmutableList<VersionKey> versions(@Nonnull List<Document> documents) {
            ImmutableList.Builder<VersionKey> builder = ImmutableList.builderWithExpectedSize(documents.size());
            for (Document document : documents) {
                builder.add(new VersionKey(document.getPath(), document.getUpdateTime()));
            }
            return builder.build();
        }
    }

    static final class VersionKey {
        @Nonnull
        final ResourcePath path;
        @Nullable
        final Timestamp updateTime;

        VersionKey(@Nonnull ResourcePath path, @Nullable Timestamp updateTime) {
            this.path = path;
            this.updateTime = updateTime;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            VersionKey that = (VersionKey) o;
            return path.equals(that.path) && Objects.equals(updateTime, that.updateTime);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, updateTime);
        }
    }

    @Nonnull
    public ByteString getToken() {
        return token;
    }

    @Nonnull
    public TransactionOptions getOptions() {
        return options;
    }

    public boolean isReadOnly() {
        return options.isReadOnly();
    }

    @Nonnull
    public Timestamp getReadTime() {
        return readTime;
    }

    public long getStartMillis() {
        return startMillis;
    }

    /**
     * Attempt number, counting from 1; each retry chained through {@code retryTransaction} adds one.
     *
     * @return the attempt number
     */
    public int getAttempt() {
        return attempt;
    }

    @Nonnull
    public synchronized TransactionState getState() {
        return state;
    }

    synchronized void setState(@Nonnull TransactionState state) {
        this.state = state;
    }

    /**
     * Move from {@code ACTIVE} to {@code next}.
     *
     * @param next the new state
     * @return the state before the call; the transition happened only if it was {@code ACTIVE}
     */
    synchronized TransactionState transition(@Nonnull TransactionState next) {
        TransactionState previous = state;
        if (previous == TransactionState.ACTIVE) {
            state = next;
        }
        return previous;
    }

    synchronized void recordRead(@Nonnull ResourcePath path) {
        readPaths.add(path);
    }

    synchronized void recordQuery(@Nonnull ResourcePath parent, @Nonnull StructuredQuery query,
                                  @Nonnull List<Document> documents) {
        queryReads.add(new QueryRead(parent, query, documents));
    }

    @Nonnull
    synchronized Set<ResourcePath> getReadPaths() {
        return new HashSet<>(readPaths);
    }

    @Nonnull
    synchronized List<QueryRead> getQueryReads() {
        return new ArrayList<>(queryReads);
    }

    @Nonnull
    public String getId() {
        return tokenString(token);
    }

    @Nonnull
    static String tokenString(@Nonnull ByteString token) {
        return BaseEncoding.base16().lowerCase().encode(token.toByteArray());
    }

    @Override
    public String toString() {
        return "Transaction{" + getId() + ", " + options + ", " + getState() + "}";
    }
}
