/*
 * Target.java
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

package org.docstore.listen;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import org.docstore.query.StructuredQuery;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * A subscription on a listen stream: what to watch, optionally where to resume from, and whether
 * to stop once the initial result is current.
 *
 * <p>
 * A target resumes from at most one point, either an opaque resume token or a read time; setting
 * one clears the other.
 * </p>
 */
public final class Target {
    /** Target id asking the server to choose one. */
    public static final int SERVER_ASSIGNED = 0;

    private final int targetId;
    @Nonnull
    private final Selector selector;
    @Nullable
    private final ByteString resumeToken;
    @Nullable
    private final Timestamp readTime;
    private final boolean once;

    private Target(int targetId, @Nonnull Selector selector, @Nullable ByteString resumeToken,
                   @Nullable Timestamp readTime, boolean once) {
        if (targetId < 0) {
            throw new IllegalArgumentException("target id must not be negative");
        }
        this.targetId = targetId;
        this.selector = selector;
        this.resumeToken = resumeToken;
        this.readTime = readTime;
        this.once = once;
    }

    /**
     * What a target watches.
     */
    public abstract static class Selector {
        private Selector() {
        }
    }

    /**
     * The results of a query under a parent.
     */
    public static final class QuerySelector extends Selector {
        @Nonnull
        private final String parent;
        @Nonnull
        private final StructuredQuery query;

        QuerySelector(@Nonnull String parent, @Nonnull StructuredQuery query) {
            this.parent = parent;
            this.query = query;
        }

        @Nonnull
        public String getParent() {
            return parent;
        }

        @Nonnull
        public StructuredQuery getQuery() {
            return query;
        }

        @Override
        public String toString() {
            return "query(" + parent + ", " + query + ")";
        }
    }

    /**
     * A fixed set of documents, by full name.
     */
    public static final class DocumentsSelector extends Selector {
        @Nonnull
        private final ImmutableList<String> documents;

        DocumentsSelector(@Nonnull List<String> documents) {
            this.documents = ImmutableList.copyOf(documents);
        }

        @Nonnull
        public List<String> getDocuments() {
            return documents;
        }

        @Override
        public String toString() {
            return "documents" + documents;
        }
    }

    @Nonnull
    public static Target query(int targetId, @Nonnull String parent, @Nonnull StructuredQuery query) {
        return new Target(targetId, new QuerySelector(parent, query), null, null, false);
    }

    @Nonnull
    public static Target documents(int targetId, @Nonnull List<String> names) {
        return new Target(targetId, new DocumentsSelector(names), null, null, false);
    }

    @Nonnull
    public static Target documents(int targetId, @Nonnull String... names) {
        return documents(targetId, Arrays.asList(names));
    }

    @Nonnull
    public Target withTargetId(int newTargetId) {
        return new Target(newTargetId, selector, resumeToken, readTime, once);
    }

    @Nonnull
    public Target withResumeToken(@Nullable ByteString newResumeToken) {
        return new Target(targetId, selector, newResumeToken, null, once);
    }

    @Nonnull
    public Target withReadTime(@Nullable Timestamp newReadTime) {
        return new Target(targetId, selector, null, newReadTime, once);
    }

    @Nonnull
    public Target withOnce(boolean newOnce) {
        return new Target(targetId, selector, resumeToken, readTime, newOnce);
    }

    public int getTargetId() {
        return targetId;
    }

    @Nonnull
    public Selector getSelector() {
        return selector;
    }

    @Nullable
    public ByteString getResumeToken() {
        return resumeToken;
    }

    @Nullable
    public Timestamp getReadTime() {
        return readTime;
    }

    public boolean isOnce() {
        return once;
    }

    @Override
    public String toString() {
        return "Target{" + targetId + ", " + selector + (once ? ", once" : "")
                + (resumeToken != null ? ", resumeToken" : "") + (readTime != null ? ", readTime" : "") + "}";
    }
}
