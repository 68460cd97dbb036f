/*
 * ResourcePath.java
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

package org.docstore.model;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.docstore.DocumentStoreExceptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A slash-separated resource path such as
 * {@code projects/p/databases/d/documents/users/alice}. Paths order segment by segment,
 * so every path sorts directly before all of its descendants.
 */
public final class ResourcePath implements Comparable<ResourcePath> {
    public static final ResourcePath EMPTY = new ResourcePath(ImmutableList.of());

    private static final Splitter SLASH = Splitter.on('/');

    @Nonnull
    private final ImmutableList<String> segments;

    private ResourcePath(@Nonnull ImmutableList<String> segments) {
        this.segments = segments;
    }

    @Nonnull
    public static ResourcePath of(@Nonnull String... segments) {
        return fromSegments(ImmutableList.copyOf(segments));
    }

    @Nonnull
    public static ResourcePath fromSegments(@Nonnull List<String> segments) {
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("resource path has an empty segment",
                        "segments", segments);
            }
        }
        return new ResourcePath(ImmutableList.copyOf(segments));
    }

    /**
     * Parse a slash-separated path. Leading and trailing slashes are not allowed.
     *
     * @param path the path string
     * @return the parsed path
     */
    @Nonnull
    public static ResourcePath parse(@Nonnull String path) {
        if (path.isEmpty()) {
            return EMPTY;
        }
        return fromSegments(SLASH.splitToList(path));
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    @Nonnull
    public String get(int index) {
        return segments.get(index);
    }

    @Nonnull
    public List<String> getSegments() {
        return segments;
    }

    @Nonnull
    public String getLastSegment() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("empty path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    @Nullable
    public ResourcePath getParent() {
        if (segments.isEmpty()) {
            return null;
        }
        return new ResourcePath(segments.subList(0, segments.size() - 1));
    }

    @Nonnull
    public ResourcePath append(@Nonnull String segment) {
        if (segment.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("resource path has an empty segment");
        }
        return new ResourcePath(ImmutableList.<String>builderWithExpectedSize(segments.size() + 1)
                .addAll(segments)
                .add(segment)
                .build());
    }

    @Nonnull
    public ResourcePath append(@Nonnull ResourcePath other) {
        return new ResourcePath(ImmutableList.<String>builder().addAll(segments).addAll(other.segments).build());
    }

    /**
     * Drop the first {@code count} segments.
     *
     * @param count number of leading segments to remove
     * @return the remaining path
     */
    @Nonnull
    public ResourcePath popFirst(int count) {
        return new ResourcePath(segments.subList(count, segments.size()));
    }

    public boolean isPrefixOf(@Nonnull ResourcePath other) {
        if (other.segments.size() < segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).equals(other.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether {@code other} is a direct child of this path.
     *
     * @param other candidate child
     * @return {@code true} if {@code other} extends this path by exactly one segment
     */
    public boolean isImmediateParentOf(@Nonnull ResourcePath other) {
        return other.size() == size() + 1 && isPrefixOf(other);
    }

    @Nonnull
    public String canonicalString() {
        return String.join("/", segments);
    }

    @Override
    public int compareTo(@Nonnull ResourcePath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = Values.compareUtf8(segments.get(i), other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ResourcePath && segments.equals(((ResourcePath)o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return canonicalString();
    }
}
