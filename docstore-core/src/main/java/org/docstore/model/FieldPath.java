/*
 * FieldPath.java
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

import com.google.common.collect.ImmutableList;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A path to a field inside a document, such as {@code address.city}. Segments that are not
 * simple identifiers are written between back quotes, e.g. {@code `first name`.initial}.
 * The special path {@code __name__} refers to the document's name.
 */
public final class FieldPath implements Comparable<FieldPath> {
    public static final String DOCUMENT_NAME_FIELD = "__name__";
    public static final FieldPath DOCUMENT_NAME = new FieldPath(ImmutableList.of(DOCUMENT_NAME_FIELD));

    private static final Pattern SIMPLE_SEGMENT = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

    @Nonnull
    private final ImmutableList<String> segments;

    private FieldPath(@Nonnull ImmutableList<String> segments) {
        this.segments = segments;
    }

    @Nonnull
    public static FieldPath of(@Nonnull String... segments) {
        return fromSegments(ImmutableList.copyOf(segments));
    }

    @Nonnull
    public static FieldPath fromSegments(@Nonnull List<String> segments) {
        if (segments.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("field path must not be empty");
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("field path has an empty segment",
                        LogMessageKeys.FIELD_PATH, segments);
            }
        }
        return new FieldPath(ImmutableList.copyOf(segments));
    }

    /**
     * Parse the canonical string form of a field path.
     *
     * @param path dotted path, with back-quoted segments where needed
     * @return the parsed path
     */
    @Nonnull
    public static FieldPath parse(@Nonnull String path) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean segmentWasQuoted = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    if (i + 1 >= path.length()) {
                        throw invalid(path);
                    }
                    current.append(path.charAt(++i));
                } else if (c == '`') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '`') {
                if (current.length() > 0) {
                    throw invalid(path);
                }
                quoted = true;
                segmentWasQuoted = true;
            } else if (c == '.') {
                if (current.length() == 0) {
                    throw invalid(path);
                }
                segments.add(current.toString());
                current.setLength(0);
                segmentWasQuoted = false;
            } else {
                if (segmentWasQuoted) {
                    throw invalid(path);
                }
                current.append(c);
            }
        }
        if (quoted || current.length() == 0) {
            throw invalid(path);
        }
        segments.add(current.toString());
        return new FieldPath(ImmutableList.copyOf(segments));
    }

    private static DocumentStoreExceptions.InvalidArgumentException invalid(@Nonnull String path) {
        return new DocumentStoreExceptions.InvalidArgumentException("invalid field path", LogMessageKeys.FIELD_PATH, path);
    }

    public int size() {
        return segments.size();
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
    public String getFirstSegment() {
        return segments.get(0);
    }

    @Nonnull
    public String getLastSegment() {
        return segments.get(segments.size() - 1);
    }

    @Nonnull
    public FieldPath popFirst() {
        return new FieldPath(segments.subList(1, segments.size()));
    }

    @Nonnull
    public FieldPath popLast() {
        return new FieldPath(segments.subList(0, segments.size() - 1));
    }

    @Nonnull
    public FieldPath append(@Nonnull String segment) {
        return fromSegments(ImmutableList.<String>builder().addAll(segments).add(segment).build());
    }

    public boolean isDocumentName() {
        return segments.size() == 1 && DOCUMENT_NAME_FIELD.equals(segments.get(0));
    }

    /**
     * Whether this path equals {@code other} or is one of its ancestors.
     *
     * @param other the possibly nested path
     * @return {@code true} if {@code other} lies within this path
     */
    public boolean isPrefixOf(@Nonnull FieldPath other) {
        if (other.segments.size() < segments.size()) {
            return false;
        }
        return other.segments.subList(0, segments.size()).equals(segments);
    }

    @Nonnull
    public String canonicalString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            String segment = segments.get(i);
            if (SIMPLE_SEGMENT.matcher(segment).matches()) {
                sb.append(segment);
            } else {
                sb.append('`').append(segment.replace("\\", "\\\\").replace("`", "\\`")).append('`');
            }
        }
        return sb.toString();
    }

    @Override
    public int compareTo(@Nonnull FieldPath other) {
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
        return o instanceof FieldPath && segments.equals(((FieldPath)o).segments);
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
