/*
 * DocumentMask.java
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

import com.google.common.collect.ImmutableSortedSet;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A set of field paths. Used both as a read projection and as the update mask of a write.
 */
public final class DocumentMask {
    @Nonnull
    private final ImmutableSortedSet<FieldPath> fieldPaths;

    private DocumentMask(@Nonnull ImmutableSortedSet<FieldPath> fieldPaths) {
        this.fieldPaths = fieldPaths;
    }

    @Nonnull
    public static DocumentMask of(@Nonnull Collection<FieldPath> fieldPaths) {
        return new DocumentMask(ImmutableSortedSet.copyOf(fieldPaths));
    }

    @Nonnull
    public static DocumentMask of(@Nonnull FieldPath... fieldPaths) {
        return of(Arrays.asList(fieldPaths));
    }

    /**
     * Build a mask from canonical field path strings.
     *
     * @param fieldPaths dotted paths
     * @return the mask
     */
    @Nonnull
    public static DocumentMask parse(@Nonnull String... fieldPaths) {
        ImmutableSortedSet.Builder<FieldPath> builder = ImmutableSortedSet.naturalOrder();
        for (String fieldPath : fieldPaths) {
            builder.add(FieldPath.parse(fieldPath));
        }
        return new DocumentMask(builder.build());
    }

    @Nonnull
    public Set<FieldPath> getFieldPaths() {
        return fieldPaths;
    }

    /**
     * Whether {@code path} is covered by the mask, either directly or through an ancestor.
     *
     * @param path field to test
     * @return {@code true} if covered
     */
    public boolean covers(@Nonnull FieldPath path) {
        for (FieldPath candidate : fieldPaths) {
            if (candidate.isPrefixOf(path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reject masks that name {@code __name__} or that name both a field and one of its ancestors.
     */
    public void validate() {
        FieldPath previous = null;
        for (FieldPath path : fieldPaths) {
            if (path.isDocumentName()) {
                throw new DocumentStoreExceptions.InvalidArgumentException("mask may not contain the document name",
                        LogMessageKeys.FIELD_PATH, path);
            }
            if (previous != null && previous.isPrefixOf(path)) {
                throw new DocumentStoreExceptions.InvalidArgumentException("mask contains overlapping paths",
                        LogMessageKeys.FIELD_PATH, path, LogMessageKeys.PARENT, previous);
            }
            previous = path;
        }
    }

    /**
     * Project {@code fields} to the paths in this mask.
     *
     * @param fields document fields
     * @return a new map holding only the masked fields that exist
     */
    @Nonnull
    public Map<String, Value> apply(@Nonnull Map<String, Value> fields) {
        Map<String, Value> result = new LinkedHashMap<>();
        for (FieldPath path : fieldPaths) {
            Optional<Value> value = Values.getField(fields, path);
            if (value.isPresent()) {
                result = Values.setField(result, path, value.get());
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DocumentMask && fieldPaths.equals(((DocumentMask)o).fieldPaths));
    }

    @Override
    public int hashCode() {
        return fieldPaths.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentMask" + fieldPaths;
    }
}
