/*
 * Filter.java
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
import org.docstore.model.FieldPath;
import org.docstore.model.Value;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * A predicate over documents used in the {@code where} clause of a {@link StructuredQuery}.
 */
public abstract class Filter {

    Filter() {
    }

    /**
     * Evaluate the filter. Missing fields and values of a kind the filter cannot compare with
     * simply do not match.
     *
     * @param document candidate document
     * @return {@code true} if the document matches
     */
    public abstract boolean matches(@Nonnull Document document);

    /**
     * Check that the filter is well formed.
     *
     * @throws org.docstore.DocumentStoreExceptions.InvalidArgumentException if it is not
     */
    public abstract void validate();

    @Nonnull
    public static Filter and(@Nonnull Filter... filters) {
        return new CompositeFilter(CompositeFilter.Operator.AND, Arrays.asList(filters));
    }

    @Nonnull
    public static Filter or(@Nonnull Filter... filters) {
        return new CompositeFilter(CompositeFilter.Operator.OR, Arrays.asList(filters));
    }

    @Nonnull
    public static Filter field(@Nonnull String fieldPath, @Nonnull FieldFilter.Operator operator, @Nonnull Value value) {
        return new FieldFilter(FieldPath.parse(fieldPath), operator, value);
    }

    @Nonnull
    public static Filter unary(@Nonnull String fieldPath, @Nonnull UnaryFilter.Operator operator) {
        return new UnaryFilter(FieldPath.parse(fieldPath), operator);
    }
}
