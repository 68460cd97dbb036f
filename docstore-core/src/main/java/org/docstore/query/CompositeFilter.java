/*
 * CompositeFilter.java
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

import com.google.common.collect.ImmutableList;
import org.docstore.DocumentStoreExceptions;
import org.docstore.model.Document;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A conjunction or disjunction of other filters.
 */
public class CompositeFilter extends Filter {

    /**
     * How the child filters are combined.
     */
    public enum Operator {
        AND,
        OR
    }

    @Nonnull
    private final Operator operator;
    @Nonnull
    private final ImmutableList<Filter> filters;

    public CompositeFilter(@Nonnull Operator operator, @Nonnull List<Filter> filters) {
        this.operator = operator;
        this.filters = ImmutableList.copyOf(filters);
    }

    @Nonnull
    public Operator getOperator() {
        return operator;
    }

    @Nonnull
    public List<Filter> getFilters() {
        return filters;
    }

    @Override
    public boolean matches(@Nonnull Document document) {
        if (operator == Operator.AND) {
            for (Filter filter : filters) {
                if (!filter.matches(document)) {
                    return false;
                }
            }
            return true;
        }
        for (Filter filter : filters) {
            if (filter.matches(document)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void validate() {
        if (filters.isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("composite filter must have at least one filter",
                    "operator", operator);
        }
        for (Filter filter : filters) {
            filter.validate();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompositeFilter that = (CompositeFilter)o;
        return operator == that.operator && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, filters);
    }

    @Override
    public String toString() {
        return operator + filters.toString();
    }
}
