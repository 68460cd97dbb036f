/*
 * LoggableKeysAndValues.java
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

package org.docstore.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Associates structured context with an object. Docstore log lines have a short static
 * title plus a set of keys and values (a document name, a target id, a transaction token)
 * so that all occurrences of a failure can be found and grouped later.
 *
 * @param <T> type of object carrying the information
 */
public interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information associated with this object.
     *
     * @return all key/value pairs added so far
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a single key/value pair.
     *
     * @param description key
     * @param object value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add pairs given as a flattened array: even elements are keys and odd elements
     * are the values that follow them.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Flatten the log information into the format accepted by {@link #addLogInfo(Object...)}.
     *
     * @return flattened key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
