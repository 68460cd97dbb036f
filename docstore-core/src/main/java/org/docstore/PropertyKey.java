/*
 * PropertyKey.java
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

package org.docstore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * A named, typed configuration property with a default value.
 *
 * @param <T> type of the property's value
 */
public final class PropertyKey<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<T> type;
    @Nonnull
    private final T defaultValue;
    @Nonnull
    private final Function<String, T> parser;

    private PropertyKey(@Nonnull String name, @Nonnull Class<T> type, @Nonnull T defaultValue,
                        @Nonnull Function<String, T> parser) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.parser = parser;
    }

    @Nonnull
    public static PropertyKey<Long> longPropertyKey(@Nonnull String name, long defaultValue) {
        return new PropertyKey<>(name, Long.class, defaultValue, s -> Long.parseLong(s.trim()));
    }

    @Nonnull
    public static PropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new PropertyKey<>(name, Integer.class, defaultValue, s -> Integer.parseInt(s.trim()));
    }

    @Nonnull
    public static PropertyKey<Double> doublePropertyKey(@Nonnull String name, double defaultValue) {
        return new PropertyKey<>(name, Double.class, defaultValue, s -> Double.parseDouble(s.trim()));
    }

    @Nonnull
    public static <E extends Enum<E>> PropertyKey<E> enumPropertyKey(@Nonnull String name, @Nonnull Class<E> type,
                                                                   @Nonnull E defaultValue) {
        return new PropertyKey<>(name, type, defaultValue, s -> Enum.valueOf(type, s.trim()));
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    @Nonnull
    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * Read this property from the given properties, falling back to the default when it is absent.
     *
     * @param properties source of configuration values
     * @return the configured value
     * @throws DocumentStoreExceptions.InvalidArgumentException if the value cannot be parsed
     */
    @Nonnull
    public T get(@Nullable Properties properties) {
        String raw = properties == null ? null : properties.getProperty(name);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreExceptions.InvalidArgumentException("invalid configuration value",
                    "property", name, "value", raw);
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
        PropertyKey<?> that = (PropertyKey<?>)o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "=" + defaultValue;
    }
}
