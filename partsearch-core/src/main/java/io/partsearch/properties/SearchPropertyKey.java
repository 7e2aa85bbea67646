/*
 * SearchPropertyKey.java
 *
 * This source file is part of the Partitioned Search open source project
 *
 * Copyright 2026 the Partitioned Search project authors
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

package io.partsearch.properties;

import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Objects;

/**
 * A named, typed configuration property with a default value. Values are looked up in a
 * {@link SearchPropertyStorage}; the default applies when the storage holds nothing for the key.
 *
 * @param <T> the type of the property value
 */
@API(API.Status.EXPERIMENTAL)
public final class SearchPropertyKey<T> {
    @Nonnull
    private final String name;
    @Nullable
    private final T defaultValue;
    @Nonnull
    private final Class<T> type;

    public SearchPropertyKey(@Nonnull String name, @Nullable T defaultValue, @Nonnull Class<T> type) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.type = type;
    }

    @Nonnull
    public static SearchPropertyKey<Boolean> booleanPropertyKey(@Nonnull String name, boolean defaultValue) {
        return new SearchPropertyKey<>(name, defaultValue, Boolean.class);
    }

    @Nonnull
    public static SearchPropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new SearchPropertyKey<>(name, defaultValue, Integer.class);
    }

    @Nonnull
    public static SearchPropertyKey<Long> longPropertyKey(@Nonnull String name, long defaultValue) {
        return new SearchPropertyKey<>(name, defaultValue, Long.class);
    }

    @Nonnull
    public static SearchPropertyKey<Double> doublePropertyKey(@Nonnull String name, double defaultValue) {
        return new SearchPropertyKey<>(name, defaultValue, Double.class);
    }

    @Nonnull
    public static SearchPropertyKey<String> stringPropertyKey(@Nonnull String name, @Nullable String defaultValue) {
        return new SearchPropertyKey<>(name, defaultValue, String.class);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public T getDefaultValue() {
        return defaultValue;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    /**
     * Convert a textual value, as read from a properties file, into the type of this key.
     *
     * @param raw the text to convert
     * @return the typed value
     * @throws SearchCoreArgumentException if the text cannot be converted
     */
    @Nonnull
    public T parse(@Nonnull String raw) {
        final String trimmed = raw.trim();
        try {
            if (type == String.class) {
                return type.cast(trimmed);
            } else if (type == Integer.class) {
                return type.cast(Integer.valueOf(trimmed));
            } else if (type == Long.class) {
                return type.cast(Long.valueOf(trimmed));
            } else if (type == Double.class) {
                return type.cast(Double.valueOf(trimmed));
            } else if (type == Boolean.class) {
                final String lower = trimmed.toLowerCase(Locale.ROOT);
                if (!"true".equals(lower) && !"false".equals(lower)) {
                    throw new NumberFormatException("not a boolean: " + trimmed);
                }
                return type.cast(Boolean.valueOf(lower));
            }
        } catch (NumberFormatException ex) {
            throw new SearchCoreArgumentException("Invalid value for property", ex)
                    .addLogInfo(LogMessageKeys.PROPERTY_KEY.toString(), name,
                            LogMessageKeys.PROPERTY_VALUE.toString(), raw,
                            LogMessageKeys.PROPERTY_TYPE.toString(), type.getSimpleName());
        }
        throw new SearchCoreArgumentException("Property type cannot be parsed from text",
                LogMessageKeys.PROPERTY_KEY, name,
                LogMessageKeys.PROPERTY_TYPE, type.getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchPropertyKey<?> that = (SearchPropertyKey<?>)o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "(" + type.getSimpleName() + ", default=" + defaultValue + ")";
    }
}
