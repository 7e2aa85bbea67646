/*
 * SearchPropertyStorage.java
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

import com.google.common.collect.ImmutableMap;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.SearchCoreException;
import io.partsearch.annotation.API;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * An immutable set of configured values for {@link SearchPropertyKey}s.
 *
 * <p>
 * Build one programmatically with {@link #newBuilder()}, or read one from {@link Properties} against a known set of
 * keys. Keys that were not configured resolve to their defaults.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class SearchPropertyStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(SearchPropertyStorage.class);
    private static final SearchPropertyStorage EMPTY = new SearchPropertyStorage(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<SearchPropertyKey<?>, Object> propertyMap;

    private SearchPropertyStorage(@Nonnull ImmutableMap<SearchPropertyKey<?>, Object> propertyMap) {
        this.propertyMap = propertyMap;
    }

    /**
     * A storage with nothing configured, so every key resolves to its default.
     * @return the empty storage
     */
    @Nonnull
    public static SearchPropertyStorage getEmptyInstance() {
        return EMPTY;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Read values for the given keys from a {@link Properties}. Entries whose names match none of the keys are
     * ignored.
     *
     * @param properties the textual properties
     * @param knownKeys the keys to look for
     * @return the storage
     * @throws SearchCoreArgumentException if a present value cannot be parsed for its key
     */
    @Nonnull
    public static SearchPropertyStorage fromProperties(@Nonnull Properties properties,
                                                       @Nonnull Collection<? extends SearchPropertyKey<?>> knownKeys) {
        final Builder builder = newBuilder();
        for (SearchPropertyKey<?> key : knownKeys) {
            final String raw = properties.getProperty(key.getName());
            if (raw != null) {
                builder.addParsed(key, raw);
            }
        }
        return builder.build();
    }

    /**
     * Read values for the given keys from a properties resource on the class path. A missing resource gives the
     * empty storage.
     *
     * @param resourceName the class path resource, e.g. {@code "partsearch.properties"}
     * @param knownKeys the keys to look for
     * @return the storage
     */
    @Nonnull
    public static SearchPropertyStorage fromResource(@Nonnull String resourceName,
                                                     @Nonnull Collection<? extends SearchPropertyKey<?>> knownKeys) {
        final ClassLoader classLoader = SearchPropertyStorage.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("Property resource not found, using defaults",
                            LogMessageKeys.MESSAGE, resourceName));
                }
                return getEmptyInstance();
            }
            final Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties, knownKeys);
        } catch (IOException ex) {
            throw new SearchCoreException("Unable to read property resource", ex)
                    .addLogInfo(LogMessageKeys.MESSAGE.toString(), resourceName);
        }
    }

    /**
     * Resolve a key, falling back to its default.
     *
     * @param propertyKey the key
     * @param <T> the value type
     * @return the configured value or the default
     */
    @Nullable
    public <T> T getPropertyValue(@Nonnull SearchPropertyKey<T> propertyKey) {
        final Object value = propertyMap.get(propertyKey);
        if (value == null) {
            return propertyKey.getDefaultValue();
        }
        return propertyKey.getType().cast(value);
    }

    /**
     * Whether the key was explicitly configured.
     * @param propertyKey the key
     * @return {@code true} if a value other than the default was supplied
     */
    public boolean isSet(@Nonnull SearchPropertyKey<?> propertyKey) {
        return propertyMap.containsKey(propertyKey);
    }

    @Nonnull
    public Map<SearchPropertyKey<?>, Object> getPropertyMap() {
        return propertyMap;
    }

    @Nonnull
    public Builder toBuilder() {
        final Builder builder = newBuilder();
        builder.propertyMap.putAll(propertyMap);
        return builder;
    }

    @Override
    public String toString() {
        return "SearchPropertyStorage" + propertyMap;
    }

    /**
     * Builder for {@link SearchPropertyStorage}.
     */
    public static final class Builder {
        @Nonnull
        private final Map<SearchPropertyKey<?>, Object> propertyMap = new HashMap<>();

        private Builder() {
        }

        @Nonnull
        public <T> Builder addProp(@Nonnull SearchPropertyKey<T> propertyKey, @Nonnull T value) {
            propertyMap.put(propertyKey, propertyKey.getType().cast(value));
            return this;
        }

        @Nonnull
        public <T> Builder addParsed(@Nonnull SearchPropertyKey<T> propertyKey, @Nonnull String raw) {
            return addProp(propertyKey, propertyKey.parse(raw));
        }

        @Nonnull
        public Builder removeProp(@Nonnull SearchPropertyKey<?> propertyKey) {
            propertyMap.remove(propertyKey);
            return this;
        }

        @Nonnull
        public SearchPropertyStorage build() {
            return new SearchPropertyStorage(ImmutableMap.copyOf(propertyMap));
        }
    }
}
