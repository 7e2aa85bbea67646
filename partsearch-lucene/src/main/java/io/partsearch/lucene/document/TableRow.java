/*
 * TableRow.java
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

package io.partsearch.lucene.document;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A structured record: named columns in a fixed order, each holding a value or {@code null}.
 */
@API(API.Status.EXPERIMENTAL)
public final class TableRow {
    @Nonnull
    private final Map<String, Object> columns;

    private TableRow(@Nonnull Map<String, Object> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Set<String> getColumnNames() {
        return columns.keySet();
    }

    @Nullable
    public Object get(@Nonnull String columnName) {
        return columns.get(columnName);
    }

    /**
     * Columns and their values, in column order. Values may be {@code null}.
     * @return an unmodifiable view of the columns
     */
    @Nonnull
    public Map<String, Object> asMap() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((TableRow) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "TableRow" + columns;
    }

    /**
     * Builder for {@link TableRow}.
     */
    public static final class Builder {
        private final Map<String, Object> columns = new LinkedHashMap<>();

        private Builder() {
        }

        @Nonnull
        public Builder set(@Nonnull String columnName, @Nullable Object value) {
            columns.put(columnName, value);
            return this;
        }

        @Nonnull
        public TableRow build() {
            return new TableRow(new LinkedHashMap<>(columns));
        }
    }
}
