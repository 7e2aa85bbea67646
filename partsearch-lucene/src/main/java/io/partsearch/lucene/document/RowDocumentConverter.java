/*
 * RowDocumentConverter.java
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

import com.google.common.collect.ImmutableSet;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.lucene.LuceneLogMessageKeys;
import io.partsearch.lucene.LuceneSearchProperties;
import io.partsearch.properties.SearchPropertyStorage;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.FloatPoint;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.facet.FacetField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Converts {@link TableRow}s to documents with one typed field per column.
 *
 * <p>
 * Columns named as index columns are searchable and stored; all other columns are only stored, so they come back
 * with hits but cannot be queried. Strings become text fields, while {@code Long}, {@code Integer}, {@code Float}
 * and {@code Double} become point fields with a stored copy. Columns named as facet columns additionally get a
 * facet label, under {@code <column>_facet} for strings or {@code <column>_numFacet} for numbers.
 * </p>
 *
 * <p>
 * A {@code null} value, or a value of any other type, is left out of the document and logged at DEBUG. In strict
 * mode it fails the conversion instead.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class RowDocumentConverter implements DocumentConverter<TableRow> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RowDocumentConverter.class);

    @Nonnull
    private final Set<String> indexColumns;
    @Nonnull
    private final Set<String> facetColumns;
    private final boolean strict;

    public RowDocumentConverter(@Nonnull Collection<String> indexColumns, @Nonnull Collection<String> facetColumns, boolean strict) {
        this.indexColumns = ImmutableSet.copyOf(indexColumns);
        this.facetColumns = ImmutableSet.copyOf(facetColumns);
        this.strict = strict;
    }

    public RowDocumentConverter(@Nonnull Collection<String> indexColumns) {
        this(indexColumns, ImmutableSet.of(), false);
    }

    /**
     * A converter whose strictness comes from {@link LuceneSearchProperties#STRICT_CONVERSION}.
     *
     * @param indexColumns the searchable columns
     * @param facetColumns the columns that also get facet labels
     * @param properties the configuration
     * @return the converter
     */
    @Nonnull
    public static RowDocumentConverter fromProperties(@Nonnull Collection<String> indexColumns,
                                                      @Nonnull Collection<String> facetColumns,
                                                      @Nonnull SearchPropertyStorage properties) {
        return new RowDocumentConverter(indexColumns, facetColumns, properties.getPropertyValue(LuceneSearchProperties.STRICT_CONVERSION));
    }

    @Nonnull
    public Set<String> getIndexColumns() {
        return indexColumns;
    }

    @Nonnull
    public Set<String> getFacetColumns() {
        return facetColumns;
    }

    public boolean isStrict() {
        return strict;
    }

    @Nonnull
    @Override
    public Document convert(@Nonnull TableRow row) {
        final Document document = new Document();
        for (Map.Entry<String, Object> column : row.asMap().entrySet()) {
            final String name = column.getKey();
            final Object value = column.getValue();
            if (insertField(document, name, value, indexColumns.contains(name))) {
                if (facetColumns.contains(name)) {
                    insertFacet(document, name, value);
                }
            } else {
                omit(name, value);
            }
        }
        return document;
    }

    private static boolean insertField(@Nonnull Document document, @Nonnull String name, @Nullable Object value, boolean indexed) {
        if (value instanceof String) {
            if (indexed) {
                document.add(new TextField(name, (String) value, Field.Store.YES));
            } else {
                document.add(new StoredField(name, (String) value));
            }
        } else if (value instanceof Long) {
            final long longValue = (Long) value;
            if (indexed) {
                document.add(new LongPoint(name, longValue));
            }
            document.add(new StoredField(name, longValue));
        } else if (value instanceof Integer) {
            final int intValue = (Integer) value;
            if (indexed) {
                document.add(new IntPoint(name, intValue));
            }
            document.add(new StoredField(name, intValue));
        } else if (value instanceof Float) {
            final float floatValue = (Float) value;
            if (indexed) {
                document.add(new FloatPoint(name, floatValue));
            }
            document.add(new StoredField(name, floatValue));
        } else if (value instanceof Double) {
            final double doubleValue = (Double) value;
            if (indexed) {
                document.add(new DoublePoint(name, doubleValue));
            }
            document.add(new StoredField(name, doubleValue));
        } else {
            return false;
        }
        return true;
    }

    private static void insertFacet(@Nonnull Document document, @Nonnull String name, @Nonnull Object value) {
        if (value instanceof String) {
            if (!((String) value).isEmpty()) {
                document.add(new FacetField(FacetFields.textFacet(name), (String) value));
            }
        } else {
            document.add(new FacetField(FacetFields.numericFacet(name), value.toString()));
        }
    }

    private void omit(@Nonnull String name, @Nullable Object value) {
        final String valueType = value == null ? "null" : value.getClass().getName();
        if (strict) {
            throw new SearchCoreArgumentException("unsupported column value",
                    LuceneLogMessageKeys.COLUMN_NAME, name,
                    LuceneLogMessageKeys.VALUE_TYPE, valueType);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("omitting column value from document",
                    LuceneLogMessageKeys.COLUMN_NAME, name,
                    LuceneLogMessageKeys.VALUE_TYPE, valueType));
        }
    }
}
