/*
 * PartitionSettings.java
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

package io.partsearch.lucene.partition;

import io.partsearch.annotation.API;
import io.partsearch.lucene.LuceneAnalyzerType;
import io.partsearch.lucene.LuceneSearchProperties;
import io.partsearch.lucene.document.DocumentConverter;
import io.partsearch.lucene.store.IndexStorage;
import io.partsearch.properties.SearchPropertyStorage;

import javax.annotation.Nonnull;

/**
 * What every partition of one collection shares: how elements become documents, where indexes are kept, and the
 * configuration.
 *
 * @param <T> the type of the source elements
 */
@API(API.Status.EXPERIMENTAL)
public final class PartitionSettings<T> {
    @Nonnull
    private final DocumentConverter<? super T> converter;
    @Nonnull
    private final IndexStorage storage;
    @Nonnull
    private final SearchPropertyStorage properties;
    @Nonnull
    private final LuceneAnalyzerType analyzerType;

    public PartitionSettings(@Nonnull DocumentConverter<? super T> converter, @Nonnull IndexStorage storage,
                             @Nonnull SearchPropertyStorage properties) {
        this.converter = converter;
        this.storage = storage;
        this.properties = properties;
        this.analyzerType = LuceneAnalyzerType.fromName(properties.getPropertyValue(LuceneSearchProperties.ANALYZER));
    }

    @Nonnull
    public DocumentConverter<? super T> getConverter() {
        return converter;
    }

    @Nonnull
    public IndexStorage getStorage() {
        return storage;
    }

    @Nonnull
    public SearchPropertyStorage getProperties() {
        return properties;
    }

    @Nonnull
    public LuceneAnalyzerType getAnalyzerType() {
        return analyzerType;
    }
}
