/*
 * LuceneSearchProperties.java
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

package io.partsearch.lucene;

import com.google.common.collect.ImmutableList;
import io.partsearch.annotation.API;
import io.partsearch.properties.SearchPropertyKey;
import io.partsearch.properties.SearchPropertyStorage;
import io.partsearch.reduce.ReductionStrategy;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The {@link SearchPropertyKey}s that configure partition indexing and querying.
 * Values are read from a {@link SearchPropertyStorage}; see {@link #load()} for reading them from the class path.
 */
@API(API.Status.EXPERIMENTAL)
public final class LuceneSearchProperties {
    /**
     * Class path resource read by {@link #load()}.
     */
    public static final String DEFAULT_RESOURCE = "partsearch.properties";

    /**
     * Number of hits returned by queries that do not say how many they want.
     */
    public static final SearchPropertyKey<Integer> DEFAULT_TOP_K = SearchPropertyKey.integerPropertyKey("io.partsearch.lucene.query.topk.default", 10);

    /**
     * Upper limit on the number of hits any query may ask for. Larger requests are clamped to this value.
     */
    public static final SearchPropertyKey<Integer> MAX_TOP_K = SearchPropertyKey.integerPropertyKey("io.partsearch.lucene.query.topk.maxvalue", 1000);

    /**
     * Number of facet labels returned per partition by facet queries that do not say how many they want.
     */
    public static final SearchPropertyKey<Integer> DEFAULT_FACET_NUM = SearchPropertyKey.integerPropertyKey("io.partsearch.lucene.query.facet.topk.default", 10);

    /**
     * Name of the {@link LuceneAnalyzerType} used for indexing, query parsing and phrase analysis.
     */
    public static final SearchPropertyKey<String> ANALYZER = SearchPropertyKey.stringPropertyKey("io.partsearch.lucene.analyzer", LuceneAnalyzerType.STANDARD.name());

    /**
     * RAM buffer of the index writer, in megabytes.
     */
    public static final SearchPropertyKey<Double> WRITER_RAM_BUFFER_MB = SearchPropertyKey.doublePropertyKey("io.partsearch.lucene.writer.ramBufferSizeMB", 16.0);

    /**
     * Whether the index writer's info stream is routed to TRACE logging.
     */
    public static final SearchPropertyKey<Boolean> WRITER_INFO_STREAM_ENABLED = SearchPropertyKey.booleanPropertyKey("io.partsearch.lucene.writer.infoStreamEnabled", false);

    /**
     * When {@code true}, converting a structured record fails on a {@code null} or unsupported column value
     * instead of leaving the column out of the document.
     */
    public static final SearchPropertyKey<Boolean> STRICT_CONVERSION = SearchPropertyKey.booleanPropertyKey("io.partsearch.lucene.conversion.strict", false);

    /**
     * Name of the {@link ReductionStrategy} used to merge partition results.
     */
    public static final SearchPropertyKey<String> REDUCTION_STRATEGY = SearchPropertyKey.stringPropertyKey("io.partsearch.reduction.strategy", ReductionStrategy.PAIRWISE_TREE.name());

    /**
     * Every key defined here.
     */
    public static final List<SearchPropertyKey<?>> ALL = ImmutableList.of(
            DEFAULT_TOP_K, MAX_TOP_K, DEFAULT_FACET_NUM, ANALYZER, WRITER_RAM_BUFFER_MB,
            WRITER_INFO_STREAM_ENABLED, STRICT_CONVERSION, REDUCTION_STRATEGY);

    /**
     * Read the keys defined here from {@value #DEFAULT_RESOURCE} on the class path, if present.
     * @return the configured storage
     */
    @Nonnull
    public static SearchPropertyStorage load() {
        return SearchPropertyStorage.fromResource(DEFAULT_RESOURCE, ALL);
    }

    private LuceneSearchProperties() {
    }
}
