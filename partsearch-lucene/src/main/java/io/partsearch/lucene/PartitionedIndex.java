/*
 * PartitionedIndex.java
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
import com.google.common.collect.ImmutableSortedSet;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.async.ScatterGather;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.lucene.document.DocumentConverter;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.facets.FacetResultMonoid;
import io.partsearch.lucene.facets.FacetResultsByField;
import io.partsearch.lucene.partition.LucenePartition;
import io.partsearch.lucene.partition.PartitionSettings;
import io.partsearch.lucene.partition.SearchPartition;
import io.partsearch.lucene.query.LuceneQueryHelpers;
import io.partsearch.lucene.response.QueryOutcome;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.lucene.response.TopKMerge;
import io.partsearch.lucene.store.IndexLocation;
import io.partsearch.lucene.store.IndexStatus;
import io.partsearch.lucene.store.IndexStorage;
import io.partsearch.lucene.store.LocalFileSystemIndexStorage;
import io.partsearch.properties.SearchPropertyStorage;
import io.partsearch.reduce.Monoid;
import io.partsearch.reduce.ReductionStrategy;
import io.partsearch.util.CloseException;
import io.partsearch.util.CloseableUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.lucene.search.BooleanClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A collection split into independently indexed partitions, queried as one.
 *
 * <p>
 * Every query is sent to all partitions in parallel on the executor, and the partition answers are reduced with
 * the configured {@link ReductionStrategy}: hits with {@link TopKMerge}, facet counts with {@link FacetResultMonoid}.
 * Both reductions give the same answer whatever the grouping, so a sequential fold and a pairwise tree agree.
 * </p>
 *
 * <pre>{@code
 * try (PartitionedIndex<String> index = PartitionedIndex.newBuilder(DocumentConverters.text("text"))
 *         .setBasePath("/var/search/articles")
 *         .build(slices)) {
 *     SearchResponse response = index.termQuery("text", "apple", 10);
 * }
 * }</pre>
 *
 * @param <T> the type of the source elements
 */
@API(API.Status.EXPERIMENTAL)
public class PartitionedIndex<T> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionedIndex.class);

    @Nonnull
    private final List<SearchPartition<T>> partitions;
    @Nonnull
    private final SearchPropertyStorage properties;
    @Nonnull
    private final ReductionStrategy reductionStrategy;
    @Nonnull
    private final Executor executor;

    public PartitionedIndex(@Nonnull List<? extends SearchPartition<T>> partitions, @Nonnull SearchPropertyStorage properties,
                            @Nonnull ReductionStrategy reductionStrategy, @Nonnull Executor executor) {
        this.partitions = ImmutableList.copyOf(partitions);
        this.properties = properties;
        this.reductionStrategy = reductionStrategy;
        this.executor = executor;
    }

    @Nonnull
    public static <T> Builder<T> newBuilder(@Nonnull DocumentConverter<? super T> converter) {
        return new Builder<>(converter);
    }

    @Nonnull
    public List<SearchPartition<T>> getPartitions() {
        return partitions;
    }

    @Nonnull
    public ReductionStrategy getReductionStrategy() {
        return reductionStrategy;
    }

    @Nonnull
    public SearchPropertyStorage getProperties() {
        return properties;
    }

    /**
     * Where each partition's index lives, in partition order. Passing the primary paths to
     * {@link Builder#open(List)} opens the same indexes again. Partitions that are built on demand are built here.
     *
     * @return the locations
     */
    @Nonnull
    public List<IndexLocation> getIndexLocations() {
        return gather(SearchPartition::getIndexLocation);
    }

    /**
     * Total number of documents over all partitions.
     * @return the document count
     */
    public long count() {
        return gather(SearchPartition::size).stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Union of the field names of all partitions.
     * @return the sorted field names
     */
    @Nonnull
    public Set<String> fields() {
        final ImmutableSortedSet.Builder<String> fields = ImmutableSortedSet.naturalOrder();
        for (Set<String> partitionFields : gather(SearchPartition::fields)) {
            fields.addAll(partitionFields);
        }
        return fields.build();
    }

    @Nonnull
    public SearchResponse termQuery(@Nonnull String field, @Nonnull String text) {
        return termQuery(field, text, defaultTopK());
    }

    @Nonnull
    public SearchResponse termQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return searchAll(topK, partition -> partition.termQuery(field, text, topK));
    }

    @Nonnull
    public SearchResponse prefixQuery(@Nonnull String field, @Nonnull String text) {
        return prefixQuery(field, text, defaultTopK());
    }

    @Nonnull
    public SearchResponse prefixQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return searchAll(topK, partition -> partition.prefixQuery(field, text, topK));
    }

    @Nonnull
    public SearchResponse fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits) {
        return fuzzyQuery(field, text, maxEdits, defaultTopK());
    }

    @Nonnull
    public SearchResponse fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits, int topK) {
        return searchAll(topK, partition -> partition.fuzzyQuery(field, text, maxEdits, topK));
    }

    @Nonnull
    public SearchResponse phraseQuery(@Nonnull String field, @Nonnull String text) {
        return phraseQuery(field, text, defaultTopK());
    }

    @Nonnull
    public SearchResponse phraseQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return searchAll(topK, partition -> partition.phraseQuery(field, text, topK));
    }

    @Nonnull
    public SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK) {
        return multiTermQuery(fieldsToTerms, topK, BooleanClause.Occur.MUST);
    }

    @Nonnull
    public SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK, @Nonnull BooleanClause.Occur occur) {
        return searchAll(topK, partition -> partition.multiTermQuery(fieldsToTerms, topK, occur));
    }

    @Nonnull
    public SearchResponse query(@Nonnull String defaultField, @Nonnull String searchString) {
        return query(defaultField, searchString, defaultTopK());
    }

    @Nonnull
    public SearchResponse query(@Nonnull String defaultField, @Nonnull String searchString, int topK) {
        return searchAll(topK, partition -> partition.query(defaultField, searchString, topK));
    }

    /**
     * Run several query strings over all partitions. A string that fails to parse fails its own entry and leaves the
     * others intact.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchStrings the query strings
     * @param topK the number of hits wanted per string
     * @return the merged outcome per string, in input order
     */
    @Nonnull
    public Map<String, QueryOutcome<SearchResponse>> queries(@Nonnull String defaultField, @Nonnull List<String> searchStrings, int topK) {
        final int mergeTopK = LuceneQueryHelpers.effectiveTopK(topK, properties);
        final List<Map<String, QueryOutcome<SearchResponse>>> partial =
                gather(partition -> partition.queries(defaultField, searchStrings, topK));
        final TopKMerge merge = new TopKMerge(mergeTopK);
        final Map<String, QueryOutcome<SearchResponse>> merged = new LinkedHashMap<>();
        for (String searchString : searchStrings) {
            if (merged.containsKey(searchString)) {
                continue;
            }
            final List<SearchResponse> responses = new ArrayList<>(partial.size());
            QueryOutcome<SearchResponse> failure = null;
            for (Map<String, QueryOutcome<SearchResponse>> outcomes : partial) {
                final QueryOutcome<SearchResponse> outcome = outcomes.get(searchString);
                if (outcome.isSuccess()) {
                    responses.add(outcome.get());
                } else if (failure == null) {
                    failure = outcome;
                }
            }
            merged.put(searchString, failure != null ? failure : QueryOutcome.success(reduce(responses, merge)));
        }
        return merged;
    }

    /**
     * Run a query and count the labels of a facet field among its matches. The hits and the counts come from the
     * same parse of the query string, so both see the same matching documents.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchString the query string
     * @param facetField the facet field, without suffix
     * @param topK the number of hits wanted
     * @param facetNum the number of labels each partition contributes
     * @return the merged hits and the combined facet counts
     */
    @Nonnull
    public Pair<SearchResponse, FacetResult> facetQuery(@Nonnull String defaultField, @Nonnull String searchString,
                                                        @Nonnull String facetField, int topK, int facetNum) {
        final int mergeTopK = LuceneQueryHelpers.effectiveTopK(topK, properties);
        return scatterReduce(
                partition -> Pair.of(partition.query(defaultField, searchString, topK),
                        partition.facetQuery(defaultField, searchString, facetField, facetNum)),
                pairOf(new TopKMerge(mergeTopK), FacetResultMonoid.INSTANCE));
    }

    @Nonnull
    public Pair<SearchResponse, FacetResult> facetQuery(@Nonnull String defaultField, @Nonnull String searchString,
                                                        @Nonnull String facetField) {
        return facetQuery(defaultField, searchString, facetField, defaultTopK(), defaultFacetNum());
    }

    /**
     * Run a query and count the labels of several facet fields among its matches. Every field is counted over the
     * documents the hits come from, and each field is combined on its own.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchString the query string
     * @param facetFields the facet fields, without suffix
     * @param topK the number of hits wanted
     * @param facetNum the number of labels each partition contributes per field
     * @return the merged hits and the combined facet counts per field
     */
    @Nonnull
    public Pair<SearchResponse, Map<String, FacetResult>> facetQueries(@Nonnull String defaultField, @Nonnull String searchString,
                                                                      @Nonnull List<String> facetFields, int topK, int facetNum) {
        final int mergeTopK = LuceneQueryHelpers.effectiveTopK(topK, properties);
        return scatterReduce(
                partition -> Pair.of(partition.query(defaultField, searchString, topK),
                        partition.facetQueries(defaultField, searchString, facetFields, facetNum)),
                pairOf(new TopKMerge(mergeTopK), FacetResultsByField.INSTANCE));
    }

    @Nonnull
    public Pair<SearchResponse, Map<String, FacetResult>> facetQueries(@Nonnull String defaultField, @Nonnull String searchString,
                                                                      @Nonnull List<String> facetFields) {
        return facetQueries(defaultField, searchString, facetFields, defaultTopK(), defaultFacetNum());
    }

    /**
     * A new collection over the elements satisfying the predicate, with one filtered partition per partition.
     * This collection is not changed; the new partitions build their indexes when first queried.
     *
     * @param predicate the elements to keep
     * @return the filtered collection
     */
    @Nonnull
    public PartitionedIndex<T> filter(@Nonnull Predicate<? super T> predicate) {
        final List<SearchPartition<T>> filtered = new ArrayList<>(partitions.size());
        for (SearchPartition<T> partition : partitions) {
            filtered.add(partition.filter(predicate));
        }
        return new PartitionedIndex<>(filtered, properties, reductionStrategy, executor);
    }

    /**
     * Close every partition.
     * @throws CloseException if any partition fails to close; the rest are still closed
     */
    @Override
    public void close() {
        CloseableUtils.closeAll(partitions);
    }

    private int defaultTopK() {
        return properties.getPropertyValue(LuceneSearchProperties.DEFAULT_TOP_K);
    }

    private int defaultFacetNum() {
        return properties.getPropertyValue(LuceneSearchProperties.DEFAULT_FACET_NUM);
    }

    @Nonnull
    private SearchResponse searchAll(int topK, @Nonnull Function<SearchPartition<T>, SearchResponse> query) {
        final int mergeTopK = LuceneQueryHelpers.effectiveTopK(topK, properties);
        return scatterReduce(query, new TopKMerge(mergeTopK));
    }

    @Nonnull
    private <R> List<R> gather(@Nonnull Function<SearchPartition<T>, R> task) {
        return ScatterGather.asyncToSync(ScatterGather.<SearchPartition<T>, R>gather(partitions, task, executor));
    }

    @Nonnull
    private <R> R scatterReduce(@Nonnull Function<SearchPartition<T>, R> task, @Nonnull Monoid<R> monoid) {
        final long startTime = System.nanoTime();
        final R result = ScatterGather.asyncToSync(
                ScatterGather.<SearchPartition<T>, R>scatterReduce(partitions, task, monoid, reductionStrategy, executor));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("reduced partition results",
                    LogMessageKeys.PARTITION_COUNT, partitions.size(),
                    LogMessageKeys.REDUCTION_STRATEGY, reductionStrategy,
                    LogMessageKeys.TIME_NANOS, System.nanoTime() - startTime));
        }
        return result;
    }

    @Nonnull
    private <R> R reduce(@Nonnull List<R> values, @Nonnull Monoid<R> monoid) {
        return ScatterGather.asyncToSync(reductionStrategy.reduce(values, monoid, executor));
    }

    @Nonnull
    private static <A, B> Monoid<Pair<A, B>> pairOf(@Nonnull Monoid<A> first, @Nonnull Monoid<B> second) {
        return new Monoid<Pair<A, B>>() {
            @Nonnull
            @Override
            public Pair<A, B> empty() {
                return Pair.of(first.empty(), second.empty());
            }

            @Nonnull
            @Override
            public Pair<A, B> combine(@Nonnull Pair<A, B> left, @Nonnull Pair<A, B> right) {
                return Pair.of(first.combine(left.getLeft(), right.getLeft()), second.combine(left.getRight(), right.getRight()));
            }
        };
    }

    /**
     * Builds the partitions of a {@link PartitionedIndex}.
     *
     * @param <T> the type of the source elements
     */
    public static final class Builder<T> {
        @Nonnull
        private final DocumentConverter<? super T> converter;
        @Nonnull
        private IndexStorage storage = new LocalFileSystemIndexStorage();
        @Nonnull
        private String basePath = "";
        @Nonnull
        private SearchPropertyStorage properties = SearchPropertyStorage.getEmptyInstance();
        @Nonnull
        private Executor executor = ForkJoinPool.commonPool();
        private ReductionStrategy reductionStrategy;

        private Builder(@Nonnull DocumentConverter<? super T> converter) {
            this.converter = converter;
        }

        @Nonnull
        public Builder<T> setStorage(@Nonnull IndexStorage storage) {
            this.storage = storage;
            return this;
        }

        /**
         * The path new partition indexes are created under.
         * @param basePath the base path
         * @return this builder
         */
        @Nonnull
        public Builder<T> setBasePath(@Nonnull String basePath) {
            this.basePath = basePath;
            return this;
        }

        @Nonnull
        public Builder<T> setProperties(@Nonnull SearchPropertyStorage properties) {
            this.properties = properties;
            return this;
        }

        @Nonnull
        public Builder<T> setExecutor(@Nonnull Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Override the reduction strategy configured by {@link LuceneSearchProperties#REDUCTION_STRATEGY}.
         * @param reductionStrategy the strategy
         * @return this builder
         */
        @Nonnull
        public Builder<T> setReductionStrategy(@Nonnull ReductionStrategy reductionStrategy) {
            this.reductionStrategy = reductionStrategy;
            return this;
        }

        /**
         * Index each slice into its own partition, all in parallel. If any partition fails to build, the ones that
         * were built are closed and the failure is rethrown.
         *
         * @param slices the elements of each partition
         * @return the collection
         */
        @Nonnull
        public PartitionedIndex<T> build(@Nonnull List<? extends Iterable<? extends T>> slices) {
            final ReductionStrategy strategy = resolveReductionStrategy();
            final PartitionSettings<T> settings = new PartitionSettings<>(converter, storage, properties);
            final List<CompletableFuture<SearchPartition<T>>> futures = new ArrayList<>(slices.size());
            for (int i = 0; i < slices.size(); i++) {
                final int partitionId = i;
                final Iterable<? extends T> slice = slices.get(i);
                futures.add(CompletableFuture.supplyAsync(
                        () -> LucenePartition.create(partitionId, slice, settings, basePath, IndexStatus.REWRITE), executor));
            }
            return complete(futures, IndexStatus.REWRITE, strategy);
        }

        /**
         * Open partitions over indexes built earlier, one per primary index path, in parallel.
         *
         * @param indexPaths primary index paths, as reported by {@link PartitionedIndex#getIndexLocations()}
         * @return the collection; its partitions have no source elements
         */
        @Nonnull
        public PartitionedIndex<T> open(@Nonnull List<String> indexPaths) {
            final ReductionStrategy strategy = resolveReductionStrategy();
            final PartitionSettings<T> settings = new PartitionSettings<>(converter, storage, properties);
            final List<CompletableFuture<SearchPartition<T>>> futures = new ArrayList<>(indexPaths.size());
            for (int i = 0; i < indexPaths.size(); i++) {
                final int partitionId = i;
                final String indexPath = indexPaths.get(i);
                futures.add(CompletableFuture.supplyAsync(
                        () -> LucenePartition.create(partitionId, ImmutableList.<T>of(), settings, indexPath, IndexStatus.EXISTS), executor));
            }
            return complete(futures, IndexStatus.EXISTS, strategy);
        }

        @Nonnull
        private ReductionStrategy resolveReductionStrategy() {
            if (reductionStrategy != null) {
                return reductionStrategy;
            }
            final String name = properties.getPropertyValue(LuceneSearchProperties.REDUCTION_STRATEGY);
            try {
                return ReductionStrategy.fromName(name);
            } catch (IllegalArgumentException ex) {
                throw new SearchCoreArgumentException("unknown reduction strategy", ex)
                        .addLogInfo(LogMessageKeys.REDUCTION_STRATEGY.toString(), name);
            }
        }

        @Nonnull
        private PartitionedIndex<T> complete(@Nonnull List<CompletableFuture<SearchPartition<T>>> futures,
                                             @Nonnull IndexStatus status, @Nonnull ReductionStrategy strategy) {
            final long startTime = System.nanoTime();
            ScatterGather.awaitSettled(futures);
            final List<SearchPartition<T>> built = new ArrayList<>(futures.size());
            RuntimeException failure = null;
            for (CompletableFuture<SearchPartition<T>> future : futures) {
                if (future.isCompletedExceptionally()) {
                    if (failure == null) {
                        failure = future.handle((ignore, err) -> ScatterGather.unwrap(err)).join();
                    }
                } else {
                    built.add(future.join());
                }
            }
            if (failure != null) {
                try {
                    CloseableUtils.closeAll(built);
                } catch (CloseException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
                throw failure;
            }
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("partitioned index ready",
                        LogMessageKeys.PARTITION_COUNT, built.size(),
                        LogMessageKeys.BUILD_STATUS, status,
                        LogMessageKeys.REDUCTION_STRATEGY, strategy,
                        LogMessageKeys.TIME_MILLIS, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime)));
            }
            return new PartitionedIndex<>(built, properties, strategy, executor);
        }
    }
}
