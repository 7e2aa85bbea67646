/*
 * DeferredLucenePartition.java
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

import com.google.common.collect.ImmutableList;
import io.partsearch.SearchCoreException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.response.QueryOutcome;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.lucene.store.IndexLocation;
import io.partsearch.lucene.store.IndexStatus;
import org.apache.lucene.search.BooleanClause;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A partition whose index is built under its base path the first time it is needed. This is what filtering a
 * partition produces: the elements are known right away but nothing is indexed until the partition is queried.
 * Iterating the elements and filtering again do not trigger a build.
 *
 * @param <T> the type of the source elements
 */
@API(API.Status.EXPERIMENTAL)
public class DeferredLucenePartition<T> implements SearchPartition<T> {
    private final int partitionId;
    @Nonnull
    private final List<T> source;
    @Nonnull
    private final PartitionSettings<T> settings;
    @Nonnull
    private final String basePath;
    @Nullable
    private LucenePartition<T> partition;
    private boolean closed;

    public DeferredLucenePartition(int partitionId, @Nonnull List<T> source, @Nonnull PartitionSettings<T> settings,
                                   @Nonnull String basePath) {
        this.partitionId = partitionId;
        this.source = ImmutableList.copyOf(source);
        this.settings = settings;
        this.basePath = basePath;
    }

    /**
     * Whether the index has been built yet.
     * @return {@code true} once the first query has run
     */
    public synchronized boolean isBuilt() {
        return partition != null;
    }

    @Nonnull
    private synchronized LucenePartition<T> partition() {
        if (closed) {
            throw new SearchCoreException("partition is closed",
                    LogMessageKeys.PARTITION_ID, partitionId);
        }
        if (partition == null) {
            partition = LucenePartition.create(partitionId, source, settings, basePath, IndexStatus.REWRITE);
        }
        return partition;
    }

    @Override
    public int getPartitionId() {
        return partitionId;
    }

    @Nonnull
    @Override
    public IndexStatus getIndexStatus() {
        return IndexStatus.REWRITE;
    }

    /**
     * The location of the index, building it if needed.
     * @return the location
     */
    @Nonnull
    @Override
    public IndexLocation getIndexLocation() {
        return partition().getIndexLocation();
    }

    @Nonnull
    @Override
    public Iterator<T> iterator() {
        return source.iterator();
    }

    @Override
    public long size() {
        return partition().size();
    }

    @Nonnull
    @Override
    public Set<String> fields() {
        return partition().fields();
    }

    @Nonnull
    @Override
    public SearchResponse termQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return partition().termQuery(field, text, topK);
    }

    @Nonnull
    @Override
    public SearchResponse prefixQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return partition().prefixQuery(field, text, topK);
    }

    @Nonnull
    @Override
    public SearchResponse fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits, int topK) {
        return partition().fuzzyQuery(field, text, maxEdits, topK);
    }

    @Nonnull
    @Override
    public SearchResponse phraseQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return partition().phraseQuery(field, text, topK);
    }

    @Nonnull
    @Override
    public SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK, @Nonnull BooleanClause.Occur occur) {
        return partition().multiTermQuery(fieldsToTerms, topK, occur);
    }

    @Nonnull
    @Override
    public SearchResponse query(@Nonnull String defaultField, @Nonnull String searchString, int topK) {
        return partition().query(defaultField, searchString, topK);
    }

    @Nonnull
    @Override
    public Map<String, QueryOutcome<SearchResponse>> queries(@Nonnull String defaultField, @Nonnull List<String> searchStrings, int topK) {
        return partition().queries(defaultField, searchStrings, topK);
    }

    @Nonnull
    @Override
    public FacetResult facetQuery(@Nonnull String defaultField, @Nonnull String searchString, @Nonnull String facetField, int topK) {
        return partition().facetQuery(defaultField, searchString, facetField, topK);
    }

    @Nonnull
    @Override
    public SearchPartition<T> filter(@Nonnull Predicate<? super T> predicate) {
        return new DeferredLucenePartition<>(partitionId,
                source.stream().filter(predicate).collect(Collectors.toList()), settings, basePath);
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (partition != null) {
            partition.close();
        }
    }

    @Override
    public String toString() {
        return "DeferredLucenePartition{" + partitionId + ", built=" + isBuilt() + "}";
    }
}
