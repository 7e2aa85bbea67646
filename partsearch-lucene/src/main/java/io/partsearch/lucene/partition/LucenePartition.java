/*
 * LucenePartition.java
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
import io.partsearch.IndexStorageException;
import io.partsearch.SearchCoreException;
import io.partsearch.annotation.API;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.lucene.LuceneExceptions;
import io.partsearch.lucene.LuceneLogMessageKeys;
import io.partsearch.lucene.LuceneLoggerInfoStream;
import io.partsearch.lucene.LuceneQueryParseException;
import io.partsearch.lucene.LuceneSearchProperties;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.query.LuceneQueryHelpers;
import io.partsearch.lucene.response.QueryOutcome;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.lucene.store.IndexAndTaxonomyWriter;
import io.partsearch.lucene.store.IndexLocation;
import io.partsearch.lucene.store.IndexStatus;
import io.partsearch.lucene.store.IndexStorage;
import io.partsearch.properties.SearchPropertyStorage;
import io.partsearch.util.CloseException;
import io.partsearch.util.CloseableUtils;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.facet.FacetsConfig;
import org.apache.lucene.facet.taxonomy.directory.DirectoryTaxonomyReader;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A partition backed by a Lucene index and taxonomy.
 *
 * <p>
 * Construction leaves the partition ready to query. With {@link IndexStatus#REWRITE} the source elements are
 * converted and indexed, in order, into a fresh location under the base path; with {@link IndexStatus#EXISTS} the
 * committed index at the given path is opened as is. After that the index is never written again, and the open
 * reader is shared by all queries until {@link #close()}.
 * </p>
 *
 * @param <T> the type of the source elements
 */
@API(API.Status.EXPERIMENTAL)
public class LucenePartition<T> implements SearchPartition<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(LucenePartition.class);

    private final int partitionId;
    @Nonnull
    private final List<T> source;
    @Nonnull
    private final PartitionSettings<T> settings;
    @Nonnull
    private final String basePath;
    @Nonnull
    private final IndexStatus status;
    @Nonnull
    private final IndexLocation location;
    @Nonnull
    private final Analyzer analyzer;
    @Nonnull
    private final FacetsConfig facetsConfig;
    @Nonnull
    private final Directory indexDirectory;
    @Nonnull
    private final Directory taxonomyDirectory;
    @Nonnull
    private final DirectoryReader indexReader;
    @Nonnull
    private final DirectoryTaxonomyReader taxonomyReader;
    @Nonnull
    private final IndexSearcher searcher;
    private volatile boolean closed;

    private LucenePartition(int partitionId, @Nonnull List<T> source, @Nonnull PartitionSettings<T> settings,
                            @Nonnull String basePath, @Nonnull IndexStatus status, @Nonnull IndexLocation location,
                            @Nonnull Analyzer analyzer, @Nonnull FacetsConfig facetsConfig,
                            @Nonnull Directory indexDirectory, @Nonnull Directory taxonomyDirectory,
                            @Nonnull DirectoryReader indexReader, @Nonnull DirectoryTaxonomyReader taxonomyReader) {
        this.partitionId = partitionId;
        this.source = source;
        this.settings = settings;
        this.basePath = basePath;
        this.status = status;
        this.location = location;
        this.analyzer = analyzer;
        this.facetsConfig = facetsConfig;
        this.indexDirectory = indexDirectory;
        this.taxonomyDirectory = taxonomyDirectory;
        this.indexReader = indexReader;
        this.taxonomyReader = taxonomyReader;
        this.searcher = new IndexSearcher(indexReader);
    }

    /**
     * Create a partition that is ready to query.
     *
     * @param partitionId the partition's id among its siblings
     * @param source the partition's elements; copied, so later changes to the iterable are not seen
     * @param settings the collection's shared settings
     * @param path the base path for {@link IndexStatus#REWRITE}, the primary index path for {@link IndexStatus#EXISTS}
     * @param status whether to build or open the index
     * @param <T> the type of the source elements
     * @return the partition
     * @throws IndexStorageException if the index cannot be built or opened
     */
    @Nonnull
    public static <T> LucenePartition<T> create(int partitionId, @Nonnull Iterable<? extends T> source,
                                                @Nonnull PartitionSettings<T> settings, @Nonnull String path,
                                                @Nonnull IndexStatus status) {
        final List<T> elements = ImmutableList.copyOf(source);
        final IndexStorage storage = settings.getStorage();
        final IndexLocation location = IndexLocation.resolve(status, path).qualify(storage);
        final String basePath = basePath(status, path);
        final Analyzer analyzer = settings.getAnalyzerType().newAnalyzer();
        final FacetsConfig facetsConfig = new FacetsConfig();
        Directory indexDirectory = null;
        Directory taxonomyDirectory = null;
        DirectoryReader indexReader = null;
        DirectoryTaxonomyReader taxonomyReader = null;
        try {
            switch (status) {
                case REWRITE:
                    storage.delete(location.getIndexPath(), true);
                    storage.delete(location.getTaxonomyPath(), true);
                    indexDirectory = storage.openDirectory(location.getIndexPath());
                    taxonomyDirectory = storage.openDirectory(location.getTaxonomyPath());
                    buildIndex(partitionId, elements, settings, location, analyzer, facetsConfig, indexDirectory, taxonomyDirectory);
                    break;
                case EXISTS:
                    checkExists(partitionId, storage, location);
                    indexDirectory = storage.openDirectory(location.getIndexPath());
                    taxonomyDirectory = storage.openDirectory(location.getTaxonomyPath());
                    break;
                default:
                    throw new SearchCoreException("unknown index status", LogMessageKeys.BUILD_STATUS, status);
            }
            indexReader = DirectoryReader.open(indexDirectory);
            taxonomyReader = new DirectoryTaxonomyReader(taxonomyDirectory);
            final LucenePartition<T> partition = new LucenePartition<>(partitionId, elements, settings, basePath, status,
                    location, analyzer, facetsConfig, indexDirectory, taxonomyDirectory, indexReader, taxonomyReader);
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("opened partition index",
                        LogMessageKeys.PARTITION_ID, partitionId,
                        LogMessageKeys.BUILD_STATUS, status,
                        LogMessageKeys.INDEX_PATH, location.getIndexPath(),
                        LogMessageKeys.DOCUMENT_COUNT, indexReader.numDocs(),
                        LuceneLogMessageKeys.SEGMENT_COUNT, indexReader.leaves().size()));
            }
            return partition;
        } catch (IOException ex) {
            final SearchCoreException failure = LuceneExceptions.toSearchCoreException("failed to open partition index", ex,
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.INDEX_PATH, location.getIndexPath());
            closeAfterFailure(failure, taxonomyReader, indexReader, taxonomyDirectory, indexDirectory, analyzer);
            throw failure;
        } catch (RuntimeException ex) {
            closeAfterFailure(ex, taxonomyReader, indexReader, taxonomyDirectory, indexDirectory, analyzer);
            throw ex;
        }
    }

    private static <T> void buildIndex(int partitionId, @Nonnull List<T> elements, @Nonnull PartitionSettings<T> settings,
                                   @Nonnull IndexLocation location, @Nonnull Analyzer analyzer,
                                   @Nonnull FacetsConfig facetsConfig,
                                   @Nonnull Directory indexDirectory, @Nonnull Directory taxonomyDirectory) throws IOException {
        final SearchPropertyStorage properties = settings.getProperties();
        final long startTime = System.nanoTime();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("building partition index",
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.INDEX_PATH, location.getIndexPath(),
                    LogMessageKeys.TAXONOMY_PATH, location.getTaxonomyPath(),
                    LogMessageKeys.ELEMENT_COUNT, elements.size()));
        }
        final LuceneLoggerInfoStream infoStream = properties.getPropertyValue(LuceneSearchProperties.WRITER_INFO_STREAM_ENABLED)
                ? LuceneLoggerInfoStream.forPartition(partitionId, location.getIndexPath())
                : null;
        try (IndexAndTaxonomyWriter writer = new IndexAndTaxonomyWriter(indexDirectory, taxonomyDirectory, analyzer, facetsConfig,
                properties.getPropertyValue(LuceneSearchProperties.WRITER_RAM_BUFFER_MB), infoStream)) {
            for (T element : elements) {
                writer.addDocument(settings.getConverter().convert(element));
            }
            writer.commit();
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("built partition index",
                        LogMessageKeys.PARTITION_ID, partitionId,
                        LogMessageKeys.DOCUMENT_COUNT, writer.getDocumentCount(),
                        LogMessageKeys.TIME_MILLIS, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime)));
            }
        }
    }

    private static void checkExists(int partitionId, @Nonnull IndexStorage storage, @Nonnull IndexLocation location) {
        for (String path : new String[] {location.getIndexPath(), location.getTaxonomyPath()}) {
            if (!storage.exists(path)) {
                throw new IndexStorageException("existing index not found",
                        LogMessageKeys.PARTITION_ID, partitionId,
                        LogMessageKeys.INDEX_PATH, path);
            }
        }
    }

    @Nonnull
    private static String basePath(@Nonnull IndexStatus status, @Nonnull String path) {
        if (status == IndexStatus.REWRITE) {
            return path;
        }
        final String indexPath = IndexLocation.trimTrailingSeparators(path);
        final int separator = Math.max(indexPath.lastIndexOf('/'), indexPath.lastIndexOf('\\'));
        return separator < 0 ? "" : indexPath.substring(0, separator);
    }

    private static void closeAfterFailure(@Nonnull RuntimeException failure, @Nullable AutoCloseable... resources) {
        try {
            CloseableUtils.closeAll(resources);
        } catch (CloseException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    @Override
    public int getPartitionId() {
        return partitionId;
    }

    @Nonnull
    @Override
    public IndexStatus getIndexStatus() {
        return status;
    }

    @Nonnull
    @Override
    public IndexLocation getIndexLocation() {
        return location;
    }

    /**
     * The base path that partitions filtered from this one are built under.
     * @return the base path
     */
    @Nonnull
    public String getBasePath() {
        return basePath;
    }

    @Nonnull
    @Override
    public Iterator<T> iterator() {
        return source.iterator();
    }

    @Override
    public long size() {
        ensureOpen();
        return indexReader.numDocs();
    }

    @Nonnull
    @Override
    public Set<String> fields() {
        ensureOpen();
        return LuceneQueryHelpers.fields(indexReader);
    }

    @Nonnull
    @Override
    public SearchResponse termQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return search(LuceneQueryHelpers.termQuery(field, text), topK);
    }

    @Nonnull
    @Override
    public SearchResponse prefixQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return search(LuceneQueryHelpers.prefixQuery(field, text), topK);
    }

    @Nonnull
    @Override
    public SearchResponse fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits, int topK) {
        return search(LuceneQueryHelpers.fuzzyQuery(field, text, maxEdits), topK);
    }

    @Nonnull
    @Override
    public SearchResponse phraseQuery(@Nonnull String field, @Nonnull String text, int topK) {
        return search(LuceneQueryHelpers.phraseQuery(analyzer, field, text), topK);
    }

    @Nonnull
    @Override
    public SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK, @Nonnull BooleanClause.Occur occur) {
        return search(LuceneQueryHelpers.multiTermQuery(fieldsToTerms, occur), topK);
    }

    @Nonnull
    @Override
    public SearchResponse query(@Nonnull String defaultField, @Nonnull String searchString, int topK) {
        return search(LuceneQueryHelpers.parse(analyzer, defaultField, searchString), topK);
    }

    @Nonnull
    @Override
    public Map<String, QueryOutcome<SearchResponse>> queries(@Nonnull String defaultField, @Nonnull List<String> searchStrings, int topK) {
        final Map<String, QueryOutcome<SearchResponse>> outcomes = new LinkedHashMap<>();
        for (String searchString : searchStrings) {
            try {
                outcomes.put(searchString, QueryOutcome.success(query(defaultField, searchString, topK)));
            } catch (LuceneQueryParseException ex) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("query string failed to parse",
                            LogMessageKeys.PARTITION_ID, partitionId,
                            LogMessageKeys.QUERY, searchString,
                            LogMessageKeys.MESSAGE, ex.getMessage()));
                }
                outcomes.put(searchString, QueryOutcome.failure(ex));
            }
        }
        return outcomes;
    }

    @Nonnull
    @Override
    public FacetResult facetQuery(@Nonnull String defaultField, @Nonnull String searchString, @Nonnull String facetField, int topK) {
        final int effectiveTopK = LuceneQueryHelpers.effectiveTopK(topK, settings.getProperties());
        final Query query = LuceneQueryHelpers.parse(analyzer, defaultField, searchString);
        ensureOpen();
        return LuceneQueryHelpers.facetSearch(searcher, taxonomyReader, facetsConfig, query, facetField, effectiveTopK);
    }

    @Nonnull
    @Override
    public SearchPartition<T> filter(@Nonnull Predicate<? super T> predicate) {
        final List<T> filtered = source.stream().filter(predicate).collect(Collectors.toList());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("filtered partition source",
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.ELEMENT_COUNT, source.size(),
                    LogMessageKeys.DOCUMENT_COUNT, filtered.size()));
        }
        return new DeferredLucenePartition<>(partitionId, filtered, settings, basePath);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        CloseableUtils.closeAll(taxonomyReader, indexReader, taxonomyDirectory, indexDirectory, analyzer);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("closed partition",
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.INDEX_PATH, location.getIndexPath()));
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Nonnull
    private SearchResponse search(@Nonnull Query query, int topK) {
        final int effectiveTopK = LuceneQueryHelpers.effectiveTopK(topK, settings.getProperties());
        ensureOpen();
        final long startTime = System.nanoTime();
        final SearchResponse response = LuceneQueryHelpers.search(searcher, query, effectiveTopK, partitionId);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("searched partition",
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.QUERY, query,
                    LogMessageKeys.TOP_K, effectiveTopK,
                    LogMessageKeys.HIT_COUNT, response.size(),
                    LogMessageKeys.TOTAL_HITS, response.getTotalHits(),
                    LogMessageKeys.TIME_NANOS, System.nanoTime() - startTime));
        }
        return response;
    }

    private void ensureOpen() {
        if (closed) {
            throw new SearchCoreException("partition is closed",
                    LogMessageKeys.PARTITION_ID, partitionId);
        }
    }

    @Override
    public String toString() {
        return "LucenePartition{" + partitionId + ", " + status + ", " + location.getIndexPath() + "}";
    }
}
