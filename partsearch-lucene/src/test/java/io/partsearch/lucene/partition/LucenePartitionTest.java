/*
 * LucenePartitionTest.java
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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.partsearch.IndexStorageException;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.SearchCoreException;
import io.partsearch.lucene.LuceneQueryParseException;
import io.partsearch.lucene.SearchTestData;
import io.partsearch.lucene.TrackingIndexStorage;
import io.partsearch.lucene.document.TableRow;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.response.QueryOutcome;
import io.partsearch.lucene.response.SearchHit;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.lucene.store.IndexLocation;
import io.partsearch.lucene.store.IndexStatus;
import io.partsearch.lucene.store.InMemoryIndexStorage;
import io.partsearch.lucene.store.LocalFileSystemIndexStorage;
import io.partsearch.properties.SearchPropertyStorage;
import org.apache.lucene.search.BooleanClause;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static io.partsearch.lucene.SearchTestData.FRUITS;
import static io.partsearch.lucene.SearchTestData.TEXT_FIELD;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LucenePartition} and {@link DeferredLucenePartition}.
 */
class LucenePartitionTest {
    private InMemoryIndexStorage storage;
    private LucenePartition<String> partition;

    @BeforeEach
    void setUp() {
        storage = new InMemoryIndexStorage();
        partition = LucenePartition.create(0, FRUITS, SearchTestData.textSettings(storage), "fruits", IndexStatus.REWRITE);
    }

    @AfterEach
    void tearDown() {
        partition.close();
    }

    private static List<Object> texts(SearchResponse response) {
        return response.getHits().stream().map(hit -> hit.getField(TEXT_FIELD)).collect(Collectors.toList());
    }

    @Test
    void sizeAndFields() {
        assertEquals(3L, partition.size());
        assertEquals(ImmutableSet.of(TEXT_FIELD), partition.fields());
        assertEquals(IndexStatus.REWRITE, partition.getIndexStatus());
        assertThat(ImmutableList.copyOf(partition), contains("apple pie", "banana bread", "apple tart"));
    }

    @Test
    void termQuery() {
        SearchResponse response = partition.termQuery(TEXT_FIELD, "apple", 10);
        assertThat(texts(response), containsInAnyOrder("apple pie", "apple tart"));
        assertEquals(2L, response.getTotalHits());
        for (SearchHit hit : response) {
            assertEquals(0, hit.getPartitionId());
        }

        SearchResponse limited = partition.termQuery(TEXT_FIELD, "apple", 1);
        assertEquals(1, limited.size());
        assertEquals(2L, limited.getTotalHits());

        assertTrue(partition.termQuery(TEXT_FIELD, "cherry", 10).isEmpty());
    }

    @Test
    void prefixFuzzyAndPhrase() {
        assertThat(texts(partition.prefixQuery(TEXT_FIELD, "ban", 10)), contains("banana bread"));
        assertThat(texts(partition.fuzzyQuery(TEXT_FIELD, "appel", 2, 10)), containsInAnyOrder("apple pie", "apple tart"));
        assertTrue(partition.fuzzyQuery(TEXT_FIELD, "appel", 0, 10).isEmpty());
        assertThat(texts(partition.phraseQuery(TEXT_FIELD, "Apple Tart", 10)), contains("apple tart"));
        assertTrue(partition.phraseQuery(TEXT_FIELD, "tart apple", 10).isEmpty());
    }

    @Test
    void multiTermQuery() {
        assertThat(texts(partition.multiTermQuery(ImmutableMap.of(TEXT_FIELD, "apple"), 10)),
                containsInAnyOrder("apple pie", "apple tart"));
        assertEquals(0, partition.multiTermQuery(ImmutableMap.of(TEXT_FIELD, "apple", "title", "apple"), 10).size());
        assertEquals(2, partition.multiTermQuery(ImmutableMap.of(TEXT_FIELD, "apple", "title", "apple"), 10,
                BooleanClause.Occur.SHOULD).size());
    }

    @Test
    void queryStrings() {
        assertThat(texts(partition.query(TEXT_FIELD, "apple AND tart", 10)), contains("apple tart"));
        assertThat(texts(partition.query(TEXT_FIELD, "bread OR pie", 10)), containsInAnyOrder("apple pie", "banana bread"));
        assertThrows(LuceneQueryParseException.class, () -> partition.query(TEXT_FIELD, "apple AND (", 10));
    }

    @Test
    void queriesIsolateParseFailures() {
        Map<String, QueryOutcome<SearchResponse>> outcomes =
                partition.queries(TEXT_FIELD, ImmutableList.of("tart", "apple AND (", "ban*"), 10);
        assertThat(outcomes.keySet(), contains("tart", "apple AND (", "ban*"));
        assertEquals(1, outcomes.get("tart").get().size());
        assertFalse(outcomes.get("apple AND (").isSuccess());
        assertThat(outcomes.get("apple AND (").getFailure().get(), instanceOf(LuceneQueryParseException.class));
        assertThat(texts(outcomes.get("ban*").get()), contains("banana bread"));
    }

    @Test
    void invalidArguments() {
        assertThrows(SearchCoreArgumentException.class, () -> partition.termQuery(TEXT_FIELD, "apple", 0));
        assertThrows(SearchCoreArgumentException.class, () -> partition.fuzzyQuery(TEXT_FIELD, "apple", 3, 10));
    }

    @Test
    void textFacets() {
        FacetResult result = partition.facetQuery("apple", TEXT_FIELD, 10);
        assertEquals(TEXT_FIELD, result.getFacetName());
        assertEquals(ImmutableMap.of("apple pie", 1L, "apple tart", 1L), result.getCounts());
        assertEquals(2L, result.getTotalCount());

        assertEquals(1, partition.facetQuery("apple", TEXT_FIELD, 1).getCounts().size());
        assertSame(FacetResult.empty(), partition.facetQuery("apple", "color", 10));
        assertThat(partition.facetQueries("*:*", ImmutableList.of(TEXT_FIELD, "color"), 10).keySet(), contains(TEXT_FIELD, "color"));
    }

    @Test
    void rowFacets() {
        PartitionSettings<TableRow> settings = new PartitionSettings<>(SearchTestData.dessertConverter(), storage,
                SearchPropertyStorage.getEmptyInstance());
        try (LucenePartition<TableRow> desserts = LucenePartition.create(1, SearchTestData.DESSERTS, settings, "desserts", IndexStatus.REWRITE)) {
            assertEquals(ImmutableSet.of("title", "category", "year", "price"), desserts.fields());

            FacetResult categories = desserts.facetQuery("*:*", "category", 10);
            assertEquals(ImmutableMap.of("baked", 3L, "frozen", 2L), categories.getCounts());

            FacetResult years = desserts.facetQuery("title:banana", "year", 10);
            assertEquals(ImmutableMap.of("2020", 2L), years.getCounts());
            assertEquals(years, desserts.facetQuery("title", "banana", "year", 10));
            assertTrue(desserts.facetQuery("banana", "year", 10).isEmpty());
            assertEquals(years, desserts.facetQueries("title", "banana", ImmutableList.of("year"), 10).get("year"));

            SearchResponse frozenBanana = desserts.multiTermQuery(ImmutableMap.of("title", "banana", "category", "frozen"), 10);
            assertEquals(1, frozenBanana.size());
            SearchHit hit = frozenBanana.getHits().get(0);
            assertEquals("Banana split", hit.getField("title"));
            assertEquals(2020, hit.getField("year"));
            assertEquals(5.0, hit.getField("price"));
            assertEquals(1, hit.getPartitionId());

            // stored only columns come back with hits but cannot be searched
            assertTrue(desserts.termQuery("price", "5.0", 10).isEmpty());
        }
    }

    @Test
    void existsReopensWithoutIndexing() {
        IndexLocation location = partition.getIndexLocation();
        SearchResponse expected = partition.termQuery(TEXT_FIELD, "apple", 10);
        int directories = storage.size();

        try (LucenePartition<String> reopened = LucenePartition.create(0, ImmutableList.of(), SearchTestData.textSettings(storage),
                location.getIndexPath(), IndexStatus.EXISTS)) {
            assertEquals(IndexStatus.EXISTS, reopened.getIndexStatus());
            assertEquals(location, reopened.getIndexLocation());
            assertEquals(3L, reopened.size());
            assertEquals(expected, reopened.termQuery(TEXT_FIELD, "apple", 10));
            assertEquals(directories, storage.size());
        }
    }

    @Test
    void existsOnFileSystem(@TempDir Path tempDir) {
        PartitionSettings<String> settings = new PartitionSettings<>(SearchTestData.textSettings(storage).getConverter(),
                new LocalFileSystemIndexStorage(), SearchPropertyStorage.getEmptyInstance());
        String indexPath;
        SearchResponse expected;
        try (LucenePartition<String> built = LucenePartition.create(0, FRUITS, settings, tempDir.toString(), IndexStatus.REWRITE)) {
            indexPath = built.getIndexLocation().getIndexPath();
            expected = built.prefixQuery(TEXT_FIELD, "ban", 10);
        }
        try (LucenePartition<String> reopened = LucenePartition.create(0, ImmutableList.of(), settings, indexPath, IndexStatus.EXISTS)) {
            assertEquals(expected, reopened.prefixQuery(TEXT_FIELD, "ban", 10));
            assertEquals(tempDir.toAbsolutePath().normalize().toString(), reopened.getBasePath());
        }
        try (LucenePartition<String> reopened = LucenePartition.create(0, ImmutableList.of(), settings, indexPath + "/", IndexStatus.EXISTS)) {
            assertEquals(expected, reopened.prefixQuery(TEXT_FIELD, "ban", 10));
            assertEquals(tempDir.toAbsolutePath().normalize().toString(), reopened.getBasePath());
        }
    }

    @Test
    void existsRequiresBuiltIndex() {
        assertThrows(IndexStorageException.class, () -> LucenePartition.create(0, ImmutableList.of(),
                SearchTestData.textSettings(storage), "nowhere/indexDirectory.1.w", IndexStatus.EXISTS));
        assertThrows(SearchCoreArgumentException.class, () -> LucenePartition.create(0, ImmutableList.of(),
                SearchTestData.textSettings(storage), "nowhere/something", IndexStatus.EXISTS));
    }

    @Test
    void sameBasePathGetsDistinctLocations() {
        try (LucenePartition<String> other = LucenePartition.create(0, FRUITS, SearchTestData.textSettings(storage), "fruits", IndexStatus.REWRITE)) {
            assertThat(other.getIndexLocation(), not(equalTo(partition.getIndexLocation())));
            assertEquals(partition.termQuery(TEXT_FIELD, "apple", 10).getTotalHits(), other.termQuery(TEXT_FIELD, "apple", 10).getTotalHits());
        }
    }

    @Test
    void emptySource() {
        try (LucenePartition<String> empty = LucenePartition.create(0, ImmutableList.of(), SearchTestData.textSettings(storage), "empty", IndexStatus.REWRITE)) {
            assertEquals(0L, empty.size());
            assertTrue(empty.termQuery(TEXT_FIELD, "apple", 10).isEmpty());
            assertSame(FacetResult.empty(), empty.facetQuery("apple", TEXT_FIELD, 10));
        }
    }

    @Test
    void filterLeavesOriginalUntouched() {
        SearchResponse before = partition.termQuery(TEXT_FIELD, "apple", 10);
        SearchPartition<String> filtered = partition.filter(text -> text.startsWith("apple"));
        try {
            assertThat(filtered, instanceOf(DeferredLucenePartition.class));
            assertFalse(((DeferredLucenePartition<String>) filtered).isBuilt());
            assertThat(ImmutableList.copyOf(filtered), contains("apple pie", "apple tart"));

            assertEquals(2L, filtered.size());
            assertTrue(((DeferredLucenePartition<String>) filtered).isBuilt());
            assertTrue(filtered.prefixQuery(TEXT_FIELD, "ban", 10).isEmpty());
            assertThat(filtered.getIndexLocation(), not(equalTo(partition.getIndexLocation())));
            assertThat(filtered.getIndexLocation().getIndexPath(), startsWith("memory:fruits/"));

            SearchPartition<String> twice = filtered.filter(text -> text.endsWith("tart"));
            try {
                assertEquals(1L, twice.size());
            } finally {
                twice.close();
            }

            assertEquals(3L, partition.size());
            assertEquals(ImmutableSet.of(TEXT_FIELD), partition.fields());
            assertEquals(before, partition.termQuery(TEXT_FIELD, "apple", 10));
        } finally {
            filtered.close();
        }
        assertThrows(SearchCoreException.class, filtered::size);
    }

    @Test
    void closedPartitionRejectsQueries() {
        partition.close();
        assertTrue(partition.isClosed());
        assertThrows(SearchCoreException.class, () -> partition.termQuery(TEXT_FIELD, "apple", 10));
        assertThrows(SearchCoreException.class, partition::size);
        partition.close();
        assertThat(ImmutableList.copyOf(partition), contains("apple pie", "banana bread", "apple tart"));
    }

    @Test
    void concurrentQueriesShareReader() throws Exception {
        SearchResponse expected = partition.termQuery(TEXT_FIELD, "apple", 10);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<SearchResponse>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> partition.termQuery(TEXT_FIELD, "apple", 10)));
            }
            for (Future<SearchResponse> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void failedBuildReleasesDirectories() {
        TrackingIndexStorage tracking = new TrackingIndexStorage();
        PartitionSettings<String> settings = new PartitionSettings<String>(text -> {
            if (text.contains("banana")) {
                throw new IllegalStateException("cannot convert " + text);
            }
            return SearchTestData.textSettings(tracking).getConverter().convert(text);
        }, tracking, SearchPropertyStorage.getEmptyInstance());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> LucenePartition.create(0, FRUITS, settings, "broken", IndexStatus.REWRITE));
        assertEquals("cannot convert banana bread", ex.getMessage());
        assertEquals(0, tracking.getOpenDirectories());

        try (LucenePartition<String> built = LucenePartition.create(0, FRUITS, SearchTestData.textSettings(tracking), "fine", IndexStatus.REWRITE)) {
            assertEquals(2, tracking.getOpenDirectories());
            assertEquals(3L, built.size());
        }
        assertEquals(0, tracking.getOpenDirectories());
    }
}
