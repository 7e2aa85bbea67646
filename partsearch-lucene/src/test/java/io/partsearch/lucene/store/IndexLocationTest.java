/*
 * IndexLocationTest.java
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

package io.partsearch.lucene.store;

import io.partsearch.SearchCoreArgumentException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link IndexLocation}.
 */
class IndexLocationTest {
    @Test
    void rewriteLocationNaming() {
        IndexLocation location = IndexLocation.forRewrite("data/base", 42L, "w1");
        assertEquals("data/base/indexDirectory.42.w1", location.getIndexPath());
        assertEquals("data/base/taxonomyDirectory.42.w1", location.getTaxonomyPath());

        assertEquals(location, IndexLocation.forRewrite("data/base/", 42L, "w1"));
        assertEquals("indexDirectory.42.w1", IndexLocation.forRewrite("", 42L, "w1").getIndexPath());
    }

    @Test
    void existingLocationDerivesTaxonomy() {
        IndexLocation location = IndexLocation.resolve(IndexStatus.EXISTS, "/tmp/x/indexDirectory.42.w1");
        assertEquals("/tmp/x/indexDirectory.42.w1", location.getIndexPath());
        assertEquals("/tmp/x/taxonomyDirectory.42.w1", location.getTaxonomyPath());
    }

    @Test
    void existingLocationRoundTripsRewrite() {
        IndexLocation built = IndexLocation.resolve(IndexStatus.REWRITE, "base");
        assertEquals(built, IndexLocation.forExisting(built.getIndexPath()));
    }

    @Test
    void existingLocationIgnoresTrailingSeparators() {
        IndexLocation expected = IndexLocation.forExisting("/tmp/x/indexDirectory.42.w1");
        assertEquals(expected, IndexLocation.forExisting("/tmp/x/indexDirectory.42.w1/"));
        assertEquals(expected, IndexLocation.forExisting("/tmp/x/indexDirectory.42.w1//"));
        assertEquals("C:\\x\\taxonomyDirectory.1.w", IndexLocation.forExisting("C:\\x\\indexDirectory.1.w\\").getTaxonomyPath());
        assertEquals("/", IndexLocation.trimTrailingSeparators("/"));
    }

    @Test
    void existingLocationMustNameIndexDirectory() {
        assertThrows(SearchCoreArgumentException.class, () -> IndexLocation.forExisting("/tmp/x/other.42"));
        // only the last path element counts
        assertThrows(SearchCoreArgumentException.class, () -> IndexLocation.forExisting("/indexDirectory/other"));
    }

    @Test
    void sameBasePathNeverCollides() {
        IndexLocation first = IndexLocation.resolve(IndexStatus.REWRITE, "base");
        IndexLocation second = IndexLocation.resolve(IndexStatus.REWRITE, "base");
        assertThat(first, not(equalTo(second)));
        assertThat(first.getIndexPath(), startsWith("base/" + IndexLocation.INDEX_DIRECTORY + "."));
    }

    @Test
    void concurrentRewritesNeverCollide() throws Exception {
        final int threads = 8;
        final int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            Set<String> paths = ConcurrentHashMap.newKeySet();
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < perThread; j++) {
                        paths.add(IndexLocation.resolve(IndexStatus.REWRITE, "shared").getIndexPath());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
            assertThat(new HashSet<>(paths), hasSize(threads * perThread));
        } finally {
            executor.shutdown();
        }
    }
}
