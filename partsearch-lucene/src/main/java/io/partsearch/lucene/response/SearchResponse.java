/*
 * SearchResponse.java
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

package io.partsearch.lucene.response;

import com.google.common.collect.ImmutableList;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * A ranked list of hits plus the number of documents that matched.
 *
 * <p>
 * A partition answers a query with a response of at most {@code K} hits. Responses from many partitions are merged
 * with {@link #merge(List, int)} or the {@link TopKMerge} monoid; the merged response has the best {@code K} hits
 * overall, in {@link SearchHit#RANK_ORDER}, and the sum of the matched counts.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class SearchResponse implements Iterable<SearchHit> {
    private static final SearchResponse EMPTY = new SearchResponse(ImmutableList.of(), 0L);

    @Nonnull
    private final List<SearchHit> hits;
    private final long totalHits;

    private SearchResponse(@Nonnull List<SearchHit> hits, long totalHits) {
        this.hits = hits;
        this.totalHits = totalHits;
    }

    @Nonnull
    public static SearchResponse empty() {
        return EMPTY;
    }

    /**
     * Create a response from hits already sorted in {@link SearchHit#RANK_ORDER}.
     *
     * @param hits the hits
     * @param totalHits the number of documents that matched, at least the number of hits
     * @return the response
     */
    @Nonnull
    public static SearchResponse of(@Nonnull List<SearchHit> hits, long totalHits) {
        if (totalHits < hits.size()) {
            throw new SearchCoreArgumentException("total hits less than returned hits",
                    LogMessageKeys.TOTAL_HITS, totalHits,
                    LogMessageKeys.HIT_COUNT, hits.size());
        }
        for (int i = 1; i < hits.size(); i++) {
            if (SearchHit.RANK_ORDER.compare(hits.get(i - 1), hits.get(i)) > 0) {
                throw new SearchCoreArgumentException("hits are not in rank order",
                        LogMessageKeys.HIT_COUNT, hits.size());
            }
        }
        return new SearchResponse(ImmutableList.copyOf(hits), totalHits);
    }

    /**
     * K-way merge of responses into the best {@code topK} hits.
     *
     * @param responses the responses, each in rank order
     * @param topK the number of hits to keep
     * @return the merged response
     */
    @Nonnull
    public static SearchResponse merge(@Nonnull List<SearchResponse> responses, int topK) {
        if (topK <= 0) {
            throw new SearchCoreArgumentException("topK must be positive", LogMessageKeys.TOP_K, topK);
        }
        final PriorityQueue<Cursor> queue = new PriorityQueue<>(Math.max(1, responses.size()),
                (left, right) -> SearchHit.RANK_ORDER.compare(left.current, right.current));
        long totalHits = 0L;
        for (SearchResponse response : responses) {
            totalHits += response.totalHits;
            final Iterator<SearchHit> iterator = response.hits.iterator();
            if (iterator.hasNext()) {
                queue.add(new Cursor(iterator));
            }
        }
        final List<SearchHit> merged = new ArrayList<>(Math.min(topK, 64));
        while (merged.size() < topK && !queue.isEmpty()) {
            final Cursor cursor = queue.poll();
            merged.add(cursor.current);
            if (cursor.advance()) {
                queue.add(cursor);
            }
        }
        return new SearchResponse(ImmutableList.copyOf(merged), totalHits);
    }

    @Nonnull
    public List<SearchHit> getHits() {
        return hits;
    }

    /**
     * Number of documents that matched the query, which may exceed the number of hits returned.
     * @return the matched document count
     */
    public long getTotalHits() {
        return totalHits;
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    /**
     * The first {@code n} hits.
     * @param n the number of hits wanted
     * @return up to {@code n} hits
     */
    @Nonnull
    public List<SearchHit> take(int n) {
        if (n < 0) {
            throw new SearchCoreArgumentException("cannot take a negative number of hits", LogMessageKeys.HIT_COUNT, n);
        }
        return hits.subList(0, Math.min(n, hits.size()));
    }

    @Nonnull
    @Override
    public Iterator<SearchHit> iterator() {
        return hits.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchResponse that = (SearchResponse) o;
        return totalHits == that.totalHits && hits.equals(that.hits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hits, totalHits);
    }

    @Override
    public String toString() {
        return "SearchResponse{totalHits=" + totalHits + ", hits=" + hits + "}";
    }

    private static final class Cursor {
        private final Iterator<SearchHit> iterator;
        private SearchHit current;

        Cursor(@Nonnull Iterator<SearchHit> iterator) {
            this.iterator = iterator;
            this.current = iterator.next();
        }

        boolean advance() {
            if (iterator.hasNext()) {
                current = iterator.next();
                return true;
            }
            return false;
        }
    }
}
