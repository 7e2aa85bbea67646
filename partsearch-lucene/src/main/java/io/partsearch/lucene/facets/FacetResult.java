/*
 * FacetResult.java
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

package io.partsearch.lucene.facets;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts of matching documents per label of one facet field.
 *
 * <p>
 * The {@linkplain #empty() empty} result has no facet name and no counts. It is what a partition reports for a
 * facet field it does not have, and it is the neutral element of {@link FacetResultMonoid}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class FacetResult {
    private static final FacetResult EMPTY = new FacetResult("", ImmutableSortedMap.of(), 0L);

    private static final Comparator<Map.Entry<String, Long>> TOP_ORDER =
            Comparator.comparing((Map.Entry<String, Long> entry) -> entry.getValue()).reversed()
                    .thenComparing(entry -> entry.getKey());

    @Nonnull
    private final String facetName;
    @Nonnull
    private final ImmutableSortedMap<String, Long> counts;
    private final long totalCount;

    private FacetResult(@Nonnull String facetName, @Nonnull ImmutableSortedMap<String, Long> counts, long totalCount) {
        this.facetName = facetName;
        this.counts = counts;
        this.totalCount = totalCount;
    }

    @Nonnull
    public static FacetResult empty() {
        return EMPTY;
    }

    /**
     * Create a result for a facet field.
     *
     * @param facetName the facet field, not empty
     * @param counts document count per label, none negative
     * @param totalCount number of matching documents carrying the facet, at least as large as any single count
     * @return the result
     */
    @Nonnull
    public static FacetResult of(@Nonnull String facetName, @Nonnull Map<String, Long> counts, long totalCount) {
        if (facetName.isEmpty()) {
            throw new SearchCoreArgumentException("facet name must not be empty");
        }
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() < 0) {
                throw new SearchCoreArgumentException("negative facet count",
                        LogMessageKeys.FACET_FIELD, facetName,
                        LogMessageKeys.ELEMENT_COUNT, entry.getValue());
            }
        }
        return new FacetResult(facetName, ImmutableSortedMap.copyOf(counts), totalCount);
    }

    /**
     * The facet field, or the empty string for the {@linkplain #empty() empty} result.
     * @return the facet field name
     */
    @Nonnull
    public String getFacetName() {
        return facetName;
    }

    /**
     * Document count per label, sorted by label.
     * @return the counts
     */
    @Nonnull
    public ImmutableMap<String, Long> getCounts() {
        return counts;
    }

    public long getCount(@Nonnull String label) {
        return counts.getOrDefault(label, 0L);
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return facetName.isEmpty();
    }

    /**
     * The {@code n} labels with the highest counts, ties broken by label.
     * @param n the number of labels wanted
     * @return up to {@code n} label and count pairs
     */
    @Nonnull
    public List<Map.Entry<String, Long>> top(int n) {
        if (n < 0) {
            throw new SearchCoreArgumentException("cannot take a negative number of labels", LogMessageKeys.TOP_K, n);
        }
        return counts.entrySet().stream()
                .sorted(TOP_ORDER)
                .limit(n)
                .map(entry -> Maps.immutableEntry(entry.getKey(), entry.getValue()))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FacetResult that = (FacetResult) o;
        return totalCount == that.totalCount && facetName.equals(that.facetName) && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(facetName, counts, totalCount);
    }

    @Override
    public String toString() {
        return isEmpty() ? "FacetResult{empty}" : "FacetResult{" + facetName + ", total=" + totalCount + ", " + counts + "}";
    }
}
