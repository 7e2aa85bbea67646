/*
 * TopKMerge.java
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
import io.partsearch.reduce.Monoid;

import javax.annotation.Nonnull;

/**
 * Merges partition responses into the best {@code K} hits. Combining keeps the best {@code K} hits of both sides and
 * adds the matched counts. Because {@link SearchHit#RANK_ORDER} is a total order, the result does not depend on how
 * the responses are grouped or ordered, as long as every input holds at most {@code K} hits.
 */
@API(API.Status.EXPERIMENTAL)
public class TopKMerge implements Monoid<SearchResponse> {
    private final int topK;

    public TopKMerge(int topK) {
        if (topK <= 0) {
            throw new SearchCoreArgumentException("topK must be positive", LogMessageKeys.TOP_K, topK);
        }
        this.topK = topK;
    }

    public int getTopK() {
        return topK;
    }

    @Nonnull
    @Override
    public SearchResponse empty() {
        return SearchResponse.empty();
    }

    @Nonnull
    @Override
    public SearchResponse combine(@Nonnull SearchResponse left, @Nonnull SearchResponse right) {
        return SearchResponse.merge(ImmutableList.of(left, right), topK);
    }
}
