/*
 * FacetResultMonoid.java
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

import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.reduce.Monoid;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;

/**
 * Combines facet results of the same field by adding counts label by label. A label missing on one side counts
 * as zero, and the totals add up. The {@linkplain FacetResult#empty() empty} result is neutral.
 * The operation is associative and commutative, so partition results may be combined in any grouping and order.
 */
@API(API.Status.EXPERIMENTAL)
public final class FacetResultMonoid implements Monoid<FacetResult> {
    public static final FacetResultMonoid INSTANCE = new FacetResultMonoid();

    private FacetResultMonoid() {
    }

    @Nonnull
    @Override
    public FacetResult empty() {
        return FacetResult.empty();
    }

    @Nonnull
    @Override
    public FacetResult combine(@Nonnull FacetResult left, @Nonnull FacetResult right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        if (!left.getFacetName().equals(right.getFacetName())) {
            throw new SearchCoreArgumentException("cannot combine results of different facet fields",
                    LogMessageKeys.FACET_FIELD, left.getFacetName(),
                    "other_facet_field", right.getFacetName());
        }
        final Map<String, Long> counts = new HashMap<>(left.getCounts());
        right.getCounts().forEach((label, count) -> counts.merge(label, count, Long::sum));
        return FacetResult.of(left.getFacetName(), counts, left.getTotalCount() + right.getTotalCount());
    }
}
