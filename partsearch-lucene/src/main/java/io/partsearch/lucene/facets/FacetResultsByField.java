/*
 * FacetResultsByField.java
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

import com.google.common.collect.ImmutableMap;
import io.partsearch.annotation.API;
import io.partsearch.reduce.Monoid;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines maps from facet field to {@link FacetResult}, one field at a time with {@link FacetResultMonoid}.
 * A field missing from one side is treated as the empty result.
 */
@API(API.Status.EXPERIMENTAL)
public final class FacetResultsByField implements Monoid<Map<String, FacetResult>> {
    public static final FacetResultsByField INSTANCE = new FacetResultsByField();

    private FacetResultsByField() {
    }

    @Nonnull
    @Override
    public Map<String, FacetResult> empty() {
        return ImmutableMap.of();
    }

    @Nonnull
    @Override
    public Map<String, FacetResult> combine(@Nonnull Map<String, FacetResult> left, @Nonnull Map<String, FacetResult> right) {
        final Map<String, FacetResult> combined = new LinkedHashMap<>(left);
        right.forEach((field, result) -> combined.merge(field, result, FacetResultMonoid.INSTANCE::combine));
        return ImmutableMap.copyOf(combined);
    }
}
