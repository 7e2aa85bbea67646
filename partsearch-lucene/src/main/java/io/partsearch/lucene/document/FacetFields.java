/*
 * FacetFields.java
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

package io.partsearch.lucene.document;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;

/**
 * Naming of facet fields. A facet over a text field {@code f} is indexed as {@code f_facet}; a facet over a numeric
 * field as {@code f_numFacet}. Facet queries name the plain field and the suffix is resolved from the index.
 */
@API(API.Status.EXPERIMENTAL)
public final class FacetFields {
    public static final String TEXT_FACET_SUFFIX = "_facet";
    public static final String NUMERIC_FACET_SUFFIX = "_numFacet";

    @Nonnull
    public static String textFacet(@Nonnull String fieldName) {
        return fieldName + TEXT_FACET_SUFFIX;
    }

    @Nonnull
    public static String numericFacet(@Nonnull String fieldName) {
        return fieldName + NUMERIC_FACET_SUFFIX;
    }

    private FacetFields() {
    }
}
