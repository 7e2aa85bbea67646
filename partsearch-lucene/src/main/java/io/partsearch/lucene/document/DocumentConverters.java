/*
 * DocumentConverters.java
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
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.facet.FacetField;

import javax.annotation.Nonnull;

/**
 * Converters for elements that are a single value.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocumentConverters {

    /**
     * Index each string into one stored text field, and also as a facet label of {@code <fieldName>_facet}.
     * Empty strings get no facet label.
     *
     * @param fieldName the field the text is indexed into
     * @return the converter
     */
    @Nonnull
    public static DocumentConverter<String> text(@Nonnull String fieldName) {
        final String facetName = FacetFields.textFacet(fieldName);
        return element -> {
            final Document document = new Document();
            document.add(new TextField(fieldName, element, Field.Store.YES));
            if (!element.isEmpty()) {
                document.add(new FacetField(facetName, element));
            }
            return document;
        };
    }

    private DocumentConverters() {
    }
}
