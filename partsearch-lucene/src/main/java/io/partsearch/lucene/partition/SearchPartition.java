/*
 * SearchPartition.java
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

import com.google.common.collect.ImmutableMap;
import io.partsearch.annotation.API;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.response.QueryOutcome;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.lucene.store.IndexLocation;
import io.partsearch.lucene.store.IndexStatus;
import org.apache.lucene.search.BooleanClause;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The operations every partition answers. All of them are read only, may be called any number of times and from
 * several threads at once, and return at most {@code topK} hits in {@link io.partsearch.lucene.response.SearchHit#RANK_ORDER}.
 * Once closed, a partition rejects every operation except {@link #close()} and {@link #iterator()}.
 *
 * @param <T> the type of the source elements
 */
@API(API.Status.EXPERIMENTAL)
public interface SearchPartition<T> extends Iterable<T>, AutoCloseable {
    int getPartitionId();

    @Nonnull
    IndexStatus getIndexStatus();

    @Nonnull
    IndexLocation getIndexLocation();

    /**
     * Number of documents in the partition's index.
     * @return the document count
     */
    long size();

    /**
     * Names of the fields present in the partition's index.
     * @return the field names
     */
    @Nonnull
    Set<String> fields();

    @Nonnull
    SearchResponse termQuery(@Nonnull String field, @Nonnull String text, int topK);

    @Nonnull
    SearchResponse prefixQuery(@Nonnull String field, @Nonnull String text, int topK);

    @Nonnull
    SearchResponse fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits, int topK);

    @Nonnull
    SearchResponse phraseQuery(@Nonnull String field, @Nonnull String text, int topK);

    /**
     * Match documents against one term per field.
     *
     * @param fieldsToTerms field to term
     * @param topK the number of hits wanted
     * @param occur how each term clause must occur
     * @return the hits
     */
    @Nonnull
    SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK, @Nonnull BooleanClause.Occur occur);

    /**
     * Match documents containing every one of the terms.
     *
     * @param fieldsToTerms field to term
     * @param topK the number of hits wanted
     * @return the hits
     */
    @Nonnull
    default SearchResponse multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, int topK) {
        return multiTermQuery(fieldsToTerms, topK, BooleanClause.Occur.MUST);
    }

    /**
     * Run a query string.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchString the query string
     * @param topK the number of hits wanted
     * @return the hits
     * @throws io.partsearch.lucene.LuceneQueryParseException if the string cannot be parsed
     */
    @Nonnull
    SearchResponse query(@Nonnull String defaultField, @Nonnull String searchString, int topK);

    /**
     * Run several query strings. A string that fails to parse fails only its own entry.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchStrings the query strings
     * @param topK the number of hits wanted per string
     * @return the outcome per string, in input order
     */
    @Nonnull
    Map<String, QueryOutcome<SearchResponse>> queries(@Nonnull String defaultField, @Nonnull List<String> searchStrings, int topK);

    /**
     * Count the labels of a facet field among the documents matching a query string.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchString the query string
     * @param facetField the facet field, without its suffix
     * @param topK the number of labels wanted
     * @return the label counts, or the empty result if the partition has no such facet
     */
    @Nonnull
    FacetResult facetQuery(@Nonnull String defaultField, @Nonnull String searchString, @Nonnull String facetField, int topK);

    /**
     * Count the labels of a facet field among the documents matching a query string, with the facet field as
     * the default field of the query.
     *
     * @param searchString the query string
     * @param facetField the facet field, without its suffix
     * @param topK the number of labels wanted
     * @return the label counts, or the empty result if the partition has no such facet
     */
    @Nonnull
    default FacetResult facetQuery(@Nonnull String searchString, @Nonnull String facetField, int topK) {
        return facetQuery(facetField, searchString, facetField, topK);
    }

    /**
     * {@link #facetQuery(String, String, String, int)} for several facet fields, all counted over the same matches.
     *
     * @param defaultField the field for terms that do not name one
     * @param searchString the query string
     * @param facetFields the facet fields
     * @param topK the number of labels wanted per field
     * @return the label counts per field, in input order
     */
    @Nonnull
    default Map<String, FacetResult> facetQueries(@Nonnull String defaultField, @Nonnull String searchString,
                                                  @Nonnull List<String> facetFields, int topK) {
        final ImmutableMap.Builder<String, FacetResult> results = ImmutableMap.builder();
        for (String facetField : facetFields) {
            results.put(facetField, facetQuery(defaultField, searchString, facetField, topK));
        }
        return results.buildKeepingLast();
    }

    /**
     * {@link #facetQuery(String, String, int)} for several facet fields. Each field is also the default field of
     * its own query.
     *
     * @param searchString the query string
     * @param facetFields the facet fields
     * @param topK the number of labels wanted per field
     * @return the label counts per field, in input order
     */
    @Nonnull
    default Map<String, FacetResult> facetQueries(@Nonnull String searchString, @Nonnull List<String> facetFields, int topK) {
        final ImmutableMap.Builder<String, FacetResult> results = ImmutableMap.builder();
        for (String facetField : facetFields) {
            results.put(facetField, facetQuery(searchString, facetField, topK));
        }
        return results.buildKeepingLast();
    }

    /**
     * A new partition over the source elements that satisfy the predicate. This partition is left unchanged; the
     * new one builds its own index the first time it is queried.
     *
     * @param predicate the elements to keep
     * @return the filtered partition
     */
    @Nonnull
    SearchPartition<T> filter(@Nonnull Predicate<? super T> predicate);

    /**
     * Release the partition's readers and directories.
     */
    @Override
    void close();
}
