/*
 * LuceneQueryHelpers.java
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

package io.partsearch.lucene.query;

import com.google.common.collect.ImmutableSortedSet;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.lucene.LuceneExceptions;
import io.partsearch.lucene.LuceneLogMessageKeys;
import io.partsearch.lucene.LuceneQueryParseException;
import io.partsearch.lucene.LuceneSearchProperties;
import io.partsearch.lucene.document.FacetFields;
import io.partsearch.lucene.facets.FacetResult;
import io.partsearch.lucene.response.SearchHit;
import io.partsearch.lucene.response.SearchResponse;
import io.partsearch.properties.SearchPropertyStorage;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.facet.FacetsCollector;
import org.apache.lucene.facet.FacetsConfig;
import org.apache.lucene.facet.LabelAndValue;
import org.apache.lucene.facet.taxonomy.FacetLabel;
import org.apache.lucene.facet.taxonomy.FastTaxonomyFacetCounts;
import org.apache.lucene.facet.taxonomy.TaxonomyReader;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.TopScoreDocCollector;
import org.apache.lucene.util.QueryBuilder;
import org.apache.lucene.util.automaton.LevenshteinAutomata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the queries a partition supports and runs them against an {@link IndexSearcher}.
 */
@API(API.Status.INTERNAL)
public final class LuceneQueryHelpers {
    private static final Logger LOGGER = LoggerFactory.getLogger(LuceneQueryHelpers.class);

    /**
     * Validate a requested number of hits and clamp it to {@link LuceneSearchProperties#MAX_TOP_K}.
     *
     * @param topK the requested number of hits
     * @param properties the configuration
     * @return the number of hits to collect
     */
    public static int effectiveTopK(int topK, @Nonnull SearchPropertyStorage properties) {
        if (topK <= 0) {
            throw new SearchCoreArgumentException("topK must be positive", LogMessageKeys.TOP_K, topK);
        }
        final int maxTopK = properties.getPropertyValue(LuceneSearchProperties.MAX_TOP_K);
        if (topK > maxTopK) {
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(KeyValueLogMessage.of("clamping requested topK",
                        LogMessageKeys.TOP_K, topK,
                        LogMessageKeys.MAX_TOP_K, maxTopK));
            }
            return maxTopK;
        }
        return topK;
    }

    @Nonnull
    public static Query termQuery(@Nonnull String field, @Nonnull String text) {
        return new TermQuery(new Term(field, text));
    }

    @Nonnull
    public static Query prefixQuery(@Nonnull String field, @Nonnull String text) {
        return new PrefixQuery(new Term(field, text));
    }

    /**
     * A query for terms within {@code maxEdits} character edits of the text.
     *
     * @param field the field to search
     * @param text the term to approximate
     * @param maxEdits the edit distance, from 0 to 2
     * @return the query
     */
    @Nonnull
    public static Query fuzzyQuery(@Nonnull String field, @Nonnull String text, int maxEdits) {
        if (maxEdits < 0 || maxEdits > LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE) {
            throw new SearchCoreArgumentException("unsupported edit distance",
                    LogMessageKeys.MAX_EDITS, maxEdits);
        }
        return new FuzzyQuery(new Term(field, text), maxEdits);
    }

    /**
     * A query for the analyzed terms of the text in sequence. Text that analyzes to no terms matches nothing.
     *
     * @param analyzer the analyzer the field was indexed with
     * @param field the field to search
     * @param text the phrase
     * @return the query
     */
    @Nonnull
    public static Query phraseQuery(@Nonnull Analyzer analyzer, @Nonnull String field, @Nonnull String text) {
        final Query query = new QueryBuilder(analyzer).createPhraseQuery(field, text);
        return query == null ? new MatchNoDocsQuery("phrase has no terms") : query;
    }

    /**
     * A boolean query with one term clause per field, all with the same occurrence.
     *
     * @param fieldsToTerms field to term
     * @param occur the occurrence of each clause
     * @return the query
     */
    @Nonnull
    public static Query multiTermQuery(@Nonnull Map<String, String> fieldsToTerms, @Nonnull BooleanClause.Occur occur) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Map.Entry<String, String> entry : fieldsToTerms.entrySet()) {
            builder.add(termQuery(entry.getKey(), entry.getValue()), occur);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("built multi term query",
                    LogMessageKeys.ELEMENT_COUNT, fieldsToTerms.size(),
                    LuceneLogMessageKeys.OCCUR, occur));
        }
        return builder.build();
    }

    /**
     * Parse a query string. Unqualified terms go to the default field.
     *
     * @param analyzer the analyzer for the query text
     * @param defaultField the default field
     * @param searchString the query string
     * @return the parsed query
     * @throws LuceneQueryParseException if the string is not valid query syntax
     */
    @Nonnull
    public static Query parse(@Nonnull Analyzer analyzer, @Nonnull String defaultField, @Nonnull String searchString) {
        // QueryParser is not thread safe
        final QueryParser parser = new QueryParser(defaultField, analyzer);
        try {
            return parser.parse(searchString);
        } catch (ParseException ex) {
            throw new LuceneQueryParseException(searchString, ex);
        }
    }

    /**
     * Run a query, collecting the best {@code topK} hits and an exact count of matches.
     *
     * @param searcher the searcher
     * @param query the query
     * @param topK the number of hits to collect, already validated
     * @param partitionId the partition the searcher belongs to
     * @return the hits in rank order
     */
    @Nonnull
    public static SearchResponse search(@Nonnull IndexSearcher searcher, @Nonnull Query query, int topK, int partitionId) {
        final int numHits = Math.max(1, Math.min(topK, searcher.getIndexReader().maxDoc()));
        final TopScoreDocCollector collector = TopScoreDocCollector.create(numHits, Integer.MAX_VALUE);
        try {
            searcher.search(query, collector);
            final TopDocs topDocs = collector.topDocs();
            final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                hits.add(new SearchHit(partitionId, scoreDoc.doc, scoreDoc.score, storedFields(searcher.doc(scoreDoc.doc))));
            }
            return SearchResponse.of(hits, topDocs.totalHits.value);
        } catch (IOException ex) {
            throw LuceneExceptions.toSearchCoreException("failed to search partition", ex,
                    LogMessageKeys.PARTITION_ID, partitionId,
                    LogMessageKeys.QUERY, query);
        }
    }

    /**
     * Count facet labels among the documents matching a query.
     *
     * <p>
     * The field is looked up as a text facet ({@code <field>_facet}) first and as a numeric facet
     * ({@code <field>_numFacet}) second. A field that is neither gives the empty result.
     * </p>
     *
     * @param searcher the searcher
     * @param taxonomyReader the taxonomy of the searcher's index
     * @param facetsConfig the facet configuration the index was built with
     * @param query the query selecting the documents to count
     * @param facetField the facet field, without suffix
     * @param topK the number of labels to return
     * @return the counts of the top labels
     */
    @Nonnull
    public static FacetResult facetSearch(@Nonnull IndexSearcher searcher, @Nonnull TaxonomyReader taxonomyReader,
                                          @Nonnull FacetsConfig facetsConfig, @Nonnull Query query,
                                          @Nonnull String facetField, int topK) {
        try {
            final String dimension = resolveFacetDimension(taxonomyReader, facetField);
            if (dimension == null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("facet field not indexed",
                            LogMessageKeys.FACET_FIELD, facetField));
                }
                return FacetResult.empty();
            }
            final FacetsCollector collector = new FacetsCollector();
            FacetsCollector.search(searcher, query, 1, collector);
            final org.apache.lucene.facet.FacetResult luceneResult =
                    new FastTaxonomyFacetCounts(taxonomyReader, facetsConfig, collector).getTopChildren(topK, dimension);
            if (luceneResult == null) {
                return FacetResult.empty();
            }
            final Map<String, Long> counts = new LinkedHashMap<>();
            for (LabelAndValue labelAndValue : luceneResult.labelValues) {
                counts.put(labelAndValue.label, labelAndValue.value.longValue());
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("counted facet labels",
                        LogMessageKeys.FACET_FIELD, facetField,
                        LuceneLogMessageKeys.FACET_DIMENSION, dimension,
                        LuceneLogMessageKeys.FACET_LABEL_COUNT, luceneResult.childCount));
            }
            return FacetResult.of(facetField, counts, luceneResult.value.longValue());
        } catch (IOException ex) {
            throw LuceneExceptions.toSearchCoreException("failed to count facets", ex,
                    LogMessageKeys.FACET_FIELD, facetField,
                    LogMessageKeys.QUERY, query);
        }
    }

    @Nullable
    private static String resolveFacetDimension(@Nonnull TaxonomyReader taxonomyReader, @Nonnull String facetField) throws IOException {
        for (String dimension : new String[] {FacetFields.textFacet(facetField), FacetFields.numericFacet(facetField)}) {
            if (taxonomyReader.getOrdinal(new FacetLabel(dimension)) != TaxonomyReader.INVALID_ORDINAL) {
                return dimension;
            }
        }
        return null;
    }

    /**
     * Names of the fields in the index, leaving out Lucene's internal facet fields.
     * @param reader the index reader
     * @return the sorted field names
     */
    @Nonnull
    public static Set<String> fields(@Nonnull IndexReader reader) {
        final ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
        for (FieldInfo fieldInfo : FieldInfos.getMergedFieldInfos(reader)) {
            if (!fieldInfo.name.startsWith("$")) {
                names.add(fieldInfo.name);
            }
        }
        return names.build();
    }

    @Nonnull
    private static Map<String, Object> storedFields(@Nonnull Document document) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        for (IndexableField field : document.getFields()) {
            final Object value = field.numericValue() != null ? field.numericValue() : field.stringValue();
            if (value != null) {
                fields.putIfAbsent(field.name(), value);
            }
        }
        return fields;
    }

    private LuceneQueryHelpers() {
    }
}
