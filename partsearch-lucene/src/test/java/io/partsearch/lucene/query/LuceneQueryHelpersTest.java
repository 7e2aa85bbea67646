/*
 * LuceneQueryHelpersTest.java
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

import com.google.common.collect.ImmutableMap;
import io.partsearch.SearchCoreArgumentException;
import io.partsearch.lucene.LuceneQueryParseException;
import io.partsearch.lucene.LuceneSearchProperties;
import io.partsearch.properties.SearchPropertyStorage;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LuceneQueryHelpers}.
 */
class LuceneQueryHelpersTest {
    private final Analyzer analyzer = new StandardAnalyzer();

    @AfterEach
    void closeAnalyzer() {
        analyzer.close();
    }

    @Test
    void effectiveTopK() {
        SearchPropertyStorage properties = SearchPropertyStorage.newBuilder()
                .addProp(LuceneSearchProperties.MAX_TOP_K, 20)
                .build();
        assertEquals(5, LuceneQueryHelpers.effectiveTopK(5, properties));
        assertEquals(20, LuceneQueryHelpers.effectiveTopK(500, properties));
        assertEquals(1000, LuceneQueryHelpers.effectiveTopK(5000, SearchPropertyStorage.getEmptyInstance()));
        assertThrows(SearchCoreArgumentException.class, () -> LuceneQueryHelpers.effectiveTopK(0, properties));
        assertThrows(SearchCoreArgumentException.class, () -> LuceneQueryHelpers.effectiveTopK(-3, properties));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2})
    void fuzzyQuery(int maxEdits) {
        FuzzyQuery query = (FuzzyQuery) LuceneQueryHelpers.fuzzyQuery("text", "appel", maxEdits);
        assertEquals(maxEdits, query.getMaxEdits());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 3})
    void fuzzyQueryRejectsEditDistance(int maxEdits) {
        assertThrows(SearchCoreArgumentException.class, () -> LuceneQueryHelpers.fuzzyQuery("text", "appel", maxEdits));
    }

    @Test
    void phraseQuery() {
        assertThat(LuceneQueryHelpers.phraseQuery(analyzer, "text", "Apple Pie"), instanceOf(PhraseQuery.class));
        assertThat(LuceneQueryHelpers.phraseQuery(analyzer, "text", "  "), instanceOf(MatchNoDocsQuery.class));
    }

    @Test
    void multiTermQuery() {
        Query query = LuceneQueryHelpers.multiTermQuery(ImmutableMap.of("title", "apple", "category", "dessert"),
                BooleanClause.Occur.SHOULD);
        BooleanQuery booleanQuery = (BooleanQuery) query;
        assertEquals(2, booleanQuery.clauses().size());
        for (BooleanClause clause : booleanQuery.clauses()) {
            assertEquals(BooleanClause.Occur.SHOULD, clause.getOccur());
        }
    }

    @Test
    void parse() {
        assertEquals("text:apple +category:dessert",
                LuceneQueryHelpers.parse(analyzer, "text", "apple +category:dessert").toString());
        LuceneQueryParseException ex = assertThrows(LuceneQueryParseException.class,
                () -> LuceneQueryHelpers.parse(analyzer, "text", "apple AND ("));
        assertEquals("apple AND (", ex.getSearchString());
        assertEquals("apple AND (", ex.getLogInfo().get("query"));
    }
}
