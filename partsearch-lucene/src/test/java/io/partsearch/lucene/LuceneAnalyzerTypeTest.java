/*
 * LuceneAnalyzerTypeTest.java
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

package io.partsearch.lucene;

import io.partsearch.SearchCoreArgumentException;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LuceneAnalyzerTypeTest {

    private static List<String> tokens(LuceneAnalyzerType type, String text) throws IOException {
        final List<String> result = new ArrayList<>();
        try (Analyzer analyzer = type.newAnalyzer(); TokenStream stream = analyzer.tokenStream("f", text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                result.add(term.toString());
            }
            stream.end();
        }
        return result;
    }

    @Test
    void tokenizes() throws IOException {
        assertEquals(List.of("apple", "pie"), tokens(LuceneAnalyzerType.STANDARD, "Apple Pie"));
        assertEquals(List.of("Apple", "Pie"), tokens(LuceneAnalyzerType.WHITESPACE, "Apple Pie"));
        assertEquals(List.of("Apple Pie"), tokens(LuceneAnalyzerType.KEYWORD, "Apple Pie"));
        assertEquals(List.of("appl", "pi"), tokens(LuceneAnalyzerType.ENGLISH, "apples pies"));
    }

    @Test
    void fromName() {
        assertEquals(LuceneAnalyzerType.ENGLISH, LuceneAnalyzerType.fromName(" english"));
        assertThrows(SearchCoreArgumentException.class, () -> LuceneAnalyzerType.fromName("klingon"));
    }
}
