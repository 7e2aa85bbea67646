/*
 * LuceneAnalyzerType.java
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
import io.partsearch.annotation.API;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.core.SimpleAnalyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * The analyzers a partition can be configured with. The same analyzer is used to index documents, to parse query
 * strings and to split phrase queries into terms.
 */
@API(API.Status.EXPERIMENTAL)
public enum LuceneAnalyzerType {
    STANDARD {
        @Nonnull
        @Override
        public Analyzer newAnalyzer() {
            return new StandardAnalyzer();
        }
    },
    ENGLISH {
        @Nonnull
        @Override
        public Analyzer newAnalyzer() {
            return new EnglishAnalyzer();
        }
    },
    WHITESPACE {
        @Nonnull
        @Override
        public Analyzer newAnalyzer() {
            return new WhitespaceAnalyzer();
        }
    },
    SIMPLE {
        @Nonnull
        @Override
        public Analyzer newAnalyzer() {
            return new SimpleAnalyzer();
        }
    },
    KEYWORD {
        @Nonnull
        @Override
        public Analyzer newAnalyzer() {
            return new KeywordAnalyzer();
        }
    };

    /**
     * Create a new analyzer of this type. Analyzers hold per-thread state and must be closed by the caller.
     * @return a new analyzer
     */
    @Nonnull
    public abstract Analyzer newAnalyzer();

    @Nonnull
    public static LuceneAnalyzerType fromName(@Nonnull String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new SearchCoreArgumentException("Unknown analyzer", ex)
                    .addLogInfo(LuceneLogMessageKeys.ANALYZER_NAME.toString(), name);
        }
    }
}
