/*
 * IndexAndTaxonomyWriterTest.java
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

package io.partsearch.lucene.store;

import io.partsearch.lucene.LuceneLoggerInfoStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.facet.FacetField;
import org.apache.lucene.facet.FacetsConfig;
import org.apache.lucene.facet.taxonomy.FacetLabel;
import org.apache.lucene.facet.taxonomy.TaxonomyReader;
import org.apache.lucene.facet.taxonomy.directory.DirectoryTaxonomyReader;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link IndexAndTaxonomyWriter}.
 */
class IndexAndTaxonomyWriterTest {
    @Test
    void commitMakesDocumentsAndFacetsVisible() throws IOException {
        try (Directory index = new ByteBuffersDirectory(); Directory taxonomy = new ByteBuffersDirectory();
                StandardAnalyzer analyzer = new StandardAnalyzer()) {
            LuceneLoggerInfoStream infoStream = LuceneLoggerInfoStream.forPartition(0, "memory:apples/indexDirectory.1.w");
            try (IndexAndTaxonomyWriter writer = new IndexAndTaxonomyWriter(index, taxonomy, analyzer, new FacetsConfig(), 16.0, infoStream)) {
                writer.addDocument(document("apple pie"));
                writer.addDocument(document("apple tart"));
                writer.commit();
                assertEquals(2L, writer.getDocumentCount());
            }
            try (DirectoryReader reader = DirectoryReader.open(index);
                    DirectoryTaxonomyReader taxonomyReader = new DirectoryTaxonomyReader(taxonomy)) {
                assertEquals(2, reader.numDocs());
                assertNotEquals(TaxonomyReader.INVALID_ORDINAL, taxonomyReader.getOrdinal(new FacetLabel("text_facet", "apple tart")));
            }
        }
    }

    @Test
    void emptyCommitIsReadable() throws IOException {
        try (Directory index = new ByteBuffersDirectory(); Directory taxonomy = new ByteBuffersDirectory();
                StandardAnalyzer analyzer = new StandardAnalyzer()) {
            try (IndexAndTaxonomyWriter writer = new IndexAndTaxonomyWriter(index, taxonomy, analyzer, new FacetsConfig(), 16.0, null)) {
                writer.commit();
            }
            try (DirectoryReader reader = DirectoryReader.open(index)) {
                assertEquals(0, reader.numDocs());
            }
        }
    }

    @Test
    void closeWithoutCommitRollsBack() throws IOException {
        try (Directory index = new ByteBuffersDirectory(); Directory taxonomy = new ByteBuffersDirectory();
                StandardAnalyzer analyzer = new StandardAnalyzer()) {
            assertThrows(IllegalStateException.class, () -> {
                try (IndexAndTaxonomyWriter writer = new IndexAndTaxonomyWriter(index, taxonomy, analyzer, new FacetsConfig(), 16.0, null)) {
                    writer.addDocument(document("apple pie"));
                    throw new IllegalStateException("conversion failed");
                }
            });
            assertFalse(DirectoryReader.indexExists(index));
            // the writers released the directory locks, so the build can be retried
            try (IndexAndTaxonomyWriter writer = new IndexAndTaxonomyWriter(index, taxonomy, analyzer, new FacetsConfig(), 16.0, null)) {
                writer.commit();
            }
            assertTrue(DirectoryReader.indexExists(index));
        }
    }

    private static Document document(String text) {
        Document document = new Document();
        document.add(new TextField("text", text, Field.Store.YES));
        document.add(new FacetField("text_facet", text));
        return document;
    }
}
