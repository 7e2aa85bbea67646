/*
 * IndexAndTaxonomyWriter.java
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

import io.partsearch.annotation.API;
import io.partsearch.lucene.LuceneLoggerInfoStream;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.facet.FacetsConfig;
import org.apache.lucene.facet.taxonomy.directory.DirectoryTaxonomyWriter;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.IOUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;

/**
 * The write handles of one index build: an {@link IndexWriter} and the {@link DirectoryTaxonomyWriter} its facets
 * go to. Both are created fresh, replacing anything already in the directories.
 *
 * <p>
 * Use in try-with-resources. {@link #commit()} makes the added documents durable; closing without a commit rolls
 * both writers back. Either way both writers are closed when the block exits.
 * </p>
 */
@API(API.Status.INTERNAL)
public class IndexAndTaxonomyWriter implements Closeable {
    @Nonnull
    private final IndexWriter indexWriter;
    @Nonnull
    private final DirectoryTaxonomyWriter taxonomyWriter;
    @Nonnull
    private final FacetsConfig facetsConfig;
    private boolean committed;
    private long documentCount;

    public IndexAndTaxonomyWriter(@Nonnull Directory indexDirectory, @Nonnull Directory taxonomyDirectory,
                                  @Nonnull Analyzer analyzer, @Nonnull FacetsConfig facetsConfig,
                                  double ramBufferSizeMB, @Nullable LuceneLoggerInfoStream infoStream) throws IOException {
        final IndexWriterConfig config = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                .setRAMBufferSizeMB(ramBufferSizeMB);
        if (infoStream != null) {
            config.setInfoStream(infoStream);
        }
        this.indexWriter = new IndexWriter(indexDirectory, config);
        boolean success = false;
        try {
            this.taxonomyWriter = new DirectoryTaxonomyWriter(taxonomyDirectory, IndexWriterConfig.OpenMode.CREATE);
            success = true;
        } finally {
            if (!success) {
                IOUtils.closeWhileHandlingException(indexWriter);
            }
        }
        this.facetsConfig = facetsConfig;
    }

    /**
     * Add a document, registering its facet labels with the taxonomy.
     * @param document the document to add
     * @throws IOException if either writer fails
     */
    public void addDocument(@Nonnull Document document) throws IOException {
        indexWriter.addDocument(facetsConfig.build(taxonomyWriter, document));
        documentCount++;
    }

    /**
     * Commit the taxonomy and then the index. An empty build still commits, so the result can be opened for reading.
     * @throws IOException if either commit fails
     */
    public void commit() throws IOException {
        taxonomyWriter.commit();
        indexWriter.commit();
        committed = true;
    }

    public long getDocumentCount() {
        return documentCount;
    }

    @Override
    public void close() throws IOException {
        if (committed) {
            IOUtils.close(taxonomyWriter, indexWriter);
        } else {
            IOUtils.close(taxonomyWriter::rollback, indexWriter::rollback);
        }
    }
}
