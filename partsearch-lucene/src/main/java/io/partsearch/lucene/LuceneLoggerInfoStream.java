/*
 * LuceneLoggerInfoStream.java
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

import io.partsearch.annotation.API;
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import org.apache.lucene.util.InfoStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * An {@link InfoStream} for the index writer of one partition build. Each diagnostic becomes a TRACE log line
 * tagged with the partition id and index path, so interleaved output from parallel builds can be told apart.
 */
@API(API.Status.INTERNAL)
@SuppressWarnings("PMD.LoggerIsNotStaticFinal")
public class LuceneLoggerInfoStream extends InfoStream {
    public static final String LOGGER_NAME = "io.partsearch.lucene.infostream";

    @Nonnull
    private final Logger logger;
    private final int partitionId;
    @Nonnull
    private final String indexPath;

    public LuceneLoggerInfoStream(@Nonnull Logger logger, int partitionId, @Nonnull String indexPath) {
        this.logger = logger;
        this.partitionId = partitionId;
        this.indexPath = indexPath;
    }

    @Nonnull
    public static LuceneLoggerInfoStream forPartition(int partitionId, @Nonnull String indexPath) {
        return new LuceneLoggerInfoStream(LoggerFactory.getLogger(LOGGER_NAME), partitionId, indexPath);
    }

    public int getPartitionId() {
        return partitionId;
    }

    @Nonnull
    public String getIndexPath() {
        return indexPath;
    }

    @Override
    public void message(String component, String message) {
        if (isEnabled(component)) {
            logger.trace(format(component, message));
        }
    }

    @Nonnull
    String format(@Nonnull String component, @Nonnull String message) {
        return KeyValueLogMessage.of("index writer diagnostics",
                LogMessageKeys.PARTITION_ID, partitionId,
                LogMessageKeys.INDEX_PATH, indexPath,
                LuceneLogMessageKeys.COMPONENT, component,
                LogMessageKeys.MESSAGE, message);
    }

    @Override
    public boolean isEnabled(String component) {
        return logger.isTraceEnabled();
    }

    @Override
    public void close() {
        // the logger outlives the writer
    }
}
