/*
 * LocalFileSystemIndexStorage.java
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
import io.partsearch.logging.KeyValueLogMessage;
import io.partsearch.logging.LogMessageKeys;
import io.partsearch.lucene.LuceneExceptions;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Keeps indexes in directories of the local file system.
 */
@API(API.Status.EXPERIMENTAL)
public class LocalFileSystemIndexStorage implements IndexStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileSystemIndexStorage.class);

    @Nonnull
    @Override
    public String qualify(@Nonnull String path) {
        return toPath(path).toString();
    }

    @Override
    public boolean exists(@Nonnull String path) {
        return Files.exists(toPath(path));
    }

    @Override
    public void delete(@Nonnull String path, boolean recursive) {
        final Path target = toPath(path);
        if (!Files.exists(target)) {
            return;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("deleting index directory",
                    LogMessageKeys.INDEX_PATH, target));
        }
        try {
            if (recursive) {
                IOUtils.rm(target);
            } else {
                Files.delete(target);
            }
        } catch (IOException ex) {
            throw LuceneExceptions.toSearchCoreException("failed to delete index directory", ex,
                    LogMessageKeys.INDEX_PATH, target);
        }
    }

    @Nonnull
    @Override
    public Directory openDirectory(@Nonnull String path) {
        final Path target = toPath(path);
        try {
            return FSDirectory.open(target);
        } catch (IOException ex) {
            throw LuceneExceptions.toSearchCoreException("failed to open index directory", ex,
                    LogMessageKeys.INDEX_PATH, target);
        }
    }

    @Nonnull
    private static Path toPath(@Nonnull String path) {
        return Paths.get(path).toAbsolutePath().normalize();
    }
}
