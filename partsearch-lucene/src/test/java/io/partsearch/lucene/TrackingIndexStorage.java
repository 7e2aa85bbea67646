/*
 * TrackingIndexStorage.java
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

import io.partsearch.lucene.store.InMemoryIndexStorage;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FilterDirectory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory storage that counts directories opened and not yet closed.
 */
public class TrackingIndexStorage extends InMemoryIndexStorage {
    private final AtomicInteger openDirectories = new AtomicInteger();

    @Nonnull
    @Override
    public Directory openDirectory(@Nonnull String path) {
        final Directory directory = super.openDirectory(path);
        openDirectories.incrementAndGet();
        return new FilterDirectory(directory) {
            private boolean closed;

            @Override
            public synchronized void close() throws IOException {
                if (!closed) {
                    closed = true;
                    openDirectories.decrementAndGet();
                }
                super.close();
            }
        };
    }

    public int getOpenDirectories() {
        return openDirectories.get();
    }
}
