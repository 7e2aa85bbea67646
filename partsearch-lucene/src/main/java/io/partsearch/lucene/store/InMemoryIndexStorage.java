/*
 * InMemoryIndexStorage.java
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
import io.partsearch.util.CloseableUtils;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FilterDirectory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps indexes in heap memory. Content lives as long as this storage object and survives partitions closing their
 * directories, so an index built by one partition can be opened again by another.
 */
@API(API.Status.EXPERIMENTAL)
public class InMemoryIndexStorage implements IndexStorage {
    private static final String SCHEME = "memory:";

    private final Map<String, ByteBuffersDirectory> directories = new ConcurrentHashMap<>();

    @Nonnull
    @Override
    public String qualify(@Nonnull String path) {
        String qualified = path.startsWith(SCHEME) ? path : SCHEME + path;
        while (qualified.length() > SCHEME.length() + 1 && qualified.endsWith("/")) {
            qualified = qualified.substring(0, qualified.length() - 1);
        }
        return qualified;
    }

    @Override
    public boolean exists(@Nonnull String path) {
        final String qualified = qualify(path);
        if (directories.containsKey(qualified)) {
            return true;
        }
        final String prefix = qualified + "/";
        return directories.keySet().stream().anyMatch(key -> key.startsWith(prefix));
    }

    @Override
    public void delete(@Nonnull String path, boolean recursive) {
        final String qualified = qualify(path);
        final List<ByteBuffersDirectory> removed = new ArrayList<>();
        final ByteBuffersDirectory exact = directories.remove(qualified);
        if (exact != null) {
            removed.add(exact);
        }
        if (recursive) {
            final String prefix = qualified + "/";
            directories.keySet().removeIf(key -> {
                if (key.startsWith(prefix)) {
                    final ByteBuffersDirectory directory = directories.get(key);
                    if (directory != null) {
                        removed.add(directory);
                    }
                    return true;
                }
                return false;
            });
        }
        CloseableUtils.closeAll(removed);
    }

    @Nonnull
    @Override
    public Directory openDirectory(@Nonnull String path) {
        return new RetainedDirectory(directories.computeIfAbsent(qualify(path), ignore -> new ByteBuffersDirectory()));
    }

    /**
     * Number of directories currently stored.
     * @return the directory count
     */
    public int size() {
        return directories.size();
    }

    /**
     * A view of a stored directory whose {@link #close()} leaves the stored content alone.
     */
    private static final class RetainedDirectory extends FilterDirectory {
        RetainedDirectory(@Nonnull Directory in) {
            super(in);
        }

        @Override
        public void close() {
            // content is released by InMemoryIndexStorage.delete
        }
    }
}
