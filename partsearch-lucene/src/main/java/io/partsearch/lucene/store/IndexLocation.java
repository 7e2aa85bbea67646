/*
 * IndexLocation.java
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

import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The pair of storage paths holding one partition's index: the primary index and the taxonomy index used for facets.
 *
 * <p>
 * A rebuilt partition lives under {@code <base>/indexDirectory.<timestamp>.<worker>} with its taxonomy under
 * {@code <base>/taxonomyDirectory.<timestamp>.<worker>}. The worker id is unique within the JVM and carries a
 * per-JVM token, so two builds against the same base path never share a location, even when they start in the
 * same millisecond on the same thread.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class IndexLocation {
    public static final String INDEX_DIRECTORY = "indexDirectory";
    public static final String TAXONOMY_DIRECTORY = "taxonomyDirectory";

    private static final String JVM_TOKEN = UUID.randomUUID().toString().substring(0, 8);
    private static final AtomicLong BUILD_SEQUENCE = new AtomicLong();

    @Nonnull
    private final String indexPath;
    @Nonnull
    private final String taxonomyPath;

    private IndexLocation(@Nonnull String indexPath, @Nonnull String taxonomyPath) {
        this.indexPath = indexPath;
        this.taxonomyPath = taxonomyPath;
    }

    /**
     * Resolve the location a partition with the given status uses.
     *
     * @param status the partition's build status
     * @param path the base path for {@link IndexStatus#REWRITE}, the primary index path for {@link IndexStatus#EXISTS}
     * @return the resolved location
     */
    @Nonnull
    public static IndexLocation resolve(@Nonnull IndexStatus status, @Nonnull String path) {
        switch (status) {
            case REWRITE:
                return forRewrite(path, System.currentTimeMillis(), nextWorkerId());
            case EXISTS:
                return forExisting(path);
            default:
                throw new SearchCoreArgumentException("unknown index status",
                        LogMessageKeys.BUILD_STATUS, status);
        }
    }

    @Nonnull
    public static IndexLocation forRewrite(@Nonnull String basePath, long timestamp, @Nonnull String workerId) {
        final String suffix = "." + timestamp + "." + workerId;
        return new IndexLocation(child(basePath, INDEX_DIRECTORY + suffix), child(basePath, TAXONOMY_DIRECTORY + suffix));
    }

    /**
     * The location of an index built earlier. The taxonomy path follows from the primary path's naming.
     *
     * @param path path of a primary index created by a rebuild, with or without trailing separators
     * @return the location
     * @throws SearchCoreArgumentException if the path's last element does not follow the primary index naming
     */
    @Nonnull
    public static IndexLocation forExisting(@Nonnull String path) {
        final String indexPath = trimTrailingSeparators(path);
        final int nameStart = Math.max(indexPath.lastIndexOf('/'), indexPath.lastIndexOf('\\')) + 1;
        final String name = indexPath.substring(nameStart);
        if (!name.startsWith(INDEX_DIRECTORY)) {
            throw new SearchCoreArgumentException("existing index path does not name an index directory",
                    LogMessageKeys.INDEX_PATH, path);
        }
        final String taxonomyPath = indexPath.substring(0, nameStart) + TAXONOMY_DIRECTORY + name.substring(INDEX_DIRECTORY.length());
        return new IndexLocation(indexPath, taxonomyPath);
    }

    /**
     * Drop separators at the end of a path, keeping a lone root separator.
     *
     * @param path a path
     * @return the path without trailing separators
     */
    @Nonnull
    public static String trimTrailingSeparators(@Nonnull String path) {
        int end = path.length();
        while (end > 1 && (path.charAt(end - 1) == '/' || path.charAt(end - 1) == '\\')) {
            end--;
        }
        return path.substring(0, end);
    }

    @Nonnull
    static String nextWorkerId() {
        return JVM_TOKEN + "-" + Thread.currentThread().getId() + "-" + BUILD_SEQUENCE.incrementAndGet();
    }

    @Nonnull
    private static String child(@Nonnull String basePath, @Nonnull String name) {
        if (basePath.isEmpty()) {
            return name;
        }
        return basePath.endsWith("/") ? basePath + name : basePath + "/" + name;
    }

    @Nonnull
    public String getIndexPath() {
        return indexPath;
    }

    @Nonnull
    public String getTaxonomyPath() {
        return taxonomyPath;
    }

    /**
     * Qualify both paths against a storage.
     * @param storage the storage the location will be used with
     * @return a location with both paths in the storage's qualified form
     */
    @Nonnull
    public IndexLocation qualify(@Nonnull IndexStorage storage) {
        return new IndexLocation(storage.qualify(indexPath), storage.qualify(taxonomyPath));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexLocation that = (IndexLocation) o;
        return indexPath.equals(that.indexPath) && taxonomyPath.equals(that.taxonomyPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexPath, taxonomyPath);
    }

    @Override
    public String toString() {
        return "IndexLocation{" + indexPath + ", " + taxonomyPath + "}";
    }
}
