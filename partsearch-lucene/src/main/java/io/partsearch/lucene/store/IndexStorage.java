/*
 * IndexStorage.java
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

import io.partsearch.IndexStorageException;
import io.partsearch.annotation.API;
import org.apache.lucene.store.Directory;

import javax.annotation.Nonnull;

/**
 * Where partition indexes are kept. Paths are plain strings; an implementation decides what they address.
 * Every failure is reported as an {@link IndexStorageException}.
 */
@API(API.Status.EXPERIMENTAL)
public interface IndexStorage {
    /**
     * Turn a path into the form used for every other call, so that equal locations compare equal.
     * @param path the path as given by the caller
     * @return the qualified path
     */
    @Nonnull
    String qualify(@Nonnull String path);

    boolean exists(@Nonnull String path);

    /**
     * Remove whatever is stored at the path. Removing a missing path does nothing.
     * @param path the path to remove
     * @param recursive whether nested content is removed as well
     */
    void delete(@Nonnull String path, boolean recursive);

    /**
     * Open a directory at the path, creating it if needed. Closing the returned directory releases it; the content
     * stays until {@link #delete} is called.
     * @param path the path to open
     * @return an open directory
     */
    @Nonnull
    Directory openDirectory(@Nonnull String path);
}
