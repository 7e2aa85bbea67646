/*
 * IndexStorageException.java
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

package io.partsearch;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when an index location cannot be deleted, created, opened or committed. Such a failure is fatal to the
 * construction of the partition that owns the location; retrying is left to the caller.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class IndexStorageException extends SearchCoreException {
    public IndexStorageException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public IndexStorageException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
