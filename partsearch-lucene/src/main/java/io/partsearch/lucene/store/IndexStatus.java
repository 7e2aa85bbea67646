/*
 * IndexStatus.java
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

/**
 * Whether a partition builds a fresh index or opens one that a previous build left behind.
 * The status is fixed when the partition is constructed.
 */
@API(API.Status.EXPERIMENTAL)
public enum IndexStatus {
    /**
     * Index the partition's elements into a new location derived from the base path.
     */
    REWRITE,
    /**
     * Open the committed index found at the given location without indexing anything.
     */
    EXISTS,
}
