/*
 * LogMessageKeys.java
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

package io.partsearch.logging;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys. Keeping them in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    CALLING_CLASS,
    // partitions
    PARTITION_ID,
    PARTITION_COUNT,
    BUILD_STATUS("status"),
    BASE_PATH,
    INDEX_PATH,
    TAXONOMY_PATH,
    WORKER_ID,
    DOCUMENT_COUNT("doc_count"),
    ELEMENT_COUNT,
    // queries
    QUERY,
    QUERY_COUNT,
    FIELD_NAME,
    FACET_FIELD,
    TOP_K("top_k"),
    MAX_TOP_K("max_top_k"),
    MAX_EDITS,
    HIT_COUNT,
    TOTAL_HITS,
    // reduction
    REDUCTION_STRATEGY,
    // configuration
    PROPERTY_KEY,
    PROPERTY_VALUE,
    PROPERTY_TYPE,
    // timing
    TIME_NANOS("time_nanos"),
    TIME_MILLIS("time_millis"),
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
