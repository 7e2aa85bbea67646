/*
 * LuceneLogMessageKeys.java
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

import java.util.Locale;

/**
 * Lucene specific logging keys.
 */
@API(API.Status.UNSTABLE)
public enum LuceneLogMessageKeys {
    ANALYZER_NAME,
    COMPONENT,
    COLUMN_NAME,
    VALUE_TYPE,
    FACET_DIMENSION,
    FACET_LABEL_COUNT,
    OCCUR,
    SEGMENT_COUNT,
    ;

    private final String logKey;

    LuceneLogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
