/*
 * LuceneQueryParseException.java
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

import io.partsearch.SearchCoreArgumentException;
import io.partsearch.annotation.API;
import io.partsearch.logging.LogMessageKeys;
import org.apache.lucene.queryparser.classic.ParseException;

import javax.annotation.Nonnull;

/**
 * Thrown when a query-language string cannot be parsed. The failure belongs to the one query that carried the
 * string; other queries and other partitions are unaffected.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class LuceneQueryParseException extends SearchCoreArgumentException {
    @Nonnull
    private final String searchString;

    public LuceneQueryParseException(@Nonnull String searchString, @Nonnull ParseException cause) {
        super("Unable to parse query string: " + cause.getMessage(), cause);
        this.searchString = searchString;
        addLogInfo(LogMessageKeys.QUERY.toString(), searchString);
    }

    @Nonnull
    public String getSearchString() {
        return searchString;
    }
}
