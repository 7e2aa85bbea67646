/*
 * LuceneExceptions.java
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

import io.partsearch.IndexStorageException;
import io.partsearch.SearchCoreException;
import io.partsearch.annotation.API;
import org.apache.lucene.index.IndexNotFoundException;
import org.apache.lucene.store.LockObtainFailedException;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Converts exceptions thrown by Lucene into {@link SearchCoreException}s.
 */
@API(API.Status.INTERNAL)
public class LuceneExceptions {
    /**
     * Convert an {@link IOException} thrown by Lucene.
     *
     * @param message the message to use; the cause's message is appended to it
     * @param ex the exception thrown by Lucene
     * @param additionalLogInfo (optional) flattened key/value pairs for the log info
     * @return the exception to throw
     */
    @Nonnull
    public static SearchCoreException toSearchCoreException(@Nonnull String message, @Nonnull IOException ex, Object... additionalLogInfo) {
        final String fullMessage = message + ": " + ex.getMessage();
        if (ex instanceof IndexNotFoundException) {
            return new IndexStorageException(fullMessage, ex)
                    .addLogInfo("reason", "index_not_found")
                    .addLogInfo(additionalLogInfo);
        } else if (ex instanceof LockObtainFailedException) {
            return new IndexStorageException(fullMessage, ex)
                    .addLogInfo("reason", "lock_taken")
                    .addLogInfo(additionalLogInfo);
        }
        return new IndexStorageException(fullMessage, ex)
                .addLogInfo(additionalLogInfo);
    }

    private LuceneExceptions() {
    }
}
