/*
 * QueryOutcome.java
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

package io.partsearch.lucene.response;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * The result of one query in a batch: either its value or the exception that query failed with.
 * A failing query does not prevent the others in the batch from answering.
 *
 * @param <R> the result type
 */
@API(API.Status.EXPERIMENTAL)
public final class QueryOutcome<R> {
    @Nullable
    private final R value;
    @Nullable
    private final RuntimeException failure;

    private QueryOutcome(@Nullable R value, @Nullable RuntimeException failure) {
        this.value = value;
        this.failure = failure;
    }

    @Nonnull
    public static <R> QueryOutcome<R> success(@Nonnull R value) {
        return new QueryOutcome<>(value, null);
    }

    @Nonnull
    public static <R> QueryOutcome<R> failure(@Nonnull RuntimeException failure) {
        return new QueryOutcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * The value of a successful query.
     * @return the value
     * @throws RuntimeException the exception the query failed with
     */
    @Nonnull
    public R get() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    @Nonnull
    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "QueryOutcome{" + value + "}" : "QueryOutcome{failure=" + failure + "}";
    }
}
