/*
 * ReductionStrategy.java
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

package io.partsearch.reduce;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Shapes in which a list of partial results can be reduced with a {@link Monoid}.
 */
@API(API.Status.EXPERIMENTAL)
public enum ReductionStrategy {
    /**
     * Combine left to right on the calling thread.
     */
    SEQUENTIAL_FOLD {
        @Nonnull
        @Override
        public <T> CompletableFuture<T> reduce(@Nonnull List<T> values, @Nonnull Monoid<T> monoid, @Nonnull Executor executor) {
            return CompletableFuture.completedFuture(monoid.combineAll(values));
        }
    },
    /**
     * Split the list in halves recursively and combine the halves on the executor, giving a balanced tree of
     * depth {@code log2(n)}.
     */
    PAIRWISE_TREE {
        @Nonnull
        @Override
        public <T> CompletableFuture<T> reduce(@Nonnull List<T> values, @Nonnull Monoid<T> monoid, @Nonnull Executor executor) {
            return reduceRange(values, 0, values.size(), monoid, executor);
        }

        private <T> CompletableFuture<T> reduceRange(@Nonnull List<T> values, int from, int to,
                                                     @Nonnull Monoid<T> monoid, @Nonnull Executor executor) {
            final int length = to - from;
            if (length == 0) {
                return CompletableFuture.completedFuture(monoid.empty());
            }
            if (length == 1) {
                return CompletableFuture.completedFuture(values.get(from));
            }
            final int mid = from + length / 2;
            final CompletableFuture<T> left = CompletableFuture.supplyAsync(() -> reduceRange(values, from, mid, monoid, executor), executor)
                    .thenCompose(future -> future);
            final CompletableFuture<T> right = reduceRange(values, mid, to, monoid, executor);
            return left.thenCombineAsync(right, monoid::combine, executor);
        }
    };

    /**
     * Reduce the given values.
     *
     * @param values the partial results, in partition order
     * @param monoid the combine operation
     * @param executor executor for any asynchronous combine steps
     * @param <T> the type of value being reduced
     * @return a future with the reduced value, which is {@link Monoid#empty()} for an empty list
     */
    @Nonnull
    public abstract <T> CompletableFuture<T> reduce(@Nonnull List<T> values, @Nonnull Monoid<T> monoid, @Nonnull Executor executor);

    /**
     * Look a strategy up by name, ignoring case.
     *
     * @param name the strategy name
     * @return the matching strategy
     * @throws IllegalArgumentException if no strategy has that name
     */
    @Nonnull
    public static ReductionStrategy fromName(@Nonnull String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
