/*
 * ScatterGather.java
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

package io.partsearch.async;

import io.partsearch.annotation.API;
import io.partsearch.reduce.Monoid;
import io.partsearch.reduce.ReductionStrategy;
import io.partsearch.util.LoggableException;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Task-per-partition fan-out and the matching gather and reduce steps.
 */
@API(API.Status.EXPERIMENTAL)
public class ScatterGather {

    /**
     * Start one task per partition on the executor.
     *
     * @param partitions the partitions to run against
     * @param task the per-partition function
     * @param executor the executor the tasks run on
     * @param <P> partition type
     * @param <R> result type
     * @return one future per partition, in partition order
     */
    @Nonnull
    public static <P, R> List<CompletableFuture<R>> scatter(@Nonnull List<? extends P> partitions,
                                                            @Nonnull Function<? super P, ? extends R> task,
                                                            @Nonnull Executor executor) {
        final List<CompletableFuture<R>> futures = new ArrayList<>(partitions.size());
        for (P partition : partitions) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(partition), executor));
        }
        return futures;
    }

    /**
     * Run a task against every partition and collect the results in partition order.
     * The returned future fails if any task fails.
     *
     * @param partitions the partitions to run against
     * @param task the per-partition function
     * @param executor the executor the tasks run on
     * @param <P> partition type
     * @param <R> result type
     * @return a future with the per-partition results
     */
    @Nonnull
    public static <P, R> CompletableFuture<List<R>> gather(@Nonnull List<? extends P> partitions,
                                                           @Nonnull Function<? super P, ? extends R> task,
                                                           @Nonnull Executor executor) {
        final List<CompletableFuture<R>> futures = scatter(partitions, task, executor);
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignore -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    /**
     * Run a task against every partition and reduce the results.
     *
     * @param partitions the partitions to run against
     * @param task the per-partition function
     * @param monoid the combine operation for the partial results
     * @param strategy the shape of the reduction
     * @param executor the executor the tasks and combine steps run on
     * @param <P> partition type
     * @param <R> result type
     * @return a future with the reduced result
     */
    @Nonnull
    public static <P, R> CompletableFuture<R> scatterReduce(@Nonnull List<? extends P> partitions,
                                                            @Nonnull Function<? super P, ? extends R> task,
                                                            @Nonnull Monoid<R> monoid,
                                                            @Nonnull ReductionStrategy strategy,
                                                            @Nonnull Executor executor) {
        return ScatterGather.<P, R>gather(partitions, task, executor)
                .thenCompose(partials -> strategy.reduce(partials, monoid, executor));
    }

    /**
     * Wait for every future to finish, successfully or not. Unlike {@link CompletableFuture#allOf}, the result
     * never completes exceptionally, so the caller can inspect each future afterwards.
     *
     * @param futures the futures to wait for
     */
    public static void awaitSettled(@Nonnull List<? extends CompletableFuture<?>> futures) {
        for (CompletableFuture<?> future : futures) {
            try {
                future.handle((result, err) -> null).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LoggableException("interrupted while waiting for partition tasks", e);
            } catch (ExecutionException e) {
                throw new LoggableException("unexpected failure of settled future", e.getCause());
            }
        }
    }

    /**
     * Block on a future, rethrowing unchecked failures of the task as they were thrown.
     *
     * @param future the future to wait on
     * @param <T> result type
     * @return the result of the future
     */
    public static <T> T asyncToSync(@Nonnull CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoggableException("interrupted while waiting for partition tasks", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Strip the {@link CompletionException} and {@link ExecutionException} layers a future adds around a failure.
     *
     * @param throwable the failure as seen through a future
     * @return the original unchecked failure, or a {@link LoggableException} wrapping a checked one
     */
    @Nonnull
    public static RuntimeException unwrap(@Nonnull Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Error) {
            throw (Error)cause;
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException)cause;
        }
        return new LoggableException("partition task failed", cause);
    }

    private ScatterGather() {
    }
}
