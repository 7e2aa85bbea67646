/*
 * Monoid.java
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

/**
 * An associative combine operation with a neutral element.
 *
 * <p>
 * Implementations must satisfy, for all {@code a}, {@code b} and {@code c}:
 * </p>
 * <ul>
 *     <li>{@code combine(combine(a, b), c).equals(combine(a, combine(b, c)))}</li>
 *     <li>{@code combine(a, empty()).equals(a)} and {@code combine(empty(), a).equals(a)}</li>
 * </ul>
 * <p>
 * A {@link ReductionStrategy} is free to group partial results in any shape, so a combine that does not hold
 * these laws gives answers that depend on scheduling. The monoids used to merge partition results are also
 * commutative, which additionally makes the order of partial results irrelevant.
 * </p>
 *
 * @param <T> the type of value being combined
 */
@API(API.Status.EXPERIMENTAL)
public interface Monoid<T> {
    /**
     * The neutral element.
     * @return a value that leaves any other value unchanged under {@link #combine(Object, Object)}
     */
    @Nonnull
    T empty();

    /**
     * Combine two values.
     * @param left the left operand
     * @param right the right operand
     * @return the combined value
     */
    @Nonnull
    T combine(@Nonnull T left, @Nonnull T right);

    /**
     * Left fold of the given values, starting from {@link #empty()}.
     * @param values the values to combine
     * @return the combined value, or {@link #empty()} if there are no values
     */
    @Nonnull
    default T combineAll(@Nonnull Iterable<? extends T> values) {
        T result = empty();
        for (T value : values) {
            result = combine(result, value);
        }
        return result;
    }
}
