/*
 * CloseableUtils.java
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

package io.partsearch.util;

import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Helpers for closing groups of {@link AutoCloseable}s.
 */
public class CloseableUtils {
    /**
     * Close every given resource in order, even if some of them fail. {@code null} entries are skipped.
     *
     * @param closeables the resources to close
     * @throws CloseException if any resource failed to close; the first failure is the cause and the rest are
     * suppressed
     */
    @API(API.Status.INTERNAL)
    public static void closeAll(@Nullable AutoCloseable... closeables) throws CloseException {
        if (closeables == null) {
            return;
        }
        CloseException accumulated = null;
        for (AutoCloseable closeable : closeables) {
            accumulated = closeOne(closeable, accumulated);
        }
        if (accumulated != null) {
            throw accumulated;
        }
    }

    /**
     * Close every resource in the collection, in iteration order, even if some of them fail.
     *
     * @param closeables the resources to close
     * @throws CloseException if any resource failed to close
     */
    @API(API.Status.INTERNAL)
    public static void closeAll(@Nonnull Collection<? extends AutoCloseable> closeables) throws CloseException {
        closeAll(closeables.toArray(new AutoCloseable[0]));
    }

    @Nullable
    @SuppressWarnings("PMD.CloseResource")
    private static CloseException closeOne(@Nullable AutoCloseable closeable, @Nullable CloseException accumulated) {
        if (closeable == null) {
            return accumulated;
        }
        try {
            closeable.close();
            return accumulated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return accumulate(accumulated, e);
        } catch (Exception e) {
            return accumulate(accumulated, e);
        }
    }

    @Nonnull
    private static CloseException accumulate(@Nullable CloseException accumulated, @Nonnull Exception e) {
        if (accumulated == null) {
            return new CloseException(e);
        }
        accumulated.addSuppressed(e);
        return accumulated;
    }

    private CloseableUtils() {
        // prevent constructor from being called
    }
}
