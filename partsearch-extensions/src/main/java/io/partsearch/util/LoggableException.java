/*
 * LoggableException.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception that carries structured key/value pairs alongside its message, so that whoever logs it
 * can emit them as searchable fields rather than baking them into the message text.
 *
 * <p>
 * Keys and values are supplied as a flattened array, {@code [k0, v0, k1, v1, ...]}, which is also the shape
 * returned by {@link #exportLogInfo()}.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and some key/value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key/value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has an odd length
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(Throwable cause) {
        super(cause);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    /**
     * The log information attached to this exception, in insertion order.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a flattened list of key/value pairs. Keys are converted with {@link String#valueOf(Object)}.
     *
     * @param keyValue flattened key/value pairs
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValue</code> has an odd length
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log information back into the {@code [k0, v0, k1, v1, ...]} form accepted by
     * {@link #addLogInfo(Object...)}.
     *
     * @return the flattened key/value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}
