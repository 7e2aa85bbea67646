/*
 * KeyValueLogMessage.java
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
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A log message made of a static title followed by {@code key="value"} pairs sorted by key.
 *
 * <pre>{@code
 * LOGGER.info(KeyValueLogMessage.of("Opened partition index",
 *         LogMessageKeys.PARTITION_ID, 3,
 *         LogMessageKeys.INDEX_PATH, path));
 * }</pre>
 */
@API(API.Status.UNSTABLE)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull String staticMessage) {
        this.staticMessage = staticMessage;
        this.keyValueMap = new TreeMap<>();
    }

    /**
     * Format a message in one step.
     *
     * @param staticMessage the title of the message
     * @param keysAndValues flattened key/value pairs
     * @return the formatted message
     */
    @Nonnull
    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    /**
     * Start a message that more pairs can be added to.
     *
     * @param staticMessage the title of the message
     * @param keysAndValues flattened key/value pairs
     * @return the message
     */
    @Nonnull
    public static KeyValueLogMessage build(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final KeyValueLogMessage message = new KeyValueLogMessage(staticMessage);
        if (keysAndValues != null) {
            message.addKeysAndValues(keysAndValues);
        }
        return message;
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nonnull Object key, @Nullable Object value) {
        keyValueMap.put(sanitizeKey(key.toString()), sanitizeValue(String.valueOf(value)));
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values don't match");
        }
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i] == null) {
                throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
            }
            addKeyAndValue(keysAndValues[i], keysAndValues[i + 1]);
        }
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull Map<?, ?> map) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            addKeyAndValue(entry.getKey(), entry.getValue());
        }
        return this;
    }

    @Nonnull
    private static String sanitizeValue(@Nonnull String value) {
        return value.replace("\"", "'");
    }

    @Nonnull
    private static String sanitizeKey(@Nonnull String key) {
        return key.replace("=", "");
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Nonnull
    public String getMessageWithKeys() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 30);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMessageWithKeys();
    }
}
