/*
 * KeyValueLogMessageTest.java
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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
class KeyValueLogMessageTest {
    @Test
    void keysAreSortedAndQuoted() {
        assertEquals("Built partition doc_count=\"3\" index_path=\"/tmp/x\" partition_id=\"0\"",
                KeyValueLogMessage.of("Built partition",
                        LogMessageKeys.PARTITION_ID, 0,
                        LogMessageKeys.INDEX_PATH, "/tmp/x",
                        LogMessageKeys.DOCUMENT_COUNT, 3));
    }

    @Test
    void valuesAndKeysAreSanitized() {
        KeyValueLogMessage message = KeyValueLogMessage.build("Parse failed")
                .addKeyAndValue("a=b", "say \"hi\"")
                .addKeysAndValues(ImmutableMap.of("n", 1));
        assertEquals("Parse failed ab=\"say 'hi'\" n=\"1\"", message.toString());
        assertEquals("null", KeyValueLogMessage.build("t", "k", null).getKeyValueMap().get("k"));
    }

    @Test
    void unbalancedPairsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("t", "k"));
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("t", null, "v"));
    }
}
