/*
 * LuceneAnalyzerTypeTest.java
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

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link LuceneLoggerInfoStream}.
 */
class LuceneLoggerInfoStreamTest {
    @Test
    void messagesCarryPartition() {
        LuceneLoggerInfoStream infoStream = LuceneLoggerInfoStream.forPartition(3, "memory:fruits/indexDirectory.1.w");
        assertEquals(3, infoStream.getPartitionId());
        assertThat(infoStream.format("IW", "commit: done"), allOf(
                startsWith("index writer diagnostics"),
                containsString("partition_id=\"3\""),
                containsString("index_path=\"memory:fruits/indexDirectory.1.w\""),
                containsString("component=\"IW\""),
                containsString("message=\"commit: done\"")));
    }

    @Test
    void enabledFollowsTraceLevel() {
        Logger logger = LoggerFactory.getLogger(LuceneLoggerInfoStream.LOGGER_NAME);
        LuceneLoggerInfoStream infoStream = new LuceneLoggerInfoStream(logger, 0, "fruits/indexDirectory.1.w");
        assertEquals(logger.isTraceEnabled(), infoStream.isEnabled("IW"));
        infoStream.message("IW", "flush");
    }
}
