/*
 * SearchPropertyStorageTest.java
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

package io.partsearch.properties;

import io.partsearch.SearchCoreArgumentException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SearchPropertyStorage} and {@link SearchPropertyKey}.
 */
class SearchPropertyStorageTest {
    private static final SearchPropertyKey<Integer> TOP_K = SearchPropertyKey.integerPropertyKey("test.topk", 10);
    private static final SearchPropertyKey<Boolean> STRICT = SearchPropertyKey.booleanPropertyKey("test.strict", false);
    private static final SearchPropertyKey<Double> BUFFER = SearchPropertyKey.doublePropertyKey("test.buffer", 16.0);
    private static final SearchPropertyKey<String> NAME = SearchPropertyKey.stringPropertyKey("test.name", "standard");
    private static final List<SearchPropertyKey<?>> KEYS = Arrays.asList(TOP_K, STRICT, BUFFER, NAME);

    @Test
    void defaultsApplyWhenUnset() {
        SearchPropertyStorage storage = SearchPropertyStorage.getEmptyInstance();
        assertEquals(10, storage.getPropertyValue(TOP_K));
        assertEquals(false, storage.getPropertyValue(STRICT));
        assertFalse(storage.isSet(TOP_K));
    }

    @Test
    void programmaticOverrides() {
        SearchPropertyStorage storage = SearchPropertyStorage.newBuilder()
                .addProp(TOP_K, 25)
                .addProp(STRICT, true)
                .build();
        assertEquals(25, storage.getPropertyValue(TOP_K));
        assertTrue(storage.getPropertyValue(STRICT));
        assertTrue(storage.isSet(TOP_K));

        SearchPropertyStorage derived = storage.toBuilder().removeProp(TOP_K).build();
        assertEquals(10, derived.getPropertyValue(TOP_K));
        assertTrue(derived.getPropertyValue(STRICT));
    }

    @Test
    void parsesTextualProperties() {
        Properties properties = new Properties();
        properties.setProperty("test.topk", " 7 ");
        properties.setProperty("test.strict", "TRUE");
        properties.setProperty("test.buffer", "32.5");
        properties.setProperty("unrelated", "ignored");
        SearchPropertyStorage storage = SearchPropertyStorage.fromProperties(properties, KEYS);
        assertEquals(7, storage.getPropertyValue(TOP_K));
        assertTrue(storage.getPropertyValue(STRICT));
        assertEquals(32.5, storage.getPropertyValue(BUFFER));
        assertEquals("standard", storage.getPropertyValue(NAME));
    }

    @Test
    void rejectsUnparseableValues() {
        Properties properties = new Properties();
        properties.setProperty("test.topk", "ten");
        SearchCoreArgumentException ex = assertThrows(SearchCoreArgumentException.class,
                () -> SearchPropertyStorage.fromProperties(properties, KEYS));
        assertEquals("test.topk", ex.getLogInfo().get("property_key"));
        assertThrows(SearchCoreArgumentException.class, () -> STRICT.parse("yes"));
    }

    @Test
    void readsClassPathResource() {
        SearchPropertyStorage storage = SearchPropertyStorage.fromResource("search-properties-test.properties", KEYS);
        assertEquals(3, storage.getPropertyValue(TOP_K));
        assertEquals("english", storage.getPropertyValue(NAME));
        assertSame(SearchPropertyStorage.getEmptyInstance(), SearchPropertyStorage.fromResource("missing.properties", KEYS));
    }
}
