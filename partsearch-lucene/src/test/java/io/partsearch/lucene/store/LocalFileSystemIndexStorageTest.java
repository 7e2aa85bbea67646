/*
 * LocalFileSystemIndexStorageTest.java
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

package io.partsearch.lucene.store;

import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LocalFileSystemIndexStorage}.
 */
class LocalFileSystemIndexStorageTest {
    @TempDir
    Path tempDir;

    private final IndexStorage storage = new LocalFileSystemIndexStorage();

    @Test
    void qualifyIsAbsoluteAndNormalized() {
        String qualified = storage.qualify(tempDir.resolve("a/../b").toString());
        assertEquals(tempDir.resolve("b").toAbsolutePath().normalize().toString(), qualified);
        assertTrue(Paths.get(storage.qualify("relative")).isAbsolute());
        assertEquals(qualified, storage.qualify(qualified));
    }

    @Test
    void openWriteDelete() throws Exception {
        String path = tempDir.resolve("base/indexDirectory.1.w").toString();
        assertFalse(storage.exists(path));
        try (Directory directory = storage.openDirectory(path)) {
            try (IndexOutput output = directory.createOutput("file", IOContext.DEFAULT)) {
                output.writeInt(7);
            }
            assertThat(directory.listAll(), arrayContaining("file"));
        }
        assertTrue(storage.exists(path));

        storage.delete(tempDir.resolve("base").toString(), true);
        assertFalse(storage.exists(path));
        assertFalse(Files.exists(tempDir.resolve("base")));
    }

    @Test
    void deleteMissingIsNoOp() {
        String path = tempDir.resolve("missing").toString();
        storage.delete(path, true);
        storage.delete(path, false);
        assertFalse(storage.exists(path));
    }
}
