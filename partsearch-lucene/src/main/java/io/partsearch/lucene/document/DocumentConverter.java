/*
 * DocumentConverter.java
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

package io.partsearch.lucene.document;

import io.partsearch.annotation.API;
import org.apache.lucene.document.Document;

import javax.annotation.Nonnull;

/**
 * Turns one source element into the document that is indexed for it. A partition calls the converter once per
 * element, in source order, from a single thread.
 *
 * @param <T> the element type
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface DocumentConverter<T> {
    @Nonnull
    Document convert(@Nonnull T element);
}
