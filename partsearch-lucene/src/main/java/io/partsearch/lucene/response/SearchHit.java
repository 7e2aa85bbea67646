/*
 * SearchHit.java
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

package io.partsearch.lucene.response;

import com.google.common.collect.ImmutableMap;
import io.partsearch.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * One matching document: where it lives, how well it scored, and its stored fields.
 */
@API(API.Status.EXPERIMENTAL)
public final class SearchHit {
    /**
     * Rank order of hits: score descending, then partition id ascending, then document id ascending.
     * Two distinct hits never compare equal, which keeps merged rankings independent of merge order.
     */
    public static final Comparator<SearchHit> RANK_ORDER = Comparator.comparingDouble((SearchHit hit) -> hit.score).reversed()
            .thenComparingInt(hit -> hit.partitionId)
            .thenComparingInt(hit -> hit.docId);

    private final int partitionId;
    private final int docId;
    private final float score;
    @Nonnull
    private final Map<String, Object> fields;

    public SearchHit(int partitionId, int docId, float score, @Nonnull Map<String, ?> fields) {
        this.partitionId = partitionId;
        this.docId = docId;
        this.score = score;
        this.fields = ImmutableMap.<String, Object>copyOf(fields);
    }

    public int getPartitionId() {
        return partitionId;
    }

    /**
     * The Lucene document id within the partition's index.
     * @return the document id
     */
    public int getDocId() {
        return docId;
    }

    public float getScore() {
        return score;
    }

    /**
     * Stored fields of the document. A field stored more than once is reported with its first value.
     * @return field name to stored value
     */
    @Nonnull
    public Map<String, Object> getFields() {
        return fields;
    }

    @Nullable
    public Object getField(@Nonnull String name) {
        return fields.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchHit that = (SearchHit) o;
        return partitionId == that.partitionId && docId == that.docId
                && Float.compare(that.score, score) == 0 && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionId, docId, score, fields);
    }

    @Override
    public String toString() {
        return "SearchHit{partition=" + partitionId + ", doc=" + docId + ", score=" + score + ", fields=" + fields + "}";
    }
}
