/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single stored memory. Instances are immutable, every change produces a new value that the store swaps in
 * atomically.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@FieldNameConstants
public class MemoryItem {
    public static final String META_CONTENT_HASH = "content_hash";
    public static final String META_SUPERSEDES = "supersedes";
    public static final String META_SUPERSEDED_CONTENT = "superseded_content";
    public static final String META_MERGED_FROM = "merged_from";
    public static final String META_SUBCATEGORIES = "subcategories";
    public static final String META_CLASSIFIED_BY = "classified_by";

    @JsonPropertyDescription("Unique id, assigned at creation")
    String id;

    @JsonPropertyDescription("Owner of the memory. Queries never cross users")
    String userId;

    @JsonPropertyDescription("Stored text")
    String content;

    @JsonPropertyDescription("Cached embedding of the content. Null when the embedding service was unavailable")
    @Getter(AccessLevel.NONE)
    @With(AccessLevel.NONE)
    float[] embedding;

    MemoryCategory category;

    double classificationConfidence;

    MemoryTier tier;

    Instant createdAt;

    Instant lastAccessedAt;

    long accessCount;

    @JsonPropertyDescription("Access instants inside the current promotion window")
    @Singular
    List<Instant> recentAccesses;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * Copy of the cached embedding, changing it does not change the item
     */
    public float[] getEmbedding() {
        return copy(embedding);
    }

    public MemoryItem withEmbedding(float[] embedding) {
        return toBuilder().embedding(embedding).build();
    }

    @JsonIgnore
    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    @JsonIgnore
    public PartitionKey partitionKey() {
        return new PartitionKey(userId, category);
    }

    private static float[] copy(float[] vector) {
        return vector == null ? null : vector.clone();
    }

    public static class MemoryItemBuilder {
        public MemoryItemBuilder embedding(float[] embedding) {
            this.embedding = copy(embedding);
            return this;
        }
    }
}
