package com.phonepe.memsight.storage.memory;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryTier;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Stored form of a memory item. Timestamps are epoch millis.
 */
@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESMemoryDocument {
    String id;

    String userId;

    String content;

    float[] embedding;

    MemoryCategory category;

    double classificationConfidence;

    MemoryTier tier;

    Long createdAt;

    Long lastAccessedAt;

    long accessCount;

    List<Long> recentAccesses;

    Map<String, Object> metadata;
}
