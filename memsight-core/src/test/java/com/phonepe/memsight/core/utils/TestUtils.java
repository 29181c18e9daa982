package com.phonepe.memsight.core.utils;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.UUID;

/**
 * Fixtures shared by store and engine tests
 */
@UtilityClass
public class TestUtils {
    public static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

    public static MemoryItem item(String userId, MemoryCategory category, String content) {
        return item(UUID.randomUUID().toString(), userId, category, MemoryTier.WORKING, content);
    }

    public static MemoryItem item(String id, String userId, MemoryCategory category, MemoryTier tier, String content) {
        return MemoryItem.builder()
                .id(id)
                .userId(userId)
                .content(content)
                .category(category)
                .classificationConfidence(0.6)
                .tier(tier)
                .createdAt(EPOCH)
                .lastAccessedAt(EPOCH)
                .build();
    }
}
