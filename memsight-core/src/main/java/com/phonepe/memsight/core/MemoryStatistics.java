package com.phonepe.memsight.core;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.QueryIntent;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of what is stored for a user, plus engine wide classification counters
 */
@Value
@Builder
public class MemoryStatistics {
    String userId;
    long totalItems;
    Map<MemoryCategory, Long> itemsByCategory;
    Map<MemoryTier, Long> itemsByTier;
    /**
     * Per (user, category) capacity of each tier, zero for unbounded
     */
    Map<MemoryTier, Integer> tierCapacities;
    long itemsWithoutEmbedding;
    Map<MemoryCategory, Long> classifiedByCategory;
    Map<QueryIntent, Long> queriesByIntent;
}
