package com.phonepe.memsight.core.model;

import lombok.NonNull;

/**
 * Storage partition. All items of a user in one category.
 */
public record PartitionKey(@NonNull String userId, @NonNull MemoryCategory category) {
}
