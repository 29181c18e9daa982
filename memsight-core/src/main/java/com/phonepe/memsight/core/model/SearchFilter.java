package com.phonepe.memsight.core.model;

import lombok.NonNull;

import java.time.Instant;
import java.util.Set;

/**
 * Restricts a search to one user and, when set, a set of categories and items created at or after an instant
 */
public record SearchFilter(@NonNull String userId, Set<MemoryCategory> categories, Instant createdAfter) {

    public SearchFilter(String userId, Set<MemoryCategory> categories) {
        this(userId, categories, null);
    }

    public boolean matches(MemoryItem item) {
        return item.getUserId().equals(userId)
                && (categories == null || categories.isEmpty() || categories.contains(item.getCategory()))
                && (createdAfter == null
                        || (item.getCreatedAt() != null && !item.getCreatedAt().isBefore(createdAfter)));
    }
}
