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
package com.phonepe.memsight.core.store;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.PartitionKey;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Durable storage for memory items, partitioned by (user, category). Implementations throw
 * {@link com.phonepe.memsight.core.errors.MemoryStoreException} when the backend is unavailable.
 */
public interface MemoryStore {
    /**
     * Store an item. Idempotent on id: inserting an existing id replaces it, moving it between partitions if the
     * category changed.
     *
     * @return the stored item
     */
    MemoryItem insert(MemoryItem item);

    /**
     * Atomically replace an item with the result of the mutation. The mutation may be invoked more than once and
     * must not have side effects. Id and user can not be changed.
     *
     * @return the updated item, empty if no item exists with the id
     */
    Optional<MemoryItem> update(String id, UnaryOperator<MemoryItem> mutation);

    /**
     * Store an item in place of another one of the same user. Readers see either the old item or the new one, never
     * both and never neither. When the old item is already gone this is a plain insert. If the write fails, the old
     * item is still stored and the new one is not.
     *
     * @return the stored item
     */
    MemoryItem replace(String oldId, MemoryItem item);

    /**
     * @return the removed item, empty if nothing was stored under the id
     */
    Optional<MemoryItem> delete(String id);

    Optional<MemoryItem> get(String id);

    /**
     * Items stored under the given ids. Missing ids are skipped.
     */
    default List<MemoryItem> getAll(Collection<String> ids) {
        return ids.stream()
                .map(this::get)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Items of a user in the given categories, optionally restricted to a tier. Only the requested partitions are
     * touched and the result is a consistent snapshot across them.
     */
    List<MemoryItem> scan(String userId, Set<MemoryCategory> categories, MemoryTier tier);

    default List<MemoryItem> scan(String userId, Set<MemoryCategory> categories) {
        return scan(userId, categories, null);
    }

    /**
     * Number of items in a partition, all tiers when tier is null
     */
    long count(String userId, MemoryCategory category, MemoryTier tier);

    /**
     * Non-empty partitions
     */
    Set<PartitionKey> partitions();
}
