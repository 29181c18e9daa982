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

package com.phonepe.memsight.core.tier;

import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.PartitionKey;
import com.phonepe.memsight.core.store.MemoryStore;
import com.phonepe.memsight.core.store.PartitionLocks;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Moves items through WORKING, SHORT_TERM and LONG_TERM.
 * <p>
 * Promotion happens on access: once the number of accesses inside the sliding window exceeds the threshold of the
 * current tier the item moves up exactly one tier and its window starts afresh. {@link #tick()} only removes items,
 * either because they sat idle too long or because their tier in the partition is over capacity (least recently
 * accessed first). Tiers never move backwards.
 */
@Slf4j
public class TieredMemoryManager {
    private static final Comparator<MemoryItem> LEAST_RECENTLY_USED = Comparator
            .comparing((MemoryItem item) -> lastTouched(item))
            .thenComparing(MemoryItem::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(MemoryItem::getId);

    private final MemoryStore store;
    private final PartitionLocks locks;
    private final TierConfig config;
    private final Clock clock;

    @Builder
    public TieredMemoryManager(@NonNull MemoryStore store, PartitionLocks locks, TierConfig config, Clock clock) {
        this.store = store;
        this.locks = Objects.requireNonNullElseGet(locks, PartitionLocks::new);
        this.config = Objects.requireNonNullElse(config, TierConfig.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        if (this.config.getWorkingPromotionThreshold() >= this.config.getShortTermPromotionThreshold()) {
            throw new ParameterValidationError(
                    "Working promotion threshold must be lower than the short term promotion threshold");
        }
    }

    /**
     * State of a freshly created item: WORKING tier, no accesses
     */
    public MemoryItem initialize(MemoryItem item) {
        final var now = clock.instant();
        return item.toBuilder()
                .tier(MemoryTier.WORKING)
                .createdAt(Objects.requireNonNullElse(item.getCreatedAt(), now))
                .lastAccessedAt(Objects.requireNonNullElse(item.getLastAccessedAt(), now))
                .accessCount(0)
                .clearRecentAccesses()
                .build();
    }

    /**
     * Record a retrieval hit and promote if the item became hot enough
     *
     * @return the item after the access, empty if it no longer exists
     */
    public Optional<MemoryItem> onAccess(@NonNull MemoryItem item) {
        final var now = clock.instant();
        final var updated = locks.withLock(item.partitionKey(),
                                           () -> store.update(item.getId(), current -> recordAccess(current, now)));
        updated.filter(after -> after.getTier() != item.getTier())
                .ifPresent(after -> log.info("Promoted item {} of user {} from {} to {}",
                                             after.getId(), after.getUserId(), item.getTier(), after.getTier()));
        return updated;
    }

    /**
     * One maintenance sweep over every partition
     */
    public TickResult tick() {
        final var partitions = store.partitions();
        if (partitions.isEmpty()) {
            return TickResult.EMPTY;
        }
        final var now = clock.instant();
        var expired = 0;
        var evicted = 0;
        for (final var partition : partitions) {
            for (final var tier : MemoryTier.values()) {
                expired += expire(partition, tier, now);
                evicted += enforceCapacity(partition, tier);
            }
        }
        if (expired > 0 || evicted > 0) {
            log.info("Tier sweep over {} partitions expired {} and evicted {} items",
                     partitions.size(), expired, evicted);
        }
        return new TickResult(partitions.size(), expired, evicted);
    }

    private MemoryItem recordAccess(MemoryItem current, Instant now) {
        final var windowStart = now.minus(config.getPromotionWindow());
        final var window = new ArrayList<Instant>();
        if (current.getRecentAccesses() != null) {
            current.getRecentAccesses()
                    .stream()
                    .filter(instant -> instant.isAfter(windowStart))
                    .forEach(window::add);
        }
        window.add(now);
        final var builder = current.toBuilder()
                .accessCount(current.getAccessCount() + 1)
                .lastAccessedAt(now)
                .clearRecentAccesses();
        final var threshold = config.promotionThreshold(current.getTier());
        final var next = current.getTier().next();
        if (threshold.isPresent() && next.isPresent() && window.size() > threshold.getAsInt()) {
            return builder.tier(next.get()).build();
        }
        //Only as many entries as the largest threshold can ever need
        final var keep = Math.min(window.size(), config.getShortTermPromotionThreshold() + 1);
        return builder.recentAccesses(window.subList(window.size() - keep, window.size())).build();
    }

    private int expire(PartitionKey partition, MemoryTier tier, Instant now) {
        final var maxIdle = config.maxIdle(tier);
        if (maxIdle == null) {
            return 0;
        }
        final var cutoff = now.minus(maxIdle);
        var expired = 0;
        for (final var item : store.scan(partition.userId(), Set.of(partition.category()), tier)) {
            if (lastTouched(item).isBefore(cutoff)
                    && removeIfUnchanged(item, current -> lastTouched(current).isBefore(cutoff))) {
                log.info("Expired idle item {} of user {} from {}", item.getId(), item.getUserId(), tier);
                expired++;
            }
        }
        return expired;
    }

    private int enforceCapacity(PartitionKey partition, MemoryTier tier) {
        final var capacity = config.capacity(tier);
        if (capacity <= 0 || store.count(partition.userId(), partition.category(), tier) <= capacity) {
            return 0;
        }
        final var victims = store.scan(partition.userId(), Set.of(partition.category()), tier)
                .stream()
                .sorted(LEAST_RECENTLY_USED)
                .toList();
        var evicted = 0;
        for (final var victim : victims) {
            final boolean removed = locks.withLock(
                    partition,
                    () -> store.count(partition.userId(), partition.category(), tier) > capacity
                            && removeLocked(victim, current -> lastTouched(current).equals(lastTouched(victim))));
            if (removed) {
                log.info("Evicted item {} of user {} from {} (capacity {})",
                         victim.getId(), victim.getUserId(), tier, capacity);
                evicted++;
            }
            else if (store.count(partition.userId(), partition.category(), tier) <= capacity) {
                break;
            }
        }
        return evicted;
    }

    private boolean removeIfUnchanged(MemoryItem item, Predicate<MemoryItem> stillEligible) {
        return locks.withLock(item.partitionKey(), () -> removeLocked(item, stillEligible));
    }

    /**
     * Caller holds the partition lock. The item is removed only if it is still in the same partition and tier.
     */
    private boolean removeLocked(MemoryItem item, Predicate<MemoryItem> stillEligible) {
        final var current = store.get(item.getId()).orElse(null);
        if (current == null
                || current.getTier() != item.getTier()
                || !current.partitionKey().equals(item.partitionKey())
                || !stillEligible.test(current)) {
            return false;
        }
        return store.delete(item.getId()).isPresent();
    }

    private static Instant lastTouched(MemoryItem item) {
        return Objects.requireNonNullElse(item.getLastAccessedAt(),
                                          Objects.requireNonNullElse(item.getCreatedAt(), Instant.EPOCH));
    }
}
