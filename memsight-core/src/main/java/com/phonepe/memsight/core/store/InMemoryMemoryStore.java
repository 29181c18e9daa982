package com.phonepe.memsight.core.store;

import com.phonepe.memsight.core.errors.ParameterValidationError;
import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.MemoryItem;
import com.phonepe.memsight.core.model.MemoryTier;
import com.phonepe.memsight.core.model.PartitionKey;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Memory store that keeps everything on heap. Subclasses can make it durable by overriding {@link #persist} and
 * {@link #erase}, which run under the partition write lock before the in-memory state changes.
 */
@Slf4j
public class InMemoryMemoryStore implements MemoryStore {

    private static final class Partition {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Set<String> ids = new HashSet<>();
        private final Map<MemoryTier, Long> counts = new EnumMap<>(MemoryTier.class);

        private void add(MemoryItem item) {
            ids.add(item.getId());
            counts.merge(item.getTier(), 1L, Long::sum);
        }

        private void remove(MemoryItem item) {
            if (ids.remove(item.getId())) {
                counts.merge(item.getTier(), -1L, Long::sum);
            }
        }
    }

    private final Map<String, MemoryItem> items = new ConcurrentHashMap<>();
    private final Map<PartitionKey, Partition> partitions = new ConcurrentHashMap<>();

    @Override
    public MemoryItem insert(@NonNull MemoryItem item) {
        validate(item);
        while (true) {
            final var existing = items.get(item.getId());
            if (existing != null && !existing.getUserId().equals(item.getUserId())) {
                throw new ParameterValidationError("Item %s belongs to another user".formatted(item.getId()));
            }
            final var applied = swap(existing, item);
            if (applied) {
                return item;
            }
        }
    }

    @Override
    public Optional<MemoryItem> update(@NonNull String id, @NonNull UnaryOperator<MemoryItem> mutation) {
        while (true) {
            final var existing = items.get(id);
            if (existing == null) {
                return Optional.empty();
            }
            final var updated = Objects.requireNonNull(mutation.apply(existing), "Mutation returned null");
            if (!id.equals(updated.getId()) || !existing.getUserId().equals(updated.getUserId())) {
                throw new ParameterValidationError("Id and user of item %s can not be changed".formatted(id));
            }
            validate(updated);
            if (swap(existing, updated)) {
                return Optional.of(updated);
            }
            log.debug("Item {} changed while updating, retrying", id);
        }
    }

    @Override
    public MemoryItem replace(@NonNull String oldId, @NonNull MemoryItem item) {
        validate(item);
        if (oldId.equals(item.getId())) {
            return insert(item);
        }
        while (true) {
            final var old = items.get(oldId);
            if (old == null) {
                return insert(item);
            }
            final var existing = items.get(item.getId());
            if (!old.getUserId().equals(item.getUserId())
                    || (existing != null && !existing.getUserId().equals(item.getUserId()))) {
                throw new ParameterValidationError("Item %s belongs to another user".formatted(oldId));
            }
            final var keys = new ArrayList<PartitionKey>();
            keys.add(item.partitionKey());
            if (!keys.contains(old.partitionKey())) {
                keys.add(old.partitionKey());
            }
            if (existing != null && !keys.contains(existing.partitionKey())) {
                keys.add(existing.partitionKey());
            }
            final var applied = withWriteLocks(keys, () -> {
                if (items.get(oldId) != old || items.get(item.getId()) != existing) {
                    return false;
                }
                persist(item);
                try {
                    erase(old);
                }
                catch (RuntimeException e) {
                    undoPersist(existing, item, e);
                    throw e;
                }
                if (existing != null) {
                    partition(existing.partitionKey()).remove(existing);
                }
                items.put(item.getId(), item);
                partition(item.partitionKey()).add(item);
                items.remove(oldId);
                partition(old.partitionKey()).remove(old);
                return true;
            });
            if (applied) {
                log.debug("Replaced item {} with {}", oldId, item.getId());
                return item;
            }
        }
    }

    @Override
    public Optional<MemoryItem> delete(@NonNull String id) {
        while (true) {
            final var existing = items.get(id);
            if (existing == null) {
                return Optional.empty();
            }
            final var deleted = withWriteLocks(List.of(existing.partitionKey()), () -> {
                if (items.get(id) != existing) {
                    return false;
                }
                erase(existing);
                items.remove(id);
                partition(existing.partitionKey()).remove(existing);
                return true;
            });
            if (deleted) {
                return Optional.of(existing);
            }
        }
    }

    @Override
    public Optional<MemoryItem> get(@NonNull String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<MemoryItem> scan(@NonNull String userId, Set<MemoryCategory> categories, MemoryTier tier) {
        final var keys = keys(userId, categories);
        final var locks = keys.stream()
                .map(key -> partition(key).lock.readLock())
                .toList();
        locks.forEach(Lock::lock);
        try {
            final var result = new ArrayList<MemoryItem>();
            for (final var key : keys) {
                for (final var id : partition(key).ids) {
                    final var item = items.get(id);
                    if (item != null
                            && item.getUserId().equals(userId)
                            && item.getCategory() == key.category()
                            && (tier == null || item.getTier() == tier)) {
                        result.add(item);
                    }
                }
            }
            return result;
        }
        finally {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    @Override
    public long count(@NonNull String userId, @NonNull MemoryCategory category, MemoryTier tier) {
        final var partition = partitions.get(new PartitionKey(userId, category));
        if (partition == null) {
            return 0;
        }
        final var lock = partition.lock.readLock();
        lock.lock();
        try {
            if (tier == null) {
                return partition.ids.size();
            }
            return partition.counts.getOrDefault(tier, 0L);
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public Set<PartitionKey> partitions() {
        return partitions.entrySet()
                .stream()
                .filter(entry -> {
                    final var lock = entry.getValue().lock.readLock();
                    lock.lock();
                    try {
                        return !entry.getValue().ids.isEmpty();
                    }
                    finally {
                        lock.unlock();
                    }
                })
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Called before an item is written, under the write lock of its partition(s). Throwing aborts the write.
     */
    protected void persist(MemoryItem item) {
        //Nothing to do for heap only storage
    }

    /**
     * Called before an item is removed, under the write lock of its partition. Throwing aborts the removal.
     */
    protected void erase(MemoryItem item) {
        //Nothing to do for heap only storage
    }

    /**
     * Load already persisted items without calling {@link #persist}
     */
    protected void restore(Collection<MemoryItem> restored) {
        restored.forEach(item -> withWriteLocks(List.of(item.partitionKey()), () -> {
            items.put(item.getId(), item);
            partition(item.partitionKey()).add(item);
            return null;
        }));
    }

    /**
     * Swap existing for updated if existing is still the current value. Moves between partitions hold both
     * partition write locks so a scan never sees the item twice or not at all.
     */
    private boolean swap(MemoryItem existing, MemoryItem updated) {
        final var keys = new ArrayList<PartitionKey>();
        keys.add(updated.partitionKey());
        if (existing != null && !existing.partitionKey().equals(updated.partitionKey())) {
            keys.add(existing.partitionKey());
        }
        return withWriteLocks(keys, () -> {
            if (items.get(updated.getId()) != existing) {
                return false;
            }
            persist(updated);
            if (existing != null) {
                partition(existing.partitionKey()).remove(existing);
            }
            items.put(updated.getId(), updated);
            partition(updated.partitionKey()).add(updated);
            return true;
        });
    }

    /**
     * Put back what was stored under the written item's id before a failed replace
     */
    private void undoPersist(MemoryItem previous, MemoryItem written, RuntimeException failure) {
        try {
            if (previous == null) {
                erase(written);
            }
            else {
                persist(previous);
            }
        }
        catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.error("Could not undo the write of item {}: {}", written.getId(), e.getMessage());
        }
    }

    private <T> T withWriteLocks(List<PartitionKey> keys, Supplier<T> action) {
        final var locks = keys.stream()
                .sorted(Comparator.comparing(PartitionKey::category))
                .map(key -> partition(key).lock.writeLock())
                .toList();
        locks.forEach(Lock::lock);
        try {
            return action.get();
        }
        finally {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    private Partition partition(PartitionKey key) {
        return partitions.computeIfAbsent(key, k -> new Partition());
    }

    private static List<PartitionKey> keys(String userId, Set<MemoryCategory> categories) {
        final var requested = categories == null || categories.isEmpty()
                              ? List.of(MemoryCategory.values())
                              : categories.stream().sorted().toList();
        return requested.stream()
                .map(category -> new PartitionKey(userId, category))
                .toList();
    }

    private static void validate(MemoryItem item) {
        if (item.getId() == null || item.getUserId() == null || item.getCategory() == null
                || item.getTier() == null) {
            throw new ParameterValidationError("Item must have id, user, category and tier");
        }
    }
}
