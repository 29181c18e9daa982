package com.phonepe.memsight.core.store;

import com.google.common.util.concurrent.Striped;
import com.phonepe.memsight.core.model.PartitionKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Serializes multi step read-evaluate-write sequences on a partition (conflict resolution, tier transitions).
 * Locks for several partitions are always taken in the same order.
 */
public class PartitionLocks {
    private static final int DEFAULT_STRIPES = 64;

    private final Striped<Lock> locks;

    public PartitionLocks() {
        this(DEFAULT_STRIPES);
    }

    public PartitionLocks(int stripes) {
        this.locks = Striped.lock(stripes);
    }

    public <T> T withLock(PartitionKey key, Supplier<T> action) {
        return withLocks(List.of(key), action);
    }

    public <T> T withLocks(Collection<PartitionKey> keys, Supplier<T> action) {
        final var acquired = new ArrayList<Lock>();
        try {
            for (final var lock : locks.bulkGet(keys)) {
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        }
        finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
}
