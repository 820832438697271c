/**
 * Table of per-key mutual exclusion locks
 * Locks are reference counted and dropped once no thread holds or waits on them
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.cache;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public class KeyedLockRegistry {

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    private final ConcurrentHashMap<String, CountedLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the lock for the key
     * Reentrant for the owning thread
     */
    public <T> T withLock(String key, Supplier<T> action) {
        CountedLock counted = locks.compute(key, (k, existing) -> {
            CountedLock lock = existing != null ? existing : new CountedLock();
            lock.holders++;
            return lock;
        });
        counted.lock.lock();
        try {
            return action.get();
        } finally {
            counted.lock.unlock();
            locks.computeIfPresent(key, (k, lock) -> --lock.holders == 0 ? null : lock);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Number of keys currently locked or awaited
     */
    public int activeKeys() {
        return locks.size();
    }
}
