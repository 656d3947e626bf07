package com.logsampler.core;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Counter with one independent {@link AtomicLong} per distinct key.
 *
 * <p>Lookups take the table's read lock; only the first occurrence of a key
 * takes the write lock to create its counter. Increments happen on the
 * per-key counter outside the table lock. Entries are never removed, so
 * memory grows with the number of distinct keys ever counted.
 */
public class ExactMessageCounter implements MessageCounter {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AtomicLong> counts = new HashMap<>();

    @Override
    public long increment(String key) {
        AtomicLong count = lookup(key);
        if (count != null) {
            return count.incrementAndGet();
        }

        lock.writeLock().lock();
        try {
            count = counts.get(key);
            if (count != null) {
                return count.incrementAndGet();
            }
            counts.put(key, new AtomicLong(1L));
            return 1L;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Zero the key's count in place. Resetting a key that was never counted
     * does nothing and creates no entry.
     */
    @Override
    public void reset(String key) {
        AtomicLong count = lookup(key);
        if (count != null) {
            count.set(0L);
        }
    }

    @Override
    public long get(String key) {
        AtomicLong count = lookup(key);
        return count != null ? count.get() : 0L;
    }

    /**
     * Number of distinct keys tracked
     */
    public int size() {
        lock.readLock().lock();
        try {
            return counts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private AtomicLong lookup(String key) {
        lock.readLock().lock();
        try {
            return counts.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }
}
