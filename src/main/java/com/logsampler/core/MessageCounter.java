package com.logsampler.core;

import com.logsampler.model.CounterMode;

/**
 * Thread-safe per-message occurrence counter. Counts start at zero, only grow
 * through {@link #increment} and only shrink through {@link #reset}.
 */
public interface MessageCounter {
    /**
     * Count one more occurrence of the key
     *
     * @return the count after incrementing
     */
    long increment(String key);

    /**
     * Set the key's count back to zero
     */
    void reset(String key);

    /**
     * Current count for the key, zero if never seen
     */
    long get(String key);

    /**
     * Create a counter of the given mode; the geometry only applies to {@link CounterMode#SHARDED}
     */
    static MessageCounter create(CounterMode mode, int shardedWidth, int shardedGroupSize) {
        switch (mode) {
            case SHARDED:
                return new ShardedMessageCounter(shardedWidth, shardedGroupSize);
            case EXACT:
            default:
                return new ExactMessageCounter();
        }
    }
}
