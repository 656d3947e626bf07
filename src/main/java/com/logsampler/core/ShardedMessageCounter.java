package com.logsampler.core;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * Approximate counter over a fixed table of slots. A key is placed into slot
 * {@code hash(key) mod width}; slots are grouped into buckets of
 * {@code groupSize}, each guarded by its own monitor. With the default group
 * of eight longs a bucket's counts fill one 64-byte cache line.
 *
 * <p>Memory is constant regardless of how many distinct messages are seen.
 * Keys that land in the same slot share a single count, so a sampler on this
 * counter may throttle a message early when another message collides with it.
 * Use {@link ExactMessageCounter} where that is not acceptable.
 */
public class ShardedMessageCounter implements MessageCounter {
    public static final int DEFAULT_WIDTH = 8192;
    public static final int DEFAULT_GROUP_SIZE = 8;

    @Getter
    private final int width;
    @Getter
    private final int groupSize;
    private final Bucket[] buckets;

    public ShardedMessageCounter() {
        this(DEFAULT_WIDTH, DEFAULT_GROUP_SIZE);
    }

    public ShardedMessageCounter(int width, int groupSize) {
        Preconditions.checkArgument(width > 0, "width must be positive: %s", width);
        Preconditions.checkArgument(groupSize > 0, "groupSize must be positive: %s", groupSize);
        Preconditions.checkArgument(width % groupSize == 0,
                "width %s must be a multiple of groupSize %s", width, groupSize);
        this.width = width;
        this.groupSize = groupSize;
        this.buckets = new Bucket[width / groupSize];
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new Bucket(groupSize);
        }
    }

    @Override
    public long increment(String key) {
        int slot = slotOf(key);
        return buckets[slot / groupSize].increment(slot % groupSize);
    }

    @Override
    public void reset(String key) {
        int slot = slotOf(key);
        buckets[slot / groupSize].reset(slot % groupSize);
    }

    @Override
    public long get(String key) {
        int slot = slotOf(key);
        return buckets[slot / groupSize].get(slot % groupSize);
    }

    /**
     * Slot a key maps to in this table
     */
    public int slotOf(String key) {
        return SlotHash.slot(key, width);
    }

    private static final class Bucket {
        private final long[] counts;

        Bucket(int size) {
            this.counts = new long[size];
        }

        synchronized long increment(int index) {
            return ++counts[index];
        }

        synchronized void reset(int index) {
            counts[index] = 0L;
        }

        synchronized long get(int index) {
            return counts[index];
        }
    }
}
