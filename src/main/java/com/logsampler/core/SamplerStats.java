package com.logsampler.core;

import com.logsampler.model.LogEntry;
import com.logsampler.model.SamplingDecision;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of forwarded and dropped entries
 */
public class SamplerStats implements SamplingListener {
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong droppedSinceReport = new AtomicLong();

    @Override
    public void onDecision(LogEntry entry, SamplingDecision decision) {
        if (decision == SamplingDecision.FORWARD) {
            forwarded.incrementAndGet();
        } else {
            dropped.incrementAndGet();
            droppedSinceReport.incrementAndGet();
        }
    }

    public long getForwarded() {
        return forwarded.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    /**
     * Dropped entries since the previous call, resetting the interval count
     */
    public long drainDroppedSinceReport() {
        return droppedSinceReport.getAndSet(0L);
    }
}
