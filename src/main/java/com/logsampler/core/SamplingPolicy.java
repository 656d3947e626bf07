package com.logsampler.core;

import com.google.common.base.Preconditions;
import com.logsampler.model.SamplingDecision;
import lombok.Value;

import java.time.Duration;

/**
 * Burst-then-cadence sampling rule: the first {@code first} occurrences of a
 * message within a tick are forwarded, after that only every
 * {@code thereafter}-th one is. The count restarts {@code tick} after the
 * message first exceeds its burst allowance.
 */
@Value
public class SamplingPolicy {
    Duration tick;
    int first;
    int thereafter;

    /**
     * @throws IllegalArgumentException if {@code tick} is not positive,
     *                                  {@code first} is negative or
     *                                  {@code thereafter} is less than one
     */
    public SamplingPolicy(Duration tick, int first, int thereafter) {
        Preconditions.checkNotNull(tick, "tick");
        Preconditions.checkArgument(!tick.isNegative() && !tick.isZero(), "tick must be positive: %s", tick);
        Preconditions.checkArgument(first >= 0, "first must not be negative: %s", first);
        Preconditions.checkArgument(thereafter >= 1, "thereafter must be at least 1: %s", thereafter);
        this.tick = tick;
        this.first = first;
        this.thereafter = thereafter;
    }

    /**
     * Decision for the {@code count}-th occurrence of a message in the current tick
     */
    public SamplingDecision decide(long count) {
        if (count <= first) {
            return SamplingDecision.FORWARD;
        }
        return (count - first) % thereafter == 0 ? SamplingDecision.FORWARD : SamplingDecision.DROP;
    }

    /**
     * Whether the {@code count}-th occurrence is the one that crosses the burst
     * allowance and should arm the reset
     */
    public boolean armsReset(long count) {
        return count == (long) first + 1;
    }
}
