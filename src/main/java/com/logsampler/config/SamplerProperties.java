package com.logsampler.config;

import com.logsampler.core.ShardedMessageCounter;
import com.logsampler.model.CounterMode;
import com.logsampler.model.Level;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the sampled logging facility, bound from {@code log.sampler.*}
 */
@Data
@ConfigurationProperties(prefix = "log.sampler")
public class SamplerProperties {
    /**
     * How long after a message starts being throttled its count is reset
     */
    private Duration tick = Duration.ofSeconds(1);

    /**
     * Occurrences of a message forwarded unconditionally per tick
     */
    private int first = 100;

    /**
     * Once throttled, forward every this many occurrences
     */
    private int thereafter = 100;

    /**
     * Exact per-message counts, or a fixed-size table where colliding messages share a count
     */
    private CounterMode counterMode = CounterMode.EXACT;

    private int shardedWidth = ShardedMessageCounter.DEFAULT_WIDTH;

    private int shardedGroupSize = ShardedMessageCounter.DEFAULT_GROUP_SIZE;

    /**
     * SLF4J logger that sampled entries are written to
     */
    private String loggerName = "sampled";

    private Level level = Level.INFO;

    /**
     * Interval between dropped-entry reports
     */
    private long reportIntervalMs = 60_000L;
}
