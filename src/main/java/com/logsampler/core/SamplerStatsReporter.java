package com.logsampler.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically logs how many entries the sampler dropped
 */
@Slf4j
public class SamplerStatsReporter {
    private final SamplerStats stats;

    public SamplerStatsReporter(SamplerStats stats) {
        this.stats = stats;
    }

    /**
     * Report drops since the previous run; quiet intervals log nothing
     */
    @Scheduled(fixedRateString = "${log.sampler.report-interval-ms:60000}")
    public void report() {
        long dropped = stats.drainDroppedSinceReport();
        if (dropped > 0) {
            log.info("Log sampler dropped {} entries since last report (forwarded total: {}, dropped total: {})",
                    dropped, stats.getForwarded(), stats.getDropped());
        }
    }
}
