package com.logsampler.test;

import com.logsampler.core.SamplerStats;
import com.logsampler.core.SamplerStatsReporter;
import com.logsampler.model.Level;
import com.logsampler.model.LogEntry;
import com.logsampler.model.SamplingDecision;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SamplerStatsReporterTest {

    @Test
    void testReportDrainsIntervalCount() {
        SamplerStats stats = new SamplerStats();
        LogEntry entry = LogEntry.of(Level.INFO, "foo");
        stats.onDecision(entry, SamplingDecision.FORWARD);
        stats.onDecision(entry, SamplingDecision.DROP);
        stats.onDecision(entry, SamplingDecision.DROP);

        new SamplerStatsReporter(stats).report();

        assertEquals(0, stats.drainDroppedSinceReport());
        assertEquals(1, stats.getForwarded());
        assertEquals(2, stats.getDropped());
    }

    @Test
    void testQuietIntervalReportsNothing() {
        SamplerStats stats = new SamplerStats();
        SamplerStatsReporter reporter = new SamplerStatsReporter(stats);

        reporter.report();
        stats.onDecision(LogEntry.of(Level.INFO, "foo"), SamplingDecision.DROP);
        reporter.report();

        assertEquals(0, stats.drainDroppedSinceReport());
        assertEquals(1, stats.getDropped());
    }
}
