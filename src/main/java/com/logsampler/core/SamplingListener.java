package com.logsampler.core;

import com.logsampler.model.LogEntry;
import com.logsampler.model.SamplingDecision;

/**
 * Callback told about every sampling decision. Invoked on the logging thread,
 * so implementations must be fast and thread-safe.
 */
@FunctionalInterface
public interface SamplingListener {
    void onDecision(LogEntry entry, SamplingDecision decision);
}
