package com.logsampler.model;

/**
 * Outcome of sampling a single log entry
 */
public enum SamplingDecision {
    /**
     * Entry is passed on to the wrapped facility
     */
    FORWARD,

    /**
     * Entry is silently discarded
     */
    DROP
}
