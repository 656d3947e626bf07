package com.logsampler.model;

/**
 * Severity of a log entry, ordered from least to most severe
 */
public enum Level {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Whether an entry at this level passes a threshold of {@code minimum}
     */
    public boolean isAtLeast(Level minimum) {
        return compareTo(minimum) >= 0;
    }
}
