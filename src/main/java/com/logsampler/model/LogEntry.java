package com.logsampler.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A single log record. Sampling only looks at the level and the message.
 */
@Value
@Builder
public class LogEntry {
    @NonNull
    Level level;

    /**
     * Message text, also the sampling key
     */
    @NonNull
    @Builder.Default
    String message = "";

    String loggerName;

    @NonNull
    @Builder.Default
    Instant time = Instant.now();

    public static LogEntry of(Level level, String message) {
        return LogEntry.builder().level(level).message(message).build();
    }
}
