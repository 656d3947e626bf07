package com.logsampler.model;

/**
 * Counter implementations a sampler can be built on
 */
public enum CounterMode {
    /**
     * One independent counter per distinct message; no collisions,
     * memory grows with the number of distinct messages ever seen
     */
    EXACT,

    /**
     * Fixed-size table of lock-striped slots; constant memory,
     * messages that hash to the same slot share a count
     */
    SHARDED
}
