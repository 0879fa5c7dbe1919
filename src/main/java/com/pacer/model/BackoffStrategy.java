package com.pacer.model;

/**
 * Growth rule applied to the current backoff on each rate-limit hit that
 * carries no server-suggested delay.
 */
public enum BackoffStrategy {

    /**
     * Add {@code min-backoff} per hit.
     */
    LINEAR,

    /**
     * Multiply by {@code backoff-multiplier} per hit.
     */
    EXPONENTIAL,

    /**
     * Grow by the golden ratio (about 1.618) per hit.
     */
    FIBONACCI
}
