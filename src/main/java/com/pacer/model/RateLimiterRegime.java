package com.pacer.model;

/**
 * Admission regime the rate limiter is currently operating in.
 */
public enum RateLimiterRegime {
    NORMAL,
    BURST_LIMITED,
    WINDOW_LIMITED,
    BACKING_OFF,
    ADAPTING
}
