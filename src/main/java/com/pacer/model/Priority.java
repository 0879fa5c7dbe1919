package com.pacer.model;

import java.time.Duration;

/**
 * Request priority class. Each class carries the minimum spacing the rate
 * limiter keeps between consecutive requests of that class.
 */
public enum Priority {

    HIGH(Duration.ofMillis(50)),

    NORMAL(Duration.ofMillis(100)),

    LOW(Duration.ofMillis(200));

    private final Duration minInterval;

    Priority(Duration minInterval) {
        this.minInterval = minInterval;
    }

    public Duration getMinInterval() {
        return minInterval;
    }
}
