package com.pacer.service.ratelimit;

import com.pacer.config.PacerProperties;

import java.time.Duration;

/**
 * Computes the next backoff after a rate-limit hit.
 *
 * A positive server-suggested delay overrides the configured strategy.
 * The result is always clamped to {@code [min-backoff, max-backoff]}.
 */
final class BackoffPolicy {

    static final double GOLDEN_RATIO = 1.618;

    private BackoffPolicy() {
    }

    static Duration next(Duration current, Duration serverSuggested, PacerProperties.RateLimitConfig config) {
        if (serverSuggested != null && !serverSuggested.isNegative() && !serverSuggested.isZero()) {
            return clamp(serverSuggested, config);
        }

        Duration next = switch (config.getBackoffStrategy()) {
            case LINEAR -> current.plus(config.getMinBackoff());
            case EXPONENTIAL -> scale(current, config.getBackoffMultiplier());
            case FIBONACCI -> scale(current, GOLDEN_RATIO);
        };
        return clamp(next, config);
    }

    private static Duration scale(Duration duration, double factor) {
        return Duration.ofNanos(Math.round(duration.toNanos() * factor));
    }

    private static Duration clamp(Duration value, PacerProperties.RateLimitConfig config) {
        if (value.compareTo(config.getMaxBackoff()) > 0) {
            return config.getMaxBackoff();
        }
        if (value.compareTo(config.getMinBackoff()) < 0) {
            return config.getMinBackoff();
        }
        return value;
    }
}
