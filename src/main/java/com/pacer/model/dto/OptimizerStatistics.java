package com.pacer.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of the request optimizer: request counters, timings,
 * cache and rate limiter state, enabled features and advisory recommendations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizerStatistics {

    private Requests requests;
    private Performance performance;
    private CacheStatistics cache;
    private RateLimiterStatistics rateLimiter;
    private Optimizations optimizations;

    /**
     * Heuristic hints. Advisory only.
     */
    private List<String> recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Requests {
        private long total;
        private long cached;
        private long batched;
        private long deduplicated;
        private long failed;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Performance {
        private double avgResponseTimeSeconds;
        private double fastestRequestSeconds;
        private double slowestRequestSeconds;
        private double p50ResponseTimeSeconds;
        private double p95ResponseTimeSeconds;
        private double p99ResponseTimeSeconds;
        private double cacheHitRatio;
        private Instant lastUpdated;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Optimizations {
        private boolean connectionPooling;
        private boolean http2;
        private boolean compression;
        private boolean requestBatching;
        private boolean requestDeduplication;
        private boolean caching;
        private boolean embeddedRateLimiting;
    }
}
