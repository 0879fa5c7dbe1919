package com.pacer.service;

import com.pacer.model.dto.OptimizerStatistics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Request counters and response-time figures owned by the optimizer.
 *
 * All state changes go through the record methods under a private lock,
 * separate from the cache and rate limiter locks. Percentiles are taken over
 * a fixed-size ring of the most recent physical response times.
 */
class OptimizerMetrics {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final long[] recentNanos;

    private int recentCount;
    private int recentNext;

    private long totalRequests;
    private long cachedResponses;
    private long batchedRequests;
    private long failedRequests;
    private long physicalRequests;
    private long totalResponseNanos;
    private long slowestNanos;
    private long fastestNanos = Long.MAX_VALUE;
    private Instant lastUpdated;

    OptimizerMetrics(Clock clock, int sampleSize) {
        this.clock = clock;
        this.recentNanos = new long[Math.max(1, sampleSize)];
    }

    void recordCacheHit() {
        lock.lock();
        try {
            totalRequests++;
            cachedResponses++;
            lastUpdated = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    void recordResponse(Duration responseTime) {
        long nanos = Math.max(0, responseTime.toNanos());
        lock.lock();
        try {
            totalRequests++;
            physicalRequests++;
            totalResponseNanos += nanos;
            slowestNanos = Math.max(slowestNanos, nanos);
            fastestNanos = Math.min(fastestNanos, nanos);

            recentNanos[recentNext] = nanos;
            recentNext = (recentNext + 1) % recentNanos.length;
            recentCount = Math.min(recentCount + 1, recentNanos.length);

            lastUpdated = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    void recordFailure() {
        lock.lock();
        try {
            failedRequests++;
            lastUpdated = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    void recordBatched() {
        lock.lock();
        try {
            batchedRequests++;
            lastUpdated = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    OptimizerStatistics.Requests requestsSnapshot(long deduplicated) {
        lock.lock();
        try {
            return OptimizerStatistics.Requests.builder()
                    .total(totalRequests)
                    .cached(cachedResponses)
                    .batched(batchedRequests)
                    .deduplicated(deduplicated)
                    .failed(failedRequests)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    OptimizerStatistics.Performance performanceSnapshot() {
        lock.lock();
        try {
            long[] sorted = Arrays.copyOf(recentNanos, recentCount);
            Arrays.sort(sorted);

            double avg = physicalRequests > 0 ? seconds(totalResponseNanos / physicalRequests) : 0.0;
            double hitRatio = totalRequests > 0 ? (double) cachedResponses / totalRequests : 0.0;

            return OptimizerStatistics.Performance.builder()
                    .avgResponseTimeSeconds(round(avg, 3))
                    .fastestRequestSeconds(fastestNanos == Long.MAX_VALUE ? 0.0 : round(seconds(fastestNanos), 3))
                    .slowestRequestSeconds(round(seconds(slowestNanos), 3))
                    .p50ResponseTimeSeconds(round(seconds(percentile(sorted, 0.50)), 3))
                    .p95ResponseTimeSeconds(round(seconds(percentile(sorted, 0.95)), 3))
                    .p99ResponseTimeSeconds(round(seconds(percentile(sorted, 0.99)), 3))
                    .cacheHitRatio(round(hitRatio, 3))
                    .lastUpdated(lastUpdated)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // Nearest-rank percentile
    private static long percentile(long[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(quantile * sorted.length);
        return sorted[Math.min(Math.max(rank, 1), sorted.length) - 1];
    }

    private static double seconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
