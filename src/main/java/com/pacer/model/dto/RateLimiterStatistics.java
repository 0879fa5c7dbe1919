package com.pacer.model.dto;

import com.pacer.model.BackoffStrategy;
import com.pacer.model.RateLimiterRegime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Point-in-time statistics of the adaptive rate limiter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimiterStatistics {

    private Configuration config;
    private CurrentState currentState;
    private Performance performance;
    private List<String> recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Configuration {
        private int maxRequestsPerWindow;
        private double windowSeconds;
        private int burstLimit;
        private double burstWindowSeconds;
        private BackoffStrategy backoffStrategy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentState {
        private RateLimiterRegime regime;
        private int requestsInWindow;
        private int requestsInBurstWindow;
        private int consecutiveRateLimits;
        private double currentBackoffSeconds;
        private double currentRatePerSecond;
        private double avgRequestIntervalSeconds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Performance {
        private long totalRequests;
        private long requestsDelayed;
        private double efficiencyPercentage;
        private double avgDelaySeconds;
        private long rateLimitHits;
        private long backoffEvents;
    }
}
