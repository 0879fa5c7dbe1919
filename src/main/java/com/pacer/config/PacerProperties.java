package com.pacer.config;

import com.pacer.model.BackoffStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for Pacer.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pacer")
public class PacerProperties {

    private ConnectionConfig connection = new ConnectionConfig();
    private BatchConfig batch = new BatchConfig();
    private CacheConfig cache = new CacheConfig();
    private RequestConfig request = new RequestConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();

    @Data
    public static class ConnectionConfig {
        private int maxConnections = 10;
        private int maxKeepaliveConnections = 5;
        private Duration keepaliveExpiry = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private Duration poolAcquireTimeout = Duration.ofSeconds(5);
        private boolean http2 = true;
        private boolean compression = true;
    }

    @Data
    public static class BatchConfig {
        private boolean enabled = true;
        private int maxBatchSize = 50;
        private Duration timeout = Duration.ofMillis(500);
        private Duration maxWait = Duration.ofSeconds(2);
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private int maxSizeMb = 50;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Duration maxTtl = Duration.ofHours(1);
        private int fallbackEntrySizeBytes = 1024;

        /**
         * Explicit byte capacity. Takes precedence over {@code maxSizeMb} when positive.
         */
        private long maxSizeBytes = 0;

        public long effectiveMaxBytes() {
            return maxSizeBytes > 0 ? maxSizeBytes : (long) maxSizeMb * 1024 * 1024;
        }
    }

    @Data
    public static class RequestConfig {
        private boolean deduplication = true;
        private boolean metricsEnabled = true;
        private Duration slowRequestThreshold = Duration.ofSeconds(5);
        private int responseTimeSamples = 1000;
    }

    @Data
    public static class RateLimitConfig {
        /**
         * Whether the optimizer acquires admission and reports feedback itself.
         */
        private boolean embedded = true;
        private int maxRequestsPerWindow = 80;
        private Duration window = Duration.ofSeconds(10);
        private int burstLimit = 20;
        private Duration burstWindow = Duration.ofSeconds(2);
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration minBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double backoffMultiplier = 2.0;
        private boolean jitterEnabled = true;
        private boolean adaptiveEnabled = true;
        private Duration adaptiveInterval = Duration.ofMinutes(5);
        private int adaptiveMinSamples = 10;
        private int adaptiveStep = 5;
        private int adaptiveCeiling = 100;
        private int adaptiveFloor = 20;
        private int adaptiveHitThreshold = 3;
        private int intervalSampleSize = 200;
        private Duration intervalSampleAge = Duration.ofMinutes(10);
    }
}
