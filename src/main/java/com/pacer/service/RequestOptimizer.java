package com.pacer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pacer.cache.ByteBoundedCache;
import com.pacer.config.PacerProperties;
import com.pacer.model.Priority;
import com.pacer.model.RequestDescriptor;
import com.pacer.model.dto.CacheStatistics;
import com.pacer.model.dto.OptimizerStatistics;
import com.pacer.model.dto.RateLimiterStatistics;
import com.pacer.service.batch.RequestBatcher;
import com.pacer.service.dedup.DedupKeyGenerator;
import com.pacer.service.dedup.RequestDeduplicator;
import com.pacer.service.ratelimit.AdaptiveRateLimiter;
import com.pacer.transport.ConnectionManager;
import com.pacer.transport.RequestExecutor;
import com.pacer.transport.RetryAfter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Main entry point that orchestrates cache lookup, deduplication, admission
 * control and the physical request.
 *
 * Flow for one request:
 * 1. Idempotent request with a cache key: serve from cache if present
 * 2. Idempotent request with deduplication on: join an identical in-flight call
 * 3. Otherwise acquire admission (when embedded), take the pooled client and execute
 * 4. On success cache the result and record timings; on failure record and propagate
 *
 * Failures are never cached and never retried here. Every caller receives
 * its own copy of the result, detached from the cached one.
 */
@Slf4j
@Service
public class RequestOptimizer {

    private final PacerProperties properties;
    private final ByteBoundedCache cache;
    private final RequestDeduplicator deduplicator;
    private final DedupKeyGenerator dedupKeyGenerator;
    private final RequestBatcher batcher;
    private final AdaptiveRateLimiter rateLimiter;
    private final ConnectionManager connectionManager;
    private final RequestExecutor requestExecutor;
    private final Clock clock;
    private final OptimizerMetrics metrics;

    public RequestOptimizer(PacerProperties properties,
                            ByteBoundedCache cache,
                            RequestDeduplicator deduplicator,
                            DedupKeyGenerator dedupKeyGenerator,
                            RequestBatcher batcher,
                            AdaptiveRateLimiter rateLimiter,
                            ConnectionManager connectionManager,
                            RequestExecutor requestExecutor,
                            Clock clock) {
        this.properties = properties;
        this.cache = cache;
        this.deduplicator = deduplicator;
        this.dedupKeyGenerator = dedupKeyGenerator;
        this.batcher = batcher;
        this.rateLimiter = rateLimiter;
        this.connectionManager = connectionManager;
        this.requestExecutor = requestExecutor;
        this.clock = clock;
        this.metrics = new OptimizerMetrics(clock, properties.getRequest().getResponseTimeSamples());
    }

    /**
     * Perform an optimized request.
     *
     * @param method   HTTP method
     * @param url      request URL
     * @param headers  request headers
     * @param body     request payload
     * @param cacheKey cache key; no caching when null
     * @param cacheTtl cache TTL; default when null
     * @param priority admission priority
     * @return parsed response body
     */
    public Mono<JsonNode> performRequest(String method,
                                         String url,
                                         Map<String, String> headers,
                                         Object body,
                                         String cacheKey,
                                         Duration cacheTtl,
                                         Priority priority) {
        RequestDescriptor.RequestDescriptorBuilder builder = RequestDescriptor.builder()
                .method(method)
                .url(url)
                .body(body)
                .cacheKey(cacheKey)
                .cacheTtl(cacheTtl)
                .priority(priority == null ? Priority.NORMAL : priority);
        if (headers != null) {
            builder.headers(headers);
        }
        return performRequest(builder.build());
    }

    /**
     * Perform an optimized request.
     */
    public Mono<JsonNode> performRequest(RequestDescriptor request) {
        return Mono.defer(() -> {
            boolean idempotent = request.isIdempotent();
            String cacheKey = request.getCacheKey();

            if (idempotent && cacheKey != null) {
                Optional<JsonNode> cached = cache.get(cacheKey, JsonNode.class);
                if (cached.isPresent()) {
                    recordCacheHit();
                    log.debug("Serving cached response for {}", cacheKey);
                    return Mono.just(cached.get().deepCopy());
                }
            }

            if (idempotent && properties.getRequest().isDeduplication()) {
                String dedupKey = dedupKeyGenerator.generate(request);
                // Waiters share one result, so each gets its own copy
                return deduplicator.join(dedupKey, () -> executePhysical(request))
                        .map(JsonNode::deepCopy);
            }

            return executePhysical(request);
        });
    }

    /**
     * Submit an item to the batch for {@code batchKey}.
     *
     * @param execute executor returning one result per item, in item order
     * @return the result for this item
     */
    public <I, R> Mono<R> performBatched(String batchKey, I item, Function<List<I>, Mono<List<R>>> execute) {
        return Mono.defer(() -> {
            if (properties.getRequest().isMetricsEnabled()) {
                metrics.recordBatched();
            }
            return batcher.enqueue(batchKey, item, execute);
        });
    }

    /**
     * Feedback for callers that execute physical requests themselves.
     */
    public void reportSuccess(Duration responseTime) {
        rateLimiter.reportSuccess(responseTime);
    }

    /**
     * Feedback for callers that execute physical requests themselves.
     *
     * @param retryAfter server-suggested delay; null if none
     */
    public void reportRateLimitHit(Duration retryAfter) {
        rateLimiter.reportRateLimitHit(retryAfter);
    }

    /**
     * Invalidate cached results whose key contains {@code pattern}, or all when null.
     *
     * @return number of entries removed
     */
    public int invalidateCache(String pattern) {
        return cache.invalidate(pattern);
    }

    public void resetRateLimiter() {
        rateLimiter.reset();
    }

    /**
     * Get a snapshot of request, cache and rate limiter statistics.
     */
    public OptimizerStatistics getStatistics() {
        CacheStatistics cacheStats = cache.getStats();
        RateLimiterStatistics rateLimiterStats = rateLimiter.getStats();
        OptimizerStatistics.Requests requests = metrics.requestsSnapshot(deduplicator.getDeduplicatedCount());
        OptimizerStatistics.Performance performance = metrics.performanceSnapshot();

        PacerProperties.ConnectionConfig connection = properties.getConnection();
        OptimizerStatistics.Optimizations optimizations = OptimizerStatistics.Optimizations.builder()
                .connectionPooling(true)
                .http2(connection.isHttp2())
                .compression(connection.isCompression())
                .requestBatching(properties.getBatch().isEnabled())
                .requestDeduplication(properties.getRequest().isDeduplication())
                .caching(properties.getCache().isEnabled())
                .embeddedRateLimiting(properties.getRateLimit().isEmbedded())
                .build();

        return OptimizerStatistics.builder()
                .requests(requests)
                .performance(performance)
                .cache(cacheStats)
                .rateLimiter(rateLimiterStats)
                .optimizations(optimizations)
                .recommendations(recommendations(requests, performance, cacheStats, rateLimiterStats))
                .build();
    }

    /**
     * Release the pooled connections.
     */
    @PreDestroy
    public void close() {
        connectionManager.close();
    }

    private Mono<JsonNode> executePhysical(RequestDescriptor request) {
        boolean embedded = properties.getRateLimit().isEmbedded();
        Mono<Duration> admission = embedded
                ? rateLimiter.acquire(request.getPriority())
                : Mono.just(Duration.ZERO);

        return admission.then(Mono.defer(() -> {
            long startNanos = System.nanoTime();
            // Deferred so a synchronous throw from the client or executor is accounted as a failure
            return Mono.defer(() -> requestExecutor.execute(connectionManager.getClient(), request))
                    .doOnSuccess(result -> onSuccess(request, result,
                            Duration.ofNanos(System.nanoTime() - startNanos), embedded))
                    .doOnError(error -> onFailure(request, error, embedded));
        }));
    }

    private void onSuccess(RequestDescriptor request, JsonNode result, Duration responseTime, boolean embedded) {
        if (result != null && request.isIdempotent() && request.getCacheKey() != null) {
            cache.put(request.getCacheKey(), result.deepCopy(), request.getCacheTtl());
        }

        if (properties.getRequest().isMetricsEnabled()) {
            metrics.recordResponse(responseTime);
        }

        if (responseTime.compareTo(properties.getRequest().getSlowRequestThreshold()) > 0) {
            log.warn("Slow request: {} {} took {}ms",
                    request.normalizedMethod(), request.getUrl(), responseTime.toMillis());
        }

        if (embedded) {
            rateLimiter.reportSuccess(responseTime);
        }
    }

    private void onFailure(RequestDescriptor request, Throwable error, boolean embedded) {
        if (properties.getRequest().isMetricsEnabled()) {
            metrics.recordFailure();
        }

        if (error instanceof WebClientResponseException responseError
                && responseError.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            Duration retryAfter = RetryAfter.parse(
                    responseError.getHeaders().getFirst(HttpHeaders.RETRY_AFTER), clock.instant());
            if (embedded) {
                rateLimiter.reportRateLimitHit(retryAfter);
            }
            return;
        }

        log.warn("Request failed: {} {} - {}", request.normalizedMethod(), request.getUrl(), error.toString());
    }

    private void recordCacheHit() {
        if (properties.getRequest().isMetricsEnabled()) {
            metrics.recordCacheHit();
        }
    }

    private List<String> recommendations(OptimizerStatistics.Requests requests,
                                         OptimizerStatistics.Performance performance,
                                         CacheStatistics cacheStats,
                                         RateLimiterStatistics rateLimiterStats) {
        List<String> recommendations = new ArrayList<>();

        if (performance.getCacheHitRatio() < 0.3 && requests.getTotal() > 100) {
            recommendations.add("Low cache hit ratio - consider increasing cache TTL or size");
        }

        double slowThreshold = properties.getRequest().getSlowRequestThreshold().toMillis() / 1000.0;
        if (performance.getAvgResponseTimeSeconds() > slowThreshold) {
            recommendations.add("High average response time - check network or API performance");
        }

        if (requests.getDeduplicated() > requests.getTotal() * 0.1) {
            recommendations.add("High request deduplication - consider request optimization");
        }

        if (cacheStats.getUtilizationPercentage() > 90) {
            recommendations.add("Cache near capacity - consider increasing cache size");
        }

        if (rateLimiterStats.getRecommendations() != null) {
            recommendations.addAll(rateLimiterStats.getRecommendations());
        }

        return recommendations;
    }
}
