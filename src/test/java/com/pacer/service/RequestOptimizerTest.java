package com.pacer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pacer.cache.ByteBoundedCache;
import com.pacer.config.PacerProperties;
import com.pacer.model.Priority;
import com.pacer.model.RequestDescriptor;
import com.pacer.model.dto.OptimizerStatistics;
import com.pacer.service.batch.RequestBatcher;
import com.pacer.service.dedup.DedupKeyGenerator;
import com.pacer.service.dedup.RequestDeduplicator;
import com.pacer.service.ratelimit.AdaptiveRateLimiter;
import com.pacer.support.MutableClock;
import com.pacer.transport.ConnectionManager;
import com.pacer.transport.RequestExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RequestOptimizer.
 */
class RequestOptimizerTest {

    private static final String CONTACTS_URL = "https://api.example.com/contacts";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger physicalCalls = new AtomicInteger();
    private final Deque<Supplier<Mono<JsonNode>>> responses = new ArrayDeque<>();

    private PacerProperties properties;
    private MutableClock clock;
    private ByteBoundedCache cache;
    private AdaptiveRateLimiter rateLimiter;
    private ConnectionManager connectionManager;
    private RequestOptimizer optimizer;

    @BeforeEach
    void setUp() {
        properties = new PacerProperties();
        properties.getConnection().setHttp2(false);
        properties.getRateLimit().setJitterEnabled(false);
        properties.getBatch().setEnabled(false);
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

        RequestExecutor executor = (client, request) -> {
            assertNotNull(client);
            physicalCalls.incrementAndGet();
            Supplier<Mono<JsonNode>> next = responses.poll();
            return next != null ? next.get() : Mono.just(json("{\"type\":\"list\"}"));
        };

        cache = new ByteBoundedCache(properties, objectMapper, clock);
        rateLimiter = new AdaptiveRateLimiter(properties, clock);
        connectionManager = new ConnectionManager(properties, WebClient.builder());
        optimizer = new RequestOptimizer(properties, cache, new RequestDeduplicator(),
                new DedupKeyGenerator(objectMapper), new RequestBatcher(properties), rateLimiter,
                connectionManager, executor, clock);
    }

    @AfterEach
    void tearDown() {
        optimizer.close();
    }

    private JsonNode json(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static RequestDescriptor get(String cacheKey) {
        return RequestDescriptor.builder()
                .url(CONTACTS_URL)
                .cacheKey(cacheKey)
                .priority(Priority.HIGH)
                .build();
    }

    private static WebClientResponseException httpError(HttpStatus status, HttpHeaders headers) {
        return WebClientResponseException.create(status.value(), status.getReasonPhrase(), headers,
                new byte[0], StandardCharsets.UTF_8);
    }

    @Test
    void testCacheHitSkipsNetwork() {
        JsonNode first = optimizer.performRequest(get("contacts:list")).block();
        JsonNode second = optimizer.performRequest(get("contacts:list")).block();

        assertEquals(first, second);
        assertEquals(1, physicalCalls.get());

        OptimizerStatistics.Requests requests = optimizer.getStatistics().getRequests();
        assertEquals(2, requests.getTotal());
        assertEquals(1, requests.getCached());
        assertEquals(0.5, optimizer.getStatistics().getPerformance().getCacheHitRatio());
        // Cache hits do not consume rate limiter capacity
        assertEquals(1, rateLimiter.getStats().getPerformance().getTotalRequests());
    }

    @Test
    void testNonIdempotentRequestsAreNeitherCachedNorCollapsed() {
        RequestDescriptor post = RequestDescriptor.builder()
                .method("POST")
                .url(CONTACTS_URL + "/search")
                .body(Map.of("query", "alice"))
                .cacheKey("search:alice")
                .priority(Priority.HIGH)
                .build();

        optimizer.performRequest(post).block();
        optimizer.performRequest(post).block();

        assertEquals(2, physicalCalls.get());
        assertEquals(0, cache.size());
    }

    @Test
    void testConcurrentIdenticalRequestsShareOnePhysicalCall() {
        Sinks.One<JsonNode> upstream = Sinks.one();
        responses.add(upstream::asMono);
        List<JsonNode> results = new CopyOnWriteArrayList<>();

        for (int i = 0; i < 10; i++) {
            optimizer.performRequest(get(null)).subscribe(results::add);
        }
        assertEquals(1, physicalCalls.get());

        upstream.tryEmitValue(json("{\"id\":\"1\"}"));

        assertEquals(10, results.size());
        assertEquals(1, results.stream().map(JsonNode::toString).collect(Collectors.toSet()).size());
        assertEquals(9, optimizer.getStatistics().getRequests().getDeduplicated());
    }

    @Test
    void testFailureIsPropagatedAndNotCached() {
        responses.add(() -> Mono.error(httpError(HttpStatus.INTERNAL_SERVER_ERROR, HttpHeaders.EMPTY)));

        WebClientResponseException error = assertThrows(WebClientResponseException.class,
                () -> optimizer.performRequest(get("contacts:list")).block());
        assertEquals(500, error.getStatusCode().value());
        assertEquals(0, cache.size());

        JsonNode retried = optimizer.performRequest(get("contacts:list")).block();

        assertNotNull(retried);
        assertEquals(2, physicalCalls.get());
        assertEquals(1, optimizer.getStatistics().getRequests().getFailed());
        // A non-429 failure is not a rate-limit signal
        assertEquals(0, rateLimiter.getStats().getPerformance().getRateLimitHits());
    }

    @Test
    void testSynchronousExecutorFailureIsCounted() {
        responses.add(() -> {
            throw new IllegalArgumentException("Query parameters require an object body, got String");
        });

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> optimizer.performRequest(get("contacts:list")).block());

        assertTrue(error.getMessage().contains("object body"));
        assertEquals(1, optimizer.getStatistics().getRequests().getFailed());
        assertEquals(0, cache.size());
    }

    @Test
    void testCachedResultIsDetachedFromCaller() {
        ObjectNode first = (ObjectNode) optimizer.performRequest(get("contacts:list")).block();
        first.put("type", "mutated");

        JsonNode second = optimizer.performRequest(get("contacts:list")).block();
        ((ObjectNode) second).put("extra", true);
        JsonNode third = optimizer.performRequest(get("contacts:list")).block();

        assertEquals(1, physicalCalls.get());
        assertEquals("list", second.get("type").asText());
        assertEquals(json("{\"type\":\"list\"}"), third);
    }

    @Test
    void testDeduplicatedWaitersReceiveSeparateCopies() {
        Sinks.One<JsonNode> upstream = Sinks.one();
        responses.add(upstream::asMono);
        List<JsonNode> results = new CopyOnWriteArrayList<>();

        optimizer.performRequest(get(null)).subscribe(results::add);
        optimizer.performRequest(get(null)).subscribe(results::add);
        upstream.tryEmitValue(json("{\"id\":\"1\"}"));

        assertEquals(2, results.size());
        assertNotSame(results.get(0), results.get(1));

        ((ObjectNode) results.get(0)).put("id", "changed");
        assertEquals("1", results.get(1).get("id").asText());
    }

    @Test
    void testTooManyRequestsIsReportedWithRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "3");
        responses.add(() -> Mono.error(httpError(HttpStatus.TOO_MANY_REQUESTS, headers)));

        assertThrows(WebClientResponseException.class, () -> optimizer.performRequest(get(null)).block());

        assertEquals(1, rateLimiter.getConsecutiveRateLimits());
        assertEquals(Duration.ofSeconds(3), rateLimiter.getCurrentBackoff());
    }

    @Test
    void testSuccessIsReportedToRateLimiter() {
        rateLimiter.reportRateLimitHit();
        clock.advance(Duration.ofSeconds(1));

        optimizer.performRequest(get(null)).block();

        assertEquals(0, rateLimiter.getConsecutiveRateLimits());
    }

    @Test
    void testExternalRateLimiterLeavesFeedbackToCaller() {
        properties.getRateLimit().setEmbedded(false);
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "3");
        responses.add(() -> Mono.error(httpError(HttpStatus.TOO_MANY_REQUESTS, headers)));

        assertThrows(WebClientResponseException.class, () -> optimizer.performRequest(get(null)).block());
        assertEquals(0, rateLimiter.getConsecutiveRateLimits());

        optimizer.reportRateLimitHit(Duration.ofSeconds(2));
        assertEquals(Duration.ofSeconds(2), rateLimiter.getCurrentBackoff());
    }

    @Test
    void testPerformBatchedCountsItems() {
        String value = optimizer.<String, String>performBatched("contacts", "a",
                items -> Mono.just(List.of("A"))).block();

        assertEquals("A", value);
        assertEquals(1, optimizer.getStatistics().getRequests().getBatched());
    }

    @Test
    void testInvalidateCacheByPattern() {
        optimizer.performRequest(get("contacts:list")).block();
        clock.advance(Duration.ofSeconds(1));
        optimizer.performRequest(get("contacts:page:2")).block();

        assertEquals(2, optimizer.invalidateCache("contacts"));
        assertEquals(0, cache.size());
    }

    @Test
    void testRepeatedStatisticsSnapshotsAreIdentical() {
        optimizer.performRequest(get("contacts:list")).block();
        optimizer.performRequest(get("contacts:list")).block();

        OptimizerStatistics first = optimizer.getStatistics();
        OptimizerStatistics second = optimizer.getStatistics();

        assertEquals(first, second);
        assertTrue(first.getOptimizations().isCaching());
        assertTrue(first.getOptimizations().isRequestDeduplication());
        assertFalse(first.getOptimizations().isRequestBatching());
        assertNotNull(first.getPerformance().getLastUpdated());
    }

    @Test
    void testResetRateLimiter() {
        rateLimiter.reportRateLimitHit();

        optimizer.resetRateLimiter();

        assertEquals(0, rateLimiter.getConsecutiveRateLimits());
        assertEquals(0, rateLimiter.getStats().getPerformance().getRateLimitHits());
    }

    @Test
    void testCloseReleasesConnections() {
        optimizer.performRequest(get(null)).block();
        assertTrue(connectionManager.isOpen());

        optimizer.close();

        assertFalse(connectionManager.isOpen());
    }
}
