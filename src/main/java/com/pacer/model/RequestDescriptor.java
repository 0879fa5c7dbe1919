package com.pacer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Description of one logical request handed to the optimizer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RequestDescriptor {

    private static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD");

    /**
     * HTTP method (GET, POST, ...).
     */
    @Builder.Default
    private String method = "GET";

    /**
     * Absolute request URL.
     */
    private String url;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Request payload. Sent as JSON for POST/PUT/PATCH, as query parameters otherwise.
     */
    private Object body;

    /**
     * Cache key. No caching when null.
     */
    private String cacheKey;

    /**
     * Cache TTL. Falls back to the configured default when null.
     */
    private Duration cacheTtl;

    @Builder.Default
    private Priority priority = Priority.NORMAL;

    /**
     * Per-request timeout. The connection defaults apply when null.
     */
    private Duration timeout;

    public String normalizedMethod() {
        return method == null ? "GET" : method.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Whether the request is safe to cache and to collapse with identical concurrent requests.
     */
    public boolean isIdempotent() {
        return IDEMPOTENT_METHODS.contains(normalizedMethod());
    }
}
