package com.pacer.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacer.config.PacerProperties;
import com.pacer.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory response cache bounded by total serialized size.
 *
 * Entries expire after their TTL and are purged lazily on read. When a new
 * entry does not fit, least-recently-used entries are evicted one at a time
 * until it does or the cache is empty. A single entry larger than the whole
 * capacity is still accepted once the cache has been drained.
 *
 * Invariant: {@code currentBytes} equals the sum of {@code sizeBytes} over all entries.
 */
@Slf4j
@Component
public class ByteBoundedCache {

    private final PacerProperties.CacheConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Access order: the first entry is the least recently used
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(64, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();
    private final long maxBytes;
    private long currentBytes;

    public ByteBoundedCache(PacerProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getCache();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxBytes = config.effectiveMaxBytes();
    }

    /**
     * Get a cached value.
     *
     * @param key cache key
     * @return the value if present and not expired
     */
    public Optional<Object> get(String key) {
        if (!config.isEnabled() || key == null) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                log.debug("Cache miss: key={}", key);
                return Optional.empty();
            }

            if (entry.isExpired(now)) {
                removeEntry(key);
                log.debug("Cache entry expired: key={}", key);
                return Optional.empty();
            }

            entry.recordHit(now);
            log.debug("Cache hit: key={}, hit_count={}", key, entry.getHitCount());
            return Optional.ofNullable(entry.getData());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get a cached value of the expected type. Values of another type are treated as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Store a value with the default TTL.
     */
    public boolean put(String key, Object value) {
        return put(key, value, null);
    }

    /**
     * Store a value.
     *
     * @param key   cache key
     * @param value value to cache
     * @param ttl   time to live; default TTL when null or not positive, capped at the max TTL
     * @return true if the value was stored
     */
    public boolean put(String key, Object value, Duration ttl) {
        if (!config.isEnabled() || key == null) {
            return false;
        }

        Duration effectiveTtl = resolveTtl(ttl);
        long sizeBytes = estimateSize(value);
        Instant now = clock.instant();

        lock.lock();
        try {
            // Drop the previous version first so the byte total stays exact
            removeEntry(key);

            while (currentBytes + sizeBytes > maxBytes && !entries.isEmpty()) {
                evictLeastRecentlyUsed();
            }

            entries.put(key, new CacheEntry(value, now, now.plus(effectiveTtl), sizeBytes));
            currentBytes += sizeBytes;

            log.debug("Stored in cache: key={}, ttl={}, size={}B", key, effectiveTtl, sizeBytes);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry.
     */
    public void invalidate() {
        invalidate(null);
    }

    /**
     * Remove entries whose key contains {@code pattern}, or every entry when the pattern is null.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern) {
        lock.lock();
        try {
            int removed;
            if (pattern == null) {
                removed = entries.size();
                entries.clear();
                currentBytes = 0;
            } else {
                removed = 0;
                Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, CacheEntry> e = it.next();
                    if (e.getKey().contains(pattern)) {
                        currentBytes -= e.getValue().getSizeBytes();
                        it.remove();
                        removed++;
                    }
                }
            }
            log.info("Invalidated {} cache entries (pattern={})", removed, pattern);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics getStats() {
        lock.lock();
        try {
            long totalHits = entries.values().stream().mapToLong(CacheEntry::getHitCount).sum();
            int count = entries.size();

            return CacheStatistics.builder()
                    .entriesCount(count)
                    .sizeBytes(currentBytes)
                    .sizeMb(round(currentBytes / (1024.0 * 1024.0), 2))
                    .utilizationPercentage(maxBytes > 0 ? round(currentBytes * 100.0 / maxBytes, 1) : 0.0)
                    .totalHits(totalHits)
                    .avgHitsPerEntry(count > 0 ? round((double) totalHits / count, 1) : 0.0)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public long getCurrentBytes() {
        lock.lock();
        try {
            return currentBytes;
        } finally {
            lock.unlock();
        }
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Estimate the serialized size of a value. Never fails.
     */
    long estimateSize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Could not serialize value for size estimate, using fallback: {}", e.getMessage());
            return config.getFallbackEntrySizeBytes();
        }
    }

    private Duration resolveTtl(Duration ttl) {
        Duration resolved = (ttl == null || ttl.isZero() || ttl.isNegative()) ? config.getDefaultTtl() : ttl;
        Duration max = config.getMaxTtl();
        if (max != null && resolved.compareTo(max) > 0) {
            return max;
        }
        return resolved;
    }

    private void evictLeastRecentlyUsed() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            Map.Entry<String, CacheEntry> eldest = it.next();
            currentBytes -= eldest.getValue().getSizeBytes();
            it.remove();
            log.debug("Evicted LRU cache entry: key={}", eldest.getKey());
        }
    }

    private void removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            currentBytes -= removed.getSizeBytes();
        }
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
