package com.pacer.cache;

import lombok.Getter;

import java.time.Instant;

/**
 * A cached result with its expiry, access bookkeeping and estimated size.
 * Mutable, and only ever touched under the owning cache's lock.
 */
@Getter
final class CacheEntry {

    private final Object data;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final long sizeBytes;
    private Instant lastAccessedAt;
    private long hitCount;

    CacheEntry(Object data, Instant createdAt, Instant expiresAt, long sizeBytes) {
        this.data = data;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.sizeBytes = sizeBytes;
        this.lastAccessedAt = createdAt;
    }

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    void recordHit(Instant now) {
        hitCount++;
        lastAccessedAt = now;
    }
}
