package com.researchplatform.webresearch.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry. {@code etag} is {@code null} for keyspaces that do not track
 * content changes.
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant storedAt,
    Duration ttl,
    String etag
) {
    public boolean isExpired(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }

    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }
}
