package com.researchplatform.webresearch.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size-bounded TTL cache. Expiry is checked lazily on {@link #get(String)}: an expired
 * entry is purged and reported as a miss, there is no background sweeper.
 *
 * <p>Entries are kept in access order; once {@code maxSize} is exceeded the least recently
 * used entry is evicted. All access is synchronized on the instance.
 */
public class TtlCache<V> {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> store;

    public TtlCache(String name, int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.name  = name;
        this.clock = clock;
        this.store = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry<V>> eldest) {
                boolean evict = size() > maxSize;
                if (evict) {
                    log.debug("[Cache EVICT] {} key={}", name, eldest.getKey());
                }
                return evict;
            }
        };
    }

    public synchronized Optional<CacheEntry<V>> get(String key) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key);
            log.debug("[Cache EXPIRED] {} key={}", name, key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public synchronized CacheEntry<V> put(String key, V value, Duration ttl, String etag) {
        CacheEntry<V> entry = new CacheEntry<>(key, value, clock.instant(), ttl, etag);
        // re-insert so a refreshed key moves to the young end
        store.remove(key);
        store.put(key, entry);
        return entry;
    }

    public synchronized void clear() {
        store.clear();
    }

    /** Entry count, including expired entries that have not been read since they expired. */
    public synchronized int size() {
        return store.size();
    }
}
