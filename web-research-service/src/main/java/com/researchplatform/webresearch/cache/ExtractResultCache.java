package com.researchplatform.webresearch.cache;

import com.researchplatform.common.model.Depth;
import com.researchplatform.common.model.ExtractResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Extract keyspace: one entry per {@code url:depth}, carrying an MD5 ETag of the
 * extracted content so callers can tell whether a page changed since it was cached.
 */
public class ExtractResultCache {

    private static final Logger log = LoggerFactory.getLogger(ExtractResultCache.class);

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final TtlCache<ExtractResult> cache;

    public ExtractResultCache(TtlCache<ExtractResult> cache) {
        this.cache = cache;
    }

    public Optional<ExtractResult> get(String url, Depth depth) {
        Optional<ExtractResult> hit = cache.get(keyFor(url, depth)).map(CacheEntry::value);
        if (hit.isPresent()) {
            log.info("[Cache HIT] Extract: {}", url);
        }
        return hit;
    }

    public void put(String url, Depth depth, ExtractResult result, Duration ttl) {
        String content = result.bestContent();
        String etag = content != null ? CacheKeys.md5(content) : null;
        cache.put(keyFor(url, depth), result, ttl, etag);
        log.info("[Cache SET] Extract: {} ttlHours={} etag={}",
                 url, ttl.toHours(), etag != null ? etag.substring(0, 8) + "..." : "none");
    }

    /** {@code true} when nothing is cached for the URL, the entry has no ETag, or the content differs. */
    public boolean hasChanged(String url, String newContent, Depth depth) {
        return cache.get(keyFor(url, depth))
            .map(CacheEntry::etag)
            .map(etag -> !etag.equals(CacheKeys.md5(newContent)))
            .orElse(true);
    }

    public void clear() {
        cache.clear();
        log.info("[Cache CLEAR] Extract cache cleared");
    }

    public int size() {
        return cache.size();
    }

    static String keyFor(String url, Depth depth) {
        return CacheKeys.sha256(url + ":" + Depth.orBasic(depth).wireValue());
    }
}
