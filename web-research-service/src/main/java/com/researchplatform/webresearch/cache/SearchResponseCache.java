package com.researchplatform.webresearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.model.Depth;
import com.researchplatform.common.model.SearchOptions;
import com.researchplatform.common.model.SearchResponse;
import com.researchplatform.common.model.SearchTopic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Search keyspace. The key is a SHA-256 fingerprint of the trimmed, lower-cased query plus
 * every option that changes the upstream answer, with defaults filled in so that
 * {@code {}} and {@code {topic: general, depth: basic}} share an entry.
 */
public class SearchResponseCache {

    private static final Logger log = LoggerFactory.getLogger(SearchResponseCache.class);

    public static final int DEFAULT_MAX_SIZE = 500;

    private static final int DEFAULT_DAYS = 7;
    private static final int DEFAULT_MAX_RESULTS = 5;

    private final TtlCache<SearchResponse> cache;
    private final ObjectMapper objectMapper;

    public SearchResponseCache(TtlCache<SearchResponse> cache, ObjectMapper objectMapper) {
        this.cache        = cache;
        this.objectMapper = objectMapper;
    }

    public Optional<SearchResponse> get(String query, SearchOptions options) {
        Optional<SearchResponse> hit = cache.get(keyFor(query, options)).map(CacheEntry::value);
        if (hit.isPresent()) {
            log.info("[Cache HIT] Search: \"{}\"", query);
        } else {
            log.debug("[Cache MISS] Search: \"{}\"", query);
        }
        return hit;
    }

    public void put(String query, SearchOptions options, SearchResponse response, Duration ttl) {
        cache.put(keyFor(query, options), response, ttl, null);
        log.info("[Cache SET] Search: \"{}\" ttlMinutes={}", query, ttl.toMinutes());
    }

    public void clear() {
        cache.clear();
        log.info("[Cache CLEAR] Search cache cleared");
    }

    public int size() {
        return cache.size();
    }

    String keyFor(String query, SearchOptions options) {
        SearchOptions opts = options != null ? options : SearchOptions.defaults();
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("query", query.trim().toLowerCase(Locale.ROOT));
        normalized.put("topic", (opts.topic() != null ? opts.topic() : SearchTopic.GENERAL).wireValue());
        normalized.put("depth", Depth.orBasic(opts.depth()).wireValue());
        normalized.put("days", opts.days() != null ? opts.days() : DEFAULT_DAYS);
        normalized.put("include_domains", joinSorted(opts.includeDomains()));
        normalized.put("exclude_domains", joinSorted(opts.excludeDomains()));
        normalized.put("max_results", opts.maxResults() != null ? opts.maxResults() : DEFAULT_MAX_RESULTS);

        try {
            return CacheKeys.sha256(objectMapper.writeValueAsString(normalized));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to fingerprint search options", e);
        }
    }

    private static String joinSorted(List<String> domains) {
        if (domains == null || domains.isEmpty()) {
            return "";
        }
        return String.join(",", domains.stream().sorted().toList());
    }
}
