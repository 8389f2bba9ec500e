package com.researchplatform.webresearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.common.model.ExtractResult;
import com.researchplatform.common.model.SearchResponse;
import com.researchplatform.webresearch.cache.CacheTtlPolicy;
import com.researchplatform.webresearch.cache.ExtractResultCache;
import com.researchplatform.webresearch.cache.SearchResponseCache;
import com.researchplatform.webresearch.cache.TtlCache;
import com.researchplatform.webresearch.metrics.MetricsStore;
import com.researchplatform.webresearch.metrics.ResearchMetricsCollector;
import com.researchplatform.webresearch.ratelimit.TokenBucketRateLimiter;
import com.researchplatform.webresearch.resilience.CircuitBreakerPolicy;
import com.researchplatform.webresearch.resilience.CircuitBreakerRegistry;
import com.researchplatform.webresearch.resilience.ResilientRequestExecutor;
import com.researchplatform.webresearch.resilience.RetryPolicy;
import com.researchplatform.webresearch.validation.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Wires the research client's process-wide singletons: one limiter, one breaker per
 * endpoint, two cache keyspaces and one metrics store.
 */
@Configuration
public class ResearchClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ResearchClientConfig.class);

    // ── rate limit ──────────────────────────────────────────────────────────

    @Value("${research.rate-limit.tier:STANDARD}")
    private ThroughputTier tier;

    // 0 means "use the tier's value"
    @Value("${research.rate-limit.capacity:0}")
    private int capacityOverride;

    @Value("${research.rate-limit.refill-per-minute:0}")
    private int refillOverride;

    @Value("${research.rate-limit.max-queue-size:100}")
    private int maxQueueSize;

    @Value("${research.rate-limit.queue-timeout-ms:30000}")
    private long queueTimeoutMs;

    // ── resilience ──────────────────────────────────────────────────────────

    @Value("${research.resilience.interactive.failure-threshold:5}")
    private int interactiveThreshold;

    @Value("${research.resilience.interactive.failure-window-seconds:60}")
    private long interactiveWindowSeconds;

    @Value("${research.resilience.interactive.cool-down-seconds:30}")
    private long interactiveCoolDownSeconds;

    @Value("${research.resilience.bulk.failure-threshold:3}")
    private int bulkThreshold;

    @Value("${research.resilience.bulk.failure-window-seconds:60}")
    private long bulkWindowSeconds;

    @Value("${research.resilience.bulk.cool-down-seconds:60}")
    private long bulkCoolDownSeconds;

    @Value("${research.resilience.retry.max-retries:3}")
    private int maxRetries;

    @Value("${research.resilience.retry.base-delay-ms:500}")
    private long baseDelayMs;

    @Value("${research.resilience.retry.max-delay-ms:8000}")
    private long maxDelayMs;

    @Value("${research.resilience.retry.jitter:0.3}")
    private double jitter;

    @Value("${research.resilience.timeout.search-ms:10000}")
    private long searchTimeoutMs;

    @Value("${research.resilience.timeout.extract-ms:30000}")
    private long extractTimeoutMs;

    @Value("${research.resilience.timeout.map-ms:20000}")
    private long mapTimeoutMs;

    @Value("${research.resilience.timeout.crawl-ms:60000}")
    private long crawlTimeoutMs;

    // ── cache / metrics ─────────────────────────────────────────────────────

    @Value("${research.cache.search-max-size:500}")
    private int searchCacheMaxSize;

    @Value("${research.cache.extract-max-size:1000}")
    private int extractCacheMaxSize;

    @Value("${research.cache.news-domains:reuters.com,bloomberg.com,cnbc.com,wsj.com,marketwatch.com,ft.com}")
    private String[] newsDomains;

    @Value("${research.metrics.window-hours:24}")
    private long metricsWindowHours;

    @Value("${research.metrics.max-entries:10000}")
    private int metricsMaxEntries;

    @Bean
    public Clock researchClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler researchScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(Scheduler researchScheduler) {
        int capacity = capacityOverride > 0 ? capacityOverride : tier.capacity();
        int refill   = refillOverride > 0 ? refillOverride : tier.requestsPerMinute();
        return new TokenBucketRateLimiter(tier.name(), capacity, refill, maxQueueSize,
            Duration.ofMillis(queueTimeoutMs), researchScheduler);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock researchClock) {
        CircuitBreakerPolicy interactive = new CircuitBreakerPolicy(interactiveThreshold,
            Duration.ofSeconds(interactiveWindowSeconds), Duration.ofSeconds(interactiveCoolDownSeconds));
        CircuitBreakerPolicy bulk = new CircuitBreakerPolicy(bulkThreshold,
            Duration.ofSeconds(bulkWindowSeconds), Duration.ofSeconds(bulkCoolDownSeconds));

        Map<EndpointKind, CircuitBreakerPolicy> policies = new EnumMap<>(EndpointKind.class);
        policies.put(EndpointKind.SEARCH, interactive);
        policies.put(EndpointKind.EXTRACT, interactive);
        policies.put(EndpointKind.MAP, bulk);
        policies.put(EndpointKind.CRAWL, bulk);
        log.info("[ResearchConfig] Circuit breakers. interactive={} bulk={}", interactive, bulk);
        return new CircuitBreakerRegistry(policies, researchClock);
    }

    @Bean
    public ResilientRequestExecutor resilientRequestExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                                             Scheduler researchScheduler) {
        Map<EndpointKind, Duration> timeouts = new EnumMap<>(EndpointKind.class);
        timeouts.put(EndpointKind.SEARCH, Duration.ofMillis(searchTimeoutMs));
        timeouts.put(EndpointKind.EXTRACT, Duration.ofMillis(extractTimeoutMs));
        timeouts.put(EndpointKind.MAP, Duration.ofMillis(mapTimeoutMs));
        timeouts.put(EndpointKind.CRAWL, Duration.ofMillis(crawlTimeoutMs));

        RetryPolicy retry = new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs),
            Duration.ofMillis(maxDelayMs), jitter);
        return new ResilientRequestExecutor(circuitBreakerRegistry, retry, timeouts, researchScheduler);
    }

    @Bean
    public SearchResponseCache searchResponseCache(Clock researchClock, ObjectMapper objectMapper) {
        return new SearchResponseCache(
            new TtlCache<SearchResponse>("search", searchCacheMaxSize, researchClock), objectMapper);
    }

    @Bean
    public ExtractResultCache extractResultCache(Clock researchClock) {
        return new ExtractResultCache(new TtlCache<ExtractResult>("extract", extractCacheMaxSize, researchClock));
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy() {
        return new CacheTtlPolicy(Set.copyOf(Arrays.asList(newsDomains)));
    }

    @Bean
    public SchemaValidator schemaValidator(ObjectMapper objectMapper) {
        return new SchemaValidator(objectMapper);
    }

    @Bean
    public MetricsStore metricsStore(Clock researchClock) {
        return new MetricsStore(Duration.ofHours(metricsWindowHours), metricsMaxEntries, researchClock);
    }

    @Bean
    public ResearchMetricsCollector researchMetricsCollector(MetricsStore metricsStore, Clock researchClock) {
        return new ResearchMetricsCollector(metricsStore, researchClock);
    }
}
