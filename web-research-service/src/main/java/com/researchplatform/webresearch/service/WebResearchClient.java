package com.researchplatform.webresearch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.researchplatform.common.exception.ConfigurationException;
import com.researchplatform.common.exception.ResearchClientException;
import com.researchplatform.common.exception.SchemaValidationException;
import com.researchplatform.common.model.CrawlRequest;
import com.researchplatform.common.model.CrawlResponse;
import com.researchplatform.common.model.CrawlResult;
import com.researchplatform.common.model.Depth;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.common.model.ExtractRequest;
import com.researchplatform.common.model.ExtractResponse;
import com.researchplatform.common.model.ExtractResult;
import com.researchplatform.common.model.MapRequest;
import com.researchplatform.common.model.MapResponse;
import com.researchplatform.common.model.MapResult;
import com.researchplatform.common.model.SearchOptions;
import com.researchplatform.common.model.SearchResponse;
import com.researchplatform.common.model.SearchResult;
import com.researchplatform.webresearch.cache.CacheTtlPolicy;
import com.researchplatform.webresearch.cache.ExtractResultCache;
import com.researchplatform.webresearch.cache.SearchResponseCache;
import com.researchplatform.webresearch.client.ResearchTransport;
import com.researchplatform.webresearch.metrics.OperationContext;
import com.researchplatform.webresearch.metrics.ResearchMetricsCollector;
import com.researchplatform.webresearch.ratelimit.TokenBucketRateLimiter;
import com.researchplatform.webresearch.resilience.ResilientRequestExecutor;
import com.researchplatform.webresearch.validation.ResponseSchemas;
import com.researchplatform.webresearch.validation.SchemaValidator;
import com.researchplatform.webresearch.validation.payload.CrawlApiResponse;
import com.researchplatform.webresearch.validation.payload.ExtractApiResponse;
import com.researchplatform.webresearch.validation.payload.ExtractApiResult;
import com.researchplatform.webresearch.validation.payload.MapApiResponse;
import com.researchplatform.webresearch.validation.payload.SearchApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single entry point for web research: search, extract, map and crawl.
 *
 * <p><strong>Flow per call:</strong>
 * <ol>
 *   <li>Unconfigured API key → {@code ConfigurationException}, mapped to a degraded result;
 *       nothing else happens.</li>
 *   <li>Cache lookup (search; extract per URL). A hit is recorded as a zero-credit metric.</li>
 *   <li>Miss → instrumented, rate-limited, circuit-broken call: transport → schema
 *       validation → normalization.</li>
 *   <li>The normalized result is cached with a volatility-based TTL.</li>
 * </ol>
 *
 * <p>The returned {@code Mono} never errors: every failure becomes a response with an empty
 * result list and a non-null {@code error}.
 */
@Service
public class WebResearchClient {

    private static final Logger log = LoggerFactory.getLogger(WebResearchClient.class);

    static final String NOT_CONFIGURED = "API key not configured";

    private static final int DEFAULT_MAX_RESULTS = 5;
    private static final int WARMUP_CONCURRENCY = 5;

    private final String apiKey;
    private final ResearchTransport transport;
    private final SchemaValidator validator;
    private final TokenBucketRateLimiter rateLimiter;
    private final ResilientRequestExecutor executor;
    private final SearchResponseCache searchCache;
    private final ExtractResultCache extractCache;
    private final CacheTtlPolicy ttlPolicy;
    private final ResearchMetricsCollector metrics;

    public WebResearchClient(@Value("${research.api-key:}") String apiKey,
                             ResearchTransport transport,
                             SchemaValidator validator,
                             TokenBucketRateLimiter rateLimiter,
                             ResilientRequestExecutor executor,
                             SearchResponseCache searchCache,
                             ExtractResultCache extractCache,
                             CacheTtlPolicy ttlPolicy,
                             ResearchMetricsCollector metrics) {
        this.apiKey       = apiKey;
        this.transport    = transport;
        this.validator    = validator;
        this.rateLimiter  = rateLimiter;
        this.executor     = executor;
        this.searchCache  = searchCache;
        this.extractCache = extractCache;
        this.ttlPolicy    = ttlPolicy;
        this.metrics      = metrics;
        if (!isConfigured()) {
            log.warn("[WebResearch] research.api-key is not set; all calls will return degraded results");
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank()
            && !"undefined".equals(apiKey) && !"null".equals(apiKey);
    }

    // ── search ──────────────────────────────────────────────────────────────

    public Mono<SearchResponse> search(String query, SearchOptions options) {
        return Mono.defer(() -> {
            requireConfigured(EndpointKind.SEARCH);
            Objects.requireNonNull(query, "query must not be null");
            SearchOptions opts = options != null ? options : SearchOptions.defaults();
            String operation = "search: \"" + query + "\"";
            OperationContext ctx = OperationContext.of(opts.depth());

            Optional<SearchResponse> cached = searchCache.get(query, opts);
            if (cached.isPresent()) {
                return metrics.instrumentOperation(operation, EndpointKind.SEARCH,
                    () -> Mono.just(cached.get()), ctx.asCacheHit());
            }

            return metrics.instrumentOperation(operation, EndpointKind.SEARCH,
                    () -> upstream(EndpointKind.SEARCH, () -> transport.post(EndpointKind.SEARCH, searchBody(query, opts))
                        .map(body -> validator.validateSearch(rejectErrorBody(EndpointKind.SEARCH, body), opts.topic())
                            .orElseThrow(EndpointKind.SEARCH))
                        .map(payload -> toSearchResponse(query, payload))),
                    ctx)
                .doOnNext(response -> searchCache.put(query, opts, response, ttlPolicy.forSearch(opts)));
        })
        .onErrorResume(e -> {
            logFailure(EndpointKind.SEARCH, "search: \"" + query + "\"", e);
            return Mono.just(SearchResponse.degraded(query, messageOf(e)));
        });
    }

    /** Runs every query through {@link #search}, five at a time, and counts the outcomes. */
    public Mono<CacheWarmupSummary> warmCache(List<String> queries, SearchOptions options) {
        log.info("[Cache WARM] Starting. queries={}", queries.size());
        return Flux.fromIterable(queries)
            .flatMap(query -> search(query, options), WARMUP_CONCURRENCY)
            .reduce(new int[2], (counts, response) -> {
                counts[response.isDegraded() ? 1 : 0]++;
                return counts;
            })
            .map(counts -> new CacheWarmupSummary(counts[0], counts[1]))
            .doOnNext(summary -> log.info("[Cache WARM] Complete. succeeded={} failed={}",
                                          summary.succeeded(), summary.failed()));
    }

    // ── extract ─────────────────────────────────────────────────────────────

    public Mono<ExtractResponse> extract(ExtractRequest request) {
        return Mono.defer(() -> {
            requireConfigured(EndpointKind.EXTRACT);
            Objects.requireNonNull(request, "extract request must not be null");
            List<String> urls = request.urls() != null ? request.urls() : List.of();
            Depth depth = Depth.orBasic(request.depth());
            if (urls.isEmpty()) {
                return Mono.just(ExtractResponse.of(List.of()));
            }

            Map<String, ExtractResult> fromCache = new LinkedHashMap<>();
            Set<String> toFetch = new LinkedHashSet<>();
            for (String url : urls) {
                if (fromCache.containsKey(url) || toFetch.contains(url)) {
                    continue;
                }
                extractCache.get(url, depth).ifPresentOrElse(
                    hit -> fromCache.put(url, hit),
                    () -> toFetch.add(url));
            }

            if (toFetch.isEmpty()) {
                return metrics.instrumentOperation(
                    "extract: " + urls.size() + " URLs (all cached)", EndpointKind.EXTRACT,
                    () -> Mono.just(ExtractResponse.of(mergeInRequestOrder(urls, fromCache, List.of()))),
                    OperationContext.urls(depth, fromCache.size()).asCacheHit());
            }

            String operation = "extract: " + toFetch.size() + " URLs";
            OperationContext ctx = OperationContext.urls(depth, toFetch.size())
                .withMetadata(Map.of("cachedUrls", fromCache.size()));
            return metrics.instrumentOperation(operation, EndpointKind.EXTRACT,
                    () -> upstream(EndpointKind.EXTRACT, () -> transport.post(EndpointKind.EXTRACT, extractBody(request, List.copyOf(toFetch)))
                        .map(body -> validator.validate(ResponseSchemas.EXTRACT, rejectErrorBody(EndpointKind.EXTRACT, body))
                            .orElseThrow(EndpointKind.EXTRACT))),
                    ctx)
                .map(payload -> {
                    List<ExtractResult> fetched = payload.results().stream().map(WebResearchClient::toExtractResult).toList();
                    fetched.stream()
                        .filter(ExtractResult::success)
                        .forEach(result -> extractCache.put(result.url(), depth, result, ttlPolicy.forExtract(result.url())));
                    return ExtractResponse.of(mergeInRequestOrder(urls, fromCache, fetched));
                });
        })
        .onErrorResume(e -> {
            logFailure(EndpointKind.EXTRACT, "extract", e);
            return Mono.just(ExtractResponse.degraded(messageOf(e)));
        });
    }

    // ── map / crawl ─────────────────────────────────────────────────────────

    public Mono<MapResponse> map(MapRequest request) {
        return Mono.defer(() -> {
            requireConfigured(EndpointKind.MAP);
            Objects.requireNonNull(request, "map request must not be null");
            return metrics.instrumentOperation("map: " + request.url(), EndpointKind.MAP,
                () -> upstream(EndpointKind.MAP, () -> transport.post(EndpointKind.MAP, mapBody(request))
                    .map(body -> validator.validate(ResponseSchemas.MAP, rejectErrorBody(EndpointKind.MAP, body))
                        .orElseThrow(EndpointKind.MAP))
                    .map(WebResearchClient::toMapResponse)),
                OperationContext.pages(Depth.BASIC, request.maxBreadth()));
        })
        .onErrorResume(e -> {
            logFailure(EndpointKind.MAP, "map: " + (request != null ? request.url() : null), e);
            return Mono.just(MapResponse.degraded(messageOf(e)));
        });
    }

    public Mono<CrawlResponse> crawl(CrawlRequest request) {
        return Mono.defer(() -> {
            requireConfigured(EndpointKind.CRAWL);
            Objects.requireNonNull(request, "crawl request must not be null");
            return metrics.instrumentOperation("crawl: " + request.url(), EndpointKind.CRAWL,
                () -> upstream(EndpointKind.CRAWL, () -> transport.post(EndpointKind.CRAWL, crawlBody(request))
                    .map(body -> validator.validate(ResponseSchemas.CRAWL, rejectErrorBody(EndpointKind.CRAWL, body))
                        .orElseThrow(EndpointKind.CRAWL))
                    .map(WebResearchClient::toCrawlResponse)),
                OperationContext.pages(request.extractDepth(), request.limit()));
        })
        .onErrorResume(e -> {
            logFailure(EndpointKind.CRAWL, "crawl: " + (request != null ? request.url() : null), e);
            return Mono.just(CrawlResponse.degraded(messageOf(e)));
        });
    }

    // ── cache administration ────────────────────────────────────────────────

    public CacheStats getCacheStats() {
        return new CacheStats(searchCache.size(), extractCache.size());
    }

    public void clearCaches() {
        searchCache.clear();
        extractCache.clear();
    }

    // ── pipeline ────────────────────────────────────────────────────────────

    /** Token first, then the breaker-guarded call; limiter failures never reach the breaker. */
    private <T> Mono<T> upstream(EndpointKind endpoint, Supplier<Mono<T>> call) {
        return rateLimiter.acquire().then(executor.execute(endpoint, call));
    }

    private static JsonNode rejectErrorBody(EndpointKind endpoint, JsonNode body) {
        JsonNode error = body.get("error");
        if (error != null && error.isTextual() && !error.asText().isBlank()) {
            throw new ResearchClientException(endpoint, error.asText());
        }
        return body;
    }

    /** Fails before any cache, limiter, breaker or metrics activity. */
    private void requireConfigured(EndpointKind endpoint) {
        if (!isConfigured()) {
            throw new ConfigurationException(endpoint, NOT_CONFIGURED);
        }
    }

    private static void logFailure(EndpointKind endpoint, String operation, Throwable e) {
        if (e instanceof ConfigurationException) {
            log.warn("[WebResearch] {} skipped, {}. operation={}", endpoint.label(), e.getMessage(), operation);
        } else if (e instanceof SchemaValidationException invalid) {
            log.error("[WebResearch] {} schema validation failed. operation={} diagnostics={}",
                      endpoint.label(), operation, invalid.getDiagnostics());
        } else {
            log.error("[WebResearch] {} failed. operation={} error={}", endpoint.label(), operation, messageOf(e));
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ── request bodies ──────────────────────────────────────────────────────

    private Map<String, Object> searchBody(String query, SearchOptions opts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", apiKey);
        body.put("query", query);
        body.put("include_answer", false);
        body.put("max_results", opts.maxResults() != null ? opts.maxResults() : DEFAULT_MAX_RESULTS);
        body.put("search_depth", Depth.orBasic(opts.depth()).wireValue());
        body.put("include_raw_content", Boolean.TRUE.equals(opts.includeRawContent()));

        if (opts.topic() != null) {
            body.put("topic", opts.topic().wireValue());
        }
        if (opts.days() != null && opts.isNews()) {
            body.put("days", opts.days());
        }
        if (opts.timeRange() != null && opts.days() == null) {
            body.put("time_range", opts.timeRange());
        }
        if (opts.chunksPerSource() != null && opts.depth() == Depth.ADVANCED) {
            body.put("chunks_per_source", opts.chunksPerSource());
        }
        putIfNotEmpty(body, "include_domains", opts.includeDomains());
        putIfNotEmpty(body, "exclude_domains", opts.excludeDomains());
        return body;
    }

    private Map<String, Object> extractBody(ExtractRequest request, List<String> urls) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", apiKey);
        body.put("urls", urls);
        body.put("extract_depth", Depth.orBasic(request.depth()).wireValue());
        body.put("format", request.format() != null ? request.format() : "markdown");
        body.put("include_images", Boolean.TRUE.equals(request.includeImages()));
        return body;
    }

    private Map<String, Object> mapBody(MapRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", apiKey);
        body.put("url", request.url());
        body.put("max_depth", request.maxDepth() != null ? request.maxDepth() : 2);
        body.put("max_breadth", request.maxBreadth() != null ? request.maxBreadth() : 50);
        if (request.limit() != null) {
            body.put("limit", request.limit());
        }
        putIfNotEmpty(body, "select_paths", request.selectPaths());
        putIfNotEmpty(body, "exclude_paths", request.excludePaths());
        if (request.instructions() != null && !request.instructions().isBlank()) {
            body.put("instructions", request.instructions());
        }
        return body;
    }

    private Map<String, Object> crawlBody(CrawlRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", apiKey);
        body.put("url", request.url());
        body.put("max_depth", request.maxDepth() != null ? request.maxDepth() : 1);
        body.put("max_breadth", request.maxBreadth() != null ? request.maxBreadth() : 50);
        body.put("limit", request.limit() != null ? request.limit() : 100);
        body.put("extract_depth", Depth.orBasic(request.extractDepth()).wireValue());
        putIfNotEmpty(body, "select_paths", request.selectPaths());
        putIfNotEmpty(body, "exclude_paths", request.excludePaths());
        return body;
    }

    private static void putIfNotEmpty(Map<String, Object> body, String key, List<String> values) {
        if (values != null && !values.isEmpty()) {
            body.put(key, values);
        }
    }

    // ── normalization ───────────────────────────────────────────────────────

    private static SearchResponse toSearchResponse(String query, SearchApiResponse payload) {
        List<SearchResult> results = payload.results().stream()
            .map(r -> new SearchResult(
                r.title(),
                r.url(),
                r.snippet() != null ? r.snippet() : r.content(),
                r.publishedDate(),
                r.score(),
                r.rawContent()))
            .toList();
        return SearchResponse.of(query, results);
    }

    private static ExtractResult toExtractResult(ExtractApiResult r) {
        return new ExtractResult(r.url(), r.rawContent(), r.content(), r.success(), r.error());
    }

    private static MapResponse toMapResponse(MapApiResponse payload) {
        return MapResponse.of(payload.results().stream()
            .map(r -> new MapResult(r.url(), r.title()))
            .toList());
    }

    private static CrawlResponse toCrawlResponse(CrawlApiResponse payload) {
        return CrawlResponse.of(payload.results().stream()
            .map(r -> new CrawlResult(r.url(), r.content(), r.rawContent(), r.success(), r.error()))
            .toList());
    }

    /** One result per requested position; duplicated URLs repeat the same result. */
    private static List<ExtractResult> mergeInRequestOrder(List<String> urls,
                                                           Map<String, ExtractResult> fromCache,
                                                           List<ExtractResult> fetched) {
        Map<String, ExtractResult> fetchedByUrl = new LinkedHashMap<>();
        fetched.forEach(result -> fetchedByUrl.putIfAbsent(result.url(), result));

        List<ExtractResult> merged = new ArrayList<>(urls.size());
        for (String url : urls) {
            ExtractResult result = fromCache.containsKey(url) ? fromCache.get(url) : fetchedByUrl.get(url);
            if (result != null) {
                merged.add(result);
            }
        }
        // upstream may report a canonicalized URL; keep those results too
        Set<String> requested = Set.copyOf(urls);
        fetchedByUrl.forEach((url, result) -> {
            if (!requested.contains(url)) {
                merged.add(result);
            }
        });
        return merged;
    }
}
