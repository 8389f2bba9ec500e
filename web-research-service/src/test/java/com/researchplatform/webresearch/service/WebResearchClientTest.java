package com.researchplatform.webresearch.service;

import com.researchplatform.common.exception.TransportException;
import com.researchplatform.common.model.CrawlRequest;
import com.researchplatform.common.model.CrawlResponse;
import com.researchplatform.common.model.Depth;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.common.model.ExtractRequest;
import com.researchplatform.common.model.ExtractResponse;
import com.researchplatform.common.model.ExtractResult;
import com.researchplatform.common.model.MapRequest;
import com.researchplatform.common.model.MapResponse;
import com.researchplatform.common.model.SearchOptions;
import com.researchplatform.common.model.SearchResponse;
import com.researchplatform.webresearch.cache.CacheTtlPolicy;
import com.researchplatform.webresearch.cache.SearchResponseCache;
import com.researchplatform.webresearch.metrics.MetricEntry;
import com.researchplatform.webresearch.resilience.CircuitState;
import com.researchplatform.webresearch.support.ResearchClientFixture;
import com.researchplatform.webresearch.validation.SchemaValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.researchplatform.webresearch.support.FakeResearchTransport.json;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebResearchClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ResearchClientFixture fixture;
    private WebResearchClient client;

    @BeforeEach
    void setUp() {
        fixture = new ResearchClientFixture();
        client = fixture.client();
    }

    private static String searchJson(String query) {
        return "{\"query\":\"" + query + "\",\"results\":["
            + "{\"title\":\"Rates held\",\"url\":\"https://www.reuters.com/markets/rates\","
            + "\"content\":\"Central bank holds rates\",\"score\":0.91,\"published_date\":\"2026-03-01\"},"
            + "{\"title\":\"Outlook\",\"url\":\"https://example.com/outlook\","
            + "\"snippet\":\"Quarterly outlook\",\"content\":\"Long form\",\"score\":0.42,\"published_date\":\"2026-02-28\"}"
            + "],\"response_time\":0.8}";
    }

    private static String extractJson(String... urls) {
        StringBuilder sb = new StringBuilder("{\"results\":[");
        for (int i = 0; i < urls.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("{\"url\":\"").append(urls[i]).append("\",\"raw_content\":\"body of ")
              .append(urls[i]).append("\",\"success\":true}");
        }
        return sb.append("],\"failed_results\":[]}").toString();
    }

    private MetricEntry lastMetric() {
        List<MetricEntry> recent = fixture.metrics.getRecentOperations(1);
        assertEquals(1, recent.size());
        return recent.get(0);
    }

    // ── search ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("normalizes results, snippet falls back to content")
        void normalizes() {
            fixture.transport.respondJson(EndpointKind.SEARCH, searchJson("fed rates"));

            SearchResponse response = client.search("fed rates", SearchOptions.news(3)).block(TIMEOUT);

            assertNotNull(response);
            assertFalse(response.isDegraded());
            assertEquals(2, response.results().size());
            assertEquals("Central bank holds rates", response.results().get(0).snippet());
            assertEquals("Quarterly outlook", response.results().get(1).snippet());
            assertEquals("2026-03-01", response.results().get(0).publishedAt());
            assertEquals(0.91, response.results().get(0).score());
        }

        @Test
        @DisplayName("identical searches hit upstream once, the repeat is a free cache hit")
        void cachesRepeats() {
            fixture.transport.respondJson(EndpointKind.SEARCH, searchJson("fed rates"));

            SearchResponse first = client.search("fed rates", SearchOptions.news(3)).block(TIMEOUT);
            SearchResponse second = client.search("fed rates", SearchOptions.news(3)).block(TIMEOUT);

            assertEquals(first, second);
            assertEquals(1, fixture.transport.callCount(EndpointKind.SEARCH));

            MetricEntry hit = lastMetric();
            assertTrue(hit.cacheHit());
            assertEquals(0.0, hit.creditsEstimated());
            assertEquals(1, fixture.metrics.getMetrics().cacheHits());
            assertEquals(1.0, fixture.metrics.getMetrics().totalCreditsEstimated());
        }

        @Test
        @DisplayName("request body carries key and defaults, days only for news")
        void requestBody() {
            fixture.transport.respondJson(EndpointKind.SEARCH, searchJson("q"));

            client.search("q", SearchOptions.builder().days(3).depth(Depth.ADVANCED).chunksPerSource(2).build())
                .block(TIMEOUT);
            client.search("q", SearchOptions.news(3)).block(TIMEOUT);

            Map<String, Object> general = fixture.transport.calls().get(0).body();
            assertEquals(ResearchClientFixture.API_KEY, general.get("api_key"));
            assertEquals(false, general.get("include_answer"));
            assertEquals(5, general.get("max_results"));
            assertEquals("advanced", general.get("search_depth"));
            assertEquals(2, general.get("chunks_per_source"));
            assertFalse(general.containsKey("days"));
            assertFalse(general.containsKey("time_range"));

            Map<String, Object> news = fixture.transport.calls().get(1).body();
            assertEquals("news", news.get("topic"));
            assertEquals(3, news.get("days"));
            assertFalse(news.containsKey("chunks_per_source"));
        }

        @Test
        @DisplayName("missing API key degrades without calling upstream or recording metrics")
        void notConfigured() {
            WebResearchClient unconfigured = fixture.client("");

            SearchResponse response = unconfigured.search("q", null).block(TIMEOUT);

            assertFalse(unconfigured.isConfigured());
            assertEquals("API key not configured", response.error());
            assertTrue(response.results().isEmpty());
            assertTrue(fixture.transport.calls().isEmpty());
            assertEquals(0, fixture.metrics.getMetrics().totalRequests());
        }

        @Test
        @DisplayName("placeholder keys count as unconfigured")
        void placeholderKeys() {
            assertFalse(fixture.client("undefined").isConfigured());
            assertFalse(fixture.client("null").isConfigured());
            assertFalse(fixture.client(null).isConfigured());
            assertTrue(client.isConfigured());
        }

        @Test
        @DisplayName("schema-invalid body degrades and records the validation error")
        void invalidSchema() {
            fixture.transport.respondJson(EndpointKind.SEARCH,
                "{\"query\":\"q\",\"results\":[{\"title\":\"t\",\"url\":\"not a url\",\"score\":0.5}]}");

            SearchResponse response = client.search("q", null).block(TIMEOUT);

            assertTrue(response.isDegraded());
            assertTrue(response.error().startsWith("Invalid search response schema"), response.error());
            assertEquals("SchemaValidationException", lastMetric().errorType());
            assertEquals(0, client.getCacheStats().searchEntries());
        }

        @Test
        @DisplayName("news results without published_date are rejected")
        void newsNeedsPublishedDate() {
            fixture.transport.respondJson(EndpointKind.SEARCH,
                "{\"query\":\"q\",\"results\":[{\"title\":\"t\",\"url\":\"https://a.com\",\"score\":0.5}]}");

            SearchResponse news = client.search("q", SearchOptions.news(1)).block(TIMEOUT);
            SearchResponse general = client.search("q", null).block(TIMEOUT);

            assertTrue(news.isDegraded());
            assertTrue(news.error().contains("published_date"), news.error());
            assertFalse(general.isDegraded());
        }

        @Test
        @DisplayName("error field in a 200 body degrades with that message")
        void errorBody() {
            fixture.transport.respondJson(EndpointKind.SEARCH, "{\"error\":\"Invalid API key\"}");

            SearchResponse response = client.search("q", null).block(TIMEOUT);

            assertEquals("Invalid API key", response.error());
            assertEquals(1, fixture.transport.callCount(EndpointKind.SEARCH));
        }

        @Test
        @DisplayName("null query degrades instead of throwing")
        void nullQuery() {
            SearchResponse response = client.search(null, null).block(TIMEOUT);

            assertNotNull(response);
            assertTrue(response.isDegraded());
            assertTrue(response.results().isEmpty());
            assertTrue(response.error().contains("query must not be null"), response.error());
            assertTrue(fixture.transport.calls().isEmpty());
        }

        @Test
        @DisplayName("a failing cache lookup degrades instead of erroring")
        void cacheFailure() {
            SearchResponseCache brokenCache = mock(SearchResponseCache.class);
            when(brokenCache.get(anyString(), any())).thenThrow(new IllegalStateException("cache unavailable"));
            WebResearchClient withBrokenCache = new WebResearchClient(ResearchClientFixture.API_KEY,
                fixture.transport, new SchemaValidator(fixture.objectMapper), fixture.rateLimiter, fixture.executor,
                brokenCache, fixture.extractCache, new CacheTtlPolicy(Set.of()), fixture.metrics);

            SearchResponse response = withBrokenCache.search("q", null).block(TIMEOUT);

            assertEquals("cache unavailable", response.error());
            assertTrue(response.results().isEmpty());
            assertTrue(fixture.transport.calls().isEmpty());
        }

        @Test
        @DisplayName("5xx is retried and then succeeds")
        void retriesServerErrors() {
            AtomicInteger attempts = new AtomicInteger();
            fixture.transport.respond(EndpointKind.SEARCH, body -> attempts.incrementAndGet() < 3
                ? Mono.error(new TransportException(EndpointKind.SEARCH, 503, "unavailable"))
                : Mono.just(json(searchJson("q"))));

            SearchResponse response = client.search("q", null).block(TIMEOUT);

            assertFalse(response.isDegraded());
            assertEquals(3, attempts.get());
            assertEquals(CircuitState.CLOSED, fixture.breakers.get(EndpointKind.SEARCH).getState());
        }
    }

    // ── cache warm-up ───────────────────────────────────────────────────────

    @Test
    @DisplayName("warmCache counts succeeded and failed queries and fills the cache")
    void warmCache() {
        fixture.transport.respond(EndpointKind.SEARCH, body -> "bad".equals(body.get("query"))
            ? Mono.error(new TransportException(EndpointKind.SEARCH, 400, "bad request"))
            : Mono.just(json("{\"query\":\"" + body.get("query") + "\",\"results\":[]}")));

        CacheWarmupSummary summary = client.warmCache(List.of("alpha", "beta", "bad"), null).block(TIMEOUT);

        assertEquals(new CacheWarmupSummary(2, 1), summary);
        assertEquals(2, client.getCacheStats().searchEntries());
    }

    // ── extract ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("extract")
    class Extract {

        private static final String A = "https://a.com/report";
        private static final String B = "https://b.com/filing";
        private static final String C = "https://c.com/news";

        @Test
        @DisplayName("only uncached URLs go upstream; results come back in request order")
        void partialCache() {
            fixture.extractCache.put(A, Depth.BASIC, new ExtractResult(A, "cached body", null, true, null),
                Duration.ofHours(1));
            fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson(C, B));

            ExtractResponse response = client.extract(ExtractRequest.of(List.of(A, B, C))).block(TIMEOUT);

            assertEquals(List.of(A, B, C), response.results().stream().map(ExtractResult::url).toList());
            assertEquals("cached body", response.results().get(0).rawContent());
            assertEquals(List.of(B, C), fixture.transport.calls().get(0).body().get("urls"));
            assertEquals(0.4, lastMetric().creditsEstimated(), 1e-9);
            assertEquals(3, client.getCacheStats().extractEntries());
        }

        @Test
        @DisplayName("fully cached request records a cache hit without calling upstream")
        void allCached() {
            fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson(A, B));

            client.extract(ExtractRequest.of(List.of(A, B))).block(TIMEOUT);
            ExtractResponse again = client.extract(ExtractRequest.of(List.of(B, A))).block(TIMEOUT);

            assertEquals(List.of(B, A), again.results().stream().map(ExtractResult::url).toList());
            assertEquals(1, fixture.transport.callCount(EndpointKind.EXTRACT));
            assertTrue(lastMetric().cacheHit());
            assertEquals(0.0, lastMetric().creditsEstimated());
        }

        @Test
        @DisplayName("cache is keyed by depth")
        void depthSeparatesCache() {
            fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson(A));

            client.extract(ExtractRequest.of(List.of(A), Depth.BASIC)).block(TIMEOUT);
            client.extract(ExtractRequest.of(List.of(A), Depth.ADVANCED)).block(TIMEOUT);

            assertEquals(2, fixture.transport.callCount(EndpointKind.EXTRACT));
            assertEquals("advanced", fixture.transport.calls().get(1).body().get("extract_depth"));
        }

        @Test
        @DisplayName("failed per-URL results are returned but not cached")
        void failedResultsNotCached() {
            fixture.transport.respondJson(EndpointKind.EXTRACT,
                "{\"results\":[{\"url\":\"" + A + "\",\"success\":false,\"error\":\"blocked\"}]}");

            ExtractResponse response = client.extract(ExtractRequest.of(List.of(A))).block(TIMEOUT);

            assertFalse(response.results().get(0).success());
            assertEquals("blocked", response.results().get(0).error());
            assertEquals(0, client.getCacheStats().extractEntries());
        }

        @Test
        @DisplayName("a URL requested twice is fetched once and returned at both positions")
        void duplicateUrls() {
            fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson(A, B));

            ExtractResponse response = client.extract(ExtractRequest.of(List.of(A, B, A))).block(TIMEOUT);

            assertEquals(List.of(A, B), fixture.transport.calls().get(0).body().get("urls"));
            assertEquals(List.of(A, B, A), response.results().stream().map(ExtractResult::url).toList());
            assertEquals(0.4, lastMetric().creditsEstimated(), 1e-9);
        }

        @Test
        @DisplayName("partial cache hits are recorded in the metric metadata")
        void cachedUrlsMetadata() {
            fixture.extractCache.put(A, Depth.BASIC, new ExtractResult(A, "cached body", null, true, null),
                Duration.ofHours(1));
            fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson(B));

            client.extract(ExtractRequest.of(List.of(A, B))).block(TIMEOUT);

            assertEquals(1, lastMetric().metadata().get("cachedUrls"));
        }

        @Test
        @DisplayName("null request degrades instead of throwing")
        void nullRequest() {
            ExtractResponse response = client.extract(null).block(TIMEOUT);

            assertTrue(response.isDegraded());
            assertTrue(response.results().isEmpty());
        }

        @Test
        @DisplayName("empty URL list returns empty results without a call")
        void emptyUrls() {
            ExtractResponse response = client.extract(ExtractRequest.of(List.of())).block(TIMEOUT);

            assertFalse(response.isDegraded());
            assertTrue(response.results().isEmpty());
            assertTrue(fixture.transport.calls().isEmpty());
        }

        @Test
        @DisplayName("five failures open the extract breaker; search is unaffected")
        void breakerOpens() {
            fixture.transport.fail(EndpointKind.EXTRACT, new TransportException(EndpointKind.EXTRACT, 400, "bad request"));
            fixture.transport.respondJson(EndpointKind.SEARCH, searchJson("q"));

            for (int i = 0; i < 5; i++) {
                ExtractResponse failed = client.extract(ExtractRequest.of(List.of("https://x.com/" + i))).block(TIMEOUT);
                assertEquals("bad request", failed.error());
            }
            assertEquals(5, fixture.transport.callCount(EndpointKind.EXTRACT));

            ExtractResponse fastFail = client.extract(ExtractRequest.of(List.of("https://x.com/6"))).block(TIMEOUT);

            assertTrue(fastFail.error().contains("Circuit breaker OPEN"), fastFail.error());
            assertEquals(5, fixture.transport.callCount(EndpointKind.EXTRACT));
            assertEquals("CircuitOpenException", lastMetric().errorType());

            assertFalse(client.search("q", null).block(TIMEOUT).isDegraded());
            assertEquals(CircuitState.CLOSED, fixture.breakers.get(EndpointKind.SEARCH).getState());
        }
    }

    // ── map / crawl ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("map and crawl")
    class MapAndCrawl {

        @Test
        @DisplayName("map returns discovered pages")
        void map() {
            fixture.transport.respondJson(EndpointKind.MAP,
                "{\"results\":[{\"url\":\"https://ir.acme.com/q1\",\"title\":\"Q1\"},{\"url\":\"https://ir.acme.com/q2\"}]}");

            MapResponse response = client.map(MapRequest.of("https://ir.acme.com")).block(TIMEOUT);

            assertEquals(2, response.results().size());
            assertEquals("Q1", response.results().get(0).title());
            assertNull(response.results().get(1).title());

            Map<String, Object> body = fixture.transport.calls().get(0).body();
            assertEquals(2, body.get("max_depth"));
            assertEquals(50, body.get("max_breadth"));
            assertFalse(body.containsKey("limit"));
        }

        @Test
        @DisplayName("crawl applies body defaults and returns page content")
        void crawl() {
            fixture.transport.respondJson(EndpointKind.CRAWL,
                "{\"results\":[{\"url\":\"https://ir.acme.com/q1\",\"content\":\"Revenue up\",\"success\":true}]}");

            CrawlResponse response = client.crawl(CrawlRequest.of("https://ir.acme.com")).block(TIMEOUT);

            assertEquals("Revenue up", response.results().get(0).content());

            Map<String, Object> body = fixture.transport.calls().get(0).body();
            assertEquals(1, body.get("max_depth"));
            assertEquals(50, body.get("max_breadth"));
            assertEquals(100, body.get("limit"));
            assertEquals("basic", body.get("extract_depth"));
            assertEquals(1.0, lastMetric().creditsEstimated(), 1e-9);
        }

        @Test
        @DisplayName("crawl failure degrades")
        void crawlFailure() {
            fixture.transport.fail(EndpointKind.CRAWL, new TransportException(EndpointKind.CRAWL, 401, "unauthorized"));

            CrawlResponse response = client.crawl(CrawlRequest.of("https://ir.acme.com")).block(TIMEOUT);

            assertTrue(response.isDegraded());
            assertTrue(response.results().isEmpty());
            assertEquals(1, fixture.transport.callCount(EndpointKind.CRAWL));
        }

        @Test
        @DisplayName("null map and crawl requests degrade")
        void nullRequests() {
            assertTrue(client.map(null).block(TIMEOUT).isDegraded());
            assertTrue(client.crawl(null).block(TIMEOUT).isDegraded());
            assertTrue(fixture.transport.calls().isEmpty());
        }

        @Test
        @DisplayName("unconfigured key degrades map and crawl")
        void notConfigured() {
            WebResearchClient unconfigured = fixture.client(" ");

            assertEquals("API key not configured",
                unconfigured.map(MapRequest.of("https://a.com")).block(TIMEOUT).error());
            assertEquals("API key not configured",
                unconfigured.crawl(CrawlRequest.of("https://a.com")).block(TIMEOUT).error());
            assertTrue(fixture.transport.calls().isEmpty());
        }
    }

    // ── cache administration ────────────────────────────────────────────────

    @Test
    @DisplayName("clearCaches empties both caches")
    void clearCaches() {
        fixture.transport.respondJson(EndpointKind.SEARCH, searchJson("q"));
        fixture.transport.respondJson(EndpointKind.EXTRACT, extractJson("https://a.com/x"));
        client.search("q", null).block(TIMEOUT);
        client.extract(ExtractRequest.of(List.of("https://a.com/x"))).block(TIMEOUT);

        assertEquals(new CacheStats(1, 1), client.getCacheStats());

        client.clearCaches();

        assertEquals(new CacheStats(0, 0), client.getCacheStats());
    }
}
