package com.researchplatform.webresearch.metrics;

import com.researchplatform.common.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Records latency, success, cache hits and estimated credit spend for every research
 * operation, and renders the aggregated window for operators.
 */
public class ResearchMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(ResearchMetricsCollector.class);

    private final MetricsStore store;
    private final Clock clock;

    public ResearchMetricsCollector(MetricsStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Times {@code call} from subscription to termination and records exactly one entry,
     * on success or on error. The outcome is passed through unchanged.
     */
    public <T> Mono<T> instrumentOperation(String operation, EndpointKind endpoint,
                                           Supplier<Mono<T>> call, OperationContext ctx) {
        return Mono.defer(() -> {
            Instant start = clock.instant();
            return Mono.defer(call)
                .doOnSuccess(result -> trackOperation(operation, endpoint, elapsedSince(start), ctx, true, null))
                .doOnError(e -> trackOperation(operation, endpoint, elapsedSince(start), ctx, false,
                    e.getClass().getSimpleName()));
        });
    }

    public MetricEntry trackOperation(String operation, EndpointKind endpoint, long latencyMs,
                                      OperationContext ctx, boolean success, String errorType) {
        double estimated = CreditCostTable.estimate(endpoint, ctx);
        MetricEntry entry = new MetricEntry(
            operation,
            endpoint,
            latencyMs,
            ctx.cacheHit() ? 0.0 : estimated,
            ctx.cacheHit(),
            success,
            errorType,
            clock.instant(),
            ctx.metadata() != null ? ctx.metadata() : Map.of()
        );
        store.add(entry);

        log.info("{} [{}] [{}] {} - {}ms, ~{} credits{}",
                 success ? "OK" : "FAILED",
                 ctx.cacheHit() ? "CACHE HIT" : "CACHE MISS",
                 endpoint.name(),
                 operation,
                 latencyMs,
                 String.format(Locale.ROOT, "%.2f", entry.creditsEstimated()),
                 errorType != null ? " error=" + errorType : "");
        return entry;
    }

    public AggregatedMetrics getMetrics() {
        return store.aggregate();
    }

    public List<MetricEntry> getRecentOperations(int count) {
        return store.getRecent(count);
    }

    public void clear() {
        store.clear();
        log.info("[Observability] Metrics cleared");
    }

    public String generateMetricsReport() {
        AggregatedMetrics m = getMetrics();
        int total = m.totalRequests();

        StringBuilder sb = new StringBuilder();
        sb.append("=== Research API Metrics Report ===\n\n");
        sb.append("Total Requests: ").append(total).append('\n');
        sb.append("  - Successful: ").append(m.successfulRequests()).append(" (").append(pct(m.successfulRequests(), total)).append(")\n");
        sb.append("  - Failed: ").append(m.failedRequests()).append(" (").append(pct(m.failedRequests(), total)).append(")\n\n");
        sb.append("Cache Performance:\n");
        sb.append("  - Hits: ").append(m.cacheHits()).append(" (").append(pct(m.cacheHits(), total)).append(")\n");
        sb.append("  - Misses: ").append(m.cacheMisses()).append(" (").append(pct(m.cacheMisses(), total)).append(")\n\n");
        sb.append("Latency:\n");
        sb.append("  - Average: ").append(Math.round(m.avgLatencyMs())).append("ms\n");
        sb.append("  - P50: ").append(m.p50LatencyMs()).append("ms\n");
        sb.append("  - P95: ").append(m.p95LatencyMs()).append("ms\n");
        sb.append("  - P99: ").append(m.p99LatencyMs()).append("ms\n\n");
        sb.append("Estimated Credits: ").append(fmt2(m.totalCreditsEstimated())).append("\n\n");
        sb.append("By Endpoint:");

        m.byEndpoint().forEach((endpoint, stats) -> {
            sb.append("\n  ").append(endpoint.label()).append(':');
            sb.append("\n    - Requests: ").append(stats.requests());
            sb.append("\n    - Avg Latency: ").append(Math.round(stats.avgLatencyMs())).append("ms");
            sb.append("\n    - Credits: ").append(fmt2(stats.creditsEstimated()));
            sb.append("\n    - Cache Hit Rate: ").append(String.format(Locale.ROOT, "%.1f%%", stats.cacheHitRate()));
        });

        if (!m.errors().isEmpty()) {
            sb.append("\n\nErrors:");
            m.errors().forEach((type, count) -> sb.append("\n  - ").append(type).append(": ").append(count));
        }
        return sb.toString();
    }

    private long elapsedSince(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    // 0 of 0 renders as 0.0%
    private static String pct(int part, int total) {
        double value = total == 0 ? 0.0 : (part * 100.0) / total;
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String fmt2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
