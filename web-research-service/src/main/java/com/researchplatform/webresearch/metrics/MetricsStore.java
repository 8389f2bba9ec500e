package com.researchplatform.webresearch.metrics;

import com.researchplatform.common.model.EndpointKind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rolling window of {@link MetricEntry} records. Entries older than {@code window} or beyond
 * {@code maxEntries} (oldest first) are dropped on every insert and before aggregation.
 */
public class MetricsStore {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Duration window;
    private final int maxEntries;
    private final Clock clock;
    private final Deque<MetricEntry> entries = new ArrayDeque<>();

    public MetricsStore(Duration window, int maxEntries, Clock clock) {
        this.window     = window;
        this.maxEntries = maxEntries;
        this.clock      = clock;
    }

    public synchronized void add(MetricEntry entry) {
        entries.addLast(entry);
        prune();
    }

    /** Latest {@code count} entries, oldest first. */
    public synchronized List<MetricEntry> getRecent(int count) {
        prune();
        List<MetricEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, count));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public AggregatedMetrics aggregate() {
        List<MetricEntry> snapshot;
        synchronized (this) {
            prune();
            snapshot = new ArrayList<>(entries);
        }
        return aggregate(snapshot);
    }

    static AggregatedMetrics aggregate(List<MetricEntry> metrics) {
        if (metrics.isEmpty()) {
            return AggregatedMetrics.empty();
        }

        int total = metrics.size();
        int successful = 0;
        int cacheHits = 0;
        long totalLatency = 0;
        double totalCredits = 0;
        Map<String, Integer> errors = new TreeMap<>();
        long[] latencies = new long[total];

        for (int i = 0; i < total; i++) {
            MetricEntry m = metrics.get(i);
            if (m.success()) {
                successful++;
            } else {
                errors.merge(m.errorType() != null ? m.errorType() : "unknown", 1, Integer::sum);
            }
            if (m.cacheHit()) {
                cacheHits++;
            }
            totalLatency += m.latencyMs();
            totalCredits += m.creditsEstimated();
            latencies[i] = m.latencyMs();
        }
        Arrays.sort(latencies);

        return new AggregatedMetrics(
            total,
            successful,
            total - successful,
            cacheHits,
            total - cacheHits,
            totalLatency,
            (double) totalLatency / total,
            percentile(latencies, 0.50),
            percentile(latencies, 0.95),
            percentile(latencies, 0.99),
            totalCredits,
            byEndpoint(metrics),
            Collections.unmodifiableMap(errors)
        );
    }

    /** Nearest-rank percentile: {@code sorted[ceil(n × p) - 1]}. */
    static long percentile(long[] sorted, double p) {
        if (sorted.length == 0) {
            return 0L;
        }
        int index = (int) Math.ceil(sorted.length * p) - 1;
        return sorted[Math.max(0, index)];
    }

    private static Map<EndpointKind, EndpointStats> byEndpoint(List<MetricEntry> metrics) {
        Map<EndpointKind, EndpointStats> stats = new EnumMap<>(EndpointKind.class);
        for (EndpointKind endpoint : EndpointKind.values()) {
            List<MetricEntry> forEndpoint = metrics.stream().filter(m -> m.endpoint() == endpoint).toList();
            if (forEndpoint.isEmpty()) {
                continue;
            }
            int n = forEndpoint.size();
            long hits = forEndpoint.stream().filter(MetricEntry::cacheHit).count();
            stats.put(endpoint, new EndpointStats(
                n,
                forEndpoint.stream().mapToLong(MetricEntry::latencyMs).sum() / (double) n,
                forEndpoint.stream().mapToDouble(MetricEntry::creditsEstimated).sum(),
                (hits / (double) n) * 100.0
            ));
        }
        return Collections.unmodifiableMap(stats);
    }

    // caller holds the monitor
    private void prune() {
        Instant cutoff = clock.instant().minus(window);
        while (!entries.isEmpty() && !entries.peekFirst().timestamp().isAfter(cutoff)) {
            entries.removeFirst();
        }
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }
}
