package com.researchplatform.webresearch.config;

/**
 * Plan-level throughput of the research API key. Chosen once at startup from
 * {@code research.rate-limit.tier}; never inferred from the key itself.
 */
public enum ThroughputTier {
    STANDARD(100, 100),
    HIGH(1000, 1000);

    private final int capacity;
    private final int requestsPerMinute;

    ThroughputTier(int capacity, int requestsPerMinute) {
        this.capacity = capacity;
        this.requestsPerMinute = requestsPerMinute;
    }

    public int capacity() {
        return capacity;
    }

    public int requestsPerMinute() {
        return requestsPerMinute;
    }
}
