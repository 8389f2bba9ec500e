package com.researchplatform.common.model;

/**
 * The four capabilities of the upstream research API. Each kind maps to its own
 * URL path and owns an independent circuit breaker, cost line and metrics bucket.
 */
public enum EndpointKind {
    SEARCH("search"),
    EXTRACT("extract"),
    MAP("map"),
    CRAWL("crawl");

    private final String path;

    EndpointKind(String path) {
        this.path = path;
    }

    /** Path segment appended to the configured base URL, e.g. {@code /search}. */
    public String path() {
        return "/" + path;
    }

    /** Lower-case name used in logs and metrics keys. */
    public String label() {
        return path;
    }
}
