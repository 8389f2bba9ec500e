package com.researchplatform.webresearch.metrics;

import com.researchplatform.common.model.Depth;
import com.researchplatform.common.model.EndpointKind;

/**
 * Estimated credit cost per operation. Approximations of the provider's pricing,
 * good enough for budgeting; the provider's own usage figures are authoritative.
 */
public final class CreditCostTable {

    static final double SEARCH_BASIC     = 1.0;
    static final double SEARCH_ADVANCED  = 2.0;
    static final double EXTRACT_BASIC    = 0.2;   // per URL, 1 credit per 5 URLs
    static final double EXTRACT_ADVANCED = 0.4;   // per URL
    static final double MAP_PER_10_PAGES = 0.1;
    static final double CRAWL_PER_PAGE   = 0.1;

    private static final int DEFAULT_URL_COUNT  = 1;
    private static final int DEFAULT_PAGE_COUNT = 10;

    private CreditCostTable() {}

    public static double estimate(EndpointKind endpoint, OperationContext ctx) {
        boolean advanced = Depth.orBasic(ctx.depth()) == Depth.ADVANCED;
        return switch (endpoint) {
            case SEARCH  -> advanced ? SEARCH_ADVANCED : SEARCH_BASIC;
            case EXTRACT -> orDefault(ctx.urlCount(), DEFAULT_URL_COUNT) * (advanced ? EXTRACT_ADVANCED : EXTRACT_BASIC);
            case MAP     -> (orDefault(ctx.pageCount(), DEFAULT_PAGE_COUNT) / 10.0) * MAP_PER_10_PAGES;
            case CRAWL   -> orDefault(ctx.pageCount(), DEFAULT_PAGE_COUNT) * CRAWL_PER_PAGE;
        };
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
