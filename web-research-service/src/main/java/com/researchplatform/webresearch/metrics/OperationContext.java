package com.researchplatform.webresearch.metrics;

import com.researchplatform.common.model.Depth;

import java.util.Map;

/**
 * Cost-relevant facts about one operation. {@code urlCount} and {@code pageCount} are
 * nullable; the credit table applies its defaults.
 */
public record OperationContext(
    Depth depth,
    Integer urlCount,
    Integer pageCount,
    boolean cacheHit,
    Map<String, Object> metadata
) {
    public static OperationContext of(Depth depth) {
        return new OperationContext(depth, null, null, false, Map.of());
    }

    public static OperationContext urls(Depth depth, int urlCount) {
        return new OperationContext(depth, urlCount, null, false, Map.of());
    }

    public static OperationContext pages(Depth depth, Integer pageCount) {
        return new OperationContext(depth, null, pageCount, false, Map.of());
    }

    public OperationContext asCacheHit() {
        return new OperationContext(depth, urlCount, pageCount, true, metadata);
    }

    public OperationContext withMetadata(Map<String, Object> extra) {
        return new OperationContext(depth, urlCount, pageCount, cacheHit, Map.copyOf(extra));
    }
}
