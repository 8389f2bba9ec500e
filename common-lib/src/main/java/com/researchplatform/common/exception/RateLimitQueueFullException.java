package com.researchplatform.common.exception;

public class RateLimitQueueFullException extends ResearchClientException {

    private final int maxQueueSize;

    public RateLimitQueueFullException(int maxQueueSize) {
        super(null, "Rate limit queue full (" + maxQueueSize + " requests waiting)");
        this.maxQueueSize = maxQueueSize;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }
}
