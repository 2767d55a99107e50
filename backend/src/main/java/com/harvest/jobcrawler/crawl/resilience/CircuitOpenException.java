package com.harvest.jobcrawler.crawl.resilience;

import java.time.Duration;

public class CircuitOpenException extends RuntimeException {
    private final String circuitName;
    private final Duration retryAfter;

    public CircuitOpenException(String circuitName, Duration retryAfter) {
        super("Circuit " + circuitName + " is OPEN, retry after " + retryAfter.toMillis() + "ms");
        this.circuitName = circuitName;
        this.retryAfter = retryAfter;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
