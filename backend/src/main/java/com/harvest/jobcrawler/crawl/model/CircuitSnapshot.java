package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;

public record CircuitSnapshot(
    String name,
    CircuitState state,
    int consecutiveFailures,
    Instant openedAt,
    int failureThreshold,
    long recoveryTimeoutSeconds
) {
}
