package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;

public record PlatformHealth(
    String source,
    long totalRequests,
    long successRequests,
    long failedRequests,
    long extractionSuccess,
    long extractionFailure,
    double avgLatencyMs,
    String lastError,
    Instant updatedAt
) {
}
