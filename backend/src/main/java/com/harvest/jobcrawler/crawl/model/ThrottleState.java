package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;

public record ThrottleState(
    String key,
    double availableTokens,
    Instant lastRefillAt,
    Double adaptiveRate,
    int successStreak,
    Instant cooldownUntil
) {
}
