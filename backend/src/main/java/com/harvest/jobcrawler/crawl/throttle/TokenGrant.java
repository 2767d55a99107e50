package com.harvest.jobcrawler.crawl.throttle;

import java.time.Instant;

/**
 * Outcome of one atomic refill-and-consume step. When not granted, {@code waitSeconds} is the time until
 * the next whole token is available at the rate used for the step.
 */
public record TokenGrant(
    boolean granted,
    double remainingTokens,
    Instant refilledAt,
    double waitSeconds
) {
    public static TokenGrant failOpen(Instant now) {
        return new TokenGrant(true, 0.0, now, 0.0);
    }
}
