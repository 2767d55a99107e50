package com.harvest.jobcrawler.crawl.throttle;

import java.time.Duration;
import java.time.Instant;

public final class TokenBucket {
    private static final double EPSILON = 1e-9;

    private TokenBucket() {
    }

    /**
     * Refills {@code availableTokens} by the elapsed time since {@code lastRefillAt} and consumes one token if
     * possible. A bucket that has never been refilled starts full.
     */
    public static TokenGrant tryConsume(
        Double availableTokens,
        Instant lastRefillAt,
        double rate,
        double capacity,
        Instant now
    ) {
        double safeRate = rate > 0 ? rate : 1.0;
        double safeCapacity = Math.max(1.0, capacity);
        double tokens;
        if (availableTokens == null || lastRefillAt == null) {
            tokens = safeCapacity;
        } else {
            long elapsedNanos = Math.max(0L, Duration.between(lastRefillAt, now).toNanos());
            double elapsedSeconds = elapsedNanos / 1_000_000_000.0;
            tokens = Math.min(safeCapacity, Math.max(0.0, availableTokens) + elapsedSeconds * safeRate);
        }
        if (tokens + EPSILON >= 1.0) {
            return new TokenGrant(true, Math.max(0.0, tokens - 1.0), now, 0.0);
        }
        double waitSeconds = (1.0 - tokens) / safeRate;
        return new TokenGrant(false, tokens, now, waitSeconds);
    }
}
