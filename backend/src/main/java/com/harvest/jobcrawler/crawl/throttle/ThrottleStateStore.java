package com.harvest.jobcrawler.crawl.throttle;

import java.time.Instant;

/**
 * Shared throttle state. Every method is one atomic operation against the backing store, so callers never
 * read-modify-write state themselves. Implementations may throw on store failure; {@link AdaptiveThrottler}
 * treats any exception as permission to proceed.
 */
public interface ThrottleStateStore {

    TokenGrant tryAcquire(String bucketKey, double rate, double capacity, Instant now);

    boolean isCoolingDown(String scopeKey, Instant now);

    void startCooldown(String scopeKey, Instant until);

    double adaptiveRate(String rateKey, double baseRate);

    /**
     * Counts one success and returns the adaptive rate after the update.
     */
    double recordSuccess(String rateKey, double baseRate, AdaptivePolicy policy);

    /**
     * Resets the success streak, cuts the adaptive rate and returns it.
     */
    double recordRateLimited(String rateKey, double baseRate, AdaptivePolicy policy);
}
