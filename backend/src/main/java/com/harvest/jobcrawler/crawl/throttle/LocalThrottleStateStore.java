package com.harvest.jobcrawler.crawl.throttle;

import com.harvest.jobcrawler.crawl.model.ThrottleState;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class LocalThrottleStateStore implements ThrottleStateStore {
    private final Map<String, ThrottleState> states = new ConcurrentHashMap<>();

    @Override
    public TokenGrant tryAcquire(String bucketKey, double rate, double capacity, Instant now) {
        AtomicReference<TokenGrant> grant = new AtomicReference<>();
        states.compute(bucketKey, (key, current) -> {
            ThrottleState state = current == null ? empty(key) : current;
            TokenGrant result = TokenBucket.tryConsume(
                current == null ? null : state.availableTokens(),
                state.lastRefillAt(),
                rate,
                capacity,
                now
            );
            grant.set(result);
            return new ThrottleState(
                key,
                result.remainingTokens(),
                result.refilledAt(),
                state.adaptiveRate(),
                state.successStreak(),
                state.cooldownUntil()
            );
        });
        return grant.get();
    }

    @Override
    public boolean isCoolingDown(String scopeKey, Instant now) {
        ThrottleState state = states.get(scopeKey);
        return state != null && state.cooldownUntil() != null && state.cooldownUntil().isAfter(now);
    }

    @Override
    public void startCooldown(String scopeKey, Instant until) {
        states.compute(scopeKey, (key, current) -> {
            ThrottleState state = current == null ? empty(key) : current;
            return new ThrottleState(
                key,
                state.availableTokens(),
                state.lastRefillAt(),
                state.adaptiveRate(),
                state.successStreak(),
                until
            );
        });
    }

    @Override
    public double adaptiveRate(String rateKey, double baseRate) {
        ThrottleState state = states.get(rateKey);
        return state == null || state.adaptiveRate() == null ? baseRate : state.adaptiveRate();
    }

    @Override
    public double recordSuccess(String rateKey, double baseRate, AdaptivePolicy policy) {
        ThrottleState updated = states.compute(rateKey, (key, current) -> {
            ThrottleState state = current == null ? empty(key) : current;
            double rate = state.adaptiveRate() == null ? baseRate : state.adaptiveRate();
            int streak = state.successStreak() + 1;
            if (streak >= policy.successStreakThreshold()) {
                streak = 0;
                rate = policy.boost(rate, baseRate);
            }
            return new ThrottleState(key, state.availableTokens(), state.lastRefillAt(), rate, streak, state.cooldownUntil());
        });
        return updated.adaptiveRate();
    }

    @Override
    public double recordRateLimited(String rateKey, double baseRate, AdaptivePolicy policy) {
        ThrottleState updated = states.compute(rateKey, (key, current) -> {
            ThrottleState state = current == null ? empty(key) : current;
            double rate = state.adaptiveRate() == null ? baseRate : state.adaptiveRate();
            return new ThrottleState(
                key,
                state.availableTokens(),
                state.lastRefillAt(),
                policy.cut(rate, baseRate),
                0,
                state.cooldownUntil()
            );
        });
        return updated.adaptiveRate();
    }

    private ThrottleState empty(String key) {
        return new ThrottleState(key, 0.0, null, null, 0, null);
    }
}
