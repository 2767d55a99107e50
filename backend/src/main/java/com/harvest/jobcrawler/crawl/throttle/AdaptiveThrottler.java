package com.harvest.jobcrawler.crawl.throttle;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Token-bucket throttle shared by every worker that talks to one source.
 *
 * <p>Acquisition checks the source cooldown (and the proxy cooldown when a proxy is given) before touching the
 * bucket, sleeps for the wait the bucket reports plus a small jitter, and gives up with {@code false} once the
 * timeout is spent. A {@code false} result is backpressure, not an error. Any failure of the state store lets
 * the caller through.
 */
@Service
public class AdaptiveThrottler {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveThrottler.class);
    private static final int PROXY_HASH_LENGTH = 8;

    private final ThrottleStateStore store;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AdaptivePolicy policy;

    @Autowired
    public AdaptiveThrottler(ThrottleStateStore store, CrawlerProperties properties, Clock clock) {
        this(store, properties, clock, Sleeper.THREAD);
    }

    public AdaptiveThrottler(ThrottleStateStore store, CrawlerProperties properties, Clock clock, Sleeper sleeper) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.policy = AdaptivePolicy.from(properties.getThrottle());
    }

    public boolean acquire(SourcePlatform source) {
        return acquire(source, null, Duration.ofMillis(properties.getThrottle().getAcquireTimeoutMs()));
    }

    public boolean acquire(SourcePlatform source, String proxyUrl, Duration timeout) {
        double baseRate = properties.rateFor(source);
        double capacity = properties.capacityFor(source);
        double rate = currentRate(source);
        List<String> cooldownKeys = cooldownKeys(source, proxyUrl);
        boolean granted = acquireLoop(bucketKey(source.code()), cooldownKeys, rate, capacity, timeout);
        if (!granted) {
            log.warn("Throttle wait timed out source={} timeoutMs={} baseRate={}", source.code(), timeout.toMillis(), baseRate);
        }
        return granted;
    }

    /**
     * Generic form for callers that are not bound to a configured source.
     */
    public boolean acquire(String key, double rate, double capacity, Duration timeout) {
        return acquireLoop(bucketKey(key), List.of(cooldownKey(key)), rate, capacity, timeout);
    }

    public boolean isCoolingDown(SourcePlatform source, String proxyUrl) {
        try {
            return coolingDown(cooldownKeys(source, proxyUrl), clock.instant());
        } catch (RuntimeException e) {
            log.warn("Throttle state unavailable while checking cooldown source={} error={}", source.code(), e.getMessage());
            return false;
        }
    }

    public double currentRate(SourcePlatform source) {
        double baseRate = properties.rateFor(source);
        try {
            return policy.clamp(store.adaptiveRate(rateKey(source), baseRate), baseRate);
        } catch (RuntimeException e) {
            log.warn("Throttle state unavailable reading adaptive rate source={} error={}", source.code(), e.getMessage());
            return baseRate;
        }
    }

    public void reportSuccess(SourcePlatform source) {
        double baseRate = properties.rateFor(source);
        try {
            double before = store.adaptiveRate(rateKey(source), baseRate);
            double after = store.recordSuccess(rateKey(source), baseRate, policy);
            if (after > before) {
                log.info("Throttle rate raised source={} from={} to={}", source.code(), before, after);
            }
        } catch (RuntimeException e) {
            log.warn("Throttle state unavailable recording success source={} error={}", source.code(), e.getMessage());
        }
    }

    public void report429(SourcePlatform source, String proxyUrl) {
        report429(source, proxyUrl, Duration.ofSeconds(properties.getThrottle().getRateLimitCooldownSeconds()));
    }

    /**
     * Starts a cooldown for the source, or only for the proxy when one is given, and cuts the adaptive rate.
     */
    public void report429(SourcePlatform source, String proxyUrl, Duration cooldown) {
        double baseRate = properties.rateFor(source);
        String scopeKey = proxyUrl == null || proxyUrl.isBlank()
            ? cooldownKey(source.code())
            : proxyCooldownKey(source.code(), proxyUrl);
        try {
            store.startCooldown(scopeKey, clock.instant().plus(cooldown));
            double cut = store.recordRateLimited(rateKey(source), baseRate, policy);
            log.warn("Rate limited source={} scope={} cooldownSeconds={} newRate={}",
                source.code(), scopeKey, cooldown.toSeconds(), cut);
        } catch (RuntimeException e) {
            log.warn("Throttle state unavailable recording rate limit source={} error={}", source.code(), e.getMessage());
        }
    }

    private boolean acquireLoop(String bucketKey, List<String> cooldownKeys, double rate, double capacity, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return false;
            }
            long remainingMs = Math.max(1L, Duration.between(now, deadline).toMillis());
            long sleepMs;
            try {
                if (coolingDown(cooldownKeys, now)) {
                    sleepMs = Math.min(properties.getThrottle().getCooldownPollMs(), remainingMs);
                } else {
                    TokenGrant grant = store.tryAcquire(bucketKey, rate, capacity, now);
                    if (grant.granted()) {
                        return true;
                    }
                    sleepMs = Math.min(waitWithJitter(grant.waitSeconds()), remainingMs);
                }
            } catch (RuntimeException e) {
                log.warn("Throttle state unavailable, allowing request key={} error={}", bucketKey, e.getMessage());
                return true;
            }
            try {
                sleeper.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private long waitWithJitter(double waitSeconds) {
        CrawlerProperties.Throttle throttle = properties.getThrottle();
        long jitter = throttle.getJitterMaxMs() > throttle.getJitterMinMs()
            ? ThreadLocalRandom.current().nextLong(throttle.getJitterMinMs(), throttle.getJitterMaxMs() + 1)
            : throttle.getJitterMinMs();
        long waitMs = (long) Math.ceil(Math.max(0.0, waitSeconds) * 1000.0) + jitter;
        return Math.max(1L, Math.min(waitMs, throttle.getMaxWaitMs()));
    }

    private boolean coolingDown(List<String> keys, Instant now) {
        for (String key : keys) {
            if (store.isCoolingDown(key, now)) {
                return true;
            }
        }
        return false;
    }

    private List<String> cooldownKeys(SourcePlatform source, String proxyUrl) {
        List<String> keys = new ArrayList<>(2);
        keys.add(cooldownKey(source.code()));
        if (proxyUrl != null && !proxyUrl.isBlank()) {
            keys.add(proxyCooldownKey(source.code(), proxyUrl));
        }
        return keys;
    }

    static String bucketKey(String name) {
        return "throttle:" + name;
    }

    static String rateKey(SourcePlatform source) {
        return "throttle:adaptive_rate:" + source.code();
    }

    static String cooldownKey(String name) {
        return "cooling:" + name;
    }

    static String proxyCooldownKey(String name, String proxyUrl) {
        return "cooling:" + name + ":proxy:" + HashUtils.md5Prefix(proxyUrl, PROXY_HASH_LENGTH);
    }
}
