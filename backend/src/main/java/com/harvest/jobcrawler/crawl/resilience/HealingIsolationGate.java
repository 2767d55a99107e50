package com.harvest.jobcrawler.crawl.resilience;

import com.harvest.jobcrawler.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide switch that disables AI healing for an isolation window after too many consecutive healing
 * failures, independent of the {@code ai_healing} breaker.
 */
@Component
public class HealingIsolationGate {
    private static final Logger log = LoggerFactory.getLogger(HealingIsolationGate.class);

    private final int failureThreshold;
    private final Duration isolationWindow;
    private final Clock clock;

    private int consecutiveFailures;
    private Instant isolatedUntil;

    public HealingIsolationGate(CrawlerProperties properties, Clock clock) {
        this.failureThreshold = properties.getHealing().getFailureThreshold();
        this.isolationWindow = Duration.ofSeconds(properties.getHealing().getIsolationSeconds());
        this.clock = clock;
    }

    public synchronized boolean isIsolated() {
        return isolatedUntil != null && clock.instant().isBefore(isolatedUntil);
    }

    public synchronized Instant isolatedUntil() {
        return isolatedUntil;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure(String reason) {
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold) {
            isolatedUntil = clock.instant().plus(isolationWindow);
            consecutiveFailures = 0;
            log.error("AI healing isolated until={} reason={}", isolatedUntil, reason);
        }
    }
}
