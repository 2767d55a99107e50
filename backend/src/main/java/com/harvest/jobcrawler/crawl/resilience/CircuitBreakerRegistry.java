package com.harvest.jobcrawler.crawl.resilience;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.CircuitSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every named breaker in the process. The fallback breakers are created up front; callers receive them
 * from here rather than creating their own.
 */
@Component
public class CircuitBreakerRegistry {
    public static final String AI_HEALING = "ai_healing";
    public static final String RENDER_FETCH = "render_fetch";

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitBreakerRegistry(CrawlerProperties properties, Clock clock) {
        this.clock = clock;
        CrawlerProperties.Circuits circuits = properties.getCircuits();
        register(AI_HEALING, circuits.getAiFailureThreshold(), Duration.ofSeconds(circuits.getAiRecoverySeconds()));
        register(RENDER_FETCH, circuits.getRenderFailureThreshold(), Duration.ofSeconds(circuits.getRenderRecoverySeconds()));
    }

    public CircuitBreaker register(String name, int failureThreshold, Duration recoveryTimeout) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, failureThreshold, recoveryTimeout, clock));
    }

    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new IllegalArgumentException("Unknown circuit breaker: " + name);
        }
        return breaker;
    }

    public List<CircuitSnapshot> snapshots() {
        return breakers.values().stream()
            .map(CircuitBreaker::snapshot)
            .sorted(Comparator.comparing(CircuitSnapshot::name))
            .toList();
    }
}
