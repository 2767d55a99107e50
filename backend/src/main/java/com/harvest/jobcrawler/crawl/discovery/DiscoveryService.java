package com.harvest.jobcrawler.crawl.discovery;

import com.harvest.jobcrawler.crawl.model.DiscoveryResult;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.service.PlatformHealthService;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the source's strategy for one category and always reports the outcome to platform health. An empty
 * listing counts as an extraction failure there, the same signal as a broken page structure.
 */
@Service
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);
    static final String STRATEGY_MISSING = "strategy_missing";

    private final DiscoveryStrategyRegistry registry;
    private final PlatformHealthService platformHealthService;

    public DiscoveryService(DiscoveryStrategyRegistry registry, PlatformHealthService platformHealthService) {
        this.registry = registry;
        this.platformHealthService = platformHealthService;
    }

    public DiscoveryResult discoverCategory(SourcePlatform source, String categoryId, int limit) {
        Optional<DiscoveryStrategy> strategy = registry.find(source);
        if (strategy.isEmpty()) {
            log.error("No discovery strategy source={}", source.code());
            platformHealthService.recordHealth(source, false, false, 0L, STRATEGY_MISSING);
            return new DiscoveryResult(source, categoryId, List.of(), 0L, STRATEGY_MISSING);
        }
        long startedAt = System.nanoTime();
        boolean ok = false;
        String error = null;
        List<String> urls = List.of();
        try {
            List<String> discovered = strategy.get().discover(categoryId, limit);
            urls = PostingUrls.normalizeAll(discovered == null ? List.of() : discovered, source, limit);
            ok = true;
        } catch (RuntimeException e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Discovery failed source={} category={} error={}", source.code(), categoryId, error);
        }
        long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
        platformHealthService.recordHealth(source, ok, ok && !urls.isEmpty(), latencyMs, error);
        if (ok && urls.isEmpty()) {
            log.warn("Discovery returned no URLs source={} category={}", source.code(), categoryId);
        }
        return new DiscoveryResult(source, categoryId, urls, latencyMs, error);
    }
}
