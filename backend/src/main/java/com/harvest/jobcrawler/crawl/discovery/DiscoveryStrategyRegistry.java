package com.harvest.jobcrawler.crawl.discovery;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source to strategy lookup, built once from every {@link DiscoveryStrategy} bean.
 */
@Component
public class DiscoveryStrategyRegistry {
    private final Map<SourcePlatform, DiscoveryStrategy> strategies;

    public DiscoveryStrategyRegistry(List<DiscoveryStrategy> strategies) {
        Map<SourcePlatform, DiscoveryStrategy> bySource = new EnumMap<>(SourcePlatform.class);
        for (DiscoveryStrategy strategy : strategies) {
            DiscoveryStrategy previous = bySource.put(strategy.source(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate discovery strategy for " + strategy.source().code());
            }
        }
        this.strategies = Collections.unmodifiableMap(bySource);
    }

    public Optional<DiscoveryStrategy> find(SourcePlatform source) {
        return Optional.ofNullable(strategies.get(source));
    }
}
