package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;

public record Category(
    SourcePlatform source,
    String layer1Id,
    String layer1Name,
    String layer2Id,
    String layer2Name,
    String layer3Id,
    String layer3Name,
    Instant lastCrawledAt
) {
    public String categoryId() {
        return layer3Id;
    }

    public String displayName() {
        return layer3Name == null || layer3Name.isBlank() ? layer3Id : layer3Name;
    }
}
