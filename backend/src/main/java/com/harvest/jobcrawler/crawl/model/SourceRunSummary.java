package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record SourceRunSummary(
    SourcePlatform source,
    Instant startedAt,
    Instant finishedAt,
    int categoriesSelected,
    int categoriesSkipped,
    int categoriesCompleted,
    int categoriesFailed,
    int urlsSucceeded,
    int urlsFailed,
    String status,
    String error,
    List<CategoryCrawlSummary> categories
) {
    public static SourceRunSummary failed(SourcePlatform source, Instant startedAt, Instant finishedAt, String error) {
        return new SourceRunSummary(source, startedAt, finishedAt, 0, 0, 0, 0, 0, 0, "FAILED", error, List.of());
    }

    public boolean isFailed() {
        return "FAILED".equals(status);
    }
}
