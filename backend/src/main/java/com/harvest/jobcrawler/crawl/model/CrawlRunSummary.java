package com.harvest.jobcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int sourcesAttempted,
    int sourcesFailed,
    int urlsSucceeded,
    int urlsFailed,
    String status,
    List<SourceRunSummary> sources
) {
}
