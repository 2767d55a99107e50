package com.harvest.jobcrawler.crawl.model;

public record CategoryCrawlSummary(
    String categoryId,
    String categoryName,
    int urlsDiscovered,
    int urlsSucceeded,
    int urlsFailed,
    boolean checkpointed,
    String status,
    String error
) {
}
