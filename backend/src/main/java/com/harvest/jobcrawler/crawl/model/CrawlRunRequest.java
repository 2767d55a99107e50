package com.harvest.jobcrawler.crawl.model;

public record CrawlRunRequest(
    String source,
    Integer limit,
    String category,
    Boolean resume
) {
}
