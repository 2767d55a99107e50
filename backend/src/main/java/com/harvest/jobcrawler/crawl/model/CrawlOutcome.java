package com.harvest.jobcrawler.crawl.model;

public record CrawlOutcome(
    String url,
    boolean success,
    long latencyMs,
    String error
) {
    public static CrawlOutcome succeeded(String url, long latencyMs) {
        return new CrawlOutcome(url, true, latencyMs, null);
    }

    public static CrawlOutcome failed(String url, long latencyMs, String error) {
        return new CrawlOutcome(url, false, latencyMs, error == null ? "unknown" : error);
    }
}
