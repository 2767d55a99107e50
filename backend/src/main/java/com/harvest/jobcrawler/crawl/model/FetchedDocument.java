package com.harvest.jobcrawler.crawl.model;

public record FetchedDocument(
    String url,
    String body,
    FetchVia via
) {
    public enum FetchVia {
        CACHE,
        PRIMARY,
        RENDERED
    }
}
