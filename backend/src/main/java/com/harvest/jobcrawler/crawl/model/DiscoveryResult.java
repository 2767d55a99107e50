package com.harvest.jobcrawler.crawl.model;

import java.util.List;

/**
 * Normalized, de-duplicated posting URLs for one category, in discovery order.
 * A failed discovery always carries an empty URL list and the error that caused it.
 */
public record DiscoveryResult(
    SourcePlatform source,
    String categoryId,
    List<String> urls,
    long latencyMs,
    String error
) {
    public DiscoveryResult {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public boolean failed() {
        return error != null;
    }

    public boolean isEmpty() {
        return urls.isEmpty();
    }
}
