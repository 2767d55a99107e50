package com.harvest.jobcrawler.crawl.discovery;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;

import java.util.List;

/**
 * Turns one category of one source into posting URLs by walking the source's listing pages.
 */
public interface DiscoveryStrategy {

    SourcePlatform source();

    /**
     * @param limit maximum number of URLs to return; zero or less means no limit
     * @throws DiscoveryException when the listing cannot be read at all
     */
    List<String> discover(String categoryId, int limit);
}
