package com.harvest.jobcrawler.crawl.http;

public interface RenderedPageFetcher {

    /**
     * Loads {@code url} in a real browser and returns the rendered HTML.
     *
     * @throws RenderingException when the page cannot be rendered within the configured limits
     * @throws RenderingCapacityException when no browser context becomes available before the acquire timeout
     */
    String fetchRendered(String url);
}
