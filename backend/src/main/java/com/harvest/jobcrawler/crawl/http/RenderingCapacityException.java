package com.harvest.jobcrawler.crawl.http;

/**
 * No browser context freed up in time. The page itself was never tried, so this is not a rendering failure.
 */
public class RenderingCapacityException extends RuntimeException {
    public RenderingCapacityException(String message) {
        super(message);
    }
}
