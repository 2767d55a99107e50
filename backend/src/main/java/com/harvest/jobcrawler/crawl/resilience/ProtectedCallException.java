package com.harvest.jobcrawler.crawl.resilience;

/**
 * Carries a checked failure out of a breaker-protected call.
 */
public class ProtectedCallException extends RuntimeException {
    public ProtectedCallException(String circuitName, Throwable cause) {
        super("Protected call failed on circuit " + circuitName + ": " + cause.getMessage(), cause);
    }
}
