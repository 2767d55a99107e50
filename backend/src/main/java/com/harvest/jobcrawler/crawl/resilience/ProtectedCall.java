package com.harvest.jobcrawler.crawl.resilience;

@FunctionalInterface
public interface ProtectedCall<T> {
    T call() throws Exception;
}
