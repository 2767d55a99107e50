package com.harvest.jobcrawler.crawl.throttle;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
