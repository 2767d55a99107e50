package com.harvest.jobcrawler.crawl.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
