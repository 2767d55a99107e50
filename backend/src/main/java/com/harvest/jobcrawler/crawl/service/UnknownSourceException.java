package com.harvest.jobcrawler.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnknownSourceException extends RuntimeException {
    private final String source;

    public UnknownSourceException(String source) {
        super("Unknown source: " + source);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
