package com.harvest.jobcrawler.crawl.healing;

public class AiHealingException extends RuntimeException {
    public AiHealingException(String message) {
        super(message);
    }

    public AiHealingException(String message, Throwable cause) {
        super(message, cause);
    }
}
