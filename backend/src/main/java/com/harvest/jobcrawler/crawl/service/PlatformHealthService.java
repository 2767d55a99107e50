package com.harvest.jobcrawler.crawl.service;

import com.harvest.jobcrawler.crawl.model.PlatformHealth;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Records per-source fetch and extraction observations. Recording never fails the caller.
 */
@Service
public class PlatformHealthService {
    private static final Logger log = LoggerFactory.getLogger(PlatformHealthService.class);

    private final CrawlJdbcRepository repository;

    public PlatformHealthService(CrawlJdbcRepository repository) {
        this.repository = repository;
    }

    public void recordHealth(SourcePlatform source, boolean fetchOk, boolean extractionOk, long latencyMs, String error) {
        try {
            repository.recordPlatformHealth(source, fetchOk, extractionOk, latencyMs, error);
        } catch (RuntimeException e) {
            log.warn("Failed to record platform health for {}: {}", source.code(), e.getMessage());
        }
    }

    public List<PlatformHealth> listHealth() {
        return repository.listPlatformHealth();
    }
}
