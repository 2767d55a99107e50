package com.harvest.jobcrawler.crawl.service;

import com.harvest.jobcrawler.crawl.enrichment.EnrichmentService;
import com.harvest.jobcrawler.crawl.healing.HealedRecord;
import com.harvest.jobcrawler.crawl.healing.SelfHealingService;
import com.harvest.jobcrawler.crawl.http.DocumentFetcher;
import com.harvest.jobcrawler.crawl.jobs.PostingExtractor;
import com.harvest.jobcrawler.crawl.jobs.PostingValidator;
import com.harvest.jobcrawler.crawl.model.Category;
import com.harvest.jobcrawler.crawl.model.CrawlOutcome;
import com.harvest.jobcrawler.crawl.model.ExtractedPage;
import com.harvest.jobcrawler.crawl.model.FetchedDocument;
import com.harvest.jobcrawler.crawl.model.JobLocation;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Processes one posting URL: fetch, extract, heal when the title is missing, validate, persist, then
 * queue enrichment. Never throws; every failure comes back as a failed {@link CrawlOutcome}.
 */
@Service
public class PostingCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(PostingCrawlerService.class);

    static final String FETCH_FAILED = "fetch_failed";
    static final String EXTRACTION_FAILED = "extraction_failed";
    static final String PERSIST_FAILED = "persist_failed";

    private final DocumentFetcher documentFetcher;
    private final PostingExtractor extractor;
    private final SelfHealingService selfHealingService;
    private final PostingValidator validator;
    private final CrawlJdbcRepository repository;
    private final EnrichmentService enrichmentService;
    private final PlatformHealthService platformHealthService;

    public PostingCrawlerService(
        DocumentFetcher documentFetcher,
        PostingExtractor extractor,
        SelfHealingService selfHealingService,
        PostingValidator validator,
        CrawlJdbcRepository repository,
        EnrichmentService enrichmentService,
        PlatformHealthService platformHealthService
    ) {
        this.documentFetcher = documentFetcher;
        this.extractor = extractor;
        this.selfHealingService = selfHealingService;
        this.validator = validator;
        this.repository = repository;
        this.enrichmentService = enrichmentService;
        this.platformHealthService = platformHealthService;
    }

    public CrawlOutcome crawl(SourcePlatform source, String url, Category category) {
        long started = System.nanoTime();
        try {
            FetchedDocument document = documentFetcher.fetch(source, url);
            if (document == null) {
                platformHealthService.recordHealth(source, false, false, elapsedMs(started), FETCH_FAILED);
                return CrawlOutcome.failed(url, elapsedMs(started), FETCH_FAILED);
            }

            ExtractedPage page = extractor.extract(source, document.body(), url);
            JobPosting posting = page.posting();
            Organization organization = page.organization();
            JobLocation location = page.nativeLocation();
            if (!page.hasPosting()) {
                Optional<HealedRecord> healed = selfHealingService.heal(source, document.body(), url, page.pageTitle());
                posting = healed.map(HealedRecord::posting).orElse(null);
                organization = healed.map(HealedRecord::organization).orElse(null);
                location = null;
            }
            if (posting == null || !posting.hasTitle()) {
                platformHealthService.recordHealth(source, true, false, elapsedMs(started), EXTRACTION_FAILED);
                return CrawlOutcome.failed(url, elapsedMs(started), EXTRACTION_FAILED);
            }

            validator.validate(posting);
            platformHealthService.recordHealth(source, true, true, elapsedMs(started), null);

            boolean saved = repository.saveRecord(
                posting,
                organization,
                category == null ? null : category.categoryId(),
                category == null ? null : category.displayName(),
                location
            );
            if (!saved) {
                return CrawlOutcome.failed(url, elapsedMs(started), PERSIST_FAILED);
            }
            enrichmentService.enrichDetached(posting, organization, location);
            return CrawlOutcome.succeeded(url, elapsedMs(started));
        } catch (RuntimeException e) {
            log.warn("Posting pipeline failed source={} url={} error={}", source.code(), url, e.getMessage());
            return CrawlOutcome.failed(url, elapsedMs(started), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
