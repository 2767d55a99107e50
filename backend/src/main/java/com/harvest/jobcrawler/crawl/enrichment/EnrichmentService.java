package com.harvest.jobcrawler.crawl.enrichment;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.JobLocation;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SkillTag;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort skill tagging, geocoding and company page enrichment that runs after a posting is persisted. Work is queued on the
 * enrichment pool; failures are logged and never reach the crawl path.
 */
@Service
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final SkillTagger skillTagger;
    private final Geocoder geocoder;
    private final CompanyEnricher companyEnricher;
    private final CrawlJdbcRepository repository;
    private final ExecutorService enrichmentExecutor;
    private final CrawlerProperties.Enrichment config;

    public EnrichmentService(
        SkillTagger skillTagger,
        Geocoder geocoder,
        CompanyEnricher companyEnricher,
        CrawlJdbcRepository repository,
        @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor,
        CrawlerProperties properties
    ) {
        this.skillTagger = skillTagger;
        this.geocoder = geocoder;
        this.companyEnricher = companyEnricher;
        this.repository = repository;
        this.enrichmentExecutor = enrichmentExecutor;
        this.config = properties.getEnrichment();
    }

    public void enrichDetached(JobPosting posting, Organization organization, JobLocation nativeLocation) {
        if (!config.isEnabled() || posting == null) {
            return;
        }
        try {
            enrichmentExecutor.execute(() -> enrich(posting, organization, nativeLocation));
        } catch (RejectedExecutionException e) {
            log.warn("Enrichment rejected source={} sourceId={}", posting.source().code(), posting.sourceId());
        }
    }

    void enrich(JobPosting posting, Organization organization, JobLocation nativeLocation) {
        try {
            List<SkillTag> skills = skillTagger.tag(posting.description());
            if (!skills.isEmpty()) {
                repository.saveJobSkills(posting.source(), posting.sourceId(), skills);
            }
            if (nativeLocation == null && config.isGeocodingEnabled() && posting.address() != null) {
                Optional<JobLocation> location = geocoder.geocode(posting.address());
                location.ifPresent(found -> repository.saveJobLocation(posting.source(), posting.sourceId(), found));
            }
        } catch (RuntimeException e) {
            log.warn("Enrichment failed source={} sourceId={} error={}",
                posting.source().code(), posting.sourceId(), e.getMessage());
        }
        if (organization != null && config.isCompanyEnabled()) {
            try {
                companyEnricher.enrich(organization);
            } catch (RuntimeException e) {
                log.warn("Company enrichment failed source={} sourceId={} error={}",
                    organization.source().code(), organization.sourceId(), e.getMessage());
            }
        }
    }
}
