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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostingCrawlerServiceTest {
    private static final String URL = "https://www.104.com.tw/job/7abc1";
    private static final Category CATEGORY = new Category(
        SourcePlatform.PLATFORM_104, "2007000000", "IT", "2007001000", "Software", "2007001004", "Backend Engineer", null
    );

    @Mock
    private DocumentFetcher documentFetcher;
    @Mock
    private PostingExtractor extractor;
    @Mock
    private SelfHealingService selfHealingService;
    @Mock
    private PostingValidator validator;
    @Mock
    private CrawlJdbcRepository repository;
    @Mock
    private EnrichmentService enrichmentService;
    @Mock
    private PlatformHealthService platformHealthService;

    private PostingCrawlerService service;

    @BeforeEach
    void setUp() {
        service = new PostingCrawlerService(
            documentFetcher, extractor, selfHealingService, validator, repository, enrichmentService, platformHealthService
        );
    }

    @Test
    void persistsExtractedPostingAndQueuesEnrichment() {
        JobPosting posting = posting("Backend Engineer", JobPosting.LAYER_NATIVE);
        JobLocation location = new JobLocation(25.04, 121.56, null, JobLocation.PROVIDER_NATIVE);
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenReturn(new FetchedDocument(URL, "<html/>", FetchedDocument.FetchVia.PRIMARY));
        when(extractor.extract(SourcePlatform.PLATFORM_104, "<html/>", URL)).thenReturn(new ExtractedPage("Backend Engineer", posting, null, location));
        when(repository.saveRecord(posting, null, "2007001004", "Backend Engineer", location)).thenReturn(true);

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.success()).isTrue();
        verify(validator).validate(posting);
        verify(platformHealthService).recordHealth(eq(SourcePlatform.PLATFORM_104), eq(true), eq(true), anyLong(), isNull());
        verify(enrichmentService).enrichDetached(posting, null, location);
        verifyNoInteractions(selfHealingService);
    }

    @Test
    void failedFetchIsReportedWithoutExtraction() {
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenReturn(null);

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).isEqualTo(PostingCrawlerService.FETCH_FAILED);
        verify(platformHealthService).recordHealth(eq(SourcePlatform.PLATFORM_104), eq(false), eq(false), anyLong(), eq("fetch_failed"));
        verifyNoInteractions(extractor, repository);
    }

    @Test
    void missingTitleFallsBackToHealing() {
        JobPosting healed = posting("Backend Engineer", JobPosting.LAYER_AI_HEALED);
        Organization organization = new Organization(SourcePlatform.PLATFORM_104, "a1b2", "Acme", null, null, null, JobPosting.LAYER_AI_HEALED);
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenReturn(new FetchedDocument(URL, "<html/>", FetchedDocument.FetchVia.RENDERED));
        when(extractor.extract(SourcePlatform.PLATFORM_104, "<html/>", URL)).thenReturn(new ExtractedPage("Backend Engineer | 104", null, null, null));
        when(selfHealingService.heal(SourcePlatform.PLATFORM_104, "<html/>", URL, "Backend Engineer | 104"))
            .thenReturn(Optional.of(new HealedRecord(healed, organization)));
        when(repository.saveRecord(healed, organization, "2007001004", "Backend Engineer", null)).thenReturn(true);

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.success()).isTrue();
        verify(enrichmentService).enrichDetached(healed, organization, null);
    }

    @Test
    void rejectedHealingIsAnExtractionFailure() {
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenReturn(new FetchedDocument(URL, "<html/>", FetchedDocument.FetchVia.PRIMARY));
        when(extractor.extract(SourcePlatform.PLATFORM_104, "<html/>", URL)).thenReturn(new ExtractedPage(null, null, null, null));
        when(selfHealingService.heal(SourcePlatform.PLATFORM_104, "<html/>", URL, null)).thenReturn(Optional.empty());

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.error()).isEqualTo(PostingCrawlerService.EXTRACTION_FAILED);
        verify(platformHealthService).recordHealth(eq(SourcePlatform.PLATFORM_104), eq(true), eq(false), anyLong(), eq("extraction_failed"));
        verify(repository, never()).saveRecord(any(), any(), anyString(), anyString(), any());
    }

    @Test
    void persistenceFailureSkipsEnrichment() {
        JobPosting posting = posting("Backend Engineer", JobPosting.LAYER_NATIVE);
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenReturn(new FetchedDocument(URL, "<html/>", FetchedDocument.FetchVia.CACHE));
        when(extractor.extract(SourcePlatform.PLATFORM_104, "<html/>", URL)).thenReturn(new ExtractedPage("Backend Engineer", posting, null, null));
        when(repository.saveRecord(posting, null, "2007001004", "Backend Engineer", null)).thenReturn(false);

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.error()).isEqualTo(PostingCrawlerService.PERSIST_FAILED);
        verifyNoInteractions(enrichmentService);
    }

    @Test
    void unexpectedErrorBecomesFailedOutcome() {
        when(documentFetcher.fetch(SourcePlatform.PLATFORM_104, URL)).thenThrow(new IllegalStateException("pool closed"));

        CrawlOutcome outcome = service.crawl(SourcePlatform.PLATFORM_104, URL, CATEGORY);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).contains("pool closed");
    }

    static JobPosting posting(String title, String layer) {
        return new JobPosting(
            SourcePlatform.PLATFORM_104, "7abc1", URL, title, "a1b2", "Acme", "Build services in Java", "Taipei",
            "FULL_TIME", 50000L, 80000L, "MONTH", null, layer, null
        );
    }
}
