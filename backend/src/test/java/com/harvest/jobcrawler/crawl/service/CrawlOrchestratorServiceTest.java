package com.harvest.jobcrawler.crawl.service;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.discovery.DiscoveryService;
import com.harvest.jobcrawler.crawl.model.Category;
import com.harvest.jobcrawler.crawl.model.CategoryCrawlSummary;
import com.harvest.jobcrawler.crawl.model.CrawlOutcome;
import com.harvest.jobcrawler.crawl.model.CrawlRunRequest;
import com.harvest.jobcrawler.crawl.model.CrawlRunSummary;
import com.harvest.jobcrawler.crawl.model.DiscoveryResult;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.model.SourceRunSummary;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorServiceTest {

    @Mock
    private CrawlJdbcRepository repository;
    @Mock
    private DiscoveryService discoveryService;
    @Mock
    private PostingCrawlerService postingCrawlerService;

    private final ExecutorService sourceExecutor = Executors.newFixedThreadPool(3);
    private final ExecutorService urlExecutor = Executors.newFixedThreadPool(8);
    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();
    private final Set<String> checkpoints = ConcurrentHashMap.newKeySet();
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setUrlConcurrency(3);
        lenient().when(repository.findCheckpointedCategoryIds(any(), any())).thenAnswer(invocation -> Set.copyOf(checkpoints));
        lenient().when(repository.markCategoryCrawled(any(), anyString(), any())).thenAnswer(invocation -> {
            checkpoints.add(invocation.getArgument(1));
            return 1;
        });
    }

    @AfterEach
    void tearDown() {
        sourceExecutor.shutdownNow();
        urlExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void resumedRunSkipsCheckpointedCategories() {
        when(repository.findCategories(SourcePlatform.PLATFORM_104, null))
            .thenReturn(List.of(category(SourcePlatform.PLATFORM_104, "c1"), category(SourcePlatform.PLATFORM_104, "c2")));
        when(discoveryService.discoverCategory(eq(SourcePlatform.PLATFORM_104), anyString(), anyInt()))
            .thenAnswer(invocation -> discovered(SourcePlatform.PLATFORM_104, invocation.getArgument(1), "https://x/job/" + invocation.getArgument(1)));
        when(postingCrawlerService.crawl(eq(SourcePlatform.PLATFORM_104), anyString(), any()))
            .thenAnswer(invocation -> CrawlOutcome.succeeded(invocation.getArgument(1), 1L));
        CrawlOrchestratorService service = service();

        SourceRunSummary first = service.runSource(SourcePlatform.PLATFORM_104, 0, null, true);
        assertThat(first.categoriesCompleted()).isEqualTo(2);
        assertThat(checkpoints).containsExactlyInAnyOrder("c1", "c2");

        SourceRunSummary second = service.runSource(SourcePlatform.PLATFORM_104, 0, null, true);

        assertThat(second.categoriesSelected()).isZero();
        assertThat(second.categoriesSkipped()).isEqualTo(2);
        verify(discoveryService, times(2)).discoverCategory(eq(SourcePlatform.PLATFORM_104), anyString(), anyInt());
    }

    @Test
    void failedUrlStillCheckpointsTheCategory() {
        List<String> urls = List.of("https://x/job/1", "https://x/job/2", "https://x/job/3", "https://x/job/4", "https://x/job/5");
        when(repository.findCategories(SourcePlatform.PLATFORM_1111, null)).thenReturn(List.of(category(SourcePlatform.PLATFORM_1111, "140100")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_1111, "140100", 0))
            .thenReturn(new DiscoveryResult(SourcePlatform.PLATFORM_1111, "140100", urls, 5L, null));
        when(postingCrawlerService.crawl(eq(SourcePlatform.PLATFORM_1111), anyString(), any())).thenAnswer(invocation -> {
            String url = invocation.getArgument(1);
            if (url.endsWith("/3")) {
                throw new IllegalStateException("parser blew up");
            }
            return CrawlOutcome.succeeded(url, 1L);
        });

        SourceRunSummary summary = service().runSource(SourcePlatform.PLATFORM_1111, 0, null, true);

        assertThat(summary.urlsSucceeded()).isEqualTo(4);
        assertThat(summary.urlsFailed()).isEqualTo(1);
        CategoryCrawlSummary category = summary.categories().get(0);
        assertThat(category.checkpointed()).isTrue();
        assertThat(category.status()).isEqualTo("PARTIAL");
        assertThat(checkpoints).containsExactly("140100");
    }

    @Test
    void failedDiscoveryLeavesCategoryUnmarked() {
        when(repository.findCategories(SourcePlatform.PLATFORM_YOURATOR, null))
            .thenReturn(List.of(category(SourcePlatform.PLATFORM_YOURATOR, "backend"), category(SourcePlatform.PLATFORM_YOURATOR, "frontend")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_YOURATOR, "backend", 0))
            .thenReturn(new DiscoveryResult(SourcePlatform.PLATFORM_YOURATOR, "backend", List.of(), 3L, "http_503"));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_YOURATOR, "frontend", 0))
            .thenReturn(new DiscoveryResult(SourcePlatform.PLATFORM_YOURATOR, "frontend", List.of(), 3L, null));

        SourceRunSummary summary = service().runSource(SourcePlatform.PLATFORM_YOURATOR, 0, null, true);

        assertThat(summary.status()).isEqualTo("PARTIAL");
        assertThat(summary.categoriesFailed()).isEqualTo(1);
        assertThat(summary.categoriesCompleted()).isEqualTo(1);
        assertThat(checkpoints).containsExactly("frontend");
        verify(postingCrawlerService, never()).crawl(any(), anyString(), any());
    }

    @Test
    void crashingSourceDoesNotStopOtherSources() {
        when(repository.findCategories(SourcePlatform.PLATFORM_104, null)).thenThrow(new IllegalStateException("connection reset"));
        when(repository.findCategories(SourcePlatform.PLATFORM_1111, null)).thenReturn(List.of(category(SourcePlatform.PLATFORM_1111, "140100")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_1111, "140100", 0))
            .thenReturn(discovered(SourcePlatform.PLATFORM_1111, "140100", "https://x/job/1"));
        when(postingCrawlerService.crawl(eq(SourcePlatform.PLATFORM_1111), anyString(), any()))
            .thenAnswer(invocation -> CrawlOutcome.succeeded(invocation.getArgument(1), 1L));

        CrawlRunSummary run = service().runAll(List.of(SourcePlatform.PLATFORM_104, SourcePlatform.PLATFORM_1111), 0, true);

        assertThat(run.sourcesAttempted()).isEqualTo(2);
        assertThat(run.sourcesFailed()).isEqualTo(1);
        assertThat(run.status()).isEqualTo("PARTIAL");
        assertThat(run.sources().get(0).status()).isEqualTo("FAILED");
        assertThat(run.sources().get(0).error()).isEqualTo("connection reset");
        assertThat(run.sources().get(1).status()).isEqualTo("COMPLETED");
        assertThat(run.urlsSucceeded()).isEqualTo(1);
    }

    @Test
    void inFlightUrlsNeverExceedConcurrencyLimit() {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            urls.add("https://x/job/" + i);
        }
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(repository.findCategories(SourcePlatform.PLATFORM_CAKERESUME, null))
            .thenReturn(List.of(category(SourcePlatform.PLATFORM_CAKERESUME, "it_back-end-engineer")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_CAKERESUME, "it_back-end-engineer", 0))
            .thenReturn(new DiscoveryResult(SourcePlatform.PLATFORM_CAKERESUME, "it_back-end-engineer", urls, 1L, null));
        when(postingCrawlerService.crawl(eq(SourcePlatform.PLATFORM_CAKERESUME), anyString(), any())).thenAnswer(invocation -> {
            int current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return CrawlOutcome.succeeded(invocation.getArgument(1), 20L);
        });

        SourceRunSummary summary = service().runSource(SourcePlatform.PLATFORM_CAKERESUME, 0, null, true);

        assertThat(summary.urlsSucceeded()).isEqualTo(12);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
    }

    @Test
    void targetedCategoryIgnoresCheckpoints() {
        checkpoints.add("c1");
        when(repository.findCategories(SourcePlatform.PLATFORM_104, "c1")).thenReturn(List.of(category(SourcePlatform.PLATFORM_104, "c1")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_104, "c1", 5))
            .thenReturn(discovered(SourcePlatform.PLATFORM_104, "c1"));

        SourceRunSummary summary = service().runSource(SourcePlatform.PLATFORM_104, 5, "c1", true);

        assertThat(summary.categoriesSelected()).isEqualTo(1);
        verify(repository, never()).findCheckpointedCategoryIds(any(), any());
    }

    @Test
    void disabledSourceIsNotCrawled() {
        CrawlerProperties.Source disabled = new CrawlerProperties.Source();
        disabled.setEnabled(false);
        properties.getSources().put("platform_yes123", disabled);

        SourceRunSummary summary = service().runSource(SourcePlatform.PLATFORM_YES123, 0, null, true);

        assertThat(summary.status()).isEqualTo("DISABLED");
        verify(repository, never()).findCategories(any(), any());
    }

    @Test
    void secondRunIsRejectedWhileOneIsActive() {
        ExecutorService idleExecutor = Mockito.mock(ExecutorService.class);
        CrawlOrchestratorService service = new CrawlOrchestratorService(
            repository, discoveryService, postingCrawlerService, sourceExecutor, urlExecutor, idleExecutor, properties, Clock.systemUTC()
        );

        service.startAsync(new CrawlRunRequest("104", 1, null, true));

        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(() -> service.run(new CrawlRunRequest("1111", 1, null, true)))
            .isInstanceOf(ActiveCrawlRunException.class);
        assertThat(service.requestStop()).isTrue();
    }

    @Test
    void unknownSourceIsRejectedBeforeTheRunStarts() {
        CrawlOrchestratorService service = service();

        assertThatThrownBy(() -> service.run(new CrawlRunRequest("monster", null, null, null)))
            .isInstanceOf(UnknownSourceException.class)
            .hasMessageContaining("monster");
        assertThat(service.isRunning()).isFalse();
        assertThat(service.resolveSources("104, platform_1111,104"))
            .containsExactly(SourcePlatform.PLATFORM_104, SourcePlatform.PLATFORM_1111);
        assertThat(service.resolveSources("all")).hasSize(SourcePlatform.values().length);
    }

    @Test
    void singleSourceRunUsesRequestLimit() {
        when(repository.findCategories(SourcePlatform.PLATFORM_104, null)).thenReturn(List.of(category(SourcePlatform.PLATFORM_104, "c9")));
        when(discoveryService.discoverCategory(SourcePlatform.PLATFORM_104, "c9", 7))
            .thenReturn(discovered(SourcePlatform.PLATFORM_104, "c9"));

        CrawlRunSummary run = service().run(new CrawlRunRequest("platform_104", 7, null, false));

        assertThat(run.status()).isEqualTo("COMPLETED");
        verify(repository, never()).findCheckpointedCategoryIds(any(), any());
        verify(repository).markCategoryCrawled(eq(SourcePlatform.PLATFORM_104), eq("c9"), any(Instant.class));
    }

    private CrawlOrchestratorService service() {
        return new CrawlOrchestratorService(
            repository,
            discoveryService,
            postingCrawlerService,
            sourceExecutor,
            urlExecutor,
            runExecutor,
            properties,
            Clock.systemUTC()
        );
    }

    private static Category category(SourcePlatform source, String id) {
        return new Category(source, "L1", "Layer 1", "L2", "Layer 2", id, "Category " + id, null);
    }

    private static DiscoveryResult discovered(SourcePlatform source, String categoryId, String... urls) {
        return new DiscoveryResult(source, categoryId, List.of(urls), 1L, null);
    }
}
