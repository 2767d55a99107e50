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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs sources in parallel and, within a source, categories strictly in listing order. Each category's
 * URLs fan out on the worker pool with a per-run bound; a category is checkpointed only once its whole
 * batch has finished without an unhandled fault.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_PARTIAL = "PARTIAL";
    static final String STATUS_STOPPED = "STOPPED";
    static final String STATUS_FAILED = "FAILED";
    static final String STATUS_DISABLED = "DISABLED";

    private final CrawlJdbcRepository repository;
    private final DiscoveryService discoveryService;
    private final PostingCrawlerService postingCrawlerService;
    private final ExecutorService sourceRunExecutor;
    private final ExecutorService urlWorkerExecutor;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final AtomicBoolean runActive = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public CrawlOrchestratorService(
        CrawlJdbcRepository repository,
        DiscoveryService discoveryService,
        PostingCrawlerService postingCrawlerService,
        @Qualifier("sourceRunExecutor") ExecutorService sourceRunExecutor,
        @Qualifier("urlWorkerExecutor") ExecutorService urlWorkerExecutor,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.discoveryService = discoveryService;
        this.postingCrawlerService = postingCrawlerService;
        this.sourceRunExecutor = sourceRunExecutor;
        this.urlWorkerExecutor = urlWorkerExecutor;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        List<SourcePlatform> sources = resolveSources(request == null ? null : request.source());
        beginRun();
        try {
            return execute(sources, request);
        } finally {
            runActive.set(false);
        }
    }

    public Instant startAsync(CrawlRunRequest request) {
        List<SourcePlatform> sources = resolveSources(request == null ? null : request.source());
        beginRun();
        Instant acceptedAt = clock.instant();
        try {
            crawlRunExecutor.submit(() -> {
                try {
                    CrawlRunSummary summary = execute(sources, request);
                    log.info("Async crawl finished status={} succeeded={} failed={}",
                        summary.status(), summary.urlsSucceeded(), summary.urlsFailed());
                } catch (RuntimeException e) {
                    log.error("Async crawl failed", e);
                } finally {
                    runActive.set(false);
                }
            });
        } catch (RuntimeException e) {
            runActive.set(false);
            throw e;
        }
        return acceptedAt;
    }

    /**
     * Stops new categories and sources from starting. URLs already in flight finish; their category stays
     * unmarked.
     */
    public boolean requestStop() {
        stopRequested.set(true);
        log.info("Stop requested active={}", runActive.get());
        return runActive.get();
    }

    public boolean isRunning() {
        return runActive.get();
    }

    public CrawlRunSummary runAll(int limitPerSource, boolean resume) {
        List<SourcePlatform> sources = Arrays.stream(SourcePlatform.values())
            .filter(properties::isSourceEnabled)
            .toList();
        return runAll(sources, limitPerSource, resume);
    }

    public CrawlRunSummary runAll(List<SourcePlatform> sources, int limitPerSource, boolean resume) {
        Instant startedAt = clock.instant();
        Map<SourcePlatform, CompletableFuture<SourceRunSummary>> futures = new LinkedHashMap<>();
        for (SourcePlatform source : sources) {
            if (stopRequested.get()) {
                log.info("Stop requested, not starting source={}", source.code());
                break;
            }
            futures.put(source, CompletableFuture.supplyAsync(
                () -> runSource(source, limitPerSource, null, resume),
                sourceRunExecutor
            ));
        }

        List<SourceRunSummary> summaries = new ArrayList<>();
        for (Map.Entry<SourcePlatform, CompletableFuture<SourceRunSummary>> entry : futures.entrySet()) {
            try {
                summaries.add(entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Source run crashed source={}", entry.getKey().code(), cause);
                summaries.add(SourceRunSummary.failed(entry.getKey(), startedAt, clock.instant(), describe(cause)));
            }
        }

        int failedSources = 0;
        int succeeded = 0;
        int failed = 0;
        for (SourceRunSummary summary : summaries) {
            if (summary.isFailed()) {
                failedSources++;
            }
            succeeded += summary.urlsSucceeded();
            failed += summary.urlsFailed();
        }
        String status = stopRequested.get()
            ? STATUS_STOPPED
            : failedSources == 0 ? STATUS_COMPLETED : STATUS_PARTIAL;
        Instant finishedAt = clock.instant();
        log.info(
            "Crawl run finished sources={} failedSources={} urlsSucceeded={} urlsFailed={} duration={}s",
            summaries.size(),
            failedSources,
            succeeded,
            failed,
            Duration.between(startedAt, finishedAt).toSeconds()
        );
        return new CrawlRunSummary(startedAt, finishedAt, summaries.size(), failedSources, succeeded, failed, status, summaries);
    }

    public SourceRunSummary runSource(SourcePlatform source, int maxPerCategory, String targetCategory, boolean resume) {
        Instant startedAt = clock.instant();
        try {
            if (!properties.isSourceEnabled(source)) {
                log.info("Source disabled source={}", source.code());
                return new SourceRunSummary(source, startedAt, clock.instant(), 0, 0, 0, 0, 0, 0, STATUS_DISABLED, null, List.of());
            }
            boolean targeted = targetCategory != null && !targetCategory.isBlank();
            List<Category> categories = repository.findCategories(source, targeted ? targetCategory.trim() : null);
            Set<String> checkpointed = resume && !targeted
                ? repository.findCheckpointedCategoryIds(source, startedAt.minus(Duration.ofDays(properties.getResumeWindowDays())))
                : Set.of();
            List<Category> selected = categories.stream()
                .filter(category -> !checkpointed.contains(category.categoryId()))
                .toList();
            int skipped = categories.size() - selected.size();
            log.info("Source run start source={} categories={} skipped={} resume={} target={}",
                source.code(), selected.size(), skipped, resume, targeted ? targetCategory : "-");

            Semaphore permits = new Semaphore(properties.getUrlConcurrency());
            List<CategoryCrawlSummary> results = new ArrayList<>();
            int completed = 0;
            int failedCategories = 0;
            int urlsSucceeded = 0;
            int urlsFailed = 0;
            boolean stopped = false;
            for (Category category : selected) {
                if (stopRequested.get()) {
                    log.info("Stop requested, leaving remaining categories source={}", source.code());
                    stopped = true;
                    break;
                }
                CategoryCrawlSummary result = crawlCategory(source, category, maxPerCategory, permits);
                results.add(result);
                urlsSucceeded += result.urlsSucceeded();
                urlsFailed += result.urlsFailed();
                if (result.checkpointed()) {
                    completed++;
                } else {
                    failedCategories++;
                }
            }

            String status = stopped ? STATUS_STOPPED : failedCategories == 0 ? STATUS_COMPLETED : STATUS_PARTIAL;
            Instant finishedAt = clock.instant();
            log.info("Source run done source={} status={} completed={} failedCategories={} urlsSucceeded={} urlsFailed={}",
                source.code(), status, completed, failedCategories, urlsSucceeded, urlsFailed);
            return new SourceRunSummary(
                source,
                startedAt,
                finishedAt,
                selected.size(),
                skipped,
                completed,
                failedCategories,
                urlsSucceeded,
                urlsFailed,
                status,
                null,
                results
            );
        } catch (RuntimeException e) {
            log.error("Source run failed source={}", source.code(), e);
            return SourceRunSummary.failed(source, startedAt, clock.instant(), describe(e));
        }
    }

    private CategoryCrawlSummary crawlCategory(SourcePlatform source, Category category, int maxPerCategory, Semaphore permits) {
        String categoryId = category.categoryId();
        DiscoveryResult discovery;
        try {
            discovery = discoveryService.discoverCategory(source, categoryId, maxPerCategory);
        } catch (RuntimeException e) {
            log.error("Discovery crashed source={} category={}", source.code(), categoryId, e);
            return unmarked(category, 0, 0, 0, describe(e));
        }
        if (discovery.failed()) {
            return unmarked(category, 0, 0, 0, discovery.error());
        }

        List<String> urls = discovery.urls();
        List<CompletableFuture<CrawlOutcome>> futures = new ArrayList<>(urls.size());
        String fault = null;
        try {
            for (String url : urls) {
                if (stopRequested.get()) {
                    fault = "stopped";
                    break;
                }
                permits.acquire();
                try {
                    futures.add(CompletableFuture.supplyAsync(() -> {
                        try {
                            return postingCrawlerService.crawl(source, url, category);
                        } finally {
                            permits.release();
                        }
                    }, urlWorkerExecutor).exceptionally(e -> CrawlOutcome.failed(url, 0L, describe(e))));
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fault = "interrupted";
        } catch (RuntimeException e) {
            log.error("URL batch submission failed source={} category={}", source.code(), categoryId, e);
            fault = describe(e);
        }

        int succeeded = 0;
        int failed = 0;
        for (CompletableFuture<CrawlOutcome> future : futures) {
            CrawlOutcome outcome = future.join();
            if (outcome.success()) {
                succeeded++;
            } else {
                failed++;
                log.debug("URL failed source={} url={} error={}", source.code(), outcome.url(), outcome.error());
            }
        }
        if (fault != null) {
            log.warn("Category left unmarked source={} category={} reason={}", source.code(), categoryId, fault);
            return unmarked(category, urls.size(), succeeded, failed, fault);
        }

        try {
            repository.markCategoryCrawled(source, categoryId, clock.instant());
        } catch (RuntimeException e) {
            log.error("Checkpoint write failed source={} category={}", source.code(), categoryId, e);
            return unmarked(category, urls.size(), succeeded, failed, describe(e));
        }
        log.info("Category done source={} category={} urls={} succeeded={} failed={}",
            source.code(), categoryId, urls.size(), succeeded, failed);
        return new CategoryCrawlSummary(
            categoryId,
            category.displayName(),
            urls.size(),
            succeeded,
            failed,
            true,
            failed == 0 ? STATUS_COMPLETED : STATUS_PARTIAL,
            null
        );
    }

    private CrawlRunSummary execute(List<SourcePlatform> sources, CrawlRunRequest request) {
        int limit = request == null || request.limit() == null ? properties.getCli().getLimit() : Math.max(0, request.limit());
        boolean resume = request == null || request.resume() == null || request.resume();
        String category = request == null ? null : request.category();
        if (sources.size() == 1) {
            Instant startedAt = clock.instant();
            SourceRunSummary summary = runSource(sources.get(0), limit, category, resume);
            return new CrawlRunSummary(
                startedAt,
                clock.instant(),
                1,
                summary.isFailed() ? 1 : 0,
                summary.urlsSucceeded(),
                summary.urlsFailed(),
                summary.status(),
                List.of(summary)
            );
        }
        return runAll(sources, limit, resume);
    }

    List<SourcePlatform> resolveSources(String requested) {
        if (requested == null || requested.isBlank() || "all".equalsIgnoreCase(requested.trim())) {
            return Arrays.stream(SourcePlatform.values()).filter(properties::isSourceEnabled).toList();
        }
        List<SourcePlatform> sources = new ArrayList<>();
        for (String token : requested.split(",")) {
            if (token.isBlank()) {
                continue;
            }
            SourcePlatform source = SourcePlatform.fromCode(token.trim())
                .orElseThrow(() -> new UnknownSourceException(token.trim()));
            if (!sources.contains(source)) {
                sources.add(source);
            }
        }
        return sources;
    }

    private void beginRun() {
        if (!runActive.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException("A crawl run is already in progress");
        }
        stopRequested.set(false);
    }

    private static CategoryCrawlSummary unmarked(Category category, int discovered, int succeeded, int failed, String error) {
        return new CategoryCrawlSummary(
            category.categoryId(),
            category.displayName(),
            discovered,
            succeeded,
            failed,
            false,
            STATUS_FAILED,
            error
        );
    }

    private static String describe(Throwable error) {
        Throwable root = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
