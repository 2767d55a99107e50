package com.harvest.jobcrawler.crawl.service;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.CategoryCrawlSummary;
import com.harvest.jobcrawler.crawl.model.CrawlRunRequest;
import com.harvest.jobcrawler.crawl.model.CrawlRunSummary;
import com.harvest.jobcrawler.crawl.model.SourceRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlerProperties.Cli cli = properties.getCli();
        CrawlRunRequest request = new CrawlRunRequest(
            cli.getSources(),
            cli.getLimit(),
            cli.getCategory(),
            cli.isResume()
        );

        CrawlRunSummary summary = crawlOrchestratorService.run(request);
        log.info("Crawl completed status={} sources={} failedSources={} urlsSucceeded={} urlsFailed={}",
            summary.status(),
            summary.sourcesAttempted(),
            summary.sourcesFailed(),
            summary.urlsSucceeded(),
            summary.urlsFailed()
        );
        for (SourceRunSummary source : summary.sources()) {
            log.info(
                "Summary {}: status={}, categories={}, skipped={}, completed={}, failed={}, urls ok/failed={}/{}{}",
                source.source().code(),
                source.status(),
                source.categoriesSelected(),
                source.categoriesSkipped(),
                source.categoriesCompleted(),
                source.categoriesFailed(),
                source.urlsSucceeded(),
                source.urlsFailed(),
                source.error() == null ? "" : ", error=" + source.error()
            );
            for (CategoryCrawlSummary category : source.categories()) {
                if (!category.checkpointed()) {
                    log.info("  unfinished category {} ({}): {}", category.categoryId(), category.categoryName(), category.error());
                }
            }
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.sourcesFailed() == 0 ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
