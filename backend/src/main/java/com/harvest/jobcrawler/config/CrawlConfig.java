package com.harvest.jobcrawler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.throttle.JdbcThrottleStateStore;
import com.harvest.jobcrawler.crawl.throttle.LocalThrottleStateStore;
import com.harvest.jobcrawler.crawl.throttle.ThrottleStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean(name = "sourceRunExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceRunExecutor() {
        return Executors.newFixedThreadPool(SourcePlatform.values().length);
    }

    @Bean(name = "urlWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService urlWorkerExecutor(CrawlerProperties properties) {
        int size = properties.getUrlConcurrency() * SourcePlatform.values().length;
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "discoveryExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor() {
        return Executors.newFixedThreadPool(Math.max(4, SourcePlatform.values().length * 2));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(4, properties.getUrlConcurrency() * 2));
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(CrawlerProperties properties) {
        CrawlerProperties.Enrichment enrichment = properties.getEnrichment();
        return new ThreadPoolExecutor(
            enrichment.getThreads(),
            enrichment.getThreads(),
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(enrichment.getQueueCapacity()),
            (task, executor) -> log.warn("Enrichment queue full, dropping task queueSize={}", executor.getQueue().size())
        );
    }

    @Bean
    public ThrottleStateStore throttleStateStore(
        CrawlerProperties properties,
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate
    ) {
        String store = properties.getThrottle().getStore().toLowerCase(Locale.ROOT);
        if ("local".equals(store)) {
            log.info("Using in-process throttle state");
            return new LocalThrottleStateStore();
        }
        if (!"jdbc".equals(store)) {
            throw new IllegalStateException("Unsupported crawler.throttle.store: " + store);
        }
        return new JdbcThrottleStateStore(jdbc, transactionTemplate);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
