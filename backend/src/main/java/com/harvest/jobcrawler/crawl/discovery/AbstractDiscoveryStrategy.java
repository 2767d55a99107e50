package com.harvest.jobcrawler.crawl.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

public abstract class AbstractDiscoveryStrategy implements DiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(AbstractDiscoveryStrategy.class);
    protected static final String JSON_ACCEPT = "application/json, text/plain, */*";
    protected static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    protected final PoliteHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final CrawlerProperties properties;
    private final ExecutorService discoveryExecutor;

    protected AbstractDiscoveryStrategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        ExecutorService discoveryExecutor
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.discoveryExecutor = discoveryExecutor;
    }

    protected String baseUrl() {
        return properties.baseUrlFor(source());
    }

    /**
     * Fetches a listing page. A failed first page aborts discovery; a failed later page yields {@code null}.
     */
    protected String fetchPage(String url, String accept, boolean firstPage) {
        HttpFetchResult result = httpClient.get(source(), url, accept);
        if (result.isSuccessful() && result.body() != null) {
            return result.body();
        }
        String failure = result.describeFailure();
        if (firstPage) {
            throw new DiscoveryException("Listing unavailable source=" + source().code() + " url=" + url + " failure=" + failure);
        }
        log.warn("Listing page failed, truncating source={} url={} failure={}", source().code(), url, failure);
        return null;
    }

    protected JsonNode fetchJson(String url, boolean firstPage) {
        String body = fetchPage(url, JSON_ACCEPT, firstPage);
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            if (firstPage) {
                throw new DiscoveryException("Listing was not JSON source=" + source().code() + " url=" + url, e);
            }
            log.warn("Listing page was not JSON source={} url={}", source().code(), url);
            return null;
        }
    }

    /**
     * Fetches {@code pages} with at most {@code concurrency} requests in flight, appending each page's links
     * to {@code sink} in page order. No further page is started once {@code limit} links have arrived.
     */
    protected void collectPages(List<Integer> pages, int concurrency, IntFunction<List<String>> pageFetcher, List<String> sink, int limit) {
        Semaphore inFlight = new Semaphore(Math.max(1, concurrency));
        AtomicInteger collected = new AtomicInteger(sink.size());
        List<CompletableFuture<List<String>>> futures = new ArrayList<>();
        for (Integer page : pages) {
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while paging source={} page={}", source().code(), page);
                break;
            }
            if (limit > 0 && collected.get() >= limit) {
                inFlight.release();
                break;
            }
            CompletableFuture<List<String>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> safePage(pageFetcher, page), discoveryExecutor);
            } catch (RejectedExecutionException e) {
                inFlight.release();
                log.warn("Listing page rejected source={} page={}", source().code(), page);
                break;
            }
            futures.add(future.whenComplete((links, error) -> {
                if (links != null) {
                    collected.addAndGet(links.size());
                }
                inFlight.release();
            }));
        }
        for (CompletableFuture<List<String>> future : futures) {
            try {
                sink.addAll(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Listing page task failed source={} error={}", source().code(), cause.getMessage());
            }
        }
    }

    protected static List<Integer> pageRange(int fromInclusive, int toInclusive) {
        List<Integer> pages = new ArrayList<>();
        for (int page = fromInclusive; page <= toInclusive; page++) {
            pages.add(page);
        }
        return pages;
    }

    protected static boolean reached(List<String> urls, int limit) {
        return limit > 0 && urls.size() >= limit;
    }

    protected static List<String> truncate(List<String> urls, int limit) {
        if (limit <= 0 || urls.size() <= limit) {
            return urls;
        }
        return new ArrayList<>(urls.subList(0, limit));
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private List<String> safePage(IntFunction<List<String>> pageFetcher, int page) {
        try {
            List<String> links = pageFetcher.apply(page);
            return links == null ? List.of() : links;
        } catch (RuntimeException e) {
            log.warn("Listing page failed source={} page={} error={}", source().code(), page, e.getMessage());
            return List.of();
        }
    }
}
