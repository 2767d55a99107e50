package com.harvest.jobcrawler.crawl.http;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.FetchedDocument;
import com.harvest.jobcrawler.crawl.model.HttpFetchResult;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreaker;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreakerRegistry;
import com.harvest.jobcrawler.crawl.resilience.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Posting page fetch: short-lived cache, then the throttled HTTP fetch, then the browser fallback behind the
 * {@code render_fetch} breaker.
 */
@Service
public class DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(DocumentFetcher.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final int PRIMARY_ATTEMPTS = 2;

    private final PoliteHttpClient httpClient;
    private final Optional<RenderedPageFetcher> renderedPageFetcher;
    private final CircuitBreaker renderBreaker;
    private final Cache<String, String> cache;

    public DocumentFetcher(
        CrawlerProperties properties,
        PoliteHttpClient httpClient,
        Optional<RenderedPageFetcher> renderedPageFetcher,
        CircuitBreakerRegistry circuitBreakerRegistry
    ) {
        this.httpClient = httpClient;
        this.renderedPageFetcher = renderedPageFetcher;
        this.renderBreaker = circuitBreakerRegistry.get(CircuitBreakerRegistry.RENDER_FETCH);
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(properties.getDocumentCacheTtlSeconds()))
            .maximumSize(properties.getDocumentCacheMaxSize())
            .build();
    }

    /**
     * @return the document, or {@code null} when neither the primary fetch nor the fallback produced one
     */
    public FetchedDocument fetch(SourcePlatform source, String url) {
        String cached = cache.getIfPresent(url);
        if (cached != null) {
            return new FetchedDocument(url, cached, FetchedDocument.FetchVia.CACHE);
        }
        String primary = fetchPrimary(source, url);
        if (primary != null) {
            cache.put(url, primary);
            return new FetchedDocument(url, primary, FetchedDocument.FetchVia.PRIMARY);
        }
        String rendered = fetchRendered(url);
        if (rendered != null) {
            cache.put(url, rendered);
            return new FetchedDocument(url, rendered, FetchedDocument.FetchVia.RENDERED);
        }
        return null;
    }

    public String fetchPrimary(SourcePlatform source, String url) {
        HttpFetchResult result = httpClient.get(source, url, HTML_ACCEPT, PRIMARY_ATTEMPTS);
        if (result.statusCode() == 401 || result.statusCode() == 403) {
            log.info("Primary fetch refused source={} url={} status={}", source.code(), url, result.statusCode());
            return null;
        }
        if (result.isSuccessful() && result.hasBody()) {
            return result.body();
        }
        log.debug("Primary fetch failed source={} url={} failure={}", source.code(), url, result.describeFailure());
        return null;
    }

    public String fetchRendered(String url) {
        if (renderedPageFetcher.isEmpty()) {
            return null;
        }
        RenderedPageFetcher renderer = renderedPageFetcher.get();
        try {
            return renderBreaker.call(
                () -> renderer.fetchRendered(url),
                error -> !(error instanceof RenderingCapacityException)
            );
        } catch (CircuitOpenException | RenderingCapacityException e) {
            log.debug("Rendering fallback skipped url={} reason={}", url, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Rendering fallback failed url={} error={}", url, e.getMessage());
            return null;
        }
    }
}
