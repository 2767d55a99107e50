package com.harvest.jobcrawler.crawl.http;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.HttpFetchResult;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.throttle.AdaptiveThrottler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final AdaptiveThrottler throttler;

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        AdaptiveThrottler throttler
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.throttler = throttler;
    }

    /**
     * Throttle-gated GET against a crawled source, retried on transient failures.
     */
    public HttpFetchResult get(SourcePlatform source, String url, String acceptHeader) {
        return get(source, url, acceptHeader, 1 + properties.getRequestMaxRetries());
    }

    public HttpFetchResult get(SourcePlatform source, String url, String acceptHeader, int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Instant startedAt = Instant.now();
            if (!throttler.acquire(source)) {
                return errorResult(url, startedAt, "throttle_timeout", "no throttle slot for " + source.code());
            }
            lastResult = executeOnce(source, url, "GET", acceptHeader, null, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
            if (lastResult.isRateLimited()) {
                throttler.report429(source, null);
            } else if (lastResult.isSuccessful()) {
                throttler.reportSuccess(source);
            }
            if (!shouldRetry(lastResult) || attempt >= attempts) {
                return lastResult;
            }
            log.debug("Retrying request source={} url={} attempt={} failure={}",
                source.code(), url, attempt, lastResult.describeFailure());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    /**
     * Plain GET for services that are not crawl targets, such as the geocoder.
     */
    public HttpFetchResult get(String url, String acceptHeader) {
        return executeOnce(null, url, "GET", acceptHeader, null, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    public HttpFetchResult postJson(String url, String jsonBody, Duration timeout) {
        return executeOnce(null, url, "POST", "application/json", jsonBody == null ? "" : jsonBody, timeout);
    }

    private HttpFetchResult executeOnce(
        SourcePlatform source,
        String url,
        String method,
        String acceptHeader,
        String body,
        Duration timeout
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "zh-TW,zh;q=0.9,en-US;q=0.8,en;q=0.7");
            if (source != null) {
                builder.header("Referer", properties.baseUrlFor(source) + "/");
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted") && !errorCode.equals("throttle_timeout");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status == 449 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) (baseDelayMs * Math.pow(properties.getRetryBackoffFactor(), Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
