package com.harvest.jobcrawler.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    public boolean isRateLimited() {
        return statusCode == 429 || statusCode == 449;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorMessage == null ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
