package com.visualsearch.crawler.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    String reasonPhrase,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUri == null ? requestedUrl : finalUri.toString();
    }

    /**
     * Human readable failure, e.g. {@code HTTP 500: Internal Server Error} or {@code Request timed out}.
     */
    public String describeFailure() {
        if (errorCode != null) {
            if ("timeout".equals(errorCode)) {
                return "Request timed out";
            }
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        String reason = reasonPhrase == null || reasonPhrase.isBlank() ? "" : ": " + reasonPhrase;
        return "HTTP " + statusCode + reason;
    }
}
