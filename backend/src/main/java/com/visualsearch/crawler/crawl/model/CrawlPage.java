package com.visualsearch.crawler.crawl.model;

import java.time.Instant;

public record CrawlPage(
    long id,
    long jobId,
    String url,
    CrawlPageStatus status,
    Integer httpStatusCode,
    String contentType,
    String title,
    String contentHash,
    int productsExtracted,
    String errorMessage,
    Instant fetchedAt
) {
}
