package com.visualsearch.crawler.crawl.model;

import java.time.Instant;

public record CrawlJob(
    long id,
    long providerId,
    String startUrl,
    String sitemapUrl,
    Integer maxPages,
    CrawlJobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant pausedAt,
    Instant canceledAt,
    Instant completedAt,
    String leaseOwner,
    Instant leaseExpiresAt,
    String errorMessage,
    long version
) {
    public boolean isLeasedBy(String workerId) {
        return status == CrawlJobStatus.RUNNING && workerId != null && workerId.equals(leaseOwner);
    }
}
