package com.visualsearch.crawler.crawl.model;

public record CrawlJobStats(
    long total,
    long queued,
    long running,
    long paused,
    long succeeded,
    long failed,
    long canceled
) {
}
