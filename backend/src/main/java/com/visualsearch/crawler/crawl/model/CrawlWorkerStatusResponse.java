package com.visualsearch.crawler.crawl.model;

import java.util.Map;

public record CrawlWorkerStatusResponse(
    boolean running,
    String workerId,
    int activeLoopCount,
    Map<String, Long> jobsInProgress,
    CrawlJobStats stats
) {
}
