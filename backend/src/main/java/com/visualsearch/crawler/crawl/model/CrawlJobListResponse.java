package com.visualsearch.crawler.crawl.model;

import java.util.List;

public record CrawlJobListResponse(List<CrawlJobView> items, long totalCount, int page, int pageSize) {
}
