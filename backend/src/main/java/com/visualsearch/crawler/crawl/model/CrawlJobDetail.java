package com.visualsearch.crawler.crawl.model;

import java.util.List;

public record CrawlJobDetail(CrawlJobView job, List<CrawlPage> recentPages) {
}
