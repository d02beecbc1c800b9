package com.visualsearch.crawler.crawl.model;

public record CreateCrawlJobRequest(Long providerId, String startUrl, String sitemapUrl, Integer maxPages) {
}
