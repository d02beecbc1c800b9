package com.visualsearch.crawler.crawl.model;

public record ProviderCrawlSettings(
    long providerId,
    String name,
    String websiteUrl,
    CrawlerType crawlerType,
    CrawlerConfig config
) {
}
