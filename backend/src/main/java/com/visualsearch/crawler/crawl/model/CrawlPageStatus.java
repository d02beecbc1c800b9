package com.visualsearch.crawler.crawl.model;

public enum CrawlPageStatus {
    SUCCEEDED,
    FAILED
}
