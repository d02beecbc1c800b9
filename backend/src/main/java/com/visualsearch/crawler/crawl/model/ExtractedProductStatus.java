package com.visualsearch.crawler.crawl.model;

public enum ExtractedProductStatus {
    PENDING,
    APPROVED,
    REJECTED,
    DUPLICATE
}
