package com.visualsearch.crawler.crawl.model;

import java.util.List;

public record CrawlPageResult(
    String url,
    boolean success,
    Integer httpStatusCode,
    String contentType,
    String title,
    String contentHash,
    List<ProductCandidate> products,
    List<String> discoveredUrls,
    String error
) {
    public CrawlPageResult {
        products = products == null ? List.of() : List.copyOf(products);
        discoveredUrls = discoveredUrls == null ? List.of() : List.copyOf(discoveredUrls);
    }

    public static CrawlPageResult failure(String url, Integer httpStatusCode, String error) {
        return new CrawlPageResult(url, false, httpStatusCode, null, null, null, List.of(), List.of(), error);
    }
}
