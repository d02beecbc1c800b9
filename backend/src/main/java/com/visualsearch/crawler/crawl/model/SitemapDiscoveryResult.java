package com.visualsearch.crawler.crawl.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<String> urls,
    Map<String, Integer> errors
) {
}
