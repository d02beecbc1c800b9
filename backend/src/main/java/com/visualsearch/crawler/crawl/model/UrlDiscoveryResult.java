package com.visualsearch.crawler.crawl.model;

import java.util.List;

/**
 * Candidate URLs for a job. When {@code followLinks} is set, links surfaced by
 * page fetches are added to the frontier as well.
 */
public record UrlDiscoveryResult(List<String> urls, String source, boolean followLinks) {
    public UrlDiscoveryResult {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
