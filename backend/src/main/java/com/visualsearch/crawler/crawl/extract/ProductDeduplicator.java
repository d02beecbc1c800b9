package com.visualsearch.crawler.crawl.extract;

import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps the first candidate per identity. A candidate is identified by {@code sku:<externalId>}
 * and, when it names its own product URL, by {@code url:<canonical url>}; a candidate with
 * neither is identified by the canonical page URL. Matching either key makes it a duplicate.
 */
public final class ProductDeduplicator {
    private ProductDeduplicator() {
    }

    public static List<ProductCandidate> dedupe(List<ProductCandidate> candidates, String pageUrl) {
        Set<String> seen = new HashSet<>();
        List<ProductCandidate> unique = new ArrayList<>();
        for (ProductCandidate candidate : candidates) {
            List<String> keys = keysOf(candidate, pageUrl);
            if (keys.isEmpty() || keys.stream().anyMatch(seen::contains)) {
                continue;
            }
            seen.addAll(keys);
            unique.add(candidate);
        }
        return unique;
    }

    static List<String> keysOf(ProductCandidate candidate, String pageUrl) {
        List<String> keys = new ArrayList<>(2);
        if (candidate.externalId() != null && !candidate.externalId().isBlank()) {
            keys.add("sku:" + candidate.externalId().trim().toLowerCase(Locale.ROOT));
        }
        String url = candidate.productUrl();
        if (url == null && keys.isEmpty()) {
            url = pageUrl;
        }
        String canonical = CrawlUrlUtils.canonicalize(url);
        if (canonical != null) {
            keys.add("url:" + canonical.toLowerCase(Locale.ROOT));
        }
        return keys;
    }
}
