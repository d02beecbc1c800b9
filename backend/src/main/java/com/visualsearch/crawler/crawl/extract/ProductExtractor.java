package com.visualsearch.crawler.crawl.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extraction chain for one HTML page: structured data and configured selectors are combined,
 * the Open Graph fallback is only consulted when both produce nothing. Results are deduplicated
 * in encounter order and candidates without their own URL get the page URL.
 */
@Component
public class ProductExtractor {
    public static final String DEFAULT_CURRENCY = "EUR";
    private static final Logger log = LoggerFactory.getLogger(ProductExtractor.class);

    private final StructuredDataExtractor structuredDataExtractor;
    private final SelectorProductExtractor selectorExtractor;
    private final PageMetadataExtractor pageMetadataExtractor;
    private final LinkExtractor linkExtractor = new LinkExtractor();

    public ProductExtractor(ObjectMapper objectMapper) {
        this.structuredDataExtractor = new StructuredDataExtractor(objectMapper);
        this.selectorExtractor = new SelectorProductExtractor(objectMapper);
        this.pageMetadataExtractor = new PageMetadataExtractor(objectMapper);
    }

    public List<ProductCandidate> extractProducts(String html, String pageUrl, CrawlerConfig config) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        return extractProducts(Jsoup.parse(html, pageUrl), pageUrl, config);
    }

    public List<ProductCandidate> extractProducts(Document document, String pageUrl, CrawlerConfig config) {
        List<ProductCandidate> candidates = new ArrayList<>(structuredDataExtractor.extract(document, pageUrl));
        candidates.addAll(selectorExtractor.extract(document, pageUrl, config));
        if (candidates.isEmpty()) {
            pageMetadataExtractor.extract(document, pageUrl).ifPresent(candidates::add);
        }
        List<ProductCandidate> unique = ProductDeduplicator.dedupe(candidates, pageUrl);
        if (unique.size() < candidates.size()) {
            log.debug("Dropped {} duplicate candidates on {}", candidates.size() - unique.size(), pageUrl);
        }
        List<ProductCandidate> products = new ArrayList<>(unique.size());
        for (ProductCandidate candidate : unique) {
            products.add(candidate.productUrl() == null ? candidate.withProductUrl(pageUrl) : candidate);
        }
        return products;
    }

    public List<String> extractLinks(Document document, String pageUrl, CrawlerConfig config) {
        return linkExtractor.extract(document, pageUrl, config.getPaginationSelector());
    }

    public List<String> extractPaginationLinks(Document document, String pageUrl, String paginationSelector) {
        return linkExtractor.paginationLinks(document, pageUrl, paginationSelector);
    }
}
