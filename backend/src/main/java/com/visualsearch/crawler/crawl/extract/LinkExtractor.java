package com.visualsearch.crawler.crawl.extract;

import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Same-site anchors with query and fragment stripped, plus pagination links.
 */
public class LinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(LinkExtractor.class);

    public List<String> extract(Document document, String pageUrl, String paginationSelector) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String resolved = CrawlUrlUtils.resolve(pageUrl, anchor.attr("href"));
            if (resolved != null && CrawlUrlUtils.sameHost(pageUrl, resolved)) {
                links.add(CrawlUrlUtils.canonicalize(resolved));
            }
        }
        links.addAll(paginationLinks(document, pageUrl, paginationSelector));
        return new ArrayList<>(links);
    }

    /**
     * Pagination targets keep their query string, which usually carries the page number.
     */
    public List<String> paginationLinks(Document document, String pageUrl, String paginationSelector) {
        List<String> links = new ArrayList<>();
        if (paginationSelector == null || paginationSelector.isBlank()) {
            return links;
        }
        try {
            for (Element element : document.select(paginationSelector)) {
                String resolved = CrawlUrlUtils.resolve(pageUrl, element.attr("href"));
                if (resolved != null && !links.contains(resolved)) {
                    links.add(resolved);
                }
            }
        } catch (Selector.SelectorParseException e) {
            log.warn("Invalid pagination selector '{}': {}", paginationSelector, e.getMessage());
        }
        return links;
    }
}
