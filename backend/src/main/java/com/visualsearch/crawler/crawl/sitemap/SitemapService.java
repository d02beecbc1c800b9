package com.visualsearch.crawler.crawl.sitemap;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.http.PoliteHttpClient;
import com.visualsearch.crawler.crawl.model.HttpFetchResult;
import com.visualsearch.crawler.crawl.model.SitemapDiscoveryResult;
import com.visualsearch.crawler.crawl.robots.RobotsRules;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Resolves sitemaps, sitemap indexes and robots.txt {@code Sitemap:} pointers into page URLs.
 * Nested documents are bounded by {@code crawler.sitemap.max-nested-sitemaps}, so self references
 * and cycles always terminate.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;

    public SitemapService(PoliteHttpClient httpClient, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public SitemapDiscoveryResult resolve(List<String> seeds, String userAgent) {
        int maxNested = properties.getSitemap().getMaxNestedSitemaps();
        int maxUrls = properties.getSitemap().getMaxUrls();

        ArrayDeque<String> queue = new ArrayDeque<>();
        Set<String> queued = new LinkedHashSet<>();
        for (String seed : seeds) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null && queued.add(normalized)) {
                queue.addLast(normalized);
            }
        }
        int nestedBudget = maxNested;

        List<String> fetched = new ArrayList<>();
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        while (!queue.isEmpty() && urls.size() < maxUrls) {
            String current = queue.removeFirst();
            List<String> children = new ArrayList<>();
            try {
                if (isRobotsTxt(current)) {
                    children.addAll(readRobotsSitemaps(current, userAgent));
                } else {
                    readSitemap(current, userAgent, children, urls, maxUrls);
                }
                fetched.add(current);
            } catch (SitemapFetchException e) {
                log.warn("Skipping sitemap {}: {}", current, e.getMessage());
                increment(errors, e.getErrorKey());
                continue;
            }

            for (String child : children) {
                if (nestedBudget <= 0) {
                    log.warn("Nested sitemap limit {} reached, ignoring remaining entries under {}", maxNested, current);
                    increment(errors, "nested_sitemap_limit");
                    break;
                }
                String normalizedChild = normalizeSitemapUrl(CrawlUrlUtils.resolve(current, child));
                if (normalizedChild != null && queued.add(normalizedChild)) {
                    queue.addLast(normalizedChild);
                    nestedBudget--;
                }
            }
        }

        return new SitemapDiscoveryResult(fetched, new ArrayList<>(urls), errors);
    }

    private List<String> readRobotsSitemaps(String robotsUrl, String userAgent) throws SitemapFetchException {
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,*/*;q=0.1", userAgent, 0);
        if (!fetch.isSuccessful()) {
            throw new SitemapFetchException(errorKey(fetch), fetch.describeFailure());
        }
        return RobotsRules.parse(fetch.body()).getSitemapUrls();
    }

    private void readSitemap(
        String sitemapUrl,
        String userAgent,
        List<String> children,
        Set<String> urls,
        int maxUrls
    ) throws SitemapFetchException {
        HttpFetchResult fetch = httpClient.get(sitemapUrl, SITEMAP_ACCEPT, userAgent, 0);
        if (!fetch.isSuccessful()) {
            throw new SitemapFetchException(errorKey(fetch), fetch.describeFailure());
        }
        String xmlPayload;
        try {
            xmlPayload = extractXmlPayload(fetch);
        } catch (IOException e) {
            throw new SitemapFetchException("gzip_decode_error", e.getMessage());
        }
        if (xmlPayload == null || xmlPayload.isBlank()) {
            throw new SitemapFetchException("empty_sitemap_payload", "empty body");
        }

        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        for (Element loc : xml.select("sitemap > loc")) {
            String child = loc.text().trim();
            if (!child.isEmpty()) {
                children.add(child);
            }
        }
        for (Element urlElement : xml.select("url")) {
            Element locElement = urlElement.selectFirst("loc");
            if (locElement == null || urls.size() >= maxUrls) {
                continue;
            }
            String loc = CrawlUrlUtils.resolve(sitemapUrl, locElement.text());
            if (loc != null) {
                urls.add(loc);
            }
        }
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    static String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    /**
     * The JDK client never inflates bodies, so gzip payloads (".gz" files or a gzip
     * Content-Encoding) always arrive with the gzip magic bytes.
     */
    private static boolean isGzipPayload(byte[] bodyBytes) {
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private static boolean isRobotsTxt(String url) {
        URI uri = CrawlUrlUtils.safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        return path.endsWith("/robots.txt");
    }

    private static String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.contains("://")) {
            normalized = "https://" + normalized;
        }
        return CrawlUrlUtils.isHttpUrl(normalized) ? normalized : null;
    }

    static class SitemapFetchException extends Exception {
        private final String errorKey;

        SitemapFetchException(String errorKey, String message) {
            super(message);
            this.errorKey = errorKey;
        }

        String getErrorKey() {
            return errorKey;
        }
    }
}
