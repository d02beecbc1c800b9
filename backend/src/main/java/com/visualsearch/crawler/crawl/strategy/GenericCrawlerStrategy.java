package com.visualsearch.crawler.crawl.strategy;

import com.visualsearch.crawler.crawl.extract.ProductExtractor;
import com.visualsearch.crawler.crawl.http.PoliteHttpClient;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.CrawlerType;
import com.visualsearch.crawler.crawl.model.HttpFetchResult;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.model.SitemapDiscoveryResult;
import com.visualsearch.crawler.crawl.model.UrlDiscoveryResult;
import com.visualsearch.crawler.crawl.robots.RobotsTxtService;
import com.visualsearch.crawler.crawl.sitemap.SitemapService;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import com.visualsearch.crawler.crawl.util.HashUtils;
import com.visualsearch.crawler.crawl.util.UrlPatternFilter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain HTTP fetch and HTML parse.
 */
@Component
public class GenericCrawlerStrategy implements CrawlerStrategy {
    private static final Logger log = LoggerFactory.getLogger(GenericCrawlerStrategy.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final List<String> PROBE_PATHS = List.of("/sitemap.xml", "/sitemap_index.xml", "/robots.txt");

    private final PoliteHttpClient httpClient;
    private final SitemapService sitemapService;
    private final RobotsTxtService robotsTxtService;
    private final ProductExtractor productExtractor;

    public GenericCrawlerStrategy(
        PoliteHttpClient httpClient,
        SitemapService sitemapService,
        RobotsTxtService robotsTxtService,
        ProductExtractor productExtractor
    ) {
        this.httpClient = httpClient;
        this.sitemapService = sitemapService;
        this.robotsTxtService = robotsTxtService;
        this.productExtractor = productExtractor;
    }

    @Override
    public CrawlerType type() {
        return CrawlerType.GENERIC;
    }

    @Override
    public UrlDiscoveryResult discoverUrls(String startUrl, String sitemapUrl, CrawlerConfig config, int maxPages)
        throws DiscoveryException {
        if (!CrawlUrlUtils.isHttpUrl(startUrl)) {
            throw new DiscoveryException("Start URL is not a valid http(s) URL: " + startUrl);
        }
        UrlPatternFilter filter = UrlPatternFilter.of(config.getIncludePatterns(), config.getExcludePatterns());

        List<String> sources = new ArrayList<>();
        if (sitemapUrl != null && !sitemapUrl.isBlank()) {
            sources.add(sitemapUrl.trim());
        }
        String root = CrawlUrlUtils.siteRoot(startUrl);
        for (String path : PROBE_PATHS) {
            sources.add(root + path);
        }

        for (String source : sources) {
            SitemapDiscoveryResult result = sitemapService.resolve(List.of(source), config.getUserAgent());
            List<String> urls = capDistinct(filter.apply(result.urls()), maxPages);
            if (!urls.isEmpty()) {
                log.info("Discovered {} urls from {} ({} sitemap documents)", urls.size(), source, result.fetchedSitemaps().size());
                return new UrlDiscoveryResult(urls, source, false);
            }
            log.debug("No usable urls from {} errors={}", source, result.errors());
        }

        log.warn("No sitemap urls found for {}, following links from the start url", startUrl);
        return new UrlDiscoveryResult(List.of(startUrl.trim()), "start_url", true);
    }

    @Override
    public CrawlPageResult fetchAndExtract(String url, CrawlerConfig config) throws InterruptedException {
        if (config.isRespectRobotsTxt() && !robotsTxtService.isAllowed(url, config.getUserAgent())) {
            return CrawlPageResult.failure(url, null, "blocked_by_robots");
        }
        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, config.getUserAgent(), config.getRequestDelayMs());
        if ("interrupted".equals(fetch.errorCode())) {
            throw new InterruptedException("Fetch interrupted for " + url);
        }
        if (!fetch.isSuccessful()) {
            return CrawlPageResult.failure(url, fetch.statusCode() > 0 ? fetch.statusCode() : null, fetch.describeFailure());
        }

        String body = fetch.body() == null ? "" : fetch.body();
        String baseUrl = fetch.finalUrlOrRequested();
        Document document = Jsoup.parse(body, baseUrl);
        List<ProductCandidate> products = productExtractor.extractProducts(document, url, config);
        List<String> links = productExtractor.extractLinks(document, baseUrl, config);
        return new CrawlPageResult(
            url,
            true,
            fetch.statusCode(),
            fetch.contentType(),
            document.title(),
            HashUtils.contentHash(body),
            products,
            links,
            null
        );
    }

    /**
     * Case-insensitive dedupe in encounter order, then the page budget.
     */
    static List<String> capDistinct(Collection<String> urls, int maxPages) {
        Map<String, String> distinct = new LinkedHashMap<>();
        for (String url : urls) {
            distinct.putIfAbsent(CrawlUrlUtils.dedupeKey(url), url);
        }
        return distinct.values().stream().limit(Math.max(0, maxPages)).toList();
    }
}
