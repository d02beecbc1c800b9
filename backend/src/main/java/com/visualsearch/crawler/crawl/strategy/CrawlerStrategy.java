package com.visualsearch.crawler.crawl.strategy;

import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.CrawlerType;
import com.visualsearch.crawler.crawl.model.UrlDiscoveryResult;

/**
 * How one kind of provider site is crawled. Implementations are stateless across calls;
 * page failures are reported in the result, never thrown.
 */
public interface CrawlerStrategy {

    CrawlerType type();

    /**
     * @throws DiscoveryException when no URL at all can be produced for the job
     */
    UrlDiscoveryResult discoverUrls(String startUrl, String sitemapUrl, CrawlerConfig config, int maxPages)
        throws DiscoveryException;

    /**
     * @throws InterruptedException when the job is stopped while this page is in flight
     */
    CrawlPageResult fetchAndExtract(String url, CrawlerConfig config) throws InterruptedException;
}
