package com.visualsearch.crawler.crawl.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.extract.ProductExtractor;
import com.visualsearch.crawler.crawl.http.PoliteHttpClient;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.UrlDiscoveryResult;
import com.visualsearch.crawler.crawl.robots.RobotsTxtService;
import com.visualsearch.crawler.crawl.sitemap.SitemapService;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenericCrawlerStrategyTest {
    private MockWebServer server;
    private ExecutorService executor;
    private GenericCrawlerStrategy strategy;
    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                MockResponse response = routes.get(request.getPath());
                return response == null ? new MockResponse().setResponseCode(404) : response;
            }
        });
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(2);
        PoliteHttpClient httpClient = new PoliteHttpClient(properties, executor);
        strategy = new GenericCrawlerStrategy(
            httpClient,
            new SitemapService(httpClient, properties),
            new RobotsTxtService(properties, httpClient, Clock.systemUTC()),
            new ProductExtractor(new ObjectMapper())
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void discoversFromProbedSitemapWithFiltersAndBudget() throws Exception {
        routes.put("/sitemap.xml", xml(
            "<urlset>"
                + "<url><loc>" + url("/p/1") + "</loc></url>"
                + "<url><loc>" + url("/about") + "</loc></url>"
                + "<url><loc>" + url("/p/2") + "</loc></url>"
                + "<url><loc>" + url("/p/3") + "</loc></url>"
                + "</urlset>"));
        CrawlerConfig config = config();
        config.setIncludePatterns(List.of("/p/"));

        UrlDiscoveryResult result = strategy.discoverUrls(url("/"), null, config, 2);

        assertThat(result.urls()).containsExactly(url("/p/1"), url("/p/2"));
        assertThat(result.source()).endsWith("/sitemap.xml");
        assertThat(result.followLinks()).isFalse();
    }

    @Test
    void explicitSitemapIsTriedFirst() throws Exception {
        routes.put("/feeds/products.xml", xml("<urlset><url><loc>" + url("/p/9") + "</loc></url></urlset>"));
        routes.put("/sitemap.xml", xml("<urlset><url><loc>" + url("/p/1") + "</loc></url></urlset>"));

        UrlDiscoveryResult result = strategy.discoverUrls(url("/"), url("/feeds/products.xml"), config(), 10);

        assertThat(result.urls()).containsExactly(url("/p/9"));
    }

    @Test
    void fallsBackToStartUrlAndLinkFollowing() throws Exception {
        UrlDiscoveryResult result = strategy.discoverUrls(url("/catalog"), null, config(), 10);

        assertThat(result.urls()).containsExactly(url("/catalog"));
        assertThat(result.source()).isEqualTo("start_url");
        assertThat(result.followLinks()).isTrue();
    }

    @Test
    void rejectsNonHttpStartUrl() {
        assertThatThrownBy(() -> strategy.discoverUrls("ftp://shop.example.com", null, config(), 10))
            .isInstanceOf(DiscoveryException.class);
    }

    @Test
    void fetchExtractsProductsAndLinks() throws Exception {
        routes.put("/p/1", html(
            """
                <html><head><title>Oak Chair | Shop</title>
                <script type="application/ld+json">
                  {"@type":"Product","name":"Oak Chair","sku":"CH-1","offers":{"price":"129.00","priceCurrency":"EUR"}}
                </script></head>
                <body><a href="/p/2?ref=related">related</a></body></html>
                """));

        CrawlPageResult result = strategy.fetchAndExtract(url("/p/1"), config());

        assertThat(result.success()).isTrue();
        assertThat(result.httpStatusCode()).isEqualTo(200);
        assertThat(result.title()).isEqualTo("Oak Chair | Shop");
        assertThat(result.contentHash()).hasSize(64);
        assertThat(result.products()).hasSize(1);
        assertThat(result.products().get(0).price()).isEqualByComparingTo(new BigDecimal("129.00"));
        assertThat(result.products().get(0).productUrl()).isEqualTo(url("/p/1"));
        assertThat(result.discoveredUrls()).contains(url("/p/2"));
    }

    @Test
    void serverErrorBecomesFailedPage() throws Exception {
        routes.put("/p/broken", new MockResponse().setResponseCode(500).setBody("boom"));

        CrawlPageResult result = strategy.fetchAndExtract(url("/p/broken"), config());

        assertThat(result.success()).isFalse();
        assertThat(result.httpStatusCode()).isEqualTo(500);
        assertThat(result.error()).isEqualTo("HTTP 500: Internal Server Error");
    }

    @Test
    void robotsDisallowBlocksFetch() throws Exception {
        routes.put("/robots.txt", new MockResponse().setBody("User-agent: *\nDisallow: /private\n"));
        routes.put("/private/p", html("<html></html>"));

        CrawlPageResult blocked = strategy.fetchAndExtract(url("/private/p"), config());

        assertThat(blocked.success()).isFalse();
        assertThat(blocked.error()).isEqualTo("blocked_by_robots");

        CrawlerConfig ignoring = config();
        ignoring.setRespectRobotsTxt(false);
        assertThat(strategy.fetchAndExtract(url("/private/p"), ignoring).success()).isTrue();
    }

    @Test
    void capDistinctIgnoresCase() {
        assertThat(GenericCrawlerStrategy.capDistinct(List.of("https://a/P/1", "https://a/p/1", "https://a/p/2"), 5))
            .containsExactly("https://a/P/1", "https://a/p/2");
    }

    private CrawlerConfig config() {
        CrawlerConfig config = new CrawlerConfig();
        config.setRequestDelayMs(0);
        return config;
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    private static MockResponse xml(String body) {
        return new MockResponse().setHeader("Content-Type", "application/xml").setBody(body);
    }

    private static MockResponse html(String body) {
        return new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(body);
    }
}
