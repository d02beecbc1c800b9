package com.visualsearch.crawler.crawl.http;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(2);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setUserAgent("VisualSearchBot/1.0 (+https://visualsearch.example/bot)");
        executor = Executors.newFixedThreadPool(2);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void sendsConfiguredUserAgentAndReturnsBody() throws Exception {
        server.enqueue(new MockResponse().setBody("<html>ok</html>").setHeader("Content-Type", "text/html"));

        HttpFetchResult result = client.get(server.url("/p/1").toString(), "text/html", null, 0);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(result.contentType()).startsWith("text/html");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).startsWith("VisualSearchBot/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("text/html");
    }

    @Test
    void providerUserAgentOverridesDefault() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        client.get(server.url("/p/2").toString(), null, "ShopPartnerBot/2.0", 0);

        assertThat(server.takeRequest().getHeader("User-Agent")).isEqualTo("ShopPartnerBot/2.0");
    }

    @Test
    void serverErrorIsDescribedWithReasonPhrase() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        HttpFetchResult result = client.get(server.url("/p/3").toString(), "text/html", null, 0);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.describeFailure()).isEqualTo("HTTP 500: Internal Server Error");
    }

    @Test
    void malformedUrlIsReportedWithoutRequest() {
        HttpFetchResult result = client.get("https://exa mple.com/p", "text/html", null, 0);

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void retryAfterSecondsAreHonoredWithinBounds() {
        assertThat(PoliteHttpClient.backoffFor("120")).isEqualTo(Duration.ofSeconds(120));
        assertThat(PoliteHttpClient.backoffFor("86400")).isEqualTo(Duration.ofMinutes(5));
        assertThat(PoliteHttpClient.backoffFor(null)).isEqualTo(Duration.ofSeconds(30));
        assertThat(PoliteHttpClient.backoffFor("Wed, 21 Oct 2026 07:28:00 GMT")).isEqualTo(Duration.ofSeconds(30));
    }
}
