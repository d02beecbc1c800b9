package com.visualsearch.crawler.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBotDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("VisualSearchBot/1.0"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
    }

    @Test
    void leaseRenewalStaysBelowLeaseDuration() {
        CrawlerProperties.Worker worker = new CrawlerProperties().getWorker();
        worker.setLeaseSeconds(30);
        worker.setLeaseRenewalSeconds(60);
        assertEquals(29, worker.getLeaseRenewalSeconds());

        worker.setLeaseRenewalSeconds(10);
        assertEquals(10, worker.getLeaseRenewalSeconds());
    }
}
