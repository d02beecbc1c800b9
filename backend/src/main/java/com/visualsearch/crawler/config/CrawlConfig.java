package com.visualsearch.crawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.visualsearch.crawler.crawl.model.CrawlerType;
import com.visualsearch.crawler.crawl.strategy.BrowserRenderedCrawlerStrategy;
import com.visualsearch.crawler.crawl.strategy.CrawlerStrategyRegistry;
import com.visualsearch.crawler.crawl.strategy.GenericCrawlerStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class CrawlConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "leaseHeartbeatScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService leaseHeartbeatScheduler(CrawlerProperties properties) {
        return Executors.newScheduledThreadPool(Math.max(1, properties.getWorker().getWorkerCount()), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-lease-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CrawlerStrategyRegistry crawlerStrategyRegistry(
        GenericCrawlerStrategy genericStrategy,
        BrowserRenderedCrawlerStrategy browserRenderedStrategy
    ) {
        return new CrawlerStrategyRegistry(Map.of(
            CrawlerType.GENERIC, genericStrategy,
            CrawlerType.BROWSER_RENDERED, browserRenderedStrategy
        ));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
