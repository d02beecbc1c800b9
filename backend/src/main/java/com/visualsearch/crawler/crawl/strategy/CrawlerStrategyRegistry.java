package com.visualsearch.crawler.crawl.strategy;

import com.visualsearch.crawler.crawl.model.CrawlerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed mapping from provider crawler type to strategy, built once at startup.
 */
public class CrawlerStrategyRegistry {
    private static final Logger log = LoggerFactory.getLogger(CrawlerStrategyRegistry.class);

    private final Map<CrawlerType, CrawlerStrategy> strategies;

    public CrawlerStrategyRegistry(Map<CrawlerType, CrawlerStrategy> strategies) {
        if (!strategies.containsKey(CrawlerType.GENERIC)) {
            throw new IllegalArgumentException("A generic strategy is required");
        }
        this.strategies = new EnumMap<>(strategies);
    }

    public CrawlerStrategy resolve(CrawlerType type) {
        CrawlerStrategy strategy = type == null ? null : strategies.get(type);
        if (strategy == null) {
            log.warn("No crawler strategy for type {}, using generic", type);
            return strategies.get(CrawlerType.GENERIC);
        }
        return strategy;
    }
}
