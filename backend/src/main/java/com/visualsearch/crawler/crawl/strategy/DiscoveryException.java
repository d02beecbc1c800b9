package com.visualsearch.crawler.crawl.strategy;

public class DiscoveryException extends Exception {

    public DiscoveryException(String message) {
        super(message);
    }
}
