package com.visualsearch.crawler.crawl.render;

/**
 * @param markerSelector     optional element to wait for after network idle; absence is not an error
 * @param pageStateVariable  optional global JS variable holding embedded page state
 */
public record RenderRequest(String url, String userAgent, String markerSelector, String pageStateVariable) {
}
