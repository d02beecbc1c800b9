package com.visualsearch.crawler.crawl.render;

/**
 * Loads a page in a real browser engine and reports the rendered HTML plus the
 * signals the browser-rendered crawl needs.
 */
public interface PageRenderer {

    RenderedPage render(RenderRequest request) throws InterruptedException;
}
