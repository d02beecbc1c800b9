package com.visualsearch.crawler.crawl.render;

public record RenderedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String html,
    String title,
    String pageStateJson,
    String errorCode,
    String errorMessage
) {
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_NAVIGATION = "navigation_error";

    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public static RenderedPage failure(String url, int statusCode, String errorCode, String errorMessage) {
        return new RenderedPage(url, url, statusCode, null, null, null, errorCode, errorMessage);
    }
}
