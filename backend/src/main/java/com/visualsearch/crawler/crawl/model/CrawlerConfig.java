package com.visualsearch.crawler.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-provider crawl settings stored as JSON on the provider row. A job reads
 * one instance when it starts and does not modify it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlerConfig {
    public static final int DEFAULT_REQUEST_DELAY_MS = 1000;
    public static final int DEFAULT_MAX_CONCURRENCY = 2;

    private int requestDelayMs = DEFAULT_REQUEST_DELAY_MS;
    private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
    private boolean respectRobotsTxt = true;
    private String userAgent;
    private String productContainerSelector;
    private String productNameSelector;
    private String productPriceSelector;
    private String productImageSelector;
    private String productDescriptionSelector;
    private String productLinkSelector;
    private String paginationSelector;
    private List<String> includePatterns = List.of();
    private List<String> excludePatterns = List.of();
    private Map<String, String> customSettings = Map.of();

    public static CrawlerConfig defaults() {
        return new CrawlerConfig();
    }

    public int getRequestDelayMs() {
        return Math.max(0, requestDelayMs);
    }

    public void setRequestDelayMs(int requestDelayMs) {
        this.requestDelayMs = requestDelayMs;
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public boolean isRespectRobotsTxt() {
        return respectRobotsTxt;
    }

    public void setRespectRobotsTxt(boolean respectRobotsTxt) {
        this.respectRobotsTxt = respectRobotsTxt;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getProductContainerSelector() {
        return productContainerSelector;
    }

    public void setProductContainerSelector(String productContainerSelector) {
        this.productContainerSelector = productContainerSelector;
    }

    public String getProductNameSelector() {
        return productNameSelector;
    }

    public void setProductNameSelector(String productNameSelector) {
        this.productNameSelector = productNameSelector;
    }

    public String getProductPriceSelector() {
        return productPriceSelector;
    }

    public void setProductPriceSelector(String productPriceSelector) {
        this.productPriceSelector = productPriceSelector;
    }

    public String getProductImageSelector() {
        return productImageSelector;
    }

    public void setProductImageSelector(String productImageSelector) {
        this.productImageSelector = productImageSelector;
    }

    public String getProductDescriptionSelector() {
        return productDescriptionSelector;
    }

    public void setProductDescriptionSelector(String productDescriptionSelector) {
        this.productDescriptionSelector = productDescriptionSelector;
    }

    public String getProductLinkSelector() {
        return productLinkSelector;
    }

    public void setProductLinkSelector(String productLinkSelector) {
        this.productLinkSelector = productLinkSelector;
    }

    public String getPaginationSelector() {
        return paginationSelector;
    }

    public void setPaginationSelector(String paginationSelector) {
        this.paginationSelector = paginationSelector;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = copyPatterns(includePatterns);
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = copyPatterns(excludePatterns);
    }

    public Map<String, String> getCustomSettings() {
        return customSettings;
    }

    public void setCustomSettings(Map<String, String> customSettings) {
        this.customSettings = customSettings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customSettings));
    }

    public String customSetting(String key) {
        String value = customSettings.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String customSetting(String key, String fallback) {
        String value = customSetting(key);
        return value == null ? fallback : value;
    }

    public int customIntSetting(String key, int fallback) {
        String value = customSetting(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static List<String> copyPatterns(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream().filter(Objects::nonNull).toList();
    }
}
