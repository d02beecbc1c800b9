package com.visualsearch.crawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "VisualSearchBot/1.0 (+https://visualsearch.example/bot)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 8;
    private int requestTimeoutSeconds = 30;
    private Worker worker = new Worker();
    private Sitemap sitemap = new Sitemap();
    private Browser browser = new Browser();
    private Robots robots = new Robots();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Worker {
        private boolean enabled = false;
        private String workerId;
        private int workerCount = 1;
        private int pollIntervalMs = 10_000;
        private int leaseSeconds = 300;
        private int leaseRenewalSeconds = 120;
        private int signalCheckMs = 1000;
        private int maxPagesPerJob = 1000;
        private int errorPauseMs = 30_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getLeaseSeconds() {
            return Math.max(2, leaseSeconds);
        }

        public void setLeaseSeconds(int leaseSeconds) {
            this.leaseSeconds = leaseSeconds;
        }

        /**
         * Renewal always happens strictly before the lease can lapse.
         */
        public int getLeaseRenewalSeconds() {
            int lease = getLeaseSeconds();
            int renewal = Math.max(1, leaseRenewalSeconds);
            return Math.min(renewal, lease - 1);
        }

        public void setLeaseRenewalSeconds(int leaseRenewalSeconds) {
            this.leaseRenewalSeconds = leaseRenewalSeconds;
        }

        public int getSignalCheckMs() {
            return Math.max(10, signalCheckMs);
        }

        public void setSignalCheckMs(int signalCheckMs) {
            this.signalCheckMs = signalCheckMs;
        }

        public int getMaxPagesPerJob() {
            return Math.max(1, maxPagesPerJob);
        }

        public void setMaxPagesPerJob(int maxPagesPerJob) {
            this.maxPagesPerJob = Math.max(1, maxPagesPerJob);
        }

        public int getErrorPauseMs() {
            return Math.max(0, errorPauseMs);
        }

        public void setErrorPauseMs(int errorPauseMs) {
            this.errorPauseMs = errorPauseMs;
        }
    }

    public static class Sitemap {
        private int maxNestedSitemaps = 50;
        private int maxUrls = 50_000;

        public int getMaxNestedSitemaps() {
            return Math.max(0, maxNestedSitemaps);
        }

        public void setMaxNestedSitemaps(int maxNestedSitemaps) {
            this.maxNestedSitemaps = maxNestedSitemaps;
        }

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }
    }

    public static class Browser {
        private boolean headless = true;
        private int navigationTimeoutMs = 30_000;
        private int markerTimeoutMs = 10_000;
        private String locale = "es-ES";
        private String timezoneId = "Europe/Madrid";

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = navigationTimeoutMs;
        }

        public int getMarkerTimeoutMs() {
            return Math.max(0, markerTimeoutMs);
        }

        public void setMarkerTimeoutMs(int markerTimeoutMs) {
            this.markerTimeoutMs = markerTimeoutMs;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        public String getTimezoneId() {
            return timezoneId;
        }

        public void setTimezoneId(String timezoneId) {
            this.timezoneId = timezoneId;
        }
    }

    public static class Robots {
        private boolean failOpen = true;
        private int cacheTtlMinutes = 1440;
        private int unavailableTtlMinutes = 360;
        private int maxCachedOrigins = 2048;

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public int getCacheTtlMinutes() {
            return Math.max(1, cacheTtlMinutes);
        }

        public void setCacheTtlMinutes(int cacheTtlMinutes) {
            this.cacheTtlMinutes = cacheTtlMinutes;
        }

        /**
         * How long the fail-open/fail-closed decision for an unreachable robots.txt is reused.
         * Never longer than the regular cache TTL.
         */
        public int getUnavailableTtlMinutes() {
            return Math.min(Math.max(1, unavailableTtlMinutes), getCacheTtlMinutes());
        }

        public void setUnavailableTtlMinutes(int unavailableTtlMinutes) {
            this.unavailableTtlMinutes = unavailableTtlMinutes;
        }

        public int getMaxCachedOrigins() {
            return Math.max(16, maxCachedOrigins);
        }

        public void setMaxCachedOrigins(int maxCachedOrigins) {
            this.maxCachedOrigins = maxCachedOrigins;
        }
    }
}
