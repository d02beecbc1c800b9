package com.visualsearch.crawler.crawl.robots;

import com.visualsearch.crawler.config.CrawlerProperties;
import com.visualsearch.crawler.crawl.http.PoliteHttpClient;
import com.visualsearch.crawler.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allow/disallow decisions for page fetches, cached per site origin and agent token. Parsed
 * rules are reused for {@code crawler.robots.cache-ttl-minutes}; the decision taken for an
 * unreachable robots.txt only for {@code unavailable-ttl-minutes}. The oldest entries are
 * evicted beyond {@code max-cached-origins}.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;
    private final Clock clock;
    private final Map<String, CachedRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(CrawlerProperties properties, PoliteHttpClient httpClient, Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    public boolean isAllowed(String url, String userAgent) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        RobotsRules rules = getRules(uri, userAgent);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    private RobotsRules getRules(URI uri, String userAgent) {
        String origin = origin(uri);
        String agent = userAgent == null || userAgent.isBlank() ? properties.getUserAgent() : userAgent;
        String key = origin + "|" + RobotsRules.agentToken(agent);
        Instant now = clock.instant();
        CachedRules cached = cache.get(key);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return cached.rules();
        }
        CachedRules loaded = loadRules(origin, agent, now);
        cache.put(key, loaded);
        evict(now);
        return loaded.rules();
    }

    int cachedEntries() {
        return cache.size();
    }

    private CachedRules loadRules(String origin, String userAgent, Instant now) {
        CrawlerProperties.Robots settings = properties.getRobots();
        Instant expiresAt = now.plus(Duration.ofMinutes(settings.getCacheTtlMinutes()));
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, ROBOTS_ACCEPT, userAgent, 0);
        if (fetch.statusCode() == 404 || fetch.statusCode() == 410) {
            return new CachedRules(RobotsRules.allowAll(), now, expiresAt);
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = settings.isFailOpen();
            log.warn(
                "robots fetch failed origin={} status={} errorCode={} decision={}",
                origin,
                fetch.statusCode(),
                fetch.errorCode(),
                failOpen ? "allow_all" : "disallow_all"
            );
            return new CachedRules(
                failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll(),
                now,
                now.plus(Duration.ofMinutes(settings.getUnavailableTtlMinutes()))
            );
        }
        return new CachedRules(RobotsRules.parse(fetch.body(), userAgent), now, expiresAt);
    }

    private void evict(Instant now) {
        cache.entrySet().removeIf(entry -> !entry.getValue().expiresAt().isAfter(now));
        int max = properties.getRobots().getMaxCachedOrigins();
        while (cache.size() > max) {
            String oldestKey = null;
            Instant oldestLoadedAt = null;
            for (Map.Entry<String, CachedRules> entry : cache.entrySet()) {
                if (oldestLoadedAt == null || entry.getValue().loadedAt().isBefore(oldestLoadedAt)) {
                    oldestLoadedAt = entry.getValue().loadedAt();
                    oldestKey = entry.getKey();
                }
            }
            if (oldestKey == null) {
                break;
            }
            cache.remove(oldestKey);
        }
    }

    static String origin(URI uri) {
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() > 0 ? scheme + "://" + host + ":" + uri.getPort() : scheme + "://" + host;
    }

    private URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record CachedRules(RobotsRules rules, Instant loadedAt, Instant expiresAt) {
    }
}
