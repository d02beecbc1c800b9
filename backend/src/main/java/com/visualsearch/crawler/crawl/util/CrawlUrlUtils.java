package com.visualsearch.crawler.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class CrawlUrlUtils {
    private CrawlUrlUtils() {
    }

    public static URI safeUri(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        try {
            return new URI(candidate.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String candidate) {
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    /**
     * Key used to decide whether two urls name the same page within one job: trimmed, case-folded.
     */
    public static String dedupeKey(String url) {
        return url == null ? null : url.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Drops query string and fragment. Unparseable input is cut at the first {@code ?} or {@code #}.
     */
    public static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getScheme() == null || uri.getRawAuthority() == null) {
            int cut = indexOfAny(trimmed, '?', '#');
            return cut >= 0 ? trimmed.substring(0, cut) : trimmed;
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT) + path;
    }

    /**
     * Resolves {@code href} against {@code baseUrl}; null for blank, non-http or unparseable targets.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:")
            || lower.startsWith("data:") || trimmed.startsWith("#")) {
            return null;
        }
        try {
            URI resolved = baseUrl == null ? new URI(trimmed) : new URI(baseUrl.trim()).resolve(trimmed);
            String value = resolved.toString();
            return isHttpUrl(value) ? value : null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean sameHost(String left, String right) {
        URI a = safeUri(left);
        URI b = safeUri(right);
        if (a == null || b == null || a.getHost() == null || b.getHost() == null) {
            return false;
        }
        return stripWww(a.getHost()).equals(stripWww(b.getHost()));
    }

    /**
     * {@code scheme://host[:port]} of the URL, or null.
     */
    public static String siteRoot(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getRawAuthority() == null) {
            return null;
        }
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority();
    }

    private static String stripWww(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
