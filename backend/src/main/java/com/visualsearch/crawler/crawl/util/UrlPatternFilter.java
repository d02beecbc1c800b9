package com.visualsearch.crawler.crawl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Exclude patterns are applied first; when include patterns exist, a URL must match at least one.
 * Patterns are case-insensitive regular expressions searched anywhere in the URL.
 */
public final class UrlPatternFilter {
    private static final Logger log = LoggerFactory.getLogger(UrlPatternFilter.class);

    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    private UrlPatternFilter(List<Pattern> includes, List<Pattern> excludes) {
        this.includes = includes;
        this.excludes = excludes;
    }

    public static UrlPatternFilter of(Collection<String> includePatterns, Collection<String> excludePatterns) {
        return new UrlPatternFilter(compile(includePatterns), compile(excludePatterns));
    }

    public boolean accepts(String url) {
        if (url == null) {
            return false;
        }
        for (Pattern exclude : excludes) {
            if (exclude.matcher(url).find()) {
                return false;
            }
        }
        if (includes.isEmpty()) {
            return true;
        }
        for (Pattern include : includes) {
            if (include.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }

    public List<String> apply(Collection<String> urls) {
        List<String> accepted = new ArrayList<>();
        for (String url : urls) {
            if (accepts(url)) {
                accepted.add(url);
            }
        }
        return accepted;
    }

    private static List<Pattern> compile(Collection<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns == null) {
            return compiled;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid url pattern '{}': {}", pattern, e.getDescription());
            }
        }
        return compiled;
    }
}
