package com.visualsearch.crawler.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of());
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength
          || (length == bestMatchLength && rule.allow() && !bestMatch.allow())) {
        bestMatch = rule;
        bestMatchLength = length;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText) {
    return parse(robotsText, null);
  }

  /**
   * Groups naming our agent token take precedence over the {@code *} group. {@code Sitemap:}
   * lines are collected regardless of the group they appear in.
   */
  public static RobotsRules parse(String robotsText, String userAgent) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String agentToken = agentToken(userAgent);

    List<String> sitemaps = new ArrayList<>();
    List<Rule> wildcardRules = new ArrayList<>();
    List<Rule> agentRules = new ArrayList<>();
    boolean agentGroupSeen = false;

    List<String> currentAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }
      if (!"allow".equals(key) && !"disallow".equals(key)) {
        continue;
      }

      boolean forAgent = agentToken != null && currentAgents.stream().anyMatch(agentToken::equals);
      boolean forWildcard = currentAgents.contains("*");
      if (forAgent) {
        agentGroupSeen = true;
      }
      if (value.isBlank()) {
        continue;
      }
      Rule rule = new Rule(value, "allow".equals(key));
      if (forAgent) {
        agentRules.add(rule);
      } else if (forWildcard) {
        wildcardRules.add(rule);
      }
    }

    return new RobotsRules(agentGroupSeen ? agentRules : wildcardRules, sitemaps);
  }

  static String agentToken(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return null;
    }
    String token = userAgent.trim().split("[/\\s]", 2)[0];
    return token.isBlank() ? null : token.toLowerCase(Locale.ROOT);
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
