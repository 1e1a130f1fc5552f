package com.delta.urlscout.crawl.robots;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt. Matching rules come from the wildcard group only; the path lists collected
 * from every group are kept separately as discovery hints.
 */
public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;
  private final List<String> disallowedPaths;
  private final List<String> allowedPaths;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
    this(rules, sitemapUrls, List.of(), List.of());
  }

  public RobotsRules(
      List<Rule> rules,
      List<String> sitemapUrls,
      List<String> disallowedPaths,
      List<String> allowedPaths) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
    this.disallowedPaths = List.copyOf(disallowedPaths);
    this.allowedPaths = List.copyOf(allowedPaths);
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

  public List<String> getDisallowedPaths() {
    return disallowedPaths;
  }

  public List<String> getAllowedPaths() {
    return allowedPaths;
  }

  public boolean hasPathHints() {
    return !disallowedPaths.isEmpty() || !allowedPaths.isEmpty();
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
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    Set<String> sitemaps = new LinkedHashSet<>();
    Set<String> disallowed = new LinkedHashSet<>();
    Set<String> allowed = new LinkedHashSet<>();
    List<Rule> parsedRules = new ArrayList<>();

    List<String> currentAgents = new ArrayList<>();
    boolean currentGroupRelevant = false;
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
        currentGroupRelevant = currentAgents.stream().anyMatch("*"::equals);
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
      if (value.isBlank()) {
        continue;
      }
      boolean allow = "allow".equals(key);
      String hint = toHintPath(value);
      if (hint != null) {
        (allow ? allowed : disallowed).add(hint);
      }
      if (currentGroupRelevant) {
        parsedRules.add(new Rule(value, allow));
      }
    }

    return new RobotsRules(
        parsedRules, new ArrayList<>(sitemaps), new ArrayList<>(disallowed), new ArrayList<>(allowed));
  }

  /**
   * Literal prefix of a rule path, up to the first wildcard. The bare root yields {@code null}.
   */
  static String toHintPath(String rulePath) {
    String path = rulePath.startsWith("/") ? rulePath : "/" + rulePath;
    int wildcard = indexOfAny(path, '*', '$', '?');
    if (wildcard >= 0) {
      path = path.substring(0, wildcard);
    }
    if (path.isEmpty() || "/".equals(path)) {
      return null;
    }
    return path;
  }

  private static int indexOfAny(String value, char... chars) {
    int best = -1;
    for (char c : chars) {
      int idx = value.indexOf(c);
      if (idx >= 0 && (best < 0 || idx < best)) {
        best = idx;
      }
    }
    return best;
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
