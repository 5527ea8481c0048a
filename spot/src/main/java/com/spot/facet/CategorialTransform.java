package com.spot.facet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule based grouping of categorial values. Literal rules take precedence over wildcard rules; each
 * kind is evaluated in insertion order. Without any rules every value is its own group.
 */
public class CategorialTransform {
  private final List<CategorialRule> rules = new ArrayList<>();
  private final Map<String, CategorialRule> literals = new LinkedHashMap<>();
  private final Map<CategorialRule, Pattern> wildcards = new LinkedHashMap<>();

  public void reset() {
    rules.clear();
    literals.clear();
    wildcards.clear();
  }

  public void addRule(CategorialRule rule) {
    rules.add(rule);
    if (rule.isWildcard()) {
      wildcards.put(rule, toPattern(rule.expression()));
    } else {
      literals.putIfAbsent(rule.expression(), rule);
    }
  }

  public ImmutableList<CategorialRule> getRules() {
    return ImmutableList.copyOf(rules);
  }

  public boolean isActive() {
    return !rules.isEmpty();
  }

  /** Returns the group label for a raw value, or null when no rule matches. */
  public String match(String value) {
    if (!isActive()) {
      return value;
    }
    CategorialRule literal = literals.get(value);
    if (literal != null) {
      return literal.group();
    }
    for (Map.Entry<CategorialRule, Pattern> wildcard : wildcards.entrySet()) {
      if (wildcard.getValue().matcher(value).matches()) {
        return wildcard.getKey().group();
      }
    }
    return null;
  }

  /** Distinct group labels in first-seen rule order, with the summed rule counts. */
  public LinkedHashMap<String, Long> groupCounts() {
    LinkedHashMap<String, Long> counts = new LinkedHashMap<>();
    for (CategorialRule rule : rules) {
      counts.merge(rule.group(), rule.count(), Long::sum);
    }
    return counts;
  }

  static Pattern toPattern(String expression) {
    String regex =
        Splitter.on(CategorialRule.WILDCARD)
            .splitToStream(expression)
            .map(Pattern::quote)
            .collect(Collectors.joining(".*"));
    return Pattern.compile(regex, Pattern.DOTALL);
  }
}
