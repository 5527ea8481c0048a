package com.spot.facet;

/**
 * Maps raw values matching {@code expression} to {@code group}. An expression containing {@code %}
 * is a wildcard pattern, anything else is matched literally.
 */
public record CategorialRule(String expression, String group, long count) {
  public static final char WILDCARD = '%';

  public boolean isWildcard() {
    return expression.indexOf(WILDCARD) >= 0;
  }
}
