package com.spot.facet;

/** Sentinel returned where a value is missing or a reduction is undefined. */
public enum Misval {
  MISSING;

  public static boolean isMissing(Object value) {
    return value == null || value == MISSING;
  }

  @Override
  public String toString() {
    return "missing";
  }
}
