package com.spot.partition;

/** How a partition splits its facet's domain into groups. */
public enum GroupingStrategy {
  /** A fixed number of equal width bins; the parameter is the bin count. */
  FIXED_N,
  /** Bins of a fixed width aligned on multiples of the width; the parameter is the width. */
  FIXED_SIZE,
  /** Power of ten bin width giving roughly the requested count; the parameter is the count. */
  FIXED_SCALE_COUNT,
  /** Logarithmic bins; the parameter is the number of bins per decade. */
  LOG,
  /** One group per category of the facet's categorial transform. */
  CATEGORIAL;

  public boolean isContinuous() {
    return this != CATEGORIAL;
  }
}
