package com.spot.partition;

/**
 * One bucket of a partition. Continuous groups cover {@code (min, max]} in transformed space, and
 * {@code (rawMin, rawMax]} in raw space; the first group of a partition also includes its lower
 * edge. Categorial groups leave the bounds at zero.
 */
public record Group(
    int index, String label, double min, double max, double rawMin, double rawMax, long count) {

  public static final int OTHER_INDEX = 0;
  public static final String OTHER_LABEL = "Other";

  public static Group categorial(int index, String label, long count) {
    return new Group(index, label, 0, 0, 0, 0, count);
  }

  public boolean containsRaw(double value) {
    if (index == 1) {
      return rawMin <= value && value <= rawMax;
    }
    return rawMin < value && value <= rawMax;
  }

  public double rawCenter() {
    return 0.5 * (rawMin + rawMax);
  }

  public Group withIndex(int newIndex) {
    return new Group(newIndex, label, min, max, rawMin, rawMax, count);
  }
}
