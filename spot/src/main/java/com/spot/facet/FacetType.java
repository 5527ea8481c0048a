package com.spot.facet;

/** The semantic type of a facet, decided by type inference or by the user. */
public enum FacetType {
  CONTINUOUS("continuous"),
  CATEGORIAL("categorial"),
  DATETIME("datetime"),
  DURATION("duration");

  private final String name;

  FacetType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /** Datetime and duration facets are bucketed like continuous facets after a time transform. */
  public boolean isContinuousLike() {
    return this != CATEGORIAL;
  }

  public boolean isTime() {
    return this == DATETIME || this == DURATION;
  }
}
