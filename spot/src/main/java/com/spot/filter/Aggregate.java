package com.spot.filter;

import static com.google.common.base.Preconditions.checkNotNull;

/** One measure of a filter. An aggregate without a facet counts records. */
public record Aggregate(String facetId, AggregateOperation operation) {
  public Aggregate {
    checkNotNull(operation, "operation");
  }

  public static Aggregate rowCount() {
    return new Aggregate(null, AggregateOperation.COUNT);
  }

  public boolean isRowCount() {
    return facetId == null;
  }
}
