package com.spot.filter;

/** Lifecycle of a filter with respect to its dataset backend. */
public enum FilterState {
  /** Partition count outside [min, max]; no backend resources. */
  UNCONFIGURED,
  /** Partition count valid, backend not materialized yet. */
  CONFIGURED,
  /** Backend materialized and data populated. */
  ACTIVE,
  /** Backend torn down, no data. */
  RELEASED
}
