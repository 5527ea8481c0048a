package com.spot.dataset.memory;

import com.spot.filter.AggregateAccumulator;
import java.util.Arrays;

/** Accumulated state of one composite key of a filter: its record count and every aggregate. */
public final class FilterAccumulator {
  private long records;
  private final AggregateAccumulator[] aggregates;

  FilterAccumulator(int aggregateCount) {
    aggregates = new AggregateAccumulator[aggregateCount];
    for (int i = 0; i < aggregateCount; i++) {
      aggregates[i] = new AggregateAccumulator();
    }
  }

  void addRecord() {
    records++;
  }

  void removeRecord() {
    records--;
  }

  public long getRecords() {
    return records;
  }

  public AggregateAccumulator getAggregate(int i) {
    return aggregates[i];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterAccumulator that)) {
      return false;
    }
    return records == that.records && Arrays.equals(aggregates, that.aggregates);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(records) + Arrays.hashCode(aggregates);
  }

  @Override
  public String toString() {
    return "FilterAccumulator{records="
        + records
        + ", aggregates="
        + Arrays.toString(aggregates)
        + '}';
  }
}
