package com.spot.dataset.memory;

import com.google.common.collect.ImmutableList;
import com.spot.facet.Facet;
import java.util.List;
import java.util.Map;

/**
 * Adds and removes records to a {@link FilterAccumulator}. Aggregates over an array facet take
 * every element; a null facet marks a row count.
 */
class FilterReducer implements Reducer<FilterAccumulator> {
  private final ImmutableList<Facet> facets;

  FilterReducer(List<Facet> facets) {
    this.facets = ImmutableList.copyOf(facets);
  }

  @Override
  public FilterAccumulator initial() {
    return new FilterAccumulator(facets.size());
  }

  @Override
  public void add(FilterAccumulator accumulator, Map<String, Object> record) {
    accumulator.addRecord();
    for (int i = 0; i < facets.size(); i++) {
      Facet facet = facets.get(i);
      if (facet == null) {
        accumulator.getAggregate(i).add(1L);
      } else {
        for (Object value : facet.baseValues(record)) {
          accumulator.getAggregate(i).add(value);
        }
      }
    }
  }

  @Override
  public void remove(FilterAccumulator accumulator, Map<String, Object> record) {
    accumulator.removeRecord();
    for (int i = 0; i < facets.size(); i++) {
      Facet facet = facets.get(i);
      if (facet == null) {
        accumulator.getAggregate(i).remove(1L);
      } else {
        for (Object value : facet.baseValues(record)) {
          accumulator.getAggregate(i).remove(value);
        }
      }
    }
  }
}
