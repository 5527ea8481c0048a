package com.spot.dataset.memory;

import java.util.Map;

/** Symmetric add/remove reduction of records into a mutable accumulator. */
public interface Reducer<A> {
  A initial();

  void add(A accumulator, Map<String, Object> record);

  void remove(A accumulator, Map<String, Object> record);
}
