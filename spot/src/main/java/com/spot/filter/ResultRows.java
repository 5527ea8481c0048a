package com.spot.filter;

import com.google.common.collect.ImmutableMap;
import com.spot.partition.Partition;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Shape of the rows both dataset backends hand to a filter: partition labels under {@code a, b, c,
 * ...} in rank order and aggregate values under {@code aa, bb, cc, ...} in declaration order.
 */
public final class ResultRows {
  private ResultRows() {}

  public static String partitionColumn(int position) {
    return String.valueOf((char) ('a' + position));
  }

  public static String aggregateColumn(int position) {
    String letter = partitionColumn(position);
    return letter + letter;
  }

  public static ImmutableMap<String, Object> row(List<String> labels, List<Object> values) {
    ImmutableMap.Builder<String, Object> row = ImmutableMap.builder();
    for (int i = 0; i < labels.size(); i++) {
      row.put(partitionColumn(i), labels.get(i));
    }
    for (int i = 0; i < values.size(); i++) {
      row.put(aggregateColumn(i), values.get(i));
    }
    return row.build();
  }

  /** Orders rows by the bucket index of each partition column, the other bucket first. */
  public static Comparator<Map<String, Object>> groupOrder(List<Partition> partitions) {
    return (left, right) -> {
      for (int i = 0; i < partitions.size(); i++) {
        String column = partitionColumn(i);
        Partition partition = partitions.get(i);
        int cmp =
            Integer.compare(
                partition.indexOfLabel((String) left.get(column)),
                partition.indexOfLabel((String) right.get(column)));
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    };
  }
}
