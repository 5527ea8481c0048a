package com.spot.partition;

import com.google.common.collect.ImmutableList;

/** An immutable copy of a partition's specification, used for drill-down history. */
public record PartitionSnapshot(
    String facetId,
    int rank,
    GroupingStrategy strategy,
    double groupingParam,
    Double minval,
    Double maxval,
    ImmutableList<Group> groups,
    ImmutableList<String> selectedLabels,
    Double selectedMin,
    Double selectedMax) {}
