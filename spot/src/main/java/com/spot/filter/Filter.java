package com.spot.filter;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spot.dataset.Dataset;
import com.spot.facet.Facet;
import com.spot.partition.GroupingStrategy;
import com.spot.partition.Partition;
import com.spot.partition.PartitionSnapshot;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A group-by request over a dataset: ordered partitions as dimensions and aggregates as measures.
 *
 * <p>The filter is configured when its partition count lies within [min, max]. Structural changes
 * on a configured filter release and re-initialize its backend resources, selection changes only
 * update the cross-filter predicate. Backend failures are logged here and never reach the caller;
 * the filter then simply keeps its previous data.
 */
public class Filter {
  private static final Logger LOG = LoggerFactory.getLogger(Filter.class);

  public static final String KEY_SEPARATOR = "|";
  private static final Splitter KEY_SPLITTER = Splitter.on(KEY_SEPARATOR);

  private final String id;
  private final int minPartitions;
  private final int maxPartitions;
  private final List<Partition> partitions = new ArrayList<>();
  private final List<Aggregate> aggregates = new ArrayList<>();
  private final Deque<ImmutableList<PartitionSnapshot>> zoomHistory = new ArrayDeque<>();
  private final List<FilterListener> listeners = new CopyOnWriteArrayList<>();

  private volatile ImmutableList<ImmutableMap<String, Object>> data = ImmutableList.of();
  private volatile FilterState state = FilterState.UNCONFIGURED;
  private long generation = 0;
  private Dataset dataset;

  private String title;
  private String chartType;

  public Filter(String id, int minPartitions, int maxPartitions) {
    checkArgument(minPartitions >= 0, "minPartitions must be non-negative");
    checkArgument(maxPartitions >= minPartitions, "maxPartitions must be at least minPartitions");
    this.id = id;
    this.minPartitions = minPartitions;
    this.maxPartitions = maxPartitions;
  }

  public String getId() {
    return id;
  }

  public int getMinPartitions() {
    return minPartitions;
  }

  public int getMaxPartitions() {
    return maxPartitions;
  }

  public boolean isConfigured() {
    int p = partitions.size();
    return minPartitions <= p && p <= maxPartitions;
  }

  public FilterState getState() {
    return state;
  }

  public ImmutableList<Partition> getPartitions() {
    return ImmutableList.copyOf(partitions);
  }

  public ImmutableList<Aggregate> getAggregates() {
    return ImmutableList.copyOf(aggregates);
  }

  /** The declared aggregates, or a single row count when none are declared. */
  public ImmutableList<Aggregate> getEffectiveAggregates() {
    return aggregates.isEmpty() ? ImmutableList.of(Aggregate.rowCount()) : getAggregates();
  }

  public ImmutableList<ImmutableMap<String, Object>> getData() {
    return data;
  }

  public Dataset getDataset() {
    return dataset;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getChartType() {
    return chartType;
  }

  public void setChartType(String chartType) {
    this.chartType = chartType;
  }

  public void addListener(FilterListener listener) {
    listeners.add(listener);
  }

  public void removeListener(FilterListener listener) {
    listeners.remove(listener);
  }

  /** Called by {@link Dataset#addFilter(Filter)}. */
  public void attach(Dataset dataset) {
    checkState(this.dataset == null, "Filter %s already belongs to a dataset", id);
    this.dataset = dataset;
    if (isConfigured()) {
      initDataFilter();
    }
  }

  /** Called by {@link Dataset#removeFilter(Filter)}: tears down backend resources. */
  public void release() {
    if (dataset != null && state == FilterState.ACTIVE) {
      releaseDataFilter();
    }
    invalidate();
    state = FilterState.RELEASED;
    setData(ImmutableList.of());
  }

  // Structure

  public void addPartition(Partition partition) {
    checkState(dataset != null, "Filter %s must be added to a dataset first", id);
    Facet facet = dataset.getFacet(partition.getFacetId());
    if (partition.getStrategy() == null && facet != null && facet.getType().isContinuousLike()) {
      partition.setGrouping(GroupingStrategy.FIXED_N, dataset.getDefaultGroupingParam());
    }
    partition.reset(facet);
    partition.setGroups(facet);
    partitions.add(partition);
    partition.setRank(partitions.size());
    onStructureChanged();
  }

  public void removePartition(Partition partition) {
    if (partitions.remove(partition)) {
      renumber();
      onStructureChanged();
    }
  }

  public void addAggregate(Aggregate aggregate) {
    aggregates.add(aggregate);
    onStructureChanged();
  }

  public void removeAggregate(Aggregate aggregate) {
    if (aggregates.remove(aggregate)) {
      onStructureChanged();
    }
  }

  /** Changes a partition's grouping and rebuilds the filter. */
  public void setGrouping(Partition partition, GroupingStrategy strategy, double groupingParam) {
    checkArgument(partitions.contains(partition), "Partition is not part of filter %s", id);
    partition.setGrouping(strategy, groupingParam);
    partition.setGroups(facetOf(partition));
    onStructureChanged();
  }

  /** Regenerates a partition's groups, e.g. after its facet's transform changed. */
  public void updatePartition(Partition partition) {
    checkArgument(partitions.contains(partition), "Partition is not part of filter %s", id);
    partition.setGroups(facetOf(partition));
    onStructureChanged();
  }

  private void renumber() {
    for (int i = 0; i < partitions.size(); i++) {
      partitions.get(i).setRank(i + 1);
    }
  }

  private Facet facetOf(Partition partition) {
    return dataset == null ? null : dataset.getFacet(partition.getFacetId());
  }

  private void onStructureChanged() {
    if (isConfigured()) {
      initDataFilter();
      return;
    }
    if (state == FilterState.ACTIVE) {
      releaseDataFilter();
    }
    state = FilterState.UNCONFIGURED;
    setData(ImmutableList.of());
  }

  // Selection

  public void selectGroup(Partition partition, String label) {
    partition.selectGroup(label);
    updateDataFilter();
  }

  public void selectRange(Partition partition, double lo, double hi) {
    partition.selectRange(lo, hi);
    updateDataFilter();
  }

  public void clearSelection() {
    partitions.forEach(Partition::clearSelection);
    updateDataFilter();
  }

  public boolean hasSelection() {
    return partitions.stream().anyMatch(Partition::hasSelection);
  }

  /**
   * Predicate over composite keys: the per partition labels joined with {@link #KEY_SEPARATOR} in
   * rank order. A key passes when every partition accepts its own label.
   */
  public Predicate<String> filterFunction() {
    List<Predicate<String>> predicates = new ArrayList<>();
    partitions.forEach(partition -> predicates.add(partition.filterFunction()));
    return key -> {
      List<String> labels = KEY_SPLITTER.splitToList(key);
      for (int i = 0; i < predicates.size(); i++) {
        if (i >= labels.size() || !predicates.get(i).test(labels.get(i))) {
          return false;
        }
      }
      return true;
    };
  }

  // Drill down

  public ImmutableList<PartitionSnapshot> snapshot() {
    ImmutableList.Builder<PartitionSnapshot> snapshots = ImmutableList.builder();
    partitions.forEach(partition -> snapshots.add(partition.snapshot()));
    return snapshots.build();
  }

  public int getZoomDepth() {
    return zoomHistory.size();
  }

  public void zoomIn() {
    zoomHistory.push(snapshot());
    for (Partition partition : partitions) {
      partition.zoomIn(facetOf(partition));
    }
    reinitialize();
  }

  public void zoomOut() {
    boolean doReset = true;
    for (Partition partition : partitions) {
      if (partition.hasSelection()) {
        partition.clearSelection();
        doReset = false;
      }
    }

    if (doReset) {
      if (!zoomHistory.isEmpty()) {
        restore(zoomHistory.pop());
      } else {
        for (Partition partition : partitions) {
          Facet facet = facetOf(partition);
          if (partition.isContinuous()) {
            partition.reset(facet);
          }
          partition.setGroups(facet);
        }
      }
    }
    reinitialize();
  }

  private void restore(ImmutableList<PartitionSnapshot> snapshots) {
    boolean sameShape = snapshots.size() == partitions.size();
    for (int i = 0; sameShape && i < snapshots.size(); i++) {
      sameShape = snapshots.get(i).facetId().equals(partitions.get(i).getFacetId());
    }
    if (sameShape) {
      for (int i = 0; i < snapshots.size(); i++) {
        partitions.get(i).restore(snapshots.get(i));
      }
    } else {
      partitions.clear();
      for (PartitionSnapshot snapshot : snapshots) {
        partitions.add(
            Partition.fromSnapshot(
                snapshot, dataset == null ? null : dataset.getFacet(snapshot.facetId())));
      }
    }
  }

  private void reinitialize() {
    if (isConfigured()) {
      initDataFilter();
    }
  }

  // Backend lifecycle

  private void initDataFilter() {
    if (dataset == null) {
      state = FilterState.CONFIGURED;
      return;
    }
    try {
      if (state == FilterState.ACTIVE) {
        dataset.releaseDataFilter(this);
        state = FilterState.RELEASED;
        LOG.debug("Released filter {} for rebuild", id);
      }
      state = FilterState.CONFIGURED;
      dataset.initDataFilter(this);
      dataset.updateDataFilter(this);
      state = FilterState.ACTIVE;
      LOG.debug("Initialized filter {} with {} partitions", id, partitions.size());
      dataset.getAllData();
    } catch (RuntimeException e) {
      LOG.error("Failed to initialize filter {}", id, e);
    }
  }

  private void releaseDataFilter() {
    try {
      dataset.releaseDataFilter(this);
      state = FilterState.RELEASED;
      LOG.debug("Released filter {}", id);
      dataset.getAllData();
    } catch (RuntimeException e) {
      LOG.error("Failed to release filter {}", id, e);
    }
  }

  private void updateDataFilter() {
    if (dataset == null || state != FilterState.ACTIVE) {
      return;
    }
    try {
      dataset.updateDataFilter(this);
      dataset.getAllData();
    } catch (RuntimeException e) {
      LOG.error("Failed to update filter {}", id, e);
    }
  }

  // Data delivery

  /** Starts a new request generation; results of earlier generations are dropped. */
  public synchronized long nextGeneration() {
    return ++generation;
  }

  public synchronized long getGeneration() {
    return generation;
  }

  /** Invalidates any outstanding request. */
  public synchronized void invalidate() {
    generation++;
  }

  /** Stores the rows if they belong to the current generation, returning whether they did. */
  public synchronized boolean setData(
      long requestGeneration, List<? extends Map<String, Object>> rows) {
    if (requestGeneration != generation) {
      return false;
    }
    setData(rows);
    return true;
  }

  public void setData(List<? extends Map<String, Object>> rows) {
    ImmutableList.Builder<ImmutableMap<String, Object>> copy = ImmutableList.builder();
    rows.forEach(row -> copy.add(ImmutableMap.copyOf(row)));
    data = copy.build();
    for (FilterListener listener : listeners) {
      try {
        listener.onNewData();
      } catch (RuntimeException e) {
        LOG.error("Listener of filter {} failed", id, e);
      }
    }
  }

  @Override
  public String toString() {
    return "Filter{id="
        + id
        + ", state="
        + state
        + ", partitions="
        + partitions
        + ", aggregates="
        + aggregates
        + '}';
  }
}
