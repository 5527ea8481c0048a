package com.spot.partition;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.spot.facet.CategorialTransform;
import com.spot.facet.ContinuousTransform;
import com.spot.facet.Facet;
import com.spot.facet.FacetType;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One dimension of a filter: a bucketing rule applied to a single facet. A partition owns its
 * domain, its ordered groups and the user's current selection on those groups.
 */
public class Partition {
  private static final Logger LOG = LoggerFactory.getLogger(Partition.class);

  public static final double DEFAULT_GROUPING_PARAM = 20;
  public static final int MAX_GROUPS = 1000;

  private final String facetId;
  private int rank;
  private FacetType facetType = FacetType.CATEGORIAL;
  private GroupingStrategy strategy;
  private double groupingParam;
  private double baseGroupingParam;
  private Double minval;
  private Double maxval;
  private ImmutableList<Group> groups = ImmutableList.of();
  private final Map<String, Integer> labelIndex = new HashMap<>();

  private final Set<String> selectedLabels = new LinkedHashSet<>();
  private Double selectedMin;
  private Double selectedMax;

  public Partition(String facetId) {
    this(facetId, null, DEFAULT_GROUPING_PARAM);
  }

  public Partition(String facetId, GroupingStrategy strategy, double groupingParam) {
    this.facetId = facetId;
    this.strategy = strategy;
    this.groupingParam = groupingParam;
    this.baseGroupingParam = groupingParam;
  }

  public String getFacetId() {
    return facetId;
  }

  public int getRank() {
    return rank;
  }

  public void setRank(int rank) {
    this.rank = rank;
  }

  public GroupingStrategy getStrategy() {
    return strategy;
  }

  public double getGroupingParam() {
    return groupingParam;
  }

  public Double getMinval() {
    return minval;
  }

  public Double getMaxval() {
    return maxval;
  }

  public ImmutableList<Group> getGroups() {
    return groups;
  }

  public boolean isContinuous() {
    return strategy != null && strategy.isContinuous();
  }

  public void setGrouping(GroupingStrategy strategy, double groupingParam) {
    this.strategy = strategy;
    this.groupingParam = groupingParam;
    this.baseGroupingParam = groupingParam;
  }

  public void setDomain(double minval, double maxval) {
    this.minval = Math.min(minval, maxval);
    this.maxval = Math.max(minval, maxval);
  }

  /**
   * Resets the domain to the facet's full domain and picks a strategy that fits the facet type. A
   * missing facet leaves the partition without groups, so every record lands in the other bucket.
   */
  public void reset(Facet facet) {
    clearSelection();
    groupingParam = baseGroupingParam;
    if (facet == null) {
      LOG.warn("Partition refers to unknown facet {}", facetId);
      facetType = FacetType.CATEGORIAL;
      strategy = GroupingStrategy.CATEGORIAL;
      minval = null;
      maxval = null;
      return;
    }
    facetType = facet.getType();
    if (!facetType.isContinuousLike()) {
      strategy = GroupingStrategy.CATEGORIAL;
    } else if (strategy == null || strategy == GroupingStrategy.CATEGORIAL) {
      strategy = GroupingStrategy.FIXED_N;
    }
    minval = facet.getMinval();
    maxval = facet.getMaxval();
  }

  /** Regenerates the groups from the current strategy, domain and facet transforms. */
  public void setGroups(Facet facet) {
    if (facet == null) {
      setGroupList(ImmutableList.of());
    } else if (isContinuous()) {
      setGroupList(continuousGroups(facet.getContinuousTransform()));
    } else {
      setGroupList(categorialGroups(facet.getCategorialTransform()));
    }
  }

  private void setGroupList(ImmutableList<Group> groups) {
    this.groups = groups;
    labelIndex.clear();
    for (Group group : groups) {
      labelIndex.putIfAbsent(group.label(), group.index());
    }
  }

  private ImmutableList<Group> categorialGroups(CategorialTransform transform) {
    ImmutableList.Builder<Group> builder = ImmutableList.builder();
    int index = 1;
    for (Map.Entry<String, Long> entry : transform.groupCounts().entrySet()) {
      builder.add(Group.categorial(index++, entry.getKey(), entry.getValue()));
    }
    return builder.build();
  }

  private ImmutableList<Group> continuousGroups(ContinuousTransform transform) {
    if (minval == null || maxval == null) {
      LOG.warn("Facet {} has no domain, partition has no groups", facetId);
      return ImmutableList.of();
    }
    double tlo = transform.forward(minval);
    double thi = transform.forward(maxval);
    double[] bounds = bounds(strategy, groupingParam, tlo, thi);

    int n = bounds.length - 1;
    double[] raw = new double[n + 1];
    for (int i = 0; i <= n; i++) {
      raw[i] = transform.inverse(bounds[i]);
    }
    if (bounds[0] == tlo) {
      raw[0] = minval;
    }
    if (bounds[n] == thi) {
      raw[n] = maxval;
    }

    ImmutableList.Builder<Group> builder = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      String label = formatLabel(0.5 * (raw[i] + raw[i + 1]));
      builder.add(new Group(i + 1, label, bounds[i], bounds[i + 1], raw[i], raw[i + 1], 0));
    }
    return builder.build();
  }

  private double[] bounds(GroupingStrategy strategy, double param, double tlo, double thi) {
    return switch (strategy) {
      case FIXED_SIZE -> fixedSize(param, tlo, thi);
      case FIXED_SCALE_COUNT -> fixedScaleCount(param, tlo, thi);
      case LOG -> logarithmic(param, tlo, thi);
      default -> fixedN(param, tlo, thi);
    };
  }

  private double[] fixedSize(double size, double tlo, double thi) {
    if (size > 0) {
      double x0 = Math.floor(tlo / size) * size;
      double x1 = Math.ceil(thi / size) * size;
      if (x1 <= x0) {
        x1 = x0 + size;
      }
      long n = Math.round((x1 - x0) / size);
      if (n <= MAX_GROUPS) {
        double[] bounds = new double[(int) n + 1];
        for (int i = 0; i <= n; i++) {
          bounds[i] = x0 + i * size;
        }
        return bounds;
      }
    }
    LOG.warn("Bin size {} unusable for facet {}, using fixed bin count", size, facetId);
    return fixedN(DEFAULT_GROUPING_PARAM, tlo, thi);
  }

  private double[] fixedScaleCount(double count, double tlo, double thi) {
    if (thi <= tlo || count <= 0) {
      return fixedN(1, tlo, thi);
    }
    double size = Math.pow(10, Math.round(Math.log10((thi - tlo) / count)));
    return fixedSize(size, tlo, thi);
  }

  private double[] logarithmic(double perDecadeParam, double tlo, double thi) {
    if (tlo <= 0) {
      LOG.warn("Facet {} has non-positive values, using fixed bin count", facetId);
      return fixedN(DEFAULT_GROUPING_PARAM, tlo, thi);
    }
    long perDecade = Math.max(1, Math.round(perDecadeParam));
    long d0 = (long) Math.floor(Math.log10(tlo));
    long d1 = (long) Math.ceil(Math.log10(thi));
    if (d1 <= d0) {
      d1 = d0 + 1;
    }
    int n = (int) Math.min(MAX_GROUPS, (d1 - d0) * perDecade);
    double[] bounds = new double[n + 1];
    for (int i = 0; i <= n; i++) {
      bounds[i] = Math.pow(10, d0 + (double) i / perDecade);
    }
    return bounds;
  }

  private static double[] fixedN(double param, double tlo, double thi) {
    int n = (int) Math.max(1, Math.min(MAX_GROUPS, Math.round(param)));
    double[] bounds = new double[n + 1];
    for (int i = 0; i < n; i++) {
      bounds[i] = tlo + i * (thi - tlo) / n;
    }
    bounds[n] = thi;
    return bounds;
  }

  String formatLabel(double value) {
    return switch (facetType) {
      case DATETIME -> Instant.ofEpochMilli(Math.round(value * 1000)).toString();
      case DURATION -> Duration.ofMillis(Math.round(value * 1000)).toString();
      default -> BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    };
  }

  /**
   * Bucket index for one base value: a number for continuous partitions, a string for categorial
   * ones. Returns {@link Group#OTHER_INDEX} when no group matches.
   */
  public int bucket(Facet facet, Object value) {
    if (facet == null || value == null) {
      return Group.OTHER_INDEX;
    }
    if (isContinuous()) {
      double v = ((Number) value).doubleValue();
      for (Group group : groups) {
        if (group.containsRaw(v)) {
          return group.index();
        }
      }
      return Group.OTHER_INDEX;
    }
    String label = facet.getCategorialTransform().match(value.toString());
    if (label == null) {
      return Group.OTHER_INDEX;
    }
    return labelIndex.getOrDefault(label, Group.OTHER_INDEX);
  }

  public String label(int bucket) {
    if (bucket <= Group.OTHER_INDEX || bucket > groups.size()) {
      return Group.OTHER_LABEL;
    }
    return groups.get(bucket - 1).label();
  }

  /** Bucket index of a group label, the other bucket for unknown labels. */
  public int indexOfLabel(String label) {
    return labelIndex.getOrDefault(label, Group.OTHER_INDEX);
  }

  // Selection

  /**
   * Toggles a group. On a continuous partition the group's raw range becomes the selection, or the
   * selection is cleared when it already is exactly that range.
   */
  public void selectGroup(String label) {
    if (isContinuous()) {
      int index = indexOfLabel(label);
      if (index == Group.OTHER_INDEX) {
        return;
      }
      Group group = groups.get(index - 1);
      if (selectedMin != null
          && selectedMin == group.rawMin()
          && selectedMax == group.rawMax()) {
        clearSelection();
      } else {
        selectRange(group.rawMin(), group.rawMax());
      }
      return;
    }
    if (!selectedLabels.remove(label)) {
      selectedLabels.add(label);
    }
  }

  /** Selects every group whose raw center lies within {@code [lo, hi]}. */
  public void selectRange(double lo, double hi) {
    selectedMin = Math.min(lo, hi);
    selectedMax = Math.max(lo, hi);
  }

  public void clearSelection() {
    selectedLabels.clear();
    selectedMin = null;
    selectedMax = null;
  }

  public boolean hasSelection() {
    return !selectedLabels.isEmpty() || selectedMin != null;
  }

  public boolean isSelected(Group group) {
    if (isContinuous()) {
      double center = group.rawCenter();
      return selectedMin != null && selectedMin <= center && center <= selectedMax;
    }
    return selectedLabels.contains(group.label());
  }

  public ImmutableSet<Integer> selectedBuckets() {
    ImmutableSet.Builder<Integer> buckets = ImmutableSet.builder();
    groups.stream().filter(this::isSelected).forEach(group -> buckets.add(group.index()));
    return buckets.build();
  }

  /** Predicate over this partition's bucket labels; accepts everything without a selection. */
  public Predicate<String> filterFunction() {
    if (!hasSelection()) {
      return label -> true;
    }
    ImmutableSet.Builder<String> labels = ImmutableSet.builder();
    groups.stream().filter(this::isSelected).forEach(group -> labels.add(group.label()));
    ImmutableSet<String> selected = labels.build();
    return selected::contains;
  }

  // Drill down

  /**
   * Narrows a continuous partition to its selected range, rescaling a fixed bin size to keep the
   * bin count, or keeps only the selected groups of a categorial partition. Clears the selection.
   */
  public void zoomIn(Facet facet) {
    if (isContinuous() && selectedMin != null) {
      if (strategy == GroupingStrategy.FIXED_SIZE
          && minval != null
          && maxval != null
          && maxval > minval) {
        groupingParam = groupingParam * (selectedMax - selectedMin) / (maxval - minval);
      }
      minval = selectedMin;
      maxval = selectedMax;
      setGroups(facet);
    } else if (!isContinuous() && !selectedLabels.isEmpty()) {
      ImmutableList.Builder<Group> zoomed = ImmutableList.builder();
      int index = 1;
      for (Group group : groups) {
        if (selectedLabels.contains(group.label())) {
          zoomed.add(group.withIndex(index++));
        }
      }
      setGroupList(zoomed.build());
    }
    clearSelection();
  }

  public PartitionSnapshot snapshot() {
    return new PartitionSnapshot(
        facetId,
        rank,
        strategy,
        groupingParam,
        minval,
        maxval,
        groups,
        ImmutableList.copyOf(selectedLabels),
        selectedMin,
        selectedMax);
  }

  public void restore(PartitionSnapshot snapshot) {
    rank = snapshot.rank();
    strategy = snapshot.strategy();
    groupingParam = snapshot.groupingParam();
    minval = snapshot.minval();
    maxval = snapshot.maxval();
    setGroupList(snapshot.groups());
    selectedLabels.clear();
    selectedLabels.addAll(snapshot.selectedLabels());
    selectedMin = snapshot.selectedMin();
    selectedMax = snapshot.selectedMax();
  }

  /** Rebuilds a partition from a snapshot; the facet supplies the type used for labels. */
  public static Partition fromSnapshot(PartitionSnapshot snapshot, Facet facet) {
    Partition partition =
        new Partition(snapshot.facetId(), snapshot.strategy(), snapshot.groupingParam());
    if (facet != null) {
      partition.facetType = facet.getType();
    }
    partition.restore(snapshot);
    return partition;
  }

  @Override
  public String toString() {
    return "Partition{facetId="
        + facetId
        + ", rank="
        + rank
        + ", strategy="
        + strategy
        + ", groups="
        + groups.size()
        + '}';
  }
}
