package com.spot.dataset.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spot.dataset.Dataset;
import com.spot.facet.Facet;
import com.spot.facet.FacetTypeInferencer;
import com.spot.facet.FacetValues;
import com.spot.facet.Misval;
import com.spot.facet.TransformEngine;
import com.spot.filter.Aggregate;
import com.spot.filter.Filter;
import com.spot.filter.ResultRows;
import com.spot.partition.Group;
import com.spot.partition.Partition;
import com.spot.util.JsonUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dataset backed by a {@link CrossIndex} over records held in memory. All operations run
 * synchronously on the caller's thread.
 */
public class InMemoryDataset extends Dataset {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryDataset.class);

  public static final String FILTER_INIT_COUNTER = "spot_memory_filter_init";
  public static final String FILTER_UPDATE_COUNTER = "spot_memory_filter_update";
  public static final String GET_DATA_TIMER = "spot_memory_get_data_timer";

  private static final Splitter KEY_SPLITTER = Splitter.on(Filter.KEY_SEPARATOR);

  private final CrossIndex index = new CrossIndex();
  private final Map<String, FilterIndex> filterIndexes = new ConcurrentHashMap<>();
  private final int sampleSize;
  private final Random random;

  private final Counter filterInitCounter;
  private final Counter filterUpdateCounter;
  private final Timer getDataTimer;

  private record FilterIndex(
      CrossIndex.Dimension dimension,
      CrossIndex.Group<FilterAccumulator> group,
      ImmutableList<Partition> partitions,
      ImmutableList<Aggregate> aggregates,
      List<Facet> aggregateFacets) {}

  public InMemoryDataset(String name, MeterRegistry meterRegistry) {
    this(name, meterRegistry, FacetTypeInferencer.DEFAULT_SAMPLE_SIZE, new Random());
  }

  public InMemoryDataset(
      String name, MeterRegistry meterRegistry, int sampleSize, Random random) {
    super(name);
    this.sampleSize = sampleSize;
    this.random = random;
    this.filterInitCounter = meterRegistry.counter(FILTER_INIT_COUNTER);
    this.filterUpdateCounter = meterRegistry.counter(FILTER_UPDATE_COUNTER);
    this.getDataTimer = meterRegistry.timer(GET_DATA_TIMER);
  }

  /**
   * Parses a JSON array of objects and appends the records. The whole input is parsed first, so
   * malformed input leaves the dataset untouched.
   */
  public void loadRecords(String json) {
    List<Map<String, Object>> records;
    try {
      records = JsonUtil.readRecords(json);
    } catch (JsonProcessingException e) {
      throw new BadRecordFormatException("Records must be a JSON array of objects", e);
    }
    if (records == null) {
      throw new BadRecordFormatException("No records in input");
    }
    for (int i = 0; i < records.size(); i++) {
      if (records.get(i) == null) {
        throw new BadRecordFormatException("Record " + i + " is not an object");
      }
    }
    addRecords(records);
  }

  public void addRecords(List<Map<String, Object>> records) {
    index.add(records);
    LOG.info(
        "Added {} records to dataset {}, {} in total", records.size(), getName(), index.size());
    getAllData();
  }

  public int size() {
    return index.size();
  }

  @VisibleForTesting
  CrossIndex getIndex() {
    return index;
  }

  @Override
  public void scanData() {
    List<Facet> facets = FacetTypeInferencer.inferFacets(getFacets(), sample());
    for (Facet facet : facets) {
      addFacet(facet);
      initializeFacet(facet);
    }
    LOG.info("Scan of dataset {} found {} new facets", getName(), facets.size());
  }

  private List<Map<String, Object>> sample() {
    List<Map<String, Object>> records = index.records();
    if (records.size() <= sampleSize) {
      return records;
    }
    List<Integer> indices = new ArrayList<>(IntStream.range(0, records.size()).boxed().toList());
    Collections.shuffle(indices, random);
    List<Map<String, Object>> sample = new ArrayList<>(sampleSize);
    for (int i = 0; i < sampleSize; i++) {
      sample.add(records.get(indices.get(i)));
    }
    return sample;
  }

  private double[] numericValues(Facet facet) {
    List<Double> values = new ArrayList<>();
    for (Map<String, Object> record : index.records()) {
      for (Object value : facet.baseValues(record)) {
        if (value instanceof Number number) {
          values.add(number.doubleValue());
        }
      }
    }
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }

  @Override
  public void setMinMax(Facet facet) {
    TransformEngine.setMinMax(facet, numericValues(facet));
  }

  @Override
  public void setPercentiles(Facet facet) {
    TransformEngine.setPercentiles(facet, numericValues(facet));
  }

  @Override
  public void setExceedances(Facet facet) {
    TransformEngine.setExceedances(facet, numericValues(facet));
  }

  @Override
  public void setCategories(Facet facet) {
    Map<String, Long> counts = new LinkedHashMap<>();
    for (Map<String, Object> record : index.records()) {
      for (Object value : facet.baseValues(record)) {
        counts.merge(FacetValues.asText(value), 1L, Long::sum);
      }
    }
    TransformEngine.setCategories(facet, counts);
  }

  @Override
  public void initDataFilter(Filter filter) {
    ImmutableList<Partition> partitions = filter.getPartitions();
    List<Facet> partitionFacets = new ArrayList<>();
    partitions.forEach(partition -> partitionFacets.add(getFacet(partition.getFacetId())));

    ImmutableList<Aggregate> aggregates = filter.getEffectiveAggregates();
    List<Facet> aggregateFacets = new ArrayList<>();
    aggregates.forEach(aggregate -> aggregateFacets.add(getFacet(aggregate.facetId())));

    CrossIndex.Dimension dimension =
        index.dimension(record -> compositeKeys(record, partitions, partitionFacets));
    CrossIndex.Group<FilterAccumulator> group =
        dimension.group(new FilterReducer(aggregateFacets));
    filterIndexes.put(
        filter.getId(), new FilterIndex(dimension, group, partitions, aggregates, aggregateFacets));
    filterInitCounter.increment();
  }

  /**
   * Bucket labels of every partition joined in rank order. Array values fan out into one key per
   * combination; a record missing any partition's facet gets no key at all.
   */
  @VisibleForTesting
  static List<String> compositeKeys(
      Map<String, Object> record, List<Partition> partitions, List<Facet> facets) {
    List<String> keys = List.of("");
    for (int i = 0; i < partitions.size(); i++) {
      Partition partition = partitions.get(i);
      Facet facet = facets.get(i);
      List<String> labels = new ArrayList<>();
      if (facet == null) {
        labels.add(Group.OTHER_LABEL);
      } else {
        for (Object value : facet.baseValues(record)) {
          labels.add(partition.label(partition.bucket(facet, value)));
        }
      }
      if (labels.isEmpty()) {
        return List.of();
      }
      List<String> next = new ArrayList<>(keys.size() * labels.size());
      for (String key : keys) {
        for (String label : labels) {
          next.add(i == 0 ? label : key + Filter.KEY_SEPARATOR + label);
        }
      }
      keys = next;
    }
    return keys;
  }

  @Override
  public void releaseDataFilter(Filter filter) {
    FilterIndex filterIndex = filterIndexes.remove(filter.getId());
    if (filterIndex != null) {
      filterIndex.dimension().dispose();
    }
  }

  @Override
  public void updateDataFilter(Filter filter) {
    FilterIndex filterIndex = filterIndexes.get(filter.getId());
    if (filterIndex == null) {
      return;
    }
    filterIndex.dimension().filterFunction(filter.hasSelection() ? filter.filterFunction() : null);
    filterUpdateCounter.increment();
  }

  @Override
  public void getData(Filter filter) {
    FilterIndex filterIndex = filterIndexes.get(filter.getId());
    if (filterIndex == null) {
      return;
    }
    List<ImmutableMap<String, Object>> rows = getDataTimer.record(() -> rows(filterIndex));
    dataTotal = index.size();
    dataSelected = index.selectedCount();
    filter.setData(rows);
  }

  private List<ImmutableMap<String, Object>> rows(FilterIndex filterIndex) {
    List<ImmutableMap<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<String, FilterAccumulator> entry : filterIndex.group().all().entrySet()) {
      FilterAccumulator accumulator = entry.getValue();
      if (accumulator.getRecords() <= 0) {
        continue;
      }
      List<String> labels =
          filterIndex.partitions().isEmpty()
              ? List.of()
              : KEY_SPLITTER.splitToList(entry.getKey());
      List<Object> values = new ArrayList<>();
      for (int i = 0; i < filterIndex.aggregates().size(); i++) {
        Aggregate aggregate = filterIndex.aggregates().get(i);
        if (!aggregate.isRowCount() && filterIndex.aggregateFacets().get(i) == null) {
          values.add(Misval.MISSING);
        } else {
          values.add(aggregate.operation().reduce(accumulator.getAggregate(i)));
        }
      }
      rows.add(ResultRows.row(labels, values));
    }
    rows.sort(ResultRows.groupOrder(filterIndex.partitions()));
    return rows;
  }

  @Override
  public boolean isInitialized(Filter filter) {
    return filterIndexes.containsKey(filter.getId());
  }
}
