package com.spot.dataset;

import com.google.common.collect.ImmutableList;
import com.spot.facet.Facet;
import com.spot.filter.Filter;
import com.spot.partition.Partition;
import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dataset owns its facets and filters and computes filter results through one of two backends:
 * an in-memory incremental index or a relational store. Both backends produce the same buckets, the
 * same missing value handling and the same row shape for a given filter.
 */
public abstract class Dataset implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Dataset.class);

  private final String name;
  private final Map<String, Facet> facets = new LinkedHashMap<>();
  private final List<Filter> filters = new CopyOnWriteArrayList<>();
  private double defaultGroupingParam = Partition.DEFAULT_GROUPING_PARAM;

  protected volatile long dataTotal;
  protected volatile long dataSelected;

  protected Dataset(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  // Facets

  public synchronized Facet getFacet(String id) {
    return id == null ? null : facets.get(id);
  }

  public synchronized ImmutableList<Facet> getFacets() {
    return ImmutableList.copyOf(facets.values());
  }

  public synchronized void addFacet(Facet facet) {
    facets.putIfAbsent(facet.getId(), facet);
  }

  public synchronized void removeFacet(String id) {
    facets.remove(id);
  }

  public double getDefaultGroupingParam() {
    return defaultGroupingParam;
  }

  public void setDefaultGroupingParam(double defaultGroupingParam) {
    this.defaultGroupingParam = defaultGroupingParam;
  }

  // Filters

  public ImmutableList<Filter> getFilters() {
    return ImmutableList.copyOf(filters);
  }

  public void addFilter(Filter filter) {
    filters.add(filter);
    filter.attach(this);
  }

  public void removeFilter(Filter filter) {
    if (filters.remove(filter)) {
      filter.release();
    }
  }

  /** Filters with live backend resources, other than {@code filter}. */
  protected ImmutableList<Filter> otherActiveFilters(Filter filter) {
    return filters.stream()
        .filter(other -> other != filter && isInitialized(other))
        .collect(ImmutableList.toImmutableList());
  }

  /** Records in the dataset. */
  public long getDataTotal() {
    return dataTotal;
  }

  /** Records passing the selections of all active filters. */
  public long getDataSelected() {
    return dataSelected;
  }

  /** Requests fresh data for every filter with live backend resources. */
  public void getAllData() {
    for (Filter filter : filters) {
      if (isInitialized(filter)) {
        getData(filter);
      }
    }
  }

  @Override
  public void close() {
    for (Filter filter : filters) {
      removeFilter(filter);
    }
    LOG.info("Closed dataset {}", name);
  }

  /** Sets the domain of a freshly discovered facet: min/max or its categories. */
  protected void initializeFacet(Facet facet) {
    if (facet.getType().isContinuousLike()) {
      setMinMax(facet);
    } else {
      setCategories(facet);
    }
  }

  /** Discovers facets and initializes the domain of every new one. */
  public abstract void scanData();

  public abstract void setMinMax(Facet facet);

  public abstract void setCategories(Facet facet);

  public abstract void setPercentiles(Facet facet);

  public abstract void setExceedances(Facet facet);

  public abstract void initDataFilter(Filter filter);

  public abstract void releaseDataFilter(Filter filter);

  public abstract void updateDataFilter(Filter filter);

  /** Computes the filter's rows and hands them to {@link Filter#setData}. */
  public abstract void getData(Filter filter);

  public abstract boolean isInitialized(Filter filter);
}
