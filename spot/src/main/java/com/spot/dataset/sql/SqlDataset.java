package com.spot.dataset.sql;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spot.dataset.Dataset;
import com.spot.facet.Facet;
import com.spot.facet.FacetType;
import com.spot.facet.TransformEngine;
import com.spot.filter.Filter;
import com.spot.proto.config.SpotConfigs;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.jooq.DSLContext;
import org.jooq.DataType;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record1;
import org.jooq.Record2;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.conf.StatementType;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dataset backed by a table in a relational store. Facet scans and transform computations run
 * synchronously; filter data is fetched asynchronously on a query executor and handed to the filter
 * from the executor thread. Every fetch is stamped with the filter's request generation, and
 * results of outdated generations or released filters are dropped.
 */
public class SqlDataset extends Dataset {
  private static final Logger LOG = LoggerFactory.getLogger(SqlDataset.class);

  public static final String QUERY_COUNTER = "spot_sql_query_count";
  public static final String QUERY_FAILED_COUNTER = "spot_sql_query_failed";
  public static final String STALE_RESULT_COUNTER = "spot_sql_stale_result_dropped";
  public static final String QUERY_TIMER = "spot_sql_query_timer";

  public static final int DEFAULT_SCAN_ROWS = 50;
  public static final int DEFAULT_MAX_CATEGORIES = 50;
  private static final int DESCRIPTION_VALUES = 6;
  private static final Joiner DESCRIPTION_JOINER = Joiner.on(", ");

  private final DataSource dataSource;
  private final DSLContext dsl;
  private final SqlQueryCompiler compiler;
  private final ExecutorService executor;
  private final int scanRows;
  private final int maxCategories;
  private final Set<String> initialized = ConcurrentHashMap.newKeySet();

  private final Counter queryCounter;
  private final Counter queryFailedCounter;
  private final Counter staleResultCounter;
  private final Timer queryTimer;

  public SqlDataset(
      String name,
      DataSource dataSource,
      SQLDialect dialect,
      String tableName,
      ExecutorService executor,
      MeterRegistry meterRegistry,
      int scanRows,
      int maxCategories) {
    super(name);
    this.dataSource = dataSource;
    this.dsl =
        DSL.using(
            dataSource, dialect, new Settings().withStatementType(StatementType.STATIC_STATEMENT));
    this.compiler = new SqlQueryCompiler(dsl, tableName);
    this.executor = executor;
    this.scanRows = scanRows;
    this.maxCategories = maxCategories;
    this.queryCounter = meterRegistry.counter(QUERY_COUNTER);
    this.queryFailedCounter = meterRegistry.counter(QUERY_FAILED_COUNTER);
    this.staleResultCounter = meterRegistry.counter(STALE_RESULT_COUNTER);
    this.queryTimer = meterRegistry.timer(QUERY_TIMER);
  }

  public static SqlDataset fromConfig(
      String name, SpotConfigs.SqlConfig sqlConfig, MeterRegistry meterRegistry) {
    HikariDataSource dataSource = SqlDataSources.fromConfig(sqlConfig);
    SQLDialect dialect =
        sqlConfig.getDialect().isEmpty()
            ? SQLDialect.POSTGRES
            : SQLDialect.valueOf(sqlConfig.getDialect());
    ExecutorService executor =
        Executors.newFixedThreadPool(
            Math.max(1, sqlConfig.getQueryThreads()),
            new ThreadFactoryBuilder().setNameFormat("spot-sql-query-%d").setDaemon(true).build());
    return new SqlDataset(
        name,
        dataSource,
        dialect,
        sqlConfig.getTableName(),
        executor,
        meterRegistry,
        sqlConfig.getScanRows() > 0 ? sqlConfig.getScanRows() : DEFAULT_SCAN_ROWS,
        sqlConfig.getMaxCategories() > 0 ? sqlConfig.getMaxCategories() : DEFAULT_MAX_CATEGORIES);
  }

  @VisibleForTesting
  SqlQueryCompiler getCompiler() {
    return compiler;
  }

  private <T> T run(String description, Supplier<T> statement) {
    try {
      return statement.get();
    } catch (DataAccessException e) {
      throw new SqlDatasetException("Failed to " + description + " on dataset " + getName(), e);
    }
  }

  // Facets

  @Override
  public void scanData() {
    Result<Record> sample = run("sample table", () -> compiler.sampleQuery(scanRows).fetch());
    int added = 0;
    for (Field<?> field : sample.fields()) {
      FacetType type = facetType(field.getDataType());
      if (type == null) {
        LOG.debug("Skipping column {} of type {}", field.getName(), field.getDataType());
        continue;
      }
      if (getFacet(field.getName()) != null) {
        continue;
      }
      Facet facet = new Facet(field.getName(), type);
      Set<String> values = new LinkedHashSet<>();
      for (Record record : sample) {
        Object value = record.get(field);
        if (value != null && values.size() < DESCRIPTION_VALUES) {
          values.add(value.toString());
        }
      }
      facet.setDescription(DESCRIPTION_JOINER.join(values));
      addFacet(facet);
      initializeFacet(facet);
      added++;
    }
    LOG.info("Scan of dataset {} found {} new facets", getName(), added);
  }

  /** Facet type for a column type, or null for columns that can't be faceted. */
  static FacetType facetType(DataType<?> dataType) {
    if (dataType.isBinary() || dataType.isArray()) {
      return null;
    }
    if (dataType.isNumeric()) {
      return FacetType.CONTINUOUS;
    }
    if (dataType.isDateTime()) {
      return FacetType.DATETIME;
    }
    if (dataType.isInterval()) {
      return FacetType.DURATION;
    }
    if (dataType.isString()) {
      return FacetType.CATEGORIAL;
    }
    if (SQLDataType.OTHER.equals(dataType.getSQLDataType())
        || dataType.isLob()
        || dataType.isUDT()) {
      return null;
    }
    return FacetType.CATEGORIAL;
  }

  @Override
  public void setMinMax(Facet facet) {
    Record2<Double, Double> minMax =
        run("find min/max of " + facet.getId(), () -> compiler.minMaxQuery(facet).fetchOne());
    if (minMax == null || minMax.value1() == null || minMax.value2() == null) {
      LOG.warn("No valid values for facet {}, leaving its domain unset", facet.getId());
      facet.setDomain(null, null);
      return;
    }
    facet.setDomain(minMax.value1(), minMax.value2());
  }

  private double[] sortedValues(Facet facet) {
    Result<Record1<Double>> values =
        run("read values of " + facet.getId(), () -> compiler.sortedValuesQuery(facet).fetch());
    return values.stream().mapToDouble(Record1::value1).toArray();
  }

  @Override
  public void setPercentiles(Facet facet) {
    TransformEngine.setPercentiles(facet, sortedValues(facet));
  }

  @Override
  public void setExceedances(Facet facet) {
    TransformEngine.setExceedances(facet, sortedValues(facet));
  }

  @Override
  public void setCategories(Facet facet) {
    Result<Record2<String, Integer>> categories =
        run(
            "read categories of " + facet.getId(),
            () -> compiler.categoriesQuery(facet, maxCategories).fetch());
    Map<String, Long> counts = new LinkedHashMap<>();
    categories.forEach(category -> counts.put(category.value1(), (long) category.value2()));
    TransformEngine.setCategories(facet, counts);
  }

  // Filters

  @Override
  public void initDataFilter(Filter filter) {
    initialized.add(filter.getId());
  }

  @Override
  public void releaseDataFilter(Filter filter) {
    if (initialized.remove(filter.getId())) {
      filter.invalidate();
    }
  }

  @Override
  public void updateDataFilter(Filter filter) {
    // the selection is compiled into the next query of every other filter
    LOG.debug("Selection of filter {} changed", filter.getId());
  }

  @Override
  public boolean isInitialized(Filter filter) {
    return initialized.contains(filter.getId());
  }

  @Override
  public void getData(Filter filter) {
    fetch(filter);
  }

  /** Submits the filter's query; the future completes after the rows were applied or dropped. */
  public CompletableFuture<Void> fetch(Filter filter) {
    SqlQueryCompiler.CompiledQuery query =
        compiler.compile(filter, this::getFacet, otherActiveFilters(filter));
    long generation = filter.nextGeneration();
    queryCounter.increment();
    LOG.debug("Query for filter {} generation {}: {}", filter.getId(), generation, query.getSql());

    return CompletableFuture.supplyAsync(() -> queryTimer.record(query::fetchRows), executor)
        .handle(
            (rows, throwable) -> {
              if (throwable != null) {
                queryFailedCounter.increment();
                LOG.error("Query for filter {} failed", filter.getId(), throwable);
              } else if (!isInitialized(filter) || !filter.setData(generation, rows)) {
                staleResultCounter.increment();
                LOG.debug("Dropped stale result of filter {}", filter.getId());
              }
              return null;
            });
  }

  @Override
  public void getAllData() {
    super.getAllData();
    refreshCounts();
  }

  /** Updates the record counters asynchronously. */
  public CompletableFuture<Void> refreshCounts() {
    ImmutableList<Filter> activeFilters = otherActiveFilters(null);
    return CompletableFuture.runAsync(
            () -> {
              dataTotal = compiler.countQuery(List.of(), this::getFacet).fetchOne().value1();
              dataSelected =
                  compiler.countQuery(activeFilters, this::getFacet).fetchOne().value1();
            },
            executor)
        .exceptionally(
            throwable -> {
              queryFailedCounter.increment();
              LOG.error("Count query on dataset {} failed", getName(), throwable);
              return null;
            });
  }

  @Override
  public void close() {
    super.close();
    MoreExecutors.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS);
    if (dataSource instanceof Closeable closeable) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.error("Failed to close data source of dataset {}", getName(), e);
      }
    }
  }
}
