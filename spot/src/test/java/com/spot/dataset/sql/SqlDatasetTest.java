package com.spot.dataset.sql;

import static com.spot.testlib.MetricsUtil.getCount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spot.dataset.Dataset;
import com.spot.dataset.memory.InMemoryDataset;
import com.spot.facet.Facet;
import com.spot.facet.FacetType;
import com.spot.filter.Aggregate;
import com.spot.filter.AggregateOperation;
import com.spot.filter.Filter;
import com.spot.filter.FilterState;
import com.spot.partition.GroupingStrategy;
import com.spot.partition.Partition;
import com.spot.proto.config.SpotConfigs;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jooq.SQLDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SqlDatasetTest {
  private static final AtomicInteger DATABASE_ID = new AtomicInteger();
  private static final String TABLE = "records";
  private static final String RECORDS_JSON =
      "[{\"origin\":\"US\",\"mpg\":18,\"cylinders\":8,\"weight\":3504.5},"
          + "{\"origin\":\"EU\",\"mpg\":30.5,\"cylinders\":4,\"weight\":2130},"
          + "{\"origin\":\"JP\",\"mpg\":34,\"cylinders\":4,\"weight\":1985.25},"
          + "{\"origin\":\"US\",\"mpg\":22,\"cylinders\":6,\"weight\":3000},"
          + "{\"origin\":\"EU\",\"mpg\":null,\"cylinders\":4,\"weight\":2250.75},"
          + "{\"origin\":null,\"mpg\":25,\"cylinders\":6,\"weight\":2800},"
          + "{\"origin\":\"JP\",\"mpg\":31,\"cylinders\":3,\"weight\":1700}]";
  private static final String[] INSERTS = {
    "('US', 18, 8, 3504.5)",
    "('EU', 30.5, 4, 2130)",
    "('JP', 34, 4, 1985.25)",
    "('US', 22, 6, 3000)",
    "('EU', null, 4, 2250.75)",
    "(null, 25, 6, 2800)",
    "('JP', 31, 3, 1700)"
  };

  private SimpleMeterRegistry meterRegistry;
  private HikariDataSource dataSource;
  private final List<SqlDataset> datasets = new ArrayList<>();

  @BeforeEach
  public void setUp() throws SQLException {
    meterRegistry = new SimpleMeterRegistry();
    SpotConfigs.SqlConfig sqlConfig =
        SpotConfigs.SqlConfig.newBuilder()
            .setJdbcUrl("jdbc:h2:mem:spot_" + DATABASE_ID.incrementAndGet() + ";DB_CLOSE_DELAY=-1")
            .setTableName(TABLE)
            .setPoolSize(4)
            .setConnectionTimeoutMs(2000)
            .build();
    dataSource = SqlDataSources.fromConfig(sqlConfig);
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      statement.execute(
          "CREATE TABLE \"records\" (\"origin\" VARCHAR(16), \"mpg\" DOUBLE PRECISION,"
              + " \"cylinders\" INTEGER, \"weight\" DOUBLE PRECISION)");
      for (String values : INSERTS) {
        statement.execute(
            "INSERT INTO \"records\" (\"origin\", \"mpg\", \"cylinders\", \"weight\") VALUES "
                + values);
      }
    }
  }

  @AfterEach
  public void tearDown() throws SQLException {
    // datasets close the shared pool, so the schema goes first
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      statement.execute("DROP ALL OBJECTS");
    }
    datasets.forEach(SqlDataset::close);
    dataSource.close();
    meterRegistry.close();
  }

  private SqlDataset newDataset(ExecutorService executor) {
    return newDataset(TABLE, executor);
  }

  private SqlDataset newDataset(String tableName, ExecutorService executor) {
    SqlDataset dataset =
        new SqlDataset(
            "cars",
            dataSource,
            SQLDialect.H2,
            tableName,
            executor,
            meterRegistry,
            SqlDataset.DEFAULT_SCAN_ROWS,
            SqlDataset.DEFAULT_MAX_CATEGORIES);
    datasets.add(dataset);
    return dataset;
  }

  private SqlDataset newDataset() {
    return newDataset(TABLE, queryExecutor());
  }

  private static ExecutorService queryExecutor() {
    return Executors.newFixedThreadPool(
        2, new ThreadFactoryBuilder().setNameFormat("spot-sql-test-%d").build());
  }

  private static Filter filterOn(SqlDataset dataset, String id, Partition... partitions) {
    Filter filter = new Filter(id, partitions.length, partitions.length);
    dataset.addFilter(filter);
    for (Partition partition : partitions) {
      filter.addPartition(partition);
    }
    return filter;
  }

  @Test
  public void testScanData() {
    SqlDataset dataset = newDataset();
    dataset.scanData();

    assertThat(dataset.getFacets())
        .extracting(Facet::getAccessor)
        .containsExactlyInAnyOrder("origin", "mpg", "cylinders", "weight");
    Facet mpg = dataset.getFacet("mpg");
    assertThat(mpg.getType()).isEqualTo(FacetType.CONTINUOUS);
    assertThat(mpg.getMinval()).isEqualTo(18.0);
    assertThat(mpg.getMaxval()).isEqualTo(34.0);
    Facet origin = dataset.getFacet("origin");
    assertThat(origin.getType()).isEqualTo(FacetType.CATEGORIAL);
    assertThat(origin.getCategorialTransform().groupCounts())
        .containsExactly(entry("EU", 2L), entry("JP", 2L), entry("US", 2L));
  }

  @Test
  public void testTransforms() {
    SqlDataset dataset = newDataset();
    Facet mpg = new Facet("mpg", FacetType.CONTINUOUS);
    dataset.addFacet(mpg);

    dataset.setPercentiles(mpg);
    assertThat(mpg.getContinuousTransform().getControlPoints()).hasSize(103);
    assertThat(mpg.getContinuousTransform().getControlPoints().get(0).x()).isEqualTo(18.0);

    dataset.setExceedances(mpg);
    assertThat(mpg.getContinuousTransform().forward(27.75)).isEqualTo(0.0);
    assertThat(mpg.getContinuousTransform().forward(34)).isEqualTo(6.0);
  }

  @Test
  public void testCountsPerBucket() {
    SqlDataset dataset = newDataset();
    dataset.scanData();
    Filter filter = filterOn(dataset, "f", new Partition("cylinders", GroupingStrategy.FIXED_N, 5));

    await().until(() -> filter.getData().size() == 3);
    assertThat(filter.getState()).isEqualTo(FilterState.ACTIVE);
    assertThat(filter.getData())
        .extracting(row -> row.get("aa"))
        .containsExactly(4.0, 2.0, 1.0);
    assertThat(filter.getData())
        .extracting(row -> row.get("a"))
        .containsExactly("3.5", "5.5", "7.5");
    assertThat(getCount(SqlDataset.QUERY_COUNTER, meterRegistry)).isPositive();
    await().until(() -> dataset.getDataTotal() == 7);
  }

  @Test
  public void testMatchesInMemoryBackend() {
    InMemoryDataset memory = new InMemoryDataset("cars", new SimpleMeterRegistry());
    memory.loadRecords(RECORDS_JSON);
    memory.scanData();
    SqlDataset sql = newDataset();
    for (Facet facet : memory.getFacets()) {
      sql.addFacet(facet);
    }

    List<Filter> memoryFilters = buildFilters(memory);
    List<Filter> sqlFilters = buildFilters(sql);
    assertMatching(memoryFilters, sqlFilters);

    memoryFilters.get(0).selectGroup(memoryFilters.get(0).getPartitions().get(0), "US");
    sqlFilters.get(0).selectGroup(sqlFilters.get(0).getPartitions().get(0), "US");
    memoryFilters.get(1).selectRange(memoryFilters.get(1).getPartitions().get(0), 20, 35);
    sqlFilters.get(1).selectRange(sqlFilters.get(1).getPartitions().get(0), 20, 35);
    assertMatching(memoryFilters, sqlFilters);
    await().until(() -> sql.getDataSelected() == memory.getDataSelected());

    memoryFilters.get(1).zoomIn();
    sqlFilters.get(1).zoomIn();
    assertMatching(memoryFilters, sqlFilters);

    memoryFilters.get(1).zoomOut();
    sqlFilters.get(1).zoomOut();
    memoryFilters.get(0).clearSelection();
    sqlFilters.get(0).clearSelection();
    assertMatching(memoryFilters, sqlFilters);

    memory.close();
  }

  private static List<Filter> buildFilters(Dataset dataset) {
    Filter byOrigin = new Filter("by-origin", 1, 2);
    byOrigin.addAggregate(new Aggregate("mpg", AggregateOperation.SUM));
    byOrigin.addAggregate(new Aggregate("weight", AggregateOperation.AVG));
    byOrigin.addAggregate(new Aggregate("origin", AggregateOperation.COUNT));
    byOrigin.addAggregate(Aggregate.rowCount());
    dataset.addFilter(byOrigin);
    byOrigin.addPartition(new Partition("origin"));
    byOrigin.addPartition(new Partition("cylinders", GroupingStrategy.FIXED_SIZE, 2));

    Filter byMpg = new Filter("by-mpg", 1, 1);
    dataset.addFilter(byMpg);
    byMpg.addPartition(new Partition("mpg", GroupingStrategy.FIXED_N, 4));

    Filter byWeight = new Filter("by-weight", 1, 1);
    byWeight.addAggregate(new Aggregate("mpg", AggregateOperation.AVG));
    dataset.addFilter(byWeight);
    Partition weight = new Partition("weight", GroupingStrategy.FIXED_N, 3);
    byWeight.addPartition(weight);
    dataset.setPercentiles(dataset.getFacet("weight"));
    byWeight.updatePartition(weight);
    return List.of(byOrigin, byMpg, byWeight);
  }

  private static void assertMatching(List<Filter> memoryFilters, List<Filter> sqlFilters) {
    for (int i = 0; i < memoryFilters.size(); i++) {
      Filter memoryFilter = memoryFilters.get(i);
      Filter sqlFilter = sqlFilters.get(i);
      assertThat(memoryFilter.getData()).isNotEmpty();
      await()
          .atMost(10, TimeUnit.SECONDS)
          .untilAsserted(
              () -> assertThat(sqlFilter.getData()).isEqualTo(memoryFilter.getData()));
    }
  }

  @Test
  public void testOutdatedResultsAreDropped() {
    ManualExecutorService executor = new ManualExecutorService();
    SqlDataset dataset = newDataset(executor);
    dataset.scanData();
    Filter byOrigin = filterOn(dataset, "by-origin", new Partition("origin"));
    Filter byCylinders =
        filterOn(dataset, "by-cylinders", new Partition("cylinders", GroupingStrategy.FIXED_N, 5));
    byOrigin.selectGroup(byOrigin.getPartitions().get(0), "JP");

    executor.runNewestFirst();

    assertThat(getCount(SqlDataset.STALE_RESULT_COUNTER, meterRegistry)).isPositive();
    assertThat(byCylinders.getData())
        .extracting(row -> row.get("aa"))
        .containsExactly(2.0);
    assertThat(byOrigin.getData()).hasSize(3);
  }

  @Test
  public void testResultsOfReleasedFiltersAreDropped() {
    ManualExecutorService executor = new ManualExecutorService();
    SqlDataset dataset = newDataset(executor);
    dataset.scanData();
    Filter filter = filterOn(dataset, "f", new Partition("origin"));

    dataset.removeFilter(filter);
    executor.runAll();

    assertThat(filter.getState()).isEqualTo(FilterState.RELEASED);
    assertThat(filter.getData()).isEmpty();
    assertThat(getCount(SqlDataset.STALE_RESULT_COUNTER, meterRegistry)).isPositive();
  }

  @Test
  public void testQueryFailuresAreCounted() {
    SqlDataset dataset = newDataset();
    Facet ghost = new Facet("ghost", FacetType.CONTINUOUS);
    ghost.setDomain(0.0, 10.0);
    dataset.addFacet(ghost);

    Filter filter = filterOn(dataset, "f", new Partition("ghost", GroupingStrategy.FIXED_N, 2));

    await().until(() -> getCount(SqlDataset.QUERY_FAILED_COUNTER, meterRegistry) >= 1);
    assertThat(filter.getData()).isEmpty();
  }

  @Test
  public void testSynchronousFailuresThrow() {
    SqlDataset dataset = newDataset();
    Facet ghost = new Facet("ghost", FacetType.CONTINUOUS);

    assertThatExceptionOfType(SqlDatasetException.class).isThrownBy(() -> dataset.setMinMax(ghost));
  }

  @Test
  public void testTimeSentinelsMatchInMemoryBackend() throws SQLException {
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      statement.execute(
          "CREATE TABLE \"sales\" (\"region\" VARCHAR(8), \"sold\" TIMESTAMP WITH TIME ZONE)");
      statement.execute(
          "INSERT INTO \"sales\" (\"region\", \"sold\") VALUES"
              + " ('x', TIMESTAMP WITH TIME ZONE '1970-01-01 00:00:00+00:00'),"
              + " ('x', TIMESTAMP WITH TIME ZONE '2020-01-01 00:00:00+00:00'),"
              + " ('y', TIMESTAMP WITH TIME ZONE '2021-07-01 12:00:00+00:00'),"
              + " ('y', null)");
    }
    InMemoryDataset memory = new InMemoryDataset("sales", new SimpleMeterRegistry());
    memory.loadRecords(
        "[{\"region\":\"x\",\"sold\":\"1970-01-01T00:00:00Z\"},"
            + "{\"region\":\"x\",\"sold\":\"2020-01-01T00:00:00Z\"},"
            + "{\"region\":\"y\",\"sold\":\"2021-07-01T12:00:00Z\"},"
            + "{\"region\":\"y\",\"sold\":null}]");
    memory.scanData();
    Facet sold = memory.getFacet("sold");
    assertThat(sold.getType()).isEqualTo(FacetType.DATETIME);
    sold.setMisval(List.of("1970-01-01T00:00:00Z"));

    SqlDataset sql = newDataset("sales", queryExecutor());
    for (Facet facet : memory.getFacets()) {
      sql.addFacet(facet);
    }
    sql.setMinMax(sold);
    assertThat(sold.getMinval()).isEqualTo(1577836800.0);
    assertThat(sold.getMaxval()).isEqualTo(1625140800.0);
    memory.setMinMax(sold);
    assertThat(sold.getMinval()).isEqualTo(1577836800.0);
    assertThat(sold.getMaxval()).isEqualTo(1625140800.0);

    List<Filter> memoryFilters = buildSalesFilters(memory);
    List<Filter> sqlFilters = buildSalesFilters(sql);

    assertThat(memoryFilters.get(0).getData())
        .extracting(row -> row.get("aa"), row -> row.get("bb"))
        .containsExactly(tuple(1.0, 2.0), tuple(1.0, 2.0));
    assertThat(memoryFilters.get(1).getData())
        .extracting(row -> row.get("aa"))
        .containsExactly(1.0, 1.0);
    assertMatching(memoryFilters, sqlFilters);

    memory.close();
  }

  private static List<Filter> buildSalesFilters(Dataset dataset) {
    Filter byRegion = new Filter("by-region", 1, 1);
    byRegion.addAggregate(new Aggregate("sold", AggregateOperation.COUNT));
    byRegion.addAggregate(Aggregate.rowCount());
    dataset.addFilter(byRegion);
    byRegion.addPartition(new Partition("region"));

    Filter bySold = new Filter("by-sold", 1, 1);
    dataset.addFilter(bySold);
    bySold.addPartition(new Partition("sold", GroupingStrategy.FIXED_N, 2));
    return List.of(byRegion, bySold);
  }

  @Test
  public void testZeroPartitionFilterOmitsEmptyResult() {
    InMemoryDataset memory = new InMemoryDataset("cars", new SimpleMeterRegistry());
    memory.loadRecords(RECORDS_JSON);
    memory.scanData();
    SqlDataset sql = newDataset();
    for (Facet facet : memory.getFacets()) {
      sql.addFacet(facet);
    }

    Filter memoryTotal = new Filter("total", 0, 0);
    memory.addFilter(memoryTotal);
    Filter sqlTotal = new Filter("total", 0, 0);
    sql.addFilter(sqlTotal);
    Filter memoryByMpg = new Filter("by-mpg", 1, 1);
    memory.addFilter(memoryByMpg);
    memoryByMpg.addPartition(new Partition("mpg", GroupingStrategy.FIXED_N, 4));
    Filter sqlByMpg = new Filter("by-mpg", 1, 1);
    sql.addFilter(sqlByMpg);
    sqlByMpg.addPartition(new Partition("mpg", GroupingStrategy.FIXED_N, 4));

    assertThat(memoryTotal.getData()).extracting(row -> row.get("aa")).containsExactly(7.0);
    await().untilAsserted(() -> assertThat(sqlTotal.getData()).isEqualTo(memoryTotal.getData()));

    memoryByMpg.selectRange(memoryByMpg.getPartitions().get(0), 100, 200);
    sqlByMpg.selectRange(sqlByMpg.getPartitions().get(0), 100, 200);

    assertThat(memoryTotal.getData()).isEmpty();
    await().untilAsserted(() -> assertThat(sqlTotal.getData()).isEmpty());
    memory.close();
  }
}
