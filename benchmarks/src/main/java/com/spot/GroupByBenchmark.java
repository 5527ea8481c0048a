package com.spot;

import com.spot.dataset.memory.InMemoryDataset;
import com.spot.filter.Aggregate;
import com.spot.filter.AggregateOperation;
import com.spot.filter.Filter;
import com.spot.partition.GroupingStrategy;
import com.spot.partition.Partition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;

@State(Scope.Thread)
public class GroupByBenchmark {
  private static final String[] ORIGINS = {"US", "EU", "JP", "KR", "CN"};

  @Param({"10000", "100000"})
  private int recordCount;

  private MeterRegistry registry;
  private InMemoryDataset dataset;
  private Filter byOrigin;
  private Filter byMpg;
  private Partition origin;
  private Partition mpg;
  private int selection = 0;

  @Setup(Level.Trial)
  public void createDataset() {
    Random random = new Random(42);
    List<Map<String, Object>> records = new ArrayList<>(recordCount);
    for (int i = 0; i < recordCount; i++) {
      records.add(
          Map.of(
              "origin", ORIGINS[random.nextInt(ORIGINS.length)],
              "mpg", 10 + 35 * random.nextDouble(),
              "weight", 1500 + random.nextInt(3000),
              "cylinders", 3 + random.nextInt(6)));
    }

    registry = new SimpleMeterRegistry();
    dataset = new InMemoryDataset("benchmark", registry, 1000, random);
    dataset.addRecords(records);
    dataset.scanData();

    byOrigin = new Filter("by-origin", 1, 2);
    byOrigin.addAggregate(new Aggregate("weight", AggregateOperation.AVG));
    dataset.addFilter(byOrigin);
    origin = new Partition("origin");
    byOrigin.addPartition(origin);
    byOrigin.addPartition(new Partition("cylinders", GroupingStrategy.FIXED_SIZE, 1));

    byMpg = new Filter("by-mpg", 1, 1);
    dataset.addFilter(byMpg);
    mpg = new Partition("mpg", GroupingStrategy.FIXED_N, 20);
    byMpg.addPartition(mpg);
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    dataset.close();
    registry.close();
  }

  @Benchmark
  public int measureSelectionUpdate() {
    byOrigin.clearSelection();
    byOrigin.selectGroup(origin, ORIGINS[selection++ % ORIGINS.length]);
    return byMpg.getData().size();
  }

  @Benchmark
  public int measureRegroup() {
    byMpg.setGrouping(mpg, GroupingStrategy.FIXED_N, 10 + (selection++ % 20));
    return byMpg.getData().size();
  }
}
