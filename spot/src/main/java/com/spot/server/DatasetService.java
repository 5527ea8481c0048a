package com.spot.server;

import com.google.common.util.concurrent.AbstractIdleService;
import com.spot.dataset.Dataset;
import com.spot.dataset.memory.InMemoryDataset;
import com.spot.dataset.sql.SqlDataset;
import com.spot.facet.Facet;
import com.spot.proto.config.SpotConfigs;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the configured dataset for the lifetime of the process. Startup loads the records of an
 * in-memory dataset and scans the data for facets; shutdown releases every filter and closes the
 * backend.
 */
public class DatasetService extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(DatasetService.class);

  private final SpotConfigs.SpotConfig config;
  private final Dataset dataset;

  public DatasetService(SpotConfigs.SpotConfig config, Dataset dataset) {
    this.config = config;
    this.dataset = dataset;
  }

  public static Dataset buildDataset(SpotConfigs.SpotConfig config, MeterRegistry meterRegistry) {
    return switch (config.getDatasetType()) {
      case IN_MEMORY -> new InMemoryDataset(
          config.getDatasetName(),
          meterRegistry,
          config.getScanConfig().getSampleSize(),
          new Random());
      case SQL -> SqlDataset.fromConfig(
          config.getDatasetName(), config.getSqlConfig(), meterRegistry);
      default -> throw new IllegalArgumentException(
          "Unsupported dataset type " + config.getDatasetType());
    };
  }

  public Dataset getDataset() {
    return dataset;
  }

  @Override
  protected void startUp() throws Exception {
    dataset.setDefaultGroupingParam(config.getScanConfig().getDefaultGroupingParam());
    if (dataset instanceof InMemoryDataset inMemoryDataset) {
      Path dataFile = Path.of(config.getInMemoryConfig().getDataFile());
      LOG.info("Loading records of dataset {} from {}", dataset.getName(), dataFile);
      inMemoryDataset.loadRecords(Files.readString(dataFile));
    }
    dataset.scanData();
    for (Facet facet : dataset.getFacets()) {
      LOG.info("Dataset {} has facet {}", dataset.getName(), facet);
    }
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Closing dataset {}", dataset.getName());
    dataset.close();
  }
}
