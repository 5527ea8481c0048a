package com.spot.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.spot.proto.config.SpotConfigs;
import java.util.Arrays;
import org.jooq.SQLDialect;

public class ValidateSpotConfig {

  /**
   * Checks that the config describes a dataset Spot can start. Classes consuming a config section
   * still apply their own defaults for unset optional values.
   */
  public static void validateConfig(SpotConfigs.SpotConfig spotConfig) {
    checkArgument(
        spotConfig.getDatasetType() == SpotConfigs.DatasetType.IN_MEMORY
            || spotConfig.getDatasetType() == SpotConfigs.DatasetType.SQL,
        "datasetType must be one of IN_MEMORY or SQL");
    checkArgument(!spotConfig.getDatasetName().isEmpty(), "datasetName can't be empty");
    validateScanConfig(spotConfig.getScanConfig());
    if (spotConfig.getDatasetType() == SpotConfigs.DatasetType.IN_MEMORY) {
      validateInMemoryConfig(spotConfig.getInMemoryConfig());
    } else {
      validateSqlConfig(spotConfig.getSqlConfig());
    }
  }

  private static void validateScanConfig(SpotConfigs.ScanConfig scanConfig) {
    checkArgument(scanConfig.getSampleSize() >= 1, "ScanConfig sampleSize must be at least 1");
    checkArgument(
        scanConfig.getDefaultGroupingParam() >= 1,
        "ScanConfig defaultGroupingParam must be at least 1");
  }

  private static void validateInMemoryConfig(SpotConfigs.InMemoryConfig inMemoryConfig) {
    checkArgument(
        !inMemoryConfig.getDataFile().isEmpty(), "InMemoryConfig dataFile can't be empty");
  }

  private static void validateSqlConfig(SpotConfigs.SqlConfig sqlConfig) {
    checkArgument(!sqlConfig.getJdbcUrl().isEmpty(), "SqlConfig jdbcUrl can't be empty");
    checkArgument(!sqlConfig.getTableName().isEmpty(), "SqlConfig tableName can't be empty");
    checkArgument(sqlConfig.getPoolSize() >= 1, "SqlConfig poolSize must be at least 1");
    checkArgument(sqlConfig.getQueryThreads() >= 1, "SqlConfig queryThreads must be at least 1");
    checkArgument(
        sqlConfig.getMaxCategories() >= 1, "SqlConfig maxCategories must be at least 1");
    if (!sqlConfig.getDialect().isEmpty()) {
      checkArgument(
          Arrays.stream(SQLDialect.values())
              .anyMatch(dialect -> dialect.name().equals(sqlConfig.getDialect())),
          "SqlConfig dialect %s is not a known dialect",
          sqlConfig.getDialect());
    }
  }
}
