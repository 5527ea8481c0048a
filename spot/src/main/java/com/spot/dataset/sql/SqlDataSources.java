package com.spot.dataset.sql;

import static com.google.common.base.Preconditions.checkArgument;

import com.spot.proto.config.SpotConfigs;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Builds the bounded connection pool the relational backend acquires connections from. */
public class SqlDataSources {
  public static final String POOL_NAME = "spot-sql-pool";
  private static final long MIN_CONNECTION_TIMEOUT_MS = 250;

  private SqlDataSources() {}

  public static HikariDataSource fromConfig(SpotConfigs.SqlConfig sqlConfig) {
    checkArgument(!sqlConfig.getJdbcUrl().isEmpty(), "jdbcUrl can't be empty");
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setPoolName(POOL_NAME);
    hikariConfig.setJdbcUrl(sqlConfig.getJdbcUrl());
    if (!sqlConfig.getUsername().isEmpty()) {
      hikariConfig.setUsername(sqlConfig.getUsername());
      hikariConfig.setPassword(sqlConfig.getPassword());
    }
    hikariConfig.setMaximumPoolSize(Math.max(1, sqlConfig.getPoolSize()));
    if (sqlConfig.getConnectionTimeoutMs() >= MIN_CONNECTION_TIMEOUT_MS) {
      hikariConfig.setConnectionTimeout(sqlConfig.getConnectionTimeoutMs());
    }
    return new HikariDataSource(hikariConfig);
  }
}
