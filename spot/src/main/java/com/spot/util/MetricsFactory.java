package com.spot.util;

import com.spot.proto.config.SpotConfigs;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.util.Locale;

public class MetricsFactory {
  private static PrometheusMeterRegistry _instance = null;

  public static void init(SpotConfigs.SpotConfig config) {
    if (_instance == null) {
      _instance = initPrometheusMeterRegistry(config);
    }
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(SpotConfigs.SpotConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "spot_dataset",
            config.getDatasetName(),
            "spot_backend",
            config.getDatasetType().toString().toLowerCase(Locale.ROOT));
    return prometheusMeterRegistry;
  }

  public static PrometheusMeterRegistry getRegistry() {
    if (_instance == null) {
      throw new IllegalStateException("MetricsFactory not initialized");
    }
    return _instance;
  }
}
