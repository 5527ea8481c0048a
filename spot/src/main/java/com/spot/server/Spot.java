package com.spot.server;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.spot.dataset.Dataset;
import com.spot.proto.config.SpotConfigs;
import com.spot.util.MetricsFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Main class of Spot: loads the config, builds the dataset and runs it until shutdown. */
public class Spot {
  private static final Logger LOG = LoggerFactory.getLogger(Spot.class);

  private final SpotConfigs.SpotConfig spotConfig;
  private final MeterRegistry meterRegistry;
  protected ServiceManager serviceManager;
  private DatasetService datasetService;

  Spot(SpotConfigs.SpotConfig spotConfig, MeterRegistry meterRegistry) {
    this.spotConfig = spotConfig;
    this.meterRegistry = meterRegistry;
    Metrics.addRegistry(meterRegistry);
    LOG.info("Started Spot process with config: {}", spotConfig);
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      LOG.error("Config file is needed as first argument");
      System.exit(1);
    }
    Path configFilePath = Path.of(args[0]);

    SpotConfig.initFromFile(configFilePath);
    SpotConfigs.SpotConfig config = SpotConfig.get();
    MetricsFactory.init(config);
    Spot spot = new Spot(config, MetricsFactory.getRegistry());
    spot.start();
  }

  public void start() {
    setupSystemMetrics(meterRegistry);
    addShutdownHook();

    Dataset dataset = DatasetService.buildDataset(spotConfig, meterRegistry);
    datasetService = new DatasetService(spotConfig, dataset);
    serviceManager = new ServiceManager(List.<Service>of(datasetService));
    serviceManager.addListener(getServiceManagerListener(), MoreExecutors.directExecutor());

    serviceManager.startAsync();
  }

  public Dataset getDataset() {
    return datasetService.getDataset();
  }

  private ServiceManager.Listener getServiceManagerListener() {
    return new ServiceManager.Listener() {
      @Override
      public void failure(Service service) {
        LOG.error(
            String.format("Service %s failed with cause ", service.getClass().toString()),
            service.failureCause());
        // stop everything if any service enters failure state
        serviceManager.stopAsync();
      }

      @Override
      public void healthy() {
        LOG.info("Spot is serving dataset {}", spotConfig.getDatasetName());
      }
    };
  }

  void shutdown() {
    LOG.info("Running shutdown hook.");
    try {
      serviceManager.stopAsync().awaitStopped(SpotConfig.DEFAULT_START_STOP_DURATION);
    } catch (Exception e) {
      // stopping timed out
      LOG.error("ServiceManager shutdown timed out", e);
    }
    LOG.info("Shutting down LogManager");
    LogManager.shutdown();
  }

  private void addShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
  }

  private static void setupSystemMetrics(MeterRegistry meterRegistry) {
    // Expose JVM metrics.
    new ClassLoaderMetrics().bindTo(meterRegistry);
    new JvmMemoryMetrics().bindTo(meterRegistry);
    new JvmGcMetrics().bindTo(meterRegistry);
    new ProcessorMetrics().bindTo(meterRegistry);
    new JvmThreadMetrics().bindTo(meterRegistry);

    LOG.info("Done registering standard JVM metrics");
  }
}
