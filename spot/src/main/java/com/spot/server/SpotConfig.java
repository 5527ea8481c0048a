package com.spot.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.spot.proto.config.SpotConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/** SpotConfig holds the process wide config, read once from a yaml or json file. */
public class SpotConfig {
  public static final Duration DEFAULT_START_STOP_DURATION = Duration.ofSeconds(30);

  private static SpotConfig _instance = null;

  // Parse a json string as a SpotConfig proto struct.
  @VisibleForTesting
  static SpotConfigs.SpotConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    SpotConfigs.SpotConfig.Builder builder = SpotConfigs.SpotConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, builder);
    SpotConfigs.SpotConfig spotConfig = builder.build();
    ValidateSpotConfig.validateConfig(spotConfig);
    return spotConfig;
  }

  // Parse a yaml string as a SpotConfig proto struct, resolving ${VAR} from the environment.
  public static SpotConfigs.SpotConfig fromYamlConfig(String yamlStr)
      throws InvalidProtocolBufferException, JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static SpotConfigs.SpotConfig fromYamlConfig(String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  @VisibleForTesting
  static void reset() {
    _instance = null;
  }

  public static void initFromFile(Path cfgFilePath) throws IOException {
    if (_instance == null) {
      if (Files.notExists(cfgFilePath)) {
        throw new IllegalArgumentException(
            "Missing config file at: " + cfgFilePath.toAbsolutePath());
      }

      String filename = cfgFilePath.getFileName().toString();
      String content = Files.readString(cfgFilePath);
      if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
        _instance = new SpotConfig(fromYamlConfig(content));
      } else if (filename.endsWith(".json")) {
        _instance = new SpotConfig(fromJsonConfig(content));
      } else {
        throw new IllegalArgumentException(
            "Invalid config file format provided - must be either .json or .yaml");
      }
    }
  }

  public static SpotConfigs.SpotConfig get() {
    if (_instance == null) {
      throw new IllegalStateException("SpotConfig not initialized");
    }
    return _instance.config;
  }

  private final SpotConfigs.SpotConfig config;

  private SpotConfig(SpotConfigs.SpotConfig config) {
    this.config = config;
  }
}
