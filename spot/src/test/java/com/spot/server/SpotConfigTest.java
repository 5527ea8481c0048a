package com.spot.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.AssertionsForClassTypes.assertThatExceptionOfType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.spot.proto.config.SpotConfigs;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SpotConfigTest {

  @BeforeEach
  public void setUp() {
    SpotConfig.reset();
  }

  @AfterEach
  public void tearDown() {
    SpotConfig.reset();
  }

  @Test
  public void testInitWithMissingConfigFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SpotConfig.initFromFile(Path.of("missing_config_file.json")));
  }

  @Test
  public void testEmptyJsonCfgFile() {
    assertThatExceptionOfType(InvalidProtocolBufferException.class)
        .isThrownBy(() -> SpotConfig.fromJsonConfig(""));
  }

  @Test
  public void testGetBeforeInit() {
    assertThatIllegalStateException().isThrownBy(SpotConfig::get);
  }

  @Test
  public void testStrToIntTypeConversionForWrongJsonType() throws InvalidProtocolBufferException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode node = mapper.createObjectNode();
    node.put("datasetType", "IN_MEMORY").put("datasetName", "cars");
    node.set(
        "scanConfig",
        mapper.createObjectNode().put("sampleSize", "25").put("defaultGroupingParam", "8"));
    node.set("inMemoryConfig", mapper.createObjectNode().put("dataFile", "records.json"));

    SpotConfigs.SpotConfig spotConfig = SpotConfig.fromJsonConfig(node.toString());

    assertThat(spotConfig.getScanConfig().getSampleSize()).isEqualTo(25);
    assertThat(spotConfig.getScanConfig().getDefaultGroupingParam()).isEqualTo(8);
  }

  @Test
  public void testUnknownFieldsAreIgnored() throws InvalidProtocolBufferException {
    String json =
        "{\"datasetType\":\"IN_MEMORY\",\"datasetName\":\"cars\",\"colour\":\"blue\","
            + "\"scanConfig\":{\"sampleSize\":1,\"defaultGroupingParam\":1},"
            + "\"inMemoryConfig\":{\"dataFile\":\"records.json\"}}";

    assertThat(SpotConfig.fromJsonConfig(json).getDatasetName()).isEqualTo("cars");
  }

  @Test
  public void testParseSpotJsonConfigFile() throws IOException {
    final File cfgFile =
        new File(getClass().getClassLoader().getResource("test_config.json").getFile());
    SpotConfig.initFromFile(cfgFile.toPath());
    final SpotConfigs.SpotConfig config = SpotConfig.get();

    assertThat(config.getDatasetType()).isEqualTo(SpotConfigs.DatasetType.SQL);
    assertThat(config.getDatasetName()).isEqualTo("cars");
    assertThat(config.getScanConfig().getSampleSize()).isEqualTo(10);
    assertThat(config.getScanConfig().getDefaultGroupingParam()).isEqualTo(20);

    final SpotConfigs.SqlConfig sqlConfig = config.getSqlConfig();
    assertThat(sqlConfig.getJdbcUrl()).isEqualTo("jdbc:h2:mem:spot_config");
    assertThat(sqlConfig.getTableName()).isEqualTo("records");
    assertThat(sqlConfig.getDialect()).isEqualTo("H2");
    assertThat(sqlConfig.getPoolSize()).isEqualTo(2);
    assertThat(sqlConfig.getQueryThreads()).isEqualTo(2);
    assertThat(sqlConfig.getConnectionTimeoutMs()).isEqualTo(1000);
    assertThat(sqlConfig.getScanRows()).isEqualTo(20);
    assertThat(sqlConfig.getMaxCategories()).isEqualTo(10);
    assertThat(config.hasInMemoryConfig()).isFalse();
  }

  @Test
  public void testParseSpotYamlConfigFile() throws IOException {
    final File cfgFile =
        new File(getClass().getClassLoader().getResource("test_config.yaml").getFile());
    SpotConfig.initFromFile(cfgFile.toPath());
    final SpotConfigs.SpotConfig config = SpotConfig.get();

    assertThat(config.getDatasetType()).isEqualTo(SpotConfigs.DatasetType.IN_MEMORY);
    assertThat(config.getDatasetName()).isEqualTo("cars");
    assertThat(config.getScanConfig().getSampleSize()).isEqualTo(5);
    assertThat(config.getScanConfig().getDefaultGroupingParam()).isEqualTo(10);
    assertThat(config.getInMemoryConfig().getDataFile())
        .isEqualTo("src/test/resources/records.json");
  }

  @Test
  public void testEnvVarSubstitutionInYaml() throws IOException {
    final File cfgFile =
        new File(getClass().getClassLoader().getResource("test_config.yaml").getFile());
    String yaml = Files.readString(cfgFile.toPath());
    Map<String, String> env = Map.of("DATASET_NAME", "trucks");

    final SpotConfigs.SpotConfig config = SpotConfig.fromYamlConfig(yaml, env::get);

    assertThat(config.getDatasetName()).isEqualTo("trucks");
  }

  @Test
  public void testInvalidConfigIsRejected() {
    String yaml = "datasetType: SQL\n" + "datasetName: cars\n";

    assertThatIllegalArgumentException()
        .isThrownBy(() -> SpotConfig.fromYamlConfig(yaml, key -> null))
        .withMessageContaining("ScanConfig sampleSize");
  }

  @Test
  public void testInvalidFileExtension(@TempDir Path tempDir) throws IOException {
    Path cfgFile = tempDir.resolve("spot.txt");
    Files.writeString(cfgFile, "datasetType: IN_MEMORY\n");

    assertThatIllegalArgumentException()
        .isThrownBy(() -> SpotConfig.initFromFile(cfgFile))
        .withMessageContaining("must be either .json or .yaml");
  }

  @Test
  public void testInitFromFileOnlyOnce() throws IOException {
    final File yamlFile =
        new File(getClass().getClassLoader().getResource("test_config.yaml").getFile());
    final File jsonFile =
        new File(getClass().getClassLoader().getResource("test_config.json").getFile());
    SpotConfig.initFromFile(yamlFile.toPath());
    SpotConfig.initFromFile(jsonFile.toPath());

    assertThat(SpotConfig.get().getDatasetType()).isEqualTo(SpotConfigs.DatasetType.IN_MEMORY);
  }
}
