package ca.gc.cra.brownian.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.validation.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSections() throws IOException {
    Path yaml = write("""
        common:
          metricsExporter: none
          verbose: true
        simulate:
          maxExits: 1000
          stepSize: 0.02
          out: run.csv
        plot:
          nPaths: 8
        """);

    Map<String, String> simulate = YamlConfigLoader.load(yaml, "simulate").orElseThrow();
    Map<String, String> plot = YamlConfigLoader.load(yaml, "plot").orElseThrow();

    assertEquals("1000", simulate.get("maxExits"));
    assertEquals("0.02", simulate.get("stepSize"));
    assertEquals("true", simulate.get("verbose"));
    assertFalse(simulate.containsKey("nPaths"));
    assertEquals("8", plot.get("nPaths"));
    assertEquals("none", plot.get("metricsExporter"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "simulate"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    assertTrue(YamlConfigLoader.load(write(""), "plot").orElseThrow().isEmpty());
  }

  @Test
  void nestedKeysAreFlattened() throws IOException {
    Path yaml = write("""
        simulate:
          domain:
            xMin: -1
        """);

    assertEquals("-1", YamlConfigLoader.load(yaml, "simulate").orElseThrow().get("domain.xMin"));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = write("""
        simulate:
          seed: [1, 2]
        """);

    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> YamlConfigLoader.load(yaml, "simulate"));
    assertTrue(ex.getMessage().contains("seed"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = write("simulate: [unclosed\n");

    assertThrows(ConfigurationException.class, () -> YamlConfigLoader.load(yaml, "simulate"));
  }

  @Test
  void scalarSectionIsRejected() throws IOException {
    Path yaml = write("simulate: 5\n");

    assertThrows(ConfigurationException.class, () -> YamlConfigLoader.load(yaml, "simulate"));
  }

  private Path write(String content) throws IOException {
    return Files.writeString(tempDir.resolve("brownian.yaml"), content);
  }
}
