package ca.gc.cra.brownian.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.application.simulation.SimulationParameters;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.validation.ConfigurationException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class SimulationConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    SimulationConfig config = SimulationConfig.defaults();

    assertEquals(Domain.unitSquare(), config.domain());
    assertEquals(50_000, config.maxExits());
    assertEquals(100, config.pathsPerThread());
    assertEquals(0.05, config.stepSize());
    assertTrue(config.seed().isEmpty());
    assertEquals(Path.of("brownian_paths.csv").toAbsolutePath().normalize(), config.output());
    assertFalse(config.allowOverwrite());
  }

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> options = new HashMap<>();
    options.put("domainXMin", "-1");
    options.put("domainXMax", "2");
    options.put("domainYMin", "0.5");
    options.put("domainYMax", "1.5");
    options.put("maxExits", "10");
    options.put("pathsPerThread", "3");
    options.put("stepSize", "0.2");
    options.put("seed", "-42");
    options.put("threads", "2");
    options.put("output", "out/run.csv");
    options.put("allowOverwrite", "yes");

    SimulationConfig config = SimulationConfig.fromMap(options);

    assertEquals(new Domain(-1, 2, 0.5, 1.5), config.domain());
    assertEquals(10, config.maxExits());
    assertEquals(3, config.pathsPerThread());
    assertEquals(0.2, config.stepSize());
    assertEquals(OptionalLong.of(-42), config.seed());
    assertEquals(2, config.threads());
    assertEquals(Path.of("out/run.csv").toAbsolutePath().normalize(), config.output());
    assertTrue(config.allowOverwrite());

    SimulationParameters parameters = config.toParameters();
    assertEquals(10, parameters.maxGlobalExits());
    assertEquals(config.domain(), parameters.domain());
  }

  @Test
  void blankSeedMeansEntropy() {
    assertTrue(SimulationConfig.fromMap(Map.of("seed", " ")).seed().isEmpty());
  }

  @Test
  void invalidValuesNameTheirKey() {
    assertMessage(Map.of("stepSize", "0"), "stepSize");
    assertMessage(Map.of("stepSize", "-0.1"), "stepSize");
    assertMessage(Map.of("maxExits", "-5"), "maxExits");
    assertMessage(Map.of("pathsPerThread", "0"), "pathsPerThread");
    assertMessage(Map.of("threads", "5000"), "threads");
    assertMessage(Map.of("domainXMin", "2"), "domainXMin");
    assertMessage(Map.of("seed", "abc"), "seed");
    assertMessage(Map.of("dryRun", "perhaps"), "dryRun");
  }

  private static void assertMessage(Map<String, String> options, String key) {
    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> SimulationConfig.fromMap(options));
    assertTrue(ex.getMessage().contains(key), ex.getMessage());
  }
}
