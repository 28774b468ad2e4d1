package ca.gc.cra.brownian.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.validation.ConfigurationException;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class PlotConfigTest {

  @Test
  void defaultsReadTheSimulateOutput() {
    PlotConfig config = PlotConfig.defaults();

    assertEquals(Path.of("brownian_paths.csv").toAbsolutePath().normalize(), config.input());
    assertEquals(Path.of("brownian_paths.svg").toAbsolutePath().normalize(), config.output());
    assertEquals(5, config.nPaths());
  }

  @Test
  void fromMapAcceptsAliases() {
    PlotConfig config = PlotConfig.fromMap(Map.of("input", "a.csv", "output", "b.svg", "nPaths", "12", "seed", "3"));

    assertEquals(Path.of("a.csv").toAbsolutePath().normalize(), config.input());
    assertEquals(Path.of("b.svg").toAbsolutePath().normalize(), config.output());
    assertEquals(12, config.nPaths());
    assertEquals(OptionalLong.of(3), config.seed());
  }

  @Test
  void pathCountIsBounded() {
    assertThrows(ConfigurationException.class, () -> PlotConfig.fromMap(Map.of("nPaths", "0")));
    assertThrows(ConfigurationException.class, () -> PlotConfig.fromMap(Map.of("nPaths", "1001")));
    assertEquals(1000, PlotConfig.fromMap(Map.of("nPaths", "1000")).nPaths());
  }

  @Test
  void inputAndOutputMustDiffer() {
    ConfigurationException ex = assertThrows(
        ConfigurationException.class, () -> PlotConfig.fromMap(Map.of("in", "same.csv", "out", "./same.csv")));
    assertTrue(ex.getMessage().contains("out must differ from in"));
  }
}
