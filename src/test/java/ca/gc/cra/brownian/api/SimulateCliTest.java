package ca.gc.cra.brownian.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.domain.path.Segment;
import ca.gc.cra.brownian.infrastructure.persistence.CsvSegmentReader;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SimulateCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(SimulateCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = SimulateCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("BROWNIAN simulate pipeline"));
  }

  @Test
  void runWritesCsvAndPrintsSummary() throws IOException {
    Path output = tempDir.resolve("paths.csv");

    ExitCode code = SimulateCli.run(new String[] {
        "out=" + output, "maxExits=20", "pathsPerThread=4", "threads=2", "seed=1", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    List<Segment> segments = new CsvSegmentReader(output).readAll();
    assertEquals(20, segments.stream().filter(Segment::hasExited).count());
    String printed = buffer.toString();
    assertTrue(printed.contains("Exits: 20"), printed);
    assertTrue(printed.contains("Wrote " + segments.size() + " segments"), printed);
  }

  @Test
  void yamlConfigSuppliesValuesAndCliWins() throws IOException {
    Path output = tempDir.resolve("from-yaml.csv");
    Path yaml = Files.writeString(tempDir.resolve("brownian.yaml"), """
        simulate:
          maxExits: 500
          pathsPerThread: 3
          threads: 1
          seed: 8
          out: %s
        """.formatted(output.toString().replace("\\", "/")));

    ExitCode code = SimulateCli.run(new String[] {"config=" + yaml, "maxExits=12"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Exits: 12"));
    assertTrue(Files.exists(output));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("CLI overrides YAML for key: maxExits")));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutput() {
    Path output = tempDir.resolve("nested/paths.csv");

    ExitCode code = SimulateCli.run(new String[] {"out=" + output, "seed=3", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Simulate dry-run"));
    assertTrue(buffer.toString().contains(" Seed              : 3"));
    assertFalse(Files.exists(output));
    assertFalse(Files.exists(tempDir.resolve("nested")));
  }

  @Test
  void existingOutputNeedsAllowOverwrite() throws IOException {
    Path output = Files.writeString(tempDir.resolve("paths.csv"), "keep me");

    ExitCode refused = SimulateCli.run(new String[] {"out=" + output, "maxExits=5", "threads=1"});

    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals("keep me", Files.readString(output));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("--allow-overwrite")));

    ExitCode replaced =
        SimulateCli.run(new String[] {"out=" + output, "maxExits=5", "threads=1", "--allow-overwrite"});

    assertEquals(ExitCode.SUCCESS, replaced);
    assertTrue(Files.readString(output).startsWith("path_id,step"));
  }

  @Test
  void invalidValuesReturnInvalidArgsWithUsage() {
    assertEquals(ExitCode.INVALID_ARGS, SimulateCli.run(new String[] {"stepSize=0"}));
    assertEquals(ExitCode.INVALID_ARGS, SimulateCli.run(new String[] {"maxExits"}));
    assertEquals(ExitCode.INVALID_ARGS, SimulateCli.run(new String[] {"domainXMin=1", "domainXMax=0"}));
    assertEquals(
        ExitCode.INVALID_ARGS, SimulateCli.run(new String[] {"config=" + tempDir.resolve("missing.yaml")}));
    assertTrue(buffer.toString().contains("usage: simulate"));
  }
}
