package ca.gc.cra.brownian.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlotCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void plotsPathsFromASimulateRun() throws IOException {
    Path csv = tempDir.resolve("paths.csv");
    Path svg = tempDir.resolve("paths.svg");
    assertEquals(ExitCode.SUCCESS, SimulateCli.run(new String[] {
        "out=" + csv, "maxExits=10", "pathsPerThread=2", "threads=1", "seed=4"}));

    ExitCode code = PlotCli.run(new String[] {"in=" + csv, "out=" + svg, "nPaths=3", "seed=2"});

    assertEquals(ExitCode.SUCCESS, code);
    String content = Files.readString(svg);
    assertEquals(3, content.split("<polyline", -1).length - 1);
    assertTrue(buffer.toString().contains("Rendered 3 paths"));
  }

  @Test
  void missingInputIsInvalid() {
    ExitCode code = PlotCli.run(new String[] {
        "in=" + tempDir.resolve("absent.csv"), "out=" + tempDir.resolve("out.svg")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: plot"));
  }

  @Test
  void malformedInputIsAnIoError() throws IOException {
    Path csv = Files.writeString(tempDir.resolve("bad.csv"), "not,a,segment,file\n");
    Path svg = tempDir.resolve("out.svg");

    ExitCode code = PlotCli.run(new String[] {"in=" + csv, "out=" + svg});

    assertEquals(ExitCode.IO_ERROR, code);
    assertFalse(Files.exists(svg));
  }

  @Test
  void dryRunLeavesNoFigure() throws IOException {
    Path csv = Files.writeString(tempDir.resolve("paths.csv"), "x");
    Path svg = tempDir.resolve("out.svg");

    ExitCode code = PlotCli.run(new String[] {"in=" + csv, "out=" + svg, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Plot dry-run"));
    assertFalse(Files.exists(svg));
  }

  @Test
  void outOfRangePathCountIsInvalid() throws IOException {
    Path csv = Files.writeString(tempDir.resolve("paths.csv"), "x");

    assertEquals(ExitCode.INVALID_ARGS, PlotCli.run(new String[] {
        "in=" + csv, "out=" + tempDir.resolve("out.svg"), "nPaths=0"}));
  }
}
