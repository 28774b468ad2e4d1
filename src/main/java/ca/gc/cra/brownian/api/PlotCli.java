package ca.gc.cra.brownian.api;

import ca.gc.cra.brownian.application.pipeline.PlotUseCase;
import ca.gc.cra.brownian.config.CompositionRoot;
import ca.gc.cra.brownian.config.PlotConfig;
import ca.gc.cra.brownian.domain.path.PathTrace;
import ca.gc.cra.brownian.logging.LoggingConfigurator;
import ca.gc.cra.brownian.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for drawing a random selection of simulated paths as an SVG figure.
 *
 * @since 0.1.0
 */
public final class PlotCli {
  private static final Logger log = LoggerFactory.getLogger(PlotCli.class);
  private static final String SUMMARY_USAGE =
      "usage: plot [in=PATH] [out=PATH] [nPaths=N] [seed=N] "
          + "[domainXMin=X] [domainXMax=X] [domainYMin=Y] [domainYMax=Y] [config=PATH] "
          + "[--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      BROWNIAN plot pipeline

      Usage:
        plot in=./brownian_paths.csv out=./brownian_paths.svg nPaths=5 [options]

      Options:
        in=PATH                  CSV written by simulate (default brownian_paths.csv)
        out=PATH                 SVG file to create (default brownian_paths.svg)
        nPaths=N                 Number of randomly chosen paths to draw, 1..1000 (default 5)
        seed=N                   Seed for the path selection
        domainXMin=X domainXMax=X domainYMin=Y domainYMax=Y
                                 Domain outline to draw (default unit square)
        --allow-overwrite        Replace an existing output file
        --dry-run                Validate inputs and print the plan without rendering
        config=PATH              YAML file with common/plot sections; CLI values win
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private PlotCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for plot CLI");
    }

    boolean dryRunFlag = input.hasFlag("--dry-run");
    boolean allowOverwriteFlag = input.hasFlag("--allow-overwrite");

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("plot", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid plot arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = dryRunFlag || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = allowOverwriteFlag || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    configInputs.put("allowOverwrite", Boolean.toString(allowOverwrite));

    PlotConfig config;
    String metricsExporter;
    Path inputFile;
    Path outputFile;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = PlotConfig.fromMap(configInputs);
      inputFile = Paths.requireReadableFile(config.input());
      outputFile = Paths.validateWritableFile(config.output(), !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid plot arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Plot dry-run: no figure will be written.",
          " Input file        : " + inputFile,
          " Output file       : " + outputFile,
          " Paths             : " + config.nPaths(),
          " Domain            : " + config.domain(),
          " Allow overwrite   : " + allowOverwrite,
          " Re-run without --dry-run to render.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      PlotUseCase useCase = root.plotUseCase(config);
      List<PathTrace> rendered = useCase.run();
      CliPrinter.println("Rendered " + rendered.size() + " paths to " + outputFile);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Plot pipeline I/O failure for {}", inputFile, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Plot configuration error: {}", ex.getMessage(), ex);
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in plot pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
