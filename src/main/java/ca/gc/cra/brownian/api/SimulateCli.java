package ca.gc.cra.brownian.api;

import ca.gc.cra.brownian.application.pipeline.SimulationUseCase;
import ca.gc.cra.brownian.application.simulation.SimulationSummary;
import ca.gc.cra.brownian.config.CompositionRoot;
import ca.gc.cra.brownian.config.SimulationConfig;
import ca.gc.cra.brownian.logging.LoggingConfigurator;
import ca.gc.cra.brownian.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running a Brownian exit simulation and writing the exited paths to CSV.
 *
 * @since 0.1.0
 */
public final class SimulateCli {
  private static final Logger log = LoggerFactory.getLogger(SimulateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: simulate [out=PATH] [maxExits=N] [pathsPerThread=N] [stepSize=X] [threads=N] [seed=N] "
          + "[domainXMin=X] [domainXMax=X] [domainYMin=Y] [domainYMax=Y] [config=PATH] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      BROWNIAN simulate pipeline

      Usage:
        simulate out=./brownian_paths.csv maxExits=50000 [options]

      Simulation:
        maxExits=N               Stop once N walks have left the domain (default 50000)
        pathsPerThread=N         Walks advanced concurrently by each worker (default 100)
        stepSize=X               Standard deviation of each Gaussian step component (default 0.05)
        threads=N                Worker threads (default: available processors)
        seed=N                   Global seed; a fixed seed with threads=1 reproduces the run exactly
        domainXMin=X domainXMax=X domainYMin=Y domainYMax=Y
                                 Rectangle the walks start in (default unit square)

      Output:
        out=PATH                 CSV file receiving the segments of exited walks
        --allow-overwrite        Replace an existing output file
        --dry-run                Validate inputs and print the plan without simulating

      Other:
        config=PATH              YAML file with common/simulate sections; CLI values win
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private SimulateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the simulate CLI logic and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for simulate CLI");
    }

    boolean dryRunFlag = input.hasFlag("--dry-run");
    boolean allowOverwriteFlag = input.hasFlag("--allow-overwrite");

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("simulate", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate arguments: {}", ex.getMessage());
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
    configInputs.put("dryRun", Boolean.toString(dryRun));
    configInputs.put("allowOverwrite", Boolean.toString(allowOverwrite));

    SimulationConfig config;
    String metricsExporter;
    Path output;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SimulationConfig.fromMap(configInputs);
      output = Paths.validateWritableFile(config.output(), !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, output);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      SimulationUseCase useCase = root.simulationUseCase(config);
      log.info(
          "Configured simulate pipeline: output={}, threads={}, metricsExporter={}",
          output,
          config.threads(),
          metricsExporter);
      SimulationSummary summary = useCase.run();
      CliPrinter.printLines(summary.describe().split("\\R"));
      CliPrinter.println("Wrote " + summary.totalSegments() + " segments to " + output);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Simulate configuration error: {}", ex.getMessage(), ex);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Simulate pipeline I/O failure writing {}", output, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Simulate pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Simulation failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in simulate pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(SimulationConfig config, Path output) {
    CliPrinter.printLines(
        "Simulate dry-run: no walks will be run and no file will be written.",
        " Domain            : " + config.domain(),
        " Max exits         : " + config.maxExits(),
        " Paths per thread  : " + config.pathsPerThread(),
        " Step size         : " + config.stepSize(),
        " Threads           : " + config.threads(),
        " Seed              : "
            + (config.seed().isPresent() ? Long.toString(config.seed().getAsLong()) : "<entropy>"),
        " Output file       : " + output,
        " Allow overwrite   : " + config.allowOverwrite(),
        " Re-run without --dry-run to simulate.");
  }
}
