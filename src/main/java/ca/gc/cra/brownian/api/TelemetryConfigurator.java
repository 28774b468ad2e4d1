package ca.gc.cra.brownian.api;

import ca.gc.cra.brownian.validation.ConfigurationException;
import ca.gc.cra.brownian.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry settings from the effective configuration to the JVM system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Consumes the telemetry keys from {@code args} and publishes them as system properties.
   *
   * @param args mutable configuration map; telemetry keys are removed
   * @return the normalized exporter name ({@code none} when absent)
   * @throws ConfigurationException if a telemetry value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = "none";
    String rawExporter = args.remove("metricsExporter");
    if (rawExporter != null && !rawExporter.isBlank()) {
      exporter = rawExporter.trim().toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new ConfigurationException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      String trimmed = Strings.requirePrintableAscii(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OpenTelemetry resource attributes override");
      System.setProperty("otel.resource.attributes", trimmed);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new ConfigurationException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new ConfigurationException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new ConfigurationException("otelEndpoint must be a valid URI", ex);
    }
  }
}
