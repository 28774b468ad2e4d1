package ca.gc.cra.brownian.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for one CLI invocation.
 * <p>Settings come from the {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
 * {@code otel.resource.attributes} system properties, falling back to the matching {@code OTEL_*} environment
 * variables. Anything other than {@code otlp} leaves metrics on the noop meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.brownian";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long FLUSH_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static MeterSession initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none").toLowerCase(Locale.ROOT);
    if (!"otlp".equals(exporter)) {
      if (!"none".equals(exporter)) {
        log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
      }
      return MeterSession.noop();
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    Attributes extra = parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("Exporting simulation metrics via OTLP to {}", endpoint);
      return MeterSession.over(provider(reader, extra));
    } catch (RuntimeException ex) {
      log.error("OpenTelemetry setup failed for endpoint {}; metrics disabled", endpoint, ex);
      return MeterSession.noop();
    }
  }

  static MeterSession forTesting(MetricReader reader) {
    return MeterSession.over(provider(Objects.requireNonNull(reader, "reader"), Attributes.empty()));
  }

  private static SdkMeterProvider provider(MetricReader reader, Attributes extra) {
    Resource service = Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "brownian")
        .put(AttributeKey.stringKey("service.version"), version())
        .build());
    return SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(service).merge(Resource.create(extra)))
        .registerMetricReader(reader)
        .build();
  }

  /**
   * Parses {@code key=value} pairs separated by commas; malformed entries are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String pair = token.trim();
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      if (eq <= 0 || eq == pair.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", pair);
        continue;
      }
      builder.put(AttributeKey.stringKey(pair.substring(0, eq).trim()), pair.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String version() {
    String version = OpenTelemetryBootstrap.class.getPackage().getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  private static String setting(String property, String envVar, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(envVar);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  /** Meter plus the provider that owns it; the provider is absent in noop mode. */
  static final class MeterSession implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterSession(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterSession noop() {
      return new MeterSession(MeterProvider.noop().get(SCOPE), null);
    }

    static MeterSession over(SdkMeterProvider provider) {
      return new MeterSession(provider.meterBuilder(SCOPE).setInstrumentationVersion(version()).build(), provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !provider.forceFlush().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metric flush did not finish within {} s", FLUSH_TIMEOUT_SECONDS);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Meter provider shutdown did not finish within {} s", FLUSH_TIMEOUT_SECONDS);
      }
    }
  }
}
