package com.crossstitch.publisher.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.Aggregation;
import io.opentelemetry.sdk.metrics.InstrumentSelector;
import io.opentelemetry.sdk.metrics.InstrumentType;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.View;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter provider behind {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from the {@code otel.*} system properties set by the CLI, falling back to the matching
 * {@code OTEL_*} environment variables. Every histogram the publisher records is a duration in milliseconds, from
 * a DynamoDB write to a converter run bounded by its timeout, so histograms share {@link #DURATION_BUCKETS_MS}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String SCOPE = "com.crossstitch.publisher";
  static final String SERVICE = "design-publisher";
  static final String NAMESPACE = "com.crossstitch";
  static final List<Double> DURATION_BUCKETS_MS = List.of(
      10d, 50d, 100d, 250d, 500d, 1_000d, 2_500d, 5_000d, 10_000d, 30_000d, 60_000d, 120_000d, 300_000d, 600_000d);
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static Telemetry initialize() {
    return initialize(Settings.fromSystem());
  }

  static Telemetry initialize(Settings settings) {
    if (!settings.exportEnabled()) {
      log.info("Publisher metrics export disabled (exporter=none)");
      return Telemetry.disabled();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("Exporting publisher metrics over OTLP to {} every {}s",
          settings.endpoint(), EXPORT_INTERVAL.toSeconds());
      return Telemetry.of(meterProvider(resource(settings.resourceAttributes()), reader));
    } catch (RuntimeException ex) {
      log.error("Failed to set up OTLP metrics export to {}; metrics are disabled", settings.endpoint(), ex);
      return Telemetry.disabled();
    }
  }

  static Telemetry forTesting(MetricReader reader) {
    return Telemetry.of(meterProvider(resource(Map.of()), Objects.requireNonNull(reader, "reader")));
  }

  private static SdkMeterProvider meterProvider(Resource resource, MetricReader reader) {
    return SdkMeterProvider.builder()
        .setResource(resource)
        .registerView(
            InstrumentSelector.builder().setType(InstrumentType.HISTOGRAM).build(),
            View.builder().setAggregation(Aggregation.explicitBucketHistogram(DURATION_BUCKETS_MS)).build())
        .registerMetricReader(reader)
        .build();
  }

  /**
   * Service identity plus operator-supplied attributes; {@code service.name} and {@code service.namespace} cannot
   * be overridden.
   */
  static Resource resource(Map<String, String> extra) {
    AttributesBuilder attributes = Attributes.builder();
    extra.forEach((key, value) -> attributes.put(AttributeKey.stringKey(key), value));
    attributes.put(AttributeKey.stringKey("service.name"), SERVICE);
    attributes.put(AttributeKey.stringKey("service.namespace"), NAMESPACE);
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    if (version != null && !version.isBlank()) {
      attributes.put(AttributeKey.stringKey("service.version"), version);
    }
    return Resource.getDefault().merge(Resource.create(attributes.build()));
  }

  /**
   * Export settings.
   *
   * @param exportEnabled {@code false} when the exporter is {@code none}
   * @param endpoint OTLP gRPC endpoint
   * @param resourceAttributes extra resource attributes in declaration order
   */
  record Settings(boolean exportEnabled, String endpoint, Map<String, String> resourceAttributes) {
    static final String DEFAULT_ENDPOINT = "http://localhost:4317";

    Settings {
      Objects.requireNonNull(endpoint, "endpoint");
      resourceAttributes = Collections.unmodifiableMap(
          new LinkedHashMap<>(Objects.requireNonNull(resourceAttributes, "resourceAttributes")));
    }

    static Settings fromSystem() {
      return from(System::getProperty, System::getenv);
    }

    static Settings from(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      String exporter = lookup(properties.apply("otel.metrics.exporter"),
          environment.apply("OTEL_METRICS_EXPORTER"), "otlp").toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
      }
      String endpoint = lookup(properties.apply("otel.exporter.otlp.endpoint"),
          environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      String attributes = lookup(properties.apply("otel.resource.attributes"),
          environment.apply("OTEL_RESOURCE_ATTRIBUTES"), "");
      return new Settings(!exporter.equals("none"), endpoint, parseAttributes(attributes));
    }

    static Map<String, String> parseAttributes(String raw) {
      Map<String, String> parsed = new LinkedHashMap<>();
      for (String entry : raw.split(",")) {
        String trimmed = entry.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        int eq = trimmed.indexOf('=');
        String key = eq < 0 ? "" : trimmed.substring(0, eq).trim();
        String value = eq < 0 ? "" : trimmed.substring(eq + 1).trim();
        if (key.isEmpty() || value.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", trimmed);
          continue;
        }
        parsed.put(key, value);
      }
      return parsed;
    }

    private static String lookup(String property, String env, String fallback) {
      if (property != null && !property.isBlank()) {
        return property.trim();
      }
      if (env != null && !env.isBlank()) {
        return env.trim();
      }
      return fallback;
    }
  }

  /** A meter plus the provider to flush and shut down; the provider is absent when export is disabled. */
  static final class Telemetry implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Telemetry(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Telemetry disabled() {
      return new Telemetry(MeterProvider.noop().get(SCOPE), null);
    }

    static Telemetry of(SdkMeterProvider provider) {
      return new Telemetry(provider.get(SCOPE), provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Metrics {} did not complete within {}s", action, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
