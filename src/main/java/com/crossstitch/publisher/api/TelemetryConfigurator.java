package com.crossstitch.publisher.api;

import com.crossstitch.publisher.validation.Strings;
import com.crossstitch.publisher.validation.Urls;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the active JVM before the OpenTelemetry SDK is bootstrapped.
 *
 * <p>The keys are removed from the map so they never reach the typed configuration records.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Moves {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} into the
   * {@code otel.*} system properties.
   *
   * @param args mutable effective configuration
   * @return normalized exporter ({@code otlp} or {@code none})
   * @throws IllegalArgumentException for an unknown exporter, a non-HTTP endpoint or non-printable attributes
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = trimmed(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "otlp";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      String validated = Urls.requireHttpUrl("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", validated);
      System.setProperty("otel.exporter.otlp.endpoint", validated);
    }

    String resourceAttributes = trimmed(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter;
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
