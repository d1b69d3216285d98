package com.crossstitch.publisher.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the publish pipeline and campaign.
 * <p><strong>Why:</strong> Lets stages record counters and durations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count stage outcomes such as {@code publish.stage.upload.success} or {@code campaign.sent}.</li>
 *   <li>Record numeric observations such as stage durations in milliseconds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from verifier workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code publish.*}, {@code campaign.*},
 * {@code verify.*}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (for example {@code campaign.sent}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, typically milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
