package com.crossstitch.publisher.infrastructure.metrics;

import com.crossstitch.publisher.application.port.MetricsPort;

/**
 * Metrics adapter used when the CLI runs with {@code metricsExporter=none}.
 * <p>Stateless; every call returns immediately.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
