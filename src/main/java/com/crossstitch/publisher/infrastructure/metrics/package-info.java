/**
 * Metrics adapters bridging {@link com.crossstitch.publisher.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code publish.*}, {@code campaign.*} and {@code verify.*}
 * namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys are exported; recipient addresses and tokens never reach
 * instrument names or attributes.</p>
 */
package com.crossstitch.publisher.infrastructure.metrics;
