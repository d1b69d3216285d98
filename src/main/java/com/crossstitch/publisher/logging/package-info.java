/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize payloads before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for publish, verification, and campaign diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from verifier polling tasks.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction and masking helpers for tokens and recipient addresses.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.logging;
