package com.crossstitch.publisher.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * External PDF converter settings ({@code converter.path}, {@code converter.timeoutSeconds}).
 *
 * @param path converter executable; existence is checked before the first conversion
 * @param timeout per-conversion timeout; {@link Duration#ZERO} disables it
 * @since 0.1.0
 */
public record ConverterConfig(Path path, Duration timeout) {
  public static final String DEFAULT_PATH = "Converter";
  public static final int DEFAULT_TIMEOUT_SECONDS = 600;

  public ConverterConfig {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("converter.timeoutSeconds must be >= 0");
    }
  }

  public static ConverterConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path path = ConfigValues.path(options, "converter.path")
        .orElseGet(() -> ConfigValues.toPath("converter.path", DEFAULT_PATH));
    int seconds = ConfigValues.integer(
        options, "converter.timeoutSeconds", DEFAULT_TIMEOUT_SECONDS, 0, 24 * 3600);
    return new ConverterConfig(path, Duration.ofSeconds(seconds));
  }
}
