package com.crossstitch.publisher.config;

import com.crossstitch.publisher.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsing helpers shared by the configuration records. Every failure names the offending key.
 */
final class ConfigValues {

  private ConfigValues() {}

  static String string(Map<String, String> options, String key, String fallback) {
    String value = options.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  static boolean bool(Map<String, String> options, String key, boolean fallback) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }

  static int integer(Map<String, String> options, String key, int fallback, int min, int max) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt(key, value, min, max);
  }

  static Optional<Path> path(Map<String, String> options, String key) {
    return optional(options, key).map(raw -> toPath(key, raw));
  }

  static Path toPath(String key, String raw) {
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(key + " must not contain null bytes");
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
