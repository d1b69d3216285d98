package com.crossstitch.publisher.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Copies switch flags into the key/value map as {@code true}, so {@code --dry-run} and {@code dryRun=true}
   * behave the same.
   *
   * @param input parsed arguments
   * @param args mutable key/value map
   * @param flagKeys flag to configuration key, e.g. {@code --dry-run -> dryRun}
   */
  static void applyFlags(CliInput input, Map<String, String> args, Map<String, String> flagKeys) {
    for (Map.Entry<String, String> entry : flagKeys.entrySet()) {
      if (input.hasFlag(entry.getKey())) {
        args.put(entry.getValue(), "true");
      }
    }
  }
}
