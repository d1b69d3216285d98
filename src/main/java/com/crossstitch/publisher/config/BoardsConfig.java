package com.crossstitch.publisher.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code boards} command.
 *
 * @param action create or rename
 * @param csv board CSV; written by create, read by rename
 * @param dryRun report without calling the pinboard service
 * @param store storage settings
 * @param pinterest pinboard settings
 * @since 0.1.0
 */
public record BoardsConfig(Action action, Path csv, boolean dryRun, StoreConfig store, PinterestConfig pinterest) {

  /** Board maintenance actions. */
  public enum Action {
    CREATE,
    RENAME;

    static Action fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("action is required (create|rename)");
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "create" -> CREATE;
        case "rename" -> RENAME;
        default -> throw new IllegalArgumentException("Unsupported boards action: " + raw);
      };
    }
  }

  public BoardsConfig {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(csv, "csv");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(pinterest, "pinterest");
  }

  public static BoardsConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PinterestConfig pinterest = PinterestConfig.fromMap(options);
    Path csv = ConfigValues.path(options, "csv").orElse(pinterest.boardsCsv());
    return new BoardsConfig(
        Action.fromString(options.get("action")),
        csv,
        ConfigValues.bool(options, "dryRun", false),
        StoreConfig.fromMap(options),
        pinterest);
  }
}
