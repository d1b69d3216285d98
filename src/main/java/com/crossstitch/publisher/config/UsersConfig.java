package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.campaign.UsersSchema;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the {@code users} maintenance command.
 *
 * @param action which maintenance pass to run
 * @param store storage settings; the designs table holds the {@code USR#} user items
 * @param schema users table layout
 * @param suppressedFile suppression list export; required by {@link Action#REMOVE_SUPPRESSED}
 * @param dryRun report what {@link Action#REMOVE_SUPPRESSED} would delete without deleting
 * @since 0.1.0
 */
public record UsersConfig(
    Action action, StoreConfig store, UsersSchema schema, Optional<Path> suppressedFile, boolean dryRun) {

  /** Maintenance actions. */
  public enum Action {
    INIT_UNSUBSCRIBE,
    INIT_CID,
    INIT_ITEMS_CID,
    MARK_VERIFIED,
    REMOVE_SUPPRESSED;

    static Action fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException(
            "action is required (init-unsubscribe|init-cid|init-items-cid|mark-verified|remove-suppressed)");
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "init-unsubscribe" -> INIT_UNSUBSCRIBE;
        case "init-cid" -> INIT_CID;
        case "init-items-cid" -> INIT_ITEMS_CID;
        case "mark-verified" -> MARK_VERIFIED;
        case "remove-suppressed" -> REMOVE_SUPPRESSED;
        default -> throw new IllegalArgumentException("Unsupported users action: " + raw);
      };
    }
  }

  public UsersConfig {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(suppressedFile, "suppressedFile");
    if (action == Action.REMOVE_SUPPRESSED && suppressedFile.isEmpty()) {
      throw new IllegalArgumentException("remove-suppressed requires file=PATH");
    }
  }

  public static UsersConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    StoreConfig store = StoreConfig.fromMap(options);
    return new UsersConfig(
        Action.fromString(options.get("action")),
        store,
        CampaignConfig.usersSchema(options, store),
        ConfigValues.path(options, "file"),
        ConfigValues.bool(options, "dryRun", false));
  }
}
