package com.crossstitch.publisher.config;

import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code campaign} command (text-only broadcast).
 *
 * @param dryRun list recipients without sending
 * @param store storage settings
 * @param site public URL settings
 * @param campaign campaign settings
 * @since 0.1.0
 */
public record BroadcastConfig(boolean dryRun, StoreConfig store, SiteConfig site, CampaignConfig campaign) {

  public BroadcastConfig {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(site, "site");
    Objects.requireNonNull(campaign, "campaign");
  }

  public static BroadcastConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    StoreConfig store = StoreConfig.fromMap(options);
    return new BroadcastConfig(
        ConfigValues.bool(options, "dryRun", false),
        store,
        SiteConfig.fromMap(options, store),
        CampaignConfig.fromMap(options, store));
  }
}
