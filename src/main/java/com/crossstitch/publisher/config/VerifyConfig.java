package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.infra.VerifySettings;
import java.util.Map;
import java.util.Objects;

/**
 * Infrastructure verification settings ({@code verify.*}).
 *
 * @param region AWS region of the fleet
 * @param settings tag value, poll interval and attempt budget
 * @since 0.1.0
 */
public record VerifyConfig(String region, VerifySettings settings) {
  public static final String DEFAULT_ENVIRONMENT_NAME = "cross-stitch-env";

  public VerifyConfig {
    region = Objects.requireNonNull(region, "region");
    settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Reads verification settings; a blank {@code verify.environmentName} disables the stage.
   *
   * @param options effective configuration
   * @param store store settings providing the region
   * @return populated settings
   */
  public static VerifyConfig fromMap(Map<String, String> options, StoreConfig store) {
    Objects.requireNonNull(options, "options");
    String environment = options.containsKey("verify.environmentName")
        ? options.get("verify.environmentName")
        : DEFAULT_ENVIRONMENT_NAME;
    int pollMillis = ConfigValues.integer(
        options, "verify.pollIntervalMillis", (int) VerifySettings.DEFAULT_POLL_INTERVAL_MILLIS, 0, 600_000);
    int attempts = ConfigValues.integer(
        options, "verify.maxAttempts", VerifySettings.DEFAULT_MAX_ATTEMPTS, 1, 10_000);
    return new VerifyConfig(store.region(), new VerifySettings(environment, pollMillis, attempts));
  }
}
