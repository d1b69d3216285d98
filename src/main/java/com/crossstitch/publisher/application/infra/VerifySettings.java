package com.crossstitch.publisher.application.infra;

/**
 * Tuning of the verification run.
 *
 * @param environmentName value of the {@code Name} tag selecting instances; blank disables verification
 * @param pollIntervalMillis pause between state polls of one instance
 * @param maxAttempts maximum state polls per instance
 * @since 0.1.0
 */
public record VerifySettings(String environmentName, long pollIntervalMillis, int maxAttempts) {
  public static final long DEFAULT_POLL_INTERVAL_MILLIS = 5_000L;
  public static final int DEFAULT_MAX_ATTEMPTS = 60;

  public VerifySettings {
    environmentName = environmentName == null ? "" : environmentName.trim();
    if (pollIntervalMillis < 0) {
      throw new IllegalArgumentException("pollIntervalMillis must be >= 0");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
  }

  public boolean enabled() {
    return !environmentName.isEmpty();
  }
}
