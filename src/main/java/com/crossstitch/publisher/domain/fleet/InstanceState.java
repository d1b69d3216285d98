package com.crossstitch.publisher.domain.fleet;

import java.util.Locale;

/**
 * Lifecycle state of a compute instance as reported by the fleet API.
 *
 * @since 0.1.0
 */
public enum InstanceState {
  PENDING,
  RUNNING,
  SHUTTING_DOWN,
  TERMINATED,
  STOPPING,
  STOPPED,
  UNKNOWN;

  /**
   * Parses a provider state name such as {@code "shutting-down"}.
   *
   * @param raw provider state name; may be {@code null}
   * @return matching state, or {@link #UNKNOWN}
   */
  public static InstanceState fromName(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (InstanceState state : values()) {
      if (state.name().equals(normalized)) {
        return state;
      }
    }
    return UNKNOWN;
  }

  /** Stopped and terminated instances are not candidates for a reboot. */
  public boolean isRebootable() {
    return this != STOPPED && this != TERMINATED;
  }
}
