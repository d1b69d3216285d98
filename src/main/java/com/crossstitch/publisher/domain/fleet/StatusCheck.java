package com.crossstitch.publisher.domain.fleet;

import java.util.Locale;

/**
 * Result of an instance or system reachability check.
 *
 * @since 0.1.0
 */
public enum StatusCheck {
  OK,
  IMPAIRED,
  INSUFFICIENT_DATA,
  NOT_APPLICABLE,
  INITIALIZING,
  UNKNOWN;

  public static StatusCheck fromName(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (StatusCheck status : values()) {
      if (status.name().equals(normalized)) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
