package com.crossstitch.publisher.config;

import java.util.Locale;

/**
 * Strategy used to allocate design ids and page numbers.
 *
 * @since 0.1.0
 */
public enum SequenceMode {
  /** Atomic counter items seeded from the current catalog maximum. */
  ATOMIC,
  /** Read the current maximum and add one; concurrent publishers can collide. */
  LEGACY;

  /**
   * Parses a case-insensitive mode name.
   *
   * @param value {@code atomic} or {@code legacy}
   * @return parsed mode
   * @throws IllegalArgumentException for any other value
   */
  public static SequenceMode fromString(String value) {
    String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    try {
      return SequenceMode.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sequenceMode must be atomic or legacy (was '" + value + "')", ex);
    }
  }
}
