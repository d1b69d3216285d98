package com.crossstitch.publisher.logging;

import java.util.Locale;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep secrets and oversized API bodies out of logs.
 * <p><strong>Why:</strong> Pinboard error bodies can be large and recipient addresses are personal data.
 * <p><strong>Role:</strong> Cross-cutting utility used by adapters and the campaign send loop.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested number of characters, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input exceeds {@code maxChars}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }

  /**
   * Returns a standard redacted placeholder for sensitive content such as tokens and secrets.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Masks the local part of an email address, keeping its first character and the domain.
   *
   * @param email address to mask; {@code null} results in {@code "<null>"}
   * @return masked address such as {@code a***@example.com}
   */
  public static String maskEmail(String email) {
    if (email == null) {
      return NULL_PLACEHOLDER;
    }
    int at = email.indexOf('@');
    if (at <= 0) {
      return REDACTED_PLACEHOLDER;
    }
    return email.charAt(0) + "***" + email.substring(at).toLowerCase(Locale.ROOT);
  }
}
