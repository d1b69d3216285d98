package com.crossstitch.publisher.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by the publisher configuration and CLI layers.
 * <p><strong>Why:</strong> Ensures bucket names, table names, addresses, and secrets are sanitized before the
 * pipeline touches object storage, the item store, or the email provider.
 * <p><strong>Role:</strong> Domain support utilities invoked before ports/adapters allocate external resources.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Verify printable ASCII constraints for identifiers sent to external APIs.</li>
 *   <li>Cap free text to the length limits imposed by the pinboard API.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations (trimmed copy only when needed).</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Urls
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Validates a loose email address shape ({@code local@domain}).
   *
   * @param name logical name for diagnostics
   * @param value candidate address
   * @return trimmed address
   * @throws IllegalArgumentException if the address lacks a local part or domain
   */
  public static String requireEmail(String name, String value) {
    String sanitized = requirePrintableAscii(name, value, 254);
    int at = sanitized.indexOf('@');
    if (at <= 0 || at != sanitized.lastIndexOf('@') || at == sanitized.length() - 1
        || sanitized.indexOf(' ') >= 0) {
      throw new IllegalArgumentException(message(name, "must be an email address"));
    }
    return sanitized;
  }

  /**
   * Returns {@code true} when the value is {@code null} or only whitespace.
   *
   * @param value candidate text
   * @return whether the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Cuts a string to at most {@code maxLength} UTF-16 characters.
   *
   * @param value text to cap; {@code null} yields an empty string
   * @param maxLength maximum number of characters to keep; must not be negative
   * @return the original value or its prefix
   */
  public static String truncate(String value, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative");
    }
    if (value == null) {
      return "";
    }
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
