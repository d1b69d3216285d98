package com.crossstitch.publisher.validation;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validation helpers for absolute http(s) URLs read from configuration.
 *
 * @since 0.1.0
 */
public final class Urls {
  private Urls() {
    // Utility
  }

  /**
   * Validates an absolute http or https URL and strips trailing slashes.
   *
   * @param name logical name for diagnostics
   * @param raw candidate URL
   * @return normalized URL without trailing {@code '/'}
   * @throws IllegalArgumentException when the URL is blank, relative, or uses another scheme
   */
  public static String requireHttpUrl(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      URI uri = new URI(trimmed);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(name + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    return trimTrailingSlashes(trimmed);
  }

  /**
   * Removes every trailing {@code '/'} from the supplied value.
   *
   * @param value URL text; {@code null} yields an empty string
   * @return value without trailing slashes
   */
  public static String trimTrailingSlashes(String value) {
    if (value == null) {
      return "";
    }
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == '/') {
      end--;
    }
    return value.substring(0, end);
  }
}
