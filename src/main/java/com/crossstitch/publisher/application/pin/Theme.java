package com.crossstitch.publisher.application.pin;

import java.util.List;
import java.util.Objects;

/**
 * A pin theme: matching keywords and the hashtags it contributes.
 *
 * @param code short code such as {@code cats}
 * @param humanName phrase used in pin titles and descriptions
 * @param keywords lowercase keywords searched in the pattern text
 * @param hashtags theme hashtags, with leading {@code #}
 * @since 0.1.0
 */
public record Theme(String code, String humanName, List<String> keywords, List<String> hashtags) {
  public Theme {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(humanName, "humanName");
    keywords = List.copyOf(keywords);
    hashtags = List.copyOf(hashtags);
  }
}
