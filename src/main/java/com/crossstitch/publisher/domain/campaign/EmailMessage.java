package com.crossstitch.publisher.domain.campaign;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outbound email with a plain-text body and an optional HTML alternative.
 *
 * @param from sender address
 * @param to recipient address
 * @param subject subject line
 * @param textBody plain-text body
 * @param htmlBody optional HTML body
 * @param headers extra headers such as {@code List-Unsubscribe}, in insertion order
 * @since 0.1.0
 */
public record EmailMessage(
    String from,
    String to,
    String subject,
    String textBody,
    Optional<String> htmlBody,
    Map<String, String> headers) {

  public EmailMessage {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    subject = subject == null ? "" : subject;
    textBody = textBody == null ? "" : textBody;
    htmlBody = Objects.requireNonNull(htmlBody, "htmlBody").filter(v -> !v.isBlank());
    headers = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
  }
}
