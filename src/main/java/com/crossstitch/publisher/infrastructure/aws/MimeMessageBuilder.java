package com.crossstitch.publisher.infrastructure.aws;

import com.crossstitch.publisher.application.campaign.EmailTemplates;
import com.crossstitch.publisher.domain.campaign.EmailMessage;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Renders an {@link EmailMessage} as a {@code multipart/alternative} MIME document for raw sends.
 *
 * <p>Lines end with CRLF. Custom headers follow {@code Subject} in insertion order. Parts that are pure ASCII
 * use {@code 7bit}; anything else is base64 encoded. A missing HTML body is derived from the HTML-encoded text
 * body. Non-ASCII subjects are written as RFC 2047 encoded words.</p>
 *
 * @since 0.1.0
 */
public final class MimeMessageBuilder {
  private static final String CRLF = "\r\n";

  private final Supplier<String> boundaries;

  public MimeMessageBuilder() {
    this(() -> "NextPart_" + UUID.randomUUID().toString().replace("-", ""));
  }

  MimeMessageBuilder(Supplier<String> boundaries) {
    this.boundaries = Objects.requireNonNull(boundaries, "boundaries");
  }

  /**
   * Builds the raw message.
   *
   * @param message message to render
   * @return MIME document
   * @throws IllegalArgumentException if a header name or value contains a line break
   */
  public String build(EmailMessage message) {
    String boundary = boundaries.get();
    String html = message.htmlBody().orElseGet(() -> EmailTemplates.htmlEncode(message.textBody()));

    StringBuilder sb = new StringBuilder(message.textBody().length() + html.length() + 512);
    header(sb, "From", message.from());
    header(sb, "To", message.to());
    header(sb, "Subject", encodeHeaderValue(message.subject()));
    for (Map.Entry<String, String> entry : message.headers().entrySet()) {
      header(sb, entry.getKey(), entry.getValue());
    }
    header(sb, "MIME-Version", "1.0");
    header(sb, "Content-Type", "multipart/alternative; boundary=\"" + boundary + "\"");
    sb.append(CRLF);

    part(sb, boundary, "text/plain", message.textBody());
    part(sb, boundary, "text/html", html);
    sb.append("--").append(boundary).append("--").append(CRLF);
    return sb.toString();
  }

  private static void part(StringBuilder sb, String boundary, String mediaType, String content) {
    sb.append("--").append(boundary).append(CRLF);
    sb.append("Content-Type: ").append(mediaType).append("; charset=\"UTF-8\"").append(CRLF);
    if (isAscii(content)) {
      sb.append("Content-Transfer-Encoding: 7bit").append(CRLF).append(CRLF);
      sb.append(normalizeLineEndings(content)).append(CRLF);
    } else {
      sb.append("Content-Transfer-Encoding: base64").append(CRLF).append(CRLF);
      String encoded = Base64.getMimeEncoder(76, CRLF.getBytes(StandardCharsets.US_ASCII))
          .encodeToString(content.getBytes(StandardCharsets.UTF_8));
      sb.append(encoded).append(CRLF);
    }
    sb.append(CRLF);
  }

  private static void header(StringBuilder sb, String name, String value) {
    if (containsLineBreak(name) || containsLineBreak(value)) {
      throw new IllegalArgumentException("Header " + name + " must not contain line breaks");
    }
    sb.append(name).append(": ").append(value).append(CRLF);
  }

  static String encodeHeaderValue(String value) {
    if (isAscii(value)) {
      return value;
    }
    return "=?UTF-8?B?" + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)) + "?=";
  }

  private static String normalizeLineEndings(String content) {
    return content.replace("\r\n", "\n").replace("\r", "\n").replace("\n", CRLF);
  }

  private static boolean isAscii(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) > 0x7F) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsLineBreak(String value) {
    return value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0;
  }
}
