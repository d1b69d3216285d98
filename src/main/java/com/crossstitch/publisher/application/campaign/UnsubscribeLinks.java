package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.validation.Urls;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds per-recipient unsubscribe URLs and the one-click unsubscribe headers.
 *
 * @since 0.1.0
 */
public final class UnsubscribeLinks {
  public static final String LIST_UNSUBSCRIBE = "List-Unsubscribe";
  public static final String LIST_UNSUBSCRIBE_POST = "List-Unsubscribe-Post";

  private final String baseUrl;
  private final String secret;

  /**
   * Creates a link builder.
   *
   * @param unsubscribeBaseUrl configured endpoint; blank uses {@code {site}/unsubscribe}
   * @param siteBaseUrl public site root
   * @param secret HMAC secret shared with the unsubscribe endpoint
   */
  public UnsubscribeLinks(String unsubscribeBaseUrl, String siteBaseUrl, String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("unsubscribe secret must be configured");
    }
    this.secret = secret;
    if (unsubscribeBaseUrl != null && !unsubscribeBaseUrl.isBlank()) {
      this.baseUrl = Urls.trimTrailingSlashes(unsubscribeBaseUrl.trim());
    } else {
      this.baseUrl = Urls.trimTrailingSlashes(Objects.requireNonNull(siteBaseUrl, "siteBaseUrl")) + "/unsubscribe";
    }
  }

  public String url(String email) {
    String token = UnsubscribeTokenizer.generateToken(email, secret);
    return baseUrl + "?token=" + escape(token);
  }

  /**
   * Builds the {@code List-Unsubscribe} header pair.
   *
   * @param unsubscribeUrl URL from {@link #url(String)}
   * @param sender sender address used for the mailto alternative
   * @return headers in send order
   */
  public static Map<String, String> headers(String unsubscribeUrl, String sender) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(LIST_UNSUBSCRIBE, "<mailto:" + sender + ">, <" + unsubscribeUrl + ">");
    headers.put(LIST_UNSUBSCRIBE_POST, "List-Unsubscribe=One-Click");
    return headers;
  }

  static String escape(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
