package com.crossstitch.publisher.infrastructure.pinterest;

import com.crossstitch.publisher.application.port.PinboardApiPort;
import com.crossstitch.publisher.logging.Logs;
import com.crossstitch.publisher.validation.Urls;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PinboardApiPort} over the Pinterest v5 REST API using {@link HttpClient}.
 * <p><strong>Contract:</strong> returns every HTTP status to the caller; only transport failures throw.</p>
 * <p><strong>Security:</strong> the bearer token is sent in the {@code Authorization} header and never logged.</p>
 * <p><strong>Thread-safety:</strong> {@link HttpClient} is thread-safe and shared across calls.</p>
 *
 * @since 0.1.0
 */
public final class PinterestHttpAdapter implements PinboardApiPort {
  private static final Logger log = LoggerFactory.getLogger(PinterestHttpAdapter.class);
  public static final String DEFAULT_BASE_URL = "https://api.pinterest.com/v5";
  private static final int LOG_BODY_CHARS = 300;

  private final HttpClient client;
  private final String baseUrl;
  private final Duration requestTimeout;

  public PinterestHttpAdapter(String baseUrl, Duration requestTimeout) {
    this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), baseUrl, requestTimeout);
  }

  PinterestHttpAdapter(HttpClient client, String baseUrl, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.baseUrl = Urls.requireHttpUrl("pinterest.baseUrl", baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public ApiResponse send(String method, String path, String jsonBody, String bearerToken)
      throws IOException, InterruptedException {
    HttpRequest request = buildRequest(method, path, jsonBody, bearerToken);
    log.debug("{} {}", request.method(), request.uri());
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (response.statusCode() >= 400) {
      log.warn("{} {} returned {}: {}", request.method(), path, response.statusCode(),
          Logs.truncate(response.body(), LOG_BODY_CHARS));
    }
    return new ApiResponse(response.statusCode(), response.body());
  }

  HttpRequest buildRequest(String method, String path, String jsonBody, String bearerToken) {
    Objects.requireNonNull(path, "path");
    if (bearerToken == null || bearerToken.isBlank()) {
      throw new IllegalArgumentException("bearer token must not be blank");
    }
    String normalizedMethod = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
    HttpRequest.BodyPublisher body = jsonBody == null
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8);
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path)))
        .timeout(requestTimeout)
        .header("Authorization", "Bearer " + bearerToken.trim())
        .header("Accept", "application/json")
        .method(normalizedMethod, body);
    if (jsonBody != null) {
      builder.header("Content-Type", "application/json");
    }
    return builder.build();
  }
}
