package com.crossstitch.publisher.config;

import com.crossstitch.publisher.infrastructure.pinterest.PinterestHttpAdapter;
import com.crossstitch.publisher.logging.Logs;
import com.crossstitch.publisher.validation.Urls;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pinboard API settings.
 *
 * <p>Keys: {@code pinterest.baseUrl}, {@code pinterest.accessToken} (falls back to the
 * {@code PINTEREST_ACCESS_TOKEN} environment variable), {@code pinterest.boardsCsv},
 * {@code pinterest.defaultBoardId}, {@code pinterest.timeoutSeconds}.</p>
 *
 * @since 0.1.0
 */
public record PinterestConfig(
    String baseUrl,
    Optional<String> accessToken,
    Path boardsCsv,
    Optional<String> defaultBoardId,
    Duration requestTimeout) {

  public static final String DEFAULT_BOARDS_CSV = "AlbumBoards.csv";
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;

  public PinterestConfig {
    baseUrl = Urls.requireHttpUrl("pinterest.baseUrl", baseUrl);
    accessToken = Objects.requireNonNull(accessToken, "accessToken");
    boardsCsv = Objects.requireNonNull(boardsCsv, "boardsCsv");
    defaultBoardId = Objects.requireNonNull(defaultBoardId, "defaultBoardId");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("pinterest.timeoutSeconds must be positive");
    }
  }

  public static PinterestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new PinterestConfig(
        ConfigValues.string(options, "pinterest.baseUrl", PinterestHttpAdapter.DEFAULT_BASE_URL),
        ConfigValues.optional(options, "pinterest.accessToken"),
        ConfigValues.path(options, "pinterest.boardsCsv")
            .orElseGet(() -> ConfigValues.toPath("pinterest.boardsCsv", DEFAULT_BOARDS_CSV)),
        ConfigValues.optional(options, "pinterest.defaultBoardId"),
        Duration.ofSeconds(ConfigValues.integer(
            options, "pinterest.timeoutSeconds", DEFAULT_TIMEOUT_SECONDS, 1, 600)));
  }

  /**
   * Describes these settings for dry-run and log output without revealing the access token.
   *
   * @return printable description
   */
  public String describe() {
    return "baseUrl=" + baseUrl
        + ", boardsCsv=" + boardsCsv
        + ", defaultBoard=" + defaultBoardId.orElse("<none>")
        + ", token=" + accessToken.map(Logs::redact).orElse("<env>");
  }
}
