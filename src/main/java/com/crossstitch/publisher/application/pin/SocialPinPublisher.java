package com.crossstitch.publisher.application.pin;

import com.crossstitch.publisher.application.json.JsonSupport;
import com.crossstitch.publisher.application.port.PinboardApiPort;
import com.crossstitch.publisher.application.port.PinboardApiPort.ApiResponse;
import com.crossstitch.publisher.application.port.TokenProvider;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes a design as a pin on the album's board.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the board through {@link BoardIndex}.</li>
 *   <li>Detect the theme and build SEO text via {@link ThemeDetector} and {@link PinPayloadBuilder}.</li>
 *   <li>Post the pin and extract its id.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share; holds only immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class SocialPinPublisher {
  private static final Logger log = LoggerFactory.getLogger(SocialPinPublisher.class);
  private static final int MAX_LOGGED_BODY = 1_000;

  private final PinboardApiPort api;
  private final TokenProvider tokens;
  private final BoardIndex boards;
  private final ThemeDetector themes;
  private final PinPayloadBuilder payloads;
  private final JsonSupport json = new JsonSupport();

  public SocialPinPublisher(
      PinboardApiPort api, TokenProvider tokens, BoardIndex boards, ThemeDetector themes, PinPayloadBuilder payloads) {
    this.api = Objects.requireNonNull(api, "api");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.boards = Objects.requireNonNull(boards, "boards");
    this.themes = Objects.requireNonNull(themes, "themes");
    this.payloads = Objects.requireNonNull(payloads, "payloads");
  }

  public String resolveBoard(int albumId) throws ConfigurationException {
    return boards.resolveBoard(albumId);
  }

  public Theme detectTheme(PatternInfo pattern) {
    return themes.detect(pattern);
  }

  /**
   * Builds the pin payload for a design.
   *
   * @param pattern pattern metadata
   * @param albumId album id
   * @param patternUrl design page URL
   * @param imageUrl preview image URL
   * @return payload with the resolved board
   * @throws ConfigurationException if no board can be resolved
   */
  public PinPayload buildPinPayload(PatternInfo pattern, int albumId, String patternUrl, String imageUrl)
      throws ConfigurationException {
    String boardId = resolveBoard(albumId);
    Theme theme = detectTheme(pattern);
    log.debug("Detected theme {} for '{}'", theme.code(), pattern.title());
    return payloads.build(pattern, theme, albumId, boardId, patternUrl, imageUrl);
  }

  /**
   * Posts a pin.
   *
   * @param payload pin payload
   * @return created pin id; empty when the API accepted the pin but returned no id
   * @throws ConfigurationException if no access token is available
   * @throws PublishException if the API answers with a non-success status or cannot be reached
   * @throws InterruptedException if interrupted while waiting for the API
   */
  public Optional<String> createPin(PinPayload payload)
      throws ConfigurationException, PublishException, InterruptedException {
    String token = tokens.accessToken();
    ApiResponse response;
    try {
      response = api.send("POST", "/pins", json.write(payload.toApiFields()), token);
    } catch (IOException ex) {
      log.error("Pin request to board {} failed", payload.boardId(), ex);
      throw new PublishException("create pin", 0, ex.getMessage());
    }
    if (!response.isSuccess()) {
      log.error("Pin creation rejected with HTTP {}: {}", response.status(),
          Logs.truncate(response.body(), MAX_LOGGED_BODY));
      throw new PublishException("create pin", response.status(), response.body());
    }
    Optional<String> pinId;
    try {
      pinId = json.stringField(response.body(), "id");
    } catch (IllegalArgumentException ex) {
      log.warn("Pin created but response body was not JSON: {}", Logs.truncate(response.body(), MAX_LOGGED_BODY));
      pinId = Optional.empty();
    }
    if (pinId.isEmpty()) {
      log.warn("Pin created on board {} but the response carried no id", payload.boardId());
    } else {
      log.info("Pin {} created on board {}", pinId.get(), payload.boardId());
    }
    return pinId;
  }
}
