package com.crossstitch.publisher.application.pin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.application.port.TokenProvider;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.testing.FakePinboardApi;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SocialPinPublisherTest {
  private static final String URL = "https://www.cross-stitch-pattern.net/Cute-Cats-7-4-Free-Design.aspx";
  private static final String IMAGE = "https://cdn.example.com/photos/7/121/4.jpg";

  @TempDir Path tempDir;

  private FakePinboardApi api;
  private BoardIndex boards;

  @BeforeEach
  void setUp() throws Exception {
    Path csv = tempDir.resolve("AlbumBoards.csv");
    Files.writeString(csv, "AlbumID,AlbumCaption,BoardID\n0007,\"Cats\",b-7\n", StandardCharsets.UTF_8);
    api = new FakePinboardApi();
    boards = new BoardIndex(csv, "");
  }

  @Test
  void buildsPayloadForAlbumBoardAndTheme() throws Exception {
    PinPayload payload = publisher(() -> "tok").buildPinPayload(
        PatternInfo.of("Cute Cats", "", 80, 60, 10), 7, URL, IMAGE);

    assertEquals("b-7", payload.boardId());
    assertEquals("Cute Cats – Cat cross stitch pattern, printable PDF pattern", payload.title());
    assertTrue(payload.description().endsWith("#cat #cats #catlover #kitty"));
    assertEquals(Map.of("source_type", "image_url", "url", IMAGE), payload.toApiFields().get("media_source"));
  }

  @Test
  void unknownAlbumWithoutDefaultBoardFails() {
    assertThrows(ConfigurationException.class,
        () -> publisher(() -> "tok").buildPinPayload(PatternInfo.of("Cats", "", 1, 1, 1), 9, URL, IMAGE));
  }

  @Test
  void createPinPostsPayloadAndReturnsId() throws Exception {
    api.respond(201, "{\"id\":\"9876\",\"board_id\":\"b-7\"}");
    PinPayload payload = new PinPayload("b-7", URL, "Title", "Desc", "Alt", IMAGE);

    Optional<String> pinId = publisher(() -> "tok").createPin(payload);

    assertEquals(Optional.of("9876"), pinId);
    FakePinboardApi.Request request = api.requests().get(0);
    assertEquals("POST", request.method());
    assertEquals("/pins", request.path());
    assertEquals("tok", request.token());
    assertTrue(request.body().startsWith("{\"board_id\":\"b-7\",\"link\":\"" + URL + "\""));
    assertTrue(request.body().contains("\"media_source\":{\"source_type\":\"image_url\",\"url\":\"" + IMAGE + "\"}"));
  }

  @Test
  void successWithoutIdYieldsEmpty() throws Exception {
    api.respond(201, "").respond(200, "not json");
    SocialPinPublisher publisher = publisher(() -> "tok");
    PinPayload payload = new PinPayload("b-7", URL, "T", "D", "A", IMAGE);

    assertFalse(publisher.createPin(payload).isPresent());
    assertFalse(publisher.createPin(payload).isPresent());
  }

  @Test
  void rejectedPinRaisesRetryableFailureOnThrottle() {
    api.respond(429, "{\"message\":\"slow down\"}");
    PinPayload payload = new PinPayload("b-7", URL, "T", "D", "A", IMAGE);

    PublishException ex = assertThrows(PublishException.class, () -> publisher(() -> "tok").createPin(payload));

    assertEquals(429, ex.status());
    assertTrue(ex.retryable());
    assertTrue(ex.body().contains("slow down"));
  }

  @Test
  void clientErrorIsNotRetryable() {
    api.respond(400, "bad board");
    PinPayload payload = new PinPayload("b-7", URL, "T", "D", "A", IMAGE);

    PublishException ex = assertThrows(PublishException.class, () -> publisher(() -> "tok").createPin(payload));

    assertFalse(ex.retryable());
  }

  @Test
  void unreachableApiReportsStatusZero() {
    api.unreachable();
    PinPayload payload = new PinPayload("b-7", URL, "T", "D", "A", IMAGE);

    PublishException ex = assertThrows(PublishException.class, () -> publisher(() -> "tok").createPin(payload));

    assertEquals(0, ex.status());
    assertTrue(ex.retryable());
  }

  @Test
  void missingTokenStopsBeforeTheRequest() {
    PinPayload payload = new PinPayload("b-7", URL, "T", "D", "A", IMAGE);
    SocialPinPublisher publisher = publisher(() -> {
      throw new ConfigurationException("No access token");
    });

    assertThrows(ConfigurationException.class, () -> publisher.createPin(payload));
    assertTrue(api.requests().isEmpty());
  }

  private SocialPinPublisher publisher(TokenProvider tokens) {
    return new SocialPinPublisher(api, tokens, boards, new ThemeDetector(), new PinPayloadBuilder());
  }
}
