package com.crossstitch.publisher.application.pin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a pin creation request.
 *
 * @param boardId target board
 * @param link destination URL of the pin
 * @param title pin title, at most 100 characters
 * @param description pin description with hashtags, at most 500 characters
 * @param altText accessibility text, at most 500 characters
 * @param imageUrl public URL of the preview image
 * @since 0.1.0
 */
public record PinPayload(
    String boardId, String link, String title, String description, String altText, String imageUrl) {

  public PinPayload {
    Objects.requireNonNull(boardId, "boardId");
    Objects.requireNonNull(link, "link");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(altText, "altText");
    Objects.requireNonNull(imageUrl, "imageUrl");
  }

  /**
   * Returns the API field layout of this payload.
   *
   * @return ordered map ready for JSON serialization
   */
  public Map<String, Object> toApiFields() {
    Map<String, Object> mediaSource = new LinkedHashMap<>();
    mediaSource.put("source_type", "image_url");
    mediaSource.put("url", imageUrl);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("board_id", boardId);
    fields.put("link", link);
    fields.put("title", title);
    fields.put("description", description);
    fields.put("alt_text", altText);
    fields.put("media_source", mediaSource);
    return fields;
  }
}
