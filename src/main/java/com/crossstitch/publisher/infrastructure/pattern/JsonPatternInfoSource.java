package com.crossstitch.publisher.infrastructure.pattern;

import com.crossstitch.publisher.application.json.JsonSupport;
import com.crossstitch.publisher.application.port.PatternInfoSource;
import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.NotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads pattern metadata from the {@code pattern.json} sidecar in a batch folder.
 *
 * <p>Expected shape: {@code {"title": "...", "notes": "...", "description": "...", "width": 120,
 * "height": 80, "colors": 14}}. Every field is optional; missing numbers read as {@code 0} and a missing
 * description falls back to the size summary.</p>
 *
 * @since 0.1.0
 */
public final class JsonPatternInfoSource implements PatternInfoSource {
  private static final Logger log = LoggerFactory.getLogger(JsonPatternInfoSource.class);
  public static final String FILE_NAME = "pattern.json";

  private final JsonSupport json = new JsonSupport();

  @Override
  public PatternInfo read(DesignBatch batch) throws NotFoundException, IOException {
    Path file = batch.folder().resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      throw new NotFoundException("Pattern metadata " + FILE_NAME + " not found in " + batch.folder());
    }
    Object root;
    try {
      root = json.parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Malformed " + file + ": " + ex.getMessage(), ex);
    }
    if (!(root instanceof Map<?, ?> fields)) {
      throw new IOException(file + " must contain a JSON object");
    }
    PatternInfo info = new PatternInfo(
        text(fields, "title"),
        text(fields, "notes"),
        text(fields, "description"),
        number(fields, "width", file),
        number(fields, "height", file),
        number(fields, "colors", file));
    log.debug("Read pattern '{}' ({})", info.title(), info.description());
    return info;
  }

  private static String text(Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    return value == null ? "" : String.valueOf(value);
  }

  private static int number(Map<?, ?> fields, String name, Path file) throws IOException {
    Object value = fields.get(name);
    if (value == null) {
      return 0;
    }
    if (value instanceof Number n && n.longValue() >= 0 && n.longValue() <= Integer.MAX_VALUE) {
      return n.intValue();
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException ex) {
        throw new IOException(file + ": " + name + " is not a number: " + s, ex);
      }
    }
    throw new IOException(file + ": " + name + " must be a non-negative integer");
  }
}
