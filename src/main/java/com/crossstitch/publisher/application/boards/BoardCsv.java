package com.crossstitch.publisher.application.boards;

import com.crossstitch.publisher.domain.design.AlbumRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the album-to-board CSV.
 *
 * <p>Format: header {@code AlbumID,AlbumCaption,BoardID}, then rows such as
 * {@code 0007,"Caption ""quoted""",123}. Captions are quoted with doubled inner quotes; unquoted captions are
 * tolerated when they contain no commas.</p>
 *
 * @since 0.1.0
 */
public final class BoardCsv {
  private static final Logger log = LoggerFactory.getLogger(BoardCsv.class);
  public static final String HEADER = "AlbumID,AlbumCaption,BoardID";
  private static final String BOM = "\uFEFF";

  private BoardCsv() {}

  /**
   * Reads every valid row; the header and malformed rows are skipped. Bytes that are not valid UTF-8 decode to
   * U+FFFD instead of failing the whole file.
   *
   * @param path CSV file
   * @return parsed rows in file order
   * @throws IOException if the file cannot be read
   */
  public static List<AlbumRecord> read(Path path) throws IOException {
    String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    if (content.startsWith(BOM)) {
      content = content.substring(1);
    }
    List<String> lines = content.lines().toList();
    List<AlbumRecord> rows = new ArrayList<>();
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty()) {
        continue;
      }
      Optional<AlbumRecord> row = parseLine(line);
      if (row.isPresent()) {
        rows.add(row.get());
      } else {
        log.warn("Skipping invalid CSV line {} in {}: {}", i + 1, path, line);
      }
    }
    return rows;
  }

  /**
   * Writes rows under the standard header, replacing the file.
   *
   * @param path CSV file
   * @param rows rows to write
   * @throws IOException if the file cannot be written
   */
  public static void write(Path path, List<AlbumRecord> rows) throws IOException {
    StringBuilder sb = new StringBuilder(HEADER).append(System.lineSeparator());
    for (AlbumRecord row : rows) {
      sb.append(formatLine(row)).append(System.lineSeparator());
    }
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
  }

  static String formatLine(AlbumRecord row) {
    return row.albumId() + ",\"" + row.caption().replace("\"", "\"\"") + "\"," + row.boardId();
  }

  /**
   * Parses one data line.
   *
   * @param line CSV line without terminator
   * @return parsed row, or empty when the album or board id is missing
   */
  static Optional<AlbumRecord> parseLine(String line) {
    int firstComma = line.indexOf(',');
    if (firstComma <= 0) {
      return Optional.empty();
    }
    String albumId = line.substring(0, firstComma).strip();
    String rest = line.substring(firstComma + 1);
    String caption;
    String boardPart;
    String trimmedRest = rest.stripLeading();
    if (trimmedRest.startsWith("\"")) {
      int closing = closingQuote(trimmedRest, 1);
      if (closing < 0) {
        return Optional.empty();
      }
      caption = trimmedRest.substring(1, closing).replace("\"\"", "\"");
      int comma = trimmedRest.indexOf(',', closing + 1);
      if (comma < 0) {
        return Optional.empty();
      }
      boardPart = trimmedRest.substring(comma + 1);
    } else {
      int lastComma = rest.lastIndexOf(',');
      if (lastComma < 0) {
        return Optional.empty();
      }
      caption = rest.substring(0, lastComma).strip();
      boardPart = rest.substring(lastComma + 1);
    }
    String boardId = unquote(boardPart.strip());
    if (albumId.isEmpty() || boardId.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new AlbumRecord(albumId, caption, boardId));
  }

  private static int closingQuote(String text, int start) {
    int i = start;
    while (i < text.length()) {
      int quote = text.indexOf('"', i);
      if (quote < 0) {
        return -1;
      }
      if (quote + 1 < text.length() && text.charAt(quote + 1) == '"') {
        i = quote + 2;
        continue;
      }
      return quote;
    }
    return -1;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
