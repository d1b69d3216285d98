package com.crossstitch.publisher.application.pin;

import com.crossstitch.publisher.application.boards.BoardCsv;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Album-to-board lookup backed by the board CSV.
 * <p><strong>Lifecycle:</strong> The CSV is read on first lookup and the map is frozen afterwards. A missing file
 * yields an empty index. When several rows name the same album the first one wins.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent lookups; a racing first load reads the file twice and
 * publishes one of two identical maps.</p>
 *
 * @since 0.1.0
 */
public final class BoardIndex {
  private static final Logger log = LoggerFactory.getLogger(BoardIndex.class);

  private final Path csvPath;
  private final String defaultBoardId;
  private volatile Map<String, String> boards;

  /**
   * Creates an index.
   *
   * @param csvPath board CSV location
   * @param defaultBoardId fallback board; blank when none is configured
   */
  public BoardIndex(Path csvPath, String defaultBoardId) {
    this.csvPath = Objects.requireNonNull(csvPath, "csvPath");
    this.defaultBoardId = defaultBoardId == null ? "" : defaultBoardId.trim();
  }

  /**
   * Resolves the board of an album.
   *
   * @param albumId album id
   * @return board id from the CSV, otherwise the default board
   * @throws ConfigurationException if the album has no board and no default is configured, or the CSV is unreadable
   */
  public String resolveBoard(int albumId) throws ConfigurationException {
    Optional<String> mapped = lookup(DesignRecord.padAlbumId(albumId));
    if (mapped.isPresent()) {
      return mapped.get();
    }
    if (!defaultBoardId.isEmpty()) {
      log.info("Album {} not in {}; using default board", albumId, csvPath);
      return defaultBoardId;
    }
    throw new ConfigurationException("Board for album " + albumId + " not found in '" + csvPath
        + "', and no default board is configured.");
  }

  /**
   * Looks up an album id in the CSV.
   *
   * @param albumKey 4-digit album id, matched case-insensitively
   * @return board id when mapped
   * @throws ConfigurationException if the CSV exists but cannot be read
   */
  public Optional<String> lookup(String albumKey) throws ConfigurationException {
    return Optional.ofNullable(boards().get(albumKey.toLowerCase(Locale.ROOT)));
  }

  private Map<String, String> boards() throws ConfigurationException {
    Map<String, String> loaded = boards;
    if (loaded == null) {
      loaded = load();
      boards = loaded;
    }
    return loaded;
  }

  private Map<String, String> load() throws ConfigurationException {
    if (!Files.exists(csvPath)) {
      log.warn("Board CSV {} not found; only the default board is available", csvPath);
      return Map.of();
    }
    try {
      Map<String, String> map = new TreeMap<>();
      for (AlbumRecord row : BoardCsv.read(csvPath)) {
        map.putIfAbsent(row.albumId().toLowerCase(Locale.ROOT), row.boardId());
      }
      log.info("Loaded {} album board mapping(s) from {}", map.size(), csvPath);
      return Collections.unmodifiableMap(map);
    } catch (IOException ex) {
      throw new ConfigurationException("Unable to read board CSV " + csvPath, ex);
    }
  }
}
