package com.crossstitch.publisher.application.boards;

import com.crossstitch.publisher.application.campaign.AlbumSuggestions;
import com.crossstitch.publisher.application.json.JsonSupport;
import com.crossstitch.publisher.application.port.PinboardApiPort;
import com.crossstitch.publisher.application.port.PinboardApiPort.ApiResponse;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.port.TokenProvider;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Creates one pinboard board per album and keeps board names search friendly.
 * <p><strong>Create:</strong> scans {@code ALBUM} items, creates a board for each and writes the
 * {@code AlbumID,AlbumCaption,BoardID} CSV consumed by the pin stage.</p>
 * <p><strong>Rename:</strong> reads that CSV and patches every board with an SEO name and description.</p>
 * <p><strong>Dry run:</strong> computes and reports every request without calling the API or writing files.</p>
 *
 * @since 0.1.0
 */
public final class BoardProvisioningUseCase {
  private static final Logger log = LoggerFactory.getLogger(BoardProvisioningUseCase.class);
  static final String SEO_SUFFIX = "Cross Stitch Free";
  static final int MAX_NAME_LENGTH = 48;
  static final int MAX_DESCRIPTION_LENGTH = 500;
  private static final int MAX_LOGGED_BODY = 1_000;

  private final ItemStorePort store;
  private final String table;
  private final PinboardApiPort api;
  private final TokenProvider tokens;
  private final ProgressSink progress;
  private final JsonSupport json = new JsonSupport();

  public BoardProvisioningUseCase(
      ItemStorePort store, String table, PinboardApiPort api, TokenProvider tokens, ProgressSink progress) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
    this.api = Objects.requireNonNull(api, "api");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
  }

  /**
   * Creates a board for every album and writes the board CSV.
   *
   * @param csvPath CSV to write; replaced
   * @param dryRun report only
   * @return album rows with their new board ids; board ids are empty in a dry run
   * @throws StoreException if albums cannot be listed
   * @throws ConfigurationException if no access token is available
   * @throws PublishException if a board creation fails or returns no id
   * @throws IOException if the CSV cannot be written
   * @throws InterruptedException if interrupted between albums
   */
  public List<AlbumRecord> createBoards(Path csvPath, boolean dryRun)
      throws StoreException, ConfigurationException, PublishException, IOException, InterruptedException {
    progress.report("Loading albums from the item store...");
    List<AlbumRecord> albums = AlbumSuggestions.listAlbums(store, table);
    progress.report("Found " + albums.size() + " albums.");
    if (albums.isEmpty()) {
      progress.report("No albums found with EntityType = 'ALBUM'. Nothing to do.");
      return List.of();
    }
    String token = dryRun ? "" : tokens.accessToken();
    List<AlbumRecord> rows = new ArrayList<>(albums.size());
    for (AlbumRecord album : albums) {
      checkInterrupted();
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("name", boardName(album));
      body.put("description", boardDescription(album));
      if (dryRun) {
        progress.report("[dry-run] Would create board '" + body.get("name") + "' for album " + album.albumId());
        rows.add(album);
        continue;
      }
      ApiResponse response = call("POST", "/boards", body, token, "create board for album " + album.albumId());
      String boardId = boardIdOf(response, album);
      progress.report("Created board '" + body.get("name") + "' (ID=" + boardId + ") for album " + album.albumId()
          + ".");
      rows.add(album.withBoardId(boardId));
    }
    if (!dryRun) {
      BoardCsv.write(csvPath, rows);
      progress.report("CSV file written to: " + csvPath);
    }
    return rows;
  }

  /**
   * Renames every board listed in the board CSV.
   *
   * @param csvPath CSV produced by {@link #createBoards}
   * @param dryRun report only
   * @return number of boards renamed (or that would be renamed)
   * @throws IOException if the CSV is missing or unreadable
   * @throws ConfigurationException if no access token is available
   * @throws PublishException if a rename is rejected
   * @throws InterruptedException if interrupted between boards
   */
  public int renameBoards(Path csvPath, boolean dryRun)
      throws IOException, ConfigurationException, PublishException, InterruptedException {
    if (!Files.exists(csvPath)) {
      throw new NoSuchFileException(csvPath.toString(), null, "CSV file with board mapping not found");
    }
    progress.report("Reading CSV: " + csvPath);
    List<AlbumRecord> rows = BoardCsv.read(csvPath);
    if (rows.isEmpty()) {
      progress.report("CSV file contains no data lines.");
      return 0;
    }
    String token = dryRun ? "" : tokens.accessToken();
    int renamed = 0;
    for (AlbumRecord row : rows) {
      checkInterrupted();
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("name", seoBoardName(row.caption()));
      body.put("description", seoBoardDescription(row.caption()));
      progress.report((dryRun ? "[dry-run] " : "") + "Renaming board " + row.boardId() + ": '" + row.caption()
          + "' => '" + body.get("name") + "'");
      if (!dryRun) {
        call("PATCH", "/boards/" + row.boardId(), body, token, "rename board " + row.boardId());
      }
      renamed++;
    }
    progress.report("Board renaming completed.");
    return renamed;
  }

  static String boardName(AlbumRecord album) {
    return album.caption().isBlank() ? "Album " + album.albumId() : album.caption();
  }

  static String boardDescription(AlbumRecord album) {
    return "Cross-stitch patterns from album " + album.albumId() + ": " + album.caption();
  }

  /**
   * Builds a board name that always carries the SEO suffix, e.g. {@code "Cute Cats" -> "Cute Cats Cross Stitch
   * Free"}, trimmed at a word boundary to fit the API's name limit.
   *
   * @param caption album caption; blank uses the suffix alone
   * @return board name of at most 48 characters
   */
  static String seoBoardName(String caption) {
    String base = caption == null || caption.isBlank() ? SEO_SUFFIX : caption.trim();
    String name = base.toLowerCase(Locale.ROOT).contains(SEO_SUFFIX.toLowerCase(Locale.ROOT))
        ? base
        : base + " " + SEO_SUFFIX;
    if (name.length() <= MAX_NAME_LENGTH) {
      return name;
    }
    int lastSpace = name.lastIndexOf(' ', MAX_NAME_LENGTH);
    return lastSpace > 0 ? name.substring(0, lastSpace) : name.substring(0, MAX_NAME_LENGTH);
  }

  static String seoBoardDescription(String caption) {
    String subject = caption == null || caption.isBlank()
        ? "beautiful counted cross stitch designs"
        : caption.trim();
    String description = "Cross stitch patterns from album " + subject + ". "
        + "Discover printable cross stitch charts and downloadable PDF patterns at Cross-Stitch.com . "
        + "Perfect for both beginners and experienced stitchers who love detailed embroidery designs.";
    return description.length() > MAX_DESCRIPTION_LENGTH
        ? description.substring(0, MAX_DESCRIPTION_LENGTH)
        : description;
  }

  private ApiResponse call(String method, String path, Map<String, Object> body, String token, String operation)
      throws PublishException, InterruptedException {
    ApiResponse response;
    try {
      response = api.send(method, path, json.write(body), token);
    } catch (IOException ex) {
      log.error("Request to {} failed", operation, ex);
      throw new PublishException(operation, 0, ex.getMessage());
    }
    if (!response.isSuccess()) {
      log.error("{} rejected with HTTP {}: {}", operation, response.status(),
          Logs.truncate(response.body(), MAX_LOGGED_BODY));
      throw new PublishException(operation, response.status(), response.body());
    }
    return response;
  }

  private String boardIdOf(ApiResponse response, AlbumRecord album) throws PublishException {
    String operation = "create board for album " + album.albumId();
    try {
      return json.stringField(response.body(), "id")
          .orElseThrow(() -> new PublishException(operation, response.status(), response.body()));
    } catch (IllegalArgumentException ex) {
      log.error("Board created for album {} but the response was not JSON", album.albumId(), ex);
      throw new PublishException(operation, response.status(), response.body());
    }
  }

  private static void checkInterrupted() throws InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("Board provisioning interrupted");
    }
  }
}
