package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanCondition;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanPage;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanRequest;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.domain.error.StoreException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Picks random albums to cross-promote in campaign emails and renders them.
 * <p><strong>Selection:</strong> scans {@code EntityType="ALBUM"} items whose id starts with {@code ALB#}, excludes
 * the album being announced (unless it is the only one) and shuffles.</p>
 * <p><strong>Failure policy:</strong> suggestions are decoration; a failed scan is logged at WARN and yields no
 * suggestions.</p>
 *
 * @since 0.1.0
 */
public final class AlbumSuggestions {
  private static final Logger log = LoggerFactory.getLogger(AlbumSuggestions.class);
  static final String ALBUM_ENTITY = "ALBUM";
  static final String ALBUM_PREFIX = "ALB#";

  private final ItemStorePort store;
  private final String table;
  private final PatternLinks links;
  private final Random random;

  public AlbumSuggestions(ItemStorePort store, String table, PatternLinks links) {
    this(store, table, links, new Random());
  }

  AlbumSuggestions(ItemStorePort store, String table, PatternLinks links, Random random) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
    this.links = Objects.requireNonNull(links, "links");
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Lists every album in the items table.
   *
   * @param store item store
   * @param table items table
   * @return albums in scan order; album ids without the {@code ALB#} prefix
   * @throws StoreException if the scan fails
   */
  public static List<AlbumRecord> listAlbums(ItemStorePort store, String table) throws StoreException {
    List<AlbumRecord> albums = new ArrayList<>();
    ScanRequest request = ScanRequest.firstPage(table,
        List.of(ScanCondition.equalTo("EntityType", ALBUM_ENTITY)), List.of("ID", "Caption", "EntityType"));
    while (true) {
      ScanPage page = store.scan(request);
      for (Item item : page.items()) {
        toAlbum(item).ifPresent(albums::add);
      }
      if (!page.hasMore()) {
        return albums;
      }
      request = request.next(page.lastEvaluatedKey());
    }
  }

  /**
   * Picks up to {@code count} random albums other than the current one.
   *
   * @param currentAlbumId album being announced
   * @param count maximum number of suggestions
   * @return suggestions; empty when the scan fails or there are no albums
   */
  public List<AlbumRecord> pick(int currentAlbumId, int count) {
    if (count <= 0) {
      return List.of();
    }
    List<AlbumRecord> albums;
    try {
      albums = listAlbums(store, table);
    } catch (StoreException ex) {
      log.warn("Failed to fetch albums for suggestions; sending without them", ex);
      return List.of();
    }
    String current = String.format("%04d", currentAlbumId);
    List<AlbumRecord> pool = new ArrayList<>();
    for (AlbumRecord album : albums) {
      if (!album.albumId().equalsIgnoreCase(current)) {
        pool.add(album);
      }
    }
    if (pool.isEmpty()) {
      pool.addAll(albums);
    }
    if (pool.size() > count) {
      Collections.shuffle(pool, random);
    }
    return List.copyOf(pool.subList(0, Math.min(count, pool.size())));
  }

  /**
   * Renders suggestions as an HTML list.
   *
   * @param albums suggestions
   * @param cid recipient tracking id; may be blank
   * @param eid campaign id; may be blank
   * @param today campaign date
   * @return HTML fragment, or an empty string when there are no albums
   */
  public String html(List<AlbumRecord> albums, String cid, String eid, LocalDate today) {
    if (albums.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("<p>Explore more albums:</p><ul>");
    int index = 1;
    for (AlbumRecord album : albums) {
      String url = TrackingUrls.withTracking(links.albumUrl(album.albumId(), album.caption()), cid, eid, today);
      sb.append("<li><a href=\"").append(EmailTemplates.htmlEncode(url)).append("\">")
          .append(EmailTemplates.htmlEncode(label(album, index))).append("</a></li>");
      index++;
    }
    return sb.append("</ul>").toString();
  }

  /**
   * Renders suggestions as plain text lines.
   *
   * @param albums suggestions
   * @param cid recipient tracking id; may be blank
   * @param eid campaign id; may be blank
   * @param today campaign date
   * @return text fragment starting with a blank line, or an empty string when there are no albums
   */
  public String text(List<AlbumRecord> albums, String cid, String eid, LocalDate today) {
    if (albums.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(EmailTemplates.CRLF).append("Explore more albums:").append(EmailTemplates.CRLF);
    int index = 1;
    for (AlbumRecord album : albums) {
      String url = TrackingUrls.withTracking(links.albumUrl(album.albumId(), album.caption()), cid, eid, today);
      sb.append("- ").append(label(album, index)).append(": ").append(url).append(EmailTemplates.CRLF);
      index++;
    }
    return sb.toString();
  }

  private static String label(AlbumRecord album, int index) {
    return album.caption().isBlank() ? "Featured album " + index : album.caption();
  }

  private static Optional<AlbumRecord> toAlbum(Item item) {
    String id = item.string("ID").orElse("");
    if (id.length() <= ALBUM_PREFIX.length() || !id.regionMatches(true, 0, ALBUM_PREFIX, 0, ALBUM_PREFIX.length())) {
      return Optional.empty();
    }
    return Optional.of(new AlbumRecord(id.substring(ALBUM_PREFIX.length()), item.string("Caption").orElse(""), ""));
  }
}
