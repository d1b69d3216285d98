package com.crossstitch.publisher.application.campaign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.testing.InMemoryItemStore;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlbumSuggestionsTest {
  private static final String TABLE = "CrossStitchItems";
  private static final LocalDate TODAY = LocalDate.of(2025, 10, 16);

  private InMemoryItemStore store;
  private AlbumSuggestions suggestions;

  @BeforeEach
  void setUp() {
    store = new InMemoryItemStore();
    store.seed(TABLE, Map.of("ID", "ALB#0003", "NPage", "ALBUM", "EntityType", "ALBUM", "Caption", "Spring Flowers"));
    store.seed(TABLE, Map.of("ID", "ALB#0007", "NPage", "ALBUM", "EntityType", "ALBUM", "Caption", "Cats"));
    store.seed(TABLE, Map.of("ID", "ALB#0009", "NPage", "ALBUM", "EntityType", "ALBUM"));
    store.seed(TABLE, Map.of("ID", "ALB#0003", "NPage", "00001", "EntityType", "DESIGN", "Caption", "Rose"));
    store.seed(TABLE, Map.of("ID", "MISC", "NPage", "ALBUM", "EntityType", "ALBUM", "Caption", "Broken"));
    PatternLinks links = new PatternLinks("https://www.cross-stitch-pattern.net", "https://cdn.example.com",
        "images/designs/photos", "");
    suggestions = new AlbumSuggestions(store, TABLE, links, new Random(7));
  }

  @Test
  void listsOnlyAlbumItemsWithPrefixedIds() throws Exception {
    List<AlbumRecord> albums = AlbumSuggestions.listAlbums(store, TABLE);

    assertEquals(List.of("0003", "0007", "0009"), albums.stream().map(AlbumRecord::albumId).toList());
  }

  @Test
  void pickExcludesCurrentAlbum() {
    List<AlbumRecord> picked = suggestions.pick(7, 4);

    assertEquals(List.of("0003", "0009"), picked.stream().map(AlbumRecord::albumId).toList());
  }

  @Test
  void pickLimitsToRequestedCount() {
    assertEquals(1, suggestions.pick(7, 1).size());
    assertTrue(suggestions.pick(7, 0).isEmpty());
  }

  @Test
  void storeFailureYieldsNoSuggestions() {
    store.fail("scan");

    assertTrue(suggestions.pick(7, 4).isEmpty());
  }

  @Test
  void rendersTrackedLinksWithFallbackLabels() {
    List<AlbumRecord> albums = List.of(new AlbumRecord("0003", "Spring Flowers", ""), new AlbumRecord("0009", "", ""));

    String text = suggestions.text(albums, "c1", "251016", TODAY);
    String html = suggestions.html(albums, "c1", "251016", TODAY);

    assertTrue(text.contains("- Spring Flowers: https://www.cross-stitch-pattern.net/Free-Spring-Flowers-Charts.aspx"
        + "?cid=c1&eid=251016&utm_source=newsletter"));
    assertTrue(text.contains("- Featured album 2: https://www.cross-stitch-pattern.net/Free-Album-0009-Charts.aspx"));
    assertTrue(html.startsWith("<p>Explore more albums:</p><ul><li><a href=\""));
    assertTrue(html.contains("?cid=c1&amp;eid=251016"));
    assertEquals("", suggestions.html(List.of(), "c1", "e", TODAY));
  }
}
