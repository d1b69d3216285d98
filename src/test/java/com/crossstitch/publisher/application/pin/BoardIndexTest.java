package com.crossstitch.publisher.application.pin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.domain.error.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BoardIndexTest {
  @TempDir Path tempDir;

  private Path csv;

  @BeforeEach
  void setUp() throws Exception {
    csv = tempDir.resolve("AlbumBoards.csv");
    Files.writeString(csv, String.join("\n",
        "AlbumID,AlbumCaption,BoardID",
        "0007,\"Cats, \"\"cute\"\" ones\",b-7",
        "0007,Duplicate,b-dup",
        "garbage",
        "0003,Flowers,b-3",
        ""), StandardCharsets.UTF_8);
  }

  @Test
  void resolvesMappedAlbumsFirstRowWins() throws Exception {
    BoardIndex index = new BoardIndex(csv, "");

    assertEquals("b-7", index.resolveBoard(7));
    assertEquals("b-3", index.resolveBoard(3));
  }

  @Test
  void unmappedAlbumUsesDefaultBoard() throws Exception {
    assertEquals("b-default", new BoardIndex(csv, " b-default ").resolveBoard(42));
  }

  @Test
  void unmappedAlbumWithoutDefaultFails() {
    ConfigurationException ex = assertThrows(ConfigurationException.class,
        () -> new BoardIndex(csv, null).resolveBoard(42));

    assertTrue(ex.getMessage().contains("Board for album 42 not found"));
  }

  @Test
  void latin1CaptionDoesNotBreakLookups() throws Exception {
    Path latin1 = tempDir.resolve("Latin1Boards.csv");
    Files.write(latin1, String.join("\n",
        "AlbumID,AlbumCaption,BoardID",
        "0007,\"Caf\u00e9\",b-7",
        "").getBytes(StandardCharsets.ISO_8859_1));
    BoardIndex index = new BoardIndex(latin1, "default-board");

    assertEquals("b-7", index.resolveBoard(7));
    assertEquals("default-board", index.resolveBoard(3));
  }

  @Test
  void missingCsvLeavesOnlyTheDefault() throws Exception {
    BoardIndex index = new BoardIndex(tempDir.resolve("missing.csv"), "b-default");

    assertEquals(Optional.empty(), index.lookup("0007"));
    assertEquals("b-default", index.resolveBoard(7));
  }

  @Test
  void mappingIsLoadedOnce() throws Exception {
    BoardIndex index = new BoardIndex(csv, "");
    index.resolveBoard(7);
    Files.delete(csv);

    assertEquals("b-3", index.resolveBoard(3));
  }
}
