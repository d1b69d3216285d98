package com.crossstitch.publisher.application.boards;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.testing.FakePinboardApi;
import com.crossstitch.publisher.testing.InMemoryItemStore;
import com.crossstitch.publisher.testing.RecordingProgress;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BoardProvisioningUseCaseTest {
  private static final String TABLE = "CrossStitchItems";

  @TempDir Path tempDir;

  private InMemoryItemStore store;
  private FakePinboardApi api;
  private RecordingProgress progress;
  private BoardProvisioningUseCase useCase;

  @BeforeEach
  void setUp() {
    store = new InMemoryItemStore();
    store.seed(TABLE, Map.of("ID", "ALB#0007", "NPage", "ALBUM", "EntityType", "ALBUM", "Caption", "Cute Cats"));
    store.seed(TABLE, Map.of("ID", "ALB#0003", "NPage", "ALBUM", "EntityType", "ALBUM"));
    api = new FakePinboardApi();
    progress = new RecordingProgress();
    useCase = new BoardProvisioningUseCase(store, TABLE, api, () -> "tok", progress);
  }

  @Test
  void createBoardsPostsEachAlbumAndWritesCsv() throws Exception {
    api.respond(201, "{\"id\":\"b-7\"}").respond(201, "{\"id\":\"b-3\"}");
    Path csv = tempDir.resolve("AlbumBoards.csv");

    List<AlbumRecord> rows = useCase.createBoards(csv, false);

    assertEquals(List.of(new AlbumRecord("0007", "Cute Cats", "b-7"), new AlbumRecord("0003", "", "b-3")), rows);
    assertEquals(rows, BoardCsv.read(csv));
    FakePinboardApi.Request first = api.requests().get(0);
    assertEquals("POST", first.method());
    assertEquals("/boards", first.path());
    assertEquals("{\"name\":\"Cute Cats\",\"description\":\"Cross-stitch patterns from album 0007: Cute Cats\"}",
        first.body());
    assertTrue(api.requests().get(1).body().contains("\"name\":\"Album 0003\""));
    assertTrue(progress.anyContains("Created board 'Cute Cats' (ID=b-7) for album 0007."));
  }

  @Test
  void createBoardsDryRunCallsNothing() throws Exception {
    Path csv = tempDir.resolve("AlbumBoards.csv");

    List<AlbumRecord> rows = useCase.createBoards(csv, true);

    assertEquals(2, rows.size());
    assertTrue(rows.stream().allMatch(row -> row.boardId().isEmpty()));
    assertTrue(api.requests().isEmpty());
    assertFalse(Files.exists(csv));
    assertTrue(progress.anyContains("[dry-run] Would create board 'Cute Cats' for album 0007"));
  }

  @Test
  void createBoardsWithoutAlbumsDoesNothing() throws Exception {
    BoardProvisioningUseCase empty =
        new BoardProvisioningUseCase(new InMemoryItemStore(), TABLE, api, () -> "tok", progress);

    assertTrue(empty.createBoards(tempDir.resolve("x.csv"), false).isEmpty());
    assertTrue(progress.anyContains("Nothing to do."));
  }

  @Test
  void boardCreationWithoutIdFails() {
    api.respond(201, "{}");

    PublishException ex = assertThrows(PublishException.class,
        () -> useCase.createBoards(tempDir.resolve("AlbumBoards.csv"), false));

    assertEquals(201, ex.status());
    assertFalse(Files.exists(tempDir.resolve("AlbumBoards.csv")));
  }

  @Test
  void renameBoardsPatchesSeoNames() throws Exception {
    Path csv = tempDir.resolve("AlbumBoards.csv");
    BoardCsv.write(csv, List.of(new AlbumRecord("0007", "Cute Cats", "b-7"), new AlbumRecord("0003", "", "b-3")));
    api.respondByDefault(200, "{}");

    assertEquals(2, useCase.renameBoards(csv, false));

    assertEquals("PATCH", api.requests().get(0).method());
    assertEquals("/boards/b-7", api.requests().get(0).path());
    assertTrue(api.requests().get(0).body().startsWith("{\"name\":\"Cute Cats Cross Stitch Free\","));
    assertTrue(api.requests().get(1).body().startsWith("{\"name\":\"Cross Stitch Free\","));
    assertTrue(progress.anyContains("Board renaming completed."));
  }

  @Test
  void renameBoardsDryRunOnlyReports() throws Exception {
    Path csv = tempDir.resolve("AlbumBoards.csv");
    BoardCsv.write(csv, List.of(new AlbumRecord("0007", "Cute Cats", "b-7")));

    assertEquals(1, useCase.renameBoards(csv, true));
    assertTrue(api.requests().isEmpty());
    assertTrue(progress.anyContains("[dry-run] Renaming board b-7: 'Cute Cats' => 'Cute Cats Cross Stitch Free'"));
  }

  @Test
  void renameBoardsRequiresCsv() {
    assertThrows(NoSuchFileException.class, () -> useCase.renameBoards(tempDir.resolve("missing.csv"), false));
  }

  @Test
  void rejectedRenameStopsTheRun() throws Exception {
    Path csv = tempDir.resolve("AlbumBoards.csv");
    BoardCsv.write(csv, List.of(new AlbumRecord("0007", "Cats", "b-7"), new AlbumRecord("0003", "Dogs", "b-3")));
    api.respond(404, "{\"message\":\"board not found\"}");

    PublishException ex = assertThrows(PublishException.class, () -> useCase.renameBoards(csv, false));

    assertEquals(404, ex.status());
    assertEquals(1, api.requests().size());
  }

  @Test
  void seoBoardNameAddsSuffixAndFitsLimit() {
    assertEquals("Cute Cats Cross Stitch Free", BoardProvisioningUseCase.seoBoardName(" Cute Cats "));
    assertEquals("Free cross stitch free charts", BoardProvisioningUseCase.seoBoardName("Free cross stitch free charts"));
    assertEquals("Cross Stitch Free", BoardProvisioningUseCase.seoBoardName(""));
    assertEquals("Beautiful Vintage Botanical Flowers And Garden",
        BoardProvisioningUseCase.seoBoardName("Beautiful Vintage Botanical Flowers And Garden Birds"));
    assertEquals(BoardProvisioningUseCase.MAX_NAME_LENGTH,
        BoardProvisioningUseCase.seoBoardName("x".repeat(60)).length());
  }

  @Test
  void seoBoardDescriptionMentionsCaptionAndIsCapped() {
    assertTrue(BoardProvisioningUseCase.seoBoardDescription("Cute Cats")
        .startsWith("Cross stitch patterns from album Cute Cats. "));
    assertTrue(BoardProvisioningUseCase.seoBoardDescription(null).contains("beautiful counted cross stitch designs"));
    assertEquals(BoardProvisioningUseCase.MAX_DESCRIPTION_LENGTH,
        BoardProvisioningUseCase.seoBoardDescription("y".repeat(600)).length());
  }
}
