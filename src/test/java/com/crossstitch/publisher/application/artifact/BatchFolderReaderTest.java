package com.crossstitch.publisher.application.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.error.NotFoundException;
import com.crossstitch.publisher.testing.BatchFolders;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchFolderReaderTest {
  @TempDir Path tempDir;

  private final BatchFolderReader reader = new BatchFolderReader();

  @Test
  void readsCompleteBatch() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);

    DesignBatch batch = reader.read(folder);

    assertEquals(7, batch.albumId());
    assertEquals("0007", batch.paddedAlbumId());
    assertEquals(folder.resolve("Rose.scc"), batch.chart());
    assertEquals(folder.resolve("4.jpg"), batch.photo());
    assertEquals(List.of("1", "3", "5"), List.copyOf(batch.pdfVariants().keySet()));
  }

  @Test
  void missingVariantsAreListed() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);
    Files.delete(folder.resolve("3.pdf"));
    Files.delete(folder.resolve("5.pdf"));

    NotFoundException ex = assertThrows(NotFoundException.class, () -> reader.read(folder));

    assertEquals("Missing required PDFs: 3.pdf, 5.pdf", ex.getMessage());
  }

  @Test
  void chartIsRequired() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);
    Files.delete(folder.resolve("Rose.scc"));

    assertEquals(".scc file expected.", assertThrows(NotFoundException.class, () -> reader.read(folder)).getMessage());
  }

  @Test
  void albumMarkerMustBePositiveNumber() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);
    Files.move(folder.resolve("7.txt"), folder.resolve("album.txt"));

    assertTrue(assertThrows(NotFoundException.class, () -> reader.read(folder)).getMessage()
        .startsWith("Invalid AlbumID"));

    Files.move(folder.resolve("album.txt"), folder.resolve("0.txt"));
    assertThrows(NotFoundException.class, () -> reader.read(folder));
  }

  @Test
  void albumMarkerIsRequired() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);
    Files.delete(folder.resolve("7.txt"));

    assertThrows(NotFoundException.class, () -> reader.read(folder));
  }

  @Test
  void photoIsRequired() throws Exception {
    Path folder = BatchFolders.complete(tempDir, 7);
    Files.delete(folder.resolve("4.jpg"));

    assertTrue(assertThrows(NotFoundException.class, () -> reader.read(folder)).getMessage()
        .startsWith("Preview photo not found"));
  }

  @Test
  void missingFolderIsNotFound() {
    assertThrows(NotFoundException.class, () -> reader.read(tempDir.resolve("absent")));
  }
}
