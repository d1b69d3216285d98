package com.crossstitch.publisher.application.artifact;

import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.error.NotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Discovers the input files of a batch folder.
 *
 * <p>A batch folder holds the source PDFs {@code 1.pdf}, {@code 3.pdf} and {@code 5.pdf}, one {@code *.scc}
 * chart, a {@code <albumId>.txt} marker whose file name is the album id, and the preview photo.</p>
 *
 * @since 0.1.0
 */
public final class BatchFolderReader {
  /** Variants that must be present, in upload order. */
  public static final List<String> REQUIRED_PDF_VARIANTS = List.of("1", "3", "5");

  static final String DEFAULT_PHOTO_FILE = "4.jpg";

  private final String photoFileName;

  public BatchFolderReader() {
    this(DEFAULT_PHOTO_FILE);
  }

  public BatchFolderReader(String photoFileName) {
    this.photoFileName = Objects.requireNonNull(photoFileName, "photoFileName");
  }

  /**
   * Reads a batch folder.
   *
   * @param folder batch folder
   * @return discovered batch
   * @throws NotFoundException if the folder or any required input is missing or the album marker is invalid
   * @throws IOException if the folder cannot be listed
   */
  public DesignBatch read(Path folder) throws NotFoundException, IOException {
    if (folder == null || !Files.isDirectory(folder)) {
      throw new NotFoundException("Batch folder not found: " + folder);
    }
    Map<String, Path> pdfs = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (String variant : REQUIRED_PDF_VARIANTS) {
      Path pdf = folder.resolve(variant + ".pdf");
      if (Files.isRegularFile(pdf)) {
        pdfs.put(variant, pdf);
      } else {
        missing.add(variant + ".pdf");
      }
    }
    if (!missing.isEmpty()) {
      throw new NotFoundException("Missing required PDFs: " + String.join(", ", missing));
    }
    Path chart = firstWithExtension(folder, ".scc")
        .orElseThrow(() -> new NotFoundException(".scc file expected."));
    Path albumMarker = firstWithExtension(folder, ".txt")
        .orElseThrow(() -> new NotFoundException("Exactly one .txt file expected for AlbumID."));
    int albumId = parseAlbumId(albumMarker);
    Path photo = folder.resolve(photoFileName);
    if (!Files.isRegularFile(photo)) {
      throw new NotFoundException("Preview photo not found: " + photo);
    }
    return new DesignBatch(folder, albumId, chart, pdfs, photo);
  }

  private static Optional<Path> firstWithExtension(Path folder, String extension) throws IOException {
    try (Stream<Path> files = Files.list(folder)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
          .sorted()
          .findFirst();
    }
  }

  private static int parseAlbumId(Path marker) throws NotFoundException {
    String name = marker.getFileName().toString();
    String stem = name.substring(0, name.length() - ".txt".length()).trim();
    try {
      int albumId = Integer.parseInt(stem);
      if (albumId <= 0) {
        throw new NotFoundException("Invalid AlbumID in " + name);
      }
      return albumId;
    } catch (NumberFormatException ex) {
      throw new NotFoundException("Invalid AlbumID in " + name);
    }
  }
}
