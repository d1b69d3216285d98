package com.crossstitch.publisher.domain.design;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input files for one publish run, discovered in a batch folder.
 *
 * @param folder batch folder
 * @param albumId album the design belongs to, parsed from {@code <albumId>.txt}
 * @param chart chart file ({@code *.scc})
 * @param pdfVariants source PDF per variant id ({@code "1"}, {@code "3"}, {@code "5"}), in variant order
 * @param photo preview photo
 * @since 0.1.0
 */
public record DesignBatch(Path folder, int albumId, Path chart, Map<String, Path> pdfVariants, Path photo) {

  public DesignBatch {
    Objects.requireNonNull(folder, "folder");
    Objects.requireNonNull(chart, "chart");
    Objects.requireNonNull(photo, "photo");
    if (albumId <= 0) {
      throw new IllegalArgumentException("albumId must be positive");
    }
    pdfVariants = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(pdfVariants, "pdfVariants")));
  }

  /**
   * Returns the album id as the 4-digit string used in partition keys and board lookups.
   *
   * @return zero-padded album id
   */
  public String paddedAlbumId() {
    return DesignRecord.padAlbumId(albumId);
  }
}
