package com.crossstitch.publisher.application.audit;

import java.util.List;

/**
 * A design whose expected PDF objects are not all present.
 *
 * @param designId design id
 * @param albumId album id
 * @param missingKeys expected keys absent from object storage
 * @since 0.1.0
 */
public record MissingPdf(int designId, int albumId, List<String> missingKeys) {
  public MissingPdf {
    missingKeys = List.copyOf(missingKeys);
  }

  public String reportLine() {
    return designId + "," + albumId;
  }
}
