package com.crossstitch.publisher.domain.design;

import java.util.Objects;

/**
 * <strong>What:</strong> Denormalized catalog entry written once per published design.
 * <p><strong>Role:</strong> Stored under the album partition {@code ALB#dddd} with the 5-digit page as sort key.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param albumId album id (unpadded)
 * @param nPage 5-digit page within the album
 * @param designId global design id
 * @param globalPage global page number
 * @param pattern extracted pattern info
 * @param pinId pin identifier; empty when the pin API returned no id
 * @since 0.1.0
 */
public record DesignRecord(
    int albumId, String nPage, int designId, int globalPage, PatternInfo pattern, String pinId) {

  /** Entity type stored on every design item. */
  public static final String ENTITY_TYPE = "DESIGN";

  public DesignRecord {
    Objects.requireNonNull(nPage, "nPage");
    Objects.requireNonNull(pattern, "pattern");
    if (nPage.length() != 5) {
      throw new IllegalArgumentException("nPage must have 5 digits: " + nPage);
    }
    pinId = pinId == null ? "" : pinId;
  }

  /**
   * Returns the album partition key for this record.
   *
   * @return key of the form {@code ALB#0007}
   */
  public String partitionKey() {
    return albumPartitionKey(albumId);
  }

  public static String albumPartitionKey(int albumId) {
    return "ALB#" + padAlbumId(albumId);
  }

  public static String padAlbumId(int albumId) {
    return String.format("%04d", albumId);
  }
}
