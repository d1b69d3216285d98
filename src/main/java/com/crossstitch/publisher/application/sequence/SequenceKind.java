package com.crossstitch.publisher.application.sequence;

/**
 * Identifier sequences maintained in the item store.
 *
 * @since 0.1.0
 */
public enum SequenceKind {
  /** Global design id; unpadded, starts at 1. */
  DESIGN_ID,
  /** Page within one album; zero-padded to 5 digits, starts at {@code 00001}. */
  ALBUM_PAGE,
  /** Global page number; unpadded, starts at 1. */
  GLOBAL_PAGE;

  /**
   * Indicates whether this sequence is scoped to an album partition.
   *
   * @return {@code true} for {@link #ALBUM_PAGE}
   */
  public boolean partitioned() {
    return this == ALBUM_PAGE;
  }
}
