package com.crossstitch.publisher.domain.design;

/**
 * <strong>What:</strong> Metadata extracted from a design's PDF by the pattern-info collaborator.
 * <p><strong>Role:</strong> Value object feeding the catalog record, pin text, and campaign content.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param title pattern title; may be empty but never {@code null}
 * @param notes free-form notes; never {@code null}
 * @param description display description; defaults to {@code "{W} x {H} stitches {N} colors"}
 * @param width width in stitches
 * @param height height in stitches
 * @param colors number of thread colors
 * @since 0.1.0
 */
public record PatternInfo(
    String title, String notes, String description, int width, int height, int colors) {

  public PatternInfo {
    title = title == null ? "" : title.trim();
    notes = notes == null ? "" : notes.trim();
    if (width < 0 || height < 0 || colors < 0) {
      throw new IllegalArgumentException("width, height and colors must be non-negative");
    }
    if (description == null || description.isBlank()) {
      description = defaultDescription(width, height, colors);
    } else {
      description = description.trim();
    }
  }

  /**
   * Creates pattern info with the default size description.
   *
   * @param title pattern title
   * @param notes free-form notes
   * @param width width in stitches
   * @param height height in stitches
   * @param colors number of colors
   * @return pattern info
   */
  public static PatternInfo of(String title, String notes, int width, int height, int colors) {
    return new PatternInfo(title, notes, null, width, height, colors);
  }

  /**
   * Formats the default description used when the source provides none.
   *
   * @param width width in stitches
   * @param height height in stitches
   * @param colors number of colors
   * @return description text
   */
  public static String defaultDescription(int width, int height, int colors) {
    return width + " x " + height + " stitches " + colors + " colors";
  }

  public boolean hasTitle() {
    return !title.isEmpty();
  }
}
