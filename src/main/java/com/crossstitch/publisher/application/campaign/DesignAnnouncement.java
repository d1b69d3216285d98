package com.crossstitch.publisher.application.campaign;

import java.util.Objects;

/**
 * Links and identifiers of a freshly published design, as announced by the campaign.
 *
 * @param albumId album id
 * @param designId design id
 * @param pinId pin id; empty when the pin API returned none
 * @param title pattern title; may be empty
 * @param patternUrl design page URL without tracking
 * @param siteUrl site root URL
 * @param imageUrl preview image URL
 * @since 0.1.0
 */
public record DesignAnnouncement(
    int albumId, int designId, String pinId, String title, String patternUrl, String siteUrl, String imageUrl) {

  public DesignAnnouncement {
    pinId = pinId == null ? "" : pinId;
    title = title == null ? "" : title.trim();
    Objects.requireNonNull(patternUrl, "patternUrl");
    Objects.requireNonNull(siteUrl, "siteUrl");
    Objects.requireNonNull(imageUrl, "imageUrl");
  }

  /** Image alt text; falls back to a generic phrase for untitled designs. */
  public String altText() {
    return title.isEmpty() ? "New cross stitch pattern" : title;
  }
}
