package com.crossstitch.publisher.application.links;

import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.validation.Urls;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds public site and image URLs for published designs, shared by the pin and email stages.
 *
 * @since 0.1.0
 */
public final class PatternLinks {
  /** Photo file name used for every design preview. */
  public static final String DEFAULT_PHOTO_FILE = "4.jpg";

  private final String siteBaseUrl;
  private final String imageBaseUrl;
  private final String photoPrefix;
  private final String albumUrlTemplate;

  /**
   * Creates a link builder.
   *
   * @param siteBaseUrl public site root, for example {@code https://www.cross-stitch-pattern.net}
   * @param imageBaseUrl public object storage root
   * @param photoPrefix key prefix of preview photos
   * @param albumUrlTemplate optional template with {@code {AlbumId}} and {@code {CaptionSlug}} placeholders;
   *     blank uses {@code {site}/Free-{slug}-Charts.aspx}
   */
  public PatternLinks(String siteBaseUrl, String imageBaseUrl, String photoPrefix, String albumUrlTemplate) {
    this.siteBaseUrl = Urls.trimTrailingSlashes(Objects.requireNonNull(siteBaseUrl, "siteBaseUrl"));
    this.imageBaseUrl = Urls.trimTrailingSlashes(Objects.requireNonNull(imageBaseUrl, "imageBaseUrl"));
    this.photoPrefix = Objects.requireNonNull(photoPrefix, "photoPrefix");
    this.albumUrlTemplate = albumUrlTemplate == null ? "" : albumUrlTemplate.trim();
  }

  public String siteBaseUrl() {
    return siteBaseUrl;
  }

  /**
   * Builds the design page URL, for example {@code {site}/Good-Morning-9-288-Free-Design.aspx}.
   *
   * <p>The page segment is the album page minus one; a non-numeric page counts as 0.</p>
   *
   * @param pattern pattern metadata; spaces in the title become hyphens
   * @param albumId album id
   * @param nPage 5-digit album page
   * @return design page URL
   */
  public String patternUrl(PatternInfo pattern, int albumId, String nPage) {
    String caption = (pattern.hasTitle() ? pattern.title() : "Cross-stitch-pattern").replace(' ', '-');
    int page;
    try {
      page = Integer.parseInt(nPage == null ? "" : nPage.trim());
    } catch (NumberFormatException ex) {
      page = 0;
    }
    return siteBaseUrl + "/" + caption + "-" + albumId + "-" + (page - 1) + "-Free-Design.aspx";
  }

  public String imageUrl(int designId, int albumId) {
    return imageUrl(designId, albumId, DEFAULT_PHOTO_FILE);
  }

  public String imageUrl(int designId, int albumId, String photoFileName) {
    return imageBaseUrl + "/" + photoPrefix + "/" + albumId + "/" + designId + "/" + photoFileName;
  }

  /**
   * Builds the album listing URL.
   *
   * @param albumId album id as stored (usually 4 digits)
   * @param caption album caption; may be blank
   * @return album URL
   */
  public String albumUrl(String albumId, String caption) {
    if (albumId == null || albumId.isBlank()) {
      throw new IllegalArgumentException("albumId must be provided");
    }
    String slug = captionSlug(caption, albumId);
    if (!albumUrlTemplate.isEmpty()) {
      return albumUrlTemplate.replace("{AlbumId}", albumId).replace("{CaptionSlug}", slug);
    }
    return siteBaseUrl + "/Free-" + slug + "-Charts.aspx";
  }

  /**
   * Turns a caption into a hyphenated title-case slug; letters and digits form words.
   *
   * @param caption album caption
   * @param albumId album id used when the caption yields no words
   * @return slug such as {@code Cute-Cats}, or {@code Album-0007}
   */
  static String captionSlug(String caption, String albumId) {
    if (caption == null || caption.isBlank()) {
      return "Album-" + albumId;
    }
    List<String> words = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < caption.length(); i++) {
      char c = caption.charAt(i);
      if (Character.isLetterOrDigit(c)) {
        current.append(c);
      } else if (current.length() > 0) {
        words.add(current.toString());
        current.setLength(0);
      }
    }
    if (current.length() > 0) {
      words.add(current.toString());
    }
    if (words.isEmpty()) {
      return "Album-" + albumId;
    }
    List<String> capitalized = new ArrayList<>(words.size());
    for (String word : words) {
      String lower = word.toLowerCase(Locale.ROOT);
      capitalized.add(Character.toUpperCase(lower.charAt(0)) + lower.substring(1));
    }
    return String.join("-", capitalized);
  }
}
