package com.crossstitch.publisher.application.pin;

import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the SEO title, description and alt text of a pin.
 *
 * @since 0.1.0
 */
public final class PinPayloadBuilder {
  static final int TITLE_MAX = 100;
  static final int DESCRIPTION_MAX = 500;
  static final int ALT_TEXT_MAX = 500;

  /**
   * Builds a complete payload.
   *
   * @param pattern pattern metadata
   * @param theme detected theme
   * @param albumId album id, printed with 4 digits in the description
   * @param boardId resolved board
   * @param patternUrl design page URL
   * @param imageUrl preview image URL
   * @return payload ready to post
   */
  public PinPayload build(
      PatternInfo pattern, Theme theme, int albumId, String boardId, String patternUrl, String imageUrl) {
    return new PinPayload(
        boardId,
        patternUrl,
        title(pattern, theme),
        description(pattern, theme, albumId, patternUrl),
        altText(pattern, theme),
        imageUrl);
  }

  /** {@code "{title} – {Theme name}, printable PDF pattern"}, capped at 100 characters. */
  static String title(PatternInfo pattern, Theme theme) {
    String base = pattern.hasTitle() ? pattern.title() : "Cross stitch pattern";
    return Strings.truncate(base + " – " + sentenceCase(theme.humanName()) + ", printable PDF pattern", TITLE_MAX);
  }

  static String altText(PatternInfo pattern, Theme theme) {
    List<String> parts = new ArrayList<>();
    parts.add("Counted cross stitch pattern");
    parts.add(pattern.hasTitle() ? pattern.title() : theme.humanName());
    List<String> technical = new ArrayList<>();
    if (pattern.width() > 0 && pattern.height() > 0) {
      technical.add(pattern.width() + " by " + pattern.height() + " stitches");
    }
    if (pattern.colors() > 0) {
      technical.add(pattern.colors() + " colours");
    }
    if (!technical.isEmpty()) {
      parts.add(String.join(", ", technical));
    }
    return Strings.truncate(String.join(", ", parts), ALT_TEXT_MAX);
  }

  static String description(PatternInfo pattern, Theme theme, int albumId, String patternUrl) {
    StringBuilder sb = new StringBuilder();
    if (pattern.hasTitle()) {
      sb.append(pattern.title()).append(" – ");
    }
    sb.append(theme.humanName()).append(". ");
    if (pattern.width() > 0 && pattern.height() > 0 && pattern.colors() > 0) {
      sb.append("Detailed counted cross stitch chart (")
          .append(pattern.width()).append(" × ").append(pattern.height())
          .append(" stitches, ").append(pattern.colors()).append(" colours). ");
    } else {
      sb.append("Beautiful counted cross stitch design. ");
    }
    if (!pattern.description().isBlank()) {
      sb.append(pattern.description()).append(' ');
    }
    if (!pattern.notes().isBlank()) {
      sb.append(pattern.notes()).append(' ');
    }
    sb.append(String.format(Locale.ROOT,
        "From album %04d. Download printable PDF and see more details at %s. ", albumId, patternUrl));
    sb.append("Perfect for embroidery lovers and cross stitch fans. ");

    List<String> hashtags = hashtags(theme);
    if (!hashtags.isEmpty()) {
      sb.append('\n').append(String.join(" ", hashtags));
    }
    return Strings.truncate(sb.toString(), DESCRIPTION_MAX);
  }

  /**
   * Generic hashtags followed by the theme's, deduplicated case-insensitively in first-seen order.
   *
   * @param theme detected theme
   * @return hashtags
   */
  static List<String> hashtags(Theme theme) {
    List<String> all = new ArrayList<>(ThemeCatalog.GENERIC_HASHTAGS);
    all.addAll(theme.hashtags());
    Set<String> seen = new LinkedHashSet<>();
    List<String> unique = new ArrayList<>();
    for (String tag : all) {
      if (tag == null || tag.isBlank()) {
        continue;
      }
      String trimmed = tag.trim();
      if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
        unique.add(trimmed);
      }
    }
    return unique;
  }

  /**
   * Capitalizes the first letter of each sentence and lowercases everything else.
   *
   * @param input text
   * @return sentence-cased text
   */
  static String sentenceCase(String input) {
    if (input == null || input.isBlank()) {
      return input;
    }
    StringBuilder sb = new StringBuilder(input.length());
    boolean newSentence = true;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (newSentence && Character.isLetter(c)) {
        sb.append(Character.toUpperCase(c));
        newSentence = false;
      } else {
        sb.append(Character.toLowerCase(c));
      }
      if (c == '.' || c == '!' || c == '?') {
        newSentence = true;
      }
    }
    return sb.toString();
  }
}
