package com.crossstitch.publisher.application.pin;

import com.crossstitch.publisher.domain.design.PatternInfo;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks the theme whose keywords occur most often in a pattern's title, description and notes.
 *
 * <p>Each keyword contained in the lowercased text scores one point. Only a strictly greater score replaces the
 * current best, so the earliest theme wins ties and a zero score yields {@link ThemeCatalog#GENERAL}. Matching is
 * plain substring containment; {@code "cat"} matches {@code "Cute Cats"}.</p>
 *
 * @since 0.1.0
 */
public final class ThemeDetector {
  private final List<Theme> themes;
  private final Theme fallback;

  public ThemeDetector() {
    this(ThemeCatalog.THEMES, ThemeCatalog.GENERAL);
  }

  public ThemeDetector(List<Theme> themes, Theme fallback) {
    this.themes = List.copyOf(themes);
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  public Theme detect(PatternInfo pattern) {
    String text = (pattern.title() + " " + pattern.description() + " " + pattern.notes()).toLowerCase(Locale.ROOT);
    Theme best = fallback;
    int bestScore = 0;
    for (Theme theme : themes) {
      int score = 0;
      for (String keyword : theme.keywords()) {
        if (!keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
          score++;
        }
      }
      if (score > bestScore) {
        bestScore = score;
        best = theme;
      }
    }
    return best;
  }
}
