package com.crossstitch.publisher.application.pin;

import java.util.List;

/**
 * Fixed theme table used for pin text. Order matters: on equal scores the earlier theme wins.
 *
 * @since 0.1.0
 */
public final class ThemeCatalog {
  /** Fallback when no keyword matches. */
  public static final Theme GENERAL = new Theme(
      "general",
      "cross stitch pattern",
      List.of(),
      List.of("#crossstitch", "#crossstitchpattern", "#embroidery", "#needlework"));

  /** Hashtags added to every pin before the theme's own. */
  public static final List<String> GENERIC_HASHTAGS = List.of(
      "#crossstitch", "#crossstitchpattern", "#embroidery", "#needlework", "#crossstitchkit");

  public static final List<Theme> THEMES = List.of(
      new Theme("cats", "cat cross stitch pattern",
          List.of("cat", "kitten", "kitty"),
          List.of("#cat", "#cats", "#catlover", "#kitty")),
      new Theme("dogs", "dog cross stitch pattern",
          List.of("dog", "puppy", "pup"),
          List.of("#dog", "#dogs", "#doglover", "#puppy")),
      new Theme("birds", "bird cross stitch pattern",
          List.of("bird", "sparrow", "owl", "eagle", "parrot"),
          List.of("#birds", "#birdart")),
      new Theme("flowers", "floral cross stitch pattern",
          List.of("flower", "rose", "tulip", "poppy", "bouquet", "floral"),
          List.of("#flowers", "#floral")),
      new Theme("nature", "nature cross stitch pattern",
          List.of("forest", "tree", "mountain", "lake", "river", "landscape", "nature"),
          List.of("#landscape", "#nature")),
      new Theme("seaside", "seaside cross stitch pattern",
          List.of("sea", "ocean", "beach", "coast", "harbor", "harbour"),
          List.of("#seaside", "#ocean", "#beach")),
      new Theme("city", "city cross stitch pattern",
          List.of("city", "street", "house", "houses", "architecture", "building"),
          List.of("#cityscape", "#architecture")),
      new Theme("people", "people cross stitch pattern",
          List.of("girl", "boy", "woman", "man", "people", "portrait"),
          List.of("#portrait", "#people")),
      new Theme("fantasy", "fantasy cross stitch pattern",
          List.of("fairy", "dragon", "unicorn", "wizard", "magic", "fantasy"),
          List.of("#fantasy", "#fairytales")),
      new Theme("christmas", "Christmas cross stitch pattern",
          List.of("christmas", "xmas", "santa", "snowman", "reindeer", "christmas tree"),
          List.of("#christmas", "#christmasdecor", "#winter")),
      new Theme("easter", "Easter cross stitch pattern",
          List.of("easter", "egg", "eggs", "bunny", "rabbit"),
          List.of("#easter", "#spring")));

  private ThemeCatalog() {}
}
