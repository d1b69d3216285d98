package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.validation.Urls;
import java.util.Map;
import java.util.Objects;

/**
 * Public URLs used in pins and emails.
 *
 * @param siteBaseUrl public site root ({@code site.baseUrl})
 * @param imageBaseUrl public object storage root ({@code site.imageBaseUrl}); defaults to the bucket's S3 URL
 * @param albumUrlTemplate album link template ({@code site.albumUrlTemplate}); blank uses the site default
 * @since 0.1.0
 */
public record SiteConfig(String siteBaseUrl, String imageBaseUrl, String albumUrlTemplate) {
  public static final String DEFAULT_SITE_BASE_URL = "https://www.cross-stitch-pattern.net";

  public SiteConfig {
    siteBaseUrl = Urls.requireHttpUrl("site.baseUrl", siteBaseUrl);
    imageBaseUrl = Urls.requireHttpUrl("site.imageBaseUrl", imageBaseUrl);
    albumUrlTemplate = albumUrlTemplate == null ? "" : albumUrlTemplate.trim();
  }

  /**
   * Reads site settings.
   *
   * @param options effective configuration
   * @param store store settings; the bucket name derives the default image base
   * @return populated settings
   */
  public static SiteConfig fromMap(Map<String, String> options, StoreConfig store) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(store, "store");
    return new SiteConfig(
        ConfigValues.string(options, "site.baseUrl", DEFAULT_SITE_BASE_URL),
        ConfigValues.string(options, "site.imageBaseUrl", "https://" + store.bucket() + ".s3.amazonaws.com"),
        ConfigValues.string(options, "site.albumUrlTemplate", ""));
  }

  public PatternLinks links(String photoPrefix) {
    return new PatternLinks(siteBaseUrl, imageBaseUrl, photoPrefix, albumUrlTemplate);
  }
}
