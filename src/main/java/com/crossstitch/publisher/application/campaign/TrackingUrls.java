package com.crossstitch.publisher.application.campaign;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Appends campaign tracking parameters to outbound links.
 * <p><strong>Policy:</strong> every parameter ({@code cid}, {@code eid}, {@code utm_source}, {@code utm_medium},
 * {@code utm_campaign}) is added only when absent, matched case-insensitively before the fragment, so applying
 * the same tracking twice yields the same URL. The fragment is preserved.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TrackingUrls {
  public static final String UTM_SOURCE = "newsletter";
  public static final String UTM_MEDIUM = "email";
  private static final DateTimeFormatter CAMPAIGN_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  private TrackingUrls() {
    // Utility
  }

  /**
   * Adds recipient and campaign ids plus the UTM parameters.
   *
   * @param url link to decorate; blank links are returned unchanged
   * @param cid recipient tracking id; skipped when blank
   * @param eid campaign id; skipped when blank
   * @param today campaign date used for {@code utm_campaign}
   * @return decorated URL
   */
  public static String withTracking(String url, String cid, String eid, LocalDate today) {
    if (url == null || url.isBlank()) {
      return url;
    }
    List<String> parts = new ArrayList<>();
    if (cid != null && !cid.isBlank() && !hasQueryParameter(url, "cid")) {
      parts.add("cid=" + UnsubscribeLinks.escape(cid));
    }
    if (eid != null && !eid.isBlank() && !hasQueryParameter(url, "eid")) {
      parts.add("eid=" + UnsubscribeLinks.escape(eid));
    }
    return withUtm(appendQueryParameters(url, parts), today);
  }

  /**
   * Adds only the UTM parameters.
   *
   * @param url link to decorate
   * @param today campaign date
   * @return decorated URL
   */
  public static String withUtm(String url, LocalDate today) {
    if (url == null || url.isBlank()) {
      return url;
    }
    List<String> parts = new ArrayList<>(3);
    if (!hasQueryParameter(url, "utm_source")) {
      parts.add("utm_source=" + UTM_SOURCE);
    }
    if (!hasQueryParameter(url, "utm_medium")) {
      parts.add("utm_medium=" + UTM_MEDIUM);
    }
    if (!hasQueryParameter(url, "utm_campaign")) {
      parts.add("utm_campaign=" + UnsubscribeLinks.escape(CAMPAIGN_DATE.format(today)));
    }
    return appendQueryParameters(url, parts);
  }

  static boolean hasQueryParameter(String url, String name) {
    int queryIndex = url.indexOf('?');
    if (queryIndex < 0) {
      return false;
    }
    String query = url.substring(queryIndex + 1);
    int hashIndex = query.indexOf('#');
    if (hashIndex >= 0) {
      query = query.substring(0, hashIndex);
    }
    for (String part : query.split("&")) {
      if (part.isEmpty()) {
        continue;
      }
      int eq = part.indexOf('=');
      String candidate = eq >= 0 ? part.substring(0, eq) : part;
      if (candidate.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }

  static String appendQueryParameters(String url, List<String> parameters) {
    if (parameters.isEmpty()) {
      return url;
    }
    String fragment = "";
    String base = url;
    int hashIndex = url.indexOf('#');
    if (hashIndex >= 0) {
      fragment = url.substring(hashIndex);
      base = url.substring(0, hashIndex);
    }
    String separator = base.contains("?") ? "&" : "?";
    return base + separator + String.join("&", parameters) + fragment;
  }
}
