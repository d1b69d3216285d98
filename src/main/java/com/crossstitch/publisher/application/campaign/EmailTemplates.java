package com.crossstitch.publisher.application.campaign;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Text and HTML fragments of campaign emails.
 * <p><strong>Conventions:</strong> text bodies use CRLF line breaks; every value interpolated into HTML goes
 * through {@link #htmlEncode(String)} except URLs built by this application.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class EmailTemplates {
  static final String CRLF = "\r\n";
  static final String USERNAME_PLACEHOLDER = "<username>";
  static final String DEFAULT_NAME = "friend";
  private static final String IMAGE_STYLE =
      "max-width:280px; max-height:280px; width:auto; height:auto; border:0;";

  private EmailTemplates() {
    // Utility
  }

  public static String greetingText(String firstName) {
    return isBlank(firstName) ? "Hi," + CRLF + CRLF : "Hi " + firstName.trim() + "," + CRLF + CRLF;
  }

  public static String greetingHtml(String firstName) {
    return isBlank(firstName) ? "<p>Hi,</p>" : "<p>Hi " + htmlEncode(firstName.trim()) + ",</p>";
  }

  /**
   * Plain-text body announcing a new design.
   *
   * @param title design title; blank uses a generic phrase
   * @param patternUrl tracked design page URL
   * @param siteUrl tracked site root URL
   * @param facebookUrl social page URL
   * @return text body without greeting or footer
   */
  public static String announcementText(String title, String patternUrl, String siteUrl, String facebookUrl) {
    return "I just wanted to send a quick note! The PDF cross-stitch pattern for " + subjectOf(title)
        + " is finished and has been uploaded to the site. I always love seeing what everyone creates." + CRLF + CRLF
        + "You can download the pattern right here:" + CRLF
        + patternUrl + CRLF + CRLF
        + "Happy Stitching," + CRLF
        + "Visit " + siteUrl + " to explore more patterns and see what I'm uploading next." + CRLF
        + "Join me on Facebook: " + facebookUrl + " - I'd love to connect.";
  }

  /**
   * HTML body announcing a new design.
   *
   * @param title design title
   * @param patternUrl tracked design page URL
   * @param imageUrl preview image URL
   * @param siteUrl tracked site root URL
   * @param facebookUrl social page URL
   * @param altText image alt text
   * @return HTML body without greeting or footer
   */
  public static String announcementHtml(
      String title, String patternUrl, String imageUrl, String siteUrl, String facebookUrl, String altText) {
    return "<p>I just wanted to send a quick note! The PDF cross-stitch pattern for " + htmlEncode(subjectOf(title))
        + " is finished and has been uploaded to the site. I always love seeing what everyone creates.</p>"
        + "<p>You can download the pattern right here:</p>"
        + "<p><a href=\"" + patternUrl + "\"><img src=\"" + imageUrl + "\" alt=\"" + htmlEncode(altText)
        + "\" style=\"" + IMAGE_STYLE + "\"></a></p>"
        + "<p><a href=\"" + patternUrl + "\">Download the pattern here</a></p>"
        + "<p>Happy Stitching,</p>"
        + "<p>Visit <a href=\"" + siteUrl + "\">" + siteUrl + "</a> to explore more patterns and see what I'm "
        + "uploading next.</p>"
        + "<p>Join me on Facebook: <a href=\"" + facebookUrl + "\">Ann Cross Stitch</a>. I'd love to connect.</p>";
  }

  /**
   * HTML body of the admin-only upload notice.
   *
   * @param design published design
   * @param patternUrl design page URL with UTM parameters
   * @return HTML body without footer
   */
  public static String uploadNoticeHtml(DesignAnnouncement design, String patternUrl) {
    return "<p>The upload for album " + design.albumId() + " design " + design.designId() + " was successful.</p>"
        + "<p><a href=\"" + patternUrl + "\"><img src=\"" + design.imageUrl() + "\" alt=\""
        + htmlEncode(design.altText()) + "\" style=\"" + IMAGE_STYLE + "\"/></a></p>"
        + "<p>Pin ID: " + htmlEncode(design.pinId()) + "</p>";
  }

  public static String uploadNoticeText(DesignAnnouncement design) {
    return "The upload for album " + design.albumId() + " design " + design.designId() + " (" + design.title()
        + ") pinId " + design.pinId() + " was successful.";
  }

  public static String unsubscribeFooterHtml(String unsubscribeUrl) {
    return "<p style=\"font-size:12px; color:#666;\">If you prefer not to receive these emails, <a href=\""
        + unsubscribeUrl + "\">unsubscribe</a>.</p>";
  }

  public static String unsubscribeLineText(String unsubscribeUrl) {
    return CRLF + "Unsubscribe: " + unsubscribeUrl;
  }

  /**
   * Replaces {@code <username>} in a text template.
   *
   * @param template template text; blank yields an empty string
   * @param firstName recipient name; blank uses {@code friend}
   * @return personalized text
   */
  public static String personalizeText(String template, String firstName) {
    if (isBlank(template)) {
      return "";
    }
    return template.replace(USERNAME_PLACEHOLDER, nameOrDefault(firstName));
  }

  /**
   * Replaces {@code <username>} and its encoded form {@code &lt;username&gt;} in an HTML template.
   *
   * @param template template HTML; blank yields an empty string
   * @param firstName recipient name, HTML-encoded before insertion
   * @return personalized HTML
   */
  public static String personalizeHtml(String template, String firstName) {
    if (isBlank(template)) {
      return "";
    }
    String encoded = htmlEncode(nameOrDefault(firstName));
    return template.replace("&lt;username&gt;", encoded).replace(USERNAME_PLACEHOLDER, encoded);
  }

  /**
   * Converts plain text to HTML paragraphs; blank lines separate paragraphs and single breaks become
   * {@code <br/>}.
   *
   * @param text plain text
   * @return HTML, or an empty string for blank input
   */
  public static String plainTextToHtml(String text) {
    if (isBlank(text)) {
      return "";
    }
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    List<String> paragraphs = new ArrayList<>();
    for (String paragraph : normalized.split("\n\n", -1)) {
      String html = htmlEncode(paragraph).replace("\n", "<br/>");
      if (!html.isBlank()) {
        paragraphs.add("<p>" + html + "</p>");
      }
    }
    return String.join("", paragraphs);
  }

  public static String htmlEncode(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length() + 16);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '&' -> sb.append("&amp;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#39;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  private static String subjectOf(String title) {
    return isBlank(title) ? "our newest design" : title.trim();
  }

  private static String nameOrDefault(String firstName) {
    return isBlank(firstName) ? DEFAULT_NAME : firstName.trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
