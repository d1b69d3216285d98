package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * Sender, content and pacing settings of the campaign.
 *
 * @param sender verified sender address
 * @param adminEmail optional admin address that receives every campaign first
 * @param notificationSubject subject of design announcements; {@code {Title}} is replaced by the design title
 * @param broadcastSubject subject of the text broadcast
 * @param broadcastBody plain-text template of the text broadcast; {@code <username>} is personalized
 * @param facebookUrl social page linked from announcements
 * @param progressEvery progress line interval in sends
 * @param albumSuggestionCount number of albums suggested in announcements
 * @since 0.1.0
 */
public record CampaignSettings(
    String sender,
    Optional<String> adminEmail,
    String notificationSubject,
    String broadcastSubject,
    String broadcastBody,
    String facebookUrl,
    int progressEvery,
    int albumSuggestionCount) {

  public static final String DEFAULT_FACEBOOK_URL = "https://www.facebook.com/AnnCrossStitch/";
  public static final String DEFAULT_NOTIFICATION_SUBJECT = "New cross stitch pattern: {Title} PDF is ready!";
  public static final int DEFAULT_PROGRESS_EVERY = 50;
  public static final int DEFAULT_ALBUM_SUGGESTIONS = 4;

  public CampaignSettings {
    sender = Strings.requireNonBlank("campaign.sender", sender);
    adminEmail = Objects.requireNonNull(adminEmail, "adminEmail").map(String::trim).filter(v -> !v.isEmpty());
    notificationSubject = notificationSubject == null || notificationSubject.isBlank()
        ? DEFAULT_NOTIFICATION_SUBJECT : notificationSubject;
    broadcastSubject = broadcastSubject == null ? "" : broadcastSubject;
    broadcastBody = broadcastBody == null ? "" : broadcastBody;
    facebookUrl = facebookUrl == null || facebookUrl.isBlank() ? DEFAULT_FACEBOOK_URL : facebookUrl.trim();
    if (progressEvery <= 0) {
      throw new IllegalArgumentException("campaign.progressEvery must be positive");
    }
    if (albumSuggestionCount < 0) {
      throw new IllegalArgumentException("campaign.albumSuggestions must be >= 0");
    }
  }

  /**
   * Resolves the announcement subject for a design.
   *
   * @param title design title; blank uses a generic phrase
   * @return subject line
   */
  public String notificationSubjectFor(String title) {
    String value = title == null || title.isBlank() ? "A new design" : title.trim();
    return notificationSubject.replace("{Title}", value);
  }
}
