package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.campaign.CampaignSettings;
import com.crossstitch.publisher.application.campaign.UsersSchema;
import com.crossstitch.publisher.logging.Logs;
import com.crossstitch.publisher.validation.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Email campaign settings: sender, admin copy, subjects, unsubscribe endpoint and the
 * users table layout.
 * <p><strong>Validation:</strong> the sender and admin addresses must look like email addresses and
 * {@code unsubscribe.secret} must be set; all of this is checked before anything is sent.</p>
 * <p><strong>Security:</strong> {@link #toString()} hides the secret.</p>
 *
 * @param settings campaign behaviour
 * @param unsubscribeBaseUrl unsubscribe endpoint; blank uses {@code {site}/unsubscribe}
 * @param unsubscribeSecret HMAC secret shared with the unsubscribe endpoint
 * @param users users table layout
 * @since 0.1.0
 */
public record CampaignConfig(
    CampaignSettings settings, String unsubscribeBaseUrl, String unsubscribeSecret, UsersSchema users) {

  public CampaignConfig {
    Objects.requireNonNull(settings, "settings");
    unsubscribeBaseUrl = unsubscribeBaseUrl == null ? "" : unsubscribeBaseUrl.trim();
    if (unsubscribeSecret == null || unsubscribeSecret.isBlank()) {
      throw new IllegalArgumentException("unsubscribe.secret must be configured");
    }
    Objects.requireNonNull(users, "users");
  }

  /**
   * Reads campaign settings.
   *
   * @param options effective configuration
   * @param store store settings providing the users table name
   * @return populated settings
   * @throws IllegalArgumentException when the sender, admin address or secret is missing or malformed
   */
  public static CampaignConfig fromMap(Map<String, String> options, StoreConfig store) {
    Objects.requireNonNull(options, "options");
    String sender = Strings.requireEmail("campaign.sender", options.get("campaign.sender"));
    Optional<String> admin = ConfigValues.optional(options, "campaign.adminEmail")
        .map(value -> Strings.requireEmail("campaign.adminEmail", value));
    CampaignSettings settings = new CampaignSettings(
        sender,
        admin,
        ConfigValues.string(options, "campaign.notificationSubject", CampaignSettings.DEFAULT_NOTIFICATION_SUBJECT),
        ConfigValues.string(options, "campaign.broadcastSubject", ""),
        options.getOrDefault("campaign.broadcastBody", ""),
        ConfigValues.string(options, "campaign.facebookUrl", CampaignSettings.DEFAULT_FACEBOOK_URL),
        ConfigValues.integer(options, "campaign.progressEvery", CampaignSettings.DEFAULT_PROGRESS_EVERY, 1, 100_000),
        ConfigValues.integer(options, "campaign.albumSuggestions", CampaignSettings.DEFAULT_ALBUM_SUGGESTIONS, 0, 20));
    return new CampaignConfig(
        settings,
        ConfigValues.string(options, "unsubscribe.baseUrl", ""),
        options.get("unsubscribe.secret"),
        usersSchema(options, store));
  }

  /**
   * Reads the users table layout ({@code users.*Attribute} keys).
   *
   * @param options effective configuration
   * @param store store settings providing the table name
   * @return users schema
   */
  public static UsersSchema usersSchema(Map<String, String> options, StoreConfig store) {
    UsersSchema defaults = UsersSchema.withTable(store.usersTable());
    return new UsersSchema(
        store.usersTable(),
        ConfigValues.string(options, "users.emailAttribute", defaults.emailAttribute()),
        ConfigValues.string(options, "users.firstNameAttribute", defaults.firstNameAttribute()),
        ConfigValues.string(options, "users.idAttribute", defaults.idAttribute()),
        ConfigValues.string(options, "users.cidAttribute", defaults.cidAttribute()),
        ConfigValues.string(options, "users.verifiedAttribute", defaults.verifiedAttribute()),
        ConfigValues.string(options, "users.unsubscribedAttribute", defaults.unsubscribedAttribute()));
  }

  @Override
  public String toString() {
    return "CampaignConfig[settings=" + settings
        + ", unsubscribeBaseUrl=" + unsubscribeBaseUrl
        + ", unsubscribeSecret=" + Logs.redact(unsubscribeSecret) + ", users=" + users + "]";
  }
}
