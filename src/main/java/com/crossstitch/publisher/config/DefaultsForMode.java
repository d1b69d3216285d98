package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.campaign.CampaignSettings;
import com.crossstitch.publisher.application.campaign.UsersSchema;
import com.crossstitch.publisher.application.infra.VerifySettings;
import com.crossstitch.publisher.infrastructure.pinterest.PinterestHttpAdapter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each publisher command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (publish, campaign, verify, boards, users, audit)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "publish" -> buildPublishDefaults();
      case "campaign" -> buildCampaignDefaults();
      case "verify" -> buildVerifyDefaults();
      case "boards" -> buildBoardsDefaults();
      case "users" -> buildUsersCommandDefaults();
      case "audit" -> buildAuditDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    StoreConfig store = StoreConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("aws.region", store.region());
    map.put("aws.bucket", store.bucket());
    map.put("store.designsTable", store.designsTable());
    map.put("store.usersTable", store.usersTable());
    map.put("store.photoPrefix", store.photoPrefix());
    map.put("sequenceMode", store.sequenceMode().name().toLowerCase(Locale.ROOT));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPublishDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("site.baseUrl", SiteConfig.DEFAULT_SITE_BASE_URL);
    map.put("pinterest.baseUrl", PinterestHttpAdapter.DEFAULT_BASE_URL);
    map.put("pinterest.boardsCsv", PinterestConfig.DEFAULT_BOARDS_CSV);
    map.put("pinterest.timeoutSeconds", Integer.toString(PinterestConfig.DEFAULT_TIMEOUT_SECONDS));
    map.put("converter.path", ConverterConfig.DEFAULT_PATH);
    map.put("converter.timeoutSeconds", Integer.toString(ConverterConfig.DEFAULT_TIMEOUT_SECONDS));
    map.putAll(buildVerifyDefaults());
    map.putAll(buildCampaignDefaults());
    map.put("dryRun", "false");
    map.put("skipVerify", "false");
    map.put("skipCampaign", "false");
    return map;
  }

  private static Map<String, String> buildCampaignDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("site.baseUrl", SiteConfig.DEFAULT_SITE_BASE_URL);
    map.put("campaign.notificationSubject", CampaignSettings.DEFAULT_NOTIFICATION_SUBJECT);
    map.put("campaign.facebookUrl", CampaignSettings.DEFAULT_FACEBOOK_URL);
    map.put("campaign.progressEvery", Integer.toString(CampaignSettings.DEFAULT_PROGRESS_EVERY));
    map.put("campaign.albumSuggestions", Integer.toString(CampaignSettings.DEFAULT_ALBUM_SUGGESTIONS));
    map.putAll(buildUsersDefaults());
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildVerifyDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("verify.environmentName", VerifyConfig.DEFAULT_ENVIRONMENT_NAME);
    map.put("verify.pollIntervalMillis", Long.toString(VerifySettings.DEFAULT_POLL_INTERVAL_MILLIS));
    map.put("verify.maxAttempts", Integer.toString(VerifySettings.DEFAULT_MAX_ATTEMPTS));
    return map;
  }

  private static Map<String, String> buildBoardsDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pinterest.baseUrl", PinterestHttpAdapter.DEFAULT_BASE_URL);
    map.put("pinterest.boardsCsv", PinterestConfig.DEFAULT_BOARDS_CSV);
    map.put("pinterest.timeoutSeconds", Integer.toString(PinterestConfig.DEFAULT_TIMEOUT_SECONDS));
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildUsersCommandDefaults() {
    Map<String, String> map = new LinkedHashMap<>(buildUsersDefaults());
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildUsersDefaults() {
    UsersSchema schema = UsersSchema.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("users.emailAttribute", schema.emailAttribute());
    map.put("users.firstNameAttribute", schema.firstNameAttribute());
    map.put("users.idAttribute", schema.idAttribute());
    map.put("users.cidAttribute", schema.cidAttribute());
    map.put("users.verifiedAttribute", schema.verifiedAttribute());
    map.put("users.unsubscribedAttribute", schema.unsubscribedAttribute());
    return map;
  }

  private static Map<String, String> buildAuditDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("report", AuditConfig.DEFAULT_REPORT);
    return map;
  }
}
