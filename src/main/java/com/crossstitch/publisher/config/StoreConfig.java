package com.crossstitch.publisher.config;

import com.crossstitch.publisher.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Locations of the AWS resources shared by every command.
 * <p><strong>Keys:</strong> {@code aws.region}, {@code aws.bucket}, {@code store.designsTable},
 * {@code store.usersTable}, {@code store.photoPrefix}, {@code sequenceMode}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param region AWS region id
 * @param bucket object storage bucket holding charts, PDFs and photos
 * @param designsTable item table holding designs, albums and sequence counters
 * @param usersTable item table holding newsletter users
 * @param photoPrefix key prefix of preview photos, without leading or trailing {@code /}
 * @param sequenceMode id allocation strategy
 * @since 0.1.0
 */
public record StoreConfig(
    String region,
    String bucket,
    String designsTable,
    String usersTable,
    String photoPrefix,
    SequenceMode sequenceMode) {

  public static final String DEFAULT_REGION = "us-east-1";
  public static final String DEFAULT_BUCKET = "cross-stitch-designs";
  public static final String DEFAULT_DESIGNS_TABLE = "CrossStitchItems";
  public static final String DEFAULT_USERS_TABLE = "CrossStitchUsers";
  public static final String DEFAULT_PHOTO_PREFIX = "images/designs/photos";

  public StoreConfig {
    region = Strings.requirePrintableAscii("aws.region", region, 64);
    bucket = Strings.requirePrintableAscii("aws.bucket", bucket, 63);
    designsTable = Strings.requirePrintableAscii("store.designsTable", designsTable, 255);
    usersTable = Strings.requirePrintableAscii("store.usersTable", usersTable, 255);
    photoPrefix = trimSlashes(Strings.requireNonBlank("store.photoPrefix", photoPrefix));
    sequenceMode = Objects.requireNonNullElse(sequenceMode, SequenceMode.ATOMIC);
  }

  public static StoreConfig defaults() {
    return new StoreConfig(DEFAULT_REGION, DEFAULT_BUCKET, DEFAULT_DESIGNS_TABLE, DEFAULT_USERS_TABLE,
        DEFAULT_PHOTO_PREFIX, SequenceMode.ATOMIC);
  }

  /**
   * Reads the store settings from flattened configuration.
   *
   * @param options effective configuration
   * @return populated settings
   * @throws IllegalArgumentException when a value is invalid
   */
  public static StoreConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    StoreConfig defaults = defaults();
    return new StoreConfig(
        ConfigValues.string(options, "aws.region", defaults.region()),
        ConfigValues.string(options, "aws.bucket", defaults.bucket()),
        ConfigValues.string(options, "store.designsTable", defaults.designsTable()),
        ConfigValues.string(options, "store.usersTable", defaults.usersTable()),
        ConfigValues.string(options, "store.photoPrefix", defaults.photoPrefix()),
        SequenceMode.fromString(ConfigValues.string(options, "sequenceMode", "atomic")));
  }

  private static String trimSlashes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '/') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '/') {
      end--;
    }
    if (start == end) {
      throw new IllegalArgumentException("store.photoPrefix must not be only slashes");
    }
    return value.substring(start, end);
  }
}
