package com.crossstitch.publisher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigFromMapTest {

  @TempDir Path tempDir;

  @Test
  void publishConfigReadsSwitchesAndCollaborators() throws Exception {
    Path batch = Files.createDirectories(tempDir.resolve("batch"));
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("publish"));
    options.put("batch", batch.toString());
    options.put("skipVerify", "yes");
    options.put("campaign.sender", "ann@cross-stitch.com");
    options.put("campaign.adminEmail", "admin@cross-stitch.com");
    options.put("unsubscribe.secret", "s3cret");
    options.put("pinterest.accessToken", "pina_t0ken");
    options.put("store.photoPrefix", "/images/photos/");

    PublishConfig config = PublishConfig.fromMap(options);

    assertEquals(batch.toAbsolutePath().normalize(), config.batchFolder());
    assertTrue(config.options().skipVerify());
    assertFalse(config.options().dryRun());
    assertEquals("images/photos", config.store().photoPrefix());
    assertEquals(SequenceMode.ATOMIC, config.store().sequenceMode());
    assertEquals("https://cross-stitch-designs.s3.amazonaws.com", config.site().imageBaseUrl());
    assertEquals(Optional.of("admin@cross-stitch.com"), config.campaign().settings().adminEmail());
    assertTrue(config.describe().stream().anyMatch(line -> line.contains("unsubscribeSecret=[REDACTED]")));
    assertTrue(config.describe().stream().noneMatch(line -> line.contains("s3cret")));
    assertTrue(config.describe().stream().anyMatch(line -> line.contains("token=[REDACTED]")));
    assertTrue(config.describe().stream().noneMatch(line -> line.contains("pina_t0ken")));
  }

  @Test
  void publishDryRunDoesNotNeedCampaignSettings() throws Exception {
    Path batch = Files.createDirectories(tempDir.resolve("batch"));
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("publish"));
    options.put("batch", batch.toString());
    options.put("dryRun", "true");

    PublishConfig config = PublishConfig.fromMap(options);

    assertNull(config.campaign());
  }

  @Test
  void publishRejectsMissingBatchFolder() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("publish"));
    options.put("batch", tempDir.resolve("absent").toString());

    assertThrows(IllegalArgumentException.class, () -> PublishConfig.fromMap(options));
  }

  @Test
  void campaignConfigRequiresSecretAndValidSender() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("campaign"));
    options.put("campaign.sender", "ann@cross-stitch.com");

    assertThrows(IllegalArgumentException.class,
        () -> CampaignConfig.fromMap(options, StoreConfig.defaults()));

    options.put("unsubscribe.secret", "s3cret");
    options.put("campaign.sender", "not-an-address");
    assertThrows(IllegalArgumentException.class,
        () -> CampaignConfig.fromMap(options, StoreConfig.defaults()));
  }

  @Test
  void campaignConfigReadsUsersSchemaOverrides() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("campaign"));
    options.put("campaign.sender", "ann@cross-stitch.com");
    options.put("unsubscribe.secret", "s3cret");
    options.put("users.emailAttribute", "Mail");
    options.put("store.usersTable", "Members");
    options.put("campaign.progressEvery", "10");

    CampaignConfig config = CampaignConfig.fromMap(options, StoreConfig.fromMap(options));

    assertEquals("Members", config.users().table());
    assertEquals("Mail", config.users().emailAttribute());
    assertEquals(10, config.settings().progressEvery());
    assertEquals(Optional.empty(), config.settings().adminEmail());
  }

  @Test
  void campaignConfigRejectsOutOfRangeNumbers() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("campaign"));
    options.put("campaign.sender", "ann@cross-stitch.com");
    options.put("unsubscribe.secret", "s3cret");
    options.put("campaign.albumSuggestions", "99");

    assertThrows(IllegalArgumentException.class,
        () -> CampaignConfig.fromMap(options, StoreConfig.defaults()));
  }

  @Test
  void boardsConfigParsesActionAndCsv() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("boards"));
    options.put("action", " Rename ");
    options.put("csv", tempDir.resolve("boards.csv").toString());
    options.put("dryRun", "1");

    BoardsConfig config = BoardsConfig.fromMap(options);

    assertEquals(BoardsConfig.Action.RENAME, config.action());
    assertEquals(tempDir.resolve("boards.csv").toAbsolutePath().normalize(), config.csv());
    assertTrue(config.dryRun());
  }

  @Test
  void boardsConfigRejectsUnknownAction() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("boards"));
    options.put("action", "delete");

    assertThrows(IllegalArgumentException.class, () -> BoardsConfig.fromMap(options));
  }

  @Test
  void verifyConfigKeepsBlankEnvironmentAsDisabled() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("verify"));
    options.put("verify.environmentName", " ");

    VerifyConfig config = VerifyConfig.fromMap(options, StoreConfig.defaults());

    assertFalse(config.settings().enabled());
    assertEquals("us-east-1", config.region());
  }

  @Test
  void booleanValuesMustBeRecognised() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("boards"));
    options.put("action", "create");
    options.put("dryRun", "maybe");

    assertThrows(IllegalArgumentException.class, () -> BoardsConfig.fromMap(options));
  }

  @Test
  void usersRemoveSuppressedNeedsFile() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("users"));
    options.put("action", "remove-suppressed");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> UsersConfig.fromMap(options));
    assertTrue(ex.getMessage().contains("file=PATH"));
  }

  @Test
  void usersConfigReadsSuppressedFileAndDryRun() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("users"));
    options.put("action", "Remove-Suppressed");
    options.put("file", tempDir.resolve("suppressed.txt").toString());
    options.put("dryRun", "true");

    UsersConfig config = UsersConfig.fromMap(options);

    assertEquals(UsersConfig.Action.REMOVE_SUPPRESSED, config.action());
    assertEquals(Optional.of(tempDir.resolve("suppressed.txt").toAbsolutePath().normalize()),
        config.suppressedFile());
    assertTrue(config.dryRun());
    assertEquals("CrossStitchItems", config.store().designsTable());
  }

  @Test
  void usersMarkVerifiedDoesNotNeedFile() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("users"));
    options.put("action", "mark-verified");

    UsersConfig config = UsersConfig.fromMap(options);

    assertEquals(UsersConfig.Action.MARK_VERIFIED, config.action());
    assertTrue(config.suppressedFile().isEmpty());
    assertFalse(config.dryRun());
  }
}
