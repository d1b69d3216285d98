package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.pipeline.PublishOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Everything the {@code publish} command needs: the batch folder, run switches and the
 * settings of every collaborator the pipeline touches.
 * <p><strong>Role:</strong> Typed view of the merged {@code publish} configuration consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Validation:</strong> the batch folder must exist; campaign settings (sender, unsubscribe secret) are
 * only required when the campaign stage will run.</p>
 *
 * @param batchFolder folder holding the design files
 * @param options run switches
 * @param store storage settings
 * @param site public URL settings
 * @param pinterest pinboard settings
 * @param converter converter process settings
 * @param verify verification settings
 * @param campaign campaign settings; {@code null} when the campaign is skipped or in a dry run
 * @since 0.1.0
 */
public record PublishConfig(
    Path batchFolder,
    PublishOptions options,
    StoreConfig store,
    SiteConfig site,
    PinterestConfig pinterest,
    ConverterConfig converter,
    VerifyConfig verify,
    CampaignConfig campaign) {

  public PublishConfig {
    Objects.requireNonNull(batchFolder, "batchFolder");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(site, "site");
    Objects.requireNonNull(pinterest, "pinterest");
    Objects.requireNonNull(converter, "converter");
    Objects.requireNonNull(verify, "verify");
  }

  /**
   * Builds the publish configuration.
   *
   * @param options effective configuration
   * @return typed configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static PublishConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path batch = ConfigValues.path(options, "batch")
        .orElseThrow(() -> new IllegalArgumentException("batch is required"));
    if (!Files.isDirectory(batch)) {
      throw new IllegalArgumentException("batch folder does not exist: " + batch);
    }
    PublishOptions switches = new PublishOptions(
        ConfigValues.bool(options, "dryRun", false),
        ConfigValues.bool(options, "skipVerify", false),
        ConfigValues.bool(options, "skipCampaign", false));
    StoreConfig store = StoreConfig.fromMap(options);
    CampaignConfig campaign = switches.skipCampaign() || switches.dryRun()
        ? null
        : CampaignConfig.fromMap(options, store);
    return new PublishConfig(
        batch,
        switches,
        store,
        SiteConfig.fromMap(options, store),
        PinterestConfig.fromMap(options),
        ConverterConfig.fromMap(options),
        VerifyConfig.fromMap(options, store),
        campaign);
  }

  /**
   * Lines printed for {@code --dry-run}.
   *
   * @return human-readable summary with secrets hidden
   */
  public List<String> describe() {
    List<String> lines = new ArrayList<>();
    lines.add("batch=" + batchFolder);
    lines.add("options=" + options);
    lines.add("store=" + store);
    lines.add("site=" + site);
    lines.add("pinterest=" + pinterest.describe());
    lines.add("converter=" + converter);
    lines.add("verify=" + verify);
    lines.add("campaign=" + (campaign == null ? "skipped" : campaign.toString()));
    return lines;
  }
}
