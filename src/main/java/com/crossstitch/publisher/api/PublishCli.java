package com.crossstitch.publisher.api;

import com.crossstitch.publisher.application.pipeline.PublishDesignUseCase;
import com.crossstitch.publisher.application.pipeline.PublishOutcome;
import com.crossstitch.publisher.config.PublishConfig;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for publishing one design batch end to end.
 *
 * @since 0.1.0
 */
public final class PublishCli {
  private static final Logger log = LoggerFactory.getLogger(PublishCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--dry-run", "dryRun",
      "--skip-verify", "skipVerify",
      "--skip-campaign", "skipCampaign");
  private static final String SUMMARY_USAGE =
      "usage: publish batch=DIR [config=PATH] [--dry-run] [--skip-verify] [--skip-campaign] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Design publish pipeline

      Usage:
        publish batch=./incoming/0007-cats [options]

      Required:
        batch=DIR                 Folder with the chart, PDF variants, photo and pattern.json

      Optional:
        config=PATH               YAML configuration (common + publish sections)
        sequenceMode=atomic|legacy  DesignID allocation strategy (default atomic)
        converter.path=PATH       Converter executable (default ./Converter)
        pinterest.boardsCsv=PATH  Album to board mapping (default AlbumBoards.csv)
        verify.environmentName=N  Name tag of the web fleet; blank disables verification
        --dry-run                 Read the batch and print the plan; nothing is uploaded or sent
        --skip-verify             Do not reboot and verify the web fleet
        --skip-campaign           Do not send the notification emails
        metricsExporter=otlp|none Configure metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Stages run in order: allocate, convert, upload, pin, catalog, verify, campaign.
        The campaign only runs after a successful verification.
      """;

  private PublishCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the publish command.
   *
   * @param args command arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("publish", args, HELP_TEXT, SUMMARY_USAGE, FLAG_KEYS, log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    PublishConfig config;
    try {
      config = PublishConfig.fromMap(prepared.config());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid publish configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (config.options().dryRun()) {
      CliPrinter.println("Publish dry-run: nothing will be uploaded, pinned, catalogued or sent.");
      CliPrinter.printLines(config.describe());
    }

    return CommandSupport.execute("publish", prepared.metricsExporter(), log, root -> {
      log.info("Publishing batch {} (sequenceMode={}, metricsExporter={})",
          config.batchFolder(), config.store().sequenceMode(), prepared.metricsExporter());
      PublishDesignUseCase useCase = root.publishUseCase(config);
      PublishOutcome outcome = useCase.execute(config.batchFolder(), config.options());
      if (outcome.dryRun()) {
        CliPrinter.println("Dry run complete. Re-run without --dry-run to publish.");
      } else {
        outcome.record().ifPresent(record -> CliPrinter.println(
            "Published DesignID " + record.designId() + " as page " + record.nPage()
                + " of album " + record.albumId()));
      }
      return ExitCode.SUCCESS;
    });
  }
}
