package com.crossstitch.publisher.api;

import com.crossstitch.publisher.application.campaign.CampaignReport;
import com.crossstitch.publisher.config.BroadcastConfig;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the text-only broadcast to every verified, subscribed user.
 *
 * @since 0.1.0
 */
public final class CampaignCli {
  private static final Logger log = LoggerFactory.getLogger(CampaignCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of("--dry-run", "dryRun");
  private static final String SUMMARY_USAGE =
      "usage: campaign [config=PATH] campaign.broadcastSubject=TEXT campaign.broadcastBody=TEXT [--dry-run]";
  private static final String HELP_TEXT = """
      Text broadcast campaign

      Usage:
        campaign config=publisher.yaml [options]

      Required (CLI or YAML):
        campaign.sender=EMAIL           Verified sender address
        campaign.broadcastSubject=TEXT  Subject line
        campaign.broadcastBody=TEXT     Plain-text body; blank lines separate paragraphs
        unsubscribe.secret=SECRET       HMAC secret shared with the unsubscribe endpoint

      Optional:
        campaign.adminEmail=EMAIL       Receives the first copy; skipped in the user loop
        campaign.progressEvery=N        Progress line every N sends (default 50)
        --dry-run                       Print the resolved settings without sending
        metricsExporter=otlp|none       Configure metrics exporter (default otlp)
        --verbose                       Enable DEBUG logging
        --help                          Show this message
      """;

  private CampaignCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("campaign", args, HELP_TEXT, SUMMARY_USAGE, FLAG_KEYS, log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    BroadcastConfig config;
    try {
      config = BroadcastConfig.fromMap(prepared.config());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid campaign configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (config.dryRun()) {
      CliPrinter.printLines(
          "Campaign dry-run: no email will be sent.",
          " Users table    : " + config.campaign().users().table(),
          " Sender         : " + config.campaign().settings().sender(),
          " Admin copy     : " + config.campaign().settings().adminEmail().orElse("<none>"),
          " Subject        : " + config.campaign().settings().broadcastSubject(),
          " Body length    : " + config.campaign().settings().broadcastBody().length(),
          " Re-run without --dry-run to send.");
      return ExitCode.SUCCESS;
    }

    return CommandSupport.execute("campaign", prepared.metricsExporter(), log, root -> {
      CampaignReport report = root.broadcastCampaign(config).broadcast();
      CliPrinter.println("Broadcast sent to " + report.sent() + " user(s)"
          + (report.adminSent() ? " plus the admin copy" : "") + ".");
      if (report.lastEmailDateFailures() > 0) {
        log.warn("{} LastEmailDate update(s) failed", report.lastEmailDateFailures());
      }
      return ExitCode.SUCCESS;
    });
  }
}
