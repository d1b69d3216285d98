package com.crossstitch.publisher.api;

import com.crossstitch.publisher.application.users.MaintenanceReport;
import com.crossstitch.publisher.application.users.SuppressionReport;
import com.crossstitch.publisher.application.users.UserMaintenanceUseCase;
import com.crossstitch.publisher.config.UsersConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for one-off users maintenance.
 *
 * @since 0.1.0
 */
public final class UsersCli {
  private static final Logger log = LoggerFactory.getLogger(UsersCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of("--dry-run", "dryRun");
  private static final String SUMMARY_USAGE = "usage: users action=init-unsubscribe|init-cid|init-items-cid|"
      + "mark-verified|remove-suppressed [file=PATH] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      Users maintenance

      Usage:
        users action=init-unsubscribe
        users action=init-cid
        users action=init-items-cid
        users action=mark-verified
        users action=remove-suppressed file=suppressed.txt [--dry-run]

      Actions:
        init-unsubscribe   Give every user without one a random UnsubscribeToken and Unsubscribed=false
        init-cid           Give every user without one a random 32-hex cid
        init-items-cid     Same as init-cid for the USR# items of the designs table
        mark-verified      Set Verified=true and VerifiedAt=CreatedAt on every user not yet verified
        remove-suppressed  Delete the USR# items of every email in the suppression list
                           (one entry per three lines, email first)

      Optional:
        store.usersTable=NAME    Users table (default CrossStitchUsers)
        store.designsTable=NAME  Designs table holding USR# items (default CrossStitchItems)
        --dry-run                remove-suppressed only: count what would be deleted
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private UsersCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("users", args, HELP_TEXT, SUMMARY_USAGE, FLAG_KEYS, log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    UsersConfig config;
    try {
      config = UsersConfig.fromMap(prepared.config());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid users arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return CommandSupport.execute("users", prepared.metricsExporter(), log, root -> {
      UserMaintenanceUseCase useCase = root.userMaintenance(config);
      return switch (config.action()) {
        case INIT_UNSUBSCRIBE -> printed(useCase.initUnsubscribeFields());
        case INIT_CID -> printed(useCase.initCidFields());
        case INIT_ITEMS_CID -> printed(useCase.initItemsCidFields(config.store().designsTable()));
        case MARK_VERIFIED -> printed(useCase.markVerified());
        case REMOVE_SUPPRESSED -> removeSuppressed(useCase, config);
      };
    });
  }

  private static ExitCode removeSuppressed(UserMaintenanceUseCase useCase, UsersConfig config) throws IOException {
    Path file = config.suppressedFile().orElseThrow();
    List<String> emails = UserMaintenanceUseCase.readSuppressedEmails(file);
    CliPrinter.println("Read " + emails.size() + " suppressed email(s) from " + file);
    SuppressionReport report = useCase.removeSuppressed(emails, config.store().designsTable(), config.dryRun());
    CliPrinter.println((report.dryRun() ? "Would delete " : "Deleted ") + report.deleted()
        + ", no user item " + report.missing() + ", without NPage " + report.missingSortKey()
        + ", errors " + report.errors());
    return report.errors() == 0 ? ExitCode.SUCCESS : ExitCode.IO_ERROR;
  }

  private static ExitCode printed(MaintenanceReport report) {
    CliPrinter.println("Scanned " + report.scanned() + ", updated " + report.updated()
        + ", already set " + report.skipped() + ", incomplete " + report.incomplete()
        + ", errors " + report.errors());
    return report.errors() == 0 ? ExitCode.SUCCESS : ExitCode.IO_ERROR;
  }
}
