package com.crossstitch.publisher.api;

import com.crossstitch.publisher.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: publisher <publish|campaign|verify|boards|users|audit> [options]";
  private static final String HELP_TEXT = """
      Cross-stitch design publisher

      Usage:
        publisher <command> [key=value ...] [--flags]

      Commands:
        publish     Convert, upload, pin and catalog a design batch, then notify users
        campaign    Send the text broadcast to verified, subscribed users
        verify      Reboot the web fleet and wait until it is healthy
        boards      Create or rename pinboards (boards --help for details)
        users       Fill in missing unsubscribe tokens or cid values
        audit       Report designs whose PDFs are missing from storage

      Global options:
        config=PATH                YAML file with a common section and one section per command
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --help                     Show this message
        --verbose                  Enable DEBUG logging before dispatching to the subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher; args={}", Arrays.toString(delegateArgs));
    }

    return switch (command) {
      case "publish" -> PublishCli.run(delegateArgs);
      case "campaign" -> CampaignCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      case "boards" -> BoardsCli.run(delegateArgs);
      case "users" -> UsersCli.run(delegateArgs);
      case "audit" -> AuditCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (arg.isEmpty() || arg.startsWith("-") || arg.contains("=")) {
        continue;
      }
      if (arg.equalsIgnoreCase("help")) {
        continue;
      }
      return i;
    }
    return -1;
  }
}
