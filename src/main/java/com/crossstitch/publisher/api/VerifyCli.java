package com.crossstitch.publisher.api;

import com.crossstitch.publisher.config.StoreConfig;
import com.crossstitch.publisher.config.VerifyConfig;
import com.crossstitch.publisher.domain.fleet.InstanceHealth;
import com.crossstitch.publisher.domain.fleet.VerificationResult;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that only reboots and verifies the web fleet.
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final String SUMMARY_USAGE =
      "usage: verify [config=PATH] [verify.environmentName=NAME] [verify.pollIntervalMillis=MS] "
          + "[verify.maxAttempts=N] [aws.region=REGION]";
  private static final String HELP_TEXT = """
      Infrastructure verification

      Usage:
        verify [options]

      Reboots every instance tagged Name=<verify.environmentName>, waits until each is running,
      then checks instance and system status. Exit code 0 only when all instances are healthy.

      Optional:
        verify.environmentName=NAME  Name tag value (default cross-stitch-env)
        verify.pollIntervalMillis=MS Poll interval (default 5000)
        verify.maxAttempts=N         Polls per instance before giving up (default 60)
        aws.region=REGION            AWS region (default us-east-1)
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private VerifyCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("verify", args, HELP_TEXT, SUMMARY_USAGE, Map.of(), log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    VerifyConfig config;
    try {
      config = VerifyConfig.fromMap(prepared.config(), StoreConfig.fromMap(prepared.config()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid verify configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    return CommandSupport.execute("verify", prepared.metricsExporter(), log, root -> {
      VerificationResult result = root.infraVerifier(config).verify();
      for (InstanceHealth health : result.health()) {
        CliPrinter.println(" " + health);
      }
      CliPrinter.println((result.success() ? "Verification passed: " : "Verification failed: ") + result.reason());
      return result.success() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    });
  }
}
