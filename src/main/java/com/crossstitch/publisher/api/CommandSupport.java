package com.crossstitch.publisher.api;

import com.crossstitch.publisher.config.CompositionRoot;
import com.crossstitch.publisher.config.ConfigMerger;
import com.crossstitch.publisher.config.DefaultsForMode;
import com.crossstitch.publisher.config.YamlConfigLoader;
import com.crossstitch.publisher.domain.error.ConversionException;
import com.crossstitch.publisher.domain.error.PipelineException;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.domain.error.SendException;
import com.crossstitch.publisher.domain.error.UploadException;
import com.crossstitch.publisher.domain.error.VerificationException;
import com.crossstitch.publisher.infrastructure.progress.ProgressChannel;
import com.crossstitch.publisher.logging.LoggingConfigurator;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared plumbing for the publisher subcommands: argument parsing, YAML/CLI/default merging, telemetry setup,
 * and the mapping of failures to exit codes.
 */
final class CommandSupport {
  private static final int LOG_BODY_CHARS = 500;

  private CommandSupport() {
    // Utility class
  }

  /**
   * Outcome of argument and configuration processing.
   *
   * @param input parsed arguments
   * @param config effective configuration with telemetry keys removed; empty when {@code exit} is set
   * @param metricsExporter normalized exporter name
   * @param exit exit code to return immediately, or {@code null} to continue
   */
  record Prepared(CliInput input, Map<String, String> config, String metricsExporter, ExitCode exit) {
    boolean finished() {
      return exit != null;
    }
  }

  /**
   * Body of a command once its adapters are available.
   */
  @FunctionalInterface
  interface CommandBody {
    ExitCode run(CompositionRoot root) throws Exception;
  }

  /**
   * Parses arguments and builds the effective configuration for {@code mode}.
   *
   * @param mode command name
   * @param args raw command arguments
   * @param helpText full help text
   * @param usage one-line usage printed on argument errors
   * @param flagKeys switch flags copied into the configuration
   * @param log command logger
   * @return prepared configuration, or an exit code when processing must stop
   */
  static Prepared prepare(
      String mode, String[] args, String helpText, String usage, Map<String, String> flagKeys, Logger log) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return stop(input, ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return stop(input, ExitCode.INVALID_ARGS);
    }
    ConfigCliUtils.applyFlags(input, kv, flagKeys);

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return stop(input, ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return stop(input, ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return stop(input, ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    String exporter;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      exporter = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return stop(input, ExitCode.INVALID_ARGS);
    }
    return new Prepared(input, effective, exporter, null);
  }

  /**
   * Runs {@code body} with a composition root and a console progress channel, translating failures.
   *
   * @param command command name used in logs and the progress thread name
   * @param metricsExporter exporter chosen by {@link #prepare}
   * @param log command logger
   * @param body command body
   * @return exit code of the body, or the code mapped from its failure
   */
  static ExitCode execute(String command, String metricsExporter, Logger log, CommandBody body) {
    Objects.requireNonNull(body, "body");
    ProgressChannel progress = new ProgressChannel(command + "-progress", CliPrinter::println).start();
    try (CompositionRoot root = new CompositionRoot(CompositionRoot.metricsFor(metricsExporter), progress)) {
      return body.run(root);
    } catch (PipelineException ex) {
      ExitCode code = ExitCode.forFailure(ex);
      log.error("{} failed [{}{}]: {}{}", command, ex.kind(), ex.retryable() ? ", retryable" : "",
          ex.getMessage(), payload(ex), ex);
      return code;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", command, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure", command, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", command, ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeProgress(progress, log);
    }
  }

  static String payload(PipelineException ex) {
    if (ex instanceof PublishException publish) {
      return " (status " + publish.status() + ", body " + Logs.truncate(publish.body(), LOG_BODY_CHARS) + ")";
    }
    if (ex instanceof SendException send) {
      return " (recipient " + Logs.maskEmail(send.recipient()) + ", sent " + send.sentBeforeFailure() + ")";
    }
    if (ex instanceof ConversionException conversion) {
      return " (exit " + conversion.exitCode() + ", output " + Logs.truncate(conversion.output(), LOG_BODY_CHARS)
          + ")";
    }
    if (ex instanceof UploadException upload) {
      return " (key " + upload.key() + ")";
    }
    if (ex instanceof VerificationException verification) {
      return " (instances " + verification.result().instanceIds() + ")";
    }
    return "";
  }

  private static void closeProgress(ProgressChannel progress, Logger log) {
    try {
      progress.close();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while flushing progress output", ex);
    }
  }

  private static Prepared stop(CliInput input, ExitCode exit) {
    return new Prepared(input, Map.of(), "none", exit);
  }
}
