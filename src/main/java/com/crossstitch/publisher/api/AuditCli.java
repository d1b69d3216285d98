package com.crossstitch.publisher.api;

import com.crossstitch.publisher.application.audit.MissingPdf;
import com.crossstitch.publisher.config.AuditConfig;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the missing-PDF audit.
 *
 * @since 0.1.0
 */
public final class AuditCli {
  private static final Logger log = LoggerFactory.getLogger(AuditCli.class);
  private static final String SUMMARY_USAGE = "usage: audit [report=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      Missing PDF audit

      Usage:
        audit report=missing-pdfs.txt

      Lists every catalogued design and the objects under pdfs/, then writes one
      designId,albumId line per design that lacks any expected PDF.

      Optional:
        report=PATH            Report file (default missing-pdfs.txt)
        aws.bucket=NAME        Bucket holding the PDFs
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private AuditCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CommandSupport.Prepared prepared =
        CommandSupport.prepare("audit", args, HELP_TEXT, SUMMARY_USAGE, Map.of(), log);
    if (prepared.finished()) {
      return prepared.exit();
    }

    AuditConfig config;
    try {
      config = AuditConfig.fromMap(prepared.config());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid audit arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return CommandSupport.execute("audit", prepared.metricsExporter(), log, root -> {
      List<MissingPdf> missing = root.pdfAudit(config).run(config.report());
      CliPrinter.println(missing.isEmpty()
          ? "All required PDFs are present."
          : missing.size() + " design(s) missing PDFs; see " + config.report());
      return ExitCode.SUCCESS;
    });
  }
}
