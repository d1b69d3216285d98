package com.crossstitch.publisher.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the missing-PDF {@code audit} command.
 *
 * @param report file the audit report is written to
 * @param store storage settings
 * @since 0.1.0
 */
public record AuditConfig(Path report, StoreConfig store) {
  public static final String DEFAULT_REPORT = "missing-pdfs.txt";

  public AuditConfig {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(store, "store");
  }

  public static AuditConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path report = ConfigValues.path(options, "report")
        .orElse(ConfigValues.toPath("report", DEFAULT_REPORT));
    return new AuditConfig(report, StoreConfig.fromMap(options));
  }
}
