package com.crossstitch.publisher.api;

import com.crossstitch.publisher.domain.error.PipelineException;

/**
 * <strong>What:</strong> Canonical exit codes shared by the publisher commands.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points; scripts that chain a publish and a
 * campaign run branch on these values.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Storage, upload or file failure. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** A pipeline stage failed for any other reason. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a pipeline failure to the exit code reported for it.
   *
   * @param failure failure raised by a use case
   * @return {@link #CONFIG_ERROR} for configuration failures, {@link #IO_ERROR} for upload, store and missing-input
   *     failures, otherwise {@link #RUNTIME_FAILURE}
   */
  public static ExitCode forFailure(PipelineException failure) {
    return switch (failure.kind()) {
      case CONFIGURATION -> CONFIG_ERROR;
      case UPLOAD, STORE, NOT_FOUND -> IO_ERROR;
      case CONVERSION, PUBLISH, VERIFICATION, SEND -> RUNTIME_FAILURE;
    };
  }
}
