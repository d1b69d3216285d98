package com.crossstitch.publisher.domain.error;

/**
 * Classifies pipeline failures so the orchestrator can tell transient faults from fatal ones.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Missing or malformed setting or secret; raised before side effects. */
  CONFIGURATION(false),
  /** An expected entity (instances, board, CSV row, batch file) does not exist. */
  NOT_FOUND(false),
  /** The external converter exited abnormally or produced no output. */
  CONVERSION(false),
  /** Object storage rejected or failed an upload. */
  UPLOAD(true),
  /** The pinboard API answered with a non-success status. */
  PUBLISH(false),
  /** Reboot or health state was not reached within the polling budget. */
  VERIFICATION(false),
  /** The email provider failed a single send. */
  SEND(true),
  /** The item store failed a read or write. */
  STORE(true);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  /**
   * Indicates whether a later re-run of the failed stage may succeed without operator changes.
   *
   * @return {@code true} for transient failures
   */
  public boolean retryable() {
    return retryable;
  }
}
