package com.crossstitch.publisher.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Base checked exception for every failure raised by the publish pipeline.
 * <p><strong>Role:</strong> Carries an {@link ErrorKind} tag and a diagnostic payload up to the CLI, which
 * turns it into an exit code and an operator-facing log line.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public class PipelineException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Creates a pipeline exception without an underlying cause.
   *
   * @param kind failure classification; must not be {@code null}
   * @param message diagnostic message
   */
  public PipelineException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates a pipeline exception wrapping an underlying cause.
   *
   * @param kind failure classification; must not be {@code null}
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public PipelineException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure classification.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Indicates whether re-running the failed stage may succeed.
   *
   * @return {@code true} for transient failures
   */
  public boolean retryable() {
    return kind.retryable();
  }
}
