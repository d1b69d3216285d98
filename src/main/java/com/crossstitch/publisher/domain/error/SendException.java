package com.crossstitch.publisher.domain.error;

/**
 * Raised when a single email send fails; the remaining batch is abandoned.
 *
 * @since 0.1.0
 */
public final class SendException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String recipient;
  private final int sentBeforeFailure;

  public SendException(String recipient, int sentBeforeFailure, Throwable cause) {
    super(ErrorKind.SEND, "Send failed after " + sentBeforeFailure + " email(s)", cause);
    this.recipient = recipient;
    this.sentBeforeFailure = sentBeforeFailure;
  }

  /**
   * Returns the address whose send failed.
   *
   * @return recipient email address
   */
  public String recipient() {
    return recipient;
  }

  public int sentBeforeFailure() {
    return sentBeforeFailure;
  }
}
