package com.crossstitch.publisher.domain.error;

/**
 * Raised when the pinboard API answers with a non-success status.
 *
 * @since 0.1.0
 */
public final class PublishException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final int status;
  private final String body;

  /**
   * Creates a publish failure.
   *
   * @param operation short description of the API call (for example {@code "create pin"})
   * @param status HTTP status returned by the API; 0 when the API could not be reached
   * @param body response body as returned by the API
   */
  public PublishException(String operation, int status, String body) {
    super(ErrorKind.PUBLISH, status == 0
        ? operation + " failed: " + body
        : operation + " failed with HTTP " + status);
    this.status = status;
    this.body = body == null ? "" : body;
  }

  public int status() {
    return status;
  }

  public String body() {
    return body;
  }

  /** Transport errors, throttling and server-side failures may succeed on a later run. */
  @Override
  public boolean retryable() {
    return status == 0 || status == 429 || status >= 500;
  }
}
