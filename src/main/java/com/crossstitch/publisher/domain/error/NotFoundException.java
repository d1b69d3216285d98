package com.crossstitch.publisher.domain.error;

/**
 * Raised when an expected input such as a batch file or catalog entry does not exist.
 *
 * @since 0.1.0
 */
public final class NotFoundException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
