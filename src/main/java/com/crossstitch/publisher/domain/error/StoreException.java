package com.crossstitch.publisher.domain.error;

/**
 * Raised when the item store fails a query, scan, or write issued by the pipeline.
 *
 * @since 0.1.0
 */
public final class StoreException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public StoreException(String message, Throwable cause) {
    super(ErrorKind.STORE, message, cause);
  }
}
