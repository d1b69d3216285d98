package com.crossstitch.publisher.domain.error;

/**
 * Raised when object storage fails an artifact upload. Already uploaded artifacts are left in place.
 *
 * @since 0.1.0
 */
public final class UploadException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String key;

  public UploadException(String key, Throwable cause) {
    super(ErrorKind.UPLOAD, "Upload failed for " + key, cause);
    this.key = key;
  }

  /**
   * Returns the object key whose upload failed.
   *
   * @return storage key
   */
  public String key() {
    return key;
  }
}
