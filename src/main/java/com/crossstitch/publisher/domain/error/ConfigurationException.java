package com.crossstitch.publisher.domain.error;

/**
 * Raised when a required setting or secret is missing or malformed.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
