package com.crossstitch.publisher.domain.error;

import com.crossstitch.publisher.domain.fleet.VerificationResult;
import java.util.Objects;

/**
 * Raised when post-deploy verification ends in failure; blocks the notification campaign.
 *
 * @since 0.1.0
 */
public final class VerificationException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final transient VerificationResult result;

  public VerificationException(VerificationResult result) {
    super(ErrorKind.VERIFICATION, "Infrastructure verification failed: "
        + Objects.requireNonNull(result, "result").reason());
    this.result = result;
  }

  /**
   * Returns the terminal verification result.
   *
   * @return failed verification result
   */
  public VerificationResult result() {
    return result;
  }
}
