package com.crossstitch.publisher.domain.error;

/**
 * Raised when the external converter exits abnormally, times out, or leaves no output file.
 *
 * @since 0.1.0
 */
public final class ConversionException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final int exitCode;
  private final String output;

  /**
   * Creates a conversion failure.
   *
   * @param message diagnostic message naming the input file
   * @param exitCode converter exit code; {@code -1} when the process never exited normally
   * @param output captured stderr, or stdout when stderr was empty
   */
  public ConversionException(String message, int exitCode, String output) {
    super(ErrorKind.CONVERSION, message);
    this.exitCode = exitCode;
    this.output = output == null ? "" : output;
  }

  public int exitCode() {
    return exitCode;
  }

  public String output() {
    return output;
  }
}
