package com.crossstitch.publisher.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program and captures its output.
 *
 * @since 0.1.0
 */
public interface ProcessRunner {
  /**
   * Runs a command to completion.
   *
   * @param command program followed by its arguments
   * @param workingDirectory working directory for the child process
   * @param timeout maximum run time; {@link Duration#ZERO} waits indefinitely
   * @return exit status and captured output
   * @throws IOException if the program cannot be started
   * @throws InterruptedException if interrupted while waiting
   */
  ProcessResult run(List<String> command, Path workingDirectory, Duration timeout)
      throws IOException, InterruptedException;

  /**
   * Outcome of a process run.
   *
   * @param exitCode process exit code; {@code -1} when the process timed out
   * @param stdout captured standard output
   * @param stderr captured standard error
   * @param timedOut {@code true} when the process was destroyed after the timeout elapsed
   */
  record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {
    public ProcessResult {
      stdout = stdout == null ? "" : stdout;
      stderr = stderr == null ? "" : stderr;
    }

    /**
     * Returns stderr when present, otherwise stdout.
     *
     * @return diagnostic output
     */
    public String diagnosticOutput() {
      return stderr.isBlank() ? stdout : stderr;
    }
  }
}
