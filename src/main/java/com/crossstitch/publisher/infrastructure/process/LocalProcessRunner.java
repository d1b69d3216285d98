package com.crossstitch.publisher.infrastructure.process;

import com.crossstitch.publisher.application.port.ProcessRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} that starts a local child process with {@link ProcessBuilder}.
 *
 * <p>Output streams are redirected to temporary files so a chatty child can never block on a full pipe. A child
 * still running when the timeout elapses is destroyed forcibly and reported with {@code timedOut=true}.</p>
 *
 * @since 0.1.0
 */
public final class LocalProcessRunner implements ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(LocalProcessRunner.class);
  private static final long DESTROY_WAIT_SECONDS = 5;

  @Override
  public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout)
      throws IOException, InterruptedException {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    Path stdout = Files.createTempFile("publisher-proc-", ".out");
    Path stderr = Files.createTempFile("publisher-proc-", ".err");
    try {
      ProcessBuilder builder = new ProcessBuilder(command)
          .directory(workingDirectory.toFile())
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile());
      log.debug("Starting {} in {}", command, workingDirectory);
      Process process = builder.start();
      boolean finished;
      try {
        finished = waitFor(process, timeout);
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(DESTROY_WAIT_SECONDS, TimeUnit.SECONDS);
        log.warn("{} exceeded {}s and was destroyed", command.get(0), timeout.toSeconds());
        return new ProcessResult(-1, read(stdout), read(stderr), true);
      }
      return new ProcessResult(process.exitValue(), read(stdout), read(stderr), false);
    } finally {
      cleanup(stdout);
      cleanup(stderr);
    }
  }

  private static boolean waitFor(Process process, Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) {
      process.waitFor();
      return true;
    }
    return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static String read(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  private static void cleanup(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Could not delete temporary process output {}", file, ex);
    }
  }
}
