package com.crossstitch.publisher.application.artifact;

import com.crossstitch.publisher.application.port.ProcessRunner;
import com.crossstitch.publisher.application.port.ProcessRunner.ProcessResult;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.ConversionException;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the external PDF converter over each source variant.
 * <p><strong>Role:</strong> First side-effecting stage of a publish; every variant is converted before any
 * upload starts.</p>
 * <p><strong>Contract:</strong> {@code <converter> <input>} must exit 0 and leave {@code <name>.converted.pdf}
 * next to the input.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactConverter {
  private static final Logger log = LoggerFactory.getLogger(ArtifactConverter.class);
  private static final int MAX_LOGGED_OUTPUT = 2_000;

  private final ProcessRunner runner;
  private final Path converterPath;
  private final Duration timeout;

  /**
   * Creates a converter.
   *
   * @param runner process runner
   * @param converterPath converter executable
   * @param timeout per-conversion timeout; {@link Duration#ZERO} disables it
   */
  public ArtifactConverter(ProcessRunner runner, Path converterPath, Duration timeout) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.converterPath = Objects.requireNonNull(converterPath, "converterPath");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Converts one input file.
   *
   * @param input source PDF
   * @return path of the converted PDF
   * @throws ConfigurationException if the converter executable does not exist
   * @throws ConversionException if the input is missing, the converter fails or times out, or no output appears
   * @throws InterruptedException if interrupted while waiting for the converter
   */
  public Path convert(Path input) throws ConfigurationException, ConversionException, InterruptedException {
    if (input == null || !Files.isRegularFile(input)) {
      throw new ConversionException("Input PDF not found: " + input, -1, "");
    }
    requireConverter();
    Path output = outputPathFor(input);
    String inputName = input.getFileName().toString();
    ProcessResult result;
    try {
      Path workingDir = input.toAbsolutePath().getParent();
      result = runner.run(List.of(converterPath.toString(), input.toString()), workingDir, timeout);
    } catch (IOException ex) {
      throw new ConversionException("Failed to start converter for " + inputName + ": " + ex.getMessage(), -1, "");
    }
    if (result.timedOut()) {
      throw new ConversionException(
          "Converter timed out for " + inputName + " after " + timeout.toSeconds() + "s", -1,
          result.diagnosticOutput());
    }
    if (result.exitCode() != 0) {
      String details = result.diagnosticOutput();
      log.debug("Converter output for {}: {}", inputName, Logs.truncate(details, MAX_LOGGED_OUTPUT));
      throw new ConversionException(
          ("Converter failed for " + inputName + " (exit " + result.exitCode() + "). " + details).trim(),
          result.exitCode(),
          details);
    }
    if (!Files.isRegularFile(output)) {
      throw new ConversionException(
          "Converter did not produce expected output: " + output, 0, result.diagnosticOutput());
    }
    log.info("Converted {} -> {}", inputName, output.getFileName());
    return output;
  }

  /**
   * Checks that the converter executable exists.
   *
   * @throws ConfigurationException if it does not
   */
  public void requireConverter() throws ConfigurationException {
    if (!Files.isRegularFile(converterPath)) {
      throw new ConfigurationException("Converter not found: " + converterPath);
    }
  }

  /**
   * Converts every variant, stopping at the first failure.
   *
   * @param variants source PDF per variant id, in upload order
   * @return converted PDF per variant id, in the same order
   * @throws ConfigurationException if the converter executable does not exist
   * @throws ConversionException if any conversion fails
   * @throws InterruptedException if interrupted while waiting for the converter
   */
  public Map<String, Path> convertAll(Map<String, Path> variants)
      throws ConfigurationException, ConversionException, InterruptedException {
    Map<String, Path> converted = new LinkedHashMap<>();
    for (Map.Entry<String, Path> entry : variants.entrySet()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Conversion interrupted");
      }
      converted.put(entry.getKey(), convert(entry.getValue()));
    }
    return converted;
  }

  static Path outputPathFor(Path input) {
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return input.resolveSibling(stem + ".converted.pdf");
  }
}
