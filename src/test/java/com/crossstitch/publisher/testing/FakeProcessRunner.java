package com.crossstitch.publisher.testing;

import com.crossstitch.publisher.application.port.ProcessRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Converter double: writes {@code <stem>.converted.pdf} next to the input like the real tool, unless told to fail.
 */
public final class FakeProcessRunner implements ProcessRunner {
  private final List<List<String>> invocations = new ArrayList<>();
  private int exitCode;
  private boolean timedOut;
  private boolean produceOutput = true;
  private String stderr = "";

  public FakeProcessRunner failWith(int code, String errorOutput) {
    this.exitCode = code;
    this.stderr = errorOutput;
    return this;
  }

  public FakeProcessRunner timeOut() {
    this.timedOut = true;
    return this;
  }

  public FakeProcessRunner withoutOutput() {
    this.produceOutput = false;
    return this;
  }

  @Override
  public ProcessResult run(List<String> command, Path workingDirectory, Duration timeout) throws IOException {
    invocations.add(List.copyOf(command));
    if (timedOut) {
      return new ProcessResult(-1, "", "", true);
    }
    if (exitCode == 0 && produceOutput) {
      Path input = Path.of(command.get(command.size() - 1));
      String name = input.getFileName().toString();
      String stem = name.substring(0, name.lastIndexOf('.'));
      Files.writeString(input.resolveSibling(stem + ".converted.pdf"), "converted " + name,
          StandardCharsets.UTF_8);
    }
    return new ProcessResult(exitCode, "ok", stderr, false);
  }

  public List<List<String>> invocations() {
    return List.copyOf(invocations);
  }
}
