package com.crossstitch.publisher.testing;

import com.crossstitch.publisher.application.port.ProgressSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Progress sink that keeps every reported line; safe for worker threads. */
public final class RecordingProgress implements ProgressSink {
  private final List<String> lines = new CopyOnWriteArrayList<>();

  @Override
  public void report(String message) {
    lines.add(message);
  }

  public List<String> lines() {
    return List.copyOf(lines);
  }

  public boolean anyContains(String fragment) {
    return lines.stream().anyMatch(line -> line.contains(fragment));
  }
}
