package com.crossstitch.publisher.application.port;

/**
 * Receives human readable progress messages from long running stages.
 *
 * <p>Implementations must tolerate calls from several threads at once; the verifier reports from its
 * polling workers.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProgressSink {
  /**
   * Publishes one progress message.
   *
   * @param message message text; never {@code null}
   */
  void report(String message);

  /** Sink that discards every message. */
  ProgressSink NO_OP = message -> {};
}
