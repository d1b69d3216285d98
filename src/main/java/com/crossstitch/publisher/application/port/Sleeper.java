package com.crossstitch.publisher.application.port;

/**
 * Pauses the calling thread between polling attempts; tests substitute a non-blocking variant.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Sleeps for the given duration.
   *
   * @param millis milliseconds to sleep; non-positive values return immediately
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = millis -> {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };
}
