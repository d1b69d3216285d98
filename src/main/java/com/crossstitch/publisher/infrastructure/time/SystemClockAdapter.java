package com.crossstitch.publisher.infrastructure.time;

import com.crossstitch.publisher.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Campaign dates derived from this value are evaluated in UTC.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
