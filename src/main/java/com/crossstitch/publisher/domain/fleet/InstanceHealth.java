package com.crossstitch.publisher.domain.fleet;

import java.util.Objects;

/**
 * Status snapshot of one instance.
 *
 * @param instanceId provider instance id
 * @param state lifecycle state
 * @param instanceStatus instance reachability check
 * @param systemStatus system reachability check
 * @since 0.1.0
 */
public record InstanceHealth(
    String instanceId, InstanceState state, StatusCheck instanceStatus, StatusCheck systemStatus) {

  public InstanceHealth {
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(instanceStatus, "instanceStatus");
    Objects.requireNonNull(systemStatus, "systemStatus");
  }

  /**
   * An instance is healthy when it is running and both status checks report OK.
   *
   * @return {@code true} when healthy
   */
  public boolean healthy() {
    return state == InstanceState.RUNNING
        && instanceStatus == StatusCheck.OK
        && systemStatus == StatusCheck.OK;
  }

  public static InstanceHealth unknown(String instanceId) {
    return new InstanceHealth(instanceId, InstanceState.UNKNOWN, StatusCheck.UNKNOWN, StatusCheck.UNKNOWN);
  }
}
