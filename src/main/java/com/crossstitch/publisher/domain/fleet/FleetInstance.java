package com.crossstitch.publisher.domain.fleet;

import java.util.Objects;

/**
 * Instance returned by a tag lookup.
 *
 * @param instanceId provider instance id
 * @param state state at lookup time
 * @since 0.1.0
 */
public record FleetInstance(String instanceId, InstanceState state) {
  public FleetInstance {
    if (instanceId == null || instanceId.isBlank()) {
      throw new IllegalArgumentException("instanceId must not be blank");
    }
    Objects.requireNonNull(state, "state");
  }
}
