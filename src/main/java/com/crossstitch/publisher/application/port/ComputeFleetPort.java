package com.crossstitch.publisher.application.port;

import com.crossstitch.publisher.domain.fleet.FleetInstance;
import com.crossstitch.publisher.domain.fleet.InstanceHealth;
import com.crossstitch.publisher.domain.fleet.InstanceState;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port over the compute fleet API used for post-deploy verification.
 * <p><strong>Role:</strong> Implemented by {@code Ec2ComputeFleetAdapter}; driven by {@code InfraVerifier}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the verifier polls one instance per
 * worker thread.</p>
 *
 * @since 0.1.0
 */
public interface ComputeFleetPort {
  /**
   * Finds instances carrying the given tag, excluding stopped and terminated ones.
   *
   * @param tagName tag key, typically {@code Name}
   * @param tagValue tag value
   * @return matching instances; empty when none match
   * @throws IOException if the lookup fails
   */
  List<FleetInstance> findByTag(String tagName, String tagValue) throws IOException;

  /**
   * Requests a reboot of every listed instance in one call.
   *
   * @param instanceIds instance ids; never empty
   * @throws IOException if the request fails
   */
  void reboot(List<String> instanceIds) throws IOException;

  /**
   * Reads the current lifecycle state of one instance.
   *
   * @param instanceId instance id
   * @return current state, {@link InstanceState#UNKNOWN} when not reported
   * @throws IOException if the request fails
   */
  InstanceState describeState(String instanceId) throws IOException;

  /**
   * Reads state and both reachability checks of one instance.
   *
   * @param instanceId instance id
   * @return health snapshot
   * @throws IOException if the request fails
   */
  InstanceHealth describeHealth(String instanceId) throws IOException;
}
