package com.crossstitch.publisher.infrastructure.aws;

import com.crossstitch.publisher.application.port.ComputeFleetPort;
import com.crossstitch.publisher.domain.fleet.FleetInstance;
import com.crossstitch.publisher.domain.fleet.InstanceHealth;
import com.crossstitch.publisher.domain.fleet.InstanceState;
import com.crossstitch.publisher.domain.fleet.StatusCheck;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstanceStatusRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstanceStatusResponse;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStatus;
import software.amazon.awssdk.services.ec2.model.InstanceStatusSummary;
import software.amazon.awssdk.services.ec2.model.RebootInstancesRequest;
import software.amazon.awssdk.services.ec2.model.Reservation;

/**
 * {@link ComputeFleetPort} backed by the EC2 API.
 *
 * <p>Lookups page through every reservation. Stopped and terminated instances are dropped from
 * {@link #findByTag(String, String)}. SDK failures surface as {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public final class Ec2ComputeFleetAdapter implements ComputeFleetPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Ec2ComputeFleetAdapter.class);

  private final Ec2Client client;

  public Ec2ComputeFleetAdapter(String region) {
    this(Ec2Client.builder().region(Region.of(region)).build());
  }

  public Ec2ComputeFleetAdapter(Ec2Client client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public List<FleetInstance> findByTag(String tagName, String tagValue) throws IOException {
    DescribeInstancesRequest request = DescribeInstancesRequest.builder()
        .filters(Filter.builder().name("tag:" + tagName).values(tagValue).build())
        .build();
    List<FleetInstance> instances = new ArrayList<>();
    try {
      for (DescribeInstancesResponse page : client.describeInstancesPaginator(request)) {
        for (Reservation reservation : page.reservations()) {
          for (Instance instance : reservation.instances()) {
            InstanceState state = stateOf(instance);
            if (state.isRebootable()) {
              instances.add(new FleetInstance(instance.instanceId(), state));
            }
          }
        }
      }
    } catch (SdkException ex) {
      throw new IOException("EC2 lookup for tag " + tagName + "=" + tagValue + " failed: " + ex.getMessage(), ex);
    }
    log.debug("Found {} instance(s) tagged {}={}", instances.size(), tagName, tagValue);
    return instances;
  }

  @Override
  public void reboot(List<String> instanceIds) throws IOException {
    try {
      client.rebootInstances(RebootInstancesRequest.builder().instanceIds(instanceIds).build());
    } catch (SdkException ex) {
      throw new IOException("EC2 reboot of " + instanceIds + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public InstanceState describeState(String instanceId) throws IOException {
    DescribeInstancesRequest request = DescribeInstancesRequest.builder().instanceIds(instanceId).build();
    try {
      DescribeInstancesResponse response = client.describeInstances(request);
      return response.reservations().stream()
          .flatMap(reservation -> reservation.instances().stream())
          .findFirst()
          .map(Ec2ComputeFleetAdapter::stateOf)
          .orElse(InstanceState.UNKNOWN);
    } catch (SdkException ex) {
      throw new IOException("EC2 state lookup for " + instanceId + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public InstanceHealth describeHealth(String instanceId) throws IOException {
    DescribeInstanceStatusRequest request = DescribeInstanceStatusRequest.builder()
        .instanceIds(instanceId)
        .includeAllInstances(true)
        .build();
    try {
      DescribeInstanceStatusResponse response = client.describeInstanceStatus(request);
      if (!response.hasInstanceStatuses() || response.instanceStatuses().isEmpty()) {
        return InstanceHealth.unknown(instanceId);
      }
      InstanceStatus status = response.instanceStatuses().get(0);
      InstanceState state = status.instanceState() == null
          ? InstanceState.UNKNOWN
          : InstanceState.fromName(status.instanceState().nameAsString());
      return new InstanceHealth(
          instanceId, state, checkOf(status.instanceStatus()), checkOf(status.systemStatus()));
    } catch (SdkException ex) {
      throw new IOException("EC2 status lookup for " + instanceId + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    client.close();
  }

  private static InstanceState stateOf(Instance instance) {
    return instance.state() == null ? InstanceState.UNKNOWN : InstanceState.fromName(instance.state().nameAsString());
  }

  private static StatusCheck checkOf(InstanceStatusSummary summary) {
    return summary == null ? StatusCheck.UNKNOWN : StatusCheck.fromName(summary.statusAsString());
  }
}
