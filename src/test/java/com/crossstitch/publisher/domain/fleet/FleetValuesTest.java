package com.crossstitch.publisher.domain.fleet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FleetValuesTest {

  @Test
  void providerNamesAreNormalized() {
    assertEquals(InstanceState.SHUTTING_DOWN, InstanceState.fromName("shutting-down"));
    assertEquals(InstanceState.RUNNING, InstanceState.fromName(" running "));
    assertEquals(InstanceState.UNKNOWN, InstanceState.fromName("rebooting"));
    assertEquals(InstanceState.UNKNOWN, InstanceState.fromName(null));
    assertEquals(StatusCheck.INSUFFICIENT_DATA, StatusCheck.fromName("insufficient-data"));
    assertEquals(StatusCheck.UNKNOWN, StatusCheck.fromName(""));
  }

  @Test
  void stoppedAndTerminatedAreNotRebootable() {
    assertFalse(InstanceState.STOPPED.isRebootable());
    assertFalse(InstanceState.TERMINATED.isRebootable());
    assertTrue(InstanceState.PENDING.isRebootable());
  }

  @Test
  void verifierStatesMoveForwardOnly() {
    assertTrue(VerifierState.IDLE.canMoveTo(VerifierState.REBOOT_REQUESTED));
    assertFalse(VerifierState.IDLE.canMoveTo(VerifierState.POLLING_RUNNING));
    assertFalse(VerifierState.POLLING_HEALTHY.canMoveTo(VerifierState.REBOOT_REQUESTED));
    assertTrue(VerifierState.POLLING_RUNNING.canMoveTo(VerifierState.DONE));
    assertFalse(VerifierState.DONE.canMoveTo(VerifierState.DONE));
  }

  @Test
  void healthRequiresRunningAndBothChecks() {
    assertTrue(new InstanceHealth("i", InstanceState.RUNNING, StatusCheck.OK, StatusCheck.OK).healthy());
    assertFalse(new InstanceHealth("i", InstanceState.RUNNING, StatusCheck.INITIALIZING, StatusCheck.OK).healthy());
    assertFalse(InstanceHealth.unknown("i").healthy());
  }
}
