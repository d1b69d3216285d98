package com.crossstitch.publisher.domain.fleet;

/**
 * States of the post-deploy verification state machine.
 *
 * <p>Transitions run strictly forward: {@code IDLE -> REBOOT_REQUESTED -> POLLING_RUNNING -> POLLING_HEALTHY -> DONE}.
 * Any failure jumps straight to {@code DONE}.</p>
 *
 * @since 0.1.0
 */
public enum VerifierState {
  IDLE,
  REBOOT_REQUESTED,
  POLLING_RUNNING,
  POLLING_HEALTHY,
  DONE;

  /**
   * Checks whether moving to {@code next} is a legal transition.
   *
   * @param next target state
   * @return {@code true} when allowed
   */
  public boolean canMoveTo(VerifierState next) {
    if (next == DONE) {
      return this != DONE;
    }
    return next.ordinal() == ordinal() + 1;
  }
}
