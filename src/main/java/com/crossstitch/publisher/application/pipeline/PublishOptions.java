package com.crossstitch.publisher.application.pipeline;

/**
 * Switches of one publish run.
 *
 * @param dryRun validate inputs and resolve the board without allocating ids or touching external services
 * @param skipVerify skip the infrastructure verification stage
 * @param skipCampaign skip the notification campaign
 * @since 0.1.0
 */
public record PublishOptions(boolean dryRun, boolean skipVerify, boolean skipCampaign) {
  public static PublishOptions defaults() {
    return new PublishOptions(false, false, false);
  }
}
