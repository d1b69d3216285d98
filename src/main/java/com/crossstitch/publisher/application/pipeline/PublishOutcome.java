package com.crossstitch.publisher.application.pipeline;

import com.crossstitch.publisher.application.campaign.CampaignReport;
import com.crossstitch.publisher.application.pin.PinPayload;
import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.fleet.VerificationResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a publish run.
 *
 * @param batch discovered batch inputs
 * @param record catalogued design; empty in a dry run
 * @param uploadedKeys object keys written, in upload order
 * @param pin pin payload that was (or would be) posted
 * @param verification verification result; empty when skipped
 * @param campaign campaign report; empty when skipped
 * @since 0.1.0
 */
public record PublishOutcome(
    DesignBatch batch,
    Optional<DesignRecord> record,
    List<String> uploadedKeys,
    PinPayload pin,
    Optional<VerificationResult> verification,
    Optional<CampaignReport> campaign) {

  public PublishOutcome {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(record, "record");
    uploadedKeys = List.copyOf(uploadedKeys);
    Objects.requireNonNull(pin, "pin");
    Objects.requireNonNull(verification, "verification");
    Objects.requireNonNull(campaign, "campaign");
  }

  public boolean dryRun() {
    return record.isEmpty();
  }
}
