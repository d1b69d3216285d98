package com.crossstitch.publisher.domain.fleet;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Terminal outcome of an infrastructure verification run.
 * <p><strong>Role:</strong> Gate for the notification campaign; only a successful result lets it run.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param success {@code true} when every instance ended healthy, or when verification was skipped
 * @param skipped {@code true} when no environment was configured
 * @param reason human readable summary
 * @param instanceIds instances covered by the run
 * @param health final health snapshots; empty when the run ended before the health stage
 * @since 0.1.0
 */
public record VerificationResult(
    boolean success,
    boolean skipped,
    String reason,
    List<String> instanceIds,
    List<InstanceHealth> health) {

  public VerificationResult {
    reason = Objects.requireNonNullElse(reason, "");
    instanceIds = List.copyOf(Objects.requireNonNull(instanceIds, "instanceIds"));
    health = List.copyOf(Objects.requireNonNull(health, "health"));
  }

  public static VerificationResult succeeded(List<String> instanceIds, List<InstanceHealth> health) {
    return new VerificationResult(true, false, "All instances healthy", instanceIds, health);
  }

  public static VerificationResult failed(String reason, List<String> instanceIds) {
    return new VerificationResult(false, false, reason, instanceIds, List.of());
  }

  public static VerificationResult failed(
      String reason, List<String> instanceIds, List<InstanceHealth> health) {
    return new VerificationResult(false, false, reason, instanceIds, health);
  }

  public static VerificationResult skippedResult(String reason) {
    return new VerificationResult(true, true, reason, List.of(), List.of());
  }

  @Override
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "List is an immutable copy.")
  public List<InstanceHealth> health() {
    return health;
  }
}
