package com.crossstitch.publisher.application.infra;

import com.crossstitch.publisher.application.port.ComputeFleetPort;
import com.crossstitch.publisher.application.port.MetricsPort;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.port.Sleeper;
import com.crossstitch.publisher.domain.fleet.FleetInstance;
import com.crossstitch.publisher.domain.fleet.InstanceHealth;
import com.crossstitch.publisher.domain.fleet.InstanceState;
import com.crossstitch.publisher.domain.fleet.VerificationResult;
import com.crossstitch.publisher.domain.fleet.VerifierState;
import com.crossstitch.publisher.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Post-deploy state machine that reboots the tagged instances and waits for them to come
 * back healthy.
 * <p><strong>States:</strong> {@code IDLE -> REBOOT_REQUESTED -> POLLING_RUNNING -> POLLING_HEALTHY -> DONE}. Any
 * failure moves straight to {@code DONE} with a failed {@link VerificationResult}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Find instances by {@code tag:Name}; an empty fleet fails without further API calls.</li>
 *   <li>Reboot all instances with one request.</li>
 *   <li>Poll each instance for {@code RUNNING} on its own worker; the stage passes only if every worker does.</li>
 *   <li>Check instance and system status once per instance.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One {@link #verify()} at a time per instance of this class. Progress is reported
 * from worker threads, so the {@link ProgressSink} must accept concurrent callers.</p>
 * <p><strong>Observability:</strong> Emits {@code verify.result.success}, {@code verify.result.failure},
 * {@code verify.result.skipped} and {@code verify.durationMs}; worker logs carry the {@code instance} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class InfraVerifier {
  private static final Logger log = LoggerFactory.getLogger(InfraVerifier.class);
  static final String NAME_TAG = "Name";

  private final ComputeFleetPort fleet;
  private final VerifySettings settings;
  private final Sleeper sleeper;
  private final ProgressSink progress;
  private final MetricsPort metrics;
  private final IntFunction<ExecutorService> poolFactory;
  private volatile VerifierState state = VerifierState.IDLE;

  public InfraVerifier(
      ComputeFleetPort fleet, VerifySettings settings, ProgressSink progress, MetricsPort metrics) {
    this(fleet, settings, Sleeper.SYSTEM, progress, metrics,
        size -> ExecutorFactories.newWorkerPool(size, "verify-poll",
            (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex)));
  }

  InfraVerifier(
      ComputeFleetPort fleet,
      VerifySettings settings,
      Sleeper sleeper,
      ProgressSink progress,
      MetricsPort metrics,
      IntFunction<ExecutorService> poolFactory) {
    this.fleet = Objects.requireNonNull(fleet, "fleet");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
  }

  /**
   * Returns the current state of the machine.
   *
   * @return current state
   */
  public VerifierState state() {
    return state;
  }

  /**
   * Runs the full verification.
   *
   * @return terminal result; skipped and successful when no environment is configured
   * @throws InterruptedException if interrupted while polling; the machine is left in {@code DONE}
   */
  public VerificationResult verify() throws InterruptedException {
    if (state != VerifierState.IDLE) {
      throw new IllegalStateException("Verifier already ran; state=" + state);
    }
    long started = System.nanoTime();
    VerificationResult result;
    try {
      result = run();
    } catch (InterruptedException ex) {
      if (state != VerifierState.DONE) {
        moveTo(VerifierState.DONE);
      }
      metrics.increment("verify.result.failure");
      throw ex;
    }
    metrics.observe("verify.durationMs", (System.nanoTime() - started) / 1_000_000L);
    if (result.skipped()) {
      metrics.increment("verify.result.skipped");
    } else {
      metrics.increment(result.success() ? "verify.result.success" : "verify.result.failure");
    }
    report((result.success() ? "SUCCESS: " : "FAILURE: ") + result.reason());
    return result;
  }

  private VerificationResult run() throws InterruptedException {
    if (!settings.enabled()) {
      log.warn("No environment name configured; infrastructure verification skipped");
      moveTo(VerifierState.DONE);
      return VerificationResult.skippedResult("No environment configured");
    }

    List<String> ids;
    try {
      ids = fleet.findByTag(NAME_TAG, settings.environmentName()).stream()
          .map(FleetInstance::instanceId)
          .toList();
    } catch (IOException | RuntimeException ex) {
      log.error("Instance lookup for environment '{}' failed", settings.environmentName(), ex);
      return fail("Instance lookup failed: " + ex.getMessage(), List.of());
    }
    if (ids.isEmpty()) {
      return fail("No instances found for environment '" + settings.environmentName() + "'", ids);
    }

    moveTo(VerifierState.REBOOT_REQUESTED);
    try {
      fleet.reboot(ids);
      report("Reboot request sent for instances: " + String.join(", ", ids));
    } catch (IOException | RuntimeException ex) {
      log.error("Reboot request failed for {}", ids, ex);
      return fail("Reboot request failed: " + ex.getMessage(), ids);
    }

    moveTo(VerifierState.POLLING_RUNNING);
    List<String> notRunning;
    try {
      notRunning = awaitRunning(ids);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("State polling failed", cause);
      return fail("State polling failed: " + cause.getMessage(), ids);
    }
    if (!notRunning.isEmpty()) {
      return fail("Instances did not reach RUNNING after " + settings.maxAttempts() + " attempts: "
          + String.join(", ", notRunning), ids);
    }

    moveTo(VerifierState.POLLING_HEALTHY);
    List<InstanceHealth> health = new ArrayList<>(ids.size());
    for (String id : ids) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Health check interrupted");
      }
      try {
        InstanceHealth snapshot = fleet.describeHealth(id);
        health.add(snapshot);
        report("Instance " + id + ": state=" + snapshot.state() + " instanceStatus=" + snapshot.instanceStatus()
            + " systemStatus=" + snapshot.systemStatus());
      } catch (IOException | RuntimeException ex) {
        log.error("Health check failed for {}", id, ex);
        return fail("Health check failed for " + id + ": " + ex.getMessage(), ids, health);
      }
    }
    List<String> unhealthy = health.stream().filter(h -> !h.healthy()).map(InstanceHealth::instanceId).toList();
    moveTo(VerifierState.DONE);
    if (!unhealthy.isEmpty()) {
      return VerificationResult.failed("Unhealthy instances: " + String.join(", ", unhealthy), ids, health);
    }
    return VerificationResult.succeeded(ids, health);
  }

  private List<String> awaitRunning(List<String> ids) throws InterruptedException, ExecutionException {
    List<Callable<Boolean>> tasks = new ArrayList<>(ids.size());
    for (String id : ids) {
      tasks.add(() -> pollUntilRunning(id));
    }
    ExecutorService executor = poolFactory.apply(ids.size());
    try {
      List<Future<Boolean>> futures = executor.invokeAll(tasks);
      List<String> notRunning = new ArrayList<>();
      ExecutionException firstFailure = null;
      for (int i = 0; i < futures.size(); i++) {
        try {
          if (!Boolean.TRUE.equals(futures.get(i).get())) {
            notRunning.add(ids.get(i));
          }
        } catch (ExecutionException ex) {
          if (firstFailure == null) {
            firstFailure = ex;
          }
        }
      }
      if (firstFailure != null) {
        throw firstFailure;
      }
      return notRunning;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("State polling interrupted; stopping workers");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
  }

  private boolean pollUntilRunning(String instanceId) throws IOException, InterruptedException {
    String previousInstance = MDC.get("instance");
    try {
      MDC.put("instance", instanceId);
      for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
        InstanceState current = fleet.describeState(instanceId);
        if (current == InstanceState.RUNNING) {
          report("Instance " + instanceId + " is running (attempt " + attempt + ")");
          return true;
        }
        log.debug("Instance {} is {} (attempt {}/{})", instanceId, current, attempt, settings.maxAttempts());
        if (attempt < settings.maxAttempts()) {
          sleeper.sleep(settings.pollIntervalMillis());
        }
      }
      report("Instance " + instanceId + " did not reach RUNNING");
      return false;
    } finally {
      if (previousInstance == null) {
        MDC.remove("instance");
      } else {
        MDC.put("instance", previousInstance);
      }
    }
  }

  private VerificationResult fail(String reason, List<String> ids) {
    return fail(reason, ids, List.of());
  }

  private VerificationResult fail(String reason, List<String> ids, List<InstanceHealth> health) {
    moveTo(VerifierState.DONE);
    return VerificationResult.failed(reason, ids, health);
  }

  private void moveTo(VerifierState next) {
    VerifierState current = state;
    if (!current.canMoveTo(next)) {
      throw new IllegalStateException("Illegal verifier transition " + current + " -> " + next);
    }
    state = next;
    log.info("Verifier {} -> {}", current, next);
    report("State " + next);
  }

  private void report(String message) {
    progress.report("[Verify] " + message);
  }
}
