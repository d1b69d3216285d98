package com.crossstitch.publisher.application.pipeline;

import com.crossstitch.publisher.application.artifact.ArtifactConverter;
import com.crossstitch.publisher.application.artifact.ArtifactPublisher;
import com.crossstitch.publisher.application.artifact.BatchFolderReader;
import com.crossstitch.publisher.application.campaign.CampaignReport;
import com.crossstitch.publisher.application.campaign.DesignAnnouncement;
import com.crossstitch.publisher.application.campaign.NotificationCampaign;
import com.crossstitch.publisher.application.catalog.ItemCatalogWriter;
import com.crossstitch.publisher.application.infra.InfraVerifier;
import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.application.pin.PinPayload;
import com.crossstitch.publisher.application.pin.SocialPinPublisher;
import com.crossstitch.publisher.application.port.MetricsPort;
import com.crossstitch.publisher.application.port.PatternInfoSource;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.sequence.SequenceAllocator;
import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.PipelineException;
import com.crossstitch.publisher.domain.error.VerificationException;
import com.crossstitch.publisher.domain.fleet.VerificationResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates one design publish from batch folder to notification campaign.
 * <p><strong>Stages:</strong> read batch, allocate ids (global page, design id, album page), convert every PDF
 * variant, upload, create pin, write catalog, verify infrastructure, announce. Stages run sequentially on the
 * calling thread and the first failure stops the run; nothing already written is rolled back.</p>
 * <p><strong>Gating:</strong> the campaign runs only when verification succeeded or was skipped.</p>
 * <p><strong>Observability:</strong> each stage emits {@code publish.stage.<name>.success},
 * {@code publish.stage.<name>.failure} and {@code publish.stage.<name>.durationMs}; logs after allocation carry
 * the {@code designId} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class PublishDesignUseCase {
  private static final Logger log = LoggerFactory.getLogger(PublishDesignUseCase.class);

  private final BatchFolderReader reader;
  private final PatternInfoSource patterns;
  private final SequenceAllocator allocator;
  private final ArtifactConverter converter;
  private final ArtifactPublisher publisher;
  private final SocialPinPublisher pins;
  private final ItemCatalogWriter catalog;
  private final PatternLinks links;
  private final InfraVerifier verifier;
  private final NotificationCampaign campaign;
  private final ProgressSink progress;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param verifier infrastructure verifier; {@code null} behaves like {@code --skip-verify}
   * @param campaign notification campaign; {@code null} behaves like {@code --skip-campaign}
   */
  public PublishDesignUseCase(
      BatchFolderReader reader,
      PatternInfoSource patterns,
      SequenceAllocator allocator,
      ArtifactConverter converter,
      ArtifactPublisher publisher,
      SocialPinPublisher pins,
      ItemCatalogWriter catalog,
      PatternLinks links,
      InfraVerifier verifier,
      NotificationCampaign campaign,
      ProgressSink progress,
      MetricsPort metrics) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.patterns = Objects.requireNonNull(patterns, "patterns");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.pins = Objects.requireNonNull(pins, "pins");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.links = Objects.requireNonNull(links, "links");
    this.verifier = verifier;
    this.campaign = campaign;
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Publishes the design in a batch folder.
   *
   * @param folder batch folder
   * @param options run switches
   * @return outcome of the run
   * @throws VerificationException if the infrastructure did not come back healthy; the campaign is not run
   * @throws PipelineException if any other stage fails
   * @throws IOException if the batch folder cannot be listed or the pattern metadata cannot be read
   * @throws InterruptedException if interrupted while converting, verifying or sending
   */
  public PublishOutcome execute(Path folder, PublishOptions options)
      throws PipelineException, IOException, InterruptedException {
    Objects.requireNonNull(options, "options");
    DesignBatch batch = reader.read(folder);
    PatternInfo pattern = patterns.read(batch);
    int albumId = batch.albumId();
    progress.report("Batch " + folder + ": album " + batch.paddedAlbumId() + ", '" + pattern.title() + "', "
        + pattern.description());

    if (options.dryRun()) {
      return dryRun(batch, pattern);
    }

    Allocation allocation = stage("allocate", () -> new Allocation(
        allocator.nextGlobalPage(), allocator.nextDesignId(), allocator.nextAlbumPage(albumId)));
    int globalPage = allocation.globalPage();
    int designId = allocation.designId();
    String nPage = allocation.nPage();
    progress.report("Allocated DesignID " + designId + ", NPage " + nPage + ", NGlobalPage " + globalPage);

    String previous = MDC.get("designId");
    MDC.put("designId", Integer.toString(designId));
    try {
      Map<String, Path> converted = stage("convert", () -> converter.convertAll(batch.pdfVariants()));
      progress.report("Converted " + converted.size() + " PDF variant(s)");

      List<String> keys = stage("upload", () -> publisher.publish(designId, batch, pattern, converted));
      progress.report("Uploaded " + keys.size() + " object(s)");

      String patternUrl = links.patternUrl(pattern, albumId, nPage);
      String imageUrl = links.imageUrl(designId, albumId);
      PinResult pin = stage("pin", () -> {
        PinPayload built = pins.buildPinPayload(pattern, albumId, patternUrl, imageUrl);
        return new PinResult(built, pins.createPin(built).orElse(""));
      });
      PinPayload payload = pin.payload();
      String pinId = pin.pinId();
      progress.report(pinId.isEmpty() ? "Pin created; id unknown" : "Pin created: " + pinId);

      DesignRecord record = new DesignRecord(albumId, nPage, designId, globalPage, pattern, pinId);
      stage("catalog", () -> {
        catalog.write(record);
        return record;
      });
      progress.report("Catalog record written: " + record.partitionKey() + " / " + nPage);

      Optional<VerificationResult> verification = Optional.empty();
      if (options.skipVerify() || verifier == null) {
        log.info("Infrastructure verification skipped");
      } else {
        verification = Optional.of(stage("verify", () -> {
          VerificationResult result = verifier.verify();
          if (!result.success()) {
            throw new VerificationException(result);
          }
          return result;
        }));
      }

      Optional<CampaignReport> report = Optional.empty();
      if (options.skipCampaign() || campaign == null) {
        log.info("Notification campaign skipped");
      } else {
        DesignAnnouncement announcement = new DesignAnnouncement(albumId, designId, pinId, pattern.title(),
            patternUrl, links.siteBaseUrl(), imageUrl);
        report = Optional.of(stage("campaign", () -> campaign.announce(announcement)));
      }
      log.info("Published design {} to album {} page {}", designId, albumId, nPage);
      return new PublishOutcome(batch, Optional.of(record), keys, payload, verification, report);
    } finally {
      if (previous == null) {
        MDC.remove("designId");
      } else {
        MDC.put("designId", previous);
      }
    }
  }

  private PublishOutcome dryRun(DesignBatch batch, PatternInfo pattern) throws PipelineException {
    converter.requireConverter();
    int albumId = batch.albumId();
    PinPayload payload = pins.buildPinPayload(pattern, albumId, links.patternUrl(pattern, albumId, "00001"),
        links.imageUrl(0, albumId));
    progress.report("[dry-run] Board " + payload.boardId() + ", title '" + payload.title() + "'");
    progress.report("[dry-run] Would convert " + batch.pdfVariants().size() + " variant(s) and upload the chart, "
        + "PDFs, legacy copy and photo of album " + albumId);
    return new PublishOutcome(batch, Optional.empty(), List.of(), payload, Optional.empty(), Optional.empty());
  }

  private <T> T stage(String name, StageBody<T> body) throws PipelineException, InterruptedException {
    long started = System.nanoTime();
    try {
      T value = body.run();
      metrics.increment("publish.stage." + name + ".success");
      return value;
    } catch (PipelineException | RuntimeException ex) {
      metrics.increment("publish.stage." + name + ".failure");
      log.error("Stage {} failed: {}", name, ex.getMessage());
      throw ex;
    } catch (InterruptedException ex) {
      metrics.increment("publish.stage." + name + ".failure");
      throw ex;
    } finally {
      metrics.observe("publish.stage." + name + ".durationMs", (System.nanoTime() - started) / 1_000_000L);
    }
  }

  private record Allocation(int globalPage, int designId, String nPage) {
  }

  private record PinResult(PinPayload payload, String pinId) {
  }

  @FunctionalInterface
  private interface StageBody<T> {
    T run() throws PipelineException, InterruptedException;
  }
}
