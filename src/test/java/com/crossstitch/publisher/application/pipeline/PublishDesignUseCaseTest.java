package com.crossstitch.publisher.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.application.artifact.ArtifactConverter;
import com.crossstitch.publisher.application.artifact.ArtifactPublisher;
import com.crossstitch.publisher.application.artifact.BatchFolderReader;
import com.crossstitch.publisher.application.campaign.AlbumSuggestions;
import com.crossstitch.publisher.application.campaign.CampaignSettings;
import com.crossstitch.publisher.application.campaign.NotificationCampaign;
import com.crossstitch.publisher.application.campaign.RecipientDirectory;
import com.crossstitch.publisher.application.campaign.UnsubscribeLinks;
import com.crossstitch.publisher.application.campaign.UsersSchema;
import com.crossstitch.publisher.application.catalog.ItemCatalogWriter;
import com.crossstitch.publisher.application.infra.InfraVerifier;
import com.crossstitch.publisher.application.infra.VerifySettings;
import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.application.pin.BoardIndex;
import com.crossstitch.publisher.application.pin.PinPayloadBuilder;
import com.crossstitch.publisher.application.pin.SocialPinPublisher;
import com.crossstitch.publisher.application.pin.ThemeDetector;
import com.crossstitch.publisher.application.sequence.AtomicCounterSequence;
import com.crossstitch.publisher.application.sequence.CatalogMaxima;
import com.crossstitch.publisher.application.sequence.SequenceAllocator;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.ConversionException;
import com.crossstitch.publisher.domain.error.VerificationException;
import com.crossstitch.publisher.domain.fleet.InstanceState;
import com.crossstitch.publisher.domain.fleet.StatusCheck;
import com.crossstitch.publisher.infrastructure.pattern.JsonPatternInfoSource;
import com.crossstitch.publisher.testing.BatchFolders;
import com.crossstitch.publisher.testing.FakeFleet;
import com.crossstitch.publisher.testing.FakePinboardApi;
import com.crossstitch.publisher.testing.FakeProcessRunner;
import com.crossstitch.publisher.testing.FixedClock;
import com.crossstitch.publisher.testing.InMemoryItemStore;
import com.crossstitch.publisher.testing.InMemoryObjectStore;
import com.crossstitch.publisher.testing.RecordingEmailDelivery;
import com.crossstitch.publisher.testing.RecordingMetricsPort;
import com.crossstitch.publisher.testing.RecordingProgress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PublishDesignUseCaseTest {
  private static final String ITEMS = "CrossStitchItems";
  private static final String USERS = "CrossStitchUsers";
  private static final String SITE = "https://www.cross-stitch-pattern.net";

  @TempDir Path tempDir;

  private Path folder;
  private Path converterExe;
  private InMemoryItemStore store;
  private InMemoryObjectStore objects;
  private FakeProcessRunner runner;
  private FakePinboardApi api;
  private FakeFleet fleet;
  private RecordingEmailDelivery delivery;
  private RecordingProgress progress;
  private RecordingMetricsPort metrics;
  private PatternLinks links;
  private BoardIndex boards;

  @BeforeEach
  void setUp() throws Exception {
    folder = BatchFolders.complete(tempDir, 7);
    converterExe = tempDir.resolve("converter.exe");
    BatchFolders.write(converterExe, "");
    Path csv = tempDir.resolve("AlbumBoards.csv");
    Files.writeString(csv, "AlbumID,AlbumCaption,BoardID\n0007,\"Flowers\",b-7\n", StandardCharsets.UTF_8);
    boards = new BoardIndex(csv, "");

    store = new InMemoryItemStore()
        .sortedBy(ITEMS, "DesignsByID-index", "DesignID")
        .sortedBy(ITEMS, "Designs-index", "NGlobalPage")
        .keyedBy(USERS, "ID");
    store.seed(ITEMS, Map.of("ID", "ALB#0007", "NPage", "00042", "EntityType", "DESIGN",
        "DesignID", 120L, "NGlobalPage", 300L));
    store.seed(ITEMS, Map.of("ID", "ALB#0003", "NPage", "00010", "EntityType", "DESIGN",
        "DesignID", 95L, "NGlobalPage", 250L));
    store.seed(ITEMS, Map.of("ID", "ALB#0003", "NPage", "00000", "EntityType", "ALBUM", "Caption", "Cute Cats"));
    store.seed(USERS, Map.of("ID", "u0", "Email", "admin@cross-stitch.com", "Verified", true));
    store.seed(USERS, Map.of("ID", "u1", "Email", "ann@example.com", "FirstName", "Ann", "Verified", true));
    store.seed(USERS, Map.of("ID", "u2", "Email", "bob@example.com", "Verified", true));

    objects = new InMemoryObjectStore();
    runner = new FakeProcessRunner();
    api = new FakePinboardApi();
    fleet = new FakeFleet().instance("i-1", InstanceState.RUNNING);
    delivery = new RecordingEmailDelivery();
    progress = new RecordingProgress();
    metrics = new RecordingMetricsPort();
    links = new PatternLinks(SITE, "https://cdn.example.com", "images/designs/photos", "");
  }

  @Test
  void publishesDesignThroughEveryStage() throws Exception {
    PublishOutcome outcome = useCase(true).execute(folder, PublishOptions.defaults());

    assertFalse(outcome.dryRun());
    DesignRecord record = outcome.record().orElseThrow();
    assertEquals(7, record.albumId());
    assertEquals("00043", record.nPage());
    assertEquals(121, record.designId());
    assertEquals(301, record.globalPage());
    assertEquals("pin-1", record.pinId());
    assertTrue(progress.anyContains("Allocated DesignID 121, NPage 00043, NGlobalPage 301"));
    assertTrue(progress.anyContains("Pin created: pin-1"));

    assertEquals(List.of(
        "charts/00121_Rose Garden.scc",
        "pdfs/7/121/Stitch121_1_Kit.pdf",
        "pdfs/7/121/Stitch121_3_Kit.pdf",
        "pdfs/7/121/Stitch121_5_Kit.pdf",
        "pdfs/7/Stitch121_Kit.pdf",
        "images/designs/photos/7/121/4.jpg"), outcome.uploadedKeys());
    assertEquals(3, runner.invocations().size());

    assertEquals("b-7", outcome.pin().boardId());
    assertEquals(links.patternUrl(record.pattern(), 7, "00043"), outcome.pin().link());
    assertEquals(links.imageUrl(121, 7), outcome.pin().imageUrl());
    assertEquals(1, api.requests().size());

    Map<String, Object> item = store.find(ITEMS, Map.of("ID", "ALB#0007", "NPage", "00043")).orElseThrow();
    assertEquals(121L, item.get("DesignID"));
    assertEquals("Rose Garden", item.get("Caption"));
    assertEquals("pin-1", item.get("PinID"));

    assertTrue(outcome.verification().orElseThrow().success());
    assertEquals(List.of(List.of("i-1")), fleet.reboots());
    assertEquals(2, outcome.campaign().orElseThrow().sent());
    assertEquals(List.of("admin@cross-stitch.com", "admin@cross-stitch.com", "ann@example.com",
        "bob@example.com"), delivery.recipients());

    for (String stage : List.of("allocate", "convert", "upload", "pin", "catalog", "verify", "campaign")) {
      assertEquals(1, metrics.count("publish.stage." + stage + ".success"), stage);
      assertEquals(1, metrics.observed("publish.stage." + stage + ".durationMs").size(), stage);
    }
  }

  @Test
  void dryRunBuildsPinWithoutSideEffects() throws Exception {
    PublishOutcome outcome = useCase(true).execute(folder, new PublishOptions(true, false, false));

    assertTrue(outcome.dryRun());
    assertEquals(List.of(), outcome.uploadedKeys());
    assertEquals("b-7", outcome.pin().boardId());
    assertEquals(Optional.empty(), outcome.campaign());
    assertTrue(progress.anyContains("[dry-run] Board b-7"));
    assertEquals(List.of(), runner.invocations());
    assertEquals(List.of(), objects.putOrder());
    assertEquals(List.of(), api.requests());
    assertEquals(List.of(), delivery.sent());
    assertEquals(0, store.countOf("increment"));
    assertEquals(0, store.countOf("put"));
  }

  @Test
  void dryRunStillRequiresConverter() throws Exception {
    Files.delete(converterExe);

    assertThrows(ConfigurationException.class,
        () -> useCase(true).execute(folder, new PublishOptions(true, false, false)));
  }

  @Test
  void skipFlagsBypassVerificationAndCampaign() throws Exception {
    PublishOutcome outcome = useCase(true).execute(folder, new PublishOptions(false, true, true));

    assertTrue(outcome.record().isPresent());
    assertEquals(Optional.empty(), outcome.verification());
    assertEquals(Optional.empty(), outcome.campaign());
    assertEquals(List.of(), fleet.reboots());
    assertEquals(List.of(), delivery.sent());
    assertFalse(metrics.hasCounter("publish.stage.verify.success"));
  }

  @Test
  void missingCollaboratorsBehaveLikeSkips() throws Exception {
    PublishOutcome outcome = useCase(false).execute(folder, PublishOptions.defaults());

    assertTrue(outcome.record().isPresent());
    assertEquals(Optional.empty(), outcome.verification());
    assertEquals(Optional.empty(), outcome.campaign());
  }

  @Test
  void unhealthyFleetStopsBeforeCampaign() throws Exception {
    fleet.health("i-1", StatusCheck.IMPAIRED, StatusCheck.OK);

    VerificationException thrown = assertThrows(VerificationException.class,
        () -> useCase(true).execute(folder, PublishOptions.defaults()));

    assertFalse(thrown.result().success());
    assertTrue(thrown.result().reason().contains("i-1"));
    assertEquals(1, metrics.count("publish.stage.verify.failure"));
    assertEquals(List.of(), delivery.sent());
    assertTrue(store.find(ITEMS, Map.of("ID", "ALB#0007", "NPage", "00043")).isPresent());
  }

  @Test
  void conversionFailureStopsBeforeUpload() throws Exception {
    runner.failWith(3, "bad pdf");

    assertThrows(ConversionException.class, () -> useCase(true).execute(folder, PublishOptions.defaults()));

    assertEquals(1, metrics.count("publish.stage.allocate.success"));
    assertEquals(1, metrics.count("publish.stage.convert.failure"));
    assertFalse(metrics.hasCounter("publish.stage.upload.success"));
    assertEquals(List.of(), objects.putOrder());
    assertEquals(List.of(), api.requests());
  }

  private PublishDesignUseCase useCase(boolean withVerifierAndCampaign) {
    FixedClock clock = FixedClock.at("2025-10-16T08:00:00Z");
    InfraVerifier verifier = null;
    NotificationCampaign campaign = null;
    if (withVerifierAndCampaign) {
      verifier = new InfraVerifier(fleet, new VerifySettings("cross-stitch-env", 0, 2), progress, metrics);
      CampaignSettings settings = new CampaignSettings("ann@cross-stitch.com",
          Optional.of("admin@cross-stitch.com"), "", "", "Hello <username>", "", 10, 2);
      campaign = new NotificationCampaign(
          new RecipientDirectory(store, UsersSchema.withTable(USERS), clock),
          delivery,
          new UnsubscribeLinks("", SITE, "secret"),
          new AlbumSuggestions(store, ITEMS, links),
          settings,
          clock,
          progress,
          metrics);
    }
    return new PublishDesignUseCase(
        new BatchFolderReader(),
        new JsonPatternInfoSource(),
        new SequenceAllocator(new AtomicCounterSequence(store, ITEMS, new CatalogMaxima(store, ITEMS))),
        new ArtifactConverter(runner, converterExe, Duration.ofSeconds(5)),
        new ArtifactPublisher(objects, "images/designs/photos", metrics),
        new SocialPinPublisher(api, () -> "tok", boards, new ThemeDetector(), new PinPayloadBuilder()),
        new ItemCatalogWriter(store, ITEMS),
        links,
        verifier,
        campaign,
        progress,
        metrics);
  }
}
