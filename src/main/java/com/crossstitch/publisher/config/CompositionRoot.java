package com.crossstitch.publisher.config;

import com.crossstitch.publisher.application.artifact.ArtifactConverter;
import com.crossstitch.publisher.application.artifact.ArtifactPublisher;
import com.crossstitch.publisher.application.artifact.BatchFolderReader;
import com.crossstitch.publisher.application.audit.PdfAuditUseCase;
import com.crossstitch.publisher.application.boards.BoardProvisioningUseCase;
import com.crossstitch.publisher.application.campaign.AlbumSuggestions;
import com.crossstitch.publisher.application.campaign.NotificationCampaign;
import com.crossstitch.publisher.application.campaign.RecipientDirectory;
import com.crossstitch.publisher.application.campaign.UnsubscribeLinks;
import com.crossstitch.publisher.application.catalog.ItemCatalogWriter;
import com.crossstitch.publisher.application.infra.InfraVerifier;
import com.crossstitch.publisher.application.links.PatternLinks;
import com.crossstitch.publisher.application.pin.BoardIndex;
import com.crossstitch.publisher.application.pin.PinPayloadBuilder;
import com.crossstitch.publisher.application.pin.SocialPinPublisher;
import com.crossstitch.publisher.application.pin.ThemeDetector;
import com.crossstitch.publisher.application.pipeline.PublishDesignUseCase;
import com.crossstitch.publisher.application.port.ClockPort;
import com.crossstitch.publisher.application.port.ComputeFleetPort;
import com.crossstitch.publisher.application.port.EmailDeliveryPort;
import com.crossstitch.publisher.application.port.MetricsPort;
import com.crossstitch.publisher.application.port.ObjectStorePort;
import com.crossstitch.publisher.application.port.PinboardApiPort;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.port.TokenProvider;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.sequence.AtomicCounterSequence;
import com.crossstitch.publisher.application.sequence.CatalogMaxima;
import com.crossstitch.publisher.application.sequence.MaxQuerySequence;
import com.crossstitch.publisher.application.sequence.Sequence;
import com.crossstitch.publisher.application.sequence.SequenceAllocator;
import com.crossstitch.publisher.application.users.UserMaintenanceUseCase;
import com.crossstitch.publisher.infrastructure.aws.DynamoDbItemStoreAdapter;
import com.crossstitch.publisher.infrastructure.aws.Ec2ComputeFleetAdapter;
import com.crossstitch.publisher.infrastructure.aws.S3ObjectStoreAdapter;
import com.crossstitch.publisher.infrastructure.aws.SesEmailDeliveryAdapter;
import com.crossstitch.publisher.infrastructure.metrics.NoOpMetricsAdapter;
import com.crossstitch.publisher.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.crossstitch.publisher.infrastructure.pattern.JsonPatternInfoSource;
import com.crossstitch.publisher.infrastructure.pinterest.PinterestHttpAdapter;
import com.crossstitch.publisher.infrastructure.process.LocalProcessRunner;
import com.crossstitch.publisher.infrastructure.time.SystemClockAdapter;
import com.crossstitch.publisher.infrastructure.token.StaticTokenProvider;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires publisher use cases to concrete adapters.
 * <p><strong>Role:</strong> Translates typed command configuration into runnable use case graphs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Instantiate the AWS, pinboard, process and metrics adapters a command needs.</li>
 *   <li>Choose the DesignID/NPage sequence strategy from {@link SequenceMode}.</li>
 *   <li>Close every adapter it created, in reverse creation order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded use during a CLI run.</p>
 *
 * @since 0.1.0
 * @see PublishDesignUseCase
 * @see NotificationCampaign
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ProgressSink progress;
  private final ClockPort clock = new SystemClockAdapter();
  private final Deque<AutoCloseable> closeables = new ArrayDeque<>();

  /**
   * Creates a composition root.
   *
   * @param metrics metrics adapter shared by every use case; closed with the root when closeable
   * @param progress user-facing progress sink
   */
  public CompositionRoot(MetricsPort metrics, ProgressSink progress) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
    if (metrics instanceof AutoCloseable closeable) {
      closeables.push(closeable);
    }
  }

  /**
   * Selects the metrics adapter for {@code metricsExporter}.
   *
   * @param exporter {@code otlp} or {@code none}; blank means {@code otlp}
   * @return OpenTelemetry adapter, or a no-op adapter when metrics are disabled
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    if ("none".equals(normalized)) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter();
  }

  /**
   * Wires the full publish pipeline.
   *
   * @param config publish configuration
   * @return ready-to-run use case
   */
  public PublishDesignUseCase publishUseCase(PublishConfig config) {
    StoreConfig store = config.store();
    ItemStorePort items = itemStore(store);
    ObjectStorePort objects = register(new S3ObjectStoreAdapter(store.region(), store.bucket()));
    PatternLinks links = config.site().links(store.photoPrefix());
    SocialPinPublisher pins = new SocialPinPublisher(
        pinboardApi(config.pinterest()),
        tokenProvider(config.pinterest()),
        new BoardIndex(config.pinterest().boardsCsv(), config.pinterest().defaultBoardId().orElse(null)),
        new ThemeDetector(),
        new PinPayloadBuilder());
    InfraVerifier verifier = config.options().skipVerify() ? null : infraVerifier(config.verify());
    NotificationCampaign campaign = config.campaign() == null
        ? null
        : notificationCampaign(items, store, config.site(), config.campaign());
    return new PublishDesignUseCase(
        new BatchFolderReader(),
        new JsonPatternInfoSource(),
        new SequenceAllocator(sequence(items, store)),
        new ArtifactConverter(new LocalProcessRunner(), config.converter().path(), config.converter().timeout()),
        new ArtifactPublisher(objects, store.photoPrefix(), metrics),
        pins,
        new ItemCatalogWriter(items, store.designsTable()),
        links,
        verifier,
        campaign,
        progress,
        metrics);
  }

  /**
   * Wires the notification campaign for the {@code campaign} command.
   *
   * @param config broadcast configuration
   * @return campaign service
   */
  public NotificationCampaign broadcastCampaign(BroadcastConfig config) {
    return notificationCampaign(itemStore(config.store()), config.store(), config.site(), config.campaign());
  }

  /**
   * Wires the infrastructure verifier.
   *
   * @param config verification configuration
   * @return verifier bound to an EC2 fleet adapter
   */
  public InfraVerifier infraVerifier(VerifyConfig config) {
    ComputeFleetPort fleet = register(new Ec2ComputeFleetAdapter(config.region()));
    return new InfraVerifier(fleet, config.settings(), progress, metrics);
  }

  public BoardProvisioningUseCase boardProvisioning(BoardsConfig config) {
    return new BoardProvisioningUseCase(
        itemStore(config.store()),
        config.store().designsTable(),
        pinboardApi(config.pinterest()),
        tokenProvider(config.pinterest()),
        progress);
  }

  public UserMaintenanceUseCase userMaintenance(UsersConfig config) {
    return new UserMaintenanceUseCase(itemStore(config.store()), config.schema(), progress, clock);
  }

  public PdfAuditUseCase pdfAudit(AuditConfig config) {
    StoreConfig store = config.store();
    ObjectStorePort objects = register(new S3ObjectStoreAdapter(store.region(), store.bucket()));
    return new PdfAuditUseCase(itemStore(store), store.designsTable(), objects, progress);
  }

  /**
   * Returns the metrics port shared by constructed use cases.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /** Closes every adapter created by this root; failures are logged and the remaining adapters still close. */
  @Override
  public void close() {
    while (!closeables.isEmpty()) {
      AutoCloseable closeable = closeables.pop();
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), ex);
      }
    }
  }

  private NotificationCampaign notificationCampaign(
      ItemStorePort items, StoreConfig store, SiteConfig site, CampaignConfig campaign) {
    PatternLinks links = site.links(store.photoPrefix());
    EmailDeliveryPort delivery = register(new SesEmailDeliveryAdapter(store.region()));
    return new NotificationCampaign(
        new RecipientDirectory(items, campaign.users(), clock),
        delivery,
        new UnsubscribeLinks(campaign.unsubscribeBaseUrl(), site.siteBaseUrl(), campaign.unsubscribeSecret()),
        new AlbumSuggestions(items, store.designsTable(), links),
        campaign.settings(),
        clock,
        progress,
        metrics);
  }

  private Sequence sequence(ItemStorePort items, StoreConfig store) {
    CatalogMaxima maxima = new CatalogMaxima(items, store.designsTable());
    return switch (store.sequenceMode()) {
      case ATOMIC -> new AtomicCounterSequence(items, store.designsTable(), maxima);
      case LEGACY -> new MaxQuerySequence(maxima);
    };
  }

  private ItemStorePort itemStore(StoreConfig store) {
    return register(new DynamoDbItemStoreAdapter(store.region()));
  }

  private PinboardApiPort pinboardApi(PinterestConfig config) {
    return new PinterestHttpAdapter(config.baseUrl(), config.requestTimeout());
  }

  private TokenProvider tokenProvider(PinterestConfig config) {
    return new StaticTokenProvider(config.accessToken().orElse(null));
  }

  private <T extends AutoCloseable> T register(T closeable) {
    closeables.push(closeable);
    return closeable;
  }
}
