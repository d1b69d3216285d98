package com.crossstitch.publisher.application.artifact;

import com.crossstitch.publisher.application.port.MetricsPort;
import com.crossstitch.publisher.application.port.ObjectStorePort;
import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.UploadException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Uploads a design's chart, converted PDFs, legacy PDF copy and preview photo.
 * <p><strong>Order:</strong> chart, each variant, legacy copy of variant {@code 1}, photo. The first failure
 * stops the stage; objects already uploaded stay in place.</p>
 * <p><strong>Observability:</strong> Increments {@code publish.upload.objects} per stored object.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactPublisher {
  private static final Logger log = LoggerFactory.getLogger(ArtifactPublisher.class);
  static final String LEGACY_VARIANT = "1";

  private final ObjectStorePort store;
  private final String photoPrefix;
  private final MetricsPort metrics;

  public ArtifactPublisher(ObjectStorePort store, String photoPrefix, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.photoPrefix = Objects.requireNonNull(photoPrefix, "photoPrefix");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Uploads all artifacts of a design.
   *
   * @param designId allocated design id
   * @param batch batch inputs
   * @param pattern pattern metadata; the title names the chart object
   * @param converted converted PDF per variant id, in upload order
   * @return uploaded keys in upload order
   * @throws UploadException on the first storage failure
   */
  public List<String> publish(int designId, DesignBatch batch, PatternInfo pattern, Map<String, Path> converted)
      throws UploadException {
    int albumId = batch.albumId();
    List<String> uploaded = new ArrayList<>();

    String chartExtension = extensionOf(batch.chart());
    upload(ArtifactKeys.chartKey(designId, pattern.title(), chartExtension),
        batch.chart(), "text/" + chartExtension, uploaded);

    for (Map.Entry<String, Path> variant : converted.entrySet()) {
      upload(ArtifactKeys.variantKey(albumId, designId, variant.getKey()),
          variant.getValue(), "application/pdf", uploaded);
    }
    Path legacy = converted.get(LEGACY_VARIANT);
    if (legacy != null) {
      upload(ArtifactKeys.legacyKey(albumId, designId), legacy, "application/pdf", uploaded);
    }

    String photoName = batch.photo().getFileName().toString();
    upload(ArtifactKeys.photoKey(photoPrefix, albumId, designId, photoName), batch.photo(), "image/jpeg", uploaded);
    return uploaded;
  }

  private void upload(String key, Path file, String contentType, List<String> uploaded) throws UploadException {
    try {
      store.put(key, file, contentType);
    } catch (IOException | RuntimeException ex) {
      log.error("Upload of {} failed after {} object(s)", key, uploaded.size(), ex);
      throw new UploadException(key, ex);
    }
    uploaded.add(key);
    metrics.increment("publish.upload.objects");
    log.info("Uploaded {} ({})", key, contentType);
  }

  static String extensionOf(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0 && dot < name.length() - 1 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "bin";
  }
}
