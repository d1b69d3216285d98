package com.crossstitch.publisher.application.audit;

import com.crossstitch.publisher.application.artifact.ArtifactKeys;
import com.crossstitch.publisher.application.artifact.BatchFolderReader;
import com.crossstitch.publisher.application.port.ObjectStorePort;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanCondition;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanPage;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanRequest;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.error.StoreException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Audits object storage for designs missing any required PDF.
 * <p><strong>Flow:</strong> scan every {@code DESIGN} item, list every key under {@code pdfs/}, compare each
 * design's expected variant and legacy keys case-insensitively, and write a {@code designId,albumId} report
 * sorted by design id.</p>
 *
 * @since 0.1.0
 */
public final class PdfAuditUseCase {
  private static final Logger log = LoggerFactory.getLogger(PdfAuditUseCase.class);
  static final String ALL_PRESENT = "All required PDFs are present.";
  private static final int DESIGN_PROGRESS_EVERY = 200;

  private final ItemStorePort items;
  private final String table;
  private final ObjectStorePort objects;
  private final ProgressSink progress;

  public PdfAuditUseCase(ItemStorePort items, String table, ObjectStorePort objects, ProgressSink progress) {
    this.items = Objects.requireNonNull(items, "items");
    this.table = Objects.requireNonNull(table, "table");
    this.objects = Objects.requireNonNull(objects, "objects");
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
  }

  /**
   * Runs the audit and writes the report.
   *
   * @param reportPath report file; overwritten
   * @return designs with missing PDFs, sorted by design id
   * @throws StoreException if the design scan fails
   * @throws IOException if the key listing or report write fails
   */
  public List<MissingPdf> run(Path reportPath) throws StoreException, IOException {
    List<DesignLocation> designs = loadDesigns();
    progress.report("Fetched " + designs.size() + " designs from the item store.");
    Set<String> keys = loadPdfKeys();
    List<MissingPdf> missing = findMissing(designs, keys);
    writeReport(reportPath, missing);
    progress.report("Missing PDFs for " + missing.size() + " design(s). Report written to: " + reportPath);
    log.info("PDF audit found {} design(s) with missing PDFs", missing.size());
    return missing;
  }

  List<DesignLocation> loadDesigns() throws StoreException {
    List<DesignLocation> designs = new ArrayList<>();
    ScanRequest request = ScanRequest.firstPage(table,
        List.of(ScanCondition.equalTo("EntityType", DesignRecord.ENTITY_TYPE)),
        List.of("AlbumID", "DesignID", "EntityType"));
    while (true) {
      ScanPage page = items.scan(request);
      for (Item item : page.items()) {
        var albumId = item.number("AlbumID");
        var designId = item.number("DesignID");
        if (albumId.isEmpty() || designId.isEmpty()) {
          log.debug("Skipping design item without numeric AlbumID/DesignID: {}", item.attributes());
          continue;
        }
        designs.add(new DesignLocation(albumId.get().intValue(), designId.get().intValue()));
      }
      if (!designs.isEmpty() && designs.size() % DESIGN_PROGRESS_EVERY == 0) {
        progress.report("Loaded " + designs.size() + " designs so far...");
      }
      if (!page.hasMore()) {
        return designs;
      }
      request = request.next(page.lastEvaluatedKey());
    }
  }

  private Set<String> loadPdfKeys() throws IOException {
    Set<String> keys = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    keys.addAll(objects.listKeys(ArtifactKeys.PDF_PREFIX));
    progress.report("Indexed " + keys.size() + " PDF objects.");
    return keys;
  }

  static List<MissingPdf> findMissing(List<DesignLocation> designs, Set<String> existingKeys) {
    List<MissingPdf> missing = new ArrayList<>();
    for (DesignLocation design : designs) {
      List<String> absent = ArtifactKeys
          .expectedPdfKeys(design.albumId(), design.designId(), BatchFolderReader.REQUIRED_PDF_VARIANTS).stream()
          .filter(key -> !existingKeys.contains(key))
          .toList();
      if (!absent.isEmpty()) {
        missing.add(new MissingPdf(design.designId(), design.albumId(), absent));
      }
    }
    missing.sort(Comparator.comparingInt(MissingPdf::designId));
    return missing;
  }

  static void writeReport(Path reportPath, List<MissingPdf> missing) throws IOException {
    List<String> lines = missing.isEmpty()
        ? List.of(ALL_PRESENT)
        : missing.stream().map(MissingPdf::reportLine).toList();
    Path parent = reportPath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(reportPath, lines, StandardCharsets.UTF_8);
    log.debug("Wrote {} report line(s) to {}", lines.size(), reportPath);
  }

  /** Album and design id of one catalogued design. */
  record DesignLocation(int albumId, int designId) {
  }
}
