package com.crossstitch.publisher.application.users;

import com.crossstitch.publisher.application.campaign.SendProgress;
import com.crossstitch.publisher.application.campaign.UnsubscribeTokenizer;
import com.crossstitch.publisher.application.campaign.UsersSchema;
import com.crossstitch.publisher.application.port.ClockPort;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanCondition;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanPage;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanRequest;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One-off maintenance passes over the users table and the user items of the designs table.
 * <p><strong>Passes:</strong>
 * <ul>
 *   <li>{@link #initUnsubscribeFields()} adds a random {@code UnsubscribeToken} and {@code Unsubscribed=false}
 *   where missing, keyed by {@code ID}.</li>
 *   <li>{@link #initCidFields()} adds a random 32-hex {@code cid} where missing, keyed by {@code ID} and
 *   {@code NPage}; {@link #initItemsCidFields(String)} does the same for {@code USR#} items of the designs
 *   table.</li>
 *   <li>{@link #markVerified()} sets {@code Verified=true} and copies {@code CreatedAt} into
 *   {@code VerifiedAt}.</li>
 *   <li>{@link #removeSuppressed(List, String, boolean)} deletes the {@code USR#} items of suppressed emails.</li>
 * </ul>
 * Existing values are never overwritten, so every backfill can be re-run.
 * <p><strong>Thread-safety:</strong> Not thread-safe; run one pass at a time.</p>
 *
 * @since 0.1.0
 */
public final class UserMaintenanceUseCase {
  private static final Logger log = LoggerFactory.getLogger(UserMaintenanceUseCase.class);
  static final String UNSUBSCRIBE_TOKEN = "UnsubscribeToken";
  static final String SORT_KEY = "NPage";
  static final String CREATED_AT = "CreatedAt";
  static final String VERIFIED_AT = "VerifiedAt";
  static final String USER_PREFIX = "USR#";
  static final int TOKEN_BYTES = 32;
  static final int PROGRESS_EVERY = 50;
  static final int SUPPRESSED_LINE_STRIDE = 3;
  private static final String BOM = "\uFEFF";
  private static final String SUPPRESS_LABEL = "[Suppress]";
  private static final String VERIFY_LABEL = "[Verify]";

  private final ItemStorePort store;
  private final UsersSchema schema;
  private final ProgressSink progress;
  private final ClockPort clock;
  private final Supplier<String> tokens;
  private final Supplier<String> cids;

  public UserMaintenanceUseCase(ItemStorePort store, UsersSchema schema, ProgressSink progress, ClockPort clock) {
    this(store, schema, progress, clock, () -> UnsubscribeTokenizer.generateRandomToken(TOKEN_BYTES),
        UnsubscribeTokenizer::generateHexId);
  }

  UserMaintenanceUseCase(
      ItemStorePort store,
      UsersSchema schema,
      ProgressSink progress,
      ClockPort clock,
      Supplier<String> tokens,
      Supplier<String> cids) {
    this.store = Objects.requireNonNull(store, "store");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.cids = Objects.requireNonNull(cids, "cids");
  }

  /**
   * Fills in missing unsubscribe attributes.
   *
   * @return pass counters
   * @throws StoreException if a scan or update fails; earlier updates are kept
   */
  public MaintenanceReport initUnsubscribeFields() throws StoreException {
    String id = schema.idAttribute();
    String unsubscribed = schema.unsubscribedAttribute();
    int scanned = 0;
    int updated = 0;
    int skipped = 0;
    int incomplete = 0;
    ScanRequest request = ScanRequest.firstPage(schema.table(), List.of(), List.of());
    while (true) {
      ScanPage page = store.scan(request);
      for (Item item : page.items()) {
        scanned++;
        Object idValue = item.attributes().get(id);
        if (idValue == null) {
          incomplete++;
          continue;
        }
        boolean hasToken = item.string(UNSUBSCRIBE_TOKEN).filter(v -> !v.isBlank()).isPresent();
        boolean hasFlag = item.has(unsubscribed);
        if (hasToken && hasFlag) {
          skipped++;
          continue;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        if (!hasToken) {
          values.put(UNSUBSCRIBE_TOKEN, tokens.get());
        }
        if (!hasFlag) {
          values.put(unsubscribed, Boolean.FALSE);
        }
        store.update(schema.table(), Map.of(id, idValue), values);
        updated++;
      }
      if (!page.hasMore()) {
        break;
      }
      request = request.next(page.lastEvaluatedKey());
    }
    MaintenanceReport report = new MaintenanceReport(scanned, updated, skipped, incomplete, 0);
    progress.report("Unsubscribe field initialization finished. Updated " + updated + " user(s), skipped "
        + skipped + " user(s).");
    log.info("Unsubscribe field initialization: {}", report);
    return report;
  }

  /**
   * Fills in missing tracking ids on the users table.
   *
   * @return pass counters; {@code incomplete} counts items without {@code NPage}
   * @throws StoreException if the count, a scan or an update fails; earlier updates are kept
   */
  public MaintenanceReport initCidFields() throws StoreException {
    return backfillCids(schema.table(), List.of());
  }

  /**
   * Fills in missing tracking ids on the user items ({@code ID} starting with {@code USR#}) of the designs table.
   *
   * @param itemsTable designs table name
   * @return pass counters; {@code incomplete} counts user items without {@code NPage}
   * @throws StoreException if the count, a scan or an update fails; earlier updates are kept
   */
  public MaintenanceReport initItemsCidFields(String itemsTable) throws StoreException {
    Objects.requireNonNull(itemsTable, "itemsTable");
    return backfillCids(itemsTable, List.of(ScanCondition.beginsWith(schema.idAttribute(), USER_PREFIX)));
  }

  private MaintenanceReport backfillCids(String table, List<ScanCondition> conditions) throws StoreException {
    String id = schema.idAttribute();
    String cid = schema.cidAttribute();
    String label = "[" + table + "]";
    long total = store.count(table, conditions);
    progress.report(total > 0
        ? label + " Total users found: " + total + "."
        : label + " Could not determine total users (count returned 0).");

    int scanned = 0;
    int updated = 0;
    int skipped = 0;
    int incomplete = 0;
    ScanRequest request = ScanRequest.firstPage(table, conditions, List.of(id, SORT_KEY, cid));
    while (true) {
      ScanPage page = store.scan(request);
      for (Item item : page.items()) {
        scanned++;
        Object idValue = item.attributes().get(id);
        if (idValue == null) {
          continue;
        }
        String nPage = item.string(SORT_KEY).filter(v -> !v.isBlank()).orElse(null);
        if (nPage == null) {
          incomplete++;
          continue;
        }
        if (item.string(cid).filter(v -> !v.isBlank()).isPresent()) {
          skipped++;
          continue;
        }
        Map<String, Object> key = new LinkedHashMap<>();
        key.put(id, idValue);
        key.put(SORT_KEY, nPage);
        store.update(table, key, Map.of(cid, cids.get()));
        updated++;
        if ((updated + skipped) % PROGRESS_EVERY == 0) {
          progress.report(label + " Scanned " + scanned + ", updated " + updated + ", skipped " + skipped
              + ", missing NPage " + incomplete + ". " + remaining(total, updated + skipped + incomplete) + ".");
        }
      }
      if (!page.hasMore()) {
        break;
      }
      request = request.next(page.lastEvaluatedKey());
    }
    MaintenanceReport report = new MaintenanceReport(scanned, updated, skipped, incomplete, 0);
    progress.report(label + " cid initialization finished. Scanned " + scanned + ", updated " + updated
        + ", skipped " + skipped + ", missing NPage " + incomplete + ".");
    log.info("cid initialization on {}: {}", table, report);
    return report;
  }

  /**
   * Marks every user verified as of their creation time. Users already verified with a {@code VerifiedAt} are
   * skipped; a failed update is reported and counted, and the pass moves on.
   *
   * @return pass counters; {@code incomplete} counts users without {@code ID} or {@code CreatedAt}
   * @throws StoreException if the count or a scan fails
   */
  public MaintenanceReport markVerified() throws StoreException {
    String id = schema.idAttribute();
    String verified = schema.verifiedAttribute();
    long total = store.count(schema.table(), List.of());
    progress.report(schema.table() + ": total users " + total + ".");

    int scanned = 0;
    int updated = 0;
    int skipped = 0;
    int incomplete = 0;
    int errors = 0;
    ScanRequest request = ScanRequest.firstPage(
        schema.table(), List.of(), List.of(id, CREATED_AT, verified, VERIFIED_AT, SORT_KEY));
    while (true) {
      ScanPage page = store.scan(request);
      for (Item item : page.items()) {
        scanned++;
        Object idValue = item.attributes().get(id);
        boolean alreadyVerified = item.bool(verified).orElse(false)
            && item.string(VERIFIED_AT).filter(v -> !v.isBlank()).isPresent();
        Object createdAt = item.attributes().get(CREATED_AT);
        if (alreadyVerified) {
          skipped++;
        } else if (idValue == null || createdAt == null || String.valueOf(createdAt).isBlank()) {
          incomplete++;
        } else {
          Map<String, Object> values = new LinkedHashMap<>();
          values.put(verified, Boolean.TRUE);
          values.put(VERIFIED_AT, createdAt);
          try {
            store.update(schema.table(), Map.of(id, idValue), values);
            updated++;
          } catch (StoreException ex) {
            errors++;
            log.warn("Marking user {} verified failed", idValue, ex);
            progress.report(VERIFY_LABEL + " Failed to update " + idValue + ": " + ex.getMessage());
          }
        }
        if (scanned % PROGRESS_EVERY == 0) {
          progress.report(VERIFY_LABEL + " Processed " + scanned + " | Updated " + updated + ", already verified "
              + skipped + ", missing CreatedAt " + incomplete + ", errors " + errors + ". "
              + remaining(total, scanned) + ".");
        }
      }
      if (!page.hasMore()) {
        break;
      }
      request = request.next(page.lastEvaluatedKey());
    }
    MaintenanceReport report = new MaintenanceReport(scanned, updated, skipped, incomplete, errors);
    progress.report(VERIFY_LABEL + " Done. Scanned " + scanned + ", updated " + updated + ", already verified "
        + skipped + ", missing CreatedAt " + incomplete + ", errors " + errors + ".");
    log.info("Verified backfill: {}", report);
    return report;
  }

  /**
   * Deletes every {@code USR#<email>} item of the designs table for the given emails. A failed lookup or delete
   * is reported and counted against that email, and the pass moves on.
   *
   * @param emails suppressed emails, as read by {@link #readSuppressedEmails(Path)}
   * @param itemsTable designs table name
   * @param dryRun count what would be deleted without deleting
   * @return removal counters
   */
  public SuppressionReport removeSuppressed(List<String> emails, String itemsTable, boolean dryRun) {
    Objects.requireNonNull(emails, "emails");
    Objects.requireNonNull(itemsTable, "itemsTable");
    String id = schema.idAttribute();
    String label = (dryRun ? "[dry-run] " : "") + SUPPRESS_LABEL;
    int total = emails.size();
    progress.report(label + " " + total + " suppressed email(s) to process in " + itemsTable + ".");
    long started = clock.nowMillis();
    int deleted = 0;
    int missing = 0;
    int missingSortKey = 0;
    int errors = 0;
    for (int i = 0; i < total; i++) {
      String email = emails.get(i);
      try {
        List<Item> items = store.queryPartition(itemsTable, id, USER_PREFIX + email, List.of(id, SORT_KEY));
        if (items.isEmpty()) {
          missing++;
        }
        for (Item item : items) {
          String nPage = item.string(SORT_KEY).filter(v -> !v.isBlank()).orElse(null);
          if (nPage == null) {
            missingSortKey++;
            continue;
          }
          if (!dryRun) {
            Map<String, Object> key = new LinkedHashMap<>();
            key.put(id, item.attributes().get(id));
            key.put(SORT_KEY, nPage);
            store.delete(itemsTable, key);
          }
          deleted++;
        }
      } catch (StoreException ex) {
        errors++;
        log.warn("Removing suppressed user {} failed", Logs.maskEmail(email), ex);
        progress.report(label + " Error for " + email + ": " + ex.getMessage());
      }
      int processed = i + 1;
      if (processed % PROGRESS_EVERY == 0 || processed == total) {
        progress.report(suppressionLine(label, processed, total, deleted, missing, missingSortKey, errors,
            clock.nowMillis() - started));
      }
    }
    SuppressionReport report = new SuppressionReport(total, deleted, missing, missingSortKey, errors, dryRun);
    progress.report(label + " Done. " + (dryRun ? "Would delete " : "Deleted ") + deleted + ", Missing " + missing
        + ", Missing NPage " + missingSortKey + ", Errors " + errors + ". Total time "
        + SendProgress.duration(clock.nowMillis() - started) + ".");
    log.info("Suppressed user removal: {}", report);
    return report;
  }

  /**
   * Reads a suppression list export. The export holds one entry per three lines with the email first, so only
   * lines 0, 3, 6 and so on are kept, trimmed, when not blank. Invalid UTF-8 is replaced rather than rejected.
   *
   * @param file suppression list export
   * @return emails in file order
   * @throws NoSuchFileException if the file does not exist
   * @throws IOException if the file cannot be read
   */
  public static List<String> readSuppressedEmails(Path file) throws IOException {
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toString(), null, "Suppressed list file not found");
    }
    String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    if (content.startsWith(BOM)) {
      content = content.substring(BOM.length());
    }
    List<String> lines = content.lines().toList();
    List<String> emails = new ArrayList<>();
    for (int i = 0; i < lines.size(); i += SUPPRESSED_LINE_STRIDE) {
      String line = lines.get(i).trim();
      if (!line.isEmpty()) {
        emails.add(line);
      }
    }
    return emails;
  }

  static String suppressionLine(String label, int processed, int total, int deleted, int missing,
      int missingSortKey, int errors, long elapsedMillis) {
    int remaining = Math.max(total - processed, 0);
    long etaMillis = processed > 0 ? elapsedMillis * remaining / processed : 0;
    double percentLeft = total > 0 ? remaining * 100.0 / total : 0;
    return String.format(Locale.ROOT,
        "%s Processed %d/%d | Deleted %d, Missing %d, Missing NPage %d, Errors %d. Elapsed %s, ETA %s, "
            + "Remaining %d (%.1f%% left).",
        label, processed, total, deleted, missing, missingSortKey, errors, SendProgress.duration(elapsedMillis),
        SendProgress.duration(etaMillis), remaining, percentLeft);
  }

  private static String remaining(long total, long done) {
    return total > 0 ? "Remaining ~" + Math.max(total - done, 0) : "Remaining: unknown";
  }
}
