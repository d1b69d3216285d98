package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.application.port.ClockPort;
import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanCondition;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanPage;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ScanRequest;
import com.crossstitch.publisher.domain.campaign.Recipient;
import com.crossstitch.publisher.domain.error.StoreException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads campaign recipients from the users table and stamps them after a send.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Scan every page, tolerating string and list-shaped email and name attributes.</li>
 *   <li>Deduplicate addresses case-insensitively; the first item wins.</li>
 *   <li>Filter verified and subscribed users client-side; count them server-side.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators.</p>
 *
 * @since 0.1.0
 */
public final class RecipientDirectory {
  private static final Logger log = LoggerFactory.getLogger(RecipientDirectory.class);

  private final ItemStorePort store;
  private final UsersSchema schema;
  private final ClockPort clock;

  public RecipientDirectory(ItemStorePort store, UsersSchema schema, ClockPort clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  public UsersSchema schema() {
    return schema;
  }

  /**
   * Fetches recipients.
   *
   * @param onlyVerified keep only items whose verified flag is {@code true}
   * @param onlySubscribed drop items whose unsubscribed flag is {@code true}
   * @return recipients in scan order, unique by lowercase address
   * @throws StoreException if a scan page fails
   */
  public List<Recipient> fetchRecipients(boolean onlyVerified, boolean onlySubscribed) throws StoreException {
    List<String> projection = List.of(schema.emailAttribute(), schema.firstNameAttribute(), schema.idAttribute(),
        schema.cidAttribute(), schema.verifiedAttribute(), schema.unsubscribedAttribute());
    ScanRequest request = ScanRequest.firstPage(schema.table(), List.of(), projection);
    Set<String> seen = new HashSet<>();
    List<Recipient> recipients = new ArrayList<>();
    while (true) {
      ScanPage page = store.scan(request);
      for (Item item : page.items()) {
        Optional<String> email = emailOf(item);
        if (email.isEmpty() || !seen.add(email.get().toLowerCase(Locale.ROOT))) {
          continue;
        }
        boolean verified = item.bool(schema.verifiedAttribute()).orElse(false);
        boolean unsubscribed = item.bool(schema.unsubscribedAttribute()).orElse(false);
        if ((onlyVerified && !verified) || (onlySubscribed && unsubscribed)) {
          continue;
        }
        Map<String, Object> key = new LinkedHashMap<>();
        Object id = item.attributes().get(schema.idAttribute());
        if (id != null) {
          key.put(schema.idAttribute(), id);
        }
        recipients.add(new Recipient(email.get(), firstNameOf(item), key,
            item.string(schema.cidAttribute()).map(String::trim), verified, unsubscribed));
      }
      if (!page.hasMore()) {
        break;
      }
      request = request.next(page.lastEvaluatedKey());
    }
    log.info("Fetched {} user emails", recipients.size());
    return recipients;
  }

  /**
   * Counts verified users that have not opted out, server-side.
   *
   * @return number of eligible users
   * @throws StoreException if the count fails
   */
  public long countEligible() throws StoreException {
    return store.count(schema.table(), List.of(
        ScanCondition.equalTo(schema.verifiedAttribute(), Boolean.TRUE),
        ScanCondition.notTrue(schema.unsubscribedAttribute())));
  }

  /**
   * Sets {@code LastEmailDate} to the current instant. Keyed by the user id when known, else by email.
   *
   * @param recipient recipient just sent to
   * @throws StoreException if the update fails
   */
  public void markSent(Recipient recipient) throws StoreException {
    Map<String, Object> key = recipient.recordKey().isEmpty()
        ? Map.of(schema.emailAttribute(), recipient.email())
        : recipient.recordKey();
    store.update(schema.table(), key, Map.of(UsersSchema.LAST_EMAIL_DATE, clock.now().toString()));
  }

  private Optional<String> emailOf(Item item) {
    Optional<String> single = item.string(schema.emailAttribute()).filter(v -> !v.isBlank());
    if (single.isPresent()) {
      return single.map(String::trim);
    }
    String last = null;
    for (String entry : item.stringList(schema.emailAttribute())) {
      if (!entry.isBlank()) {
        last = entry.trim();
      }
    }
    return Optional.ofNullable(last);
  }

  private Optional<String> firstNameOf(Item item) {
    Optional<String> single = item.string(schema.firstNameAttribute()).filter(v -> !v.isBlank());
    if (single.isPresent()) {
      return single.map(String::trim);
    }
    return item.stringList(schema.firstNameAttribute()).stream()
        .filter(v -> !v.isBlank())
        .map(String::trim)
        .findFirst();
  }
}
