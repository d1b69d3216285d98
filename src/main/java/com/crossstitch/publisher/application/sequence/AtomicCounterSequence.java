package com.crossstitch.publisher.application.sequence;

import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.domain.error.StoreException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Allocates sequence values with an atomic counter item per sequence.
 * <p><strong>Why:</strong> A read-max-then-add allocation races when two publishers run at once; a store-side
 * {@code ADD 1} never hands out the same value twice.</p>
 * <p><strong>Role:</strong> Default {@link Sequence} strategy ({@code sequenceMode=atomic}).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>On first use of a counter, seed it with the catalog's current maximum using a put-if-absent.</li>
 *   <li>Advance the counter with an atomic increment and return the new value.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; concurrent seeding is resolved by the conditional put.</p>
 *
 * @since 0.1.0
 */
public final class AtomicCounterSequence implements Sequence {
  private static final Logger log = LoggerFactory.getLogger(AtomicCounterSequence.class);

  static final String COUNTER_SORT_KEY = "SEQ";
  static final String COUNTER_ENTITY_TYPE = "SEQUENCE";
  static final String VALUE_ATTRIBUTE = "Value";

  private final ItemStorePort store;
  private final String table;
  private final CatalogMaxima maxima;
  private final Set<String> seeded = ConcurrentHashMap.newKeySet();

  public AtomicCounterSequence(ItemStorePort store, String table, CatalogMaxima maxima) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
    this.maxima = Objects.requireNonNull(maxima, "maxima");
  }

  @Override
  public long next(SequenceKind kind, String partitionKey) throws StoreException {
    String counterId = counterId(kind, partitionKey);
    Map<String, Object> key = Map.of("ID", counterId, "NPage", COUNTER_SORT_KEY);
    if (!seeded.contains(counterId)) {
      seed(kind, partitionKey, counterId);
      seeded.add(counterId);
    }
    long value = store.increment(table, key, VALUE_ATTRIBUTE, 1);
    log.debug("Allocated {} = {} from counter {}", kind, value, counterId);
    return value;
  }

  private void seed(SequenceKind kind, String partitionKey, String counterId) throws StoreException {
    long current = maxima.currentMax(kind, partitionKey);
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("ID", counterId);
    attributes.put("NPage", COUNTER_SORT_KEY);
    attributes.put("EntityType", COUNTER_ENTITY_TYPE);
    attributes.put(VALUE_ATTRIBUTE, current);
    boolean created = store.putIfAbsent(table, Item.of(attributes), "ID");
    if (created) {
      log.info("Seeded sequence counter {} at {}", counterId, current);
    }
  }

  /**
   * Builds the counter item id, for example {@code SEQ#ALBUM_PAGE#ALB#0007}.
   *
   * @param kind sequence
   * @param partitionKey album partition key for partitioned sequences
   * @return counter id
   */
  static String counterId(SequenceKind kind, String partitionKey) {
    if (kind.partitioned()) {
      return "SEQ#" + kind.name() + "#" + CatalogMaxima.requirePartition(partitionKey);
    }
    return "SEQ#" + kind.name();
  }
}
