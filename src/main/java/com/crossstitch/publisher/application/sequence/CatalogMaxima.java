package com.crossstitch.publisher.application.sequence;

import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.application.port.store.ItemStorePort.ItemQuery;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.error.StoreException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the current maximum of each sequence from the design catalog.
 *
 * <p>Each lookup is a descending, limit-one query: the {@code DesignsByID-index} and {@code Designs-index}
 * secondary indexes on {@code EntityType="DESIGN"} for design ids and global pages, and the album partition
 * for album pages.</p>
 *
 * @since 0.1.0
 */
public final class CatalogMaxima {
  static final String DESIGNS_BY_ID_INDEX = "DesignsByID-index";
  static final String DESIGNS_INDEX = "Designs-index";

  private final ItemStorePort store;
  private final String table;

  public CatalogMaxima(ItemStorePort store, String table) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
  }

  /**
   * Returns the largest value stored for a sequence.
   *
   * @param kind sequence
   * @param partitionKey album partition key for {@link SequenceKind#ALBUM_PAGE}
   * @return current maximum, or 0 when the catalog holds none
   * @throws StoreException if the query fails or the stored value is not numeric
   */
  public long currentMax(SequenceKind kind, String partitionKey) throws StoreException {
    return switch (kind) {
      case DESIGN_ID -> numeric(latestOnIndex(DESIGNS_BY_ID_INDEX), "DesignID");
      case GLOBAL_PAGE -> numeric(latestOnIndex(DESIGNS_INDEX), "NGlobalPage");
      case ALBUM_PAGE -> albumPage(store.queryLatest(
          ItemQuery.onTable(table, "ID", requirePartition(partitionKey))));
    };
  }

  private Optional<Item> latestOnIndex(String index) throws StoreException {
    return store.queryLatest(ItemQuery.onIndex(table, index, "EntityType", DesignRecord.ENTITY_TYPE));
  }

  private static long numeric(Optional<Item> latest, String attribute) throws StoreException {
    if (latest.isEmpty() || !latest.get().has(attribute)) {
      return 0;
    }
    return latest.get().number(attribute)
        .orElseThrow(() -> new StoreException("Non-numeric " + attribute + " in catalog", null));
  }

  private static long albumPage(Optional<Item> latest) throws StoreException {
    Optional<String> page = latest.flatMap(item -> item.string("NPage"));
    if (page.isEmpty()) {
      return 0;
    }
    return parsePage(page.get());
  }

  /**
   * Parses a zero-padded page such as {@code 00042}.
   *
   * @param page stored page value
   * @return numeric page; 0 for an all-zero or empty value
   * @throws StoreException if the value is not numeric
   */
  static long parsePage(String page) throws StoreException {
    String trimmed = page.strip().replaceFirst("^0+", "");
    if (trimmed.isEmpty()) {
      return 0;
    }
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new StoreException("Non-numeric NPage '" + page + "' in catalog", ex);
    }
  }

  static String requirePartition(String partitionKey) {
    if (partitionKey == null || partitionKey.isBlank()) {
      throw new IllegalArgumentException("ALBUM_PAGE requires an album partition key");
    }
    return partitionKey;
  }
}
