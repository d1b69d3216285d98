package com.crossstitch.publisher.application.catalog;

import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.application.port.store.ItemStorePort.Item;
import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.StoreException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the denormalized design record to the catalog table.
 *
 * <p>The put is unconditional and keyed by ({@code ID}, {@code NPage}); a colliding record is overwritten.</p>
 *
 * @since 0.1.0
 */
public final class ItemCatalogWriter {
  private static final Logger log = LoggerFactory.getLogger(ItemCatalogWriter.class);

  private final ItemStorePort store;
  private final String table;

  public ItemCatalogWriter(ItemStorePort store, String table) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
  }

  /**
   * Stores the record.
   *
   * @param record design record
   * @throws StoreException if the write fails
   */
  public void write(DesignRecord record) throws StoreException {
    store.put(table, toItem(record));
    log.info("Catalog record written for design {} at {}/{}", record.designId(), record.partitionKey(),
        record.nPage());
  }

  static Item toItem(DesignRecord record) {
    PatternInfo pattern = record.pattern();
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("ID", record.partitionKey());
    attributes.put("NPage", record.nPage());
    attributes.put("AlbumID", (long) record.albumId());
    attributes.put("Caption", pattern.title());
    attributes.put("Description", pattern.description());
    attributes.put("DesignID", (long) record.designId());
    attributes.put("EntityType", DesignRecord.ENTITY_TYPE);
    attributes.put("Height", (long) pattern.height());
    attributes.put("NColors", (long) pattern.colors());
    attributes.put("NDownloaded", 0L);
    attributes.put("NGlobalPage", (long) record.globalPage());
    attributes.put("Notes", pattern.notes());
    attributes.put("Width", (long) pattern.width());
    attributes.put("PinID", record.pinId());
    return Item.of(attributes);
  }
}
