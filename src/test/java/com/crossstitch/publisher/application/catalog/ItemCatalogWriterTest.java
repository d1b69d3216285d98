package com.crossstitch.publisher.application.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.testing.InMemoryItemStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ItemCatalogWriterTest {
  private static final String TABLE = "CrossStitchItems";

  private final DesignRecord record = new DesignRecord(7, "00043", 121, 301,
      PatternInfo.of("Rose Garden", "Uses DMC threads.", 120, 80, 12), "pin-9");

  @Test
  void writesDenormalizedDesignItem() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore();

    new ItemCatalogWriter(store, TABLE).write(record);

    Map<String, Object> item = store.find(TABLE, Map.of("ID", "ALB#0007", "NPage", "00043")).orElseThrow();
    assertEquals(7L, item.get("AlbumID"));
    assertEquals("Rose Garden", item.get("Caption"));
    assertEquals("120 x 80 stitches 12 colors", item.get("Description"));
    assertEquals(121L, item.get("DesignID"));
    assertEquals("DESIGN", item.get("EntityType"));
    assertEquals(80L, item.get("Height"));
    assertEquals(12L, item.get("NColors"));
    assertEquals(0L, item.get("NDownloaded"));
    assertEquals(301L, item.get("NGlobalPage"));
    assertEquals("Uses DMC threads.", item.get("Notes"));
    assertEquals(120L, item.get("Width"));
    assertEquals("pin-9", item.get("PinID"));
  }

  @Test
  void itemAttributesFollowCatalogLayout() {
    assertEquals(List.of("ID", "NPage", "AlbumID", "Caption", "Description", "DesignID", "EntityType", "Height",
        "NColors", "NDownloaded", "NGlobalPage", "Notes", "Width", "PinID"),
        List.copyOf(ItemCatalogWriter.toItem(record).attributes().keySet()));
  }

  @Test
  void rewriteOverwritesSameKey() throws Exception {
    InMemoryItemStore store = new InMemoryItemStore();
    ItemCatalogWriter writer = new ItemCatalogWriter(store, TABLE);

    writer.write(record);
    writer.write(new DesignRecord(7, "00043", 122, 302, PatternInfo.of("Other", "", 1, 1, 1), ""));

    assertEquals(1, store.items(TABLE).size());
    assertEquals(122L, store.items(TABLE).get(0).get("DesignID"));
  }

  @Test
  void storeFailurePropagates() {
    InMemoryItemStore store = new InMemoryItemStore().fail("put");

    assertThrows(StoreException.class, () -> new ItemCatalogWriter(store, TABLE).write(record));
  }
}
