package com.crossstitch.publisher.application.port.store;

import com.crossstitch.publisher.domain.error.StoreException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port over the key/value item store holding designs, albums, users and counters.
 * <p><strong>Why:</strong> Keeps the sequence allocator, catalog writer and campaign independent of the
 * DynamoDB SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code DynamoDbItemStoreAdapter}; tests use {@code InMemoryItemStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Descending single-item queries for "current maximum" lookups.</li>
 *   <li>Paginated filtered scans, partition queries and server-side counts.</li>
 *   <li>Unconditional puts, conditional puts, attribute updates, deletes and atomic increments.</li>
 * </ul>
 * <p><strong>Values:</strong> attribute values are {@link String}, {@link Long}, {@link Boolean} or
 * {@code List<String>}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ItemStorePort {

  /**
   * Returns the item with the greatest sort key in one partition of a table or index.
   *
   * @param query partition and optional index to query
   * @return the latest item, or empty when the partition has none
   * @throws StoreException if the query fails
   */
  Optional<Item> queryLatest(ItemQuery query) throws StoreException;

  /**
   * Reads every item of one table partition, following continuation keys.
   *
   * @param table table name
   * @param partitionAttribute partition key attribute
   * @param partitionValue partition key value
   * @param projection attributes to return; empty returns all
   * @return items of the partition in sort key order
   * @throws StoreException if a query page fails
   */
  List<Item> queryPartition(String table, String partitionAttribute, Object partitionValue, List<String> projection)
      throws StoreException;

  /**
   * Reads one page of a filtered scan.
   *
   * @param request table, filter, projection and continuation key
   * @return items of this page and the continuation key for the next one
   * @throws StoreException if the scan fails
   */
  ScanPage scan(ScanRequest request) throws StoreException;

  /**
   * Counts the items matching every condition, across all pages.
   *
   * @param table table name
   * @param conditions filter conditions combined with AND
   * @return number of matching items
   * @throws StoreException if the count fails
   */
  long count(String table, List<ScanCondition> conditions) throws StoreException;

  /**
   * Writes an item, overwriting any item with the same key.
   *
   * @param table table name
   * @param item full item including key attributes
   * @throws StoreException if the write fails
   */
  void put(String table, Item item) throws StoreException;

  /**
   * Writes an item only when no item with the same key exists.
   *
   * @param table table name
   * @param item full item including key attributes
   * @param keyAttribute partition key attribute checked for absence
   * @return {@code true} when written, {@code false} when an item already existed
   * @throws StoreException if the write fails for any other reason
   */
  boolean putIfAbsent(String table, Item item, String keyAttribute) throws StoreException;

  /**
   * Sets attributes on an existing item.
   *
   * @param table table name
   * @param key full primary key of the item
   * @param values attributes to set
   * @throws StoreException if the update fails
   */
  void update(String table, Map<String, Object> key, Map<String, Object> values) throws StoreException;

  /**
   * Deletes one item; deleting a missing item is not an error.
   *
   * @param table table name
   * @param key full primary key of the item
   * @throws StoreException if the delete fails
   */
  void delete(String table, Map<String, Object> key) throws StoreException;

  /**
   * Atomically adds {@code delta} to a numeric attribute and returns the new value.
   *
   * @param table table name
   * @param key full primary key of the item
   * @param attribute numeric attribute to increment
   * @param delta amount to add
   * @return value after the increment
   * @throws StoreException if the update fails
   */
  long increment(String table, Map<String, Object> key, String attribute, long delta) throws StoreException;

  /**
   * Immutable attribute map of one stored item.
   *
   * @param attributes attribute values keyed by name, in insertion order
   */
  record Item(Map<String, Object> attributes) {
    public Item {
      Objects.requireNonNull(attributes, "attributes");
      Map<String, Object> copy = new LinkedHashMap<>();
      attributes.forEach((name, value) -> copy.put(
          Objects.requireNonNull(name, "attribute name"),
          Objects.requireNonNull(value, () -> "value of " + name)));
      attributes = Collections.unmodifiableMap(copy);
    }

    @Override
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Map is unmodifiable.")
    public Map<String, Object> attributes() {
      return attributes;
    }

    public boolean has(String name) {
      return attributes.containsKey(name);
    }

    public Optional<String> string(String name) {
      Object value = attributes.get(name);
      return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Reads a numeric attribute; numeric strings are accepted for legacy items.
     *
     * @param name attribute name
     * @return numeric value, or empty when absent or not numeric
     */
    public Optional<Long> number(String name) {
      Object value = attributes.get(name);
      if (value instanceof Number n) {
        return Optional.of(n.longValue());
      }
      if (value instanceof String s) {
        try {
          return Optional.of(Long.parseLong(s.trim()));
        } catch (NumberFormatException ex) {
          return Optional.empty();
        }
      }
      return Optional.empty();
    }

    public Optional<Boolean> bool(String name) {
      Object value = attributes.get(name);
      return value instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    /**
     * Reads a string-list attribute.
     *
     * @param name attribute name
     * @return list elements converted to strings, or an empty list
     */
    public List<String> stringList(String name) {
      Object value = attributes.get(name);
      if (value instanceof List<?> list) {
        return list.stream().map(String::valueOf).toList();
      }
      return List.of();
    }

    public static Item of(Map<String, Object> attributes) {
      return new Item(attributes);
    }
  }

  /**
   * Descending, limit-one query against a table or secondary index.
   *
   * @param table table name
   * @param indexName optional index name
   * @param partitionAttribute partition key attribute of the table or index
   * @param partitionValue partition key value
   */
  record ItemQuery(String table, Optional<String> indexName, String partitionAttribute, Object partitionValue) {
    public ItemQuery {
      Objects.requireNonNull(table, "table");
      Objects.requireNonNull(indexName, "indexName");
      Objects.requireNonNull(partitionAttribute, "partitionAttribute");
      Objects.requireNonNull(partitionValue, "partitionValue");
    }

    public static ItemQuery onIndex(String table, String index, String attribute, Object value) {
      return new ItemQuery(table, Optional.of(index), attribute, value);
    }

    public static ItemQuery onTable(String table, String attribute, Object value) {
      return new ItemQuery(table, Optional.empty(), attribute, value);
    }
  }

  /**
   * One page request of a filtered scan.
   *
   * @param table table name
   * @param conditions filter conditions combined with AND
   * @param projection attributes to return; empty returns all
   * @param startKey continuation key from the previous page; empty for the first page
   */
  record ScanRequest(
      String table, List<ScanCondition> conditions, List<String> projection, Map<String, Object> startKey) {
    public ScanRequest {
      Objects.requireNonNull(table, "table");
      conditions = List.copyOf(conditions);
      projection = List.copyOf(projection);
      startKey = Map.copyOf(startKey);
    }

    public static ScanRequest firstPage(String table, List<ScanCondition> conditions, List<String> projection) {
      return new ScanRequest(table, conditions, projection, Map.of());
    }

    public ScanRequest next(Map<String, Object> continuation) {
      return new ScanRequest(table, conditions, projection, continuation);
    }
  }

  /**
   * One page of scan results.
   *
   * @param items items of this page
   * @param lastEvaluatedKey continuation key; empty on the last page
   */
  record ScanPage(List<Item> items, Map<String, Object> lastEvaluatedKey) {
    public ScanPage {
      items = List.copyOf(items);
      lastEvaluatedKey = Map.copyOf(lastEvaluatedKey);
    }

    public boolean hasMore() {
      return !lastEvaluatedKey.isEmpty();
    }
  }

  /** Scan filter condition. */
  sealed interface ScanCondition permits ScanCondition.AttributeEquals, ScanCondition.AttributeNotTrue,
      ScanCondition.BeginsWith {

    /**
     * Tests the condition against an item, mirroring the store's server-side filter semantics.
     *
     * @param item candidate item
     * @return {@code true} when the item matches
     */
    boolean matches(Item item);

    static ScanCondition equalTo(String attribute, Object value) {
      return new AttributeEquals(attribute, value);
    }

    static ScanCondition notTrue(String attribute) {
      return new AttributeNotTrue(attribute);
    }

    static ScanCondition beginsWith(String attribute, String prefix) {
      return new BeginsWith(attribute, prefix);
    }

    /** Attribute exists and equals the value. */
    record AttributeEquals(String attribute, Object value) implements ScanCondition {
      public AttributeEquals {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(value, "value");
      }

      @Override
      public boolean matches(Item item) {
        return value.equals(item.attributes().get(attribute));
      }
    }

    /** Attribute is missing or is boolean {@code false}. */
    record AttributeNotTrue(String attribute) implements ScanCondition {
      public AttributeNotTrue {
        Objects.requireNonNull(attribute, "attribute");
      }

      @Override
      public boolean matches(Item item) {
        Object value = item.attributes().get(attribute);
        return value == null || Boolean.FALSE.equals(value);
      }
    }

    /** String attribute starts with the prefix. */
    record BeginsWith(String attribute, String prefix) implements ScanCondition {
      public BeginsWith {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(prefix, "prefix");
      }

      @Override
      public boolean matches(Item item) {
        return item.attributes().get(attribute) instanceof String s && s.startsWith(prefix);
      }
    }
  }
}
