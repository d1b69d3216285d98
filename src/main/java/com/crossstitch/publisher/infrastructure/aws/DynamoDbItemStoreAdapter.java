package com.crossstitch.publisher.infrastructure.aws;

import com.crossstitch.publisher.application.port.store.ItemStorePort;
import com.crossstitch.publisher.domain.error.StoreException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * <strong>What:</strong> {@link ItemStorePort} backed by DynamoDB.
 * <p><strong>Values:</strong> {@code String} maps to {@code S}, numbers to {@code N}, {@code Boolean} to
 * {@code BOOL} and lists to {@code L} of strings. Reads map {@code SS} to lists as well; {@code NULL}, map and
 * binary attributes are dropped.</p>
 * <p><strong>Filters:</strong> {@link ScanCondition.AttributeEquals} renders as {@code #a = :v};
 * {@link ScanCondition.AttributeNotTrue} as {@code (attribute_not_exists(#a) OR #a = :false)};
 * {@link ScanCondition.BeginsWith} as {@code begins_with(#a, :v)}.</p>
 * <p><strong>Errors:</strong> every {@link SdkException} becomes a {@link StoreException} naming the table and
 * operation.</p>
 *
 * @since 0.1.0
 */
public final class DynamoDbItemStoreAdapter implements ItemStorePort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DynamoDbItemStoreAdapter.class);

  private final DynamoDbClient client;

  public DynamoDbItemStoreAdapter(String region) {
    this(DynamoDbClient.builder().region(Region.of(region)).build());
  }

  public DynamoDbItemStoreAdapter(DynamoDbClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public Optional<Item> queryLatest(ItemQuery query) throws StoreException {
    QueryRequest.Builder builder = QueryRequest.builder()
        .tableName(query.table())
        .keyConditionExpression("#pk = :pk")
        .expressionAttributeNames(Map.of("#pk", query.partitionAttribute()))
        .expressionAttributeValues(Map.of(":pk", toAttribute(query.partitionValue())))
        .scanIndexForward(false)
        .limit(1);
    query.indexName().ifPresent(builder::indexName);
    try {
      QueryResponse response = client.query(builder.build());
      if (!response.hasItems() || response.items().isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(fromAttributes(response.items().get(0)));
    } catch (SdkException ex) {
      throw failure("query", query.table(), ex);
    }
  }

  @Override
  public List<Item> queryPartition(
      String table, String partitionAttribute, Object partitionValue, List<String> projection)
      throws StoreException {
    Map<String, String> names = new HashMap<>();
    names.put("#pk", partitionAttribute);
    String projectionExpression = projectionPlaceholders(projection, names);
    List<Item> items = new ArrayList<>();
    Map<String, AttributeValue> startKey = null;
    try {
      do {
        QueryRequest.Builder builder = QueryRequest.builder()
            .tableName(table)
            .keyConditionExpression("#pk = :pk")
            .expressionAttributeNames(names)
            .expressionAttributeValues(Map.of(":pk", toAttribute(partitionValue)));
        if (!projectionExpression.isEmpty()) {
          builder.projectionExpression(projectionExpression);
        }
        if (startKey != null) {
          builder.exclusiveStartKey(startKey);
        }
        QueryResponse response = client.query(builder.build());
        if (response.hasItems()) {
          response.items().forEach(raw -> items.add(fromAttributes(raw)));
        }
        startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
            ? response.lastEvaluatedKey()
            : null;
      } while (startKey != null);
    } catch (SdkException ex) {
      throw failure("query", table, ex);
    }
    return items;
  }

  @Override
  public ScanPage scan(ScanRequest request) throws StoreException {
    Expressions filter = Expressions.filter(request.conditions());
    software.amazon.awssdk.services.dynamodb.model.ScanRequest.Builder builder =
        software.amazon.awssdk.services.dynamodb.model.ScanRequest.builder().tableName(request.table());
    Map<String, String> names = new HashMap<>(filter.names());
    if (!filter.expression().isEmpty()) {
      builder.filterExpression(filter.expression()).expressionAttributeValues(filter.values());
    }
    String projection = projectionPlaceholders(request.projection(), names);
    if (!projection.isEmpty()) {
      builder.projectionExpression(projection);
    }
    if (!names.isEmpty()) {
      builder.expressionAttributeNames(names);
    }
    if (!request.startKey().isEmpty()) {
      builder.exclusiveStartKey(toAttributes(request.startKey()));
    }
    try {
      ScanResponse response = client.scan(builder.build());
      List<Item> items = new ArrayList<>();
      if (response.hasItems()) {
        response.items().forEach(raw -> items.add(fromAttributes(raw)));
      }
      Map<String, Object> next = response.hasLastEvaluatedKey()
          ? fromAttributes(response.lastEvaluatedKey()).attributes()
          : Map.of();
      log.debug("Scanned {} item(s) from {} (more={})", items.size(), request.table(), !next.isEmpty());
      return new ScanPage(items, next);
    } catch (SdkException ex) {
      throw failure("scan", request.table(), ex);
    }
  }

  @Override
  public long count(String table, List<ScanCondition> conditions) throws StoreException {
    Expressions filter = Expressions.filter(conditions);
    long total = 0;
    Map<String, AttributeValue> startKey = null;
    try {
      do {
        software.amazon.awssdk.services.dynamodb.model.ScanRequest.Builder builder =
            software.amazon.awssdk.services.dynamodb.model.ScanRequest.builder()
                .tableName(table)
                .select(Select.COUNT);
        if (!filter.expression().isEmpty()) {
          builder.filterExpression(filter.expression())
              .expressionAttributeNames(filter.names())
              .expressionAttributeValues(filter.values());
        }
        if (startKey != null) {
          builder.exclusiveStartKey(startKey);
        }
        ScanResponse response = client.scan(builder.build());
        total += response.count() == null ? 0 : response.count();
        startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
            ? response.lastEvaluatedKey()
            : null;
      } while (startKey != null);
    } catch (SdkException ex) {
      throw failure("count", table, ex);
    }
    return total;
  }

  @Override
  public void put(String table, Item item) throws StoreException {
    try {
      client.putItem(PutItemRequest.builder().tableName(table).item(toAttributes(item.attributes())).build());
    } catch (SdkException ex) {
      throw failure("put", table, ex);
    }
  }

  @Override
  public boolean putIfAbsent(String table, Item item, String keyAttribute) throws StoreException {
    PutItemRequest request = PutItemRequest.builder()
        .tableName(table)
        .item(toAttributes(item.attributes()))
        .conditionExpression("attribute_not_exists(#k)")
        .expressionAttributeNames(Map.of("#k", keyAttribute))
        .build();
    try {
      client.putItem(request);
      return true;
    } catch (ConditionalCheckFailedException ex) {
      log.debug("Item with {} already present in {}", keyAttribute, table);
      return false;
    } catch (SdkException ex) {
      throw failure("conditional put", table, ex);
    }
  }

  @Override
  public void update(String table, Map<String, Object> key, Map<String, Object> values) throws StoreException {
    if (values.isEmpty()) {
      return;
    }
    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> attributeValues = new HashMap<>();
    List<String> assignments = new ArrayList<>();
    int i = 0;
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      names.put("#u" + i, entry.getKey());
      attributeValues.put(":u" + i, toAttribute(entry.getValue()));
      assignments.add("#u" + i + " = :u" + i);
      i++;
    }
    UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(table)
        .key(toAttributes(key))
        .updateExpression("SET " + String.join(", ", assignments))
        .expressionAttributeNames(names)
        .expressionAttributeValues(attributeValues)
        .build();
    try {
      client.updateItem(request);
    } catch (SdkException ex) {
      throw failure("update", table, ex);
    }
  }

  @Override
  public void delete(String table, Map<String, Object> key) throws StoreException {
    try {
      client.deleteItem(DeleteItemRequest.builder().tableName(table).key(toAttributes(key)).build());
    } catch (SdkException ex) {
      throw failure("delete", table, ex);
    }
  }

  @Override
  public long increment(String table, Map<String, Object> key, String attribute, long delta)
      throws StoreException {
    UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(table)
        .key(toAttributes(key))
        .updateExpression("ADD #n :d")
        .expressionAttributeNames(Map.of("#n", attribute))
        .expressionAttributeValues(Map.of(":d", AttributeValue.fromN(Long.toString(delta))))
        .returnValues(ReturnValue.UPDATED_NEW)
        .build();
    try {
      UpdateItemResponse response = client.updateItem(request);
      AttributeValue updated = response.hasAttributes() ? response.attributes().get(attribute) : null;
      if (updated == null || updated.n() == null) {
        throw new StoreException("Increment of " + attribute + " in " + table + " returned no value", null);
      }
      return new BigDecimal(updated.n()).longValueExact();
    } catch (SdkException | ArithmeticException | NumberFormatException ex) {
      throw failure("increment", table, ex);
    }
  }

  @Override
  public void close() {
    client.close();
  }

  static AttributeValue toAttribute(Object value) {
    if (value instanceof String s) {
      return AttributeValue.fromS(s);
    }
    if (value instanceof Boolean b) {
      return AttributeValue.fromBool(b);
    }
    if (value instanceof Number n) {
      return AttributeValue.fromN(n.toString());
    }
    if (value instanceof List<?> list) {
      return AttributeValue.fromL(list.stream().map(v -> AttributeValue.fromS(String.valueOf(v))).toList());
    }
    throw new IllegalArgumentException("Unsupported attribute value type: "
        + (value == null ? "null" : value.getClass().getName()));
  }

  static Map<String, AttributeValue> toAttributes(Map<String, Object> values) {
    Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    values.forEach((name, value) -> attributes.put(name, toAttribute(value)));
    return attributes;
  }

  static Item fromAttributes(Map<String, AttributeValue> raw) {
    Map<String, Object> values = new LinkedHashMap<>();
    raw.forEach((name, attribute) -> {
      Object converted = fromAttribute(attribute);
      if (converted != null) {
        values.put(name, converted);
      }
    });
    return new Item(values);
  }

  private static Object fromAttribute(AttributeValue attribute) {
    if (attribute.s() != null) {
      return attribute.s();
    }
    if (attribute.n() != null) {
      try {
        return new BigDecimal(attribute.n()).longValueExact();
      } catch (ArithmeticException ex) {
        return attribute.n();
      }
    }
    if (attribute.bool() != null) {
      return attribute.bool();
    }
    if (attribute.hasL()) {
      List<String> list = new ArrayList<>();
      for (AttributeValue element : attribute.l()) {
        Object converted = fromAttribute(element);
        if (converted != null) {
          list.add(String.valueOf(converted));
        }
      }
      return List.copyOf(list);
    }
    if (attribute.hasSs()) {
      return List.copyOf(attribute.ss());
    }
    return null;
  }

  private static String projectionPlaceholders(List<String> projection, Map<String, String> names) {
    List<String> placeholders = new ArrayList<>();
    for (int i = 0; i < projection.size(); i++) {
      String placeholder = "#p" + i;
      names.put(placeholder, projection.get(i));
      placeholders.add(placeholder);
    }
    return String.join(", ", placeholders);
  }

  private static StoreException failure(String operation, String table, Exception ex) {
    return new StoreException("DynamoDB " + operation + " on " + table + " failed: " + ex.getMessage(), ex);
  }

  /** Filter expression with its placeholder maps. */
  record Expressions(String expression, Map<String, String> names, Map<String, AttributeValue> values) {

    static Expressions filter(List<ScanCondition> conditions) {
      List<String> clauses = new ArrayList<>();
      Map<String, String> names = new HashMap<>();
      Map<String, AttributeValue> values = new HashMap<>();
      int i = 0;
      for (ScanCondition condition : conditions) {
        String name = "#a" + i;
        String value = ":v" + i;
        if (condition instanceof ScanCondition.AttributeEquals eq) {
          names.put(name, eq.attribute());
          values.put(value, toAttribute(eq.value()));
          clauses.add(name + " = " + value);
        } else if (condition instanceof ScanCondition.AttributeNotTrue notTrue) {
          names.put(name, notTrue.attribute());
          values.put(value, AttributeValue.fromBool(false));
          clauses.add("(attribute_not_exists(" + name + ") OR " + name + " = " + value + ")");
        } else if (condition instanceof ScanCondition.BeginsWith prefix) {
          names.put(name, prefix.attribute());
          values.put(value, AttributeValue.fromS(prefix.prefix()));
          clauses.add("begins_with(" + name + ", " + value + ")");
        }
        i++;
      }
      return new Expressions(String.join(" AND ", clauses), Map.copyOf(names), Map.copyOf(values));
    }
  }
}
