package io.github.awsbind.dynamodb;

import java.util.*;
import java.util.Map.Entry;

import com.google.gson.*;

/**
 * Query
 *
 * <p>the json body of one dynamodb call, built up field by field
 */
public class Query {

  public static final String ADD = "ADD";
  public static final String PUT = "PUT";
  public static final String DELETE = "DELETE";

  private final JsonObject buffer = new JsonObject();

  public Query() {
  }

  public Query(Table table) {
    buffer.addProperty("TableName", table.getName());
  }

  public Query addKey(Table table, Key key) {
    buffer.add("Key", encodeKey(table.getKey(), key));
    return this;
  }

  public Query addItem(Item item) {
    buffer.add("Item", AttributeCodec.encodeItem(item));
    return this;
  }

  /**
   * addUpdates
   * 
   * <p>a scalar DELETE carries no value and removes the whole attribute
   * 
   * @param action {@link #ADD}, {@link #PUT} or {@link #DELETE}
   */
  // https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_AttributeValueUpdate.html
  public Query addUpdates(List<Attribute> attributes, String action) {
    JsonObject updates = new JsonObject();
    for (Attribute attribute : attributes) {
      if (updates.has(attribute.getName()))
        continue; // first one wins
      JsonObject update = new JsonObject();
      update.addProperty("Action", action);
      if (!DELETE.equals(action) || attribute.getType().isSet())
        update.add("Value", AttributeCodec.encode(attribute));
      updates.add(attribute.getName(), update);
    }
    buffer.add("AttributeUpdates", updates);
    return this;
  }

  // https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_BatchGetItem.html
  public Query addRequestItems(Map<Table, List<Key>> tableKeys) {
    JsonObject requestItems = new JsonObject();
    for (Entry<Table, List<Key>> entry : tableKeys.entrySet()) {
      JsonArray keys = new JsonArray();
      for (Key key : entry.getValue())
        keys.add(encodeKey(entry.getKey().getKey(), key));
      JsonObject keysAndAttributes = new JsonObject();
      keysAndAttributes.add("Keys", keys);
      requestItems.add(entry.getKey().getName(), keysAndAttributes);
    }
    buffer.add("RequestItems", requestItems);
    return this;
  }

  // https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_BatchWriteItem.html
  public Query addBatchWriteItemOperations(BatchWriteItemRequest request) {
    JsonObject requestItems = new JsonObject();
    for (Entry<String, BatchWriteItemOperations> entry : request.getOperations().entrySet()) {
      JsonArray writeRequests = new JsonArray();
      for (Item key : entry.getValue().getDeleteRequest())
        writeRequests.add(writeRequest(UnprocessedItems.DELETE_REQUEST, "Key", key));
      for (Item item : entry.getValue().getPutRequest())
        writeRequests.add(writeRequest(UnprocessedItems.PUT_REQUEST, "Item", item));
      requestItems.add(entry.getKey(), writeRequests);
    }
    buffer.add("RequestItems", requestItems);
    return this;
  }

  private static JsonObject writeRequest(String kind, String field, Item item) {
    JsonObject body = new JsonObject();
    body.add(field, AttributeCodec.encodeItem(item));
    JsonObject writeRequest = new JsonObject();
    writeRequest.add(kind, body);
    return writeRequest;
  }

  static JsonObject encodeKey(PrimaryKey primaryKey, Key key) {
    JsonObject wire = new JsonObject();
    Attribute hash = primaryKey.getKeyAttribute();
    wire.add(hash.getName(), AttributeCodec.encode(Attribute.of(hash.getType(), hash.getName(), key.getHashKey())));
    Attribute range = primaryKey.getRangeAttribute();
    if (range != null && key.getRangeKey() != null)
      wire.add(range.getName(), AttributeCodec.encode(Attribute.of(range.getType(), range.getName(), key.getRangeKey())));
    return wire;
  }

  public JsonObject toJson() {
    return buffer.deepCopy();
  }

  public String toString() {
    return buffer.toString();
  }

}
