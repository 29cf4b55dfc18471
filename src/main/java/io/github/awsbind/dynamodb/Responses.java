package io.github.awsbind.dynamodb;

import java.util.*;
import java.util.Map.Entry;

import com.google.gson.*;

import io.github.awsbind.MalformedResponseException;
import io.github.awsbind.NotFoundException;

/**
 * Responses
 *
 * <p>raw response bytes to typed results
 * <p>structural mismatches at table, container or item level abort the decode with {@link MalformedResponseException};
 * a single field that is not a tagged attribute is dropped
 */
public final class Responses {

  private Responses() {
  }

  /**
   * acknowledge
   * 
   * <p>PutItem, DeleteItem and UpdateItem answer with a json object whose content is not inspected
   */
  public static void acknowledge(byte[] raw) {
    WireJson.object(WireJson.parse(raw));
  }

  /**
   * item
   * 
   * @param raw {"Item": {name: wireAttribute, ...}}
   * @throws NotFoundException if there is no "Item" field
   */
  public static Item item(byte[] raw) {
    JsonObject root = WireJson.object(WireJson.parse(raw));
    if (!root.has("Item"))
      throw new NotFoundException("Item not found");
    return AttributeCodec.decodeItem(root.get("Item"));
  }

  /**
   * batchGetItem
   * 
   * @param raw {"Responses": {table: [item, ...]}}
   * @return table -> items, in response order
   */
  public static Map<String, List<Item>> batchGetItem(byte[] raw) {
    JsonObject tables = WireJson.object(WireJson.object(WireJson.parse(raw)).get("Responses"));
    Map<String, List<Item>> results = new LinkedHashMap<>();
    for (Entry<String, JsonElement> table : tables.entrySet()) {
      List<Item> tableResult = new ArrayList<>();
      for (JsonElement entry : WireJson.array(table.getValue()))
        tableResult.add(AttributeCodec.decodeItem(entry));
      results.put(table.getKey(), tableResult);
    }
    return results;
  }

  /**
   * batchWriteItem
   * 
   * <p>an empty "UnprocessedItems" mapping is full success
   * 
   * @param raw {"UnprocessedItems": {table: [{kind: {"Item"|"Key": {name: wireAttribute, ...}}}, ...]}}
   * @throws MalformedResponseException if "UnprocessedItems" is absent or any level has the wrong shape
   */
  public static UnprocessedItems batchWriteItem(byte[] raw) {
    JsonObject tables = WireJson.object(WireJson.object(WireJson.parse(raw)).get("UnprocessedItems"));
    UnprocessedItems results = new UnprocessedItems();
    for (Entry<String, JsonElement> table : tables.entrySet()) {
      results.table(table.getKey());
      for (JsonElement container : WireJson.array(table.getValue())) {
        for (Entry<String, JsonElement> operation : WireJson.object(container).entrySet()) {
          for (Entry<String, JsonElement> attributes : WireJson.object(operation.getValue()).entrySet())
            results.add(table.getKey(), operation.getKey(), AttributeCodec.decodeItem(attributes.getValue()));
        }
      }
    }
    return results;
  }

}
