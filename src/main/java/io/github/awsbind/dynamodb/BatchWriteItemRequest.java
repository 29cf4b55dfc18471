package io.github.awsbind.dynamodb;

import java.util.*;

import com.google.common.base.*;

import helpers.LogHelper;
import io.github.awsbind.ValidationException;
import io.github.awsbind.ValidationException.Reason;

/**
 * BatchWriteItemRequest
 *
 * <p>put and delete operations accumulated per table, tables in insertion order
 * <p>not thread-safe
 */
// https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_BatchWriteItem.html
public class BatchWriteItemRequest {

  public static final int MAX_ITEMS = 25;
  public static final int MAX_ITEM_SIZE = 64 * 1024;
  public static final int MAX_REQUEST_SIZE = 1024 * 1024;

  private final Map<String, BatchWriteItemOperations> operations = new LinkedHashMap<>();
  private boolean returnConsumedCapacity;
  private boolean returnItemCollectionMetrics;

  public BatchWriteItemRequest addDeleteRequest(String table, Item key) {
    operations(table).addDeleteRequest(Preconditions.checkNotNull(key, "key"));
    return this;
  }

  public BatchWriteItemRequest addPutRequest(String table, Item item) {
    operations(table).addPutRequest(Preconditions.checkNotNull(item, "item"));
    return this;
  }

  private BatchWriteItemOperations operations(String table) {
    return operations.computeIfAbsent(Preconditions.checkNotNull(table, "table"), k -> new BatchWriteItemOperations());
  }

  public Map<String, BatchWriteItemOperations> getOperations() {
    return Collections.unmodifiableMap(operations);
  }

  /**
   * getItems
   * 
   * @return every item of every table, deletions before puts per table
   */
  public List<Item> getItems() {
    List<Item> items = new ArrayList<>();
    for (BatchWriteItemOperations tableOperations : operations.values()) {
      items.addAll(tableOperations.getDeleteRequest());
      items.addAll(tableOperations.getPutRequest());
    }
    return items;
  }

  public void setReturnConsumedCapacity(boolean value) {
    returnConsumedCapacity = value;
    info("Parsing of the ReturnConsumedCapacity in the response not implemented");
  }

  public void setReturnItemCollectionMetrics(boolean value) {
    returnItemCollectionMetrics = value;
    info("Parsing of the ReturnItemCollectionMetrics in the response not implemented");
  }

  public boolean getReturnConsumedCapacity() {
    return returnConsumedCapacity;
  }

  public boolean getReturnItemCollectionMetrics() {
    return returnItemCollectionMetrics;
  }

  /**
   * validate
   * 
   * <p>the service's hard limits, checked in order: at least one item, at most 25 items, 64KB per item, 1MB in total
   * 
   * @throws ValidationException on the first limit violated
   */
  public void validate() throws ValidationException {
    List<Item> items = getItems();
    if (items.isEmpty())
      throw new ValidationException(Reason.EMPTY_REQUEST, "The request must contain at least 1 item");
    if (items.size() > MAX_ITEMS)
      throw new ValidationException(Reason.TOO_MANY_ITEMS, "Each request cannot contain more than 25 items");
    long totalSize = 0;
    for (Item item : items) {
      int size = item.size();
      if (size > MAX_ITEM_SIZE)
        throw new ValidationException(Reason.ITEM_TOO_LARGE, "The size of the item cannot exceed 64KB");
      totalSize += size;
    }
    if (totalSize > MAX_REQUEST_SIZE)
      throw new ValidationException(Reason.REQUEST_TOO_LARGE, "The size of the request cannot exceed 1MB");
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).add("tables", operations.keySet()).add("items", getItems().size()).toString();
  }

  private void info(Object... args) {
    new LogHelper(this).info(args);
  }

}
