package io.github.awsbind.dynamodb;

import java.util.*;

/**
 * BatchWriteItemOperations
 *
 * <p>one table's share of a batch: deletions (key-only items) and puts (full items)
 */
public class BatchWriteItemOperations {

  private final List<Item> deleteRequest = new ArrayList<>();
  private final List<Item> putRequest = new ArrayList<>();

  void addDeleteRequest(Item item) {
    deleteRequest.add(item);
  }

  void addPutRequest(Item item) {
    putRequest.add(item);
  }

  public List<Item> getDeleteRequest() {
    return Collections.unmodifiableList(deleteRequest);
  }

  public List<Item> getPutRequest() {
    return Collections.unmodifiableList(putRequest);
  }

  public int count() {
    return deleteRequest.size() + putRequest.size();
  }

}
