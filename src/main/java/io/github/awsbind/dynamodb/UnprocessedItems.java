package io.github.awsbind.dynamodb;

import java.util.*;
import java.util.Map.Entry;

import com.google.common.base.*;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import helpers.LogHelper;

/**
 * UnprocessedItems
 *
 * <p>what a batch write did not apply: table -> operation kind -> items, in response order
 * <p>partial success data, not an error; retrying is up to the caller
 */
public class UnprocessedItems {

  public static final String PUT_REQUEST = "PutRequest";
  public static final String DELETE_REQUEST = "DeleteRequest";

  private final Map<String, Map<String, List<Item>>> tables = new LinkedHashMap<>();

  Map<String, List<Item>> table(String table) {
    return tables.computeIfAbsent(table, k -> new LinkedHashMap<>());
  }

  void add(String table, String kind, Item item) {
    table(table).computeIfAbsent(kind, k -> new ArrayList<>()).add(item);
  }

  public Set<String> tableNames() {
    return Collections.unmodifiableSet(tables.keySet());
  }

  /**
   * get
   * 
   * @param table table name
   * @param kind e.g., {@link #PUT_REQUEST}
   * @return the items, empty if none
   */
  public List<Item> get(String table, String kind) {
    Map<String, List<Item>> kinds = tables.get(table);
    if (kinds == null || !kinds.containsKey(kind))
      return Collections.emptyList();
    return Collections.unmodifiableList(kinds.get(kind));
  }

  public int count() {
    int count = 0;
    for (Map<String, List<Item>> kinds : tables.values()) {
      for (List<Item> items : kinds.values())
        count += items.size();
    }
    return count;
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  /**
   * asMap
   * 
   * <p>an immutable copy at every level, in response order
   */
  public Map<String, Map<String, List<Item>>> asMap() {
    ImmutableMap.Builder<String, Map<String, List<Item>>> copy = ImmutableMap.builder();
    for (Entry<String, Map<String, List<Item>>> table : tables.entrySet()) {
      ImmutableMap.Builder<String, List<Item>> kinds = ImmutableMap.builder();
      for (Entry<String, List<Item>> kind : table.getValue().entrySet())
        kinds.put(kind.getKey(), ImmutableList.copyOf(kind.getValue()));
      copy.put(table.getKey(), kinds.build());
    }
    return copy.build();
  }

  /**
   * toRequest
   * 
   * <p>the unprocessed puts and deletes as a new request, for the caller to resend
   */
  public BatchWriteItemRequest toRequest() {
    BatchWriteItemRequest request = new BatchWriteItemRequest();
    for (Entry<String, Map<String, List<Item>>> table : tables.entrySet()) {
      for (Item item : get(table.getKey(), DELETE_REQUEST))
        request.addDeleteRequest(table.getKey(), item);
      for (Item item : get(table.getKey(), PUT_REQUEST))
        request.addPutRequest(table.getKey(), item);
      for (String kind : table.getValue().keySet()) {
        if (!PUT_REQUEST.equals(kind) && !DELETE_REQUEST.equals(kind))
          debug("toRequest", "skipped", table.getKey(), kind);
      }
    }
    return request;
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).add("tables", tables).toString();
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

}
