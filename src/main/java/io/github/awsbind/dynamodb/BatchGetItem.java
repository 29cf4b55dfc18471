package io.github.awsbind.dynamodb;

import java.util.*;

import com.google.common.collect.ImmutableList;

/**
 * BatchGetItem
 *
 * <p>keys to read, per table; adding a table again replaces its keys
 * <p>not thread-safe
 */
// https://docs.aws.amazon.com/amazondynamodb/latest/APIReference/API_BatchGetItem.html
public class BatchGetItem {

  private final Server server;
  private final Map<Table, List<Key>> keys = new LinkedHashMap<>();

  BatchGetItem(Server server) {
    this.server = server;
  }

  public BatchGetItem addTable(Table table, List<Key> keys) {
    this.keys.put(table, ImmutableList.copyOf(keys));
    return this;
  }

  public Map<Table, List<Key>> getKeys() {
    return Collections.unmodifiableMap(keys);
  }

  /**
   * execute
   * 
   * @return table name -> items found, in response order
   */
  public Map<String, List<Item>> execute() {
    Query query = new Query().addRequestItems(keys);
    return Responses.batchGetItem(server.queryServer(Server.target("BatchGetItem"), query));
  }

}
