package io.github.awsbind.dynamodb;

import java.util.List;

import com.google.common.base.*;

import io.github.awsbind.NotFoundException;
import io.github.awsbind.ValidationException;
import io.github.awsbind.ValidationException.Reason;

/**
 * Table
 *
 * <p>single-item operations against one table
 */
public class Table {

  private final Server server;
  private final String name;
  private final PrimaryKey key;

  Table(Server server, String name, PrimaryKey key) {
    this.server = Preconditions.checkNotNull(server, "server");
    this.name = Preconditions.checkNotNull(name, "name");
    this.key = Preconditions.checkNotNull(key, "key");
  }

  public Server getServer() {
    return server;
  }

  public String getName() {
    return name;
  }

  public PrimaryKey getKey() {
    return key;
  }

  /**
   * getItem
   * 
   * @throws NotFoundException if the table has no item with this key
   */
  public Item getItem(Key key) {
    Query query = new Query(this).addKey(this, key);
    return Responses.item(server.queryServer(Server.target("GetItem"), query));
  }

  /**
   * putItem
   * 
   * @throws ValidationException if the item has no attributes
   */
  public boolean putItem(Item item) {
    if (item.isEmpty())
      throw new ValidationException(Reason.NO_ATTRIBUTES, "At least one attribute is required.");
    Query query = new Query(this).addItem(item);
    Responses.acknowledge(server.queryServer(Server.target("PutItem"), query));
    return true;
  }

  public boolean deleteItem(Key key) {
    Query query = new Query(this).addKey(this, key);
    Responses.acknowledge(server.queryServer(Server.target("DeleteItem"), query));
    return true;
  }

  public boolean addAttributes(Key key, List<Attribute> attributes) {
    return modifyAttributes(key, attributes, Query.ADD);
  }

  public boolean updateAttributes(Key key, List<Attribute> attributes) {
    return modifyAttributes(key, attributes, Query.PUT);
  }

  public boolean deleteAttributes(Key key, List<Attribute> attributes) {
    return modifyAttributes(key, attributes, Query.DELETE);
  }

  private boolean modifyAttributes(Key key, List<Attribute> attributes, String action) {
    if (attributes.isEmpty())
      throw new ValidationException(Reason.NO_ATTRIBUTES, "At least one attribute is required.");
    Query query = new Query(this).addKey(this, key).addUpdates(attributes, action);
    Responses.acknowledge(server.queryServer(Server.target("UpdateItem"), query));
    return true;
  }

  public UnprocessedItems batchWriteItem(BatchWriteItemRequest request) {
    return server.batchWriteItem(request);
  }

  public BatchGetItem batchGetItems(List<Key> keys) {
    return new BatchGetItem(server).addTable(this, keys);
  }

  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("key", key).toString();
  }

}
