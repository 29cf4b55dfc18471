package io.github.awsbind.dynamodb;

import com.google.common.base.*;

import helpers.LogHelper;
import io.github.awsbind.transport.Transport;

/**
 * Server
 *
 * <p>dynamodb over a {@link Transport}; one blocking call per operation, no retries
 */
public class Server {

  public static final String TARGET_PREFIX = "DynamoDB_20120810.";

  private final Transport transport;

  public Server(Transport transport) {
    debug("ctor", transport);
    this.transport = Preconditions.checkNotNull(transport, "transport");
  }

  public Table newTable(String name, PrimaryKey key) {
    return new Table(this, name, key);
  }

  /**
   * target
   * 
   * @param operation e.g., "GetItem"
   * @return e.g., "DynamoDB_20120810.GetItem"
   */
  public static String target(String operation) {
    return TARGET_PREFIX + operation;
  }

  byte[] queryServer(String target, Query query) {
    debug("queryServer", target);
    trace("queryServer", target, query);
    byte[] response = transport.send(target, query.toString());
    trace("queryServer", target, "response", response.length);
    return response;
  }

  /**
   * batchWriteItem
   * 
   * <p>the request is validated before anything is sent
   * 
   * @return what the service did not apply, empty on full success
   */
  public UnprocessedItems batchWriteItem(BatchWriteItemRequest request) {
    request.validate();
    Query query = new Query().addBatchWriteItemOperations(request);
    UnprocessedItems unprocessedItems = Responses.batchWriteItem(queryServer(target("BatchWriteItem"), query));
    debug("batchWriteItem", request, "unprocessed", unprocessedItems.count());
    return unprocessedItems;
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

  private void trace(Object... args) {
    new LogHelper(this).trace(args);
  }

}
