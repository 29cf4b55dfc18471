package io.github.awsbind;

import java.io.*;
import java.util.*;
import java.util.concurrent.atomic.*;

import com.google.gson.*;

import helpers.LogHelper;
import io.github.awsbind.dynamodb.*;

/**
 * BatchWriteCommand
 *
 * <p>concatenated dynamodb-json items in, batches of 25 out; whatever was not applied is echoed as dynamodb-json
 * <p>not thread-safe
 */
public class BatchWriteCommand {

  private final Server server;
  private final String tableName;
  private final boolean delete; // DeleteRequest vs PutRequest
  private final PrintStream out;

  private final AtomicLong in = new AtomicLong();
  private final AtomicLong success = new AtomicLong();
  private final AtomicLong failure = new AtomicLong();

  public class Work {
    private final Number in;
    private final Number out;
    private final Number err;
    Work(Number in, Number success, Number failure) {
      this.in = in;
      this.out = success;
      this.err = failure;
    }
    public long in() {
      return in.longValue();
    }
    public long out() {
      return out.longValue();
    }
    public long err() {
      return err.longValue();
    }
    public String toString() {
      return getClass().getSimpleName() + new Gson().toJson(this);
    }
  }

  public BatchWriteCommand(Server server, String tableName, boolean delete, PrintStream out) {
    debug("ctor", tableName, delete);
    this.server = server;
    this.tableName = tableName;
    this.delete = delete;
    this.out = out;
  }

  public Work run(Reader reader) {
    JsonStreamParser parser = new JsonStreamParser(reader);
    List<JsonElement> partition = new ArrayList<>();
    try {
      while (parser.hasNext()) {
        in.incrementAndGet();
        partition.add(parser.next());
        if (partition.size() == BatchWriteItemRequest.MAX_ITEMS) {
          doBatchWriteItem(partition);
          partition = new ArrayList<>();
        }
      }
    } catch (JsonParseException e) {
      // the rest of the stream is unreadable; what was read so far still goes out
      warn("run", e.getMessage());
      failure.incrementAndGet();
    }
    if (partition.size() > 0)
      doBatchWriteItem(partition);
    out.flush();
    return new Work(in.get(), success.get(), failure.get());
  }

  private void doBatchWriteItem(List<JsonElement> partition) {
    BatchWriteItemRequest request = new BatchWriteItemRequest();
    for (JsonElement jsonElement : partition) {
      try {
        Item item = AttributeCodec.decodeItem(jsonElement);
        if (item.isEmpty() || item.size() > BatchWriteItemRequest.MAX_ITEM_SIZE) {
          warn("not writable", item.size());
          failure.incrementAndGet();
          out.println(jsonElement);
          continue;
        }
        if (delete)
          request.addDeleteRequest(tableName, item);
        else
          request.addPutRequest(tableName, item);
      } catch (MalformedResponseException e) {
        warn("not an item", jsonElement);
        failure.incrementAndGet();
        out.println(jsonElement);
      }
    }
    if (request.getItems().isEmpty())
      return;
    try {
      UnprocessedItems unprocessedItems = server.batchWriteItem(request);
      for (String kind : List.of(UnprocessedItems.PUT_REQUEST, UnprocessedItems.DELETE_REQUEST)) {
        for (Item item : unprocessedItems.get(tableName, kind))
          out.println(AttributeCodec.encodeItem(item));
      }
      success.addAndGet(request.getItems().size() - unprocessedItems.count());
      failure.addAndGet(unprocessedItems.count());
    } catch (ServiceException e) {
      warn("batchWriteItem", e.getMessage());
      for (Item item : request.getItems())
        out.println(AttributeCodec.encodeItem(item));
      failure.addAndGet(request.getItems().size());
    }
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

  private void warn(Object... args) {
    new LogHelper(this).warn(args);
  }

}
