package io.github.awsbind.dynamodb;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.awsbind.MalformedResponseException;
import io.github.awsbind.NotFoundException;

public class ResponsesTest {

  @Test
  public void batchWriteItemSuccessTest() {
    UnprocessedItems unprocessedItems = Responses.batchWriteItem(raw("{UnprocessedItems:{}}"));
    assertThat(unprocessedItems.isEmpty()).isTrue();
    assertThat(unprocessedItems.tableNames()).isEmpty();
  }

  @Test
  public void batchWriteItemUnprocessedTest() {
    UnprocessedItems unprocessedItems = Responses.batchWriteItem(raw("{UnprocessedItems:{T:[{PutRequest:{Item:{id:{N:'1'}}}}]}}"));
    assertThat(unprocessedItems.tableNames()).containsExactly("T");
    assertThat(unprocessedItems.count()).isEqualTo(1);
    assertThat(unprocessedItems.get("T", UnprocessedItems.PUT_REQUEST)).containsExactly(new Item(Attribute.newNumber("id", "1")));
    assertThat(unprocessedItems.get("T", UnprocessedItems.DELETE_REQUEST)).isEmpty();
  }

  @Test
  public void batchWriteItemOrderTest() {
    String json = "{UnprocessedItems:{A:[{DeleteRequest:{Key:{id:{S:'k1'}}}},{PutRequest:{Item:{id:{S:'p1'}}}},{DeleteRequest:{Key:{id:{S:'k2'}}}}],B:[]}}";
    UnprocessedItems unprocessedItems = Responses.batchWriteItem(raw(json));
    assertThat(unprocessedItems.tableNames()).containsExactly("A", "B");
    assertThat(unprocessedItems.get("A", UnprocessedItems.DELETE_REQUEST)).extracting(item -> item.getAttribute("id").getValue()).containsExactly("k1", "k2");
    assertThat(unprocessedItems.get("A", UnprocessedItems.PUT_REQUEST)).extracting(item -> item.getAttribute("id").getValue()).containsExactly("p1");
    assertThat(unprocessedItems.count()).isEqualTo(3);
  }

  @Test
  public void batchWriteItemDropsBadFieldsTest() {
    UnprocessedItems unprocessedItems = Responses.batchWriteItem(raw("{UnprocessedItems:{T:[{PutRequest:{Item:{id:{N:'1'},x:{Q:'1'},y:{S:2}}}}]}}"));
    Item item = unprocessedItems.get("T", UnprocessedItems.PUT_REQUEST).get(0);
    assertThat(item.getAttributes()).extracting(Attribute::getName).containsExactly("id");
  }

  @Test
  public void batchWriteItemMalformedTest() {
    // UnprocessedItems not a mapping
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:'oops'}"));
    });
    // UnprocessedItems absent
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{}"));
    });
    // table not a sequence
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:{T:{}}}"));
    });
    // container not a mapping
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:{T:['x']}}"));
    });
    // operation not a mapping
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:{T:[{PutRequest:1}]}}"));
    });
    // attributes not a mapping
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:{T:[{PutRequest:{Item:[]}}]}}"));
    });
    // not json
    assertThrows(MalformedResponseException.class, () -> {
      Responses.batchWriteItem(raw("{UnprocessedItems:"));
    });
  }

  @Test
  public void itemTest() {
    Item item = Responses.item(raw("{Item:{id:{S:'abc'},n:{N:'2'},tags:{SS:['a','b']}}}"));
    assertThat(item.getAttributes()).containsExactly(
        //
        Attribute.newString("id", "abc"),
        //
        Attribute.newNumber("n", "2"),
        //
        Attribute.newStringSet("tags", "a", "b"));
  }

  @Test
  public void itemNotFoundTest() {
    assertThrows(NotFoundException.class, () -> {
      Responses.item(raw("{}"));
    });
  }

  @Test
  public void itemEmptyTest() {
    assertThat(Responses.item(raw("{Item:{}}")).getAttributes()).isEmpty();
  }

  @Test
  public void itemMalformedTest() {
    assertThrows(MalformedResponseException.class, () -> {
      Responses.item(raw("[]"));
    });
    assertThrows(MalformedResponseException.class, () -> {
      Responses.item(raw("{Item:'x'}"));
    });
  }

  @Test
  public void batchGetItemTest() {
    Map<String, List<Item>> results = Responses.batchGetItem(raw("{Responses:{A:[{id:{N:'1'}},{id:{N:'2'}}],B:[]},UnprocessedKeys:{}}"));
    assertThat(results.keySet()).containsExactly("A", "B");
    assertThat(results.get("A")).containsExactly(new Item(Attribute.newNumber("id", "1")), new Item(Attribute.newNumber("id", "2")));
    assertThat(results.get("B")).isEmpty();
  }

  @Test
  public void acknowledgeTest() {
    Responses.acknowledge(raw("{}"));
    Responses.acknowledge(raw("{ConsumedCapacityUnits:1}"));
    assertThrows(MalformedResponseException.class, () -> {
      Responses.acknowledge(raw("null"));
    });
  }

  private static byte[] raw(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

}
