package io.github.awsbind.dynamodb;

import java.util.*;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;
import com.google.gson.*;

import helpers.LogHelper;
import io.github.awsbind.MalformedResponseException;

/**
 * AttributeCodec
 *
 * <p>attribute to/from its tagged wire form, e.g., {"S":"abc"}, {"NS":["1","2"]}
 */
public final class AttributeCodec {

  private AttributeCodec() {
  }

  public static JsonObject encode(Attribute attribute) {
    JsonObject wire = new JsonObject();
    if (attribute.getType().isSet()) {
      JsonArray values = new JsonArray();
      for (String value : attribute.getSetValues())
        values.add(value);
      wire.add(attribute.getType().tag(), values);
    } else {
      wire.addProperty(attribute.getType().tag(), attribute.getValue());
    }
    return wire;
  }

  /**
   * encodeItem
   * 
   * @return {name: wireAttribute, ...} in attribute order
   */
  public static JsonObject encodeItem(Item item) {
    JsonObject wire = new JsonObject();
    for (Attribute attribute : item.getAttributes()) {
      // first one wins, as in Item.getAttribute
      if (wire.has(attribute.getName())) {
        debug("encodeItem", "duplicate", attribute.getName());
        continue;
      }
      wire.add(attribute.getName(), encode(attribute));
    }
    return wire;
  }

  /**
   * decode
   * 
   * <p>the first recognized tag carrying a well-formed value wins
   * 
   * @param name attribute name
   * @param wire e.g., {"N":"1"}
   * @return empty when the field is not a tagged attribute
   */
  public static Optional<Attribute> decode(String name, JsonElement wire) {
    if (wire != null && wire.isJsonObject()) {
      for (Entry<String, JsonElement> entry : wire.getAsJsonObject().entrySet()) {
        AttributeType type = AttributeType.fromTag(entry.getKey());
        if (type != null) {
          Attribute attribute = type.isSet() ? decodeSet(type, name, entry.getValue()) : decodeScalar(type, name, entry.getValue());
          if (attribute != null)
            return Optional.of(attribute);
        }
      }
    }
    debug("decode", "dropped", name, wire);
    return Optional.empty();
  }

  private static Attribute decodeScalar(AttributeType type, String name, JsonElement value) {
    if (isString(value))
      return Attribute.of(type, name, value.getAsString());
    return null;
  }

  private static Attribute decodeSet(AttributeType type, String name, JsonElement value) {
    if (!value.isJsonArray())
      return null;
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (JsonElement element : value.getAsJsonArray()) {
      if (!isString(element))
        return null;
      values.add(element.getAsString());
    }
    return Attribute.ofSet(type, name, values.build());
  }

  private static boolean isString(JsonElement value) {
    return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
  }

  /**
   * decodeAttributes
   * 
   * <p>fields that are not tagged attributes are dropped
   * 
   * @param wire {name: wireAttribute, ...}
   * @return name to attribute, in wire order
   * @throws MalformedResponseException if wire is not a mapping
   */
  public static Map<String, Attribute> decodeAttributes(JsonElement wire) {
    Map<String, Attribute> attributes = new LinkedHashMap<>();
    for (Entry<String, JsonElement> entry : WireJson.object(wire).entrySet()) {
      decode(entry.getKey(), entry.getValue()).ifPresent(attribute -> attributes.put(entry.getKey(), attribute));
    }
    return attributes;
  }

  public static Item decodeItem(JsonElement wire) {
    return new Item().addAttributesFromMap(decodeAttributes(wire));
  }

  private static void debug(Object... args) {
    new LogHelper(AttributeCodec.class).debug(args);
  }

}
