package io.github.awsbind.dynamodb;

import java.nio.charset.StandardCharsets;

import com.google.gson.*;

import io.github.awsbind.MalformedResponseException;

// each helper checks one nesting level and fails with the offending fragment
final class WireJson {

  private WireJson() {
  }

  static JsonElement parse(byte[] raw) {
    String text = new String(raw, StandardCharsets.UTF_8);
    try {
      return JsonParser.parseString(text);
    } catch (JsonParseException e) {
      throw new MalformedResponseException(text, e);
    }
  }

  static JsonObject object(JsonElement jsonElement) {
    if (jsonElement == null || !jsonElement.isJsonObject())
      throw new MalformedResponseException(jsonElement);
    return jsonElement.getAsJsonObject();
  }

  static JsonArray array(JsonElement jsonElement) {
    if (jsonElement == null || !jsonElement.isJsonArray())
      throw new MalformedResponseException(jsonElement);
    return jsonElement.getAsJsonArray();
  }

}
