package io.github.awsbind.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.base.*;

import helpers.LogHelper;
import io.github.awsbind.MalformedResponseException;

/**
 * XmlQueryClient
 *
 * <p>base of the query-protocol bindings: form parameters out, xml in
 * <p>zero and empty option values are never sent
 */
public abstract class XmlQueryClient {

  private final QueryTransport transport;
  private final String apiVersion;
  private final XmlMapper xmlMapper;

  protected XmlQueryClient(QueryTransport transport, String apiVersion) {
    this.transport = Preconditions.checkNotNull(transport, "transport");
    this.apiVersion = Preconditions.checkNotNull(apiVersion, "apiVersion");
    this.xmlMapper = new XmlMapper();
    this.xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  protected Map<String, String> makeParams(String action) {
    Map<String, String> params = new TreeMap<>();
    params.put("Action", action);
    params.put("Version", apiVersion);
    return params;
  }

  protected static void putString(Map<String, String> params, String name, String value) {
    if (!Strings.isNullOrEmpty(value))
      params.put(name, value);
  }

  protected static void putInt(Map<String, String> params, String name, int value) {
    if (value != 0)
      params.put(name, String.valueOf(value));
  }

  // only "true" is sent; the service default applies otherwise
  protected static void putTrue(Map<String, String> params, String name, boolean value) {
    if (value)
      params.put(name, "true");
  }

  // Label.member.1, Label.member.2, ...
  protected static void putList(Map<String, String> params, String label, List<String> values) {
    for (int i = 0; i < values.size(); ++i) {
      if (!Strings.isNullOrEmpty(values.get(i)))
        params.put(member(label, i), values.get(i));
    }
  }

  protected static String member(String label, int index) {
    return label + ".member." + (index + 1);
  }

  /**
   * query
   *
   * @throws MalformedResponseException if the body does not decode into classOfT
   */
  protected <T> T query(Map<String, String> params, Class<T> classOfT) {
    byte[] raw = transport.query(params);
    trace("query", params.get("Action"), new String(raw, StandardCharsets.UTF_8));
    try {
      return xmlMapper.readValue(raw, classOfT);
    } catch (IOException e) {
      throw new MalformedResponseException(new String(raw, StandardCharsets.UTF_8), e);
    }
  }

  private void trace(Object... args) {
    new LogHelper(this).trace(args);
  }

}
