package io.github.awsbind.transport;

import java.util.Map;

import io.github.awsbind.TransportException;

/**
 * QueryTransport
 *
 * <p>query protocol, e.g., rds and autoscaling
 */
@FunctionalInterface
public interface QueryTransport {

  /**
   * query
   *
   * @param params form parameters, including Action and Version
   * @return raw response body
   * @throws TransportException on network, auth or non-2xx failure
   */
  byte[] query(Map<String, String> params) throws TransportException;

}
