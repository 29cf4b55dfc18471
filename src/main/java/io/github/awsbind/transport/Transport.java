package io.github.awsbind.transport;

import io.github.awsbind.TransportException;

/**
 * Transport
 *
 * <p>json 1.0 protocol, e.g., dynamodb
 */
@FunctionalInterface
public interface Transport {

  /**
   * send
   *
   * @param target the x-amz-target header value, e.g., "DynamoDB_20120810.GetItem"
   * @param payload request body
   * @return raw response body
   * @throws TransportException on network, auth or non-2xx failure
   */
  byte[] send(String target, String payload) throws TransportException;

}
