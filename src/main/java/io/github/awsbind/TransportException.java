package io.github.awsbind;

/**
 * TransportException
 *
 * <p>network, auth or non-2xx failure of the signed http call
 */
public class TransportException extends ServiceException {

  private final int statusCode;
  private final String body;

  public TransportException(int statusCode, String body) {
    super(String.format("http %s %s", statusCode, body));
    this.statusCode = statusCode;
    this.body = body;
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
    this.body = null;
  }

  /**
   * http status, or -1 when no response was received
   */
  public int getStatusCode() {
    return statusCode;
  }

  public String getBody() {
    return body;
  }

}
