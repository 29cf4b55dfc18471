package io.github.awsbind;

/**
 * MalformedResponseException
 *
 * <p>the service returned a shape the decoder cannot interpret
 */
public class MalformedResponseException extends ServiceException {

  private final String fragment;

  public MalformedResponseException(Object fragment) {
    this(fragment, null);
  }

  public MalformedResponseException(Object fragment, Throwable cause) {
    super("Unexpected response " + fragment, cause);
    this.fragment = String.valueOf(fragment);
  }

  /**
   * the raw piece of the response that failed to decode
   */
  public String getFragment() {
    return fragment;
  }

}
