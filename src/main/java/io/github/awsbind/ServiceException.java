package io.github.awsbind;

/**
 * ServiceException
 *
 * <p>root of everything a binding throws at its caller
 */
public class ServiceException extends RuntimeException {

  public ServiceException(String message) {
    super(message);
  }

  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }

}
