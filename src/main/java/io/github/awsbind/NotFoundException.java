package io.github.awsbind;

/**
 * NotFoundException
 *
 * <p>read miss: the service answered but had no such record
 */
public class NotFoundException extends ServiceException {

  public NotFoundException(String message) {
    super(message);
  }

}
