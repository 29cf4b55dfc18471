package io.github.awsbind;

/**
 * ValidationException
 *
 * <p>caller-supplied data violates a precondition; always raised before anything is sent
 */
public class ValidationException extends ServiceException {

  public enum Reason {
    EMPTY_REQUEST,
    TOO_MANY_ITEMS,
    ITEM_TOO_LARGE,
    REQUEST_TOO_LARGE,
    NO_ATTRIBUTES
  }

  private final Reason reason;

  public ValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

}
