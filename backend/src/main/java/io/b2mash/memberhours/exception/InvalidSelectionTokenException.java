package io.b2mash.memberhours.exception;

/** Selection token is unknown, expired or already redeemed. */
public class InvalidSelectionTokenException extends ApiException {

  public InvalidSelectionTokenException(String detail) {
    super(ErrorKind.INVALID_SELECTION_TOKEN, "Invalid selection token", detail);
  }
}
