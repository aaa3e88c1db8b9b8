package io.b2mash.memberhours.exception;

public class TooManyAttemptsException extends ApiException {

  public TooManyAttemptsException(String detail) {
    super(ErrorKind.TOO_MANY_ATTEMPTS, "Too many attempts", detail);
  }
}
