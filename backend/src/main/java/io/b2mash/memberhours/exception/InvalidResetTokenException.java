package io.b2mash.memberhours.exception;

public class InvalidResetTokenException extends ApiException {

  public InvalidResetTokenException(String detail) {
    super(ErrorKind.INVALID_RESET_TOKEN, "Invalid reset token", detail);
  }
}
