package io.b2mash.memberhours.exception;

public class ValidationException extends ApiException {

  public ValidationException(String detail) {
    super(ErrorKind.VALIDATION_ERROR, "Validation failed", detail);
  }
}
