package io.b2mash.memberhours.exception;

public class NoSuchProfileException extends ApiException {

  public NoSuchProfileException(String detail) {
    super(ErrorKind.NO_SUCH_PROFILE, "Member not found", detail);
  }
}
