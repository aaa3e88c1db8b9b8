package io.b2mash.memberhours.exception;

public class WeakSecretException extends ApiException {

  public WeakSecretException(String detail) {
    super(ErrorKind.WEAK_SECRET, "Password too weak", detail);
  }
}
