package io.b2mash.memberhours.exception;

/** Unknown email, wrong password or no directory profile. All three are reported identically. */
public class InvalidCredentialException extends ApiException {

  public InvalidCredentialException(String detail) {
    super(ErrorKind.INVALID_CREDENTIAL, "Invalid credentials", detail);
  }
}
