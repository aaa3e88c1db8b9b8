package io.b2mash.memberhours.exception;

import org.springframework.http.HttpStatus;

/**
 * The session does not authorize the operation. Reported as 403 when a valid session targets
 * another member's data, and as 401 when the session itself is missing or invalid.
 */
public class UnauthorizedException extends ApiException {

  public UnauthorizedException(String detail) {
    super(ErrorKind.UNAUTHORIZED, "Not authorized", detail);
  }

  public static UnauthorizedException unauthenticated(String detail) {
    return new UnauthorizedException(HttpStatus.UNAUTHORIZED, detail);
  }

  private UnauthorizedException(HttpStatus status, String detail) {
    super(ErrorKind.UNAUTHORIZED, status, "Not authenticated", detail);
  }
}
