package io.b2mash.memberhours.exception;

import org.springframework.http.HttpStatus;

/** Stable, machine-readable error kinds reported in every error body as {@code kind}. */
public enum ErrorKind {
  INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED),
  INVALID_SELECTION_TOKEN(HttpStatus.UNAUTHORIZED),
  CANDIDATE_NOT_IN_SET(HttpStatus.BAD_REQUEST),
  INVALID_RESET_TOKEN(HttpStatus.BAD_REQUEST),
  WEAK_SECRET(HttpStatus.BAD_REQUEST),
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
  UNAUTHORIZED(HttpStatus.FORBIDDEN),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  NO_SUCH_PROFILE(HttpStatus.NOT_FOUND),
  DUPLICATE_ENTRY_FOR_DATE(HttpStatus.CONFLICT),
  TOO_MANY_ATTEMPTS(HttpStatus.TOO_MANY_REQUESTS),
  DIRECTORY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  DATA_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

  private final HttpStatus status;

  ErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
