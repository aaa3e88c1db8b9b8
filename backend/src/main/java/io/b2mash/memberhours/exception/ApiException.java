package io.b2mash.memberhours.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base class for all domain errors. Carries a {@link ProblemDetail} with the {@link ErrorKind} as
 * the {@code kind} property so that {@link GlobalExceptionHandler} can render a uniform body.
 */
public abstract class ApiException extends ErrorResponseException {

  private final ErrorKind kind;

  protected ApiException(ErrorKind kind, String title, String detail) {
    this(kind, kind.status(), title, detail);
  }

  protected ApiException(ErrorKind kind, HttpStatus status, String title, String detail) {
    super(status, createProblem(kind, status, title, detail), null);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  private static ProblemDetail createProblem(
      ErrorKind kind, HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("kind", kind.name());
    return problem;
  }
}
