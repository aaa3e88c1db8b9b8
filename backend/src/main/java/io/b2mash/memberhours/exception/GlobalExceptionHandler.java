package io.b2mash.memberhours.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders every domain error as a problem-detail style map that also carries {@code kind}, {@code
 * success:false} and {@code message}, the shape the login and ledger clients read.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<Map<String, Object>> handleApiException(
      ApiException ex, HttpServletRequest request) {
    var problem = ex.getBody();
    log.warn(
        "Request failed: path={}, method={}, kind={}, detail={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getKind(),
        problem.getDetail());
    return ResponseEntity.status(ex.getStatusCode())
        .body(
            errorBody(ex.getKind(), ex.getStatusCode(), problem.getTitle(), problem.getDetail()));
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    log.warn("Request validation failed: {}", detail);
    return validationError(detail);
  }

  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return validationError("Request body is malformed");
  }

  @Override
  protected ResponseEntity<Object> handleTypeMismatch(
      TypeMismatchException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    log.warn("Request parameter type mismatch: {}", ex.getPropertyName());
    return validationError("Invalid value for " + ex.getPropertyName());
  }

  /** Builds the uniform error body. Shared with the authentication entry point. */
  public static Map<String, Object> errorBody(
      ErrorKind kind, HttpStatusCode status, String title, String detail) {
    var body = new LinkedHashMap<String, Object>();
    body.put("type", "about:blank");
    body.put("title", title);
    body.put("status", status.value());
    body.put("detail", detail);
    body.put("kind", kind.name());
    body.put("success", false);
    body.put("message", detail);
    return body;
  }

  private ResponseEntity<Object> validationError(String detail) {
    var body =
        errorBody(ErrorKind.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, "Validation failed", detail);
    return ResponseEntity.badRequest().body(body);
  }
}
