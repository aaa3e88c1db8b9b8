package io.b2mash.memberhours.security;

import io.b2mash.memberhours.exception.ErrorKind;
import io.b2mash.memberhours.exception.GlobalExceptionHandler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Logs authentication failures and answers with a 401 in the same body shape as every other API
 * error.
 */
@Component
public class SessionAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationEntryPoint.class);

  private final ObjectMapper objectMapper;

  public SessionAuthenticationEntryPoint(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage());

    var body =
        GlobalExceptionHandler.errorBody(
            ErrorKind.UNAUTHORIZED,
            HttpStatus.UNAUTHORIZED,
            "Not authenticated",
            authException.getMessage());
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().write(objectMapper.writeValueAsString(body));
  }
}
