package io.b2mash.memberhours.security;

import io.b2mash.memberhours.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the {@code Authorization: Bearer} session token and exposes the {@link SessionClaims}
 * as the request's authentication principal. Requests without a bearer token pass through
 * anonymously and are rejected by the authorization rules where a session is required.
 *
 * <p>Public authentication endpoints are skipped so that a stale token never blocks a new login.
 */
public class SessionAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionTokenService sessionTokenService;
  private final AuthenticationEntryPoint entryPoint;

  public SessionAuthFilter(
      SessionTokenService sessionTokenService, AuthenticationEntryPoint entryPoint) {
    this.sessionTokenService = sessionTokenService;
    this.entryPoint = entryPoint;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
      filterChain.doFilter(request, response);
      return;
    }

    String token = authHeader.substring(BEARER_PREFIX.length()).trim();
    SessionClaims claims;
    try {
      claims = sessionTokenService.verify(token);
    } catch (UnauthorizedException e) {
      log.debug("Session auth failed: {}", e.getBody().getDetail());
      SecurityContextHolder.clearContext();
      entryPoint.commence(
          request, response, new BadCredentialsException(e.getBody().getDetail()));
      return;
    }

    var context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new SessionAuthentication(claims));
    SecurityContextHolder.setContext(context);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (!path.startsWith("/api/")) {
      return true;
    }
    return SecurityConfig.PUBLIC_ENDPOINTS.contains(path);
  }
}
