package io.b2mash.memberhours.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/** Adds a request id and the authenticated profile id to the logging MDC. */
public class SessionLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_PROFILE_ID = "profileId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof SessionAuthentication session) {
        MDC.put(MDC_PROFILE_ID, session.getPrincipal().profileId());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_PROFILE_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
