package io.b2mash.memberhours.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/** Authentication whose principal is the verified {@link SessionClaims}. */
public class SessionAuthentication extends AbstractAuthenticationToken {

  private final SessionClaims claims;

  public SessionAuthentication(SessionClaims claims) {
    super(AuthorityUtils.createAuthorityList("ROLE_MEMBER"));
    this.claims = claims;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return null;
  }

  @Override
  public SessionClaims getPrincipal() {
    return claims;
  }

  @Override
  public String getName() {
    return claims.profileId();
  }
}
