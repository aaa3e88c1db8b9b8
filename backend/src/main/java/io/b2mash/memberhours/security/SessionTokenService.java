package io.b2mash.memberhours.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.exception.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 session JWTs. Sessions are stateless: validity depends only on the
 * signature, the {@code type} claim and expiry.
 */
@Service
public class SessionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
  private static final String TOKEN_TYPE = "session";
  private static final int MIN_SECRET_BYTES = 32;

  private final byte[] secret;
  private final Duration sessionTtl;
  private final Clock clock;

  public SessionTokenService(AuthProperties authProperties, Clock clock) {
    String configured = authProperties.jwtSecret();
    if (configured == null
        || configured.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "memberhours.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes long");
    }
    this.secret = configured.getBytes(StandardCharsets.UTF_8);
    this.sessionTtl = authProperties.sessionTtl();
    this.clock = clock;
  }

  /** A freshly signed session token together with the claims it carries. */
  public record IssuedSession(String token, SessionClaims claims) {}

  public IssuedSession issue(String profileId, String email) {
    try {
      // JWT timestamps have second precision
      Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
      Instant expiresAt = now.plus(sessionTtl);
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(profileId)
              .claim("email", email)
              .claim("type", TOKEN_TYPE)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(expiresAt))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued session for profile {}", profileId);
      return new IssuedSession(
          signedJwt.serialize(), new SessionClaims(profileId, email, now, expiresAt));
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign session JWT", e);
    }
  }

  /**
   * Verifies signature, expiry and token type.
   *
   * @throws UnauthorizedException if the token is malformed, tampered with or expired
   */
  public SessionClaims verify(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())
          || !signedJwt.verify(verifier)) {
        throw UnauthorizedException.unauthenticated("Invalid session token signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
        throw UnauthorizedException.unauthenticated("Session has expired");
      }
      if (!TOKEN_TYPE.equals(claims.getStringClaim("type"))) {
        throw UnauthorizedException.unauthenticated("Invalid token type for session access");
      }
      if (claims.getSubject() == null || claims.getSubject().isBlank()) {
        throw UnauthorizedException.unauthenticated("Session token has no subject");
      }

      Instant issuedAt = claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null;
      return new SessionClaims(
          claims.getSubject(),
          claims.getStringClaim("email"),
          issuedAt,
          claims.getExpirationTime().toInstant());
    } catch (ParseException | JOSEException e) {
      throw UnauthorizedException.unauthenticated("Invalid session token");
    }
  }
}
