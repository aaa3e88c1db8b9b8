package io.b2mash.memberhours.auth.reset;

import io.b2mash.memberhours.auth.OpaqueTokenGenerator;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.credential.EmailAddresses;
import io.b2mash.memberhours.exception.InvalidResetTokenException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and redeems password reset tokens. At most one token per email is outstanding: issuing a
 * new one consumes the previous ones. Redemption is an atomic check-and-consume under a row lock.
 */
@Service
public class ResetTokenService {

  private static final Logger log = LoggerFactory.getLogger(ResetTokenService.class);

  private final ResetTokenRepository tokenRepository;
  private final OpaqueTokenGenerator tokenGenerator;
  private final Clock clock;
  private final Duration tokenTtl;

  public ResetTokenService(
      ResetTokenRepository tokenRepository,
      OpaqueTokenGenerator tokenGenerator,
      Clock clock,
      AuthProperties authProperties) {
    this.tokenRepository = tokenRepository;
    this.tokenGenerator = tokenGenerator;
    this.clock = clock;
    this.tokenTtl = authProperties.resetTokenTtl();
  }

  /**
   * Issues a reset token for the email, invalidating any earlier outstanding token.
   *
   * @return the raw token to embed in the reset link
   */
  @Transactional
  public String issue(String email) {
    String normalized = EmailAddresses.normalize(email);
    Instant now = clock.instant();
    tokenRepository.consumeOutstandingByEmail(normalized, now);

    String rawToken = tokenGenerator.generate();
    tokenRepository.save(
        new ResetToken(
            OpaqueTokenGenerator.hash(rawToken), normalized, now, now.plus(tokenTtl)));
    log.debug("Issued password reset token expiring in {}", tokenTtl);
    return rawToken;
  }

  /**
   * Consumes the token and returns the email it was issued for.
   *
   * @throws InvalidResetTokenException if the token is unknown, expired or already consumed
   */
  @Transactional
  public String redeem(String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      throw new InvalidResetTokenException("Reset link is invalid");
    }
    ResetToken token =
        tokenRepository
            .findByTokenHashForUpdate(OpaqueTokenGenerator.hash(rawToken))
            .orElseThrow(() -> new InvalidResetTokenException("Reset link is invalid"));

    Instant now = clock.instant();
    if (token.isConsumed()) {
      throw new InvalidResetTokenException("Reset link has already been used");
    }
    if (token.isExpired(now)) {
      throw new InvalidResetTokenException("Reset link has expired");
    }

    token.markConsumed(now);
    tokenRepository.save(token);
    log.debug("Redeemed password reset token {}", token.getId());
    return token.getEmail();
  }

  /** Invalidates every outstanding token for the email. Joins the caller's transaction. */
  @Transactional
  public int invalidateAll(String email) {
    return tokenRepository.consumeOutstandingByEmail(
        EmailAddresses.normalize(email), clock.instant());
  }
}
