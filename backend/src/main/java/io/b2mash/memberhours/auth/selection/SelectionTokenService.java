package io.b2mash.memberhours.auth.selection;

import io.b2mash.memberhours.auth.OpaqueTokenGenerator;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.exception.CandidateNotInSetException;
import io.b2mash.memberhours.exception.InvalidSelectionTokenException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and redeems member selection tokens. Tokens are persisted as SHA-256 hashes and redeemed
 * under a row lock, so two concurrent redemptions of one token yield exactly one success.
 */
@Service
public class SelectionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SelectionTokenService.class);

  private final SelectionTokenRepository tokenRepository;
  private final OpaqueTokenGenerator tokenGenerator;
  private final Clock clock;
  private final Duration tokenTtl;

  public SelectionTokenService(
      SelectionTokenRepository tokenRepository,
      OpaqueTokenGenerator tokenGenerator,
      Clock clock,
      AuthProperties authProperties) {
    this.tokenRepository = tokenRepository;
    this.tokenGenerator = tokenGenerator;
    this.clock = clock;
    this.tokenTtl = authProperties.selectionTokenTtl();
  }

  /** The outcome of a successful redemption. */
  public record RedeemedSelection(String email, String profileId) {}

  /**
   * Issues a token bound to the given candidates.
   *
   * @return the raw token handed to the caller
   */
  @Transactional
  public String issue(String email, List<String> candidateProfileIds) {
    if (candidateProfileIds.size() < 2) {
      throw new IllegalArgumentException("A selection needs at least two candidates");
    }
    String rawToken = tokenGenerator.generate();
    Instant now = clock.instant();
    var token =
        new SelectionToken(
            OpaqueTokenGenerator.hash(rawToken),
            email,
            candidateProfileIds,
            now,
            now.plus(tokenTtl));
    tokenRepository.save(token);
    log.debug("Issued selection token for {} candidates", candidateProfileIds.size());
    return rawToken;
  }

  /**
   * Checks that the token could be redeemed for the profile, without consuming it.
   *
   * @throws InvalidSelectionTokenException if the token is unknown, expired or already consumed
   * @throws CandidateNotInSetException if the profile was not offered with this token
   */
  @Transactional(readOnly = true)
  public void check(String rawToken, String profileId) {
    requireRedeemable(findToken(rawToken, false), profileId, clock.instant());
  }

  /**
   * Consumes the token for one of its candidates. A profile outside the candidate set is rejected
   * without consuming the token.
   *
   * @throws InvalidSelectionTokenException if the token is unknown, expired or already consumed
   * @throws CandidateNotInSetException if the profile was not offered with this token
   */
  @Transactional
  public RedeemedSelection redeem(String rawToken, String profileId) {
    SelectionToken token = findToken(rawToken, true);
    Instant now = clock.instant();
    requireRedeemable(token, profileId, now);

    token.markConsumed(now);
    tokenRepository.save(token);
    log.debug("Redeemed selection token {} for profile {}", token.getId(), profileId);
    return new RedeemedSelection(token.getEmail(), profileId);
  }

  private SelectionToken findToken(String rawToken, boolean forUpdate) {
    if (rawToken == null || rawToken.isBlank()) {
      throw new InvalidSelectionTokenException("Selection token is invalid");
    }
    String tokenHash = OpaqueTokenGenerator.hash(rawToken);
    var token =
        forUpdate
            ? tokenRepository.findByTokenHashForUpdate(tokenHash)
            : tokenRepository.findByTokenHash(tokenHash);
    return token.orElseThrow(
        () -> new InvalidSelectionTokenException("Selection token is invalid"));
  }

  private static void requireRedeemable(SelectionToken token, String profileId, Instant now) {
    if (token.isConsumed()) {
      throw new InvalidSelectionTokenException("Selection token has already been used");
    }
    if (token.isExpired(now)) {
      throw new InvalidSelectionTokenException("Selection token has expired");
    }
    if (!token.hasCandidate(profileId)) {
      throw new CandidateNotInSetException("The selected member is not available for this login");
    }
  }
}
