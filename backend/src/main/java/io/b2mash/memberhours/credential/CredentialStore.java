package io.b2mash.memberhours.credential;

import io.b2mash.memberhours.auth.reset.ResetTokenService;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.exception.InvalidCredentialException;
import io.b2mash.memberhours.exception.WeakSecretException;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns password hashes. Verification failures are reported identically for unknown emails and
 * wrong passwords, and an unknown email still costs one BCrypt comparison.
 */
@Service
public class CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
  private static final String GENERIC_FAILURE = "Invalid email or password";

  private final CredentialRepository credentialRepository;
  private final PasswordEncoder passwordEncoder;
  private final ResetTokenService resetTokenService;
  private final Clock clock;
  private final int minLength;
  private final String dummyHash;

  public CredentialStore(
      CredentialRepository credentialRepository,
      PasswordEncoder passwordEncoder,
      ResetTokenService resetTokenService,
      Clock clock,
      AuthProperties authProperties) {
    this.credentialRepository = credentialRepository;
    this.passwordEncoder = passwordEncoder;
    this.resetTokenService = resetTokenService;
    this.clock = clock;
    this.minLength = authProperties.passwordMinLength();
    this.dummyHash = passwordEncoder.encode("timing-equalizer-not-a-password");
  }

  /** Result of a successful verification; the email is the directory lookup key. */
  public record VerifiedCredential(String email) {}

  /**
   * Verifies an email/secret pair.
   *
   * @throws InvalidCredentialException if the email is unknown or the secret does not match
   */
  @Transactional(readOnly = true)
  public VerifiedCredential verify(String email, String secret) {
    String normalized = EmailAddresses.normalize(email);
    var record = credentialRepository.findByEmail(normalized);
    String candidate = secret == null ? "" : secret;

    if (record.isEmpty()) {
      passwordEncoder.matches(candidate, dummyHash);
      throw new InvalidCredentialException(GENERIC_FAILURE);
    }
    if (!passwordEncoder.matches(candidate, record.get().getPasswordHash())) {
      throw new InvalidCredentialException(GENERIC_FAILURE);
    }
    return new VerifiedCredential(normalized);
  }

  /**
   * Rejects secrets that are blank or shorter than the configured minimum.
   *
   * @throws WeakSecretException if the secret fails the policy
   */
  public void checkPolicy(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new WeakSecretException("Password must not be empty");
    }
    if (secret.length() < minLength) {
      throw new WeakSecretException("Password must be at least " + minLength + " characters long");
    }
  }

  /**
   * Sets the password for the email, creating the credential if none exists yet. All outstanding
   * reset tokens for the email are invalidated in the same transaction.
   */
  @Transactional
  public void setPassword(String email, String newSecret) {
    checkPolicy(newSecret);
    String normalized = EmailAddresses.normalize(email);
    String hash = passwordEncoder.encode(newSecret);
    Instant now = clock.instant();

    var record = credentialRepository.findByEmail(normalized).orElse(null);
    if (record == null) {
      credentialRepository.save(new CredentialRecord(normalized, hash, now));
      log.info("Created credential {}", maskEmail(normalized));
    } else {
      record.changePasswordHash(hash, now);
      credentialRepository.save(record);
      log.info("Updated password for credential {}", record.getId());
    }

    int invalidated = resetTokenService.invalidateAll(normalized);
    if (invalidated > 0) {
      log.debug("Invalidated {} outstanding reset tokens", invalidated);
    }
  }

  static String maskEmail(String email) {
    int at = email.indexOf('@');
    if (at <= 1) {
      return "***" + (at >= 0 ? email.substring(at) : "");
    }
    return email.charAt(0) + "***" + email.substring(at);
  }
}
