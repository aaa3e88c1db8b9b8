package io.b2mash.memberhours.auth;

import io.b2mash.memberhours.auth.LoginOutcome.AmbiguousSelection;
import io.b2mash.memberhours.auth.LoginOutcome.AuthFailure;
import io.b2mash.memberhours.auth.LoginOutcome.SingleSession;
import io.b2mash.memberhours.auth.selection.SelectionTokenService;
import io.b2mash.memberhours.config.MemberHoursConfig.AppProperties;
import io.b2mash.memberhours.credential.CredentialStore;
import io.b2mash.memberhours.credential.EmailAddresses;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.directory.ProfileOrdering;
import io.b2mash.memberhours.directory.ProfileRecord;
import io.b2mash.memberhours.exception.ErrorKind;
import io.b2mash.memberhours.exception.InvalidCredentialException;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import io.b2mash.memberhours.exception.TooManyAttemptsException;
import io.b2mash.memberhours.security.SessionClaims;
import io.b2mash.memberhours.security.SessionTokenService;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives login: credential check, directory resolution and then either a session for a single
 * member or a selection token for several members sharing the email.
 *
 * <p>A wrong password, an unknown email and an email the directory does not know all produce the
 * same {@link AuthFailure}. Directory outages are not failures of the caller and propagate as
 * retryable errors.
 */
@Service
public class AuthOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(AuthOrchestrator.class);
  static final String GENERIC_FAILURE = "Invalid email or password";

  private final CredentialStore credentialStore;
  private final ProfileDirectory profileDirectory;
  private final SelectionTokenService selectionTokenService;
  private final SessionTokenService sessionTokenService;
  private final LoginRateLimiter loginRateLimiter;
  private final Locale collationLocale;

  public AuthOrchestrator(
      CredentialStore credentialStore,
      ProfileDirectory profileDirectory,
      SelectionTokenService selectionTokenService,
      SessionTokenService sessionTokenService,
      LoginRateLimiter loginRateLimiter,
      AppProperties appProperties) {
    this.credentialStore = credentialStore;
    this.profileDirectory = profileDirectory;
    this.selectionTokenService = selectionTokenService;
    this.sessionTokenService = sessionTokenService;
    this.loginRateLimiter = loginRateLimiter;
    this.collationLocale = appProperties.collationLocale();
  }

  /**
   * Authenticates an email/password pair.
   *
   * @throws TooManyAttemptsException if the email has too many recent failed attempts
   */
  public LoginOutcome login(String email, String password) {
    String normalized = EmailAddresses.normalize(email);
    if (loginRateLimiter.isBlocked(normalized)) {
      throw new TooManyAttemptsException(
          "Too many failed login attempts. Please try again later.");
    }

    try {
      credentialStore.verify(normalized, password);
    } catch (InvalidCredentialException e) {
      loginRateLimiter.recordFailure(normalized);
      log.info("Login rejected: invalid credentials");
      return new AuthFailure(ErrorKind.INVALID_CREDENTIAL, GENERIC_FAILURE);
    }
    loginRateLimiter.recordSuccess(normalized);

    List<ProfileRecord> candidates;
    try {
      candidates = profileDirectory.resolve(normalized);
    } catch (NoSuchProfileException e) {
      log.warn("Login rejected: credential exists but no directory profile matches the email");
      return new AuthFailure(ErrorKind.INVALID_CREDENTIAL, GENERIC_FAILURE);
    }

    if (candidates.size() == 1) {
      return startSession(candidates.get(0), normalized);
    }

    var sorted =
        candidates.stream().sorted(ProfileOrdering.byDisplayName(collationLocale)).toList();
    String selectionToken =
        selectionTokenService.issue(
            normalized, sorted.stream().map(ProfileRecord::profileId).toList());
    log.info("Login requires member selection among {} profiles", sorted.size());
    return new AmbiguousSelection(selectionToken, sorted.stream().map(MemberView::from).toList());
  }

  /**
   * Redeems a selection token for one of its candidates and starts a session for that member.
   * The profile is read before the token is consumed, so a directory outage leaves the token
   * usable for a retry.
   */
  public SingleSession selectMember(String selectionToken, String profileId) {
    selectionTokenService.check(selectionToken, profileId);
    var profile = profileDirectory.findById(profileId);
    var redeemed = selectionTokenService.redeem(selectionToken, profileId);
    return startSession(profile, redeemed.email());
  }

  /** The directory profile behind a verified session. */
  public ProfileRecord currentUser(SessionClaims session) {
    return profileDirectory.findById(session.profileId());
  }

  private SingleSession startSession(ProfileRecord profile, String loginEmail) {
    var session = sessionTokenService.issue(profile.profileId(), loginEmail);
    log.info("Session issued for profile {}", profile.profileId());
    return new SingleSession(session, MemberView.from(profile));
  }
}
