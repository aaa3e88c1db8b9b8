package io.b2mash.memberhours.auth.reset;

import io.b2mash.memberhours.config.MemberHoursConfig.AppProperties;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.credential.CredentialStore;
import io.b2mash.memberhours.credential.EmailAddresses;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.directory.ProfileRecord;
import io.b2mash.memberhours.email.EmailMessage;
import io.b2mash.memberhours.email.EmailProvider;
import io.b2mash.memberhours.exception.DirectoryUnavailableException;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.HtmlUtils;

/**
 * Password reset flow. Requesting a reset never reveals whether the email is known; redeeming a
 * token sets the password for the token's email and creates the login if it does not exist yet.
 */
@Service
public class PasswordResetService {

  private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);
  private static final String SUBJECT = "Passwort zurücksetzen";

  private final ProfileDirectory profileDirectory;
  private final ResetTokenService resetTokenService;
  private final CredentialStore credentialStore;
  private final EmailProvider emailProvider;
  private final String frontendUrl;
  private final long linkValidityHours;

  public PasswordResetService(
      ProfileDirectory profileDirectory,
      ResetTokenService resetTokenService,
      CredentialStore credentialStore,
      EmailProvider emailProvider,
      AppProperties appProperties,
      AuthProperties authProperties) {
    this.profileDirectory = profileDirectory;
    this.resetTokenService = resetTokenService;
    this.credentialStore = credentialStore;
    this.emailProvider = emailProvider;
    this.frontendUrl = appProperties.frontendUrl();
    this.linkValidityHours = authProperties.resetTokenTtl().toHours();
  }

  /**
   * Issues a reset token and mails the link if the email belongs to a directory member.
   *
   * @return the reset link when one was issued; callers expose it in development profiles only
   */
  public Optional<String> requestReset(String email) {
    String normalized = EmailAddresses.normalize(email);
    List<ProfileRecord> profiles;
    try {
      profiles = profileDirectory.resolve(normalized);
    } catch (NoSuchProfileException e) {
      log.info("Password reset requested for an email without directory profile");
      return Optional.empty();
    } catch (DirectoryUnavailableException e) {
      log.warn("Password reset not issued: member directory unavailable");
      return Optional.empty();
    }

    String rawToken = resetTokenService.issue(normalized);
    String resetLink =
        frontendUrl
            + "/reset-password?token="
            + URLEncoder.encode(rawToken, StandardCharsets.UTF_8)
            + "&id="
            + URLEncoder.encode(profiles.get(0).profileId(), StandardCharsets.UTF_8);

    try {
      var result = emailProvider.sendEmail(resetMessage(normalized, profiles.get(0), resetLink));
      if (!result.success()) {
        log.warn("Password reset email was not accepted: {}", result.errorMessage());
      }
    } catch (RuntimeException e) {
      log.warn("Failed to send password reset email via {}", emailProvider.providerId(), e);
    }
    return Optional.of(resetLink);
  }

  /**
   * Sets a new password using a reset token. The password policy is checked before the token is
   * touched, and token consumption commits together with the password change.
   */
  @Transactional
  public void resetPassword(String rawToken, String newPassword) {
    credentialStore.checkPolicy(newPassword);
    String email = resetTokenService.redeem(rawToken);
    credentialStore.setPassword(email, newPassword);
    log.info("Password reset completed");
  }

  private EmailMessage resetMessage(String email, ProfileRecord profile, String resetLink) {
    String greeting = "Hallo " + profile.displayName() + ",";
    String validity =
        "Der Link ist "
            + linkValidityHours
            + " Stunden gültig und kann nur einmal verwendet werden.";
    String plain =
        greeting
            + "\n\nüber folgenden Link kannst du dein Passwort zurücksetzen:\n"
            + resetLink
            + "\n\n"
            + validity;
    String html =
        "<p>"
            + HtmlUtils.htmlEscape(greeting)
            + "</p><p>über folgenden Link kannst du dein Passwort zurücksetzen:</p>"
            + "<p><a href=\""
            + resetLink
            + "\">Passwort zurücksetzen</a></p>"
            + "<p>"
            + validity
            + "</p>";
    return new EmailMessage(email, SUBJECT, html, plain, Map.of("referenceType", "PASSWORD_RESET"));
  }
}
