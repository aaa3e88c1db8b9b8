package io.b2mash.memberhours.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.memberhours.auth.LoginOutcome.AmbiguousSelection;
import io.b2mash.memberhours.auth.LoginOutcome.AuthFailure;
import io.b2mash.memberhours.auth.LoginOutcome.SingleSession;
import io.b2mash.memberhours.auth.reset.PasswordResetService;
import io.b2mash.memberhours.directory.ProfileRecord;
import io.b2mash.memberhours.security.SessionClaims;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login, member selection and password reset endpoints. Login and reset requests are public;
 * {@code /verify-token} and {@code /user} require a session.
 */
@RestController
@RequestMapping("/api")
public class AuthController {

  static final String SELECTION_MESSAGE = "Multiple members found. Please select a member.";
  static final String RESET_REQUESTED_MESSAGE =
      "If an account exists for this email, a password reset link has been sent.";
  static final String RESET_DONE_MESSAGE = "Password has been reset successfully.";

  private final AuthOrchestrator authOrchestrator;
  private final PasswordResetService passwordResetService;
  private final Environment environment;

  public AuthController(
      AuthOrchestrator authOrchestrator,
      PasswordResetService passwordResetService,
      Environment environment) {
    this.authOrchestrator = authOrchestrator;
    this.passwordResetService = passwordResetService;
    this.environment = environment;
  }

  @PostMapping("/login")
  public ResponseEntity<Object> login(@Valid @RequestBody LoginRequest request) {
    LoginOutcome outcome = authOrchestrator.login(request.email(), request.password());

    if (outcome instanceof SingleSession single) {
      return ResponseEntity.ok(LoginResponse.from(single));
    }
    if (outcome instanceof AmbiguousSelection ambiguous) {
      return ResponseEntity.ok(
          new MemberSelectionResponse(
              false,
              true,
              ambiguous.candidates().stream().map(UserResponse::from).toList(),
              ambiguous.selectionToken(),
              SELECTION_MESSAGE));
    }
    var failure = (AuthFailure) outcome;
    return ResponseEntity.status(failure.kind().status())
        .body(new AuthFailureResponse(false, failure.kind().name(), failure.message()));
  }

  @PostMapping("/select-member")
  public ResponseEntity<LoginResponse> selectMember(
      @Valid @RequestBody SelectMemberRequest request) {
    var single = authOrchestrator.selectMember(request.selectionToken(), request.memberId());
    return ResponseEntity.ok(LoginResponse.from(single));
  }

  /**
   * Always answers with the same message so the response does not reveal whether the email is
   * registered. In dev/test profiles the reset link is included for testing.
   */
  @PostMapping("/forgotPassword")
  public ResponseEntity<ForgotPasswordResponse> forgotPassword(
      @Valid @RequestBody ForgotPasswordRequest request) {
    var resetLink = passwordResetService.requestReset(request.email());
    String exposedLink = isDevProfile() ? resetLink.orElse(null) : null;
    return ResponseEntity.ok(
        new ForgotPasswordResponse(true, RESET_REQUESTED_MESSAGE, exposedLink));
  }

  @PostMapping("/resetPassword")
  public ResponseEntity<MessageResponse> resetPassword(
      @Valid @RequestBody ResetPasswordRequest request) {
    passwordResetService.resetPassword(request.token(), request.password());
    return ResponseEntity.ok(new MessageResponse(true, RESET_DONE_MESSAGE));
  }

  @GetMapping("/verify-token")
  public ResponseEntity<VerifyTokenResponse> verifyToken(
      @AuthenticationPrincipal SessionClaims session) {
    var profile = authOrchestrator.currentUser(session);
    return ResponseEntity.ok(
        new VerifyTokenResponse(true, UserResponse.from(MemberView.from(profile))));
  }

  @GetMapping("/user")
  public ResponseEntity<UserProfileResponse> currentUser(
      @AuthenticationPrincipal SessionClaims session) {
    return ResponseEntity.ok(UserProfileResponse.from(authOrchestrator.currentUser(session)));
  }

  private boolean isDevProfile() {
    for (String profile : environment.getActiveProfiles()) {
      if ("local".equals(profile) || "test".equals(profile) || "dev".equals(profile)) {
        return true;
      }
    }
    return false;
  }

  // --- DTOs ---

  public record LoginRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email,
      @NotBlank(message = "password is required") String password) {}

  public record SelectMemberRequest(
      @JsonProperty("member_id") @NotBlank(message = "member_id is required") String memberId,
      @JsonProperty("selection_token") @NotBlank(message = "selection_token is required")
          String selectionToken) {}

  public record ForgotPasswordRequest(
      @NotBlank(message = "email is required") @Email(message = "invalid email format")
          String email) {}

  /** {@code userId} is carried by the reset link but has no authority; the token decides. */
  public record ResetPasswordRequest(
      @NotBlank(message = "token is required") String token, String userId, String password) {}

  public record UserResponse(String id, String name, String email) {

    static UserResponse from(MemberView view) {
      return new UserResponse(view.id(), view.name(), view.email());
    }
  }

  public record LoginResponse(boolean success, String token, UserResponse user) {

    static LoginResponse from(SingleSession single) {
      return new LoginResponse(true, single.session().token(), UserResponse.from(single.user()));
    }
  }

  public record MemberSelectionResponse(
      boolean success,
      boolean multiple,
      List<UserResponse> users,
      @JsonProperty("selection_token") String selectionToken,
      String message) {}

  public record AuthFailureResponse(boolean success, String kind, String message) {}

  public record MessageResponse(boolean success, String message) {}

  public record ForgotPasswordResponse(boolean success, String message, String resetLink) {}

  public record VerifyTokenResponse(boolean valid, UserResponse user) {}

  public record UserProfileResponse(
      String id,
      String firstName,
      String lastName,
      String name,
      String email,
      String familyUnitId) {

    static UserProfileResponse from(ProfileRecord profile) {
      return new UserProfileResponse(
          profile.profileId(),
          profile.firstName(),
          profile.lastName(),
          profile.displayName(),
          profile.email(),
          profile.familyUnitId());
    }
  }
}
