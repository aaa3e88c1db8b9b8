package io.b2mash.memberhours.auth;

import static io.b2mash.memberhours.TestFixtures.familyMember;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.memberhours.TestFixtures;
import io.b2mash.memberhours.auth.LoginOutcome.AmbiguousSelection;
import io.b2mash.memberhours.auth.LoginOutcome.AuthFailure;
import io.b2mash.memberhours.auth.LoginOutcome.SingleSession;
import io.b2mash.memberhours.auth.selection.SelectionToken;
import io.b2mash.memberhours.auth.selection.SelectionTokenRepository;
import io.b2mash.memberhours.auth.selection.SelectionTokenService;
import io.b2mash.memberhours.auth.selection.SelectionTokenService.RedeemedSelection;
import io.b2mash.memberhours.credential.CredentialStore;
import io.b2mash.memberhours.credential.CredentialStore.VerifiedCredential;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.exception.DirectoryUnavailableException;
import io.b2mash.memberhours.exception.ErrorKind;
import io.b2mash.memberhours.exception.InvalidCredentialException;
import io.b2mash.memberhours.exception.InvalidSelectionTokenException;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import io.b2mash.memberhours.exception.TooManyAttemptsException;
import io.b2mash.memberhours.security.SessionClaims;
import io.b2mash.memberhours.security.SessionTokenService.IssuedSession;
import io.b2mash.memberhours.security.SessionTokenService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthOrchestratorTest {

  private static final String EMAIL = "familie@example.org";

  @Mock private CredentialStore credentialStore;
  @Mock private ProfileDirectory profileDirectory;
  @Mock private SelectionTokenService selectionTokenService;
  @Mock private SessionTokenService sessionTokenService;

  private LoginRateLimiter loginRateLimiter;
  private AuthOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    loginRateLimiter = new LoginRateLimiter(3, Duration.ofMinutes(15), Ticker.systemTicker());
    orchestrator =
        new AuthOrchestrator(
            credentialStore,
            profileDirectory,
            selectionTokenService,
            sessionTokenService,
            loginRateLimiter,
            TestFixtures.appProperties());
  }

  @Test
  void login_singleCandidateYieldsSession() {
    var anna = familyMember("rec1", "Anna", "Berg", EMAIL, null);
    when(credentialStore.verify(EMAIL, "secret-123")).thenReturn(new VerifiedCredential(EMAIL));
    when(profileDirectory.resolve(EMAIL)).thenReturn(List.of(anna));
    when(sessionTokenService.issue("rec1", EMAIL)).thenReturn(issued("rec1"));

    var outcome = orchestrator.login("Familie@Example.org", "secret-123");

    assertThat(outcome).isInstanceOf(SingleSession.class);
    var single = (SingleSession) outcome;
    assertThat(single.session().token()).isEqualTo("jwt-rec1");
    assertThat(single.user()).isEqualTo(new MemberView("rec1", "Anna Berg", EMAIL));
    verifyNoInteractions(selectionTokenService);
  }

  @Test
  void login_severalCandidatesAreSortedAndBoundToSelectionToken() {
    var zoe = familyMember("rec3", "Zoë", "Adler", EMAIL, "F1");
    var aenne = familyMember("rec2", "Änne", "Adler", EMAIL, "F1");
    var bernd = familyMember("rec1", "Bernd", "Adler", EMAIL, "F1");
    when(credentialStore.verify(EMAIL, "secret-123")).thenReturn(new VerifiedCredential(EMAIL));
    when(profileDirectory.resolve(EMAIL)).thenReturn(List.of(zoe, bernd, aenne));
    when(selectionTokenService.issue(EMAIL, List.of("rec2", "rec1", "rec3")))
        .thenReturn("selection-token");

    var outcome = orchestrator.login(EMAIL, "secret-123");

    assertThat(outcome).isInstanceOf(AmbiguousSelection.class);
    var ambiguous = (AmbiguousSelection) outcome;
    assertThat(ambiguous.selectionToken()).isEqualTo("selection-token");
    assertThat(ambiguous.candidates())
        .extracting(MemberView::name)
        .containsExactly("Änne Adler", "Bernd Adler", "Zoë Adler");
    verify(sessionTokenService, never()).issue(anyString(), anyString());
  }

  @Test
  void login_wrongPasswordAndUnknownProfileLookTheSame() {
    when(credentialStore.verify(EMAIL, "wrong"))
        .thenThrow(new InvalidCredentialException("Invalid email or password"));
    when(credentialStore.verify(EMAIL, "secret-123")).thenReturn(new VerifiedCredential(EMAIL));
    when(profileDirectory.resolve(EMAIL)).thenThrow(new NoSuchProfileException("no profile"));

    var wrongPassword = orchestrator.login(EMAIL, "wrong");
    var noProfile = orchestrator.login(EMAIL, "secret-123");

    assertThat(wrongPassword).isEqualTo(noProfile);
    assertThat(wrongPassword)
        .isEqualTo(new AuthFailure(ErrorKind.INVALID_CREDENTIAL, "Invalid email or password"));
  }

  @Test
  void login_directoryOutagePropagates() {
    when(credentialStore.verify(EMAIL, "secret-123")).thenReturn(new VerifiedCredential(EMAIL));
    when(profileDirectory.resolve(EMAIL))
        .thenThrow(new DirectoryUnavailableException("directory down"));

    assertThatThrownBy(() -> orchestrator.login(EMAIL, "secret-123"))
        .isInstanceOf(DirectoryUnavailableException.class);
  }

  @Test
  void login_blockedAfterRepeatedFailures() {
    when(credentialStore.verify(EMAIL, "wrong"))
        .thenThrow(new InvalidCredentialException("Invalid email or password"));
    for (int i = 0; i < 3; i++) {
      assertThat(orchestrator.login(EMAIL, "wrong")).isInstanceOf(AuthFailure.class);
    }

    assertThatThrownBy(() -> orchestrator.login(EMAIL, "wrong"))
        .isInstanceOf(TooManyAttemptsException.class);
  }

  @Test
  void selectMember_startsSessionForRedeemedProfile() {
    var bernd = familyMember("rec1", "Bernd", "Adler", EMAIL, "F1");
    when(selectionTokenService.redeem("selection-token", "rec1"))
        .thenReturn(new RedeemedSelection(EMAIL, "rec1"));
    when(profileDirectory.findById("rec1")).thenReturn(bernd);
    when(sessionTokenService.issue("rec1", EMAIL)).thenReturn(issued("rec1"));

    var single = orchestrator.selectMember("selection-token", "rec1");

    assertThat(single.user().id()).isEqualTo("rec1");
    assertThat(single.session().claims().profileId()).isEqualTo("rec1");
  }

  @Test
  void selectMember_invalidTokenStartsNoSession() {
    doThrow(new InvalidSelectionTokenException("Selection token has already been used"))
        .when(selectionTokenService)
        .check("used-token", "rec1");

    assertThatThrownBy(() -> orchestrator.selectMember("used-token", "rec1"))
        .isInstanceOf(InvalidSelectionTokenException.class);
    verify(sessionTokenService, never()).issue(any(), any());
    verifyNoInteractions(profileDirectory);
  }

  @Test
  void selectMember_directoryOutageLeavesTokenUsableForRetry() {
    var tokenRepository = mock(SelectionTokenRepository.class);
    var tokenService =
        new SelectionTokenService(
            tokenRepository,
            new OpaqueTokenGenerator(),
            Clock.fixed(Instant.parse("2025-03-15T10:00:00Z"), ZoneOffset.UTC),
            TestFixtures.authProperties());
    String raw = tokenService.issue(EMAIL, List.of("rec1", "rec2"));
    var saved = ArgumentCaptor.forClass(SelectionToken.class);
    verify(tokenRepository).save(saved.capture());
    var token = saved.getValue();
    when(tokenRepository.findByTokenHash(OpaqueTokenGenerator.hash(raw)))
        .thenReturn(Optional.of(token));
    when(tokenRepository.findByTokenHashForUpdate(OpaqueTokenGenerator.hash(raw)))
        .thenReturn(Optional.of(token));
    var bernd = familyMember("rec1", "Bernd", "Adler", EMAIL, "F1");
    when(profileDirectory.findById("rec1"))
        .thenThrow(new DirectoryUnavailableException("Member directory is currently unavailable"))
        .thenReturn(bernd);
    when(sessionTokenService.issue("rec1", EMAIL)).thenReturn(issued("rec1"));
    var withRealTokens =
        new AuthOrchestrator(
            credentialStore,
            profileDirectory,
            tokenService,
            sessionTokenService,
            loginRateLimiter,
            TestFixtures.appProperties());

    assertThatThrownBy(() -> withRealTokens.selectMember(raw, "rec1"))
        .isInstanceOf(DirectoryUnavailableException.class);
    assertThat(token.isConsumed()).isFalse();

    var single = withRealTokens.selectMember(raw, "rec1");

    assertThat(single.user().id()).isEqualTo("rec1");
    assertThat(token.isConsumed()).isTrue();
  }

  private static IssuedSession issued(String profileId) {
    var now = Instant.parse("2025-03-15T10:00:00Z");
    return new IssuedSession(
        "jwt-" + profileId,
        new SessionClaims(profileId, EMAIL, now, now.plus(Duration.ofHours(24))));
  }
}
