package io.b2mash.memberhours.auth;

import io.b2mash.memberhours.exception.ErrorKind;
import io.b2mash.memberhours.security.SessionTokenService.IssuedSession;
import java.util.List;

/** Result of a login attempt. Exactly one of the three shapes is produced per request. */
public sealed interface LoginOutcome
    permits LoginOutcome.SingleSession, LoginOutcome.AmbiguousSelection, LoginOutcome.AuthFailure {

  /** The email resolved to one member; a session has been issued. */
  record SingleSession(IssuedSession session, MemberView user) implements LoginOutcome {}

  /** Several members share the email; the caller must pick one with the selection token. */
  record AmbiguousSelection(String selectionToken, List<MemberView> candidates)
      implements LoginOutcome {

    public AmbiguousSelection {
      candidates = List.copyOf(candidates);
    }
  }

  record AuthFailure(ErrorKind kind, String message) implements LoginOutcome {}
}
