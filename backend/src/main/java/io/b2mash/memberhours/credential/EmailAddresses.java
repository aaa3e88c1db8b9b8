package io.b2mash.memberhours.credential;

import java.util.Locale;

/** Emails are compared case-insensitively everywhere; this is the single normalization rule. */
public final class EmailAddresses {

  private EmailAddresses() {}

  public static String normalize(String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }
}
