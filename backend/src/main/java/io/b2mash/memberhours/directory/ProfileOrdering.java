package io.b2mash.memberhours.directory;

import java.text.Collator;
import java.util.Comparator;
import java.util.Locale;

/** Deterministic, locale-aware ordering of profiles for candidate lists and dashboards. */
public final class ProfileOrdering {

  private ProfileOrdering() {}

  /** Orders by display name under the locale's collation rules, then by profile id. */
  public static Comparator<ProfileRecord> byDisplayName(Locale locale) {
    Collator collator = Collator.getInstance(locale);
    return Comparator.comparing(ProfileRecord::displayName, collator)
        .thenComparing(ProfileRecord::profileId);
  }
}
