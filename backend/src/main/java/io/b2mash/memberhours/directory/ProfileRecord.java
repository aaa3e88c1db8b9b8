package io.b2mash.memberhours.directory;

import java.time.LocalDate;

/**
 * A member profile as held by the external directory. Several profiles may share one email.
 *
 * @param familyUnitId directory family identifier, {@code null} when the member has none
 * @param birthDate {@code null} when unknown or unparseable
 */
public record ProfileRecord(
    String profileId,
    String firstName,
    String lastName,
    String email,
    String familyUnitId,
    LocalDate birthDate) {

  public String displayName() {
    return (nullToEmpty(firstName) + " " + nullToEmpty(lastName)).trim();
  }

  public boolean hasFamily() {
    return familyUnitId != null && !familyUnitId.isBlank();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
