package io.b2mash.memberhours.directory;

import io.b2mash.memberhours.exception.DirectoryUnavailableException;
import io.b2mash.memberhours.exception.NoSuchProfileException;
import java.util.List;

/**
 * Read-only port to the external member directory. Implementations report remote failures as
 * {@link DirectoryUnavailableException} and empty lookups as {@link NoSuchProfileException}; the
 * two are never conflated.
 */
public interface ProfileDirectory {

  /** All profiles registered under the email, compared case-insensitively. Never empty. */
  List<ProfileRecord> resolve(String email);

  ProfileRecord findById(String profileId);

  /** The family unit containing the profile, or a one-member unit if it has no family id. */
  FamilyUnit familyOf(String profileId);
}
