package io.b2mash.memberhours.auth;

import io.b2mash.memberhours.directory.ProfileRecord;

/** What a caller may see of a profile during login: no family, birth date or secrets. */
public record MemberView(String id, String name, String email) {

  public static MemberView from(ProfileRecord profile) {
    return new MemberView(profile.profileId(), profile.displayName(), profile.email());
  }
}
