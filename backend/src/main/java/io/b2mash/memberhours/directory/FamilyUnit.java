package io.b2mash.memberhours.directory;

import java.util.List;

/** The members sharing one directory family id, or a synthetic unit holding a single profile. */
public record FamilyUnit(String familyUnitId, List<ProfileRecord> members) {

  static final String SINGLE_PREFIX = "single:";

  public FamilyUnit {
    if (members == null || members.isEmpty()) {
      throw new IllegalArgumentException("A family unit has at least one member");
    }
    members = List.copyOf(members);
  }

  public static FamilyUnit single(ProfileRecord profile) {
    return new FamilyUnit(SINGLE_PREFIX + profile.profileId(), List.of(profile));
  }

  public boolean hasSingleMember() {
    return members.size() == 1;
  }

  public boolean contains(String profileId) {
    return members.stream().anyMatch(member -> member.profileId().equals(profileId));
  }
}
