package io.b2mash.memberhours.ledger;

import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.exception.DuplicateEntryForDateException;
import io.b2mash.memberhours.exception.ResourceNotFoundException;
import io.b2mash.memberhours.exception.UnauthorizedException;
import io.b2mash.memberhours.security.SessionClaims;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Work-hour bookings of one member. Each member books at most one entry per day; the unique
 * constraint on {@code (profile_id, entry_date)} is authoritative, the repository pre-check only
 * gives the common case a friendlier path. Only the owner may change an entry, family members may
 * read it.
 */
@Service
public class WorkHourLedger {

  private static final Logger log = LoggerFactory.getLogger(WorkHourLedger.class);
  static final String DUPLICATE_MESSAGE =
      "Für dieses Datum existiert bereits ein Eintrag. Pro Person und Tag ist nur ein Eintrag"
          + " erlaubt.";

  private final WorkHourEntryRepository repository;
  private final WorkHourEntryValidator validator;
  private final ProfileDirectory profileDirectory;
  private final Clock clock;

  public WorkHourLedger(
      WorkHourEntryRepository repository,
      WorkHourEntryValidator validator,
      ProfileDirectory profileDirectory,
      Clock clock) {
    this.repository = repository;
    this.validator = validator;
    this.profileDirectory = profileDirectory;
    this.clock = clock;
  }

  @Transactional
  public WorkHourEntry create(
      SessionClaims session, LocalDate date, String description, BigDecimal hours) {
    String cleanDescription = validator.validate(date, description, hours);
    if (repository.existsByProfileIdAndEntryDate(session.profileId(), date)) {
      throw new DuplicateEntryForDateException(DUPLICATE_MESSAGE);
    }

    var entry =
        new WorkHourEntry(session.profileId(), date, cleanDescription, hours, clock.instant());
    try {
      entry = repository.saveAndFlush(entry);
    } catch (DataIntegrityViolationException ex) {
      throw new DuplicateEntryForDateException(DUPLICATE_MESSAGE);
    }

    log.info(
        "Created work hour entry: id={}, profileId={}, date={}, hours={}",
        entry.getId(),
        entry.getProfileId(),
        entry.getEntryDate(),
        entry.getHours());
    return entry;
  }

  @Transactional
  public WorkHourEntry update(
      SessionClaims session, UUID entryId, LocalDate date, String description, BigDecimal hours) {
    var entry = requireOwned(session, entryId);
    String cleanDescription = validator.validate(date, description, hours);
    if (repository.existsByProfileIdAndEntryDateAndIdNot(entry.getProfileId(), date, entryId)) {
      throw new DuplicateEntryForDateException(DUPLICATE_MESSAGE);
    }

    entry.update(date, cleanDescription, hours, clock.instant());
    try {
      entry = repository.saveAndFlush(entry);
    } catch (DataIntegrityViolationException ex) {
      throw new DuplicateEntryForDateException(DUPLICATE_MESSAGE);
    }

    log.info("Updated work hour entry: id={}, date={}, hours={}", entryId, date, hours);
    return entry;
  }

  @Transactional
  public void delete(SessionClaims session, UUID entryId) {
    var entry = requireOwned(session, entryId);
    repository.delete(entry);
    log.info("Deleted work hour entry: id={}, profileId={}", entryId, entry.getProfileId());
  }

  @Transactional(readOnly = true)
  public WorkHourEntry get(SessionClaims session, UUID entryId) {
    var entry = find(entryId);
    requireReadAccess(session, entry.getProfileId());
    return entry;
  }

  /** Entries of a profile in a calendar year, ordered by date then id. */
  @Transactional(readOnly = true)
  public List<WorkHourEntry> listByProfile(SessionClaims session, String profileId, int year) {
    WorkHourEntryValidator.requireSupportedYear(year);
    requireReadAccess(session, profileId);
    return repository.findByProfileIdAndEntryDateBetweenOrderByEntryDateAscIdAsc(
        profileId, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
  }

  private WorkHourEntry find(UUID entryId) {
    return repository
        .findById(entryId)
        .orElseThrow(() -> new ResourceNotFoundException("Work hour entry", entryId));
  }

  private WorkHourEntry requireOwned(SessionClaims session, UUID entryId) {
    var entry = find(entryId);
    if (!entry.isOwnedBy(session.profileId())) {
      log.warn(
          "Profile {} attempted to modify work hour entry {} of another member",
          session.profileId(),
          entryId);
      throw new UnauthorizedException("Only the owner can modify this work hour entry");
    }
    return entry;
  }

  private void requireReadAccess(SessionClaims session, String profileId) {
    if (session.profileId().equals(profileId)) {
      return;
    }
    if (!profileDirectory.familyOf(session.profileId()).contains(profileId)) {
      throw new UnauthorizedException("Work hours of this member are not visible to you");
    }
  }
}
