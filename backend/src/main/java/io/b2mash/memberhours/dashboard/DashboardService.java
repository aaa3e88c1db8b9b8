package io.b2mash.memberhours.dashboard;

import io.b2mash.memberhours.config.MemberHoursConfig.AppProperties;
import io.b2mash.memberhours.dashboard.dto.DashboardSummary;
import io.b2mash.memberhours.dashboard.dto.EntryView;
import io.b2mash.memberhours.dashboard.dto.FamilySummary;
import io.b2mash.memberhours.dashboard.dto.MemberContribution;
import io.b2mash.memberhours.dashboard.dto.PersonalSummary;
import io.b2mash.memberhours.directory.FamilyUnit;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.directory.ProfileOrdering;
import io.b2mash.memberhours.directory.ProfileRecord;
import io.b2mash.memberhours.directory.RequiredHoursPolicy;
import io.b2mash.memberhours.exception.DataUnavailableException;
import io.b2mash.memberhours.exception.DirectoryUnavailableException;
import io.b2mash.memberhours.ledger.WorkHourEntry;
import io.b2mash.memberhours.ledger.WorkHourEntryRepository;
import io.b2mash.memberhours.ledger.WorkHourEntryValidator;
import io.b2mash.memberhours.security.SessionClaims;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Aggregates booked hours against the annual obligation. A caller without family sees a personal
 * summary; otherwise hours and obligations of all family members are pooled.
 *
 * <p>All amounts carry two decimal places. The percentage is capped at 100 and rounded half-up,
 * while {@code complete} compares the exact sums.
 */
@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  private static final BigDecimal HUNDRED = new BigDecimal("100.00");
  private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
  private static final Comparator<WorkHourEntry> ENTRY_ORDER =
      Comparator.comparing(WorkHourEntry::getEntryDate).thenComparing(WorkHourEntry::getId);

  private final ProfileDirectory profileDirectory;
  private final WorkHourEntryRepository entryRepository;
  private final RequiredHoursPolicy requiredHoursPolicy;
  private final Locale collationLocale;

  public DashboardService(
      ProfileDirectory profileDirectory,
      WorkHourEntryRepository entryRepository,
      RequiredHoursPolicy requiredHoursPolicy,
      AppProperties appProperties) {
    this.profileDirectory = profileDirectory;
    this.entryRepository = entryRepository;
    this.requiredHoursPolicy = requiredHoursPolicy;
    this.collationLocale = appProperties.collationLocale();
  }

  @Transactional(readOnly = true)
  public DashboardSummary summarize(SessionClaims session, int year) {
    WorkHourEntryValidator.requireSupportedYear(year);

    FamilyUnit unit;
    try {
      unit = profileDirectory.familyOf(session.profileId());
    } catch (DirectoryUnavailableException e) {
      log.warn("Dashboard for profile {} unavailable: {}", session.profileId(), e.getMessage());
      throw new DataUnavailableException(
          "Member data is temporarily unavailable. Please try again later.");
    }

    var members =
        unit.members().stream().sorted(ProfileOrdering.byDisplayName(collationLocale)).toList();
    Map<String, List<WorkHourEntry>> entriesByProfile =
        entryRepository
            .findForProfilesBetween(
                members.stream().map(ProfileRecord::profileId).toList(),
                LocalDate.of(year, 1, 1),
                LocalDate.of(year, 12, 31))
            .stream()
            .collect(Collectors.groupingBy(WorkHourEntry::getProfileId));

    var contributions =
        members.stream()
            .map(
                member ->
                    contribution(
                        member, year, entriesByProfile.getOrDefault(member.profileId(), List.of())))
            .toList();

    if (unit.hasSingleMember()) {
      var own = contributions.get(0);
      return new PersonalSummary(
          year,
          own.profileId(),
          own.name(),
          own.completed(),
          own.required(),
          own.remaining(),
          own.percentage(),
          own.complete(),
          own.entries());
    }

    BigDecimal completed =
        contributions.stream().map(MemberContribution::completed).reduce(ZERO, BigDecimal::add);
    BigDecimal required =
        contributions.stream().map(MemberContribution::required).reduce(ZERO, BigDecimal::add);
    return new FamilySummary(
        year,
        unit.familyUnitId(),
        completed,
        required,
        remaining(completed, required),
        percentage(completed, required),
        completed.compareTo(required) >= 0,
        contributions);
  }

  private MemberContribution contribution(
      ProfileRecord member, int year, List<WorkHourEntry> entries) {
    BigDecimal completed =
        entries.stream()
            .map(WorkHourEntry::getHours)
            .reduce(ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
    BigDecimal required = requiredHoursPolicy.requiredHours(member, year);
    var views =
        entries.stream()
            .sorted(ENTRY_ORDER)
            .map(
                entry ->
                    new EntryView(
                        entry.getId(),
                        entry.getEntryDate(),
                        entry.getDescription(),
                        entry.getHours()))
            .toList();
    return new MemberContribution(
        member.profileId(),
        member.displayName(),
        completed,
        required,
        remaining(completed, required),
        percentage(completed, required),
        completed.compareTo(required) >= 0,
        views);
  }

  static BigDecimal remaining(BigDecimal completed, BigDecimal required) {
    return required.subtract(completed).max(ZERO).setScale(2, RoundingMode.HALF_UP);
  }

  static BigDecimal percentage(BigDecimal completed, BigDecimal required) {
    if (required.signum() == 0) {
      return HUNDRED;
    }
    return completed.multiply(HUNDRED).divide(required, 2, RoundingMode.HALF_UP).min(HUNDRED);
  }
}
