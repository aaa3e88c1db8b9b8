package io.b2mash.memberhours.ledger;

import io.b2mash.memberhours.config.MemberHoursConfig.HoursProperties;
import io.b2mash.memberhours.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import org.springframework.stereotype.Component;

/**
 * Field rules shared by create and update. Entries may be booked for the current year up to today;
 * during January the previous year stays open for late bookings.
 */
@Component
public class WorkHourEntryValidator {

  public static final int MIN_YEAR = 2000;
  public static final int MAX_YEAR = 2100;
  static final BigDecimal MAX_HOURS = new BigDecimal("24");
  private static final BigDecimal STEP = new BigDecimal("0.5");

  private final Clock clock;
  private final int descriptionMaxLength;

  public WorkHourEntryValidator(Clock clock, HoursProperties hoursProperties) {
    this.clock = clock;
    this.descriptionMaxLength = hoursProperties.descriptionMaxLength();
  }

  /** Returns the trimmed description once every rule holds. */
  public String validate(LocalDate date, String description, BigDecimal hours) {
    validateDate(date);
    validateHours(hours);
    return validateDescription(description);
  }

  /** Rejects years outside the range that listings and summaries are served for. */
  public static void requireSupportedYear(int year) {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      throw new ValidationException(
          "year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", was " + year);
    }
  }

  private void validateDate(LocalDate date) {
    if (date == null) {
      throw new ValidationException("date is required");
    }
    LocalDate today = LocalDate.now(clock);
    if (date.isAfter(today)) {
      throw new ValidationException("Work hours cannot be booked for a future date");
    }
    boolean currentYear = date.getYear() == today.getYear();
    boolean lateBooking =
        today.getMonth() == Month.JANUARY && date.getYear() == today.getYear() - 1;
    if (!currentYear && !lateBooking) {
      throw new ValidationException(
          "Work hours can only be booked for the current year (previous year during January)");
    }
  }

  private void validateHours(BigDecimal hours) {
    if (hours == null) {
      throw new ValidationException("hours is required");
    }
    if (hours.signum() <= 0 || hours.compareTo(MAX_HOURS) > 0) {
      throw new ValidationException("hours must be greater than 0 and at most 24");
    }
    if (hours.remainder(STEP).signum() != 0) {
      throw new ValidationException("hours must be a multiple of 0.5");
    }
  }

  private String validateDescription(String description) {
    String trimmed = description == null ? "" : description.trim();
    if (trimmed.isEmpty()) {
      throw new ValidationException("description is required");
    }
    if (trimmed.length() > descriptionMaxLength) {
      throw new ValidationException(
          "description must be at most " + descriptionMaxLength + " characters");
    }
    return trimmed;
  }
}
