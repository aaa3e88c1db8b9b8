package io.b2mash.memberhours.directory;

import io.b2mash.memberhours.config.MemberHoursConfig.HoursProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Annual work-hour obligation by age: members whose age reached in the year lies in {@code
 * [minAge, maxAge)} owe the standard hours, everyone else owes none. An unknown birth date counts
 * as obliged.
 */
@Component
public class RequiredHoursPolicy {

  private final BigDecimal standardHours;
  private final int minAge;
  private final int maxAge;

  public RequiredHoursPolicy(HoursProperties hoursProperties) {
    this.standardHours = hoursProperties.requiredPerYear().setScale(2, RoundingMode.HALF_UP);
    this.minAge = hoursProperties.minAge();
    this.maxAge = hoursProperties.maxAge();
  }

  public BigDecimal requiredHours(ProfileRecord profile, int year) {
    if (profile.birthDate() == null) {
      return standardHours;
    }
    int age = year - profile.birthDate().getYear();
    return age >= minAge && age < maxAge ? standardHours : BigDecimal.ZERO.setScale(2);
  }
}
