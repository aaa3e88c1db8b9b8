package io.b2mash.memberhours.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;

/** Totals over all members of a family unit; members are listed in display-name order. */
public record FamilySummary(
    int year,
    String familyUnitId,
    BigDecimal completed,
    BigDecimal required,
    BigDecimal remaining,
    BigDecimal percentage,
    boolean complete,
    List<MemberContribution> members)
    implements DashboardSummary {

  public static final String TYPE = "family";

  @Override
  @JsonProperty("type")
  public String type() {
    return TYPE;
  }
}
