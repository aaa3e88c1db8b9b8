package io.b2mash.memberhours.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/** Year progress of the caller, either alone or as part of a family unit. */
public sealed interface DashboardSummary permits PersonalSummary, FamilySummary {

  @JsonProperty("type")
  String type();

  int year();

  BigDecimal completed();

  BigDecimal required();

  BigDecimal remaining();

  BigDecimal percentage();

  boolean complete();
}
