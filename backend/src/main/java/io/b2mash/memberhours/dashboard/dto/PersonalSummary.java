package io.b2mash.memberhours.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;

public record PersonalSummary(
    int year,
    String profileId,
    String name,
    BigDecimal completed,
    BigDecimal required,
    BigDecimal remaining,
    BigDecimal percentage,
    boolean complete,
    List<EntryView> entries)
    implements DashboardSummary {

  public static final String TYPE = "personal";

  @Override
  @JsonProperty("type")
  public String type() {
    return TYPE;
  }
}
