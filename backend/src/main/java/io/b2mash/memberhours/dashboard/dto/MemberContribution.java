package io.b2mash.memberhours.dashboard.dto;

import java.math.BigDecimal;
import java.util.List;

/** One member's share of a family summary. */
public record MemberContribution(
    String profileId,
    String name,
    BigDecimal completed,
    BigDecimal required,
    BigDecimal remaining,
    BigDecimal percentage,
    boolean complete,
    List<EntryView> entries) {}
