package io.b2mash.memberhours.dashboard.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record EntryView(UUID id, LocalDate date, String description, BigDecimal hours) {}
