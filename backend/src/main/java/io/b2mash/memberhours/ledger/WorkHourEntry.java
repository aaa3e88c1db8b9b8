package io.b2mash.memberhours.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "work_hour_entries")
public class WorkHourEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "profile_id", nullable = false, updatable = false, length = 64)
  private String profileId;

  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @Column(name = "description", nullable = false, length = 500)
  private String description;

  @Column(name = "hours", nullable = false, precision = 4, scale = 2)
  private BigDecimal hours;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkHourEntry() {}

  public WorkHourEntry(
      String profileId, LocalDate entryDate, String description, BigDecimal hours, Instant now) {
    this.profileId = profileId;
    this.entryDate = entryDate;
    this.description = description;
    this.hours = hours.setScale(2, RoundingMode.HALF_UP);
    this.createdAt = now;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getProfileId() {
    return profileId;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getHours() {
    return hours;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isOwnedBy(String candidateProfileId) {
    return profileId.equals(candidateProfileId);
  }

  public void update(LocalDate entryDate, String description, BigDecimal hours, Instant now) {
    this.entryDate = entryDate;
    this.description = description;
    this.hours = hours.setScale(2, RoundingMode.HALF_UP);
    this.updatedAt = now;
  }
}
