package io.b2mash.memberhours.ledger;

import io.b2mash.memberhours.security.SessionClaims;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkHourController {

  private final WorkHourLedger workHourLedger;
  private final Clock clock;

  public WorkHourController(WorkHourLedger workHourLedger, Clock clock) {
    this.workHourLedger = workHourLedger;
    this.clock = clock;
  }

  @GetMapping("/api/arbeitsstunden")
  public ResponseEntity<List<WorkHourEntryResponse>> listEntries(
      @AuthenticationPrincipal SessionClaims session,
      @RequestParam(required = false) Integer year,
      @RequestParam(required = false) String profileId) {
    int effectiveYear = year != null ? year : LocalDate.now(clock).getYear();
    String effectiveProfile = profileId != null ? profileId : session.profileId();
    var entries = workHourLedger.listByProfile(session, effectiveProfile, effectiveYear);
    return ResponseEntity.ok(entries.stream().map(WorkHourEntryResponse::from).toList());
  }

  @GetMapping("/api/arbeitsstunden/{id}")
  public ResponseEntity<WorkHourEntryResponse> getEntry(
      @AuthenticationPrincipal SessionClaims session, @PathVariable UUID id) {
    return ResponseEntity.ok(WorkHourEntryResponse.from(workHourLedger.get(session, id)));
  }

  @PostMapping("/api/arbeitsstunden")
  public ResponseEntity<WorkHourEntryResponse> createEntry(
      @AuthenticationPrincipal SessionClaims session,
      @Valid @RequestBody WorkHourEntryRequest request) {
    var entry =
        workHourLedger.create(
            session, request.date(), request.description(), HoursValue.parse(request.hours()));
    return ResponseEntity.created(URI.create("/api/arbeitsstunden/" + entry.getId()))
        .body(WorkHourEntryResponse.from(entry));
  }

  @PutMapping("/api/arbeitsstunden/{id}")
  public ResponseEntity<WorkHourEntryResponse> updateEntry(
      @AuthenticationPrincipal SessionClaims session,
      @PathVariable UUID id,
      @Valid @RequestBody WorkHourEntryRequest request) {
    var entry =
        workHourLedger.update(
            session,
            id,
            request.date(),
            request.description(),
            HoursValue.parse(request.hours()));
    return ResponseEntity.ok(WorkHourEntryResponse.from(entry));
  }

  @DeleteMapping("/api/arbeitsstunden/{id}")
  public ResponseEntity<Void> deleteEntry(
      @AuthenticationPrincipal SessionClaims session, @PathVariable UUID id) {
    workHourLedger.delete(session, id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  /** {@code hours} is a JSON number or a numeric string with {@code ,} or {@code .}. */
  public record WorkHourEntryRequest(
      @NotNull(message = "date is required") LocalDate date,
      String description,
      @NotNull(message = "hours is required") Object hours) {}

  public record WorkHourEntryResponse(
      UUID id,
      String profileId,
      LocalDate date,
      String description,
      BigDecimal hours,
      Instant createdAt,
      Instant updatedAt) {

    public static WorkHourEntryResponse from(WorkHourEntry entry) {
      return new WorkHourEntryResponse(
          entry.getId(),
          entry.getProfileId(),
          entry.getEntryDate(),
          entry.getDescription(),
          entry.getHours(),
          entry.getCreatedAt(),
          entry.getUpdatedAt());
    }
  }
}
