package io.b2mash.memberhours.auth.selection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Short-lived token letting a caller who proved the shared password pick one of the profiles
 * registered under the email. The candidate list is fixed at issue time.
 */
@Entity
@Table(name = "selection_tokens")
public class SelectionToken {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "token_hash", nullable = false, unique = true, length = 64)
  private String tokenHash;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "candidate_profile_ids", nullable = false, columnDefinition = "jsonb")
  private List<String> candidateProfileIds;

  @Column(name = "issued_at", nullable = false, updatable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  protected SelectionToken() {}

  public SelectionToken(
      String tokenHash,
      String email,
      List<String> candidateProfileIds,
      Instant issuedAt,
      Instant expiresAt) {
    this.tokenHash = tokenHash;
    this.email = email;
    this.candidateProfileIds = List.copyOf(candidateProfileIds);
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
  }

  public void markConsumed(Instant now) {
    this.consumedAt = now;
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public boolean isConsumed() {
    return consumedAt != null;
  }

  public boolean hasCandidate(String profileId) {
    return candidateProfileIds.contains(profileId);
  }

  public UUID getId() {
    return id;
  }

  public String getTokenHash() {
    return tokenHash;
  }

  public String getEmail() {
    return email;
  }

  public List<String> getCandidateProfileIds() {
    return candidateProfileIds;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }
}
