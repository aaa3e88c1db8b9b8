package io.b2mash.memberhours.auth.reset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Single-use password reset token, stored as a SHA-256 hash and bound to one login email. */
@Entity
@Table(name = "reset_tokens")
public class ResetToken {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "token_hash", nullable = false, unique = true, length = 64)
  private String tokenHash;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "issued_at", nullable = false, updatable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  protected ResetToken() {}

  public ResetToken(String tokenHash, String email, Instant issuedAt, Instant expiresAt) {
    this.tokenHash = tokenHash;
    this.email = email;
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

  public UUID getId() {
    return id;
  }

  public String getTokenHash() {
    return tokenHash;
  }

  public String getEmail() {
    return email;
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
