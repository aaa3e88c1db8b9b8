package io.b2mash.memberhours.auth.reset;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResetTokenRepository extends JpaRepository<ResetToken, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM ResetToken t WHERE t.tokenHash = :tokenHash")
  Optional<ResetToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

  @Modifying
  @Query(
      "UPDATE ResetToken t SET t.consumedAt = :now WHERE t.email = :email AND t.consumedAt IS NULL")
  int consumeOutstandingByEmail(@Param("email") String email, @Param("now") Instant now);

  @Modifying
  @Query("DELETE FROM ResetToken t WHERE t.expiresAt < :before")
  int deleteExpiredBefore(@Param("before") Instant before);
}
