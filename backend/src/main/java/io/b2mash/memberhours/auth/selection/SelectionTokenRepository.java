package io.b2mash.memberhours.auth.selection;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SelectionTokenRepository extends JpaRepository<SelectionToken, UUID> {

  Optional<SelectionToken> findByTokenHash(String tokenHash);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM SelectionToken t WHERE t.tokenHash = :tokenHash")
  Optional<SelectionToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

  @Modifying
  @Query("DELETE FROM SelectionToken t WHERE t.expiresAt < :before")
  int deleteExpiredBefore(@Param("before") Instant before);
}
