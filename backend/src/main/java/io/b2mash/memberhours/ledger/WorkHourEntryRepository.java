package io.b2mash.memberhours.ledger;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkHourEntryRepository extends JpaRepository<WorkHourEntry, UUID> {

  List<WorkHourEntry> findByProfileIdAndEntryDateBetweenOrderByEntryDateAscIdAsc(
      String profileId, LocalDate from, LocalDate to);

  @Query(
      """
      SELECT e FROM WorkHourEntry e
      WHERE e.profileId IN :profileIds
        AND e.entryDate BETWEEN :from AND :to
      ORDER BY e.entryDate ASC, e.id ASC
      """)
  List<WorkHourEntry> findForProfilesBetween(
      @Param("profileIds") Collection<String> profileIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  boolean existsByProfileIdAndEntryDate(String profileId, LocalDate entryDate);

  boolean existsByProfileIdAndEntryDateAndIdNot(String profileId, LocalDate entryDate, UUID id);
}
