package io.b2mash.memberhours.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.memberhours.TestFixtures;
import io.b2mash.memberhours.TestcontainersConfiguration;
import io.b2mash.memberhours.auth.selection.SelectionTokenService;
import io.b2mash.memberhours.directory.ProfileDirectory;
import io.b2mash.memberhours.exception.DuplicateEntryForDateException;
import io.b2mash.memberhours.exception.InvalidSelectionTokenException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Races on the database-enforced invariants: one entry per member and day, single-use tokens. */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class LedgerConcurrencyIntegrationTest {

  private static final int THREADS = 4;

  @Autowired private WorkHourLedger ledger;
  @Autowired private WorkHourEntryRepository repository;
  @Autowired private SelectionTokenService selectionTokenService;
  @MockitoBean private ProfileDirectory profileDirectory;

  @Test
  void concurrentCreatesForSameDay_exactlyOneSucceeds() throws Exception {
    var session = TestFixtures.session("recRace");
    var today = LocalDate.now(TestFixtures.BERLIN);

    var outcomes =
        race(
            () -> {
              ledger.create(session, today, "Parallel", BigDecimal.ONE);
              return "created";
            });

    assertThat(outcomes).containsOnlyOnce("created");
    assertThat(outcomes).filteredOn(o -> !o.equals("created")).allMatch("duplicate"::equals);
    assertThat(
            repository.findByProfileIdAndEntryDateBetweenOrderByEntryDateAscIdAsc(
                "recRace", today, today))
        .hasSize(1);
  }

  @Test
  void concurrentSelectionRedemptions_exactlyOneSucceeds() throws Exception {
    String token = selectionTokenService.issue("race@example.org", List.of("recA", "recB"));

    var outcomes =
        race(
            () -> {
              selectionTokenService.redeem(token, "recA");
              return "redeemed";
            });

    assertThat(outcomes).containsOnlyOnce("redeemed");
    assertThat(outcomes).filteredOn(o -> !o.equals("redeemed")).allMatch("invalid"::equals);
  }

  private List<String> race(Callable<String> action) throws InterruptedException {
    var executor = Executors.newFixedThreadPool(THREADS);
    var start = new CountDownLatch(1);
    try {
      var futures = new ArrayList<Future<String>>();
      for (int i = 0; i < THREADS; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return action.call();
                }));
      }
      start.countDown();

      var outcomes = new ArrayList<String>();
      for (var future : futures) {
        outcomes.add(outcomeOf(future));
      }
      return outcomes;
    } finally {
      executor.shutdownNow();
    }
  }

  private static String outcomeOf(Future<String> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof DuplicateEntryForDateException) {
        return "duplicate";
      }
      if (e.getCause() instanceof InvalidSelectionTokenException) {
        return "invalid";
      }
      return "failed: " + e.getCause();
    }
  }
}
