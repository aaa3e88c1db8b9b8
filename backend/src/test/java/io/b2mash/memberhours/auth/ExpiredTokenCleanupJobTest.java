package io.b2mash.memberhours.auth;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.memberhours.auth.reset.ResetTokenRepository;
import io.b2mash.memberhours.auth.selection.SelectionTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class ExpiredTokenCleanupJobTest {

  private static final Instant NOW = Instant.parse("2025-03-15T10:00:00Z");

  @Mock private SelectionTokenRepository selectionTokenRepository;
  @Mock private ResetTokenRepository resetTokenRepository;
  @Mock private TransactionTemplate transactionTemplate;

  @Test
  void cleanup_deletesTokensExpiredMoreThanADayAgo() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
    var cutoff = Instant.parse("2025-03-14T10:00:00Z");
    when(selectionTokenRepository.deleteExpiredBefore(cutoff)).thenReturn(3);
    when(resetTokenRepository.deleteExpiredBefore(cutoff)).thenReturn(1);
    var job =
        new ExpiredTokenCleanupJob(
            selectionTokenRepository,
            resetTokenRepository,
            transactionTemplate,
            Clock.fixed(NOW, ZoneOffset.UTC));

    job.cleanupExpiredTokens();

    verify(selectionTokenRepository).deleteExpiredBefore(cutoff);
    verify(resetTokenRepository).deleteExpiredBefore(cutoff);
  }
}
