package io.b2mash.memberhours.auth;

import io.b2mash.memberhours.auth.reset.ResetTokenRepository;
import io.b2mash.memberhours.auth.selection.SelectionTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Hourly removal of selection and reset tokens that expired more than a day ago. Expired tokens
 * are already unusable; this only keeps the tables small.
 */
@Component
public class ExpiredTokenCleanupJob {

  private static final Logger log = LoggerFactory.getLogger(ExpiredTokenCleanupJob.class);

  private final SelectionTokenRepository selectionTokenRepository;
  private final ResetTokenRepository resetTokenRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ExpiredTokenCleanupJob(
      SelectionTokenRepository selectionTokenRepository,
      ResetTokenRepository resetTokenRepository,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.selectionTokenRepository = selectionTokenRepository;
    this.resetTokenRepository = resetTokenRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(fixedRate = 3600000) // hourly
  public void cleanupExpiredTokens() {
    Instant cutoff = clock.instant().minus(1, ChronoUnit.DAYS);
    Integer selections =
        transactionTemplate.execute(status -> selectionTokenRepository.deleteExpiredBefore(cutoff));
    Integer resets =
        transactionTemplate.execute(status -> resetTokenRepository.deleteExpiredBefore(cutoff));

    int total = (selections != null ? selections : 0) + (resets != null ? resets : 0);
    if (total > 0) {
      log.info(
          "Cleaned up {} expired selection tokens and {} expired reset tokens", selections, resets);
    }
  }
}
