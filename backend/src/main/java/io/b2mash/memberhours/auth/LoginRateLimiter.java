package io.b2mash.memberhours.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.memberhours.config.MemberHoursConfig.AuthProperties;
import io.b2mash.memberhours.credential.EmailAddresses;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Counts failed credential checks per email. Once the limit is reached, logins for that email are
 * refused until the window, measured from the first failure, has passed.
 */
@Service
public class LoginRateLimiter {

  private final int maxFailures;
  private final Cache<String, AtomicInteger> failureCounters;

  @Autowired
  public LoginRateLimiter(AuthProperties authProperties) {
    this(
        authProperties.loginAttempts().maxFailures(),
        authProperties.loginAttempts().window(),
        Ticker.systemTicker());
  }

  LoginRateLimiter(int maxFailures, Duration window, Ticker ticker) {
    this.maxFailures = maxFailures;
    this.failureCounters =
        Caffeine.newBuilder().expireAfterWrite(window).maximumSize(10_000).ticker(ticker).build();
  }

  public boolean isBlocked(String email) {
    var counter = failureCounters.getIfPresent(key(email));
    return counter != null && counter.get() >= maxFailures;
  }

  public void recordFailure(String email) {
    failureCounters.get(key(email), k -> new AtomicInteger(0)).incrementAndGet();
  }

  public void recordSuccess(String email) {
    failureCounters.invalidate(key(email));
  }

  public int failureCount(String email) {
    var counter = failureCounters.getIfPresent(key(email));
    return counter != null ? counter.get() : 0;
  }

  private static String key(String email) {
    return EmailAddresses.normalize(email);
  }
}
