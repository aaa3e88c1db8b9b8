package io.b2mash.memberhours.config;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@EnableConfigurationProperties({
  MemberHoursConfig.AppProperties.class,
  MemberHoursConfig.AuthProperties.class,
  MemberHoursConfig.DirectoryProperties.class,
  MemberHoursConfig.HoursProperties.class
})
public class MemberHoursConfig {

  /** Club-wide settings: server time zone, collation locale and the frontend base URL. */
  @ConfigurationProperties("memberhours")
  public record AppProperties(
      @DefaultValue("Europe/Berlin") String zone,
      @DefaultValue("de-DE") String locale,
      @DefaultValue("http://localhost:5173") String frontendUrl) {

    public ZoneId zoneId() {
      return ZoneId.of(zone);
    }

    public Locale collationLocale() {
      return Locale.forLanguageTag(locale);
    }
  }

  @ConfigurationProperties("memberhours.auth")
  public record AuthProperties(
      String jwtSecret,
      @DefaultValue("24h") Duration sessionTtl,
      @DefaultValue("5m") Duration selectionTokenTtl,
      @DefaultValue("24h") Duration resetTokenTtl,
      @DefaultValue("8") int passwordMinLength,
      @DefaultValue LoginAttempts loginAttempts) {

    public record LoginAttempts(
        @DefaultValue("5") int maxFailures, @DefaultValue("15m") Duration window) {}
  }

  @ConfigurationProperties("memberhours.directory")
  public record DirectoryProperties(
      String baseUrl,
      String token,
      String membersTableId,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("10s") Duration readTimeout) {}

  /** Annual work-hour obligation and entry limits. */
  @ConfigurationProperties("memberhours.hours")
  public record HoursProperties(
      @DefaultValue("8.00") BigDecimal requiredPerYear,
      @DefaultValue("17") int minAge,
      @DefaultValue("70") int maxAge,
      @DefaultValue("500") int descriptionMaxLength) {}

  @Bean
  Clock clock(AppProperties appProperties) {
    return Clock.system(appProperties.zoneId());
  }

  @Bean
  PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }
}
