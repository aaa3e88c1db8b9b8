package io.b2mash.memberhours.security;

import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  /** Endpoints reachable without a session. */
  static final Set<String> PUBLIC_ENDPOINTS =
      Set.of("/api/login", "/api/select-member", "/api/forgotPassword", "/api/resetPassword");

  private final SessionTokenService sessionTokenService;
  private final SessionAuthenticationEntryPoint entryPoint;
  private final Environment environment;

  public SecurityConfig(
      SessionTokenService sessionTokenService,
      SessionAuthenticationEntryPoint entryPoint,
      Environment environment) {
    this.sessionTokenService = sessionTokenService;
    this.entryPoint = entryPoint;
    this.environment = environment;
  }

  /**
   * Stateless chain for the member API. Session tokens are verified by {@link SessionAuthFilter};
   * the filters are created here rather than as beans so the servlet container does not register
   * them a second time.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health", "/error")
                    .permitAll()
                    .requestMatchers(PUBLIC_ENDPOINTS.toArray(String[]::new))
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(
            new SessionAuthFilter(sessionTokenService, entryPoint),
            UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(new SessionLoggingFilter(), SessionAuthFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
