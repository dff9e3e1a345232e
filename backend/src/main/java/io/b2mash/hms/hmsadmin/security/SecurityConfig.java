package io.b2mash.hms.hmsadmin.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;

/**
 * Single stateless chain. Health and info probes are open, {@code /internal/**} requires the
 * API key, everything else is denied.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final RequestLoggingFilter requestLoggingFilter;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter, RequestLoggingFilter requestLoggingFilter) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.requestLoggingFilter = requestLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .hasAuthority(Roles.AUTHORITY_INTERNAL)
                    .anyRequest()
                    .denyAll())
        .addFilterAfter(requestLoggingFilter, SecurityContextHolderFilter.class)
        .addFilterBefore(apiKeyAuthFilter, AnonymousAuthenticationFilter.class);

    return http.build();
  }
}
