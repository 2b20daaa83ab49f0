package com.tempo.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

import java.util.ArrayList;
import java.util.List;

/**
 * Security configuration for the Tempo API.
 *
 * Design principles:
 * - Stateless (bearer tokens only, no sessions)
 * - Fail-closed: everything not listed as public needs a valid token
 * - Owner checks live in the services, not here
 */
@Configuration
public class SecurityConfig {

  /**
   * Public endpoints (no token): login, register, error page and,
   * while tempo.security.open-schedule-delete is true, schedule deletion.
   */
  @Bean
  @Order(2)
  SecurityFilterChain publicApiChain(HttpSecurity http, TempoSecurityProperties props) throws Exception {
    List<String> open = new ArrayList<>(List.of("/login", "/register", "/error"));
    if (props.openScheduleDelete()) {
      open.add("/schedule/delete");
    }
    return http
        .securityMatcher(open.toArray(String[]::new))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .build();
  }

  /**
   * Everything else: bearer token validated and resolved to a user by
   * {@link BearerUserAuthenticationProvider}.
   */
  @Bean
  @Order(3)
  SecurityFilterChain securedApiChain(
      HttpSecurity http,
      BearerUserAuthenticationProvider bearerProvider,
      BearerAuthenticationEntryPoint entryPoint
  ) throws Exception {
    var manager = new ProviderManager(bearerProvider);
    return http
        .securityMatcher("/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .anyRequest().authenticated()
        )
        .exceptionHandling(ex -> ex.authenticationEntryPoint(entryPoint))
        .oauth2ResourceServer(oauth -> oauth
            .authenticationEntryPoint(entryPoint)
            .jwt(jwt -> jwt.authenticationManager(manager))
        )
        .build();
  }
}
