package io.forgecascade.governance.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final GovernanceJwtAuthenticationConverter jwtAuthConverter;
  private final AuthenticationFailureEntryPoint authFailureEntryPoint;

  public SecurityConfig(
      GovernanceJwtAuthenticationConverter jwtAuthConverter,
      AuthenticationFailureEntryPoint authFailureEntryPoint) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.authFailureEntryPoint = authFailureEntryPoint;
  }

  /**
   * Single stateless chain: public actuator, JWT-authenticated {@code /api/**} and {@code
   * /internal/**}. Role checks live on the controllers via {@code @PreAuthorize}.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/**")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .authenticated()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(authFailureEntryPoint));

    return http.build();
  }
}
