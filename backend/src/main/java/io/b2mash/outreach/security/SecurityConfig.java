package io.b2mash.outreach.security;

import io.b2mash.outreach.tenant.TenantLoggingFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final TenantLoggingFilter tenantLoggingFilter;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter, TenantLoggingFilter tenantLoggingFilter) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
  }

  /** Internal endpoints require the service API key; health probes are public. */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .hasRole("INTERNAL_SERVICE")
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(apiKeyAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(tenantLoggingFilter, ApiKeyAuthFilter.class);

    return http.build();
  }
}
