package com.example.licensing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(LicensingAdminProperties.class)
public class LicensingSecurityConfig {

  // Filter を Bean にするとサーブレットコンテナにも二重登録されるため、チェーン内でのみ生成する
  @Bean
  SecurityFilterChain securityFilterChain(HttpSecurity http, LicensingAdminProperties properties)
      throws Exception {
    final AdminApiAuthenticationFilter adminApiAuthenticationFilter =
        new AdminApiAuthenticationFilter(properties);
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(adminApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/health",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/validate", "/check")
                    .permitAll()
                    .requestMatchers("/admin/**", "/actuator/metrics", "/actuator/metrics/**")
                    .hasRole("ADMIN")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
