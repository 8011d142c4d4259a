package com.example.licensing.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class AdminApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(AdminApiAuthenticationFilter.class);
  private static final String ADMIN_ROLE = "ROLE_ADMIN";
  private static final String ADMIN_PATH_PREFIX = "/admin/";

  private final LicensingAdminProperties properties;

  public AdminApiAuthenticationFilter(LicensingAdminProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(ADMIN_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidAdminToken(request.getHeader(properties.headerName()))) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              "licensing-admin", "N/A", List.of(new SimpleGrantedAuthority(ADMIN_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(authentication);
      logger.debug("admin authentication established for path={}", request.getRequestURI());
    } else {
      // トークン値そのものはログへ出さない
      logger.debug("admin authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isValidAdminToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
