package com.example.licensing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "licensing.admin")
public record LicensingAdminProperties(String headerName, String token) {

  public LicensingAdminProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Admin-Key" : headerName;
    token = token == null ? "" : token;
  }
}
