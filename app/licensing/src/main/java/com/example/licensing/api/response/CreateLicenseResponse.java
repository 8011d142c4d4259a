package com.example.licensing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateLicenseResponse(
    boolean success, String licenseKey, String expiresAt, int maxActivations) {}
