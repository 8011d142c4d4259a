package com.example.licensing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Positive;

/** 省略されたフィールドは licensing.* の既定値で補う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateLicenseRequest(
    @Positive(message = "max_activations must be positive") Integer maxActivations,
    @Positive(message = "days_valid must be positive") Integer daysValid) {}
