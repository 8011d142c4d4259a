package com.example.licensing.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(boolean success, String message, String error, String timestamp) {}
