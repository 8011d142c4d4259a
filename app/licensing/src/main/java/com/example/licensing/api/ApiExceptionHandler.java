package com.example.licensing.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  static final String OUTCOME_BAD_REQUEST = "BAD_REQUEST";
  static final String OUTCOME_TRANSIENT = "TRANSIENT";
  static final String OUTCOME_NOT_FOUND = "NOT_FOUND";
  static final String OUTCOME_INTERNAL_ERROR = "INTERNAL_ERROR";

  @ExceptionHandler(InvalidLicenseRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidLicenseRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(OUTCOME_BAD_REQUEST, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final FieldError fieldError = ex.getBindingResult().getFieldError();
    final String message =
        fieldError == null || fieldError.getDefaultMessage() == null
            ? "request validation failed"
            : fieldError.getDefaultMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(OUTCOME_BAD_REQUEST, message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(OUTCOME_BAD_REQUEST, "request body is missing or malformed"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(OUTCOME_BAD_REQUEST, ex.getHeaderName() + " header is required"));
  }

  @ExceptionHandler(LicenseNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(LicenseNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiErrorResponse.of(OUTCOME_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(LicenseStoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(
      LicenseStoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiErrorResponse.of(OUTCOME_TRANSIENT, "Server error, please retry"));
  }

  // 内部情報をクライアントへ出さないため、詳細はログにのみ残す
  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected error while handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of(OUTCOME_INTERNAL_ERROR, "Server error"));
  }
}
