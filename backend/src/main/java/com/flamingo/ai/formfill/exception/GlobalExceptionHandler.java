package com.flamingo.ai.formfill.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps run-fatal errors to API responses. Field-level errors never reach this handler because the
 * executor folds them into the run report.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidProfileException.class)
  public ResponseEntity<ApiError> handleInvalidProfile(
      InvalidProfileException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_profile");
    String errorId = generateErrorId();
    log.warn("Invalid profile [{}]: attribute={}", errorId, ex.getAttribute());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_PROFILE, ex.getUserMessage(), request);
  }

  @ExceptionHandler(StaleDocumentException.class)
  public ResponseEntity<ApiError> handleStaleDocument(
      StaleDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("stale_document");
    String errorId = generateErrorId();
    log.warn("Stale document [{}]: page={}, {}", errorId, ex.getPageId(), ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.STALE_DOCUMENT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(PageBusyException.class)
  public ResponseEntity<ApiError> handlePageBusy(PageBusyException ex, HttpServletRequest request) {

    incrementErrorCounter("page_busy");
    String errorId = generateErrorId();
    log.warn("Page busy [{}]: {}", errorId, ex.getPageId());

    return build(HttpStatus.CONFLICT, errorId, ApiError.PAGE_BUSY, ex.getUserMessage(), request);
  }

  @ExceptionHandler(FormSourceException.class)
  public ResponseEntity<ApiError> handleFormSource(
      FormSourceException ex, HttpServletRequest request) {

    incrementErrorCounter("form_source");
    String errorId = generateErrorId();
    log.error("Form source error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.FORM_SOURCE_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(UnknownAttributeException.class)
  public ResponseEntity<ApiError> handleUnknownAttribute(
      UnknownAttributeException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unknown attribute key [{}]: {}", errorId, ex.getAttribute());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
