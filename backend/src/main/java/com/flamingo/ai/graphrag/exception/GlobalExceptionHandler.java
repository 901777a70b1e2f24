package com.flamingo.ai.graphrag.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ApiError> handleInvalidInput(
      InvalidInputException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_input");
    String errorId = generateErrorId();
    log.warn("Invalid retrieval input [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
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

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMostSpecificCause().getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request: " + ex.getMostSpecificCause().getMessage(),
        request);
  }

  @ExceptionHandler(GraphStoreUnavailableException.class)
  public ResponseEntity<ApiError> handleGraphUnavailable(
      GraphStoreUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("graph_unavailable");
    String errorId = generateErrorId();
    log.error("Graph store unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.GRAPH_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(GraphQueryFailedException.class)
  public ResponseEntity<ApiError> handleGraphQueryFailed(
      GraphQueryFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("graph_query_failed");
    String errorId = generateErrorId();
    log.error("Graph query failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.GRAPH_QUERY_FAILED, ex.getUserMessage(), request);
  }

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<ApiError> handleProviderUnavailable(
      ProviderUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("provider_unavailable");
    String errorId = generateErrorId();
    log.error(
        "Model provider unavailable [{}] ({}): {}", errorId, ex.getProvider(), ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PROVIDER_UNAVAILABLE,
        "Model provider '" + ex.getProvider() + "' is temporarily unavailable.",
        request);
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
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
