package com.flamingo.ai.assessrec.exception;

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

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ApiError> handleInvalidQuery(
      InvalidQueryException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_query");
    String errorId = generateErrorId();
    log.warn("Invalid query [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, ApiError.INVALID_QUERY, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(IndexNotReadyException.class)
  public ResponseEntity<ApiError> handleIndexNotReady(
      IndexNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("index_not_ready");
    String errorId = generateErrorId();
    log.warn("Index not ready [{}]", errorId);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.INDEX_NOT_READY,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(CatalogEmptyException.class)
  public ResponseEntity<ApiError> handleCatalogEmpty(
      CatalogEmptyException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_empty");
    String errorId = generateErrorId();
    log.warn("Catalog empty [{}]", errorId);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.CATALOG_EMPTY,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(CatalogLoadException.class)
  public ResponseEntity<ApiError> handleCatalogLoad(
      CatalogLoadException ex, HttpServletRequest request) {

    incrementErrorCounter("catalog_load");
    String errorId = generateErrorId();
    log.error("Catalog load error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.CATALOG_LOAD_ERROR,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(InternalInconsistencyException.class)
  public ResponseEntity<ApiError> handleInconsistency(
      InternalInconsistencyException ex, HttpServletRequest request) {

    incrementErrorCounter("internal_inconsistency");
    String errorId = generateErrorId();
    log.error("Internal inconsistency [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        ex.getUserMessage(),
        errorId,
        request);
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

    return build(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        errorId,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        errorId,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String code,
      String message,
      String errorId,
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
