package com.flamingo.ai.resumescreening.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {
    String errorId = record("document_not_found");
    log.warn("Document not found [{}]: {}", errorId, ex.getSource());
    return respond(
        HttpStatus.NOT_FOUND, ApiError.DOCUMENT_NOT_FOUND, errorId, ex.getUserMessage(), request);
  }

  @ExceptionHandler(UnreadableDocumentException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      UnreadableDocumentException ex, HttpServletRequest request) {
    String errorId = record("document_unreadable");
    log.warn("Unreadable document [{}] {}: {}", errorId, ex.getSource(), ex.getMessage());
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiError.DOCUMENT_UNREADABLE,
        errorId,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmptyDocumentException.class)
  public ResponseEntity<ApiError> handleEmptyDocument(
      EmptyDocumentException ex, HttpServletRequest request) {
    String errorId = record("document_empty");
    log.warn("Empty document [{}]: {}", errorId, ex.getSource());
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiError.DOCUMENT_EMPTY,
        errorId,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler({ArityMismatchException.class, EmptyBatchException.class})
  public ResponseEntity<ApiError> handleEmbeddingFailure(
      IngestionException ex, HttpServletRequest request) {
    String errorId = record("embedding_failed");
    log.error("Embedding failed [{}] for {}: {}", errorId, ex.getSource(), ex.getMessage());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.EMBEDDING_FAILED,
        errorId,
        "Embedding service is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(IngestionException.class)
  public ResponseEntity<ApiError> handleIngestion(
      IngestionException ex, HttpServletRequest request) {
    String errorId = record("ingestion_error");
    log.error("Ingestion error [{}] for {}: {}", errorId, ex.getSource(), ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiError.DOCUMENT_INGESTION_ERROR,
        errorId,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmptyCorpusException.class)
  public ResponseEntity<ApiError> handleEmptyCorpus(
      EmptyCorpusException ex, HttpServletRequest request) {
    String errorId = record("empty_corpus");
    log.info("Ranking requested on an empty corpus [{}]", errorId);
    return respond(HttpStatus.NOT_FOUND, ApiError.EMPTY_CORPUS, errorId, ex.getMessage(), request);
  }

  @ExceptionHandler(NoMatchingChunksException.class)
  public ResponseEntity<ApiError> handleNoMatchingChunks(
      NoMatchingChunksException ex, HttpServletRequest request) {
    String errorId = record("no_matching_chunks");
    log.info("Analysis found no matching chunks [{}]", errorId);
    return respond(
        HttpStatus.NOT_FOUND, ApiError.NO_MATCHING_CHUNKS, errorId, ex.getMessage(), request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    String errorId = record("search_error");
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.SEARCH_FAILED,
        errorId,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {
    String errorId = record("circuit_open");
    log.warn("Circuit breaker open [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.SEARCH_UNAVAILABLE,
        errorId,
        SearchException.USER_MESSAGE,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, errorId, message, request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, errorId, ex.getMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    String errorId = record("upload_too_large");
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        ApiError.UPLOAD_TOO_LARGE,
        errorId,
        "Maximum file size is 50MB",
        request);
  }

  @ExceptionHandler(ScreeningConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ScreeningConfigurationException ex, HttpServletRequest request) {
    String errorId = record("configuration_error");
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.CONFIGURATION_ERROR,
        errorId,
        "The service is misconfigured. Please contact the administrator.",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        errorId,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String code,
      String errorId,
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

  /** Counts the error and returns a fresh error id. */
  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
