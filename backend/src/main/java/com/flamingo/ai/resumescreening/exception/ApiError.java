package com.flamingo.ai.resumescreening.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_UNREADABLE = "DOCUMENT_002";
  public static final String DOCUMENT_INGESTION_ERROR = "DOCUMENT_003";
  public static final String DOCUMENT_EMPTY = "DOCUMENT_004";
  public static final String EMBEDDING_FAILED = "EMBEDDING_001";
  public static final String EMPTY_CORPUS = "RETRIEVAL_001";
  public static final String NO_MATCHING_CHUNKS = "RETRIEVAL_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String SEARCH_UNAVAILABLE = "SEARCH_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String UPLOAD_TOO_LARGE = "VALIDATION_002";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
