package com.flamingo.ai.assessrec.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_QUERY = "QUERY_001";
  public static final String INDEX_NOT_READY = "INDEX_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String CATALOG_EMPTY = "CATALOG_001";
  public static final String CATALOG_LOAD_ERROR = "CATALOG_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
