package com.flamingo.ai.assessrec.exception;

/** Thrown when catalog or index data violates a structural invariant. */
public class InternalInconsistencyException extends RecommendationException {

  public InternalInconsistencyException(String message) {
    super(message, "An unexpected error occurred. Please try again later.");
  }
}
