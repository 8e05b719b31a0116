package com.flamingo.ai.assessrec.exception;

/** Thrown when a reranker fails, times out, or returns a malformed ordering. */
public class RerankUnavailableException extends RecommendationException {

  private static final String USER_MESSAGE = "Reranking is temporarily unavailable.";

  public RerankUnavailableException(String message) {
    super(message, USER_MESSAGE);
  }

  public RerankUnavailableException(String message, Throwable cause) {
    super(message, USER_MESSAGE, cause);
  }
}
