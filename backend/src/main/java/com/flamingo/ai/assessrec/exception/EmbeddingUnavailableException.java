package com.flamingo.ai.assessrec.exception;

/**
 * Thrown when the embedding model cannot produce a usable vector: remote failure, timeout, empty
 * response, or a vector of the wrong dimension.
 */
public class EmbeddingUnavailableException extends RecommendationException {

  private static final String USER_MESSAGE =
      "Semantic search is temporarily unavailable. Please try again.";

  public EmbeddingUnavailableException(String message) {
    super(message, USER_MESSAGE);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, USER_MESSAGE, cause);
  }
}
