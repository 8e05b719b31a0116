package com.flamingo.ai.assessrec.exception;

/** Thrown when a query is blank or longer than the configured limit. */
public class InvalidQueryException extends RecommendationException {

  public InvalidQueryException(String message) {
    super(message, message);
  }
}
