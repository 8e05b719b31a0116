package com.flamingo.ai.assessrec.exception;

/** Base type for every typed failure raised by the recommendation pipeline. */
public abstract class RecommendationException extends RuntimeException {

  private final String userMessage;

  protected RecommendationException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected RecommendationException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
