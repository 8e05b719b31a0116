package com.flamingo.ai.assessrec.exception;

/** Thrown when a recommendation is requested before the catalog index has been built. */
public class IndexNotReadyException extends RecommendationException {

  public IndexNotReadyException() {
    super(
        "Catalog index has not been built yet",
        "The recommendation service is starting up. Please try again shortly.");
  }
}
