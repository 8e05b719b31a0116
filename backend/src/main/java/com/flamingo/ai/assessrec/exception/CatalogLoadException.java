package com.flamingo.ai.assessrec.exception;

/** Thrown when the catalog source cannot be read or parsed. */
public class CatalogLoadException extends RecommendationException {

  public CatalogLoadException(String message, Throwable cause) {
    super(message, "The assessment catalog could not be loaded.", cause);
  }
}
