package com.flamingo.ai.assessrec.exception;

/** Thrown at the API boundary when the loaded catalog holds no assessments. */
public class CatalogEmptyException extends RecommendationException {

  public CatalogEmptyException() {
    super("Catalog is empty", "No assessments are currently available.");
  }
}
