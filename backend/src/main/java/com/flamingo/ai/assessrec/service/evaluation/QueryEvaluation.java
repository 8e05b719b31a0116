package com.flamingo.ai.assessrec.service.evaluation;

import java.util.List;

/**
 * Evaluation outcome for one labelled query.
 *
 * @param query query text
 * @param retrieved identifiers returned by the engine, in order
 * @param recall recall@k for this query
 * @param diversity distinct primary categories divided by result size
 * @param error error message when the engine call failed, otherwise {@code null}
 */
public record QueryEvaluation(
    String query, List<String> retrieved, double recall, double diversity, String error) {

  public boolean failed() {
    return error != null;
  }
}
