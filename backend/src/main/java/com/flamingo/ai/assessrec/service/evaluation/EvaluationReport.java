package com.flamingo.ai.assessrec.service.evaluation;

import java.util.List;

/**
 * Aggregate recall and diversity over a labelled query set.
 *
 * @param k cut-off used for recall
 * @param queries per-query outcomes in input order
 */
public record EvaluationReport(int k, List<QueryEvaluation> queries) {

  public EvaluationReport {
    queries = List.copyOf(queries);
  }

  /**
   * Mean recall@k across all queries.
   *
   * @return average recall (0.0-1.0), 0.0 for an empty set
   */
  public double meanRecall() {
    return queries.stream().mapToDouble(QueryEvaluation::recall).average().orElse(0.0);
  }

  /**
   * Mean category diversity across all queries.
   *
   * @return average diversity (0.0-1.0), 0.0 for an empty set
   */
  public double meanDiversity() {
    return queries.stream().mapToDouble(QueryEvaluation::diversity).average().orElse(0.0);
  }

  public long failedQueries() {
    return queries.stream().filter(QueryEvaluation::failed).count();
  }

  /**
   * Returns a formatted summary of all metrics.
   *
   * @return multi-line string with metric summary
   */
  public String getSummary() {
    return String.format(
        """
            Recommendation Evaluation (n=%d queries, %d failed):
            ====================================================
            Mean Recall@%d:        %.3f
            Mean Diversity:        %.3f
            """,
        queries.size(),
        failedQueries(),
        k,
        meanRecall(),
        meanDiversity());
  }
}
