package com.flamingo.ai.assessrec.service.rerank;

import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import java.util.List;

/**
 * Advisory reordering of a shortlist by an external model. Implementations may only change the
 * order: the output must contain exactly the input candidates.
 */
public interface AssessmentReranker {

  /** Strategy name as configured under {@code recommender.reranking.strategy}. */
  String strategy();

  /**
   * Reorders candidates by fit to the query.
   *
   * @param query the validated query text
   * @param candidates balanced shortlist, best first
   * @return a permutation of {@code candidates}
   * @throws RerankUnavailableException on any error or malformed response
   */
  List<RankedCandidate> rerank(String query, List<RankedCandidate> candidates);
}
