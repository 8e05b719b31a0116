package com.flamingo.ai.assessrec.service.ranking;

import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import java.util.List;

/** One scoring strategy over a catalog snapshot. */
public interface CandidateRanker {

  ScoreSource source();

  /**
   * Ranks the snapshot's records against the query.
   *
   * @param index snapshot to rank
   * @param query validated query text
   * @param limit maximum number of candidates to return
   * @return at most {@code limit} candidates, best first, ties in catalog order
   */
  List<RankedCandidate> rank(CatalogIndex index, String query, int limit);
}
