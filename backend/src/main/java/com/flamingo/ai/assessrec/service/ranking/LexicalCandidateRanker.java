package com.flamingo.ai.assessrec.service.ranking;

import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Term-overlap ranking used when no query embedding is available. A record's score is the number of
 * distinct query terms found in its canonical text. Records sharing no term are still returned,
 * after every matching record.
 */
@Component
@Slf4j
public class LexicalCandidateRanker implements CandidateRanker {

  @Override
  public ScoreSource source() {
    return ScoreSource.LEXICAL;
  }

  @Override
  public List<RankedCandidate> rank(CatalogIndex index, String query, int limit) {
    Set<String> queryTerms = LexicalTokenizer.terms(query);

    List<RankedCandidate> scored = new ArrayList<>(index.size());
    for (int i = 0; i < index.size(); i++) {
      Set<String> recordTerms = index.termSets().get(i);
      int shared = 0;
      for (String term : queryTerms) {
        if (recordTerms.contains(term)) {
          shared++;
        }
      }
      scored.add(new RankedCandidate(index.records().get(i), shared, ScoreSource.LEXICAL));
    }
    scored.sort((a, b) -> Double.compare(b.score(), a.score()));

    int n = Math.max(0, Math.min(limit, scored.size()));
    log.debug(
        "Lexical ranking: {} query terms, best score {}",
        queryTerms.size(),
        scored.isEmpty() ? 0 : scored.get(0).score());
    return List.copyOf(scored.subList(0, n));
  }
}
