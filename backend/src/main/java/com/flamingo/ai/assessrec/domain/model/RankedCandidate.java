package com.flamingo.ai.assessrec.domain.model;

import com.flamingo.ai.assessrec.domain.enums.ScoreSource;

/**
 * A catalog record with the score one ranking strategy gave it for the current request. Scores from
 * different sources are not comparable.
 */
public record RankedCandidate(CatalogRecord record, double score, ScoreSource source) {

  public String id() {
    return record.id();
  }
}
