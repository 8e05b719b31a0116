package com.flamingo.ai.assessrec.service.rerank;

import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Default strategy: keeps the balanced order. */
@Service
@ConditionalOnProperty(
    name = "recommender.reranking.strategy",
    havingValue = "none",
    matchIfMissing = true)
public class PassThroughReranker implements AssessmentReranker {

  @Override
  public String strategy() {
    return "none";
  }

  @Override
  public List<RankedCandidate> rerank(String query, List<RankedCandidate> candidates) {
    return candidates;
  }
}
