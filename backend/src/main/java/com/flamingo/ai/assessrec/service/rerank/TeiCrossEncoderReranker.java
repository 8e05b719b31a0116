package com.flamingo.ai.assessrec.service.rerank;

import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import com.flamingo.ai.assessrec.service.catalog.CanonicalText;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Cross-encoder reranking through a TEI server. */
@Service
@ConditionalOnProperty(name = "recommender.reranking.strategy", havingValue = "tei")
@RequiredArgsConstructor
@Slf4j
public class TeiCrossEncoderReranker implements AssessmentReranker {

  private final TeiRerankerClient teiRerankerClient;
  private final MeterRegistry meterRegistry;

  @Override
  public String strategy() {
    return "tei";
  }

  @Override
  @Timed(value = "recommendation.rerank.tei", description = "Time for TEI cross-encoder reranking")
  @CircuitBreaker(name = "tei", fallbackMethod = "rerankFallback")
  @Retry(name = "tei")
  public List<RankedCandidate> rerank(String query, List<RankedCandidate> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    log.debug("TEI reranking {} candidates", candidates.size());
    List<String> texts = candidates.stream().map(c -> CanonicalText.of(c.record())).toList();
    List<TeiRerankerClient.RerankResult> results = teiRerankerClient.rerank(query, texts);

    if (results == null || results.size() != candidates.size()) {
      throw new RerankUnavailableException(
          "TEI returned "
              + (results == null ? 0 : results.size())
              + " results for "
              + candidates.size()
              + " candidates");
    }

    boolean[] seen = new boolean[candidates.size()];
    for (TeiRerankerClient.RerankResult result : results) {
      int index = result.index();
      if (index < 0 || index >= candidates.size() || seen[index]) {
        throw new RerankUnavailableException("TEI returned invalid or duplicate index " + index);
      }
      seen[index] = true;
    }

    List<TeiRerankerClient.RerankResult> ordered = new ArrayList<>(results);
    ordered.sort(
        Comparator.comparingDouble(TeiRerankerClient.RerankResult::score)
            .reversed()
            .thenComparingInt(TeiRerankerClient.RerankResult::index));

    meterRegistry.counter("recommendation.rerank.tei.invocations").increment();
    log.debug(
        "TEI reranking complete, top score: {}",
        String.format("%.3f", ordered.get(0).score()));

    return ordered.stream().map(r -> candidates.get(r.index())).toList();
  }

  /** Fallback when TEI is unavailable or its response is unusable. */
  @SuppressWarnings("unused")
  List<RankedCandidate> rerankFallback(
      String query, List<RankedCandidate> candidates, Throwable t) {
    log.warn("TEI reranker unavailable: {}", t.getMessage());
    meterRegistry.counter("recommendation.rerank.tei.fallback").increment();
    if (t instanceof RerankUnavailableException unavailable) {
      throw unavailable;
    }
    throw new RerankUnavailableException("TEI reranking failed", t);
  }
}
