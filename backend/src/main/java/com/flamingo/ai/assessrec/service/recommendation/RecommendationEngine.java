package com.flamingo.ai.assessrec.service.recommendation;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.ConfidenceLevel;
import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.exception.IndexNotReadyException;
import com.flamingo.ai.assessrec.exception.InternalInconsistencyException;
import com.flamingo.ai.assessrec.exception.InvalidQueryException;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import com.flamingo.ai.assessrec.service.diversity.CategoryDiversityBalancer;
import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import com.flamingo.ai.assessrec.service.index.CatalogIndexHolder;
import com.flamingo.ai.assessrec.service.ranking.CandidateRanker;
import com.flamingo.ai.assessrec.service.recommendation.BoundedCallExecutor.Lane;
import com.flamingo.ai.assessrec.service.rerank.AssessmentReranker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a free-text hiring need into an ordered shortlist of catalog assessments.
 *
 * <p>Pipeline: validate, rank by vector similarity (lexical overlap when no embedding is
 * available), balance categories, rerank best-effort, truncate to k. Embedding and reranking
 * failures degrade the result but never fail the request.
 */
@Service
@Slf4j
public class RecommendationEngine {

  private final QueryValidator queryValidator;
  private final CatalogIndexHolder catalogIndexHolder;
  private final List<CandidateRanker> candidateRankers;
  private final CategoryDiversityBalancer categoryDiversityBalancer;
  private final AssessmentReranker assessmentReranker;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RecommenderConfig recommenderConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Creates the engine.
   *
   * @param candidateRankers scoring strategies, tried in {@link ScoreSource} order until one can
   *     rank the snapshot
   */
  public RecommendationEngine(
      QueryValidator queryValidator,
      CatalogIndexHolder catalogIndexHolder,
      List<CandidateRanker> candidateRankers,
      CategoryDiversityBalancer categoryDiversityBalancer,
      AssessmentReranker assessmentReranker,
      BoundedCallExecutor boundedCallExecutor,
      RecommenderConfig recommenderConfig,
      MeterRegistry meterRegistry) {
    this.queryValidator = queryValidator;
    this.catalogIndexHolder = catalogIndexHolder;
    this.candidateRankers =
        candidateRankers.stream().sorted(Comparator.comparing(CandidateRanker::source)).toList();
    this.categoryDiversityBalancer = categoryDiversityBalancer;
    this.assessmentReranker = assessmentReranker;
    this.boundedCallExecutor = boundedCallExecutor;
    this.recommenderConfig = recommenderConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Recommends up to {@code k} assessments for a query.
   *
   * @param query free-text query
   * @param k requested result size, {@code null} for the default; clamped to {@code [1, maxK]}
   * @return between 1 and k distinct records, or an empty result for an empty catalog
   * @throws InvalidQueryException for a blank or rejected query
   * @throws IndexNotReadyException before the catalog index is first built
   */
  @Timed(value = "recommendation.recommend", description = "Time to produce a recommendation")
  public RecommendationResult recommend(String query, Integer k) {
    String validQuery = queryValidator.validate(query);
    int size = queryValidator.clampK(k);
    CatalogIndex index = catalogIndexHolder.current();

    if (index.isEmpty()) {
      log.warn("Catalog is empty, returning no recommendations");
      return RecommendationResult.empty();
    }

    int multiplier = Math.max(1, recommenderConfig.getRetrieval().getOverFetchMultiplier());
    int overFetch = Math.min(index.size(), size * multiplier);
    List<RankedCandidate> ranked = retrieve(index, validQuery, overFetch);
    ScoreSource source = ranked.get(0).source();

    List<RankedCandidate> balanced = categoryDiversityBalancer.balance(ranked, size);

    Optional<List<RankedCandidate>> reranked = rerank(validQuery, balanced);
    List<RankedCandidate> finalOrder = reranked.orElse(balanced);

    List<CatalogRecord> records =
        finalOrder.stream().limit(size).map(RankedCandidate::record).toList();
    ConfidenceLevel confidence = confidence(source, ranked.get(0).score());

    meterRegistry
        .counter("recommendation.requests", "source", source.name().toLowerCase(Locale.ROOT))
        .increment();
    log.debug(
        "Recommended {} of {} requested ({} candidates, source={}, confidence={}, reranked={})",
        records.size(),
        size,
        ranked.size(),
        source,
        confidence,
        reranked.isPresent());

    return new RecommendationResult(records, source, confidence, reranked.isPresent());
  }

  /** Ranks with the first strategy that can; an embedding failure moves on to the next one. */
  private List<RankedCandidate> retrieve(CatalogIndex index, String query, int overFetch) {
    EmbeddingUnavailableException lastFailure = null;
    for (CandidateRanker ranker : candidateRankers) {
      try {
        return ranker.rank(index, query, overFetch);
      } catch (EmbeddingUnavailableException e) {
        log.warn("{} ranking unavailable, falling back: {}", ranker.source(), e.getMessage());
        meterRegistry.counter("recommendation.fallback", "stage", "embedding").increment();
        lastFailure = e;
      }
    }
    if (lastFailure != null) {
      throw lastFailure;
    }
    throw new InternalInconsistencyException("No candidate ranker is configured");
  }

  /** Returns the reranked order, or empty when reranking is off or its output is unusable. */
  private Optional<List<RankedCandidate>> rerank(String query, List<RankedCandidate> balanced) {
    if ("none".equals(assessmentReranker.strategy()) || balanced.size() < 2) {
      return Optional.empty();
    }

    try {
      List<RankedCandidate> reordered =
          boundedCallExecutor.call(
              Lane.RERANK,
              "Reranking",
              recommenderConfig.getReranking().getTimeoutMs(),
              () -> assessmentReranker.rerank(query, balanced),
              RecommendationEngine::toRerankUnavailable);
      if (!isPermutation(balanced, reordered)) {
        throw new RerankUnavailableException("Reranker output is not a permutation of its input");
      }
      return Optional.of(reordered);
    } catch (RerankUnavailableException e) {
      log.warn(
          "Reranking ({}) failed, keeping balanced order: {}",
          assessmentReranker.strategy(),
          e.getMessage());
      meterRegistry.counter("recommendation.fallback", "stage", "rerank").increment();
      return Optional.empty();
    }
  }

  static boolean isPermutation(List<RankedCandidate> input, List<RankedCandidate> output) {
    if (output == null || output.size() != input.size()) {
      return false;
    }
    Map<String, Integer> counts = new HashMap<>();
    for (RankedCandidate candidate : input) {
      counts.merge(candidate.id(), 1, Integer::sum);
    }
    for (RankedCandidate candidate : output) {
      if (candidate == null) {
        return false;
      }
      Integer remaining = counts.get(candidate.id());
      if (remaining == null || remaining == 0) {
        return false;
      }
      counts.put(candidate.id(), remaining - 1);
    }
    return true;
  }

  private ConfidenceLevel confidence(ScoreSource source, double topScore) {
    if (source == ScoreSource.LEXICAL) {
      return ConfidenceLevel.LOW;
    }
    RecommenderConfig.Confidence thresholds = recommenderConfig.getConfidence();
    if (topScore >= thresholds.getHigh()) {
      return ConfidenceLevel.HIGH;
    }
    if (topScore >= thresholds.getMedium()) {
      return ConfidenceLevel.MEDIUM;
    }
    return ConfidenceLevel.LOW;
  }

  private static RuntimeException toRerankUnavailable(Throwable cause) {
    if (cause instanceof RerankUnavailableException unavailable) {
      return unavailable;
    }
    return new RerankUnavailableException("Reranking failed: " + cause, cause);
  }
}
