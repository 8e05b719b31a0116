package com.flamingo.ai.assessrec.service.rerank;

import com.flamingo.ai.assessrec.agent.AssessmentRerankerAgent;
import com.flamingo.ai.assessrec.agent.dto.RerankingScores;
import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Prompt-based reranking through a chat model. All candidates are scored in one call; the output
 * order is a stable sort by the returned scores.
 */
@Service
@ConditionalOnProperty(name = "recommender.reranking.strategy", havingValue = "llm")
@RequiredArgsConstructor
@Slf4j
public class LlmPromptReranker implements AssessmentReranker {

  private final AssessmentRerankerAgent agent;
  private final RecommenderConfig recommenderConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public String strategy() {
    return "llm";
  }

  @Override
  @Timed(value = "recommendation.rerank.llm", description = "Time for LLM reranking")
  public List<RankedCandidate> rerank(String query, List<RankedCandidate> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    log.debug("Reranking {} candidates with LLM", candidates.size());
    meterRegistry.counter("recommendation.rerank.llm.invocations").increment();

    RerankingScores result;
    try {
      result = agent.scoreAssessments(query, buildAssessmentsString(candidates));
    } catch (RuntimeException e) {
      throw new RerankUnavailableException("LLM reranking call failed", e);
    }

    if (result == null || result.scores() == null) {
      throw new RerankUnavailableException("LLM reranker returned no scores");
    }
    List<Double> scores = result.scores();
    if (scores.size() != candidates.size()) {
      throw new RerankUnavailableException(
          "LLM reranker returned "
              + scores.size()
              + " scores for "
              + candidates.size()
              + " candidates");
    }

    List<Integer> order = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      if (scores.get(i) == null || scores.get(i).isNaN()) {
        throw new RerankUnavailableException("LLM reranker returned a non-numeric score at " + i);
      }
      order.add(i);
    }
    order.sort((a, b) -> Double.compare(clamp(scores.get(b)), clamp(scores.get(a))));

    log.debug(
        "LLM reranking complete, top score: {}",
        String.format("%.3f", clamp(scores.get(order.get(0)))));
    return order.stream().map(candidates::get).toList();
  }

  private String buildAssessmentsString(List<RankedCandidate> candidates) {
    int maxChars = recommenderConfig.getReranking().getLlm().getMaxPassageChars();
    StringBuilder sb = new StringBuilder();

    for (int i = 0; i < candidates.size(); i++) {
      CatalogRecord record = candidates.get(i).record();
      String description = record.description();
      if (description.length() > maxChars) {
        description = description.substring(0, maxChars) + "...";
      }
      String categories =
          record.categories().stream()
              .map(AssessmentCategory::getDisplayName)
              .collect(Collectors.joining(", "));

      sb.append("[")
          .append(i)
          .append("] ")
          .append(record.name())
          .append(" (")
          .append(categories)
          .append("): ")
          .append(description)
          .append("\n\n");
    }

    return sb.toString();
  }

  private static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}
