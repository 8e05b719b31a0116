package com.flamingo.ai.assessrec.service.evaluation;

import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.exception.RecommendationException;
import com.flamingo.ai.assessrec.service.recommendation.RecommendationEngine;
import com.flamingo.ai.assessrec.service.recommendation.RecommendationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Offline recall@k evaluation of the recommendation engine against labelled queries. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallEvaluator {

  private final RecommendationEngine recommendationEngine;

  /**
   * Fraction of relevant identifiers found among the first {@code k} retrieved ones.
   *
   * @param retrieved identifiers in ranked order; duplicates count once
   * @param relevant relevant identifiers; duplicates count once
   * @param k cut-off
   * @return recall in [0, 1]; 0.0 when {@code relevant} is empty
   */
  public static double recallAtK(List<String> retrieved, List<String> relevant, int k) {
    if (relevant == null || relevant.isEmpty()) {
      return 0.0;
    }
    Set<String> relevantSet = new HashSet<>(relevant);
    Set<String> topK = new LinkedHashSet<>(retrieved.subList(0, Math.min(k, retrieved.size())));

    long hits = topK.stream().filter(relevantSet::contains).count();
    return (double) hits / relevantSet.size();
  }

  /**
   * Runs every labelled query through the engine and scores the results.
   *
   * <p>A query the engine rejects or cannot serve scores 0.0 and is reported as failed.
   *
   * @param labeledQueries labelled set
   * @param k result size requested from the engine and recall cut-off
   * @return the evaluation report
   */
  public EvaluationReport evaluate(List<LabeledQuery> labeledQueries, int k) {
    List<QueryEvaluation> evaluations = new ArrayList<>(labeledQueries.size());

    for (LabeledQuery labeled : labeledQueries) {
      try {
        RecommendationResult result = recommendationEngine.recommend(labeled.query(), k);
        List<String> retrieved = identifiers(result.recommendations(), labeled.relevant());
        double recall = recallAtK(retrieved, labeled.relevant(), k);
        double diversity = diversity(result.recommendations());
        evaluations.add(new QueryEvaluation(labeled.query(), retrieved, recall, diversity, null));
        log.debug("Recall@{} {} for query: {}", k, String.format("%.3f", recall), labeled.query());
      } catch (RecommendationException e) {
        log.warn("Evaluation query failed: {} ({})", labeled.query(), e.getMessage());
        evaluations.add(new QueryEvaluation(labeled.query(), List.of(), 0.0, 0.0, e.getMessage()));
      }
    }

    EvaluationReport report = new EvaluationReport(k, evaluations);
    log.info("\n{}", report.getSummary());
    return report;
  }

  /** Uses the url where the labels reference urls, the id otherwise. */
  private static List<String> identifiers(List<CatalogRecord> records, List<String> relevant) {
    Set<String> labels = new HashSet<>(relevant);
    return records.stream().map(r -> labels.contains(r.url()) ? r.url() : r.id()).toList();
  }

  private static double diversity(List<CatalogRecord> records) {
    if (records.isEmpty()) {
      return 0.0;
    }
    long categories = records.stream().map(CatalogRecord::primaryCategory).distinct().count();
    return (double) categories / records.size();
  }
}
