package com.flamingo.ai.assessrec.service.diversity;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Category-aware selection of the final shortlist.
 *
 * <p>Keeps a single category from filling every slot when the candidate pool spans several
 * categories, while staying as close as possible to the similarity order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryDiversityBalancer {

  private final RecommenderConfig recommenderConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Selects up to {@code k} candidates from an over-fetched ranking.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Partition candidates by primary category, keeping each partition in ranking order
   *   <li>Repeatedly take the best remaining candidate of the category with the fewest picks so
   *       far, breaking ties by global rank
   *   <li>Stop after {@code k} picks or when candidates run out
   * </ol>
   *
   * <p>The first pick is always the global top candidate, and a single-category pool yields the
   * plain ranking order.
   *
   * @param ranked candidates, best first
   * @param k target size
   * @return at most {@code min(k, distinct candidates)} candidates
   */
  public List<RankedCandidate> balance(List<RankedCandidate> ranked, int k) {
    if (ranked == null || ranked.isEmpty() || k <= 0) {
      return List.of();
    }

    List<RankedCandidate> distinct = dedupe(ranked);

    if (!recommenderConfig.getDiversity().isEnabled()) {
      log.debug("Diversity balancing disabled, returning ranking order");
      return List.copyOf(distinct.subList(0, Math.min(k, distinct.size())));
    }

    Map<AssessmentCategory, Deque<Integer>> partitions = new LinkedHashMap<>();
    for (int rank = 0; rank < distinct.size(); rank++) {
      AssessmentCategory category = distinct.get(rank).record().primaryCategory();
      partitions.computeIfAbsent(category, c -> new ArrayDeque<>()).addLast(rank);
    }
    Map<AssessmentCategory, Integer> picks = new LinkedHashMap<>();
    partitions.keySet().forEach(category -> picks.put(category, 0));

    List<RankedCandidate> result = new ArrayList<>(Math.min(k, distinct.size()));
    while (result.size() < k && !partitions.isEmpty()) {
      AssessmentCategory chosen = null;
      for (Map.Entry<AssessmentCategory, Deque<Integer>> entry : partitions.entrySet()) {
        AssessmentCategory category = entry.getKey();
        if (chosen == null) {
          chosen = category;
          continue;
        }
        int cmp = Integer.compare(picks.get(category), picks.get(chosen));
        if (cmp < 0
            || (cmp == 0 && entry.getValue().peekFirst() < partitions.get(chosen).peekFirst())) {
          chosen = category;
        }
      }

      Deque<Integer> partition = partitions.get(chosen);
      result.add(distinct.get(partition.pollFirst()));
      picks.merge(chosen, 1, Integer::sum);
      if (partition.isEmpty()) {
        partitions.remove(chosen);
      }
    }

    double diversityScore = diversityScore(result);
    meterRegistry.summary("recommendation.diversity.score").record(diversityScore);
    log.debug(
        "Diversity balancing: {} candidates across {} categories -> {} picks, diversity {}",
        distinct.size(),
        picks.size(),
        result.size(),
        String.format("%.2f", diversityScore));

    return List.copyOf(result);
  }

  /**
   * Share of distinct primary categories in a result.
   *
   * @param candidates the result to evaluate
   * @return between 0.0 (empty) and 1.0 (one candidate per category)
   */
  public static double diversityScore(List<RankedCandidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return 0.0;
    }
    long categories =
        candidates.stream().map(c -> c.record().primaryCategory()).distinct().count();
    return (double) categories / candidates.size();
  }

  private static List<RankedCandidate> dedupe(List<RankedCandidate> ranked) {
    Set<String> seen = new HashSet<>();
    List<RankedCandidate> distinct = new ArrayList<>(ranked.size());
    for (RankedCandidate candidate : ranked) {
      if (seen.add(candidate.id())) {
        distinct.add(candidate);
      }
    }
    return distinct;
  }
}
