package com.flamingo.ai.assessrec.service.evaluation;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Runs the offline evaluation once at startup when the {@code evaluate} profile is active. */
@Component
@Profile("evaluate")
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class EvaluationCommand implements ApplicationRunner {

  private final LabeledQuerySetLoader labeledQuerySetLoader;
  private final RecallEvaluator recallEvaluator;
  private final RecommenderConfig recommenderConfig;

  @Override
  public void run(ApplicationArguments args) {
    RecommenderConfig.Evaluation evaluation = recommenderConfig.getEvaluation();
    EvaluationReport report =
        recallEvaluator.evaluate(
            labeledQuerySetLoader.load(evaluation.getLabeledSet()), evaluation.getK());
    report.queries().stream()
        .filter(q -> q.recall() < 1.0)
        .forEach(q -> log.info("Recall {} for: {}", String.format("%.3f", q.recall()), q.query()));
  }
}
