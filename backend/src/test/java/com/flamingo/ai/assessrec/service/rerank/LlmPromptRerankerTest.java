package com.flamingo.ai.assessrec.service.rerank;

import static com.flamingo.ai.assessrec.testsupport.TestRecords.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.assessrec.agent.AssessmentRerankerAgent;
import com.flamingo.ai.assessrec.agent.dto.RerankingScores;
import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmPromptReranker Tests")
class LlmPromptRerankerTest {

  @Mock private AssessmentRerankerAgent agent;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private LlmPromptReranker reranker;
  private List<RankedCandidate> candidates;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    reranker = new LlmPromptReranker(agent, new RecommenderConfig(), meterRegistry);
    candidates =
        List.of(
            candidate("a", AssessmentCategory.KNOWLEDGE_SKILLS, 0.9),
            candidate("b", AssessmentCategory.PERSONALITY_BEHAVIOR, 0.8),
            candidate("c", AssessmentCategory.SIMULATION, 0.7));
  }

  @Test
  @DisplayName("Should reorder candidates by agent scores")
  void shouldReorderByScores() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenReturn(new RerankingScores(List.of(0.2, 0.9, 0.5)));

    List<RankedCandidate> result = reranker.rerank("team lead", candidates);

    assertThat(result).extracting(RankedCandidate::id).containsExactly("b", "c", "a");
    verify(counter).increment();
  }

  @Test
  @DisplayName("Should keep input order for equal scores")
  void shouldBeStableForEqualScores() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenReturn(new RerankingScores(List.of(0.5, 0.5, 1.7)));

    List<RankedCandidate> result = reranker.rerank("anything", candidates);

    // 1.7 clamps to 1.0
    assertThat(result).extracting(RankedCandidate::id).containsExactly("c", "a", "b");
  }

  @Test
  @DisplayName("Should number every candidate in the prompt")
  void shouldNumberCandidatesInPrompt() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenReturn(new RerankingScores(List.of(0.1, 0.2, 0.3)));

    reranker.rerank("team lead", candidates);

    verify(agent).scoreAssessments(eq("team lead"), contains("[2] Assessment c (Simulations)"));
  }

  @Test
  @DisplayName("Should reject a score list of the wrong size")
  void shouldRejectWrongSizedScores() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenReturn(new RerankingScores(List.of(0.9, 0.1)));

    assertThatThrownBy(() -> reranker.rerank("q", candidates))
        .isInstanceOf(RerankUnavailableException.class)
        .hasMessageContaining("2 scores for 3 candidates");
  }

  @Test
  @DisplayName("Should reject missing or null scores")
  void shouldRejectMissingScores() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenReturn(new RerankingScores(null))
        .thenReturn(new RerankingScores(Arrays.asList(0.1, null, 0.3)));

    assertThatThrownBy(() -> reranker.rerank("q", candidates))
        .isInstanceOf(RerankUnavailableException.class);
    assertThatThrownBy(() -> reranker.rerank("q", candidates))
        .isInstanceOf(RerankUnavailableException.class);
  }

  @Test
  @DisplayName("Should wrap agent failures")
  void shouldWrapAgentFailures() {
    when(agent.scoreAssessments(anyString(), anyString()))
        .thenThrow(new RuntimeException("rate limited"));

    assertThatThrownBy(() -> reranker.rerank("q", candidates))
        .isInstanceOf(RerankUnavailableException.class)
        .hasCauseInstanceOf(RuntimeException.class);
  }

  @Test
  @DisplayName("Should handle empty candidates list")
  void shouldHandleEmptyCandidates() {
    assertThat(reranker.rerank("q", List.of())).isEmpty();
  }
}
