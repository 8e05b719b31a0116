package com.flamingo.ai.assessrec.service.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.config.RecommenderConfig.OverflowPolicy;
import com.flamingo.ai.assessrec.exception.InvalidQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("QueryValidator Tests")
class QueryValidatorTest {

  private RecommenderConfig config;
  private QueryValidator validator;

  @BeforeEach
  void setUp() {
    config = new RecommenderConfig();
    config.getQuery().setMaxLength(20);
    validator = new QueryValidator(config);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "\t\n"})
  @DisplayName("Should reject empty and whitespace-only queries")
  void shouldRejectBlankQueries(String query) {
    assertThatThrownBy(() -> validator.validate(query))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("empty");
  }

  @Test
  @DisplayName("Should trim and truncate over-long queries by default")
  void shouldTruncateLongQueries() {
    assertThat(validator.validate("  java developer  ")).isEqualTo("java developer");
    assertThat(validator.validate("a".repeat(50))).hasSize(20);
  }

  @Test
  @DisplayName("Should reject over-long queries under the REJECT policy")
  void shouldRejectLongQueriesWhenConfigured() {
    config.getQuery().setOverflowPolicy(OverflowPolicy.REJECT);

    assertThatThrownBy(() -> validator.validate("a".repeat(21)))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("20");
    assertThat(validator.validate("a".repeat(20))).hasSize(20);
  }

  @Test
  @DisplayName("Should clamp k to [1, maxK] and default when absent")
  void shouldClampK() {
    config.getRetrieval().setDefaultK(5);
    config.getRetrieval().setMaxK(8);

    assertThat(validator.clampK(null)).isEqualTo(5);
    assertThat(validator.clampK(0)).isEqualTo(1);
    assertThat(validator.clampK(-3)).isEqualTo(1);
    assertThat(validator.clampK(3)).isEqualTo(3);
    assertThat(validator.clampK(50)).isEqualTo(8);
    assertThat(validator.maxK()).isEqualTo(8);
  }

  @Test
  @DisplayName("Should never exceed the hard ceiling of 10")
  void shouldCapMaxKAtTen() {
    config.getRetrieval().setMaxK(100);

    assertThat(validator.clampK(100)).isEqualTo(QueryValidator.HARD_MAX_K);
  }
}
