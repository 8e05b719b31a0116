package com.flamingo.ai.assessrec.service.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.exception.CatalogLoadException;
import com.flamingo.ai.assessrec.exception.InternalInconsistencyException;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("CatalogLoader Tests")
class CatalogLoaderTest {

  private CatalogLoader loader;

  @BeforeEach
  void setUp() {
    loader =
        new CatalogLoader(new DefaultResourceLoader(), new ObjectMapper(), new RecommenderConfig());
  }

  @Test
  @DisplayName("Should parse records and skip entries without name or url")
  void shouldParseRecordsAndSkipIncompleteEntries() {
    List<CatalogRecord> records = loader.load("classpath:catalog/test-catalog.json");

    assertThat(records)
        .extracting(CatalogRecord::id)
        .containsExactly("java-test", "https://catalog.example.com/teamwork/", "numerical");
  }

  @Test
  @DisplayName("Should map codes, labels, durations and flags")
  void shouldMapFields() {
    List<CatalogRecord> records = loader.load("classpath:catalog/test-catalog.json");

    CatalogRecord java = records.get(0);
    assertThat(java.name()).isEqualTo("Java Programming Test");
    assertThat(java.categories()).containsExactly(AssessmentCategory.KNOWLEDGE_SKILLS);
    assertThat(java.durationMinutes()).isEqualTo(30);
    assertThat(java.adaptiveSupport()).isTrue();
    assertThat(java.remoteSupport()).isTrue();

    CatalogRecord teamwork = records.get(1);
    assertThat(teamwork.primaryCategory()).isEqualTo(AssessmentCategory.PERSONALITY_BEHAVIOR);
    assertThat(teamwork.durationMinutes()).isEqualTo(25);
    assertThat(teamwork.adaptiveSupport()).isFalse();
    assertThat(teamwork.remoteSupport()).isTrue();

    CatalogRecord numerical = records.get(2);
    assertThat(numerical.categories())
        .containsExactly(AssessmentCategory.ABILITY_APTITUDE, AssessmentCategory.SIMULATION);
    assertThat(numerical.durationMinutes()).isNull();
    assertThat(numerical.description()).isEmpty();
  }

  @Test
  @DisplayName("Should reject duplicate ids")
  void shouldRejectDuplicateIds() {
    assertThatThrownBy(() -> loader.load("classpath:catalog/duplicate-ids.json"))
        .isInstanceOf(InternalInconsistencyException.class)
        .hasMessageContaining("same");
  }

  @Test
  @DisplayName("Should read the first integer of a duration and treat unreadable ones as unknown")
  void shouldParseDurationText() {
    List<CatalogRecord> records = loader.load("classpath:catalog/odd-durations.json");

    assertThat(records)
        .extracting(CatalogRecord::id, CatalogRecord::durationMinutes)
        .containsExactly(
            tuple("range", 30),
            tuple("overflow-text", null),
            tuple("overflow-number", null),
            tuple("untimed", null));
  }

  @Test
  @DisplayName("Should fail on a missing resource or a non-array document")
  void shouldFailOnMissingOrMalformedSource() {
    assertThatThrownBy(() -> loader.load("classpath:catalog/does-not-exist.json"))
        .isInstanceOf(CatalogLoadException.class);
    assertThatThrownBy(() -> loader.load("classpath:catalog/not-an-array.json"))
        .isInstanceOf(CatalogLoadException.class);
  }

  @Test
  @DisplayName("Should load the bundled catalog with unique ids")
  void shouldLoadBundledCatalog() {
    List<CatalogRecord> records = loader.load();

    assertThat(records).hasSizeGreaterThan(100);
    assertThat(new HashSet<>(records.stream().map(CatalogRecord::id).toList()))
        .hasSize(records.size());
    assertThat(records)
        .extracting(CatalogRecord::primaryCategory)
        .contains(
            AssessmentCategory.KNOWLEDGE_SKILLS,
            AssessmentCategory.PERSONALITY_BEHAVIOR,
            AssessmentCategory.ABILITY_APTITUDE,
            AssessmentCategory.SIMULATION);
  }

  @Test
  @DisplayName("Canonical text should join name, description and category labels")
  void canonicalTextShouldJoinFields() {
    CatalogRecord java = loader.load("classpath:catalog/test-catalog.json").get(0);

    assertThat(CanonicalText.of(java))
        .isEqualTo("Java Programming Test Core Java coding skills Knowledge & Skills");
  }
}
